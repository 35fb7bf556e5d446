/*
 * zorbage-siemens: code for reading Siemens MR spectroscopy raw data into zorbage structures for further processing
 *
 * Copyright (C) 2024 Barry DeZonia
 * 
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 * 
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 * 
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package nom.bdezonia.zorbage.siemens;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One named entry of a CSA header with its decoded items. Items are Double,
 * Long or String depending on the tag name.
 *
 * @author Barry DeZonia
 *
 */
public final class CsaTag {

	private final String name;
	private final int vm;
	private final String vr;
	private final int syngoDt;
	private final List<Object> items;

	public CsaTag(String name, int vm, String vr, int syngoDt, List<Object> items) {
		this.name = name;
		this.vm = vm;
		this.vr = vr;
		this.syngoDt = syngoDt;
		this.items = Collections.unmodifiableList(new ArrayList<>(items));
	}

	public String name() {
		return name;
	}

	/** Value multiplicity as declared in the tag. */
	public int vm() {
		return vm;
	}

	/** DICOM value representation, e.g. "FD" or "IS". */
	public String vr() {
		return vr;
	}

	public int syngoDt() {
		return syngoDt;
	}

	public List<Object> items() {
		return items;
	}

	/**
	 * A single item on its own, otherwise the whole (possibly empty) list.
	 */
	public Object value() {
		if (items.size() == 1)
			return items.get(0);
		return items;
	}

	@Override
	public String toString() {
		return name + " = " + value();
	}
}
