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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The values extracted from one protocol header, already converted to the
 * units the rest of the library works in. Immutable.
 *
 * @author Barry DeZonia
 *
 */
public final class HeaderParameters {

	private final Map<String, Object> values;

	private final AffineTransform transform;

	HeaderParameters(Map<String, Object> values, AffineTransform transform) {
		this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
		this.transform = transform;
	}

	public boolean contains(String name) {
		return values.containsKey(name);
	}

	public Object get(String name) {
		return values.get(name);
	}

	public double getDouble(String name) {
		Object value = values.get(name);
		if (!(value instanceof Number))
			throw new IllegalArgumentException("header parameter "+name+" is not a number: "+value);
		return ((Number) value).doubleValue();
	}

	public String getString(String name) {
		Object value = values.get(name);
		return value == null ? null : value.toString();
	}

	/** Null when the header carried no usable voxel geometry. */
	public AffineTransform transform() {
		return transform;
	}

	public Map<String, Object> asMap() {
		return values;
	}

	@Override
	public String toString() {
		return "HeaderParameters" + values;
	}
}
