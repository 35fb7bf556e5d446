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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import nom.bdezonia.zorbage.siemens.exceptions.MissingRequiredParameterException;

/**
 * The decoded tags of one CSA block in file order, plus any truncations that
 * were repaired while reading it.
 *
 * @author Barry DeZonia
 *
 */
public final class CsaHeader {

	public enum Variant { CSA1, CSA2 }

	private final Variant variant;
	private final Map<String, CsaTag> tags;
	private final List<TagTruncation> truncations;

	CsaHeader(Variant variant, List<CsaTag> tags, List<TagTruncation> truncations) {
		this.variant = variant;
		Map<String, CsaTag> map = new LinkedHashMap<>();
		for (CsaTag tag : tags) {
			// a repeated name keeps its last value
			map.put(tag.name(), tag);
		}
		this.tags = Collections.unmodifiableMap(map);
		this.truncations = Collections.unmodifiableList(new ArrayList<>(truncations));
	}

	public Variant variant() {
		return variant;
	}

	public boolean contains(String name) {
		return tags.containsKey(name);
	}

	public CsaTag tag(String name) {
		return tags.get(name);
	}

	/** The collapsed value of a tag, or null when the tag is absent. */
	public Object get(String name) {
		CsaTag tag = tags.get(name);
		return tag == null ? null : tag.value();
	}

	public List<CsaTag> tags() {
		return new ArrayList<>(tags.values());
	}

	/** Name to collapsed value, in file order. */
	public Map<String, Object> asMap() {
		Map<String, Object> map = new LinkedHashMap<>();
		for (CsaTag tag : tags.values()) {
			map.put(tag.name(), tag.value());
		}
		return map;
	}

	public List<TagTruncation> truncations() {
		return truncations;
	}

	public boolean isTruncated() {
		return !truncations.isEmpty();
	}

	/**
	 * The first item of a numeric tag.
	 *
	 * @throws MissingRequiredParameterException if the tag is absent or empty
	 */
	public double getDouble(String name) {
		return numbers(name, 1)[0];
	}

	/**
	 * The first count items of a numeric tag.
	 *
	 * @throws MissingRequiredParameterException if the tag has fewer items
	 */
	public double[] numbers(String name, int count) {
		CsaTag tag = tags.get(name);
		if (tag == null || tag.items().size() < count)
			throw new MissingRequiredParameterException(Collections.singletonList(name));
		double[] values = new double[count];
		for (int i = 0; i < count; i++) {
			Object item = tag.items().get(i);
			if (!(item instanceof Number))
				throw new IllegalArgumentException("CSA tag "+name+" is not numeric: "+item);
			values[i] = ((Number) item).doubleValue();
		}
		return values;
	}

	@Override
	public String toString() {
		return "CsaHeader[" + variant + ", " + tags.size() + " tags]";
	}
}
