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
import java.util.function.DoubleUnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One value to pull out of the protocol text. Different scanner software
 * versions spell the same parameter differently, so each parameter carries an
 * ordered list of patterns. The first pattern that matches anywhere wins; a
 * match whose captured text is empty falls back to the default.
 *
 * @author Barry DeZonia
 *
 */
public final class HeaderParameter {

	public enum Kind { NUMBER, TEXT }

	private final String name;
	private final Kind kind;
	private final List<Pattern> patterns;
	private final DoubleUnaryOperator conversion;
	private final Object defaultValue;
	private final boolean lastOccurrence;

	private HeaderParameter(String name, Kind kind, DoubleUnaryOperator conversion,
			Object defaultValue, boolean lastOccurrence, String... regexes)
	{
		if (regexes.length == 0)
			throw new IllegalArgumentException("parameter "+name+" needs at least one pattern");
		this.name = name;
		this.kind = kind;
		this.conversion = conversion;
		this.defaultValue = defaultValue;
		this.lastOccurrence = lastOccurrence;
		List<Pattern> list = new ArrayList<>();
		for (String regex : regexes) {
			list.add(Pattern.compile(regex, Pattern.MULTILINE));
		}
		this.patterns = Collections.unmodifiableList(list);
	}

	/**
	 * A number converted on the way out, with no default: it must be present.
	 */
	public static HeaderParameter required(String name, DoubleUnaryOperator conversion, String... regexes) {
		return new HeaderParameter(name, Kind.NUMBER, conversion, null, true, regexes);
	}

	/**
	 * A number that takes a default value when no pattern finds it.
	 */
	public static HeaderParameter optional(String name, double defaultValue, String... regexes) {
		return new HeaderParameter(name, Kind.NUMBER, DoubleUnaryOperator.identity(), defaultValue, true, regexes);
	}

	/**
	 * A number read from the first occurrence of a single assignment.
	 */
	public static HeaderParameter firstOf(String name, DoubleUnaryOperator conversion, String regex) {
		return new HeaderParameter(name, Kind.NUMBER, conversion, null, false, regex);
	}

	public static HeaderParameter text(String name, String defaultValue, String... regexes) {
		return new HeaderParameter(name, Kind.TEXT, null, defaultValue, true, regexes);
	}

	public String name() {
		return name;
	}

	public Kind kind() {
		return kind;
	}

	public boolean isRequired() {
		return defaultValue == null;
	}

	public Object defaultValue() {
		return defaultValue;
	}

	public List<Pattern> patterns() {
		return patterns;
	}

	/**
	 * Try every pattern in turn.
	 *
	 * @return a Double or String, the default when nothing usable matched,
	 *   or null when nothing matched and there is no default
	 */
	public Object extract(String header) {

		for (Pattern pattern : patterns) {

			Matcher m = pattern.matcher(header);

			boolean found = false;
			String captured = null;

			while (m.find()) {
				found = true;
				captured = m.groupCount() > 0 ? m.group(1) : m.group();
				if (!lastOccurrence)
					break;
			}

			if (found)
				return convert(captured);
		}

		return defaultValue;
	}

	private Object convert(String captured) {

		if (captured == null || captured.trim().isEmpty())
			return defaultValue;

		if (kind == Kind.TEXT)
			return captured;

		try {
			return conversion.applyAsDouble(Double.parseDouble(captured.trim()));
		} catch (NumberFormatException e) {
			System.out.println("WARNING: header parameter " + name + " has unreadable value \"" +
					captured + "\"; using " + defaultValue);
			return defaultValue;
		}
	}

	@Override
	public String toString() {
		return "HeaderParameter[" + name + "]";
	}
}
