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

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builds CSA tag streams in memory.
 *
 * @author Barry DeZonia
 *
 */
class CsaTestStreams {

	static class Tag {

		final String name;
		final String vr;
		final List<String> items;
		// -1 means use the real length
		long declaredLastLength = -1;

		Tag(String name, String vr, String... items) {
			this.name = name;
			this.vr = vr;
			this.items = new ArrayList<>(Arrays.asList(items));
		}

		Tag declareLastLength(long length) {
			declaredLastLength = length;
			return this;
		}
	}

	static Tag tag(String name, String vr, String... items) {
		return new Tag(name, vr, items);
	}

	static byte[] csa2(Tag... tags) {
		return stream(true, tags);
	}

	static byte[] csa1(Tag... tags) {
		return stream(false, tags);
	}

	private static byte[] stream(boolean csa2, Tag... tags) {

		ByteArrayOutputStream out = new ByteArrayOutputStream();

		if (csa2) {
			write(out, "SV10".getBytes(StandardCharsets.ISO_8859_1));
			write(out, new byte[] { 4, 3, 2, 1 });
		}
		ByteBuffer start = buffer(8);
		start.putInt(tags.length);
		start.putInt(77);
		write(out, start.array());

		for (Tag tag : tags) {

			ByteBuffer pre = buffer(84);
			pre.put(Arrays.copyOf(tag.name.getBytes(StandardCharsets.ISO_8859_1), 64));
			pre.putInt(tag.items.size());
			pre.put(Arrays.copyOf(tag.vr.getBytes(StandardCharsets.ISO_8859_1), 4));
			pre.putInt(3);
			pre.putInt(tag.items.size());
			pre.putInt(77);
			write(out, pre.array());

			for (int i = 0; i < tag.items.size(); i++) {

				byte[] text = tag.items.get(i).getBytes(StandardCharsets.ISO_8859_1);

				long declared = text.length;
				if (i == tag.items.size() - 1 && tag.declaredLastLength >= 0)
					declared = tag.declaredLastLength;

				ByteBuffer sizes = buffer(16);
				if (csa2) {
					sizes.putInt(0);
					sizes.putInt((int) declared);
				}
				else {
					sizes.putInt((int) declared);
					sizes.putInt(0);
				}
				sizes.putInt(77);
				sizes.putInt((int) declared);
				write(out, sizes.array());

				write(out, text);
				int padding = (4 - text.length % 4) % 4;
				write(out, new byte[padding]);
			}
		}

		return out.toByteArray();
	}

	private static void write(ByteArrayOutputStream out, byte[] bytes) {
		out.write(bytes, 0, bytes.length);
	}

	private static ByteBuffer buffer(int size) {
		return ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
	}
}
