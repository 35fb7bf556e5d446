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

import java.io.BufferedInputStream;
import java.io.Closeable;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;

import nom.bdezonia.zorbage.siemens.exceptions.MalformedContainerException;

/**
 * Forward reading cursor over a little endian byte stream. It remembers how
 * many bytes have been consumed so callers can jump to absolute positions
 * that lie ahead of it. The only backwards movement allowed is a
 * {@link #peekInts(int)} at the very start of the stream.
 *
 * @author Barry DeZonia
 *
 */
public class LittleEndianInput implements Closeable {

	private final BufferedInputStream buffered;

	private final DataInputStream str;

	private long position;

	public LittleEndianInput(InputStream in) {

		this.buffered = new BufferedInputStream(in);

		this.str = new DataInputStream(buffered);

		this.position = 0;
	}

	public long position() {
		return position;
	}

	/**
	 * Read count unsigned 32 bit values without moving the cursor.
	 */
	public long[] peekInts(int count) throws IOException {

		buffered.mark(count * 4);

		long[] values = new long[count];

		try {
			for (int i = 0; i < count; i++) {
				values[i] = swapInt(str.readInt()) & 0xffffffffL;
			}
		} catch (EOFException e) {
			throw new MalformedContainerException("source too short to hold a container header", e);
		}

		buffered.reset();

		return values;
	}

	/**
	 * Move the cursor to an absolute position at or after the current one.
	 */
	public void seek(long target) throws IOException {

		if (target < position)
			throw new MalformedContainerException("cannot move backwards from "+position+" to "+target);

		skip(target - position);
	}

	public void skip(long count) throws IOException {

		long remaining = count;

		while (remaining > 0) {
			long skipped = str.skip(remaining);
			if (skipped <= 0) {
				// skip() may legally return 0 before the end; a read tells us for sure
				if (str.read() < 0)
					throw new MalformedContainerException("unexpected end of data at position "+position);
				skipped = 1;
			}
			remaining -= skipped;
			position += skipped;
		}
	}

	public byte[] readBytes(int count) throws IOException {

		if (count < 0)
			throw new MalformedContainerException("negative byte count "+count+" at position "+position);

		byte[] bytes = new byte[count];

		try {
			str.readFully(bytes);
		} catch (EOFException e) {
			throw new MalformedContainerException("short read of "+count+" bytes at position "+position, e);
		}

		position += count;

		return bytes;
	}

	public int readUnsignedShort() throws IOException {
		return readShort() & 0xffff;
	}

	public short readShort() throws IOException {
		short v;
		try {
			v = swapShort(str.readShort());
		} catch (EOFException e) {
			throw new MalformedContainerException("short read at position "+position, e);
		}
		position += 2;
		return v;
	}

	public long readUnsignedInt() throws IOException {
		return readInt() & 0xffffffffL;
	}

	public int readInt() throws IOException {
		int v;
		try {
			v = swapInt(str.readInt());
		} catch (EOFException e) {
			throw new MalformedContainerException("short read at position "+position, e);
		}
		position += 4;
		return v;
	}

	public long readLong() throws IOException {
		long v;
		try {
			v = swapLong(str.readLong());
		} catch (EOFException e) {
			throw new MalformedContainerException("short read at position "+position, e);
		}
		position += 8;
		return v;
	}

	public float readFloat() throws IOException {
		return Float.intBitsToFloat(readInt());
	}

	@Override
	public void close() throws IOException {
		str.close();
	}

	static short swapShort(short in) {
		int b0 = (in >> 0) & 0xff;
		int b1 = (in >> 8) & 0xff;
		return (short) ((b0 << 8) | (b1 << 0));
	}

	static int swapInt(int in) {
		int b0 = (in >> 0) & 0xff;
		int b1 = (in >> 8) & 0xff;
		int b2 = (in >> 16) & 0xff;
		int b3 = (in >> 24) & 0xff;
		return (b0 << 24) | (b1 << 16) | (b2 << 8) | (b3 << 0);
	}

	static long swapLong(long in) {
		long b0 = (in >> 0) & 0xff;
		long b1 = (in >> 8) & 0xff;
		long b2 = (in >> 16) & 0xff;
		long b3 = (in >> 24) & 0xff;
		long b4 = (in >> 32) & 0xff;
		long b5 = (in >> 40) & 0xff;
		long b6 = (in >> 48) & 0xff;
		long b7 = (in >> 56) & 0xff;
		return (b0 << 56) | (b1 << 48) | (b2 << 40) | (b3 << 32) | (b4 << 24) | (b5 << 16) | (b6 << 8) | (b7 << 0);
	}
}
