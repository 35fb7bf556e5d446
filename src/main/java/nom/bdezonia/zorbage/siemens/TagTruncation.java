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

/**
 * A CSA item whose declared length ran past the end of the block. The item
 * was kept but cut to the bytes that were actually there.
 *
 * @author Barry DeZonia
 *
 */
public final class TagTruncation {

	private final String tagName;
	private final int itemIndex;
	private final long declaredLength;
	private final long availableLength;

	public TagTruncation(String tagName, int itemIndex, long declaredLength, long availableLength) {
		this.tagName = tagName;
		this.itemIndex = itemIndex;
		this.declaredLength = declaredLength;
		this.availableLength = availableLength;
	}

	public String tagName() {
		return tagName;
	}

	public int itemIndex() {
		return itemIndex;
	}

	public long declaredLength() {
		return declaredLength;
	}

	public long availableLength() {
		return availableLength;
	}

	/** How many bytes the item claimed beyond the end of the block. */
	public long overrun() {
		return declaredLength - availableLength;
	}

	@Override
	public String toString() {
		return "tag " + tagName + " item " + itemIndex + " declares " + declaredLength +
				" bytes but only " + availableLength + " remain";
	}
}
