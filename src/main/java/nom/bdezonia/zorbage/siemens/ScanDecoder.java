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

import java.io.IOException;

import nom.bdezonia.zorbage.siemens.exceptions.MalformedContainerException;

/**
 * Reads one measurement data header (MDH) and the channel data that follows
 * it. Whatever happens while decoding, the cursor ends up at the start of the
 * next scan as given by the DMA length of this one.
 *
 * @author Barry DeZonia
 *
 */
public class ScanDecoder {

	/** The lower 26 bits of the first word hold the byte length of a scan. */
	public static final int DMA_LENGTH_MASK = (1 << 26) - 1;

	/** VB repeats all but the last four bytes of the MDH before every channel. */
	static final int VB_CHANNEL_PREAMBLE = 124;

	static final int VD_CHANNEL_HEADER = 32;

	// do not instantiate

	private ScanDecoder() { }

	/**
	 * What the decoder found at the cursor.
	 */
	public static final class Step {

		private final EvalInfoMask evalInfo;

		private final ScanRecord record;

		Step(EvalInfoMask evalInfo, ScanRecord record) {
			this.evalInfo = evalInfo;
			this.record = record;
		}

		public EvalInfoMask evalInfo() {
			return evalInfo;
		}

		public boolean isEnd() {
			return evalInfo.acquisitionEnd();
		}

		/** Null when the scan was skipped or ends the acquisition. */
		public ScanRecord record() {
			return record;
		}
	}

	/**
	 *
	 * @param in
	 * @param format
	 * @return
	 * @throws IOException
	 */
	public static Step next(LittleEndianInput in, TwixFormat format) throws IOException {

		switch (format) {
		case VB:
			return nextVb(in);
		case VD:
			return nextVd(in);
		default:
			throw new IllegalArgumentException("Unknown twix format "+format);
		}
	}

	private static Step nextVb(LittleEndianInput in) throws IOException {

		long startPosition = in.position();

		long dmaLength = in.readUnsignedInt() & DMA_LENGTH_MASK;

		long measUid = in.readUnsignedInt();
		int scanCounter = in.readInt();
		long timeStamp = in.readUnsignedInt();
		long pmuTimeStamp = in.readUnsignedInt();

		EvalInfoMask mask = new EvalInfoMask(in.readLong());

		if (mask.acquisitionEnd())
			return new Step(mask, null);

		Exception failure = null;

		try {

			if (mask.isSkipped())
				return new Step(mask, null);

			int numSamples = in.readUnsignedShort();
			int numChannels = in.readUnsignedShort();

			int[] loopCounters = readLoopCounters(in);

			long cutOffData = in.readUnsignedInt();
			int kspaceCentreColumn = in.readUnsignedShort();
			int coilSelect = in.readUnsignedShort();
			long readoutOffcentre = in.readUnsignedInt();
			long timeSinceRf = in.readUnsignedInt();
			int kspaceCentreLine = in.readUnsignedShort();
			int kspaceCentrePartition = in.readUnsignedShort();

			int[] iceProgramParams = readUnsignedShorts(in, 4);
			int[] freeParams = readUnsignedShorts(in, 4);

			float[] slicePosition = readFloats(in, 7);

			// there are some dummy points before the data starts
			int fidStart = freeParams[0];

			int np = usableLength(numSamples, fidStart);

			float[][] re = new float[numChannels][];
			float[][] im = new float[numChannels][];

			for (int c = 0; c < numChannels; c++) {
				// channel id and ptab pos neg
				in.readUnsignedShort();
				in.readShort();
				readChannel(in, numSamples, fidStart, np, re, im, c);
				if (c < numChannels - 1)
					in.skip(VB_CHANNEL_PREAMBLE);
			}

			ScanRecord.ScannerFields fields = new ScanRecord.ScannerFields(measUid, timeStamp,
					pmuTimeStamp, cutOffData, kspaceCentreColumn, coilSelect, readoutOffcentre,
					timeSinceRf, kspaceCentreLine, kspaceCentrePartition, slicePosition,
					iceProgramParams, freeParams);

			return new Step(mask, new ScanRecord(mask, scanCounter, numSamples, fidStart,
					loopCounters, fields, re, im));

		} catch (IOException | RuntimeException e) {
			failure = e;
			throw e;
		} finally {
			moveToNextScan(in, startPosition + dmaLength, failure);
		}
	}

	private static Step nextVd(LittleEndianInput in) throws IOException {

		long startPosition = in.position();

		long dmaLength = in.readUnsignedInt() & DMA_LENGTH_MASK;

		long measUid = in.readUnsignedInt();
		int scanCounter = in.readInt();
		long timeStamp = in.readUnsignedInt();
		long pmuTimeStamp = in.readUnsignedInt();

		// system type, ptab pos delay, ptab pos x / y / z, reserved
		in.skip(20);

		EvalInfoMask mask = new EvalInfoMask(in.readLong());

		if (mask.acquisitionEnd())
			return new Step(mask, null);

		Exception failure = null;

		try {

			if (mask.isSkipped())
				return new Step(mask, null);

			int numSamples = in.readUnsignedShort();
			int numChannels = in.readUnsignedShort();

			int[] loopCounters = readLoopCounters(in);

			long cutOffData = in.readUnsignedInt();
			int kspaceCentreColumn = in.readUnsignedShort();
			int coilSelect = in.readUnsignedShort();
			long readoutOffcentre = in.readUnsignedInt();
			long timeSinceRf = in.readUnsignedInt();
			int kspaceCentreLine = in.readUnsignedShort();
			int kspaceCentrePartition = in.readUnsignedShort();

			float[] slicePosition = readFloats(in, 7);

			int[] iceProgramParams = readUnsignedShorts(in, 24);
			int[] reservedParams = readUnsignedShorts(in, 4);

			int fidStart = iceProgramParams[4] + reservedParams[0];

			int np = usableLength(numSamples, fidStart);

			// application counter, application mask, crc
			in.skip(8);

			float[][] re = new float[numChannels][];
			float[][] im = new float[numChannels][];

			for (int c = 0; c < numChannels; c++) {
				in.skip(VD_CHANNEL_HEADER);
				readChannel(in, numSamples, fidStart, np, re, im, c);
			}

			ScanRecord.ScannerFields fields = new ScanRecord.ScannerFields(measUid, timeStamp,
					pmuTimeStamp, cutOffData, kspaceCentreColumn, coilSelect, readoutOffcentre,
					timeSinceRf, kspaceCentreLine, kspaceCentrePartition, slicePosition,
					iceProgramParams, reservedParams);

			return new Step(mask, new ScanRecord(mask, scanCounter, numSamples, fidStart,
					loopCounters, fields, re, im));

		} catch (IOException | RuntimeException e) {
			failure = e;
			throw e;
		} finally {
			moveToNextScan(in, startPosition + dmaLength, failure);
		}
	}

	/**
	 * The largest power of two that fits in what is left after the dummy points.
	 */
	static int usableLength(int numSamples, int fidStart) {

		int available = numSamples - fidStart;

		if (available <= 0)
			throw new MalformedContainerException("fid start "+fidStart+" leaves no samples out of "+numSamples);

		return Integer.highestOneBit(available);
	}

	private static void readChannel(LittleEndianInput in, int numSamples, int fidStart, int np,
			float[][] re, float[][] im, int channel) throws IOException
	{
		float[] r = new float[np];
		float[] i = new float[np];

		for (int s = 0; s < numSamples; s++) {
			float real = in.readFloat();
			float imag = in.readFloat();
			int pos = s - fidStart;
			if (pos >= 0 && pos < np) {
				r[pos] = real;
				i[pos] = -imag;
			}
		}

		re[channel] = r;
		im[channel] = i;
	}

	private static int[] readLoopCounters(LittleEndianInput in) throws IOException {
		return readUnsignedShorts(in, ScanRecord.NUM_LOOP_COUNTERS);
	}

	private static int[] readUnsignedShorts(LittleEndianInput in, int count) throws IOException {
		int[] values = new int[count];
		for (int i = 0; i < count; i++) {
			values[i] = in.readUnsignedShort();
		}
		return values;
	}

	private static float[] readFloats(LittleEndianInput in, int count) throws IOException {
		float[] values = new float[count];
		for (int i = 0; i < count; i++) {
			values[i] = in.readFloat();
		}
		return values;
	}

	private static void moveToNextScan(LittleEndianInput in, long nextScan, Exception failure)
			throws IOException
	{
		if (failure == null) {
			in.seek(nextScan);
			return;
		}
		try {
			in.seek(nextScan);
		} catch (IOException | RuntimeException e) {
			failure.addSuppressed(e);
		}
	}
}
