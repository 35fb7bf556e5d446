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
 * One decoded acquisition: the loop counters that place it in the output
 * array and the usable part of every channel's FID. The imaginary parts are
 * already negated relative to the file.
 *
 * @author Barry DeZonia
 *
 */
public final class ScanRecord {

	/** Number of loop counters in a measurement data header. */
	public static final int NUM_LOOP_COUNTERS = 14;

	private final EvalInfoMask evalInfo;
	private final int scanCounter;
	private final int sampleCount;
	private final int fidStart;
	private final int[] loopCounters;
	private final ScannerFields scannerFields;
	private final float[][] re;
	private final float[][] im;

	ScanRecord(EvalInfoMask evalInfo, int scanCounter, int sampleCount, int fidStart,
			int[] loopCounters, ScannerFields scannerFields, float[][] re, float[][] im)
	{
		if (loopCounters.length != NUM_LOOP_COUNTERS)
			throw new IllegalArgumentException("a scan needs exactly "+NUM_LOOP_COUNTERS+" loop counters");
		if (re.length != im.length)
			throw new IllegalArgumentException("real and imaginary channel counts differ");
		this.evalInfo = evalInfo;
		this.scanCounter = scanCounter;
		this.sampleCount = sampleCount;
		this.fidStart = fidStart;
		this.loopCounters = loopCounters.clone();
		this.scannerFields = scannerFields;
		this.re = re;
		this.im = im;
	}

	public EvalInfoMask evalInfo() {
		return evalInfo;
	}

	public int scanCounter() {
		return scanCounter;
	}

	/** Samples per channel as stored in the file, dummy points included. */
	public int sampleCount() {
		return sampleCount;
	}

	/** Leading samples discarded before the first usable point. */
	public int fidStart() {
		return fidStart;
	}

	public int[] loopCounters() {
		return loopCounters.clone();
	}

	public ScannerFields scannerFields() {
		return scannerFields;
	}

	public int channelCount() {
		return re.length;
	}

	/** Usable samples per channel, a power of two. */
	public int fidLength() {
		return re.length == 0 ? 0 : re[0].length;
	}

	public float real(int channel, int sample) {
		return re[channel][sample];
	}

	public float imaginary(int channel, int sample) {
		return im[channel][sample];
	}

	/**
	 * Header fields the reader does not interpret but keeps around for callers
	 * that know what to do with them.
	 */
	public static final class ScannerFields {

		public final long measUid;
		public final long timeStamp;
		public final long pmuTimeStamp;
		public final long cutOffData;
		public final int kspaceCentreColumn;
		public final int coilSelect;
		public final long readoutOffcentre;
		public final long timeSinceRf;
		public final int kspaceCentreLine;
		public final int kspaceCentrePartition;
		private final float[] slicePosition;
		private final int[] iceProgramParams;
		private final int[] freeParams;

		ScannerFields(long measUid, long timeStamp, long pmuTimeStamp, long cutOffData,
				int kspaceCentreColumn, int coilSelect, long readoutOffcentre, long timeSinceRf,
				int kspaceCentreLine, int kspaceCentrePartition, float[] slicePosition,
				int[] iceProgramParams, int[] freeParams)
		{
			this.measUid = measUid;
			this.timeStamp = timeStamp;
			this.pmuTimeStamp = pmuTimeStamp;
			this.cutOffData = cutOffData;
			this.kspaceCentreColumn = kspaceCentreColumn;
			this.coilSelect = coilSelect;
			this.readoutOffcentre = readoutOffcentre;
			this.timeSinceRf = timeSinceRf;
			this.kspaceCentreLine = kspaceCentreLine;
			this.kspaceCentrePartition = kspaceCentrePartition;
			this.slicePosition = slicePosition;
			this.iceProgramParams = iceProgramParams;
			this.freeParams = freeParams;
		}

		public float[] slicePosition() {
			return slicePosition.clone();
		}

		public int[] iceProgramParams() {
			return iceProgramParams.clone();
		}

		/** Free parameters (VB) or reserved parameters (VD). */
		public int[] freeParams() {
			return freeParams.clone();
		}
	}
}
