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
import java.util.Arrays;
import java.util.List;

import nom.bdezonia.zorbage.algebra.G;
import nom.bdezonia.zorbage.data.DimensionedDataSource;
import nom.bdezonia.zorbage.data.DimensionedStorage;
import nom.bdezonia.zorbage.sampling.IntegerIndex;
import nom.bdezonia.zorbage.siemens.exceptions.EmptyAcquisitionException;
import nom.bdezonia.zorbage.siemens.exceptions.InconsistentChannelCountException;
import nom.bdezonia.zorbage.siemens.exceptions.InconsistentSampleLengthException;
import nom.bdezonia.zorbage.type.complex.float64.ComplexFloat64Member;

/**
 * Collects the scans of one container and scatters them into a dense array.
 * <p>
 * We have no prior knowledge about which loop counters vary in a given
 * acquisition, so every scan is kept until the end and the shape is derived
 * from the largest index seen on each counter. Combinations the scanner never
 * visited stay zero. Axes of length one are dropped.
 * <p>
 * zorbage varies index 0 fastest, so the axes are laid out innermost first:
 * sample, channel, then the loop counters from Ide down to Lin. Read
 * backwards this is the usual (loops..., channel, sample) shape.
 * <p>
 * An assembler belongs to a single decode and is not thread safe.
 *
 * @author Barry DeZonia
 *
 */
public class SignalAssembler {

	/** Names of the 14 loop counters in MDH order. */
	public static final String[] LOOP_COUNTER_NAMES = {
			"line", "average", "slice", "partition", "echo", "phase", "repetition",
			"set", "segment", "ida", "idb", "idc", "idd", "ide" };

	private final List<ScanRecord> scans = new ArrayList<>();

	private int np = -1;

	private int numChannels = -1;

	public void accept(ScanRecord scan) {
		setNumChannels(scan.channelCount());
		setNp(scan.fidLength());
		scans.add(scan);
	}

	/**
	 * Convenience entry for callers that hold bare sample arrays. The channel
	 * arrays must all have the same length.
	 */
	public void accept(int[] loopCounters, int channelCount, float[][] re, float[][] im) {
		if (re.length != channelCount || im.length != channelCount)
			throw new InconsistentChannelCountException(channelCount, re.length);
		int length = channelCount == 0 ? 0 : re[0].length;
		for (int c = 0; c < channelCount; c++) {
			if (re[c].length != length || im[c].length != length)
				throw new InconsistentSampleLengthException(length, Math.min(re[c].length, im[c].length));
		}
		accept(new ScanRecord(new EvalInfoMask(0), scans.size(), length, 0, loopCounters, null,
				deepCopy(re), deepCopy(im)));
	}

	public int numScans() {
		return scans.size();
	}

	/** -1 until the first scan arrives. */
	public int np() {
		return np;
	}

	/** -1 until the first scan arrives. */
	public int numChannels() {
		return numChannels;
	}

	/**
	 * Build the dense array from everything accepted so far.
	 */
	public DimensionedDataSource<ComplexFloat64Member> finish() {

		if (scans.isEmpty())
			throw new EmptyAcquisitionException("no scans were found in the acquisition");

		int[] maxCounters = new int[ScanRecord.NUM_LOOP_COUNTERS];
		for (ScanRecord scan : scans) {
			int[] counters = scan.loopCounters();
			for (int i = 0; i < counters.length; i++) {
				maxCounters[i] = Math.max(maxCounters[i], counters[i]);
			}
		}

		// full axis list, zorbage order
		int numFull = 2 + ScanRecord.NUM_LOOP_COUNTERS;
		long[] fullDims = new long[numFull];
		String[] fullNames = new String[numFull];
		fullDims[0] = np;
		fullNames[0] = "t";
		fullDims[1] = numChannels;
		fullNames[1] = "channel";
		for (int i = 0; i < ScanRecord.NUM_LOOP_COUNTERS; i++) {
			int counter = ScanRecord.NUM_LOOP_COUNTERS - 1 - i;
			fullDims[2 + i] = 1L + maxCounters[counter];
			fullNames[2 + i] = LOOP_COUNTER_NAMES[counter];
		}

		// squeeze: remember where each full axis lands, -1 if dropped.
		// the sample axis always stays as axis 0.
		int[] axisMap = new int[numFull];
		axisMap[0] = 0;
		int kept = 1;
		for (int i = 1; i < numFull; i++) {
			axisMap[i] = fullDims[i] == 1 ? -1 : kept++;
		}
		long[] dims = new long[kept];
		String[] names = new String[kept];
		for (int i = 0; i < numFull; i++) {
			if (axisMap[i] >= 0) {
				dims[axisMap[i]] = fullDims[i];
				names[axisMap[i]] = fullNames[i];
			}
		}

		DimensionedDataSource<ComplexFloat64Member> data =
				DimensionedStorage.allocate(G.CDBL.construct(), dims);

		IntegerIndex idx = new IntegerIndex(dims.length);
		ComplexFloat64Member value = G.CDBL.construct();

		for (ScanRecord scan : scans) {
			int[] counters = scan.loopCounters();
			for (int i = 0; i < ScanRecord.NUM_LOOP_COUNTERS; i++) {
				int axis = axisMap[2 + i];
				if (axis >= 0)
					idx.set(axis, counters[ScanRecord.NUM_LOOP_COUNTERS - 1 - i]);
			}
			for (int c = 0; c < numChannels; c++) {
				if (axisMap[1] >= 0)
					idx.set(axisMap[1], c);
				for (int s = 0; s < np; s++) {
					idx.set(0, s);
					value.setR(scan.real(c, s));
					value.setI(scan.imaginary(c, s));
					data.set(idx, value);
				}
			}
		}

		for (int i = 0; i < names.length; i++) {
			data.setAxisType(i, names[i]);
		}

		System.out.println("dims = " + Arrays.toString(dims));

		return data;
	}

	private void setNp(int value) {
		if (np < 0)
			np = value;
		else if (np != value)
			throw new InconsistentSampleLengthException(np, value);
	}

	private void setNumChannels(int value) {
		if (numChannels < 0)
			numChannels = value;
		else if (numChannels != value)
			throw new InconsistentChannelCountException(numChannels, value);
	}

	private static float[][] deepCopy(float[][] in) {
		float[][] out = new float[in.length][];
		for (int i = 0; i < in.length; i++) {
			out[i] = in[i].clone();
		}
		return out;
	}
}
