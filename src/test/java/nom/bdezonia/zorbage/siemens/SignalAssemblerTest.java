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

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import nom.bdezonia.zorbage.algebra.G;
import nom.bdezonia.zorbage.data.DimensionedDataSource;
import nom.bdezonia.zorbage.sampling.IntegerIndex;
import nom.bdezonia.zorbage.siemens.exceptions.EmptyAcquisitionException;
import nom.bdezonia.zorbage.siemens.exceptions.InconsistentChannelCountException;
import nom.bdezonia.zorbage.siemens.exceptions.InconsistentSampleLengthException;
import nom.bdezonia.zorbage.type.complex.float64.ComplexFloat64Member;

/**
 * @author Barry DeZonia
 */
public class SignalAssemblerTest {

	private static int[] counters(int line, int slice) {
		int[] c = new int[ScanRecord.NUM_LOOP_COUNTERS];
		c[0] = line;
		c[2] = slice;
		return c;
	}

	private static float[][] filled(int channels, int samples, float base) {
		float[][] v = new float[channels][samples];
		for (int c = 0; c < channels; c++) {
			for (int s = 0; s < samples; s++) {
				v[c][s] = base + 10 * c + s;
			}
		}
		return v;
	}

	private static ComplexFloat64Member get(DimensionedDataSource<ComplexFloat64Member> data, long... pos) {
		IntegerIndex idx = new IntegerIndex(pos.length);
		for (int i = 0; i < pos.length; i++) {
			idx.set(i, pos[i]);
		}
		ComplexFloat64Member v = G.CDBL.construct();
		data.get(idx, v);
		return v;
	}

	@Test
	public void shapeFollowsTheLargestCounters() {

		SignalAssembler assembler = new SignalAssembler();

		for (int line = 0; line < 2; line++) {
			for (int slice = 0; slice < 3; slice++) {
				float base = 1000 * line + 100 * slice;
				assembler.accept(counters(line, slice), 2, filled(2, 4, base), filled(2, 4, -base));
			}
		}

		assertEquals(6, assembler.numScans());
		assertEquals(4, assembler.np());
		assertEquals(2, assembler.numChannels());

		DimensionedDataSource<ComplexFloat64Member> data = assembler.finish();

		// sample, channel, slice, line
		assertEquals(4, data.numDimensions());
		assertEquals(4, data.dimension(0));
		assertEquals(2, data.dimension(1));
		assertEquals(3, data.dimension(2));
		assertEquals(2, data.dimension(3));

		ComplexFloat64Member v = get(data, 3, 1, 2, 1);
		assertEquals(1000 + 200 + 10 + 3, v.r(), 1e-9);
		assertEquals(-1000 - 200 + 10 + 3, v.i(), 1e-9);
	}

	@Test
	public void unvisitedCombinationsStayZero() {

		SignalAssembler assembler = new SignalAssembler();

		assembler.accept(counters(0, 0), 1, filled(1, 2, 5), filled(1, 2, 5));
		assembler.accept(counters(1, 2), 1, filled(1, 2, 7), filled(1, 2, 7));

		DimensionedDataSource<ComplexFloat64Member> data = assembler.finish();

		// channel axis is gone
		assertEquals(3, data.numDimensions());

		ComplexFloat64Member hole = get(data, 1, 1, 0);
		assertEquals(0, hole.r(), 0);
		assertEquals(0, hole.i(), 0);

		assertEquals(8, get(data, 1, 2, 1).r(), 1e-9);
	}

	@Test
	public void singlePointKeepsOneAxis() {

		SignalAssembler assembler = new SignalAssembler();

		assembler.accept(counters(0, 0), 1, new float[][] { { 2 } }, new float[][] { { 3 } });

		DimensionedDataSource<ComplexFloat64Member> data = assembler.finish();

		assertEquals(1, data.numDimensions());
		assertEquals(1, data.dimension(0));
		assertEquals(2, get(data, 0).r(), 0);
		assertEquals(3, get(data, 0).i(), 0);
	}

	@Test
	public void sampleAxisSurvivesWhenOnlyChannelsVary() {

		SignalAssembler assembler = new SignalAssembler();

		assembler.accept(counters(0, 0), 2, new float[][] { { 2 }, { 4 } }, new float[][] { { 3 }, { 5 } });

		DimensionedDataSource<ComplexFloat64Member> data = assembler.finish();

		assertEquals(2, data.numDimensions());
		assertEquals(1, data.dimension(0));
		assertEquals(2, data.dimension(1));
		assertEquals(4, get(data, 0, 1).r(), 0);
		assertEquals(5, get(data, 0, 1).i(), 0);
	}

	@Test
	public void channelCountMustNotChange() {

		SignalAssembler assembler = new SignalAssembler();

		assembler.accept(counters(0, 0), 2, filled(2, 4, 0), filled(2, 4, 0));

		InconsistentChannelCountException e = assertThrows(InconsistentChannelCountException.class,
				() -> assembler.accept(counters(1, 0), 1, filled(1, 4, 0), filled(1, 4, 0)));
		assertTrue(e.getMessage().contains("2"));

		assertEquals(1, assembler.numScans());
	}

	@Test
	public void sampleLengthMustNotChange() {

		SignalAssembler assembler = new SignalAssembler();

		assembler.accept(counters(0, 0), 1, filled(1, 8, 0), filled(1, 8, 0));

		assertThrows(InconsistentSampleLengthException.class,
				() -> assembler.accept(counters(1, 0), 1, filled(1, 16, 0), filled(1, 16, 0)));
	}

	@Test
	public void callerArraysAreCopied() {

		SignalAssembler assembler = new SignalAssembler();

		float[][] re = filled(1, 2, 1);
		assembler.accept(counters(0, 0), 1, re, filled(1, 2, 1));
		re[0][0] = 99;

		assertEquals(1, get(assembler.finish(), 0).r(), 0);
	}

	@Test
	public void nothingAcceptedIsAnEmptyAcquisition() {

		assertThrows(EmptyAcquisitionException.class, () -> new SignalAssembler().finish());
	}
}
