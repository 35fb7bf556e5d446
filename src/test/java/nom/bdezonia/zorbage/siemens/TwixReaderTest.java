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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import nom.bdezonia.zorbage.algebra.G;
import nom.bdezonia.zorbage.data.DimensionedDataSource;
import nom.bdezonia.zorbage.sampling.IntegerIndex;
import nom.bdezonia.zorbage.siemens.TwixTestFiles.Scan;
import nom.bdezonia.zorbage.siemens.exceptions.EmptyAcquisitionException;
import nom.bdezonia.zorbage.siemens.exceptions.MalformedContainerException;
import nom.bdezonia.zorbage.type.complex.float64.ComplexFloat64Member;

/**
 * @author Barry DeZonia
 */
public class TwixReaderTest {

	private static final double TOL = 1e-9;

	private static MrsData read(byte[] bytes) throws IOException {
		return TwixReader.read(new ByteArrayInputStream(bytes));
	}

	private static ComplexFloat64Member value(DimensionedDataSource<ComplexFloat64Member> data, long... pos) {
		IntegerIndex idx = new IntegerIndex(pos.length);
		for (int i = 0; i < pos.length; i++) {
			idx.set(i, pos[i]);
		}
		ComplexFloat64Member v = G.CDBL.construct();
		data.get(idx, v);
		return v;
	}

	@Test
	public void vbAveragesBecomeOneAxis() throws IOException {

		byte[] file = TwixTestFiles.vb(TwixTestFiles.ASCCONV_HEADER,
				Scan.ramp(1, 8).counter(1, 0),
				Scan.ramp(1, 8).counter(1, 1));

		MrsData mrs = read(file);

		assertArrayEquals(new long[] { 2, 8 }, mrs.shape());
		assertEquals(8, mrs.np());

		ComplexFloat64Member v = value(mrs.data(), 3, 1);
		assertEquals(3.0, v.r(), TOL);
		// stored as -3.5, conjugated on the way in
		assertEquals(3.5, v.i(), TOL);

		assertEquals(833e-9, mrs.dt(), 1e-15);
		assertEquals(123.259, mrs.f0(), 1e-9);
		assertEquals(30.0, mrs.te(), TOL);
		assertEquals(2000.0, mrs.tr(), TOL);
		assertEquals("svs_se_30", mrs.metadata().get(ProtocolHeader.PROTOCOL_NAME));
	}

	@Test
	public void vbSecondChannelFollowsRepeatedHeader() throws IOException {

		byte[] file = TwixTestFiles.vb(TwixTestFiles.ASCCONV_HEADER, Scan.ramp(2, 4));

		MrsData mrs = read(file);

		assertArrayEquals(new long[] { 2, 4 }, mrs.shape());

		ComplexFloat64Member v = value(mrs.data(), 2, 1);
		assertEquals(102.0, v.r(), TOL);
		assertEquals(102.5, v.i(), TOL);
	}

	@Test
	public void singleSampleKeepsTheTimeAxis() throws IOException {

		byte[] file = TwixTestFiles.vb(TwixTestFiles.ASCCONV_HEADER, Scan.ramp(2, 1));

		MrsData mrs = read(file);

		assertArrayEquals(new long[] { 2, 1 }, mrs.shape());
		assertEquals(1, mrs.np());
		assertEquals(1, mrs.timeAxis().length);
		assertEquals(mrs.spectralWidth(), mrs.frequencyResolution(), TOL);
		assertEquals(100.0, value(mrs.data(), 0, 1).r(), TOL);
	}

	@Test
	public void dummyPointsAreDroppedAndLengthIsAPowerOfTwo() throws IOException {

		byte[] file = TwixTestFiles.vb(TwixTestFiles.ASCCONV_HEADER, Scan.ramp(1, 12).fidStart(2));

		MrsData mrs = read(file);

		// 10 usable samples round down to 8
		assertArrayEquals(new long[] { 8 }, mrs.shape());
		assertEquals(2.0, value(mrs.data(), 0).r(), TOL);
		assertEquals(9.0, value(mrs.data(), 7).r(), TOL);
	}

	@Test
	public void packingBitsAboveTheDmaLengthAreIgnored() throws IOException {

		byte[] file = TwixTestFiles.vb(TwixTestFiles.ASCCONV_HEADER,
				Scan.ramp(1, 4).counter(6, 0).dmaFlags(0x25),
				Scan.ramp(1, 4).counter(6, 1).dmaFlags(0x3f));

		MrsData mrs = read(file);

		assertArrayEquals(new long[] { 2, 4 }, mrs.shape());
	}

	@Test
	public void auxiliaryScansAreSkippedWithoutLosingSync() throws IOException {

		byte[] file = TwixTestFiles.vb(TwixTestFiles.ASCCONV_HEADER,
				Scan.ramp(1, 16).flags(EvalInfoMask.NOISE_ADJ_SCAN),
				Scan.ramp(2, 32).flags(EvalInfoMask.SYNC_DATA),
				Scan.ramp(1, 4),
				Scan.ramp(1, 16).flags(EvalInfoMask.PAT_REF_SCAN),
				Scan.ramp(1, 4).counter(1, 1));

		MrsData mrs = read(file);

		assertArrayEquals(new long[] { 2, 4 }, mrs.shape());
		assertEquals(3.0, value(mrs.data(), 3, 1).r(), TOL);
	}

	@Test
	public void onlyAnAcquisitionEndIsAnEmptyAcquisition() {

		byte[] file = TwixTestFiles.vb(TwixTestFiles.ASCCONV_HEADER);

		assertThrows(EmptyAcquisitionException.class, () -> read(file));
	}

	@Test
	public void readingTwiceGivesTheSameSignal() throws IOException {

		byte[] file = TwixTestFiles.vb(TwixTestFiles.ASCCONV_HEADER,
				Scan.ramp(2, 8).counter(2, 0),
				Scan.ramp(2, 8).counter(2, 1));

		MrsData a = read(file);
		MrsData b = read(file);

		assertArrayEquals(a.shape(), b.shape());
		for (long s = 0; s < 8; s++) {
			for (long c = 0; c < 2; c++) {
				for (long slice = 0; slice < 2; slice++) {
					ComplexFloat64Member va = value(a.data(), s, c, slice);
					ComplexFloat64Member vb = value(b.data(), s, c, slice);
					assertEquals(va.r(), vb.r(), 0);
					assertEquals(va.i(), vb.i(), 0);
				}
			}
		}
		assertEquals(a.transform(), b.transform());
	}

	@Test
	public void truncatedFileIsMalformed() {

		byte[] file = TwixTestFiles.vb(TwixTestFiles.ASCCONV_HEADER, Scan.ramp(1, 8), Scan.ramp(1, 8));

		// cut into the middle of the second scan
		byte[] cut = Arrays.copyOf(file, file.length - 128 - 40);

		assertThrows(MalformedContainerException.class, () -> read(cut));
	}

	@Test
	public void tooShortToDetectIsMalformed() {

		assertThrows(MalformedContainerException.class, () -> read(new byte[] { 1, 2, 3 }));
	}

	@Test
	public void vdReadsTheLastMeasurement() throws IOException {

		String adjustment = TwixTestFiles.ASCCONV_HEADER.replace("svs_se_30", "adjustment");

		byte[] file = TwixTestFiles.vd(
				Arrays.asList(adjustment, TwixTestFiles.ASCCONV_HEADER),
				Arrays.asList(
						Collections.singletonList(Scan.ramp(1, 64)),
						Arrays.asList(Scan.ramp(2, 8).counter(1, 0), Scan.ramp(2, 8).counter(1, 1))));

		MrsData mrs = read(file);

		assertEquals("svs_se_30", mrs.metadata().get(ProtocolHeader.PROTOCOL_NAME));
		assertArrayEquals(new long[] { 2, 2, 8 }, mrs.shape());
		ComplexFloat64Member v = value(mrs.data(), 5, 1, 0);
		assertEquals(105.0, v.r(), TOL);
		assertEquals(105.5, v.i(), TOL);
	}

	@Test
	public void vdFidStartComesFromTheIceParameters() throws IOException {

		byte[] file = TwixTestFiles.vd(
				Collections.singletonList(TwixTestFiles.ASCCONV_HEADER),
				Collections.singletonList(Collections.singletonList(Scan.ramp(1, 20).fidStart(4))));

		MrsData mrs = read(file);

		assertArrayEquals(new long[] { 16 }, mrs.shape());
		assertEquals(4.0, value(mrs.data(), 0).r(), TOL);
	}

	@Test
	public void geometryComesFromTheProtocol() throws IOException {

		MrsData mrs = read(TwixTestFiles.vb(TwixTestFiles.ASCCONV_HEADER, Scan.ramp(1, 4)));

		AffineTransform t = mrs.transform();
		assertNotNull(t);
		assertArrayEquals(new double[] { 1.5, -2.5, 10 }, t.position(), TOL);
		assertArrayEquals(new double[] { 20, 20, 20 }, t.voxelSize(), TOL);
	}

	@Test
	public void protocolHeadersOfEveryMeasurement() throws IOException {

		byte[] vd = TwixTestFiles.vd(
				Arrays.asList("first header\n", "second header\n"),
				Arrays.asList(
						Collections.singletonList(Scan.ramp(1, 4)),
						Collections.singletonList(Scan.ramp(1, 4))));

		List<String> headers = TwixReader.readProtocolHeaders(new ByteArrayInputStream(vd));

		assertEquals(Arrays.asList("first header\n", "second header\n"), headers);

		byte[] vb = TwixTestFiles.vb("only header\n", Scan.ramp(1, 4));

		assertEquals(Collections.singletonList("only header\n"),
				TwixReader.readProtocolHeaders(new ByteArrayInputStream(vb)));
	}

	@Test
	public void facadeBundlesTheSignal() throws IOException {

		byte[] file = TwixTestFiles.vb(TwixTestFiles.ASCCONV_HEADER, Scan.ramp(1, 4));

		MrsData mrs = SiemensReader.readTwix(new ByteArrayInputStream(file));

		assertEquals(4, mrs.np());
		assertEquals(4, mrs.timeAxis().length);
		assertEquals(3 * 833e-9, mrs.timeAxis()[3], 1e-15);
	}
}
