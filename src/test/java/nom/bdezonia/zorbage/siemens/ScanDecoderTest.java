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
import java.io.ByteArrayOutputStream;
import java.io.IOException;

import org.junit.jupiter.api.Test;

import nom.bdezonia.zorbage.siemens.TwixTestFiles.Scan;
import nom.bdezonia.zorbage.siemens.exceptions.MalformedContainerException;

/**
 * @author Barry DeZonia
 */
public class ScanDecoderTest {

	private static LittleEndianInput vbScans(Scan... scans) {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		for (Scan scan : scans) {
			TwixTestFiles.writeVbScan(out, scan);
		}
		return new LittleEndianInput(new ByteArrayInputStream(out.toByteArray()));
	}

	private static LittleEndianInput vdScans(Scan... scans) {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		for (Scan scan : scans) {
			TwixTestFiles.writeVdScan(out, scan);
		}
		return new LittleEndianInput(new ByteArrayInputStream(out.toByteArray()));
	}

	@Test
	public void usableLengthIsThePowerOfTwoAfterTheDummyPoints() {
		assertEquals(8, ScanDecoder.usableLength(10, 2));
		assertEquals(8, ScanDecoder.usableLength(12, 2));
		assertEquals(2048, ScanDecoder.usableLength(2048, 0));
		assertEquals(1, ScanDecoder.usableLength(1, 0));
		assertThrows(MalformedContainerException.class, () -> ScanDecoder.usableLength(2, 2));
	}

	@Test
	public void vbRecordCarriesCountersAndConjugatedSamples() throws IOException {

		LittleEndianInput in = vbScans(Scan.ramp(2, 4).counter(0, 3).counter(13, 1));

		ScanDecoder.Step step = ScanDecoder.next(in, TwixFormat.VB);

		assertFalse(step.isEnd());
		ScanRecord record = step.record();
		assertNotNull(record);
		assertEquals(2, record.channelCount());
		assertEquals(4, record.fidLength());
		assertEquals(4, record.sampleCount());
		assertEquals(3, record.loopCounters()[0]);
		assertEquals(1, record.loopCounters()[13]);
		assertEquals(101.0f, record.real(1, 1), 0);
		assertEquals(101.5f, record.imaginary(1, 1), 0);
		assertEquals(7, record.scannerFields().measUid);

		// the cursor sits exactly at the end of the scan
		assertEquals(2 * (128 + 8 * 4), in.position());
	}

	@Test
	public void vdRecordCursorEndsAtDmaLength() throws IOException {

		LittleEndianInput in = vdScans(Scan.ramp(3, 8).fidStart(0), Scan.ramp(3, 8).counter(1, 1));

		ScanDecoder.Step first = ScanDecoder.next(in, TwixFormat.VD);
		assertEquals(192 + 3 * (32 + 64), in.position());

		ScanDecoder.Step second = ScanDecoder.next(in, TwixFormat.VD);
		assertEquals(1, second.record().loopCounters()[1]);
		assertEquals(first.record().real(2, 7), second.record().real(2, 7), 0);
	}

	@Test
	public void skippedScanHasNoRecordButMovesOn() throws IOException {

		LittleEndianInput in = vbScans(
				Scan.ramp(1, 32).flags(EvalInfoMask.RT_FEEDBACK),
				Scan.ramp(1, 4));

		ScanDecoder.Step skipped = ScanDecoder.next(in, TwixFormat.VB);
		assertNull(skipped.record());
		assertFalse(skipped.isEnd());
		assertTrue(skipped.evalInfo().rtFeedback());

		ScanDecoder.Step kept = ScanDecoder.next(in, TwixFormat.VB);
		assertNotNull(kept.record());
		assertEquals(4, kept.record().fidLength());
	}

	@Test
	public void acquisitionEndStops() throws IOException {

		LittleEndianInput in = vdScans(new Scan(0, 0).flags(EvalInfoMask.ACQ_END));

		ScanDecoder.Step step = ScanDecoder.next(in, TwixFormat.VD);

		assertTrue(step.isEnd());
		assertNull(step.record());
	}

	@Test
	public void fidStartPastTheSamplesIsMalformed() throws IOException {

		LittleEndianInput in = vbScans(Scan.ramp(1, 4).fidStart(4), Scan.ramp(1, 4).counter(0, 5));

		assertThrows(MalformedContainerException.class, () -> ScanDecoder.next(in, TwixFormat.VB));

		// the bad scan is still stepped over by its declared length
		assertEquals(128 + 8 * 4, in.position());

		ScanDecoder.Step next = ScanDecoder.next(in, TwixFormat.VB);
		assertEquals(5, next.record().loopCounters()[0]);
		assertEquals(3.0f, next.record().real(0, 3), 0);
	}

	@Test
	public void vdFidStartPastTheSamplesStillSeeksToTheNextScan() throws IOException {

		LittleEndianInput in = vdScans(Scan.ramp(2, 4).fidStart(6), Scan.ramp(2, 4).counter(1, 2));

		assertThrows(MalformedContainerException.class, () -> ScanDecoder.next(in, TwixFormat.VD));
		assertEquals(192 + 2 * (32 + 8 * 4), in.position());

		assertEquals(2, ScanDecoder.next(in, TwixFormat.VD).record().loopCounters()[1]);
	}
}
