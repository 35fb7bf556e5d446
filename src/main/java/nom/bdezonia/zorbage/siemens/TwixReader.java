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
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import nom.bdezonia.zorbage.data.DimensionedDataSource;
import nom.bdezonia.zorbage.siemens.exceptions.MalformedContainerException;
import nom.bdezonia.zorbage.type.complex.float64.ComplexFloat64Member;

/**
 * Reads Siemens TWIX raw data (meas.dat). VB files hold one measurement that
 * starts at byte 0. VD/VE files start with a table of measurements; like most
 * tools we assume the spectroscopy is the last one, the earlier ones being
 * adjustment scans.
 * <p>
 * The stream is only ever read forwards, so it can come from anywhere. It is
 * not closed.
 *
 * @author Barry DeZonia
 *
 */
public class TwixReader {

	/** Bytes in one entry of the VD measurement table. */
	static final int MEASUREMENT_ENTRY = 152;

	/** The protocol header ends with bytes that are not text. */
	static final int HEADER_TRAILER = 24;

	/** Largest measurement count a VD file can hold. */
	static final int MAX_MEASUREMENTS = 64;

	// do not instantiate

	private TwixReader() { }

	/**
	 *
	 * @param stream
	 * @return
	 * @throws IOException
	 */
	public static MrsData read(InputStream stream) throws IOException {

		LittleEndianInput in = new LittleEndianInput(stream);

		long[] start = in.peekInts(2);

		TwixFormat format = TwixFormat.detect(start[0], start[1]);

		if (format == TwixFormat.VD) {
			System.out.println("twix file is VD/VE");
			List<MeasurementEntry> table = readMeasurementTable(in, start[1]);
			MeasurementEntry last = table.get(table.size() - 1);
			System.out.println("  reading " + last);
			in.seek(last.offset);
		}
		else {
			System.out.println("twix file is VB");
		}

		HeaderParameters header = ProtocolHeader.parse(readProtocolHeader(in));

		SignalAssembler assembler = new SignalAssembler();

		while (true) {
			ScanDecoder.Step step = ScanDecoder.next(in, format);
			if (step.isEnd())
				break;
			if (step.record() != null)
				assembler.accept(step.record());
		}

		DimensionedDataSource<ComplexFloat64Member> data = assembler.finish();

		data.setName("siemens twix file");

		return new MrsData(data,
				header.getDouble(ProtocolHeader.DWELL_TIME),
				header.getDouble(ProtocolHeader.FREQUENCY),
				header.getDouble(ProtocolHeader.TE),
				header.getDouble(ProtocolHeader.TR),
				header.asMap(),
				header.transform());
	}

	/**
	 * The protocol text of every measurement in the container, in table order.
	 * A VB file gives a single entry.
	 *
	 * @param stream
	 * @return
	 * @throws IOException
	 */
	public static List<String> readProtocolHeaders(InputStream stream) throws IOException {

		LittleEndianInput in = new LittleEndianInput(stream);

		long[] start = in.peekInts(2);

		if (TwixFormat.detect(start[0], start[1]) == TwixFormat.VB) {
			System.out.println("twix file is VB");
			return Collections.singletonList(readProtocolHeader(in));
		}

		System.out.println("twix file is VD/VE");

		List<MeasurementEntry> table = readMeasurementTable(in, start[1]);

		// visit the measurements in file order, report them in table order
		List<MeasurementEntry> byOffset = new ArrayList<>(table);
		byOffset.sort(Comparator.comparingLong(e -> e.offset));

		String[] headers = new String[table.size()];
		for (MeasurementEntry entry : byOffset) {
			in.seek(entry.offset);
			headers[entry.index] = readProtocolHeader(in);
		}

		return Arrays.asList(headers);
	}

	/**
	 * Reads the length prefixed protocol text at the cursor.
	 */
	static String readProtocolHeader(LittleEndianInput in) throws IOException {

		long headerSize = in.readUnsignedInt();

		// the size counts its own four bytes
		if (headerSize < 4 + HEADER_TRAILER || headerSize > Integer.MAX_VALUE)
			throw new MalformedContainerException("impossible protocol header length "+headerSize);

		byte[] header = in.readBytes((int) headerSize - 4);

		return new String(header, 0, header.length - HEADER_TRAILER, StandardCharsets.ISO_8859_1);
	}

	private static List<MeasurementEntry> readMeasurementTable(LittleEndianInput in, long numMeasurements)
			throws IOException
	{
		if (numMeasurements < 1 || numMeasurements > MAX_MEASUREMENTS)
			throw new MalformedContainerException("VD file lists "+numMeasurements+" measurements");

		// twix id, measurement count
		in.skip(8);

		List<MeasurementEntry> table = new ArrayList<>();

		for (int i = 0; i < numMeasurements; i++) {

			long measId = in.readUnsignedInt();
			long fileId = in.readUnsignedInt();
			long offset = in.readLong();
			long length = in.readLong();
			in.skip(64); // patient name
			byte[] protocolName = in.readBytes(64);

			if (offset < 8 + MEASUREMENT_ENTRY * numMeasurements)
				throw new MalformedContainerException("measurement "+i+" starts at impossible offset "+offset);

			table.add(new MeasurementEntry(i, measId, fileId, offset, length, text(protocolName)));
		}

		return table;
	}

	private static String text(byte[] bytes) {
		int len = 0;
		while (len < bytes.length && bytes[len] != 0)
			len++;
		return new String(bytes, 0, len, StandardCharsets.ISO_8859_1);
	}

	private static class MeasurementEntry {

		final int index;
		final long measId;
		final long fileId;
		final long offset;
		final long length;
		final String protocolName;

		MeasurementEntry(int index, long measId, long fileId, long offset, long length,
				String protocolName)
		{
			this.index = index;
			this.measId = measId;
			this.fileId = fileId;
			this.offset = offset;
			this.length = length;
			this.protocolName = protocolName;
		}

		@Override
		public String toString() {
			return "measurement " + measId + " (file " + fileId + ", " + protocolName + ", " +
					length + " bytes at " + offset + ")";
		}
	}
}
