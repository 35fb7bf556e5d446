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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import nom.bdezonia.zorbage.algebra.G;
import nom.bdezonia.zorbage.data.DimensionedDataSource;
import nom.bdezonia.zorbage.data.DimensionedStorage;
import nom.bdezonia.zorbage.sampling.IntegerIndex;
import nom.bdezonia.zorbage.siemens.exceptions.EmptyAcquisitionException;
import nom.bdezonia.zorbage.siemens.exceptions.MalformedContainerException;
import nom.bdezonia.zorbage.siemens.exceptions.MissingRequiredParameterException;
import nom.bdezonia.zorbage.type.complex.float64.ComplexFloat64Member;

/**
 * Builds a signal from the CSA image header of a spectroscopy DICOM file and
 * the bytes of its CSA non-image element. The samples are little endian
 * float (real, imaginary) pairs.
 *
 * @author Barry DeZonia
 *
 */
public class CsaSignalReader {

	public static final String SLICES = "SpectroscopyAcquisitionOut-of-planePhaseSteps";
	public static final String ROWS = "Rows";
	public static final String COLUMNS = "Columns";
	public static final String POINTS = "DataPointColumns";

	private static final String[] AXIS_NAMES = { "slice", "row", "column", "t" };

	// do not instantiate

	private CsaSignalReader() { }

	public static MrsData read(byte[] csaHeaderBytes, byte[] signalBytes) {
		return read(CsaHeaderReader.read(csaHeaderBytes), signalBytes);
	}

	/**
	 *
	 * @param header decoded CSA image header
	 * @param signalBytes contents of the CSA non-image element
	 * @return
	 */
	public static MrsData read(CsaHeader header, byte[] signalBytes) {

		List<String> missing = new ArrayList<>();

		String[] required = { SLICES, ROWS, COLUMNS, POINTS, "RealDwellTime", "ImagingFrequency",
				"EchoTime", "RepetitionTime", "VoiOrientation", "VoiPosition", "PixelSpacing",
				"SliceThickness", "VoiReadoutFoV", "VoiPhaseFoV", "VoiThickness" };
		for (String name : required) {
			CsaTag tag = header.tag(name);
			if (tag == null || tag.items().isEmpty())
				missing.add(name);
		}
		if (!missing.isEmpty())
			throw new MissingRequiredParameterException(missing);

		if (signalBytes.length % 8 != 0)
			throw new MalformedContainerException("signal of "+signalBytes.length+" bytes is not a whole number of complex floats");

		long available = signalBytes.length / 8;

		if (available == 0)
			throw new EmptyAcquisitionException("the CSA signal element holds no samples");

		// outermost first: slices, rows, columns, points
		long[] shape = {
				(long) header.getDouble(SLICES),
				(long) header.getDouble(ROWS),
				(long) header.getDouble(COLUMNS),
				(long) header.getDouble(POINTS) };

		long product = 1;
		for (long s : shape) {
			product *= s;
		}

		if (product != available) {
			System.out.println("WARNING: the calculated data shape (" + shape[0] + ", " + shape[1] + ", " +
					shape[2] + ", " + shape[3] + ") does not match the " + available +
					" points in the file. Returning a flat signal of " + available + " points.");
			shape = new long[] { available };
		}

		DimensionedDataSource<ComplexFloat64Member> data = fill(squeeze(shape), axisNames(shape), signalBytes);

		double dt = header.getDouble("RealDwellTime") * 1e-9;
		double f0 = header.getDouble("ImagingFrequency");
		double te = header.getDouble("EchoTime");
		double tr = header.getDouble("RepetitionTime");

		double[] pixelSpacing = header.numbers("PixelSpacing", 2);
		double[] spacing = { pixelSpacing[0], pixelSpacing[1], header.getDouble("SliceThickness") };
		double inPlaneRotation = header.contains("VoiInPlaneRotation") &&
				!header.tag("VoiInPlaneRotation").items().isEmpty() ?
						header.getDouble("VoiInPlaneRotation") : 0;

		AffineTransform transform = Orientation.transform(
				header.numbers("VoiOrientation", 3),
				inPlaneRotation,
				header.numbers("VoiPosition", 3),
				spacing);

		Map<String, Object> metadata = new LinkedHashMap<>();
		metadata.put("voi_readout_fov", header.getDouble("VoiReadoutFoV"));
		metadata.put("voi_phase_fov", header.getDouble("VoiPhaseFoV"));
		metadata.put("voi_thickness", header.getDouble("VoiThickness"));
		for (CsaTag tag : header.tags()) {
			if (!tag.items().isEmpty())
				metadata.put("CSA HEADER: " + tag.name(), tag.value());
		}

		data.setName("siemens csa spectroscopy");

		return new MrsData(data, dt, f0, te, tr, metadata, transform);
	}

	// zorbage order (innermost first) without unit axes. The point axis always survives.

	private static long[] squeeze(long[] shape) {
		List<Long> dims = new ArrayList<>();
		for (int i = shape.length - 1; i >= 0; i--) {
			if (shape[i] != 1 || i == shape.length - 1)
				dims.add(shape[i]);
		}
		long[] out = new long[dims.size()];
		for (int i = 0; i < out.length; i++) {
			out[i] = dims.get(i);
		}
		return out;
	}

	private static String[] axisNames(long[] shape) {
		List<String> names = new ArrayList<>();
		for (int i = shape.length - 1; i >= 0; i--) {
			if (shape[i] != 1 || i == shape.length - 1)
				names.add(shape.length == AXIS_NAMES.length ? AXIS_NAMES[i] : "t");
		}
		return names.toArray(new String[0]);
	}

	private static DimensionedDataSource<ComplexFloat64Member> fill(long[] dims, String[] names, byte[] signalBytes) {

		DimensionedDataSource<ComplexFloat64Member> data =
				DimensionedStorage.allocate(G.CDBL.construct(), dims);

		ComplexFloat64Member value = G.CDBL.construct();

		IntegerIndex idx = new IntegerIndex(dims.length);

		try (LittleEndianInput in = new LittleEndianInput(new ByteArrayInputStream(signalBytes))) {

			long total = signalBytes.length / 8;

			for (long n = 0; n < total; n++) {
				// the first axis varies fastest, the same order the samples are stored in
				long rem = n;
				for (int d = 0; d < dims.length; d++) {
					idx.set(d, rem % dims[d]);
					rem /= dims[d];
				}
				value.setR(in.readFloat());
				value.setI(in.readFloat());
				data.set(idx, value);
			}

		} catch (IOException e) {
			throw new MalformedContainerException("could not read CSA signal: "+e.getMessage(), e);
		}

		for (int d = 0; d < dims.length; d++) {
			data.setAxisType(d, names[d]);
		}

		return data;
	}
}
