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

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import nom.bdezonia.zorbage.coordinates.LinearNdCoordinateSpace;
import nom.bdezonia.zorbage.data.DimensionedDataSource;
import nom.bdezonia.zorbage.metadata.MetaDataStore;
import nom.bdezonia.zorbage.type.complex.float64.ComplexFloat64Member;

/**
 * A decoded spectroscopy signal together with what is needed to interpret it:
 * dwell time in seconds, spectrometer frequency in MHz, echo and repetition
 * times in ms, the header values it was read with, and where the voxel sits
 * in the scanner when that is known.
 * <p>
 * The time axis is axis 0 of the data source.
 *
 * @author Barry DeZonia
 *
 */
public final class MrsData {

	private final DimensionedDataSource<ComplexFloat64Member> data;
	private final double dt;
	private final double f0;
	private final double te;
	private final double tr;
	private final Map<String, Object> metadata;
	private final AffineTransform transform;

	/**
	 *
	 * @param data complex samples, time on axis 0
	 * @param dt dwell time in seconds
	 * @param f0 spectrometer frequency in MHz
	 * @param te echo time in ms
	 * @param tr repetition time in ms
	 * @param metadata extra named values, may be empty
	 * @param transform voxel to scanner transform, or null
	 */
	public MrsData(DimensionedDataSource<ComplexFloat64Member> data, double dt, double f0,
			double te, double tr, Map<String, Object> metadata, AffineTransform transform)
	{
		if (data == null)
			throw new IllegalArgumentException("signal data cannot be null");
		if (!(dt > 0))
			throw new IllegalArgumentException("dwell time must be positive, not "+dt);
		this.data = data;
		this.dt = dt;
		this.f0 = f0;
		this.te = te;
		this.tr = tr;
		this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
		this.transform = transform;
		describe();
	}

	public DimensionedDataSource<ComplexFloat64Member> data() {
		return data;
	}

	/** Dwell time in seconds. */
	public double dt() {
		return dt;
	}

	/** Spectrometer frequency in MHz. */
	public double f0() {
		return f0;
	}

	/** Echo time in ms. */
	public double te() {
		return te;
	}

	/** Repetition time in ms. */
	public double tr() {
		return tr;
	}

	public Map<String, Object> metadata() {
		return metadata;
	}

	/** Null when the source carried no usable geometry. */
	public AffineTransform transform() {
		return transform;
	}

	/** Points per FID. */
	public long np() {
		return data.dimension(0);
	}

	/** In Hz. */
	public double spectralWidth() {
		return 1.0 / dt;
	}

	/** Spacing of the spectrum in Hz. */
	public double frequencyResolution() {
		return spectralWidth() / np();
	}

	/** Acquisition time of each point in seconds. */
	public double[] timeAxis() {
		int n = (int) np();
		double[] t = new double[n];
		for (int i = 0; i < n; i++) {
			t[i] = dt * i;
		}
		return t;
	}

	/**
	 * Dimensions outermost first, the order a C style array would list them.
	 */
	public long[] shape() {
		int numD = data.numDimensions();
		long[] shape = new long[numD];
		for (int i = 0; i < numD; i++) {
			shape[i] = data.dimension(numD - 1 - i);
		}
		return shape;
	}

	// mirror everything into the data source so it travels with a DataBundle

	private void describe() {

		MetaDataStore store = data.metadata();

		store.putDouble("dwell time (s)", dt);
		store.putDouble("spectrometer frequency (MHz)", f0);
		store.putDouble("echo time (ms)", te);
		store.putDouble("repetition time (ms)", tr);
		store.putDouble("spectral width (Hz)", spectralWidth());

		for (Map.Entry<String, Object> entry : metadata.entrySet()) {
			Object value = entry.getValue();
			if (value instanceof Double)
				store.putDouble(entry.getKey(), (Double) value);
			else if (value instanceof Long)
				store.putLong(entry.getKey(), (Long) value);
			else if (value != null)
				store.putString(entry.getKey(), value.toString());
		}

		if (transform != null) {
			for (int r = 0; r < 4; r++) {
				for (int c = 0; c < 4; c++) {
					store.putDouble("transform " + r + "," + c, transform.get(r, c));
				}
			}
		}

		int numD = data.numDimensions();
		BigDecimal[] scales = new BigDecimal[numD];
		BigDecimal[] offsets = new BigDecimal[numD];
		for (int i = 0; i < numD; i++) {
			scales[i] = BigDecimal.ONE;
			offsets[i] = BigDecimal.ZERO;
		}
		scales[0] = BigDecimal.valueOf(dt);
		data.setCoordinateSpace(new LinearNdCoordinateSpace(scales, offsets));
		data.setAxisUnit(0, "s");
	}

	@Override
	public String toString() {
		StringBuilder b = new StringBuilder("MrsData[shape=(");
		long[] shape = shape();
		for (int i = 0; i < shape.length; i++) {
			if (i > 0) b.append(", ");
			b.append(shape[i]);
		}
		b.append("), dt=").append(dt).append(", f0=").append(f0).append(']');
		return b.toString();
	}
}
