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
import java.util.Arrays;

import nom.bdezonia.zorbage.coordinates.Affine3dCoordinateSpace;

/**
 * 4x4 matrix taking voxel coordinates to scanner coordinates. Columns 0-2 are
 * the voxel axes scaled by the voxel spacing, column 3 is the origin and the
 * bottom row is (0,0,0,1). Instances never change.
 *
 * @author Barry DeZonia
 *
 */
public final class AffineTransform {

	private final double[][] m;

	private AffineTransform(double[][] m) {
		this.m = m;
	}

	/**
	 * Build a transform from two in-plane unit vectors. The third axis is their
	 * cross product.
	 *
	 * @param rowVector unit vector of the voxel x axis in scanner space
	 * @param columnVector unit vector of the voxel y axis in scanner space
	 * @param position origin of the voxel grid in scanner space
	 * @param spacing size of a voxel along x, y and z
	 */
	public static AffineTransform of(double[] rowVector, double[] columnVector, double[] position, double[] spacing) {

		double[] sliceVector = Orientation.cross(rowVector, columnVector);

		double[][] m = new double[4][4];
		for (int i = 0; i < 3; i++) {
			m[i][0] = rowVector[i] * spacing[0];
			m[i][1] = columnVector[i] * spacing[1];
			m[i][2] = sliceVector[i] * spacing[2];
			m[i][3] = position[i];
		}
		m[3][3] = 1.0;

		return new AffineTransform(m);
	}

	/**
	 * Wrap an existing matrix. The bottom row must be (0,0,0,1).
	 */
	public static AffineTransform fromArray(double[][] matrix) {

		if (matrix.length != 4)
			throw new IllegalArgumentException("transform must have 4 rows");
		double[][] m = new double[4][];
		for (int i = 0; i < 4; i++) {
			if (matrix[i].length != 4)
				throw new IllegalArgumentException("transform must have 4 columns");
			m[i] = matrix[i].clone();
		}
		if (m[3][0] != 0 || m[3][1] != 0 || m[3][2] != 0 || m[3][3] != 1)
			throw new IllegalArgumentException("bottom row of an affine transform must be 0,0,0,1");
		return new AffineTransform(m);
	}

	public double get(int row, int col) {
		return m[row][col];
	}

	public double[][] toArray() {
		double[][] copy = new double[4][];
		for (int i = 0; i < 4; i++) {
			copy[i] = m[i].clone();
		}
		return copy;
	}

	/** The origin of the voxel grid in scanner coordinates. */
	public double[] position() {
		return new double[] { m[0][3], m[1][3], m[2][3] };
	}

	/** The length of each voxel axis. */
	public double[] voxelSize() {
		double[] size = new double[3];
		for (int j = 0; j < 3; j++) {
			size[j] = Math.sqrt(m[0][j] * m[0][j] + m[1][j] * m[1][j] + m[2][j] * m[2][j]);
		}
		return size;
	}

	public double[] toScanner(double x, double y, double z) {
		double[] out = new double[3];
		for (int i = 0; i < 3; i++) {
			out[i] = m[i][0] * x + m[i][1] * y + m[i][2] * z + m[i][3];
		}
		return out;
	}

	/**
	 * Inverse of {@link #toScanner(double, double, double)}. Fails when the
	 * linear part is singular (a zero spacing).
	 */
	public double[] fromScanner(double x, double y, double z) {

		double a = m[0][0], b = m[0][1], c = m[0][2];
		double d = m[1][0], e = m[1][1], f = m[1][2];
		double g = m[2][0], h = m[2][1], k = m[2][2];

		double det = a * (e * k - f * h) - b * (d * k - f * g) + c * (d * h - e * g);
		if (det == 0)
			throw new IllegalStateException("transform is singular and cannot be inverted");

		double px = x - m[0][3];
		double py = y - m[1][3];
		double pz = z - m[2][3];

		// adjugate / determinant
		double[] out = new double[3];
		out[0] = ((e * k - f * h) * px + (c * h - b * k) * py + (b * f - c * e) * pz) / det;
		out[1] = ((f * g - d * k) * px + (a * k - c * g) * py + (c * d - a * f) * pz) / det;
		out[2] = ((d * h - e * g) * px + (b * g - a * h) * py + (a * e - b * d) * pz) / det;
		return out;
	}

	/**
	 * The same mapping as a zorbage coordinate space, for data whose first three
	 * axes are spatial.
	 */
	public Affine3dCoordinateSpace toCoordinateSpace() {
		return new Affine3dCoordinateSpace(
				BigDecimal.valueOf(m[0][0]), BigDecimal.valueOf(m[0][1]), BigDecimal.valueOf(m[0][2]), BigDecimal.valueOf(m[0][3]),
				BigDecimal.valueOf(m[1][0]), BigDecimal.valueOf(m[1][1]), BigDecimal.valueOf(m[1][2]), BigDecimal.valueOf(m[1][3]),
				BigDecimal.valueOf(m[2][0]), BigDecimal.valueOf(m[2][1]), BigDecimal.valueOf(m[2][2]), BigDecimal.valueOf(m[2][3]));
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof AffineTransform)) return false;
		return Arrays.deepEquals(m, ((AffineTransform) o).m);
	}

	@Override
	public int hashCode() {
		return Arrays.deepHashCode(m);
	}

	@Override
	public String toString() {
		return "AffineTransform" + Arrays.deepToString(m);
	}
}
