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

import nom.bdezonia.zorbage.siemens.exceptions.DegenerateOrientationException;

/**
 * Siemens stores the orientation of a voxel in a somewhat strange way: a
 * normal vector and a rotation angle. To get the row vector we use
 * Gram-Schmidt to make a default row vector orthogonal to the normal, and
 * then rotate it about the normal by the in-plane angle.
 *
 * @author Barry DeZonia
 *
 */
public class Orientation {

	private static final double TOLERANCE = 1e-6;

	public enum Plane { TRANSVERSE, CORONAL, SAGITTAL }

	// do not instantiate

	private Orientation() { }

	/**
	 * The dominant axis of a (sag, cor, tra) normal. Ties go to transverse
	 * first, then coronal.
	 */
	public static Plane classify(double[] normal) {
		double x = Math.abs(normal[0]);
		double y = Math.abs(normal[1]);
		double z = Math.abs(normal[2]);
		if (z >= y - TOLERANCE && z >= x - TOLERANCE)
			return Plane.TRANSVERSE;
		if (y >= x - TOLERANCE)
			return Plane.CORONAL;
		return Plane.SAGITTAL;
	}

	/**
	 *
	 * @param normal plane normal in (sag, cor, tra) scanner coordinates
	 * @param inPlaneRotation rotation about the normal in radians
	 * @return unit row vector
	 */
	public static double[] rowVector(double[] normal, double inPlaneRotation) {

		double[] n = unitNormal(normal);

		double[] candidate = classify(n) == Plane.SAGITTAL ?
				new double[] { 0, 0, 1 } : new double[] { -1, 0, 0 };

		double along = dot(candidate, n);
		double[] orthogonal = new double[3];
		for (int i = 0; i < 3; i++) {
			orthogonal[i] = candidate[i] - along * n[i];
		}
		double length = norm(orthogonal);
		if (length == 0)
			throw new DegenerateOrientationException("default row vector is parallel to the normal");
		for (int i = 0; i < 3; i++) {
			orthogonal[i] /= length;
		}

		return multiply(rotationMatrix(inPlaneRotation, n), orthogonal);
	}

	/**
	 * The column vector is row x normal.
	 */
	public static double[] columnVector(double[] rowVector, double[] normal) {
		return cross(rowVector, unitNormal(normal));
	}

	/**
	 * Put the whole calculation together.
	 *
	 * @param normal plane normal
	 * @param inPlaneRotation rotation about the normal in radians
	 * @param position voxel centre in scanner coordinates
	 * @param spacing voxel size along row, column and normal
	 */
	public static AffineTransform transform(double[] normal, double inPlaneRotation, double[] position, double[] spacing) {
		double[] row = rowVector(normal, inPlaneRotation);
		double[] column = columnVector(row, normal);
		return AffineTransform.of(row, column, position, spacing);
	}

	/**
	 * Rodrigues' rotation matrix for an angle about an axis.
	 */
	public static double[][] rotationMatrix(double angle, double[] axis) {

		double[] k = unitNormal(axis);

		double c = Math.cos(angle);
		double s = Math.sin(angle);
		double t = 1 - c;

		double x = k[0], y = k[1], z = k[2];

		return new double[][] {
			{ c + x * x * t,     x * y * t - z * s, x * z * t + y * s },
			{ y * x * t + z * s, c + y * y * t,     y * z * t - x * s },
			{ z * x * t - y * s, z * y * t + x * s, c + z * z * t     }
		};
	}

	static double[] cross(double[] a, double[] b) {
		return new double[] {
			a[1] * b[2] - a[2] * b[1],
			a[2] * b[0] - a[0] * b[2],
			a[0] * b[1] - a[1] * b[0]
		};
	}

	static double dot(double[] a, double[] b) {
		return a[0] * b[0] + a[1] * b[1] + a[2] * b[2];
	}

	static double norm(double[] a) {
		return Math.sqrt(dot(a, a));
	}

	private static double[] unitNormal(double[] normal) {
		if (normal.length != 3)
			throw new DegenerateOrientationException("normal must have 3 components, not "+normal.length);
		double length = norm(normal);
		if (length == 0 || Double.isNaN(length))
			throw new DegenerateOrientationException("normal vector has zero length");
		return new double[] { normal[0] / length, normal[1] / length, normal[2] / length };
	}

	private static double[] multiply(double[][] matrix, double[] v) {
		double[] out = new double[3];
		for (int i = 0; i < 3; i++) {
			out[i] = matrix[i][0] * v[0] + matrix[i][1] * v[1] + matrix[i][2] * v[2];
		}
		return out;
	}
}
