package com.github.micycle1.surfrec;

import org.ejml.data.DMatrixSparseTriplet;

/**
 * One discrete curl-free equation for the interior pixel quad (i,j):
 * <pre>
 * u(i,j) + v(i+1,j) - u(i,j+1) - v(i,j) = 0
 * </pre>
 * Instances are immutable; {@link #of(int, int, GridShape)} is a pure function
 * and may be called from any thread.
 */
public final class CompatibilityEquation {

	public static final int TERMS = 4;

	private static final double[] COEFFICIENTS = { 1.0, 1.0, -1.0, -1.0 };

	private final int row;
	private final int[] columns;

	private CompatibilityEquation(int row, int[] columns) {
		this.row = row;
		this.columns = columns;
	}

	/**
	 * @throws IndexOutOfBoundsException if (i,j) is not an interior quad of the
	 *                                   grid
	 */
	public static CompatibilityEquation of(int i, int j, GridShape shape) {
		if (!shape.isInteriorQuad(i, j)) {
			throw new IndexOutOfBoundsException("Quad (" + i + "," + j + ") is outside the interior of a " + shape + " grid");
		}
		int[] cols = { shape.u(i, j), shape.v(i + 1, j), shape.u(i, j + 1), shape.v(i, j) };
		return new CompatibilityEquation(shape.constraintRow(i, j), cols);
	}

	/** Row of this equation in the compatibility block. */
	public int row() {
		return row;
	}

	public int column(int k) {
		return columns[k];
	}

	public double coefficient(int k) {
		return COEFFICIENTS[k];
	}

	/** Adds the four nonzeros of this equation as row {@code targetRow}. */
	public void writeTo(DMatrixSparseTriplet target, int targetRow) {
		for (int k = 0; k < TERMS; k++) {
			target.addItem(targetRow, columns[k], COEFFICIENTS[k]);
		}
	}

	/** Residual of this equation for a flat unknown vector. */
	public double residual(double[] x) {
		double r = 0;
		for (int k = 0; k < TERMS; k++) {
			r += COEFFICIENTS[k] * x[columns[k]];
		}
		return r;
	}
}
