package com.github.micycle1.surfrec;

/**
 * Dimensions (M rows, N columns) of a pair of gradient fields, and the single
 * indexing scheme that maps pixels to unknowns of the saddle-point system.
 * <p>
 * Conventions:
 * <ul>
 * <li>The unknown vector holds the M*N x-gradient unknowns (u) followed by the
 * M*N y-gradient unknowns (v).</li>
 * <li>{@code u(i,j)} is the row-major flat index of pixel (i,j);
 * {@code v(i,j) = u(i,j) + M*N}. On square grids this is {@code i*M + j}.</li>
 * <li>Interior quad (i,j), {@code 0 <= i < M-1, 0 <= j < N-1}, owns constraint
 * row {@code i*(N-1) + j}.</li>
 * </ul>
 * Matrix assembly, right-hand-side assembly and solution splitting all go
 * through this class.
 */
public final class GridShape {

	public final int rows; // M
	public final int cols; // N

	private final int pixelCount;
	private final int constraintCount;
	private final int nonzeroCount;

	private GridShape(int rows, int cols) {
		this.rows = rows;
		this.cols = cols;
		this.pixelCount = Math.multiplyExact(rows, cols);
		this.constraintCount = Math.multiplyExact(rows - 1, cols - 1);
		// u and v unknowns plus one multiplier per quad must fit an int index
		Math.addExact(Math.multiplyExact(2, pixelCount), constraintCount);
		// so must the nonzero count of the augmented matrix
		this.nonzeroCount = Math.addExact(Math.multiplyExact(2, pixelCount),
				Math.multiplyExact(2 * CompatibilityEquation.TERMS, constraintCount));
	}

	public static GridShape of(int rows, int cols) {
		if (rows < 1 || cols < 1) {
			throw new IllegalArgumentException("Grid must be at least 1x1, got " + rows + "x" + cols);
		}
		return new GridShape(rows, cols);
	}

	/**
	 * Shape of a rectangular 2-D array. Ragged or empty arrays are rejected.
	 */
	public static GridShape of(float[][] field) {
		if (field == null || field.length == 0 || field[0] == null || field[0].length == 0) {
			throw new IllegalArgumentException("Gradient field must be a non-empty 2-D array");
		}
		int n = field[0].length;
		for (int i = 1; i < field.length; i++) {
			if (field[i] == null || field[i].length != n) {
				throw new IllegalArgumentException("Gradient field is ragged at row " + i);
			}
		}
		return of(field.length, n);
	}

	/** Flat index of the x-gradient unknown of pixel (i,j). */
	public int u(int i, int j) {
		return i * cols + j;
	}

	/** Flat index of the y-gradient unknown of pixel (i,j). */
	public int v(int i, int j) {
		return u(i, j) + pixelCount;
	}

	/** Index of the constraint row owned by interior quad (i,j). */
	public int constraintRow(int i, int j) {
		return i * (cols - 1) + j;
	}

	/** M*N */
	public int pixelCount() {
		return pixelCount;
	}

	/** 2*M*N: corrected-gradient unknowns, excluding multipliers. */
	public int unknownCount() {
		return 2 * pixelCount;
	}

	/** (M-1)*(N-1): one compatibility equation per interior quad. */
	public int constraintCount() {
		return constraintCount;
	}

	/** Order of the augmented matrix, also the length of the right-hand side. */
	public int systemSize() {
		return unknownCount() + constraintCount;
	}

	/** Nonzeros of the augmented matrix: the 2MN diagonal plus E and E'. */
	public int nonzeroCount() {
		return nonzeroCount;
	}

	public boolean isInteriorQuad(int i, int j) {
		return i >= 0 && i < rows - 1 && j >= 0 && j < cols - 1;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof GridShape)) {
			return false;
		}
		GridShape other = (GridShape) o;
		return rows == other.rows && cols == other.cols;
	}

	@Override
	public int hashCode() {
		return 31 * rows + cols;
	}

	@Override
	public String toString() {
		return rows + "x" + cols;
	}
}
