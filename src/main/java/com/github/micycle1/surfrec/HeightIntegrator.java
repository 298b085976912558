package com.github.micycle1.surfrec;

/**
 * Path integration of a gradient pair into a height field anchored at
 * {@code Z[0][0] = 0}.
 * <p>
 * For a field that is not exactly integrable the result depends on the path;
 * {@link #reconstruct} and {@link #reconstructTransposed} are both valid and
 * the choice is left to the caller.
 */
public final class HeightIntegrator {

	private HeightIntegrator() {
	}

	/**
	 * Primary path. The boundary profile is the running sum of {@code gY}'s first
	 * row, {@code [0, gY[0][0], gY[0][0]+gY[0][1], ...]}, repeated on every row;
	 * to it is added the running sum of {@code gX} down each column, starting from
	 * a zero first row.
	 */
	public static float[][] reconstruct(float[][] gX, float[][] gY) {
		GridShape shape = GridArrays.requireSameShape(gX, gY);
		final int m = shape.rows;
		final int n = shape.cols;

		double[] z0 = new double[n];
		for (int j = 1; j < n; j++) {
			z0[j] = z0[j - 1] + gY[0][j - 1];
		}

		float[][] z = new float[m][n];
		double[] down = new double[n]; // running column sums of gX
		for (int i = 0; i < m; i++) {
			for (int j = 0; j < n; j++) {
				z[i][j] = (float) (down[j] + z0[j]);
				down[j] += gX[i][j];
			}
		}
		return z;
	}

	/**
	 * Transposed path: swaps the roles of the two gradients, integrates with
	 * {@link #reconstruct} and transposes back. Runs along column 0 first, then
	 * across each row.
	 */
	public static float[][] reconstructTransposed(float[][] gX, float[][] gY) {
		GridArrays.requireSameShape(gX, gY);
		float[][] zt = reconstruct(GridArrays.transpose(gY), GridArrays.transpose(gX));
		return GridArrays.transpose(zt);
	}

	public static float[][] reconstruct(GradientField g) {
		return reconstruct(g.gx(), g.gy());
	}

	public static float[][] reconstructTransposed(GradientField g) {
		return reconstructTransposed(g.gx(), g.gy());
	}

	/**
	 * Residual of the compatibility equation of quad (i,j):
	 * {@code gX[i][j] + gY[i+1][j] - gX[i][j+1] - gY[i][j]}. Zero (up to noise)
	 * for a compatible field.
	 *
	 * @throws IndexOutOfBoundsException if (i,j) is not an interior quad
	 */
	public static double examine(float[][] gX, float[][] gY, int i, int j) {
		GridShape shape = GridArrays.requireSameShape(gX, gY);
		if (!shape.isInteriorQuad(i, j)) {
			throw new IndexOutOfBoundsException("Quad (" + i + "," + j + ") is outside the interior of a " + shape + " grid");
		}
		return (double) gX[i][j] + gY[i + 1][j] - gX[i][j + 1] - gY[i][j];
	}

	/** Largest absolute {@link #examine} residual over all interior quads; 0 when there are none. */
	public static double maxResidual(float[][] gX, float[][] gY) {
		GridShape shape = GridArrays.requireSameShape(gX, gY);
		double max = 0;
		for (int i = 0; i < shape.rows - 1; i++) {
			for (int j = 0; j < shape.cols - 1; j++) {
				max = Math.max(max, Math.abs(examine(gX, gY, i, j)));
			}
		}
		return max;
	}
}
