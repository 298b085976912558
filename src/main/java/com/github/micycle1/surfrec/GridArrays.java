package com.github.micycle1.surfrec;

/**
 * Small helpers over rectangular {@code float[][]} fields.
 */
public final class GridArrays {

	private GridArrays() {
	}

	public static float[][] transpose(float[][] a) {
		GridShape s = GridShape.of(a);
		float[][] t = new float[s.cols][s.rows];
		for (int i = 0; i < s.rows; i++) {
			for (int j = 0; j < s.cols; j++) {
				t[j][i] = a[i][j];
			}
		}
		return t;
	}

	public static float[][] copy(float[][] a) {
		float[][] c = new float[a.length][];
		for (int i = 0; i < a.length; i++) {
			c[i] = a[i].clone();
		}
		return c;
	}

	public static float[][] zeros(GridShape shape) {
		return new float[shape.rows][shape.cols];
	}

	/**
	 * Shape shared by both fields; fails when either is ragged or the shapes
	 * differ.
	 */
	public static GridShape requireSameShape(float[][] a, float[][] b) {
		GridShape sa = GridShape.of(a);
		GridShape sb = GridShape.of(b);
		if (!sa.equals(sb)) {
			throw new IllegalArgumentException("Gradient shapes differ: " + sa + " vs " + sb);
		}
		return sa;
	}

	public static double mean(float[][] a) {
		GridShape s = GridShape.of(a);
		double sum = 0;
		for (float[] row : a) {
			for (float x : row) {
				sum += x;
			}
		}
		return sum / s.pixelCount();
	}

	/** Largest absolute element-wise difference of two same-shape fields. */
	public static double maxAbsDifference(float[][] a, float[][] b) {
		requireSameShape(a, b);
		double max = 0;
		for (int i = 0; i < a.length; i++) {
			for (int j = 0; j < a[i].length; j++) {
				max = Math.max(max, Math.abs((double) a[i][j] - b[i][j]));
			}
		}
		return max;
	}
}
