package com.github.micycle1.surfrec;

import java.util.Map;

/**
 * A pair of same-shape gradient fields: slope along the row axis ({@code gx})
 * and slope along the column axis ({@code gy}). Used both for measured input
 * and for corrected output of the solve.
 */
public final class GradientField {

	private final float[][] gx;
	private final float[][] gy;
	private final GridShape shape;

	public GradientField(float[][] gx, float[][] gy) {
		this.shape = GridArrays.requireSameShape(gx, gy);
		this.gx = gx;
		this.gy = gy;
	}

	/**
	 * Picks the two named datasets out of a frame. A missing y dataset is
	 * replaced with zeros of the x shape; a missing x dataset is an error.
	 */
	public static GradientField fromArrays(Map<String, float[][]> arrays, String xName, String yName) {
		float[][] x = arrays.get(xName);
		if (x == null) {
			throw new IllegalArgumentException("Missing gradient dataset '" + xName + "', have " + arrays.keySet());
		}
		float[][] y = arrays.get(yName);
		if (y == null) {
			y = GridArrays.zeros(GridShape.of(x));
		}
		return new GradientField(x, y);
	}

	public float[][] gx() {
		return gx;
	}

	public float[][] gy() {
		return gy;
	}

	public GridShape shape() {
		return shape;
	}
}
