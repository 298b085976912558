package com.github.micycle1.surfrec;

import org.ejml.data.DMatrixRMaj;

/**
 * Right-hand side of the saddle-point system for measured gradients
 * {@code (gX, gY)}: {@code 2*gX} and {@code 2*gY} in unknown order, then one
 * zero per compatibility equation. Always double precision.
 */
public final class RightHandSide {

	private RightHandSide() {
	}

	public static DMatrixRMaj build(float[][] gX, float[][] gY) {
		GridShape shape = GridArrays.requireSameShape(gX, gY);
		DMatrixRMaj b = new DMatrixRMaj(shape.systemSize(), 1);
		for (int i = 0; i < shape.rows; i++) {
			for (int j = 0; j < shape.cols; j++) {
				b.data[shape.u(i, j)] = 2.0 * gX[i][j];
				b.data[shape.v(i, j)] = 2.0 * gY[i][j];
			}
		}
		// trailing (M-1)(N-1) entries stay zero
		return b;
	}

	public static DMatrixRMaj build(GradientField g) {
		return build(g.gx(), g.gy());
	}
}
