package com.github.micycle1.surfrec;

/**
 * Removes a constant background tilt from a gradient pair before integration.
 */
public final class Flattening {

	private Flattening() {
	}

	/** Constant background gradient. */
	public static final class Background {
		public final double gx;
		public final double gy;

		public Background(double gx, double gy) {
			this.gx = gx;
			this.gy = gy;
		}

		@Override
		public String toString() {
			return String.format("Background{gx=%.6g, gy=%.6g}", gx, gy);
		}
	}

	/** Background taken as the mean of each gradient of a reference frame. */
	public static Background estimateBackground(GradientField reference) {
		return new Background(GridArrays.mean(reference.gx()), GridArrays.mean(reference.gy()));
	}

	/** New gradient pair with the background subtracted; the input is unchanged. */
	public static GradientField subtract(GradientField g, Background bg) {
		float[][] gx = GridArrays.copy(g.gx());
		float[][] gy = GridArrays.copy(g.gy());
		for (int i = 0; i < gx.length; i++) {
			for (int j = 0; j < gx[i].length; j++) {
				gx[i][j] -= bg.gx;
				gy[i][j] -= bg.gy;
			}
		}
		return new GradientField(gx, gy);
	}
}
