package com.github.micycle1.surfrec;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

public class FlatteningTest {

	@Test
	void backgroundIsTheMeanGradient() {
		GradientField g = new GradientField(new float[][] { { 1, 2 }, { 3, 4 } }, new float[][] { { -1, -1 }, { 1, 5 } });
		Flattening.Background bg = Flattening.estimateBackground(g);
		assertEquals(2.5, bg.gx, 1e-12);
		assertEquals(1.0, bg.gy, 1e-12);
	}

	@Test
	void subtractLeavesInputUntouched() {
		float[][] gx = { { 1, 2 }, { 3, 4 } };
		float[][] gy = { { 0, 0 }, { 0, 0 } };
		GradientField g = new GradientField(gx, gy);

		GradientField f = Flattening.subtract(g, new Flattening.Background(1, -1));
		assertEquals(0f, f.gx()[0][0]);
		assertEquals(3f, f.gx()[1][1]);
		assertEquals(1f, f.gy()[1][0]);
		assertEquals(1f, gx[0][0]);
		assertEquals(0f, gy[1][0]);
	}

	@Test
	void flattenedTiltIntegratesToZero() {
		GradientField tilt = new GradientField(SyntheticFields.filled(4, 4, 0.7f), SyntheticFields.filled(4, 4, -0.1f));
		GradientField f = Flattening.subtract(tilt, Flattening.estimateBackground(tilt));
		float[][] z = HeightIntegrator.reconstruct(f);
		assertEquals(0.0, GridArrays.maxAbsDifference(z, new float[4][4]), 1e-6);
	}
}
