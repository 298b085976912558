package com.github.micycle1.surfrec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class HeightIntegratorTest {

	@Test
	void zeroGradientsGiveZeroHeight() {
		float[][] z = HeightIntegrator.reconstruct(new float[5][4], new float[5][4]);
		float[][] zt = HeightIntegrator.reconstructTransposed(new float[5][4], new float[5][4]);
		for (int i = 0; i < 5; i++) {
			for (int j = 0; j < 4; j++) {
				assertEquals(0f, z[i][j]);
				assertEquals(0f, zt[i][j]);
			}
		}
	}

	@Test
	void unitRowSlopeGivesRowIndex() {
		float[][] gx = SyntheticFields.filled(3, 3, 1f);
		float[][] gy = new float[3][3];

		float[][] z = HeightIntegrator.reconstruct(gx, gy);
		float[][] zt = HeightIntegrator.reconstructTransposed(gx, gy);
		for (int i = 0; i < 3; i++) {
			for (int j = 0; j < 3; j++) {
				assertEquals(i, z[i][j], 0f);
				assertEquals(i, zt[i][j], 0f);
			}
		}
	}

	@Test
	void boundarySeededFromFirstRowOfGy() {
		float[][] gx = new float[2][4];
		float[][] gy = { { 1, 2, 3, 4 }, { 10, 20, 30, 40 } };
		float[][] z = HeightIntegrator.reconstruct(gx, gy);
		float[] expected = { 0, 1, 3, 6 };
		for (int i = 0; i < 2; i++) {
			for (int j = 0; j < 4; j++) {
				assertEquals(expected[j], z[i][j], 0f);
			}
		}
	}

	@Test
	void integrableFieldRecoversHeight() {
		float[][] h = SyntheticFields.height(6, 5);
		GradientField g = SyntheticFields.differentiate(h, 0f);

		float[][] z = HeightIntegrator.reconstruct(g);
		float[][] zt = HeightIntegrator.reconstructTransposed(g);
		assertEquals(0f, z[0][0]);
		assertEquals(0.0, GridArrays.maxAbsDifference(h, z), 1e-5);
		assertEquals(0.0, GridArrays.maxAbsDifference(h, zt), 1e-5);
	}

	@ParameterizedTest
	@ValueSource(floats = { 0.01f, 0.1f, 0.5f })
	void pathDependenceTracksTheViolation(float delta) {
		GradientField g = SyntheticFields.differentiate(SyntheticFields.height(5, 6), 0f);
		float[][] gx = GridArrays.copy(g.gx());
		gx[1][3] += delta;

		assertEquals(delta, HeightIntegrator.examine(gx, g.gy(), 1, 3), 1e-5);
		assertEquals(-delta, HeightIntegrator.examine(gx, g.gy(), 1, 2), 1e-5);

		float[][] z = HeightIntegrator.reconstruct(gx, g.gy());
		float[][] zt = HeightIntegrator.reconstructTransposed(gx, g.gy());
		double diff = GridArrays.maxAbsDifference(z, zt);
		assertTrue(diff > 0, "paths should disagree");
		assertEquals(delta, diff, 1e-5);
	}

	@Test
	void examineIsZeroForIntegrableField() {
		GradientField g = SyntheticFields.integrable(4, 4);
		for (int i = 0; i < 3; i++) {
			for (int j = 0; j < 3; j++) {
				assertEquals(0.0, HeightIntegrator.examine(g.gx(), g.gy(), i, j), 1e-6);
			}
		}
		assertEquals(0.0, HeightIntegrator.maxResidual(g.gx(), g.gy()), 1e-6);
	}

	@Test
	void examineRejectsBoundaryQuads() {
		assertThrows(IndexOutOfBoundsException.class, () -> HeightIntegrator.examine(new float[3][3], new float[3][3], 2, 0));
		assertThrows(IllegalArgumentException.class, () -> HeightIntegrator.reconstruct(new float[3][3], new float[2][3]));
	}

	@Test
	void singlePixel() {
		float[][] z = HeightIntegrator.reconstruct(new float[][] { { 3 } }, new float[][] { { 4 } });
		assertEquals(0f, z[0][0]);
		assertEquals(0.0, HeightIntegrator.maxResidual(new float[][] { { 3 } }, new float[][] { { 4 } }));
	}
}
