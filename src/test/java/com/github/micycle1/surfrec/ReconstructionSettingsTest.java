package com.github.micycle1.surfrec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Properties;

import org.junit.jupiter.api.Test;

public class ReconstructionSettingsTest {

	@Test
	void defaults() {
		ReconstructionSettings s = ReconstructionSettings.defaults();
		assertEquals(1000, s.getColumnBatchSize());
		assertTrue(s.getWorkerThreads() >= 1);
		assertEquals(ReconstructionSettings.SolverBackend.EJML, s.getSolverBackend());
		assertTrue(s.isReuseFactorization());
		assertEquals("gradz_x", s.getGradientXDataset());
		assertEquals("gradz_y", s.getGradientYDataset());
		assertEquals("z_%03d", s.getHeightFilePattern());
	}

	@Test
	void loadsOverridesFromClasspath() throws Exception {
		ReconstructionSettings s = ReconstructionSettings.load("surfrec-test.properties");
		assertEquals(2, s.getColumnBatchSize());
		assertEquals(3, s.getWorkerThreads());
		assertEquals(1e-6, s.getResidualTolerance());
		assertEquals(ReconstructionSettings.SolverBackend.OJALGO, s.getSolverBackend());
		assertEquals("slope_y", s.getGradientYDataset());
		// untouched keys keep their defaults
		assertEquals("gradz_x", s.getGradientXDataset());
	}

	@Test
	void missingResourceGivesDefaults() throws Exception {
		assertEquals(ReconstructionSettings.defaults().withWorkerThreads(1),
				ReconstructionSettings.load("no-such.properties").withWorkerThreads(1));
	}

	@Test
	void invalidValuesAreRejected() {
		Properties p = new Properties();
		p.setProperty("surfrec.columnBatchSize", "0");
		assertThrows(IllegalArgumentException.class, () -> ReconstructionSettings.fromProperties(p));

		Properties q = new Properties();
		q.setProperty("surfrec.solverBackend", "cholmod");
		assertThrows(IllegalArgumentException.class, () -> ReconstructionSettings.fromProperties(q));
	}
}
