package com.github.micycle1.surfrec;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Process-wide settings for matrix assembly, solving and frame processing.
 * Created once at start-up and passed by reference to the components that need
 * it.
 */
@Value
@Builder
@With
public class ReconstructionSettings {

	public static final String PREFIX = "surfrec.";

	/**
	 * Columns per batch when assembling constraint rows; bounds peak memory of
	 * the per-column tasks held at once.
	 */
	@Builder.Default
	int columnBatchSize = 1000;

	/**
	 * Worker threads used by the row-block assembler. Defaults to one less than
	 * the available processors, reserving one for the OS.
	 */
	@Builder.Default
	int workerThreads = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);

	/**
	 * Largest accepted {@code ||A x - b|| / max(1, ||b||)} after a solve.
	 */
	@Builder.Default
	double residualTolerance = 1e-8;

	/**
	 * Factorization back end.
	 */
	@Builder.Default
	SolverBackend solverBackend = SolverBackend.EJML;

	/**
	 * Keep one factorization per grid shape and reuse it for later frames.
	 */
	@Builder.Default
	boolean reuseFactorization = true;

	@Builder.Default
	String gradientXDataset = "gradz_x";

	@Builder.Default
	String gradientYDataset = "gradz_y";

	@Builder.Default
	String gradientFilePattern = "gradz%04d";

	@Builder.Default
	String heightFilePattern = "z_%03d";

	@Builder.Default
	String flatFilePattern = "z_flat_%03d";

	public static ReconstructionSettings defaults() {
		return builder().build();
	}

	/**
	 * Defaults overridden by any {@code surfrec.*} key present in {@code props}.
	 */
	public static ReconstructionSettings fromProperties(Properties props) {
		ReconstructionSettings s = defaults();
		String v;
		if ((v = props.getProperty(PREFIX + "columnBatchSize")) != null) {
			s = s.withColumnBatchSize(Integer.parseInt(v.trim()));
		}
		if ((v = props.getProperty(PREFIX + "workerThreads")) != null) {
			s = s.withWorkerThreads(Integer.parseInt(v.trim()));
		}
		if ((v = props.getProperty(PREFIX + "residualTolerance")) != null) {
			s = s.withResidualTolerance(Double.parseDouble(v.trim()));
		}
		if ((v = props.getProperty(PREFIX + "solverBackend")) != null) {
			s = s.withSolverBackend(SolverBackend.valueOf(v.trim().toUpperCase()));
		}
		if ((v = props.getProperty(PREFIX + "reuseFactorization")) != null) {
			s = s.withReuseFactorization(Boolean.parseBoolean(v.trim()));
		}
		if ((v = props.getProperty(PREFIX + "gradientXDataset")) != null) {
			s = s.withGradientXDataset(v.trim());
		}
		if ((v = props.getProperty(PREFIX + "gradientYDataset")) != null) {
			s = s.withGradientYDataset(v.trim());
		}
		if ((v = props.getProperty(PREFIX + "gradientFilePattern")) != null) {
			s = s.withGradientFilePattern(v.trim());
		}
		if ((v = props.getProperty(PREFIX + "heightFilePattern")) != null) {
			s = s.withHeightFilePattern(v.trim());
		}
		if ((v = props.getProperty(PREFIX + "flatFilePattern")) != null) {
			s = s.withFlatFilePattern(v.trim());
		}
		return s.validate();
	}

	/**
	 * Loads a {@code .properties} classpath resource; a missing resource yields
	 * the defaults.
	 */
	public static ReconstructionSettings load(String resource) throws IOException {
		Properties props = new Properties();
		try (InputStream in = ReconstructionSettings.class.getClassLoader().getResourceAsStream(resource)) {
			if (in != null) {
				props.load(in);
			}
		}
		return fromProperties(props);
	}

	public ReconstructionSettings validate() {
		if (columnBatchSize < 1) {
			throw new IllegalArgumentException("columnBatchSize must be positive: " + columnBatchSize);
		}
		if (workerThreads < 1) {
			throw new IllegalArgumentException("workerThreads must be positive: " + workerThreads);
		}
		if (!(residualTolerance > 0)) {
			throw new IllegalArgumentException("residualTolerance must be positive: " + residualTolerance);
		}
		return this;
	}

	/**
	 * Sparse LU implementations available to the compatibility solver.
	 */
	public enum SolverBackend {
		/** EJML sparse LU on the CSC matrix. */
		EJML,
		/** ojAlgo LU; dense, only sensible for small grids and cross-checks. */
		OJALGO
	}
}
