package com.github.micycle1.surfrec;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.ejml.data.DMatrixRMaj;
import org.ejml.data.DMatrixSparseCSC;
import org.ejml.dense.row.NormOps_DDRM;
import org.ejml.sparse.csc.CommonOps_DSCC;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.surfrec.linalg.EjmlSparseLuSolver;
import com.github.micycle1.surfrec.linalg.FactorizationException;
import com.github.micycle1.surfrec.linalg.LinearSystemSolver;
import com.github.micycle1.surfrec.linalg.OjAlgoLuSolver;
import com.github.micycle1.surfrec.store.CoefficientMatrixStore;
import com.github.micycle1.surfrec.store.MissingCoefficientMatrixException;

/**
 * Finds the least-squares correction of a measured gradient pair that
 * satisfies every compatibility equation, by solving the cached saddle-point
 * system for the pair's grid shape.
 * <p>
 * The solve runs in double precision; corrected gradients are returned in
 * single precision. The matrix is never built here: a shape without a stored
 * matrix fails with {@link MissingCoefficientMatrixException}.
 */
public class CompatibilitySolver {

	private static final Logger LOGGER = LoggerFactory.getLogger(CompatibilitySolver.class);

	private final CoefficientMatrixStore store;
	private final LinearSystemSolver backend;
	private final ReconstructionSettings settings;

	private final Map<GridShape, PreparedSystem> prepared = new ConcurrentHashMap<>();

	public CompatibilitySolver(CoefficientMatrixStore store, ReconstructionSettings settings) {
		this(store, backendFor(settings.getSolverBackend()), settings);
	}

	public CompatibilitySolver(CoefficientMatrixStore store, LinearSystemSolver backend, ReconstructionSettings settings) {
		this.store = store;
		this.backend = backend;
		this.settings = settings.validate();
	}

	public static LinearSystemSolver backendFor(ReconstructionSettings.SolverBackend kind) {
		switch (kind) {
			case OJALGO :
				return new OjAlgoLuSolver();
			case EJML :
			default :
				return new EjmlSparseLuSolver();
		}
	}

	/**
	 * @throws MissingCoefficientMatrixException if no matrix is stored for the
	 *                                           gradients' shape
	 * @throws FactorizationException            if the system is singular or the
	 *                                           solution fails verification
	 */
	public GradientField solve(GradientField measured) throws MissingCoefficientMatrixException, IOException {
		final GridShape shape = measured.shape();
		final PreparedSystem system = prepare(shape);

		final DMatrixRMaj b = RightHandSide.build(measured);
		LOGGER.info("Start solving linear system for {} grid ...", shape);
		final long t0 = System.nanoTime();
		final DMatrixRMaj x = system.factorization.solve(b);
		verify(system.matrix, x, b);
		LOGGER.info("Solved {} grid in {} ms", shape, (System.nanoTime() - t0) / 1_000_000);

		float[][] sX = new float[shape.rows][shape.cols];
		float[][] sY = new float[shape.rows][shape.cols];
		for (int i = 0; i < shape.rows; i++) {
			for (int j = 0; j < shape.cols; j++) {
				sX[i][j] = (float) x.data[shape.u(i, j)];
				sY[i][j] = (float) x.data[shape.v(i, j)];
			}
		}
		// entries past 2MN are the Lagrange multipliers
		return new GradientField(sX, sY);
	}

	public GradientField solve(float[][] gX, float[][] gY) throws MissingCoefficientMatrixException, IOException {
		return solve(new GradientField(gX, gY));
	}

	private PreparedSystem prepare(GridShape shape) throws MissingCoefficientMatrixException, IOException {
		if (!settings.isReuseFactorization()) {
			return load(shape);
		}
		PreparedSystem system = prepared.get(shape);
		if (system != null) {
			return system;
		}
		synchronized (this) {
			system = prepared.get(shape);
			if (system == null) {
				system = load(shape);
				prepared.put(shape, system);
			}
			return system;
		}
	}

	private PreparedSystem load(GridShape shape) throws MissingCoefficientMatrixException, IOException {
		DMatrixSparseCSC a = store.get(shape);
		long t0 = System.nanoTime();
		PreparedSystem system = new PreparedSystem(a, backend.factorize(a));
		LOGGER.info("Factorized {}x{} system for {} grid in {} ms", a.numRows, a.numCols, shape,
				(System.nanoTime() - t0) / 1_000_000);
		return system;
	}

	private void verify(DMatrixSparseCSC a, DMatrixRMaj x, DMatrixRMaj b) {
		for (int k = 0; k < x.getNumElements(); k++) {
			if (!Double.isFinite(x.data[k])) {
				throw new FactorizationException("Solution has a non-finite entry at index " + k + " (singular system)");
			}
		}
		DMatrixRMaj r = new DMatrixRMaj(b.numRows, 1);
		CommonOps_DSCC.mult(a, x, r);
		for (int k = 0; k < r.data.length; k++) {
			r.data[k] -= b.data[k];
		}
		double normR = NormOps_DDRM.normF(r);
		double scale = Math.max(1.0, NormOps_DDRM.normF(b));
		if (normR > settings.getResidualTolerance() * scale) {
			throw new FactorizationException(String.format("Residual %.3e exceeds tolerance %.1e (ill-conditioned system)",
					normR / scale, settings.getResidualTolerance()));
		}
	}

	private static final class PreparedSystem {
		final DMatrixSparseCSC matrix;
		final LinearSystemSolver.Factorization factorization;

		PreparedSystem(DMatrixSparseCSC matrix, LinearSystemSolver.Factorization factorization) {
			this.matrix = matrix;
			this.factorization = factorization;
		}
	}
}
