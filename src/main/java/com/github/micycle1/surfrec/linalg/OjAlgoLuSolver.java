package com.github.micycle1.surfrec.linalg;

import org.ejml.data.DMatrixRMaj;
import org.ejml.data.DMatrixSparseCSC;
import org.ojalgo.matrix.decomposition.LU;
import org.ojalgo.matrix.store.MatrixStore;
import org.ojalgo.matrix.store.R064Store;
import org.ojalgo.matrix.store.SparseStore;

/**
 * ojAlgo LU back end. The decomposition is dense, so this is meant for small
 * grids and for cross-checking the sparse solver.
 */
public final class OjAlgoLuSolver implements LinearSystemSolver {

	@Override
	public Factorization factorize(DMatrixSparseCSC a) {
		if (a.numRows != a.numCols) {
			throw new IllegalArgumentException("Matrix must be square, got " + a.numRows + "x" + a.numCols);
		}
		final int n = a.numRows;

		final SparseStore<Double> store = SparseStore.R064.make(n, n);
		for (int c = 0; c < a.numCols; c++) {
			for (int p = a.col_idx[c]; p < a.col_idx[c + 1]; p++) {
				store.add(a.nz_rows[p], c, a.nz_values[p]);
			}
		}

		final LU<Double> lu = LU.R064.make();
		if (!lu.decompose(store) || !lu.isSolvable()) {
			throw new FactorizationException("ojAlgo LU failed (singular/ill-conditioned system)");
		}
		return new OjAlgoFactorization(lu, n);
	}

	private static final class OjAlgoFactorization implements Factorization {

		private final LU<Double> lu;
		private final int n;

		OjAlgoFactorization(LU<Double> lu, int n) {
			this.lu = lu;
			this.n = n;
		}

		@Override
		public synchronized DMatrixRMaj solve(DMatrixRMaj b) {
			if (b.numRows != n || b.numCols != 1) {
				throw new IllegalArgumentException("Right-hand side must be " + n + "x1, got " + b.numRows + "x" + b.numCols);
			}
			final R064Store rhs = R064Store.FACTORY.make(n, 1);
			for (int i = 0; i < n; i++) {
				rhs.set(i, 0, b.data[i]);
			}
			final MatrixStore<Double> x = lu.getSolution(rhs);

			DMatrixRMaj out = new DMatrixRMaj(n, 1);
			for (int i = 0; i < n; i++) {
				out.data[i] = x.doubleValue(i, 0);
			}
			return out;
		}
	}
}
