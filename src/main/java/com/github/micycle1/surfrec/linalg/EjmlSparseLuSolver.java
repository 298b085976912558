package com.github.micycle1.surfrec.linalg;

import org.ejml.data.DMatrixRMaj;
import org.ejml.data.DMatrixSparseCSC;
import org.ejml.interfaces.linsol.LinearSolverSparse;
import org.ejml.sparse.FillReducing;
import org.ejml.sparse.csc.factory.LinearSolverFactory_DSCC;

/**
 * Sparse LU (EJML, up-looking with partial pivoting) on the CSC matrix.
 */
public final class EjmlSparseLuSolver implements LinearSystemSolver {

	@Override
	public Factorization factorize(DMatrixSparseCSC a) {
		if (a.numRows != a.numCols) {
			throw new IllegalArgumentException("Matrix must be square, got " + a.numRows + "x" + a.numCols);
		}
		LinearSolverSparse<DMatrixSparseCSC, DMatrixRMaj> solver = LinearSolverFactory_DSCC.lu(FillReducing.NONE);
		boolean ok;
		try {
			ok = solver.setA(solver.modifiesA() ? a.copy() : a);
		} catch (RuntimeException e) {
			throw new FactorizationException("Sparse LU failed on " + a.numRows + "x" + a.numCols + " matrix", e);
		}
		if (!ok) {
			throw new FactorizationException("Sparse LU failed to set A (singular matrix)");
		}
		return new EjmlFactorization(solver, a.numRows);
	}

	private static final class EjmlFactorization implements Factorization {

		private final LinearSolverSparse<DMatrixSparseCSC, DMatrixRMaj> solver;
		private final int n;

		EjmlFactorization(LinearSolverSparse<DMatrixSparseCSC, DMatrixRMaj> solver, int n) {
			this.solver = solver;
			this.n = n;
		}

		// EJML solvers keep internal work arrays, so solves are serialized
		@Override
		public synchronized DMatrixRMaj solve(DMatrixRMaj b) {
			if (b.numRows != n || b.numCols != 1) {
				throw new IllegalArgumentException("Right-hand side must be " + n + "x1, got " + b.numRows + "x" + b.numCols);
			}
			DMatrixRMaj x = new DMatrixRMaj(n, 1);
			try {
				solver.solve(solver.modifiesB() ? b.copy() : b, x);
			} catch (RuntimeException e) {
				throw new FactorizationException("Sparse LU solve failed", e);
			}
			return x;
		}
	}
}
