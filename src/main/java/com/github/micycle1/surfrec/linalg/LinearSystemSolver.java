package com.github.micycle1.surfrec.linalg;

import org.ejml.data.DMatrixRMaj;
import org.ejml.data.DMatrixSparseCSC;

/**
 * Direct (factorize once, solve many) solver for square sparse systems
 * {@code A x = b}.
 */
public interface LinearSystemSolver {

	/**
	 * Factorizes {@code a}. The matrix is not modified.
	 *
	 * @throws FactorizationException if the matrix is singular or the
	 *                                factorization fails
	 */
	Factorization factorize(DMatrixSparseCSC a);

	/** A factorized system. */
	interface Factorization {

		/**
		 * Solves for one right-hand side column. {@code b} is not modified.
		 *
		 * @throws FactorizationException if the back end fails during the solve
		 */
		DMatrixRMaj solve(DMatrixRMaj b);
	}
}
