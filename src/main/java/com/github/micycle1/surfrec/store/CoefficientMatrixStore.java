package com.github.micycle1.surfrec.store;

import java.io.IOException;

import org.ejml.data.DMatrixSparseCSC;

import com.github.micycle1.surfrec.GridShape;

/**
 * Shape-keyed storage of augmented coefficient matrices.
 * <p>
 * Entries are write-once: a matrix is put by the build step and afterwards only
 * read, possibly by many solvers at once. Callers must treat returned matrices
 * as read-only.
 */
public interface CoefficientMatrixStore {

	/**
	 * @throws MissingCoefficientMatrixException if nothing was stored for
	 *                                           {@code shape}
	 */
	DMatrixSparseCSC get(GridShape shape) throws MissingCoefficientMatrixException, IOException;

	/**
	 * @throws IllegalStateException if a matrix is already stored for
	 *                               {@code shape}
	 */
	void put(GridShape shape, DMatrixSparseCSC matrix) throws IOException;

	boolean contains(GridShape shape);

	/**
	 * @throws IllegalArgumentException if {@code m} is not the
	 *                                  {@link GridShape#systemSize()} square
	 *                                  matrix of {@code shape}
	 */
	static void requireSystemSize(GridShape shape, DMatrixSparseCSC m) {
		int n = shape.systemSize();
		if (m.numRows != n || m.numCols != n) {
			throw new IllegalArgumentException(
					"Matrix is " + m.numRows + "x" + m.numCols + " but a " + shape + " grid needs " + n + "x" + n);
		}
	}
}
