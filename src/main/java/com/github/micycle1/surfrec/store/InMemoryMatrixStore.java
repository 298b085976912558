package com.github.micycle1.surfrec.store;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.ejml.data.DMatrixSparseCSC;

import com.github.micycle1.surfrec.GridShape;

/**
 * Map-backed store for tests and single-process use.
 */
public class InMemoryMatrixStore implements CoefficientMatrixStore {

	private final Map<GridShape, DMatrixSparseCSC> matrices = new ConcurrentHashMap<>();

	@Override
	public DMatrixSparseCSC get(GridShape shape) throws MissingCoefficientMatrixException {
		DMatrixSparseCSC m = matrices.get(shape);
		if (m == null) {
			throw new MissingCoefficientMatrixException(shape, "in-memory store");
		}
		return m;
	}

	@Override
	public void put(GridShape shape, DMatrixSparseCSC matrix) {
		CoefficientMatrixStore.requireSystemSize(shape, matrix);
		if (matrices.putIfAbsent(shape, matrix) != null) {
			throw new IllegalStateException("Coefficient matrix for " + shape + " already stored");
		}
	}

	@Override
	public boolean contains(GridShape shape) {
		return matrices.containsKey(shape);
	}
}
