package com.github.micycle1.surfrec;

import java.util.List;

import org.ejml.data.DMatrixSparseTriplet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.surfrec.concurrent.WorkerPool;

/**
 * Builds the compatibility rows belonging to one grid row i, for every
 * {@code j in [0, N-1)}.
 * <p>
 * Columns are handled in batches of {@code batchSize}; each batch fans out one
 * task per column on the worker pool and joins before the next batch starts.
 * Rows are stacked in increasing j, so local row j of the returned block is
 * global constraint row {@code i*(N-1) + j}.
 */
public class ConstraintBlockAssembler {

	private static final Logger LOGGER = LoggerFactory.getLogger(ConstraintBlockAssembler.class);

	private final WorkerPool pool;
	private final int batchSize;

	public ConstraintBlockAssembler(WorkerPool pool, int batchSize) {
		if (batchSize < 1) {
			throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
		}
		this.pool = pool;
		this.batchSize = batchSize;
	}

	/**
	 * Returns a {@code (N-1) x 2MN} block holding the equations of grid row i.
	 * Empty (zero rows) when N <= 1.
	 */
	public DMatrixSparseTriplet assembleRow(int i, GridShape shape) throws InterruptedException {
		if (i < 0 || i >= shape.rows - 1) {
			throw new IndexOutOfBoundsException("Grid row " + i + " has no interior quads in a " + shape + " grid");
		}
		final int quads = shape.cols - 1;
		DMatrixSparseTriplet block = new DMatrixSparseTriplet(quads, shape.unknownCount(),
				Math.multiplyExact(quads, CompatibilityEquation.TERMS));

		for (int jStart = 0; jStart < quads; jStart += batchSize) {
			int jEnd = Math.min(quads, jStart + batchSize);
			List<CompatibilityEquation> batch = pool.mapOrdered(col -> CompatibilityEquation.of(i, col, shape), jStart, jEnd);

			int j = jStart;
			for (CompatibilityEquation eq : batch) {
				if (eq.row() != shape.constraintRow(i, j)) {
					throw new IllegalStateException("Equation for quad (" + i + "," + j + ") came back as row " + eq.row());
				}
				eq.writeTo(block, j++);
			}
			LOGGER.debug("Grid row {}: assembled columns [{}, {}) of {}", i, jStart, jEnd, quads);
		}
		return block;
	}
}
