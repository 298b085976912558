package com.github.micycle1.surfrec;

import java.io.IOException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.ejml.data.DMatrixSparseCSC;
import org.ejml.data.DMatrixSparseTriplet;
import org.ejml.ops.DConvertMatrixStruct;
import org.ejml.sparse.csc.CommonOps_DSCC;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.surfrec.concurrent.WorkerPool;
import com.github.micycle1.surfrec.store.CoefficientMatrixStore;

/**
 * Builds the augmented saddle-point matrix
 * <pre>
 * [ 2Q  E' ]
 * [ E   0  ]
 * </pre>
 * for an M x N grid, where Q is the 2MN identity and E holds one
 * {@link CompatibilityEquation} per interior quad.
 * <p>
 * E rows are emitted grid row by grid row (i-major, j-minor); the builder
 * checks that every block starts at row {@code i*(N-1)} so the constraint row
 * of quad (i,j) is always {@link GridShape#constraintRow(int, int)}.
 * <p>
 * Q is scaled by 2, the Hessian of {@code ||x - g||^2}, to match the
 * right-hand side {@code 2g}; with that, an integrable input comes back
 * unchanged from the solve.
 */
public class CoefficientMatrixBuilder {

	private static final Logger LOGGER = LoggerFactory.getLogger(CoefficientMatrixBuilder.class);

	/** Weight of the quadratic block in the augmented matrix. */
	public static final double OBJECTIVE_WEIGHT = 2.0;

	private final ConstraintBlockAssembler assembler;
	private final Set<GridShape> building = ConcurrentHashMap.newKeySet();

	public CoefficientMatrixBuilder(ConstraintBlockAssembler assembler) {
		this.assembler = assembler;
	}

	/**
	 * Assembles on {@code pool} in batches of
	 * {@link ReconstructionSettings#getColumnBatchSize()} columns.
	 */
	public CoefficientMatrixBuilder(ReconstructionSettings settings, WorkerPool pool) {
		this(new ConstraintBlockAssembler(pool, settings.validate().getColumnBatchSize()));
	}

	/**
	 * Build step driven by {@code settings} alone: runs on a pool of
	 * {@link ReconstructionSettings#getWorkerThreads()} threads that is shut
	 * down afterwards.
	 *
	 * @see #buildAndStore(GridShape, CoefficientMatrixStore)
	 */
	public static boolean buildAndStore(GridShape shape, CoefficientMatrixStore store, ReconstructionSettings settings)
			throws InterruptedException, IOException {
		try (WorkerPool pool = new WorkerPool(settings.validate().getWorkerThreads())) {
			return new CoefficientMatrixBuilder(settings, pool).buildAndStore(shape, store);
		}
	}

	/** The 2MN x 2MN identity. */
	public DMatrixSparseCSC buildQ(GridShape shape) {
		DMatrixSparseCSC q = CommonOps_DSCC.identity(shape.unknownCount());
		LOGGER.info("Built a Q matrix of size ({}, {})", q.numRows, q.numCols);
		return q;
	}

	/** The (M-1)(N-1) x 2MN compatibility block. */
	public DMatrixSparseCSC buildE(GridShape shape) throws InterruptedException {
		return DConvertMatrixStruct.convert(buildConstraintTriplet(shape), (DMatrixSparseCSC) null);
	}

	/** The full augmented matrix in compressed sparse column form. */
	public DMatrixSparseCSC buildA(GridShape shape) throws InterruptedException {
		final int unknowns = shape.unknownCount();
		final int n = shape.systemSize();

		DMatrixSparseCSC q = buildQ(shape);
		DMatrixSparseTriplet e = buildConstraintTriplet(shape);

		DMatrixSparseTriplet atr = new DMatrixSparseTriplet(n, n, shape.nonzeroCount());

		// top-left: weighted identity
		for (int c = 0; c < q.numCols; c++) {
			for (int p = q.col_idx[c]; p < q.col_idx[c + 1]; p++) {
				atr.addItem(q.nz_rows[p], c, OBJECTIVE_WEIGHT * q.nz_values[p]);
			}
		}
		// bottom-left E and top-right E'
		for (int k = 0; k < e.nz_length; k++) {
			int row = e.nz_rowcol.data[2 * k];
			int col = e.nz_rowcol.data[2 * k + 1];
			double val = e.nz_value.data[k];
			atr.addItem(unknowns + row, col, val);
			atr.addItem(col, unknowns + row, val);
		}

		DMatrixSparseCSC a = DConvertMatrixStruct.convert(atr, (DMatrixSparseCSC) null);
		LOGGER.info("Built A for {} grid: {}x{}, {} nonzeros", shape, a.numRows, a.numCols, a.nz_length);
		return a;
	}

	/**
	 * Offline build step: builds A and writes it to {@code store}. Returns false
	 * without rebuilding when the store already holds a matrix for the shape.
	 *
	 * @throws IllegalStateException if another build of the same shape is
	 *                               running on this builder
	 */
	public boolean buildAndStore(GridShape shape, CoefficientMatrixStore store) throws InterruptedException, IOException {
		if (!building.add(shape)) {
			throw new IllegalStateException("Coefficient matrix for " + shape + " is already being built");
		}
		try {
			if (store.contains(shape)) {
				LOGGER.info("Coefficient matrix for {} already present, not rebuilding", shape);
				return false;
			}
			long t0 = System.nanoTime();
			DMatrixSparseCSC a = buildA(shape);
			store.put(shape, a);
			LOGGER.info("Stored coefficient matrix for {} in {} ms", shape, (System.nanoTime() - t0) / 1_000_000);
			return true;
		} finally {
			building.remove(shape);
		}
	}

	private DMatrixSparseTriplet buildConstraintTriplet(GridShape shape) throws InterruptedException {
		DMatrixSparseTriplet e = new DMatrixSparseTriplet(shape.constraintCount(), shape.unknownCount(),
				Math.multiplyExact(shape.constraintCount(), CompatibilityEquation.TERMS));

		int rowOffset = 0;
		for (int i = 0; i < shape.rows - 1; i++) {
			LOGGER.info("Building E matrix for i={}", i);
			if (rowOffset != shape.constraintRow(i, 0)) {
				throw new IllegalStateException("E block for i=" + i + " would start at row " + rowOffset + ", expected "
						+ shape.constraintRow(i, 0));
			}
			DMatrixSparseTriplet block = assembler.assembleRow(i, shape);
			for (int k = 0; k < block.nz_length; k++) {
				e.addItem(rowOffset + block.nz_rowcol.data[2 * k], block.nz_rowcol.data[2 * k + 1], block.nz_value.data[k]);
			}
			rowOffset += block.numRows;
		}
		if (rowOffset != shape.constraintCount()) {
			throw new IllegalStateException("E has " + rowOffset + " rows, expected " + shape.constraintCount());
		}
		return e;
	}
}
