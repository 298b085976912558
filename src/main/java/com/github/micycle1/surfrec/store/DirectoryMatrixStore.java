package com.github.micycle1.surfrec.store;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Path;

import org.ejml.data.DMatrixSparseCSC;
import org.janelia.saalfeldlab.n5.N5FSWriter;
import org.janelia.saalfeldlab.n5.N5Writer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.surfrec.GridShape;
import com.github.micycle1.surfrec.io.N5Arrays;

/**
 * One N5 group per grid shape, {@code A_<M>_<N>}, holding the CSC arrays of
 * the matrix as datasets {@code col_idx}, {@code nz_rows} (INT32) and
 * {@code nz_values} (FLOAT64).
 * <p>
 * A group is written under a staging path and renamed into place, so a reader
 * never observes a partially written matrix and concurrent writers of one
 * shape cannot both succeed.
 */
public class DirectoryMatrixStore implements CoefficientMatrixStore {

	private static final Logger LOGGER = LoggerFactory.getLogger(DirectoryMatrixStore.class);

	static final String COL_IDX = "col_idx";
	static final String NZ_ROWS = "nz_rows";
	static final String NZ_VALUES = "nz_values";
	static final String NUM_ROWS = "numRows";
	static final String NUM_COLS = "numCols";
	static final String INDICES_SORTED = "indicesSorted";

	private final Path directory;
	private final N5Writer n5;

	public DirectoryMatrixStore(Path directory) {
		this.directory = directory;
		this.n5 = new N5FSWriter(directory.toString());
	}

	public static String groupFor(GridShape shape) {
		return String.format("A_%d_%d", shape.rows, shape.cols);
	}

	@Override
	public DMatrixSparseCSC get(GridShape shape) throws MissingCoefficientMatrixException, IOException {
		final String group = groupFor(shape);
		if (!contains(shape)) {
			throw new MissingCoefficientMatrixException(shape, directory.resolve(group).toString());
		}
		final Integer rows = n5.getAttribute(group, NUM_ROWS, Integer.class);
		final Integer cols = n5.getAttribute(group, NUM_COLS, Integer.class);
		final Boolean sorted = n5.getAttribute(group, INDICES_SORTED, Boolean.class);
		if (rows == null || cols == null) {
			throw new IOException("Coefficient matrix " + group + " in " + directory + " has no size attributes");
		}
		final int[] colIdx = N5Arrays.readInts(n5, group + "/" + COL_IDX);
		final int[] nzRows = N5Arrays.readInts(n5, group + "/" + NZ_ROWS);
		final double[] nzValues = N5Arrays.readDoubles(n5, group + "/" + NZ_VALUES);
		final int nz = nzValues.length;
		if (colIdx.length != cols + 1 || nzRows.length != nz || colIdx[cols] != nz) {
			throw new IOException("Corrupt coefficient matrix " + group + ": " + colIdx.length + " column pointers, "
					+ nzRows.length + " row indices, " + nz + " values");
		}

		final DMatrixSparseCSC m = new DMatrixSparseCSC(rows, cols, 0);
		m.col_idx = colIdx;
		m.nz_rows = nzRows;
		m.nz_values = nzValues;
		m.nz_length = nz;
		m.indicesSorted = sorted != null && sorted;
		CoefficientMatrixStore.requireSystemSize(shape, m);
		LOGGER.info("Loaded coefficient matrix {} ({} nonzeros)", group, m.nz_length);
		return m;
	}

	/**
	 * @throws IllegalStateException if a matrix is already stored for
	 *                               {@code shape}, including one stored by a
	 *                               concurrent writer
	 */
	@Override
	public void put(GridShape shape, DMatrixSparseCSC matrix) throws IOException {
		CoefficientMatrixStore.requireSystemSize(shape, matrix);
		final String group = groupFor(shape);
		try {
			N5Arrays.writeOnce(n5, directory, group, (writer, staging) -> {
				N5Arrays.writeInts(writer, staging + "/" + COL_IDX, matrix.col_idx, matrix.numCols + 1);
				N5Arrays.writeInts(writer, staging + "/" + NZ_ROWS, matrix.nz_rows, matrix.nz_length);
				N5Arrays.writeDoubles(writer, staging + "/" + NZ_VALUES, matrix.nz_values, matrix.nz_length);
				writer.setAttribute(staging, NUM_ROWS, matrix.numRows);
				writer.setAttribute(staging, NUM_COLS, matrix.numCols);
				writer.setAttribute(staging, INDICES_SORTED, matrix.indicesSorted);
			});
		} catch (FileAlreadyExistsException e) {
			throw new IllegalStateException("Coefficient matrix already stored at " + e.getFile(), e);
		}
		LOGGER.info("Wrote coefficient matrix {} to {}", group, directory);
	}

	@Override
	public boolean contains(GridShape shape) {
		return n5.datasetExists(groupFor(shape) + "/" + NZ_VALUES);
	}
}
