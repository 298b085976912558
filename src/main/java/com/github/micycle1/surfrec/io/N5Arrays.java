package com.github.micycle1.surfrec.io;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import java.util.UUID;

import org.janelia.saalfeldlab.n5.DataBlock;
import org.janelia.saalfeldlab.n5.DataType;
import org.janelia.saalfeldlab.n5.DatasetAttributes;
import org.janelia.saalfeldlab.n5.DoubleArrayDataBlock;
import org.janelia.saalfeldlab.n5.FloatArrayDataBlock;
import org.janelia.saalfeldlab.n5.GzipCompression;
import org.janelia.saalfeldlab.n5.IntArrayDataBlock;
import org.janelia.saalfeldlab.n5.N5Reader;
import org.janelia.saalfeldlab.n5.N5Writer;

/**
 * Plain Java arrays as gzip-compressed N5 datasets, and write-once
 * publication of N5 groups on a file system container.
 * <p>
 * A 2-D array of M rows and N columns is stored with dimensions {@code (N, M)},
 * the fastest-varying dimension first, in blocks of whole rows.
 */
public final class N5Arrays {

	/** Upper bound on the number of elements in one block. */
	static final int BLOCK_ELEMENTS = 1 << 18;

	/** Container-relative group under which groups are written before publication. */
	static final String STAGING = ".staging";

	private N5Arrays() {
	}

	/**
	 * Writes a group through {@link #writeOnce}.
	 */
	@FunctionalInterface
	public interface GroupWriter {
		void write(N5Writer n5, String group) throws IOException;
	}

	/**
	 * Writes a group under a unique staging path, then publishes it as
	 * {@code group} with one directory rename. A reader never sees a partial
	 * group. A rename onto a non-empty directory fails and a published group is
	 * never empty, so of two concurrent writers of the same group exactly one
	 * succeeds. The staging group is removed on failure.
	 *
	 * @param root file system path of the container {@code n5} writes to
	 * @throws FileAlreadyExistsException if {@code group} exists
	 */
	public static void writeOnce(N5Writer n5, Path root, String group, GroupWriter writer) throws IOException {
		if (n5.exists(group)) {
			throw new FileAlreadyExistsException(root.resolve(group).toString());
		}
		final String staging = STAGING + "/" + group.replace('/', '_') + "-" + UUID.randomUUID();
		try {
			writer.write(n5, staging);
			publish(root.resolve(staging), root.resolve(group));
		} finally {
			if (n5.exists(staging)) {
				n5.remove(staging);
			}
		}
	}

	private static void publish(Path source, Path target) throws IOException {
		Files.createDirectories(target.getParent());
		try {
			Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
		} catch (FileSystemException e) {
			if (Files.isDirectory(target)) {
				FileAlreadyExistsException exists = new FileAlreadyExistsException(target.toString());
				exists.initCause(e);
				throw exists;
			}
			throw e;
		}
	}

	/**
	 * Number of columns of a rectangular, non-empty array.
	 *
	 * @throws IllegalArgumentException if {@code a} is empty or ragged
	 */
	public static int requireRectangular(String name, float[][] a) {
		if (a == null || a.length == 0 || a[0] == null || a[0].length == 0) {
			throw new IllegalArgumentException("Array '" + name + "' is empty");
		}
		final int cols = a[0].length;
		for (int i = 1; i < a.length; i++) {
			if (a[i] == null || a[i].length != cols) {
				throw new IllegalArgumentException("Array '" + name + "' is ragged at row " + i);
			}
		}
		return cols;
	}

	public static void writeFloatMatrix(N5Writer n5, String dataset, float[][] a) {
		final int rows = a.length;
		final int cols = requireRectangular(dataset, a);
		final int band = Math.max(1, Math.min(rows, BLOCK_ELEMENTS / cols));
		n5.createDataset(dataset, new long[] { cols, rows }, new int[] { cols, band }, DataType.FLOAT32, new GzipCompression());
		final DatasetAttributes attributes = n5.getDatasetAttributes(dataset);

		for (int b = 0; (long) b * band < rows; b++) {
			final int first = b * band;
			final int height = Math.min(band, rows - first);
			final float[] data = new float[height * cols];
			for (int i = 0; i < height; i++) {
				System.arraycopy(a[first + i], 0, data, i * cols, cols);
			}
			n5.writeBlock(dataset, attributes, new FloatArrayDataBlock(new int[] { cols, height }, new long[] { 0, b }, data));
		}
	}

	public static float[][] readFloatMatrix(N5Reader n5, String dataset) throws IOException {
		final DatasetAttributes attributes = require(n5, dataset, DataType.FLOAT32, 2);
		final int cols = Math.toIntExact(attributes.getDimensions()[0]);
		final int rows = Math.toIntExact(attributes.getDimensions()[1]);
		final int band = attributes.getBlockSize()[1];

		final float[][] a = new float[rows][cols];
		for (int b = 0; (long) b * band < rows; b++) {
			final int first = b * band;
			final int height = Math.min(band, rows - first);
			final float[] data = (float[]) readBlock(n5, dataset, attributes, height * cols, 0, b).getData();
			for (int i = 0; i < height; i++) {
				System.arraycopy(data, i * cols, a[first + i], 0, cols);
			}
		}
		return a;
	}

	/** Writes the first {@code length} entries of {@code values}. */
	public static void writeInts(N5Writer n5, String dataset, int[] values, int length) {
		final int block = blockLength(length);
		n5.createDataset(dataset, new long[] { length }, new int[] { block }, DataType.INT32, new GzipCompression());
		final DatasetAttributes attributes = n5.getDatasetAttributes(dataset);
		for (int b = 0; (long) b * block < length; b++) {
			final int first = b * block;
			final int[] data = Arrays.copyOfRange(values, first, Math.min(length, first + block));
			n5.writeBlock(dataset, attributes, new IntArrayDataBlock(new int[] { data.length }, new long[] { b }, data));
		}
	}

	public static int[] readInts(N5Reader n5, String dataset) throws IOException {
		final DatasetAttributes attributes = require(n5, dataset, DataType.INT32, 1);
		final int length = Math.toIntExact(attributes.getDimensions()[0]);
		final int block = attributes.getBlockSize()[0];
		final int[] values = new int[length];
		for (int b = 0; (long) b * block < length; b++) {
			final int first = b * block;
			final int n = Math.min(block, length - first);
			System.arraycopy((int[]) readBlock(n5, dataset, attributes, n, b).getData(), 0, values, first, n);
		}
		return values;
	}

	/** Writes the first {@code length} entries of {@code values}. */
	public static void writeDoubles(N5Writer n5, String dataset, double[] values, int length) {
		final int block = blockLength(length);
		n5.createDataset(dataset, new long[] { length }, new int[] { block }, DataType.FLOAT64, new GzipCompression());
		final DatasetAttributes attributes = n5.getDatasetAttributes(dataset);
		for (int b = 0; (long) b * block < length; b++) {
			final int first = b * block;
			final double[] data = Arrays.copyOfRange(values, first, Math.min(length, first + block));
			n5.writeBlock(dataset, attributes, new DoubleArrayDataBlock(new int[] { data.length }, new long[] { b }, data));
		}
	}

	public static double[] readDoubles(N5Reader n5, String dataset) throws IOException {
		final DatasetAttributes attributes = require(n5, dataset, DataType.FLOAT64, 1);
		final int length = Math.toIntExact(attributes.getDimensions()[0]);
		final int block = attributes.getBlockSize()[0];
		final double[] values = new double[length];
		for (int b = 0; (long) b * block < length; b++) {
			final int first = b * block;
			final int n = Math.min(block, length - first);
			System.arraycopy((double[]) readBlock(n5, dataset, attributes, n, b).getData(), 0, values, first, n);
		}
		return values;
	}

	private static int blockLength(int length) {
		return Math.max(1, Math.min(length, BLOCK_ELEMENTS));
	}

	private static DatasetAttributes require(N5Reader n5, String dataset, DataType type, int numDimensions) throws IOException {
		final DatasetAttributes attributes = n5.getDatasetAttributes(dataset);
		if (attributes == null) {
			throw new IOException("No dataset " + dataset);
		}
		if (attributes.getDataType() != type || attributes.getNumDimensions() != numDimensions) {
			throw new IOException("Dataset " + dataset + " is " + attributes.getNumDimensions() + "-D " + attributes.getDataType()
					+ ", expected " + numDimensions + "-D " + type);
		}
		return attributes;
	}

	private static DataBlock<?> readBlock(N5Reader n5, String dataset, DatasetAttributes attributes, int expectedElements,
			long... gridPosition) throws IOException {
		final DataBlock<?> block = n5.readBlock(dataset, attributes, gridPosition);
		if (block == null) {
			throw new IOException("Missing block " + Arrays.toString(gridPosition) + " of " + dataset);
		}
		if (block.getNumElements() != expectedElements) {
			throw new IOException("Block " + Arrays.toString(gridPosition) + " of " + dataset + " holds " + block.getNumElements()
					+ " elements, expected " + expectedElements);
		}
		return block;
	}
}
