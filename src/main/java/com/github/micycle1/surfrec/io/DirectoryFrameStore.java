package com.github.micycle1.surfrec.io;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import org.janelia.saalfeldlab.n5.N5FSWriter;
import org.janelia.saalfeldlab.n5.N5Writer;

/**
 * Frames as groups of an N5 container on the file system: one group per frame
 * and one FLOAT32 dataset per array. The group attribute {@value #ARRAYS}
 * keeps the order the arrays were written in.
 */
public class DirectoryFrameStore implements FrameStore {

	public static final String ARRAYS = "arrays";

	private final Path directory;
	private final N5Writer n5;

	public DirectoryFrameStore(Path directory) {
		this.directory = directory;
		this.n5 = new N5FSWriter(directory.toString());
	}

	@Override
	public boolean exists(String name) {
		return n5.exists(name);
	}

	@Override
	public boolean exists(String name, String array) {
		return n5.datasetExists(name + "/" + array);
	}

	@Override
	public Map<String, float[][]> read(String name) throws IOException {
		if (!n5.exists(name)) {
			throw new NoSuchFileException(directory.resolve(name).toString());
		}
		final String[] names = n5.getAttribute(name, ARRAYS, String[].class);
		if (names == null) {
			throw new IOException("Group " + name + " in " + directory + " has no '" + ARRAYS + "' attribute");
		}
		final Map<String, float[][]> arrays = new LinkedHashMap<>();
		for (String array : names) {
			arrays.put(array, N5Arrays.readFloatMatrix(n5, name + "/" + array));
		}
		return arrays;
	}

	@Override
	public void write(String name, Map<String, float[][]> arrays) throws IOException {
		for (Map.Entry<String, float[][]> e : arrays.entrySet()) {
			if (e.getKey().isEmpty() || e.getKey().contains("/")) {
				throw new IllegalArgumentException("Invalid array name '" + e.getKey() + "'");
			}
			N5Arrays.requireRectangular(e.getKey(), e.getValue());
		}
		final String[] names = arrays.keySet().toArray(new String[0]);
		N5Arrays.writeOnce(n5, directory, name, (writer, group) -> {
			writer.createGroup(group);
			for (String array : names) {
				N5Arrays.writeFloatMatrix(writer, group + "/" + array, arrays.get(array));
			}
			writer.setAttribute(group, ARRAYS, names);
		});
	}
}
