package com.github.micycle1.surfrec.io;

import java.io.IOException;
import java.util.Map;

/**
 * Named groups of 2-D float arrays (one group per frame), e.g. the measured
 * gradients {@code gradz_x}/{@code gradz_y} or a reconstruction
 * {@code z}/{@code gx}/{@code gy}.
 * <p>
 * Writes are all-or-nothing: after a failed write {@link #exists} is still
 * false. An entry that exists is never overwritten.
 */
public interface FrameStore {

	boolean exists(String name);

	/** Whether entry {@code name} holds an array called {@code array}. */
	boolean exists(String name, String array);

	/**
	 * Arrays of entry {@code name} in the order they were written.
	 *
	 * @throws java.nio.file.NoSuchFileException if the entry does not exist
	 */
	Map<String, float[][]> read(String name) throws IOException;

	/**
	 * @throws java.nio.file.FileAlreadyExistsException if the entry exists
	 * @throws IllegalArgumentException                  if an array is empty or
	 *                                                   ragged
	 */
	void write(String name, Map<String, float[][]> arrays) throws IOException;
}
