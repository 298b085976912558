package com.github.micycle1.surfrec.io;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class DirectoryFrameStoreTest {

	@TempDir
	Path dir;

	private static void assertSameArray(float[][] expected, float[][] actual) {
		assertEquals(expected.length, actual.length);
		for (int i = 0; i < expected.length; i++) {
			assertArrayEquals(expected[i], actual[i]);
		}
	}

	private static float[][] ramp(int rows, int cols, float offset) {
		float[][] a = new float[rows][cols];
		for (int i = 0; i < rows; i++) {
			for (int j = 0; j < cols; j++) {
				a[i][j] = offset + i * cols + j;
			}
		}
		return a;
	}

	@Test
	void writeThenRead() throws Exception {
		DirectoryFrameStore store = new DirectoryFrameStore(dir.resolve("z"));
		Map<String, float[][]> arrays = new LinkedHashMap<>();
		arrays.put("z", new float[][] { { 0, 1.5f }, { -2, 3 } });
		arrays.put("gx", new float[][] { { 7, 8 }, { 9, 10 } });

		assertFalse(store.exists("z_001"));
		store.write("z_001", arrays);
		assertTrue(store.exists("z_001"));
		assertTrue(store.exists("z_001", "gx"));
		assertFalse(store.exists("z_001", "gy"));
		assertTrue(Files.isDirectory(dir.resolve("z").resolve("z_001")));

		Map<String, float[][]> back = new DirectoryFrameStore(dir.resolve("z")).read("z_001");
		assertEquals(List.of("z", "gx"), List.copyOf(back.keySet()));
		for (String name : arrays.keySet()) {
			assertSameArray(arrays.get(name), back.get(name));
		}
	}

	@ParameterizedTest
	@CsvSource({ "1,1", "3,700", "700,3", "600,600" })
	void arraysSpanningSeveralBlocks(int rows, int cols) throws Exception {
		DirectoryFrameStore store = new DirectoryFrameStore(dir);
		float[][] a = ramp(rows, cols, 0.25f);
		store.write("f", Map.of("a", a));
		assertSameArray(a, store.read("f").get("a"));
	}

	@Test
	void existingEntryIsNotOverwritten() throws Exception {
		DirectoryFrameStore store = new DirectoryFrameStore(dir);
		store.write("f", Map.of("a", new float[][] { { 1 } }));

		assertThrows(FileAlreadyExistsException.class, () -> store.write("f", Map.of("a", new float[][] { { 2 } })));
		assertSameArray(new float[][] { { 1 } }, store.read("f").get("a"));
	}

	@Test
	void concurrentWritersOfOneEntryHaveExactlyOneWinner() throws Exception {
		ExecutorService executor = Executors.newFixedThreadPool(2);
		try {
			for (int trial = 0; trial < 20; trial++) {
				DirectoryFrameStore store = new DirectoryFrameStore(dir.resolve("trial" + trial));
				CyclicBarrier start = new CyclicBarrier(2);
				float[][] a = ramp(4, 5, 0f);
				float[][] b = ramp(4, 5, 100f);
				Future<Boolean> first = executor.submit(writer(store, start, a));
				Future<Boolean> second = executor.submit(writer(store, start, b));
				boolean firstWon = first.get(30, TimeUnit.SECONDS);
				boolean secondWon = second.get(30, TimeUnit.SECONDS);

				assertTrue(firstWon ^ secondWon, "trial " + trial);
				assertSameArray(firstWon ? a : b, store.read("f").get("z"));
			}
		} finally {
			executor.shutdownNow();
		}
	}

	private static Callable<Boolean> writer(DirectoryFrameStore store, CyclicBarrier start, float[][] z) {
		return () -> {
			start.await(10, TimeUnit.SECONDS);
			try {
				store.write("f", Map.of("z", z));
				return true;
			} catch (FileAlreadyExistsException e) {
				return false;
			}
		};
	}

	@Test
	void failedWriteLeavesNothing() throws Exception {
		DirectoryFrameStore store = new DirectoryFrameStore(dir);
		Map<String, float[][]> ragged = Map.of("a", new float[][] { { 1, 2 }, { 3 } });
		assertThrows(IllegalArgumentException.class, () -> store.write("bad", ragged));
		assertThrows(IllegalArgumentException.class, () -> store.write("bad", Map.of("a/b", new float[][] { { 1 } })));
		assertFalse(store.exists("bad"));
		assertFalse(Files.exists(dir.resolve("bad")));
	}

	@Test
	void readingMissingEntryFails() {
		DirectoryFrameStore store = new DirectoryFrameStore(dir);
		assertThrows(NoSuchFileException.class, () -> store.read("nope"));
	}
}
