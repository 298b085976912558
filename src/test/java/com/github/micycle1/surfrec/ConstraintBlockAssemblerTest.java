package com.github.micycle1.surfrec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.ejml.data.DMatrixSparseTriplet;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.github.micycle1.surfrec.concurrent.WorkerPool;

public class ConstraintBlockAssemblerTest {

	private WorkerPool pool;

	@BeforeEach
	void setUp() {
		pool = new WorkerPool(4);
	}

	@AfterEach
	void tearDown() {
		pool.close();
	}

	@ParameterizedTest
	@ValueSource(ints = { 1, 2, 3, 7, 1000 })
	void rowsComeOutInColumnOrderForAnyBatchSize(int batchSize) throws Exception {
		GridShape s = GridShape.of(6, 11);
		ConstraintBlockAssembler assembler = new ConstraintBlockAssembler(pool, batchSize);

		for (int i = 0; i < s.rows - 1; i++) {
			DMatrixSparseTriplet block = assembler.assembleRow(i, s);
			assertEquals(s.cols - 1, block.numRows);
			assertEquals(s.unknownCount(), block.numCols);
			assertEquals(4 * (s.cols - 1), block.nz_length);

			for (int j = 0; j < s.cols - 1; j++) {
				CompatibilityEquation eq = CompatibilityEquation.of(i, j, s);
				for (int k = 0; k < CompatibilityEquation.TERMS; k++) {
					assertEquals(eq.coefficient(k), block.get(j, eq.column(k)), "row " + j + " of block " + i);
				}
			}
		}
	}

	@Test
	void singleColumnGridGivesNoRows() throws Exception {
		ConstraintBlockAssembler assembler = new ConstraintBlockAssembler(pool, 10);
		DMatrixSparseTriplet block = assembler.assembleRow(0, GridShape.of(4, 1));
		assertEquals(0, block.numRows);
		assertEquals(0, block.nz_length);
	}

	@Test
	void sameResultWithOneThread() throws Exception {
		GridShape s = GridShape.of(4, 9);
		try (WorkerPool single = new WorkerPool(1)) {
			DMatrixSparseTriplet a = new ConstraintBlockAssembler(single, 2).assembleRow(2, s);
			DMatrixSparseTriplet b = new ConstraintBlockAssembler(pool, 3).assembleRow(2, s);
			assertEquals(a.nz_length, b.nz_length);
			for (int k = 0; k < 2 * a.nz_length; k++) {
				assertEquals(a.nz_rowcol.data[k], b.nz_rowcol.data[k]);
			}
		}
	}

	@Test
	void rejectsBadArguments() {
		assertThrows(IllegalArgumentException.class, () -> new ConstraintBlockAssembler(pool, 0));
		ConstraintBlockAssembler assembler = new ConstraintBlockAssembler(pool, 5);
		assertThrows(IndexOutOfBoundsException.class, () -> assembler.assembleRow(3, GridShape.of(4, 4)));
	}
}
