package com.github.micycle1.surfrec.store;

import com.github.micycle1.surfrec.GridShape;

/**
 * No coefficient matrix has been built for a grid shape. The matrix must be
 * produced by the explicit build step; solving never rebuilds it implicitly.
 */
public class MissingCoefficientMatrixException extends Exception {

	private static final long serialVersionUID = 1L;

	private final transient GridShape shape;

	public MissingCoefficientMatrixException(GridShape shape, String location) {
		super("No coefficient matrix for M=" + shape.rows + " N=" + shape.cols + " (" + location
				+ "); build it with CoefficientMatrixBuilder.buildAndStore first");
		this.shape = shape;
	}

	public GridShape getShape() {
		return shape;
	}
}
