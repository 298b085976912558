package com.github.micycle1.surfrec.linalg;

/**
 * A factorization or solve failed numerically: singular or near-singular
 * matrix, non-finite solution, or a residual above tolerance. Distinct from a
 * missing coefficient matrix, which means the matrix needs building.
 */
public class FactorizationException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public FactorizationException(String message) {
		super(message);
	}

	public FactorizationException(String message, Throwable cause) {
		super(message, cause);
	}
}
