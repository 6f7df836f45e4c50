package edu.tum.cs.matrix.math;

/**
 * Arithmetic operations on an element type. Implementations must not modify their arguments.
 */
public interface Arithmetic<T> {

	/** additive identity, also used as the default value of computed matrices */
	public T zero();

	public T add(T a, T b);

	public T subtract(T a, T b);

	public T multiply(T a, T b);

	public T divide(T a, T b);

}
