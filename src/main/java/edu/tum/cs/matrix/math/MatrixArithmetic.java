package edu.tum.cs.matrix.math;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.logging.Logger;

import com.google.common.base.Function;
import com.google.common.base.Optional;

import edu.tum.cs.matrix.Matrix;
import edu.tum.cs.matrix.MatrixIndexException;

/**
 * Scalar and matrix arithmetic over an element type. Every operation returns a new matrix with its own storage and
 * the {@link Arithmetic#zero() zero} of the element type as default value; the operands are never modified.
 * <p>
 * Operations on two matrices return an absent result if the shapes of the operands do not fit, and reject
 * unallocated operands with an {@link IllegalArgumentException}.
 */
public class MatrixArithmetic<T> {

	private static final Logger logger = Logger.getLogger(MatrixArithmetic.class.getName());

	private final Arithmetic<T> arithmetic;

	public MatrixArithmetic(Arithmetic<T> arithmetic) {
		this.arithmetic = arithmetic;
	}

	public Arithmetic<T> getArithmetic() {
		return arithmetic;
	}

	/** m + v */
	public Matrix<T> addScalar(Matrix<T> m, final T v) {
		return m.map(new Function<T, T>() {
			@Override
			public T apply(T x) {
				return arithmetic.add(x, v);
			}
		}, arithmetic.zero());
	}

	/** m - v */
	public Matrix<T> subtractScalar(Matrix<T> m, final T v) {
		return m.map(new Function<T, T>() {
			@Override
			public T apply(T x) {
				return arithmetic.subtract(x, v);
			}
		}, arithmetic.zero());
	}

	/** m * v */
	public Matrix<T> multiplyScalar(Matrix<T> m, final T v) {
		return m.map(new Function<T, T>() {
			@Override
			public T apply(T x) {
				return arithmetic.multiply(x, v);
			}
		}, arithmetic.zero());
	}

	/** m / v */
	public Matrix<T> divideScalar(Matrix<T> m, final T v) {
		return m.map(new Function<T, T>() {
			@Override
			public T apply(T x) {
				return arithmetic.divide(x, v);
			}
		}, arithmetic.zero());
	}

	/**
	 * Elementwise sum.
	 *
	 * @return a + b, or absent if the shapes of a and b differ
	 */
	public Optional<Matrix<T>> matrixAdd(Matrix<T> a, Matrix<T> b) {
		if (!checkSameShape("add", a, b))
			return Optional.absent();

		List<T> result = new ArrayList<T>(a.internalSize());
		Iterator<T> itB = b.values().iterator();
		for (T x : a.values())
			result.add(arithmetic.add(x, itB.next()));
		return Optional.of(Matrix.fromValues(a.getNumRows(), a.getNumColumns(), result, arithmetic.zero()));
	}

	/**
	 * Elementwise difference.
	 *
	 * @return a - b, or absent if the shapes of a and b differ
	 */
	public Optional<Matrix<T>> matrixSubtract(Matrix<T> a, Matrix<T> b) {
		if (!checkSameShape("subtract", a, b))
			return Optional.absent();

		List<T> result = new ArrayList<T>(a.internalSize());
		Iterator<T> itB = b.values().iterator();
		for (T x : a.values())
			result.add(arithmetic.subtract(x, itB.next()));
		return Optional.of(Matrix.fromValues(a.getNumRows(), a.getNumColumns(), result, arithmetic.zero()));
	}

	private boolean checkSameShape(String op, Matrix<T> a, Matrix<T> b) {
		if (!a.hasSameShape(b)) {
			logger.fine("cannot " + op + " " + shapeOf(a) + " and " + shapeOf(b) + " matrix");
			return false;
		}
		checkAllocated(op, a, b);
		return true;
	}

	private static void checkAllocated(String op, Matrix<?> a, Matrix<?> b) {
		if (!a.isAllocated() || !b.isAllocated())
			throw new IllegalArgumentException("cannot " + op + " unallocated matrix");
	}

	/**
	 * Matrix product.
	 *
	 * @return a * b with shape <code>a.numRows x b.numColumns</code>, or absent if the number of columns of a
	 * 	differs from the number of rows of b
	 */
	public Optional<Matrix<T>> matrixMultiply(Matrix<T> a, Matrix<T> b) {
		if (a.getNumColumns() != b.getNumRows()) {
			logger.fine("cannot multiply " + shapeOf(a) + " and " + shapeOf(b) + " matrix");
			return Optional.absent();
		}
		checkAllocated("multiply", a, b);

		int n = a.getNumRows();
		int m = b.getNumColumns();
		int common = a.getNumColumns();
		Matrix<T> result = Matrix.filled(n, m, arithmetic.zero());
		try {
			for (int i = 0; i < n; i++) {
				for (int j = 0; j < m; j++) {
					for (int k = 0; k < common; k++) {
						final T prod = arithmetic.multiply(a.getOrDefault(i, k), b.getOrDefault(k, j));
						result.apply(i, j, new Function<T, T>() {
							@Override
							public T apply(T x) {
								return arithmetic.add(x, prod);
							}
						});
					}
				}
			}
		} catch (MatrixIndexException ex) {
			// result is allocated with the full target shape
			throw new IllegalStateException(ex);
		}
		return Optional.of(result);
	}

	private static String shapeOf(Matrix<?> m) {
		return m.getNumRows() + "x" + m.getNumColumns();
	}

}
