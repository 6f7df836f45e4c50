package edu.tum.cs.matrix;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

import com.google.common.base.Function;
import com.google.common.base.Objects;
import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

/**
 * Dense matrix of arbitrary element type, stored in a flat buffer in row-major order: the element at (row, column)
 * lives at offset <code>row * numColumns + column</code>.
 * <p>
 * Every matrix carries the default value of its element type, which is used to pad freshly allocated cells and as
 * the fallback of {@link #getOrDefault(int, int)}. Elements and default values must not be null.
 * <p>
 * A matrix obtained from {@link #unallocated(int, int, Object)} declares a shape but stores no elements until
 * {@link #allocate()} is called. All reads on such a matrix report absent values and all writes fail.
 * <p>
 * Instances are not thread-safe.
 */
public class Matrix<T> {

	private static final Logger logger = Logger.getLogger(Matrix.class.getName());

	private final int numRows;
	private final int numColumns;
	private final T defaultValue;
	private final ArrayList<T> data;

	private Matrix(int numRows, int numColumns, T defaultValue, ArrayList<T> data) {
		this.numRows = numRows;
		this.numColumns = numColumns;
		this.defaultValue = Preconditions.checkNotNull(defaultValue, "default value must not be null");
		this.data = data;
	}

	/**
	 * Creates a deep copy of another matrix. Elements are shared, the buffer is not.
	 */
	public Matrix(Matrix<? extends T> other) {
		this(other.numRows, other.numColumns, other.defaultValue, new ArrayList<T>(other.data));
	}

	/**
	 * Declares a shape without storing any element. The matrix has to be {@link #allocate() allocated} before it
	 * can be used.
	 */
	public static <T> Matrix<T> unallocated(int numRows, int numColumns, T defaultValue) {
		checkShape(numRows, numColumns);
		return new Matrix<T>(numRows, numColumns, defaultValue, new ArrayList<T>());
	}

	/**
	 * Creates a matrix of the given shape with every cell set to <code>defaultValue</code>.
	 */
	public static <T> Matrix<T> filled(int numRows, int numColumns, T defaultValue) {
		checkShape(numRows, numColumns);
		return new Matrix<T>(numRows, numColumns, defaultValue,
				new ArrayList<T>(Collections.nCopies(numRows * numColumns, defaultValue)));
	}

	/**
	 * Creates a matrix from a list of rows. The number of columns is taken from the first row.
	 *
	 * @throws IllegalArgumentException if no rows are given or if any row differs in length from the first one
	 */
	public static <T> Matrix<T> fromRows(List<? extends List<? extends T>> rows, T defaultValue) {
		if (rows.isEmpty())
			throw new IllegalArgumentException("cannot build a matrix from zero rows");

		int numColumns = rows.get(0).size();
		ArrayList<T> data = new ArrayList<T>(rows.size() * numColumns);
		int rowIdx = 0;
		for (List<? extends T> row : rows) {
			if (row.size() != numColumns)
				throw new IllegalArgumentException("row " + rowIdx + " has " + row.size() + " columns, expected " +
						numColumns);
			int colIdx = 0;
			for (T value : row)
				data.add(Preconditions.checkNotNull(value, "null element at (%s, %s)", rowIdx, colIdx++));
			rowIdx++;
		}
		return new Matrix<T>(rows.size(), numColumns, defaultValue, data);
	}

	public static <T> Matrix<T> fromRows(T[][] rows, T defaultValue) {
		List<List<T>> rowList = new ArrayList<List<T>>(rows.length);
		for (T[] row : rows)
			rowList.add(Arrays.asList(row));
		return fromRows(rowList, defaultValue);
	}

	/**
	 * Creates a matrix of the given shape from values in row-major order.
	 *
	 * @throws IllegalArgumentException if the number of values does not match the shape
	 */
	public static <T> Matrix<T> fromValues(int numRows, int numColumns, List<? extends T> values, T defaultValue) {
		checkShape(numRows, numColumns);
		if (values.size() != (numRows * numColumns))
			throw new IllegalArgumentException("got " + values.size() + " values for a " + numRows + "x" +
					numColumns + " matrix");
		ArrayList<T> data = new ArrayList<T>(values.size());
		for (T value : values)
			data.add(Preconditions.checkNotNull(value, "null element at offset %s", data.size()));
		return new Matrix<T>(numRows, numColumns, defaultValue, data);
	}

	private static void checkShape(int numRows, int numColumns) {
		if ((numRows < 0) || (numColumns < 0))
			throw new IllegalArgumentException("invalid shape " + numRows + "x" + numColumns);
		if (((long) numRows * numColumns) > Integer.MAX_VALUE)
			throw new IllegalArgumentException("shape " + numRows + "x" + numColumns + " exceeds maximum size");
	}

	public int getNumRows() {
		return numRows;
	}

	public int getNumColumns() {
		return numColumns;
	}

	/**
	 * @return <code>{numRows, numColumns}</code>
	 */
	public int[] getShape() {
		return new int[] { numRows, numColumns };
	}

	public boolean hasSameShape(Matrix<?> other) {
		return (numRows == other.numRows) && (numColumns == other.numColumns);
	}

	public T getDefaultValue() {
		return defaultValue;
	}

	/**
	 * @return number of elements held by the backing buffer; zero for an unallocated matrix
	 */
	public int internalSize() {
		return data.size();
	}

	public boolean isAllocated() {
		return data.size() == (numRows * numColumns);
	}

	/**
	 * Stores the default value in every cell of an unallocated matrix. Has no effect on an allocated one.
	 */
	public Matrix<T> allocate() {
		if (!isAllocated()) {
			logger.fine("allocating " + numRows + "x" + numColumns + " matrix");
			data.addAll(Collections.nCopies(numRows * numColumns, defaultValue));
		}
		return this;
	}

	/**
	 * Maps a coordinate to its offset in the backing buffer. No validation is performed.
	 */
	public int offset(int row, int column) {
		return row * numColumns + column;
	}

	public boolean isInBounds(int row, int column) {
		return (row >= 0) && (row < numRows) && (column >= 0) && (column < numColumns);
	}

	/**
	 * @return the offset of the given cell, or absent if the coordinate is outside the shape or the cell is not
	 * 	stored
	 */
	public Optional<Integer> checkedOffset(int row, int column) {
		if (!isInBounds(row, column))
			return Optional.absent();
		int offset = offset(row, column);
		if (offset >= data.size())
			return Optional.absent();
		return Optional.of(offset);
	}

	public Optional<T> get(int row, int column) {
		Optional<Integer> offset = checkedOffset(row, column);
		if (!offset.isPresent())
			return Optional.absent();
		return Optional.of(data.get(offset.get()));
	}

	public T getOrDefault(int row, int column) {
		return get(row, column).or(defaultValue);
	}

	public Matrix<T> set(int row, int column, T value) throws MatrixIndexException {
		Preconditions.checkNotNull(value, "value must not be null");
		data.set(requireOffset(row, column), value);
		return this;
	}

	/**
	 * Replaces the value of a single cell by the result of applying <code>transform</code> to it.
	 */
	public Matrix<T> apply(int row, int column, Function<? super T, ? extends T> transform)
			throws MatrixIndexException {
		int offset = requireOffset(row, column);
		T value = transform.apply(data.get(offset));
		data.set(offset, Preconditions.checkNotNull(value, "transform returned null"));
		return this;
	}

	private int requireOffset(int row, int column) throws MatrixIndexException {
		Optional<Integer> offset = checkedOffset(row, column);
		if (!offset.isPresent())
			throw new MatrixIndexException(row, column);
		return offset.get();
	}

	public Matrix<T> fill(T value) {
		Preconditions.checkNotNull(value, "value must not be null");
		Collections.fill(data, value);
		return this;
	}

	/**
	 * Applies <code>transform</code> to every element in buffer order and collects the results in a new matrix of
	 * the same shape. This matrix is not modified.
	 *
	 * @param defaultValue default value of the resulting matrix
	 */
	public <R> Matrix<R> map(Function<? super T, ? extends R> transform, R defaultValue) {
		ArrayList<R> result = new ArrayList<R>(data.size());
		for (T value : data)
			result.add(Preconditions.checkNotNull(transform.apply(value), "transform returned null"));
		return new Matrix<R>(numRows, numColumns, defaultValue, result);
	}

	/**
	 * Same as {@link #map(Function, Object)}, keeping the element type and the default value of this matrix.
	 */
	public Matrix<T> map(Function<? super T, ? extends T> transform) {
		return map(transform, defaultValue);
	}

	/**
	 * @return read-only view of all stored elements in row-major order
	 */
	public List<T> values() {
		return Collections.unmodifiableList(data);
	}

	/**
	 * @return a new read-only view of the rows of this matrix, each of length <code>numColumns</code>; empty if the
	 * 	matrix is unallocated
	 */
	public Iterable<List<T>> rows() {
		return rowList();
	}

	public Optional<List<T>> getRow(int row) {
		List<List<T>> rows = rowList();
		if ((row < 0) || (row >= rows.size()))
			return Optional.absent();
		return Optional.of(rows.get(row));
	}

	private List<List<T>> rowList() {
		if (!isAllocated())
			return Collections.emptyList();
		if (numColumns == 0)
			return Collections.nCopies(numRows, Collections.<T>emptyList());
		return Lists.partition(Collections.unmodifiableList(data), numColumns);
	}

	/**
	 * Two matrices are equal if they have the same shape and equal elements. Default values are not compared.
	 */
	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Matrix))
			return false;
		Matrix<?> other = (Matrix<?>) obj;
		return hasSameShape(other) && data.equals(other.data);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(numRows, numColumns, data);
	}

	@Override
	public String toString() {
		return MatrixFormat.getDefault().format(this);
	}

}
