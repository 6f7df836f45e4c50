package edu.tum.cs.matrix.math;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;

import com.google.common.primitives.Doubles;

import edu.tum.cs.matrix.Matrix;

/**
 * Conversion between {@link Matrix} and Commons Math {@link RealMatrix}.
 */
public class RealMatrices {

	/**
	 * Copies a numeric matrix into a new {@link Array2DRowRealMatrix}.
	 *
	 * @throws IllegalArgumentException if the matrix is unallocated or has no elements
	 */
	public static Array2DRowRealMatrix toRealMatrix(Matrix<? extends Number> m) {
		if (!m.isAllocated() || (m.internalSize() == 0))
			throw new IllegalArgumentException("cannot convert empty or unallocated " + m.getNumRows() + "x" +
					m.getNumColumns() + " matrix");

		double[][] data = new double[m.getNumRows()][];
		int i = 0;
		for (List<? extends Number> row : m.rows())
			data[i++] = Doubles.toArray(row);
		return new Array2DRowRealMatrix(data, false);
	}

	public static Matrix<Double> fromRealMatrix(RealMatrix m) {
		List<Double> values = new ArrayList<Double>(m.getRowDimension() * m.getColumnDimension());
		for (int i = 0; i < m.getRowDimension(); i++) {
			for (int j = 0; j < m.getColumnDimension(); j++)
				values.add(m.getEntry(i, j));
		}
		return Matrix.fromValues(m.getRowDimension(), m.getColumnDimension(), values, 0.0);
	}

	private RealMatrices() {
	}

}
