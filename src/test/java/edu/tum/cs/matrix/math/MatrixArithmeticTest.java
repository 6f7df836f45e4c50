package edu.tum.cs.matrix.math;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;

import org.apache.commons.math3.fraction.Fraction;
import org.apache.commons.math3.fraction.FractionField;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;
import org.junit.Test;

import com.google.common.base.Function;
import com.google.common.base.Optional;

import edu.tum.cs.matrix.Matrix;

public class MatrixArithmeticTest {

	private static final long seed = 4711L;

	private final MatrixArithmetic<Integer> ints = new MatrixArithmetic<Integer>(Arithmetics.INTEGER);
	private final MatrixArithmetic<Double> doubles = new MatrixArithmetic<Double>(Arithmetics.DOUBLE);

	private static Matrix<Integer> intMatrix(Integer[][] rows) {
		return Matrix.fromRows(rows, 0);
	}

	@Test
	public void testScalarOps() {
		Matrix<Integer> m = intMatrix(new Integer[][] { { 1, 2, 3 }, { 4, 5, 6 } });
		assertEquals(intMatrix(new Integer[][] { { 3, 4, 5 }, { 6, 7, 8 } }), ints.addScalar(m, 2));
		assertEquals(intMatrix(new Integer[][] { { 0, 1, 2 }, { 3, 4, 5 } }), ints.subtractScalar(m, 1));
		assertEquals(intMatrix(new Integer[][] { { 3, 6, 9 }, { 12, 15, 18 } }), ints.multiplyScalar(m, 3));
		assertEquals(intMatrix(new Integer[][] { { 0, 1, 1 }, { 2, 2, 3 } }), ints.divideScalar(m, 2));

		Matrix<Integer> sum = ints.addScalar(m, 10);
		assertArrayEquals(m.getShape(), sum.getShape());
		assertEquals(Integer.valueOf(0), sum.getDefaultValue());
		// operand is left untouched
		assertEquals(intMatrix(new Integer[][] { { 1, 2, 3 }, { 4, 5, 6 } }), m);
	}

	@Test(expected = ArithmeticException.class)
	public void testIntegerDivisionByZero() {
		ints.divideScalar(intMatrix(new Integer[][] { { 1 } }), 0);
	}

	@Test
	public void testMatrixAdd() {
		Matrix<Integer> a = intMatrix(new Integer[][] { { 1, 2 }, { 3, 4 } });
		Matrix<Integer> b = intMatrix(new Integer[][] { { 10, 20 }, { 30, 40 } });
		Optional<Matrix<Integer>> sum = ints.matrixAdd(a, b);
		assertTrue(sum.isPresent());
		assertEquals(intMatrix(new Integer[][] { { 11, 22 }, { 33, 44 } }), sum.get());

		Optional<Matrix<Integer>> diff = ints.matrixSubtract(b, a);
		assertEquals(intMatrix(new Integer[][] { { 9, 18 }, { 27, 36 } }), diff.get());
	}

	@Test
	public void testAddZero() {
		Matrix<Double> zero = Matrix.filled(3, 5, 0.0);
		Matrix<Double> sum = doubles.matrixAdd(zero, Matrix.filled(3, 5, 0.0)).get();
		assertArrayEquals(new int[] { 3, 5 }, sum.getShape());
		for (Double v : sum.values())
			assertEquals(0.0, v, 0.0);
	}

	@Test
	public void testShapeMismatch() {
		Matrix<Integer> a = Matrix.filled(2, 2, 1);
		Matrix<Integer> b = Matrix.filled(3, 2, 1);
		assertFalse(ints.matrixAdd(a, b).isPresent());
		assertFalse(ints.matrixSubtract(a, b).isPresent());
		assertFalse(ints.matrixAdd(Matrix.filled(1, 4, 1), Matrix.filled(4, 1, 1)).isPresent());
		// 2x2 * 3x2: inner dimensions differ
		assertFalse(ints.matrixMultiply(a, b).isPresent());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testAddUnallocated() {
		ints.matrixAdd(Matrix.filled(2, 2, 0), Matrix.unallocated(2, 2, 0));
	}

	@Test
	public void testMatrixMultiply() {
		Matrix<Integer> a = intMatrix(new Integer[][] { { 1, 2, 3 }, { 4, 5, 6 } });
		Matrix<Integer> b = intMatrix(new Integer[][] { { 7, 8 }, { 9, 10 }, { 11, 12 } });
		Matrix<Integer> c = ints.matrixMultiply(a, b).get();
		assertArrayEquals(new int[] { 2, 2 }, c.getShape());
		assertEquals(intMatrix(new Integer[][] { { 58, 64 }, { 139, 154 } }), c);

		Matrix<Integer> d = ints.matrixMultiply(b, a).get();
		assertArrayEquals(new int[] { 3, 3 }, d.getShape());
		assertEquals(Arrays.asList(39, 54, 69, 49, 68, 87, 59, 82, 105), d.values());

		// operands are left untouched
		assertEquals(intMatrix(new Integer[][] { { 1, 2, 3 }, { 4, 5, 6 } }), a);
	}

	@Test
	public void testMultiplyIdentity() {
		Matrix<Integer> m = intMatrix(new Integer[][] { { 2, -1 }, { 0, 3 } });
		Matrix<Integer> identity = intMatrix(new Integer[][] { { 1, 0 }, { 0, 1 } });
		assertEquals(m, ints.matrixMultiply(m, identity).get());
		assertEquals(m, ints.matrixMultiply(identity, m).get());
	}

	@Test
	public void testMultiplyEmptyInner() {
		Matrix<Integer> c = ints.matrixMultiply(Matrix.filled(2, 0, 5), Matrix.filled(0, 3, 5)).get();
		assertArrayEquals(new int[] { 2, 3 }, c.getShape());
		assertEquals(Arrays.asList(0, 0, 0, 0, 0, 0), c.values());
	}

	@Test
	public void testMultiplyAgainstRealMatrix() {
		UniformRandomProvider rand = RandomSource.XO_RO_SHI_RO_128_PP.create(seed);
		Matrix<Double> a = Matrix.filled(7, 4, 0.0);
		Matrix<Double> b = Matrix.filled(4, 5, 0.0);
		a = a.map(new RandomValues(rand));
		b = b.map(new RandomValues(rand));

		RealMatrix expected = RealMatrices.toRealMatrix(a).multiply(RealMatrices.toRealMatrix(b));
		Matrix<Double> actual = doubles.matrixMultiply(a, b).get();
		assertEquals(expected.getRowDimension(), actual.getNumRows());
		assertEquals(expected.getColumnDimension(), actual.getNumColumns());
		for (int i = 0; i < actual.getNumRows(); i++)
			for (int j = 0; j < actual.getNumColumns(); j++)
				assertEquals(i + "x" + j, expected.getEntry(i, j), actual.getOrDefault(i, j), 1e-9);

		Array2DRowRealMatrix sum = RealMatrices.toRealMatrix(a).add(RealMatrices.toRealMatrix(a));
		assertEquals(RealMatrices.fromRealMatrix(sum), doubles.matrixAdd(a, a).get());
	}

	private static class RandomValues implements Function<Double, Double> {
		private final UniformRandomProvider rand;

		public RandomValues(UniformRandomProvider rand) {
			this.rand = rand;
		}

		@Override
		public Double apply(Double x) {
			return rand.nextDouble() * 10.0 - 5.0;
		}
	}

	@Test
	public void testFractions() {
		MatrixArithmetic<Fraction> fractions = new MatrixArithmetic<Fraction>(
				FieldArithmetic.of(FractionField.getInstance()));
		Matrix<Fraction> m = Matrix.fromRows(new Fraction[][] {
				{ new Fraction(1, 2), new Fraction(1, 3) },
				{ new Fraction(2, 3), Fraction.ONE } }, Fraction.ZERO);

		Matrix<Fraction> halved = fractions.divideScalar(m, new Fraction(2));
		assertEquals(new Fraction(1, 4), halved.getOrDefault(0, 0));
		assertEquals(new Fraction(1, 2), halved.getOrDefault(1, 1));

		Matrix<Fraction> square = fractions.matrixMultiply(m, m).get();
		// 1/4 + 2/9, 1/6 + 1/3, 1/3 + 2/3, 2/9 + 1
		assertEquals(new Fraction(17, 36), square.getOrDefault(0, 0));
		assertEquals(new Fraction(1, 2), square.getOrDefault(0, 1));
		assertEquals(Fraction.ONE, square.getOrDefault(1, 0));
		assertEquals(new Fraction(11, 9), square.getOrDefault(1, 1));
		assertEquals(Fraction.ZERO, square.getDefaultValue());
	}

	@Test
	public void testBigNumbers() {
		MatrixArithmetic<BigInteger> bigInts = new MatrixArithmetic<BigInteger>(Arithmetics.BIG_INTEGER);
		Matrix<BigInteger> m = Matrix.filled(2, 2, BigInteger.valueOf(Long.MAX_VALUE));
		Matrix<BigInteger> sum = bigInts.matrixAdd(m, m).get();
		assertEquals(BigInteger.valueOf(Long.MAX_VALUE).shiftLeft(1), sum.getOrDefault(1, 1));

		MatrixArithmetic<BigDecimal> decimals = new MatrixArithmetic<BigDecimal>(Arithmetics.BIG_DECIMAL);
		Matrix<BigDecimal> third = decimals.divideScalar(Matrix.filled(1, 1, BigDecimal.ONE), new BigDecimal(3));
		assertEquals(34, third.getOrDefault(0, 0).precision());

		MatrixArithmetic<Long> longs = new MatrixArithmetic<Long>(Arithmetics.LONG);
		assertEquals(Long.valueOf(6L), longs.multiplyScalar(Matrix.filled(1, 1, 2L), 3L).getOrDefault(0, 0));
	}

}
