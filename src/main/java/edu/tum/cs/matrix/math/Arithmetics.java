package edu.tum.cs.matrix.math;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;

/**
 * {@link Arithmetic} implementations for the numeric types of the JDK. Integer division truncates and throws
 * {@link ArithmeticException} on division by zero.
 */
public class Arithmetics {

	public static final Arithmetic<Integer> INTEGER = new Arithmetic<Integer>() {
		@Override
		public Integer zero() {
			return 0;
		}

		@Override
		public Integer add(Integer a, Integer b) {
			return a + b;
		}

		@Override
		public Integer subtract(Integer a, Integer b) {
			return a - b;
		}

		@Override
		public Integer multiply(Integer a, Integer b) {
			return a * b;
		}

		@Override
		public Integer divide(Integer a, Integer b) {
			return a / b;
		}
	};

	public static final Arithmetic<Long> LONG = new Arithmetic<Long>() {
		@Override
		public Long zero() {
			return 0L;
		}

		@Override
		public Long add(Long a, Long b) {
			return a + b;
		}

		@Override
		public Long subtract(Long a, Long b) {
			return a - b;
		}

		@Override
		public Long multiply(Long a, Long b) {
			return a * b;
		}

		@Override
		public Long divide(Long a, Long b) {
			return a / b;
		}
	};

	public static final Arithmetic<Double> DOUBLE = new Arithmetic<Double>() {
		@Override
		public Double zero() {
			return 0.0;
		}

		@Override
		public Double add(Double a, Double b) {
			return a + b;
		}

		@Override
		public Double subtract(Double a, Double b) {
			return a - b;
		}

		@Override
		public Double multiply(Double a, Double b) {
			return a * b;
		}

		@Override
		public Double divide(Double a, Double b) {
			return a / b;
		}
	};

	public static final Arithmetic<BigInteger> BIG_INTEGER = new Arithmetic<BigInteger>() {
		@Override
		public BigInteger zero() {
			return BigInteger.ZERO;
		}

		@Override
		public BigInteger add(BigInteger a, BigInteger b) {
			return a.add(b);
		}

		@Override
		public BigInteger subtract(BigInteger a, BigInteger b) {
			return a.subtract(b);
		}

		@Override
		public BigInteger multiply(BigInteger a, BigInteger b) {
			return a.multiply(b);
		}

		@Override
		public BigInteger divide(BigInteger a, BigInteger b) {
			return a.divide(b);
		}
	};

	/** divides with {@link MathContext#DECIMAL128} precision */
	public static final Arithmetic<BigDecimal> BIG_DECIMAL = new Arithmetic<BigDecimal>() {
		@Override
		public BigDecimal zero() {
			return BigDecimal.ZERO;
		}

		@Override
		public BigDecimal add(BigDecimal a, BigDecimal b) {
			return a.add(b);
		}

		@Override
		public BigDecimal subtract(BigDecimal a, BigDecimal b) {
			return a.subtract(b);
		}

		@Override
		public BigDecimal multiply(BigDecimal a, BigDecimal b) {
			return a.multiply(b);
		}

		@Override
		public BigDecimal divide(BigDecimal a, BigDecimal b) {
			return a.divide(b, MathContext.DECIMAL128);
		}
	};

	private Arithmetics() {
	}

}
