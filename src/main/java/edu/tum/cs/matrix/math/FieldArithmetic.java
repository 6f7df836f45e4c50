package edu.tum.cs.matrix.math;

import org.apache.commons.math3.Field;
import org.apache.commons.math3.FieldElement;

/**
 * Arithmetic on the elements of a Commons Math {@link Field}, e.g. <code>FractionField</code> or
 * <code>BigFractionField</code>.
 */
public class FieldArithmetic<T extends FieldElement<T>> implements Arithmetic<T> {

	private final Field<T> field;

	public FieldArithmetic(Field<T> field) {
		this.field = field;
	}

	public static <T extends FieldElement<T>> FieldArithmetic<T> of(Field<T> field) {
		return new FieldArithmetic<T>(field);
	}

	public Field<T> getField() {
		return field;
	}

	@Override
	public T zero() {
		return field.getZero();
	}

	@Override
	public T add(T a, T b) {
		return a.add(b);
	}

	@Override
	public T subtract(T a, T b) {
		return a.subtract(b);
	}

	@Override
	public T multiply(T a, T b) {
		return a.multiply(b);
	}

	@Override
	public T divide(T a, T b) {
		return a.divide(b);
	}

}
