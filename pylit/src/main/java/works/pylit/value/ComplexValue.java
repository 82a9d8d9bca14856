package works.pylit.value;

import works.pylit.PyLiteral;

/**
 * Python {@code complex}: a pair of doubles.
 */
public record ComplexValue(double real, double imag) implements PyValue {
	public static ComplexValue imaginary(double imag) {
		return new ComplexValue(0.0, imag);
	}

	/**
	 * Flips the sign of both parts, as Python's unary minus does.
	 */
	public ComplexValue negate() {
		return new ComplexValue(-real, -imag);
	}

	@Override
	public Kind kind() {
		return Kind.COMPLEX;
	}

	@Override
	public String toString() {
		return PyLiteral.format(this);
	}
}
