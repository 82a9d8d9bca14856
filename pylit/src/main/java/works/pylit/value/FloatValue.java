package works.pylit.value;

import works.pylit.PyLiteral;

/**
 * Python {@code float}.
 * Record equality on a {@code double} component compares bit patterns,
 * which is the rule we want for set and dict membership.
 */
public record FloatValue(double value) implements PyValue {
	public FloatValue negate() {
		return new FloatValue(-value);
	}

	@Override
	public Kind kind() {
		return Kind.FLOAT;
	}

	@Override
	public String toString() {
		return PyLiteral.format(this);
	}
}
