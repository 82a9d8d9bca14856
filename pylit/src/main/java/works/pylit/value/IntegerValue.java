package works.pylit.value;

import java.math.BigInteger;
import works.pylit.PyLiteral;

import static java.util.Objects.requireNonNull;

/**
 * Python {@code int}, which has unlimited precision.
 */
public record IntegerValue(BigInteger value) implements PyValue {
	public IntegerValue {
		requireNonNull(value);
	}

	public IntegerValue negate() {
		return new IntegerValue(value.negate());
	}

	@Override
	public Kind kind() {
		return Kind.INTEGER;
	}

	@Override
	public String toString() {
		return PyLiteral.format(this);
	}
}
