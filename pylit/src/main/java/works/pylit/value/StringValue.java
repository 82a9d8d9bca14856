package works.pylit.value;

import works.pylit.PyLiteral;

import static java.util.Objects.requireNonNull;

/**
 * Python {@code str}.
 * Like a Python string, the value may contain unpaired surrogates.
 */
public record StringValue(String value) implements PyValue {
	public StringValue {
		requireNonNull(value);
	}

	@Override
	public Kind kind() {
		return Kind.STRING;
	}

	@Override
	public String toString() {
		return PyLiteral.format(this);
	}
}
