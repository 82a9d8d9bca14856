package works.pylit.value;

import works.pylit.PyLiteral;

public record BooleanValue(boolean value) implements PyValue {
	public static final BooleanValue TRUE = new BooleanValue(true);
	public static final BooleanValue FALSE = new BooleanValue(false);

	public static BooleanValue of(boolean value) {
		return value? TRUE : FALSE;
	}

	@Override
	public Kind kind() {
		return Kind.BOOLEAN;
	}

	@Override
	public String toString() {
		return PyLiteral.format(this);
	}
}
