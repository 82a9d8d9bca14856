package works.pylit.value;

import works.pylit.PyLiteral;

public enum NoneValue implements PyValue {
	NONE;

	@Override
	public Kind kind() {
		return Kind.NONE;
	}

	@Override
	public String toString() {
		return PyLiteral.format(this);
	}
}
