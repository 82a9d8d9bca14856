package works.pylit.value;

import java.util.List;
import works.pylit.PyLiteral;

public record TupleValue(List<PyValue> elements) implements PyValue {
	public static final TupleValue EMPTY = new TupleValue(List.of());

	public TupleValue {
		elements = List.copyOf(elements);
	}

	public static TupleValue of(PyValue... elements) {
		return new TupleValue(List.of(elements));
	}

	@Override
	public Kind kind() {
		return Kind.TUPLE;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof TupleValue other && elements.equals(other.elements);
	}

	@Override
	public int hashCode() {
		return elements.hashCode();
	}

	@Override
	public String toString() {
		return PyLiteral.format(this);
	}
}
