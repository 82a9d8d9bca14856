package works.pylit.value;

import java.util.List;
import works.pylit.PyLiteral;

public record ListValue(List<PyValue> elements) implements PyValue {
	public ListValue {
		elements = List.copyOf(elements);
	}

	public static ListValue of(PyValue... elements) {
		return new ListValue(List.of(elements));
	}

	@Override
	public Kind kind() {
		return Kind.LIST;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof ListValue other && elements.equals(other.elements);
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
