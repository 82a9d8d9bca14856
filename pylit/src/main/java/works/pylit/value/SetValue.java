package works.pylit.value;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import works.pylit.PyLiteral;

/**
 * Python {@code set}.
 * <p>
 * Duplicates (by structural equality) are dropped, keeping the first occurrence,
 * and the remaining elements keep their insertion order,
 * which is the order in which they are formatted.
 * Equality ignores that order.
 */
public record SetValue(List<PyValue> elements) implements PyValue {
	public SetValue {
		elements = List.copyOf(new LinkedHashSet<>(elements));
	}

	public static SetValue of(PyValue... elements) {
		return new SetValue(List.of(elements));
	}

	public boolean contains(PyValue element) {
		return elements.contains(element);
	}

	public int size() {
		return elements.size();
	}

	@Override
	public Kind kind() {
		return Kind.SET;
	}

	@Override
	public boolean equals(Object obj) {
		if (obj instanceof SetValue other) {
			return elements.size() == other.elements.size()
				&& new HashSet<>(elements).containsAll(other.elements);
		} else {
			return false;
		}
	}

	@Override
	public int hashCode() {
		int result = 0;
		for (PyValue element : elements) {
			result += element.hashCode();
		}
		return result;
	}

	@Override
	public String toString() {
		return PyLiteral.format(this);
	}
}
