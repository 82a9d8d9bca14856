package works.pylit.value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import works.pylit.PyLiteral;

import static java.util.Objects.requireNonNull;

/**
 * Python {@code dict}.
 * <p>
 * Entries keep insertion order.
 * When a key appears more than once, the entry stays where the key was first seen,
 * but takes the value given last.
 */
public record DictValue(List<Entry> entries) implements PyValue {
	public static final DictValue EMPTY = new DictValue(List.of());

	public record Entry(PyValue key, PyValue value) {
		public Entry {
			requireNonNull(key);
			requireNonNull(value);
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof Entry other && key.equals(other.key) && value.equals(other.value);
		}

		@Override
		public int hashCode() {
			return 31 * key.hashCode() + value.hashCode();
		}
	}

	public DictValue {
		Map<PyValue, PyValue> map = new LinkedHashMap<>();
		for (Entry entry : entries) {
			map.put(entry.key(), entry.value());
		}
		if (map.size() == entries.size()) {
			entries = List.copyOf(entries);
		} else {
			entries = map.entrySet().stream()
				.map(e -> new Entry(e.getKey(), e.getValue()))
				.toList();
		}
	}

	public static DictValue of(Entry... entries) {
		return new DictValue(List.of(entries));
	}

	public static Builder builder() {
		return new Builder();
	}

	public Optional<PyValue> get(PyValue key) {
		for (Entry entry : entries) {
			if (entry.key().equals(key)) {
				return Optional.of(entry.value());
			}
		}
		return Optional.empty();
	}

	public List<PyValue> keys() {
		return entries.stream().map(Entry::key).toList();
	}

	public int size() {
		return entries.size();
	}

	public boolean isEmpty() {
		return entries.isEmpty();
	}

	@Override
	public Kind kind() {
		return Kind.DICT;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof DictValue other && entries.equals(other.entries);
	}

	@Override
	public int hashCode() {
		return entries.hashCode();
	}

	@Override
	public String toString() {
		return PyLiteral.format(this);
	}

	public static final class Builder {
		private final List<Entry> entries = new ArrayList<>();

		private Builder() { }

		public Builder put(PyValue key, PyValue value) {
			entries.add(new Entry(key, value));
			return this;
		}

		public DictValue build() {
			return new DictValue(entries);
		}
	}
}
