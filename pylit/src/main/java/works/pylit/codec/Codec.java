package works.pylit.codec;

import works.pylit.value.PyValue;

/**
 * A matched {@link Parser} and {@link Generator}.
 * Accessible via {@link CodecBuilder}.
 * <p>
 * Codecs hold no mutable state and can be shared between threads.
 */
public interface Codec {
	Parser parser();
	Generator generator();

	default PyValue parse(CharSequence text) {
		return parser().parse(text);
	}

	default String format(PyValue value) {
		StringBuilder sb = new StringBuilder();
		generator().generate(sb, value);
		return sb.toString();
	}

	default void format(Appendable out, PyValue value) {
		generator().generate(out, value);
	}
}
