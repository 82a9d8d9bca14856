package works.pylit;

import works.pylit.codec.Codec;
import works.pylit.codec.CodecBuilder;
import works.pylit.codec.CodecBuilder.Settings;
import works.pylit.exceptions.PyLiteralSyntaxException;
import works.pylit.value.PyValue;

/**
 * Entry points using {@link Settings#DEFAULT default settings}.
 * For anything else, use {@link CodecBuilder}.
 */
public final class PyLiteral {
	private static final Codec DEFAULT_CODEC = CodecBuilder.using(Settings.DEFAULT).build();

	private PyLiteral() { }

	/**
	 * @throws PyLiteralSyntaxException if {@code text} is not a valid literal
	 */
	public static PyValue parse(CharSequence text) {
		return DEFAULT_CODEC.parse(text);
	}

	/**
	 * Never fails. Note, though, that an empty {@link works.pylit.value.SetValue SetValue}
	 * is written as {@code set()}, which is not a literal and won't parse.
	 */
	public static String format(PyValue value) {
		return DEFAULT_CODEC.format(value);
	}

	public static Codec defaultCodec() {
		return DEFAULT_CODEC;
	}
}
