package works.pylit.codec;

import works.pylit.exceptions.PyLiteralSyntaxException;
import works.pylit.value.PyValue;

/**
 * Creates {@link PyValue}s corresponding to literal text.
 */
public interface Parser {
	/**
	 * @throws PyLiteralSyntaxException if {@code text} is not exactly one valid literal,
	 * optionally surrounded by insignificant text
	 */
	PyValue parse(CharSequence text);
}
