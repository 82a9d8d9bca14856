package works.pylit.exceptions;

/**
 * Categorizes a {@link PyLiteralSyntaxException}.
 */
public enum ErrorKind {
	/**
	 * Invalid digits, radix prefix, underscore placement, exponent or imaginary suffix,
	 * or an additive combination other than real-plus-imaginary.
	 */
	MALFORMED_NUMBER,

	/**
	 * Unterminated quote, invalid escape, invalid prefix,
	 * or mixing {@code str} and {@code bytes} in adjacent literals.
	 */
	MALFORMED_STRING,

	/**
	 * Mismatched delimiter, mixed set/dict entries,
	 * or a separator where none belongs.
	 */
	MALFORMED_COLLECTION,

	/**
	 * Some character that can't start a value.
	 */
	UNEXPECTED_TOKEN,

	/**
	 * A complete value was parsed, but more significant text follows.
	 */
	TRAILING_INPUT,

	UNEXPECTED_END_OF_INPUT,

	NESTING_TOO_DEEP,
}
