package works.pylit.exceptions;

/**
 * An unexpected error has occurred while reading or writing literal text.
 * <p>
 * This does not indicate a problem with the input text.
 * The usual culprit is the {@link Appendable} given to a
 * {@link works.pylit.codec.Generator Generator}, which is allowed to throw
 * {@link java.io.IOException}.
 */
public final class PyLiteralProcessingException extends PyLiteralException {
	public PyLiteralProcessingException(String message) {
		super(message);
	}

	public PyLiteralProcessingException(Throwable cause) {
		super(cause);
	}

	public PyLiteralProcessingException(String message, Throwable cause) {
		super(message, cause);
	}
}
