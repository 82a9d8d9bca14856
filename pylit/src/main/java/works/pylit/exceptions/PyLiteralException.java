package works.pylit.exceptions;

public sealed abstract class PyLiteralException extends RuntimeException permits PyLiteralSyntaxException, PyLiteralProcessingException {
	protected PyLiteralException(String message) {
		super(message);
	}

	protected PyLiteralException(Throwable cause) {
		super(cause);
	}

	protected PyLiteralException(String message, Throwable cause) {
		super(message, cause);
	}
}
