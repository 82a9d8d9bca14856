package works.pylit.exceptions;

import static java.util.Objects.requireNonNull;

/**
 * The input text is not a valid literal.
 * <p>
 * Carries the {@link ErrorKind} along with the position at which
 * the problem was detected.
 * Lines and columns are 1-based and count UTF-16 chars;
 * the offset is a 0-based char index.
 */
public final class PyLiteralSyntaxException extends PyLiteralException {
	private final ErrorKind kind;
	private final int offset;
	private final int line;
	private final int column;

	public PyLiteralSyntaxException(ErrorKind kind, String message, int offset, int line, int column) {
		super(kind + " at line " + line + ", column " + column + " (offset " + offset + "): " + message);
		this.kind = requireNonNull(kind);
		this.offset = offset;
		this.line = line;
		this.column = column;
	}

	public PyLiteralSyntaxException(ErrorKind kind, String message, int offset, int line, int column, Throwable cause) {
		this(kind, message, offset, line, column);
		initCause(cause);
	}

	public ErrorKind kind() {
		return kind;
	}

	public int offset() {
		return offset;
	}

	public int line() {
		return line;
	}

	public int column() {
		return column;
	}
}
