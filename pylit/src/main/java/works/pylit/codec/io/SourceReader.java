package works.pylit.codec.io;

import works.pylit.codec.Token;
import works.pylit.exceptions.ErrorKind;
import works.pylit.exceptions.PyLiteralSyntaxException;

import static java.lang.Math.min;

/**
 * A cursor over literal text held in a char array.
 * <p>
 * {@link #peekToken} skips insignificant text and reports what comes next
 * without consuming it. The token-specific readers then consume characters
 * directly, using the {@code peekChar}/{@code advance} family.
 * <p>
 * Not thread-safe; each parse creates its own.
 */
public final class SourceReader {
	final char[] chars;
	int pos = 0;

	public SourceReader(CharSequence text) {
		this.chars = text.toString().toCharArray();
	}

	/**
	 * Skips insignificant text and returns the next token encountered.
	 * This method is idempotent; calling it repeatedly will return the same result.
	 */
	public Token peekToken() {
		skipInsignificant();
		return Token.startingWith(peekChar());
	}

	/**
	 * After {@link #peekToken} returns a token with a
	 * {@link Token#hasFixedRepresentation fixed representation},
	 * this consumes that token.
	 *
	 * @throws PyLiteralSyntaxException if the token is a keyword and the text
	 * doesn't spell it exactly, as in {@code Nope} or {@code Truest}
	 */
	public void consumeFixedToken(Token token) {
		assert token.hasFixedRepresentation() && Token.startingWith(peekChar()) == token;
		String representation = token.fixedRepresentation();
		if (token.isKeyword()) {
			int start = pos;
			String word = readIdentifier();
			if (!word.equals(representation)) {
				throw errorAt(ErrorKind.UNEXPECTED_TOKEN, "Unexpected identifier '" + word + "'", start);
			}
		} else {
			pos += representation.length();
		}
	}

	/**
	 * Consumes the token if it's the expected one.
	 *
	 * @return true if the token was the expected one
	 */
	public boolean nextTokenIs(Token expected) {
		if (peekToken() == expected) {
			consumeFixedToken(expected);
			return true;
		} else {
			return false;
		}
	}

	/**
	 * @return NOT a code point! Just the next UTF-16 char, or -1 at the end of the input
	 */
	public int peekChar() {
		return peekChar(0);
	}

	public int peekChar(int lookahead) {
		int index = pos + lookahead;
		if (index >= chars.length) {
			return -1;
		} else {
			return chars[index];
		}
	}

	public void advance(int n) {
		assert pos + n <= chars.length;
		pos += n;
	}

	public boolean atEnd() {
		return pos >= chars.length;
	}

	public int position() {
		return pos;
	}

	/**
	 * Consumes a run of identifier characters, which may be empty.
	 */
	public String readIdentifier() {
		int start = pos;
		while (isIdentifierPart(peekChar())) {
			pos++;
		}
		return new String(chars, start, pos - start);
	}

	public static boolean isIdentifierPart(int c) {
		return c >= 0 && Character.isJavaIdentifierPart((char) c) && c != '$' && !Character.isIdentifierIgnorable((char) c);
	}

	/**
	 * Skips whitespace, comments, and backslash-newline line continuations.
	 */
	private void skipInsignificant() {
		while (true) {
			int c = peekChar();
			if (Util.isWhitespace(c)) {
				pos++;
			} else if (c == '#') {
				while (!atEnd() && !Util.isNewline(peekChar())) {
					pos++;
				}
			} else if (c == '\\' && Util.isNewline(peekChar(1))) {
				pos += (peekChar(1) == '\r' && peekChar(2) == '\n')? 3 : 2;
			} else {
				return;
			}
		}
	}

	/**
	 * On a best-effort basis, return the upcoming characters in the input.
	 */
	public String previewString(int requestedLength) {
		return previewStringAt(pos, requestedLength);
	}

	private String previewStringAt(int offset, int requestedLength) {
		int start = min(offset, chars.length);
		int actualLength = min(requestedLength, chars.length - start);
		return new String(chars, start, actualLength)
			.replace('\n', ' ')
			.replace('\r', ' ');
	}

	public PyLiteralSyntaxException error(ErrorKind kind, String message) {
		return errorAt(kind, message, pos);
	}

	public PyLiteralSyntaxException errorAt(ErrorKind kind, String message, int offset) {
		return errorAt(kind, message, offset, null);
	}

	public PyLiteralSyntaxException errorAt(ErrorKind kind, String message, int offset, Throwable cause) {
		int line = 1;
		int column = 1;
		for (int i = 0; i < offset && i < chars.length; i++) {
			char c = chars[i];
			if (c == '\n' || (c == '\r' && (i + 1 >= chars.length || chars[i + 1] != '\n'))) {
				line++;
				column = 1;
			} else if (c != '\r') {
				column++;
			}
		}
		String preview = (offset < chars.length)? ": |" + previewStringAt(offset, PREVIEW_LENGTH) + "|" : "";
		if (cause == null) {
			return new PyLiteralSyntaxException(kind, message + preview, offset, line, column);
		} else {
			return new PyLiteralSyntaxException(kind, message + preview, offset, line, column, cause);
		}
	}

	private static final int PREVIEW_LENGTH = 12;
}
