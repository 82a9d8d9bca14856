package works.pylit.codec.io;

import java.util.Locale;
import works.pylit.codec.Token;
import works.pylit.exceptions.ErrorKind;
import works.pylit.exceptions.PyLiteralSyntaxException;
import works.pylit.value.BytesValue;
import works.pylit.value.PyValue;
import works.pylit.value.StringValue;

import static works.pylit.exceptions.ErrorKind.MALFORMED_STRING;

/**
 * Reads string and bytes literals, including adjacent-literal concatenation.
 * <p>
 * Supported prefixes are {@code r}, {@code u}, {@code b}, {@code br} and {@code rb}, in any case.
 * Unlike Python, an unrecognized escape sequence is an error rather than
 * being passed through with its backslash intact.
 */
public final class TextLiteralReader {
	private TextLiteralReader() { }

	/**
	 * The reader must be positioned at a prefix letter or a quote.
	 * Reads one literal, then keeps reading as long as the next significant text
	 * is another literal of the same kind, concatenating them all.
	 *
	 * @return a {@link StringValue} or {@link BytesValue}
	 * @throws PyLiteralSyntaxException with {@link ErrorKind#MALFORMED_STRING} for invalid literals,
	 * or {@link ErrorKind#UNEXPECTED_TOKEN} if the cursor is at an identifier that isn't a prefix
	 */
	public static PyValue read(SourceReader in) {
		StringBuilder contents = new StringBuilder();
		boolean isBytes = readOne(in, contents);
		while (in.peekToken() == Token.STRING && atLiteralStart(in)) {
			int start = in.position();
			if (readOne(in, contents) != isBytes) {
				throw in.errorAt(MALFORMED_STRING, "Cannot mix bytes and nonbytes literals", start);
			}
		}
		if (isBytes) {
			byte[] bytes = new byte[contents.length()];
			for (int i = 0; i < bytes.length; i++) {
				bytes[i] = (byte) contents.charAt(i);
			}
			return new BytesValue(bytes);
		} else {
			return new StringValue(contents.toString());
		}
	}

	/**
	 * @return true if the cursor is at an optional run of identifier characters followed by a quote
	 */
	static boolean atLiteralStart(SourceReader in) {
		int i = 0;
		while (SourceReader.isIdentifierPart(in.peekChar(i))) {
			i++;
		}
		return isQuote(in.peekChar(i));
	}

	/**
	 * Reads a single literal, appending its decoded contents to {@code out}.
	 * For bytes literals, each char appended is a byte value in [0, 255].
	 *
	 * @return true if the literal is a bytes literal
	 */
	private static boolean readOne(SourceReader in, StringBuilder out) {
		int start = in.position();
		String prefix = in.readIdentifier();
		if (!isQuote(in.peekChar())) {
			throw in.errorAt(ErrorKind.UNEXPECTED_TOKEN, "Unexpected identifier '" + prefix + "'", start);
		}
		boolean isRaw = false;
		boolean isBytes = false;
		boolean isUnicode = false;
		for (char p : prefix.toLowerCase(Locale.ROOT).toCharArray()) {
			switch (p) {
				case 'r' -> {
					if (isRaw) {
						throw invalidPrefix(in, prefix, start);
					}
					isRaw = true;
				}
				case 'b' -> {
					if (isBytes) {
						throw invalidPrefix(in, prefix, start);
					}
					isBytes = true;
				}
				case 'u' -> {
					if (isUnicode) {
						throw invalidPrefix(in, prefix, start);
					}
					isUnicode = true;
				}
				default -> throw invalidPrefix(in, prefix, start);
			}
		}
		if (isUnicode && (isRaw || isBytes)) {
			throw invalidPrefix(in, prefix, start);
		}

		int quote = in.peekChar();
		boolean isTriple = in.peekChar(1) == quote && in.peekChar(2) == quote;
		in.advance(isTriple? 3 : 1);
		while (true) {
			int c = in.peekChar();
			if (c == -1) {
				throw in.errorAt(MALFORMED_STRING, "Unterminated " + (isTriple? "triple-quoted " : "") + "string literal", start);
			} else if (c == quote) {
				if (!isTriple) {
					in.advance(1);
					return isBytes;
				} else if (in.peekChar(1) == quote && in.peekChar(2) == quote) {
					in.advance(3);
					return isBytes;
				} else {
					out.append((char) c);
					in.advance(1);
				}
			} else if (Util.isNewline(c) && !isTriple) {
				throw in.errorAt(MALFORMED_STRING, "Unterminated string literal: newline before closing quote", start);
			} else if (c == '\\') {
				if (isRaw) {
					readRawBackslash(in, out, isBytes);
				} else {
					readEscape(in, out, isBytes);
				}
			} else {
				if (isBytes && c >= 0x80) {
					throw in.error(MALFORMED_STRING, "Bytes literals can only contain ASCII characters");
				}
				out.append((char) c);
				in.advance(1);
			}
		}
	}

	/**
	 * In a raw literal, a backslash stays in the result, and so does the character after it,
	 * which therefore can't end the literal.
	 */
	private static void readRawBackslash(SourceReader in, StringBuilder out, boolean isBytes) {
		in.advance(1);
		out.append('\\');
		int c = in.peekChar();
		if (c == -1) {
			return; // Caller reports the unterminated literal
		}
		if (isBytes && c >= 0x80) {
			throw in.error(MALFORMED_STRING, "Bytes literals can only contain ASCII characters");
		}
		out.append((char) c);
		in.advance(1);
		if (c == '\r' && in.peekChar() == '\n') {
			out.append('\n');
			in.advance(1);
		}
	}

	private static void readEscape(SourceReader in, StringBuilder out, boolean isBytes) {
		int escapeStart = in.position();
		in.advance(1);
		int c = in.peekChar();
		if (c == -1) {
			return; // Caller reports the unterminated literal
		}
		in.advance(1);
		switch (c) {
			case '\n' -> { } // Line continuation
			case '\r' -> {
				if (in.peekChar() == '\n') {
					in.advance(1);
				}
			}
			case '\\', '\'', '"' -> out.append((char) c);
			case 'a' -> out.append('\u0007');
			case 'b' -> out.append('\b');
			case 'f' -> out.append('\f');
			case 'n' -> out.append('\n');
			case 'r' -> out.append('\r');
			case 't' -> out.append('\t');
			case 'v' -> out.append('\u000B');
			case '0', '1', '2', '3', '4', '5', '6', '7' -> {
				int value = c - '0';
				for (int i = 0; i < 2 && Util.digitValue(in.peekChar(), 8) >= 0; i++) {
					value = value * 8 + Util.digitValue(in.peekChar(), 8);
					in.advance(1);
				}
				if (isBytes && value > 0xFF) {
					throw in.errorAt(MALFORMED_STRING, "Octal escape value " + value + " is out of range for bytes", escapeStart);
				}
				out.append((char) value);
			}
			case 'x' -> out.append((char) readHexDigits(in, 2, escapeStart, "\\xhh"));
			default -> {
				if (isBytes) {
					throw invalidEscape(in, c, escapeStart);
				}
				switch (c) {
					case 'u' -> out.append((char) readHexDigits(in, 4, escapeStart, "\\uhhhh"));
					case 'U' -> {
						int codePoint = readHexDigits(in, 8, escapeStart, "\\Uhhhhhhhh");
						if (codePoint < 0 || codePoint > Character.MAX_CODE_POINT) { // Eight hex digits can overflow an int
							throw in.errorAt(MALFORMED_STRING, "Escape \\U" + String.format("%08x", codePoint) + " is beyond the Unicode range", escapeStart);
						}
						out.appendCodePoint(codePoint);
					}
					case 'N' -> out.appendCodePoint(readNamedCharacter(in, escapeStart));
					default -> throw invalidEscape(in, c, escapeStart);
				}
			}
		}
	}

	private static int readHexDigits(SourceReader in, int count, int escapeStart, String form) {
		int value = 0;
		for (int i = 0; i < count; i++) {
			int digit = Util.digitValue(in.peekChar(), 16);
			if (digit < 0) {
				throw in.errorAt(MALFORMED_STRING, "Truncated " + form + " escape", escapeStart);
			}
			value = value * 16 + digit;
			in.advance(1);
		}
		return value;
	}

	/**
	 * Reads the <code>{NAME}</code> part of a <code>\N{NAME}</code> escape.
	 */
	private static int readNamedCharacter(SourceReader in, int escapeStart) {
		if (in.peekChar() != '{') {
			throw in.errorAt(MALFORMED_STRING, "Malformed \\N character escape", escapeStart);
		}
		in.advance(1);
		StringBuilder name = new StringBuilder();
		int c;
		while ((c = in.peekChar()) != '}') {
			if (c == -1 || Util.isNewline(c) || isQuote(c)) {
				throw in.errorAt(MALFORMED_STRING, "Malformed \\N character escape", escapeStart);
			}
			name.append((char) c);
			in.advance(1);
		}
		in.advance(1);
		int result = UnicodeNames.lookup(name.toString());
		if (result == UnicodeNames.NOT_FOUND) {
			throw in.errorAt(MALFORMED_STRING, "Unknown Unicode character name '" + name + "'", escapeStart);
		}
		return result;
	}

	private static boolean isQuote(int c) {
		return c == '\'' || c == '"';
	}

	private static PyLiteralSyntaxException invalidPrefix(SourceReader in, String prefix, int start) {
		return in.errorAt(MALFORMED_STRING, "Invalid string prefix '" + prefix + "'", start);
	}

	private static PyLiteralSyntaxException invalidEscape(SourceReader in, int c, int escapeStart) {
		return in.errorAt(MALFORMED_STRING, "Invalid escape sequence '\\" + (char) c + "'", escapeStart);
	}
}
