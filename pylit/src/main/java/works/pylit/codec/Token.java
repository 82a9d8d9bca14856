package works.pylit.codec;

/**
 * A syntactically significant element of literal text.
 * <p>
 * Insignificant text (whitespace, comments, and line continuations)
 * never produces a token; readers skip it before peeking.
 */
public enum Token {
	END_TEXT,
	NONE,
	FALSE,
	TRUE,

	/**
	 * An unsigned numeric literal. Signs are separate tokens.
	 */
	NUMBER,
	PLUS,
	MINUS,

	/**
	 * A string or bytes literal, including any prefix letters.
	 * We don't distinguish at the token level.
	 */
	STRING,

	START_TUPLE,
	END_TUPLE,
	START_LIST,
	END_LIST,
	START_BRACE,
	END_BRACE,
	COMMA,
	COLON,

	ERROR;

	public static Token startingWith(int c) {
		return switch (c) {
			case -1 -> END_TEXT;
			case 'N' -> NONE;
			case 'F' -> FALSE;
			case 'T' -> TRUE;
			case '0', '1', '2', '3', '4', '5', '6', '7', '8', '9', '.' -> NUMBER;
			case '+' -> PLUS;
			case '-' -> MINUS;
			case '\'', '"', 'r', 'R', 'b', 'B', 'u', 'U' -> STRING; // Prefix letters are checked by the text reader
			case '(' -> START_TUPLE;
			case ')' -> END_TUPLE;
			case '[' -> START_LIST;
			case ']' -> END_LIST;
			case '{' -> START_BRACE;
			case '}' -> END_BRACE;
			case ',' -> COMMA;
			case ':' -> COLON;
			default -> ERROR;
		};
	}

	/**
	 * @return true for tokens that are always represented with the same sequence of characters
	 */
	public boolean hasFixedRepresentation() {
		return switch (this) {
			case NUMBER, STRING, ERROR -> false;
			default -> true;
		};
	}

	public String fixedRepresentation() {
		return switch (this) {
			case END_TEXT -> "";
			case NONE -> "None";
			case FALSE -> "False";
			case TRUE -> "True";
			case PLUS -> "+";
			case MINUS -> "-";
			case START_TUPLE -> "(";
			case END_TUPLE -> ")";
			case START_LIST -> "[";
			case END_LIST -> "]";
			case START_BRACE -> "{";
			case END_BRACE -> "}";
			case COMMA -> ",";
			case COLON -> ":";
			default ->
				throw new IllegalArgumentException("Token has no fixed representation: " + this);
		};
	}

	/**
	 * @return true for the keyword tokens, which must be followed by a non-identifier character
	 */
	public boolean isKeyword() {
		return switch (this) {
			case NONE, FALSE, TRUE -> true;
			default -> false;
		};
	}
}
