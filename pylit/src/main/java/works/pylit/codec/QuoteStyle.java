package works.pylit.codec;

/**
 * Which quote character a {@link Generator} uses for string and bytes literals.
 */
public enum QuoteStyle {
	DOUBLE,
	SINGLE,

	/**
	 * Single quotes, unless the text contains a single quote and no double quotes.
	 * This is the rule Python's {@code repr} follows.
	 */
	ADAPTIVE;

	public char quoteFor(CharSequence text) {
		return switch (this) {
			case DOUBLE -> '"';
			case SINGLE -> '\'';
			case ADAPTIVE -> (contains(text, '\'') && !contains(text, '"'))? '"' : '\'';
		};
	}

	private static boolean contains(CharSequence text, char c) {
		for (int i = 0; i < text.length(); i++) {
			if (text.charAt(i) == c) {
				return true;
			}
		}
		return false;
	}
}
