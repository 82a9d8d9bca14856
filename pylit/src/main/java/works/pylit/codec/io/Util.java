package works.pylit.codec.io;

import java.util.stream.LongStream;

public class Util {
	private static final long WHITESPACE_CHARS = LongStream
		.of(0x20, 0x0A, 0x0D, 0x09, 0x0C)
		.map(n -> 1L << n)
		.sum();

	/**
	 * The parameter need not be an actual code point: it can also be a surrogate character
	 * or -1 for end of input.
	 */
	public static boolean isWhitespace(int c) {
		return 0 <= c && c < 64 && (WHITESPACE_CHARS & (1L << c)) != 0;
	}

	public static boolean isNewline(int c) {
		return c == '\n' || c == '\r';
	}

	public static boolean isDecimalDigit(int c) {
		return '0' <= c && c <= '9';
	}

	/**
	 * Unlike {@link Character#digit(int, int)}, accepts only ASCII digits.
	 *
	 * @return the value of {@code c} as a digit in the given radix, or -1 if it isn't one
	 */
	public static int digitValue(int c, int radix) {
		if (c < 0 || c >= 0x80) {
			return -1;
		} else {
			return Character.digit(c, radix);
		}
	}
}
