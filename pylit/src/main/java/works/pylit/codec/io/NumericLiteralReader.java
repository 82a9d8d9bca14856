package works.pylit.codec.io;

import java.math.BigInteger;
import works.pylit.exceptions.ErrorKind;
import works.pylit.exceptions.PyLiteralSyntaxException;
import works.pylit.value.ComplexValue;
import works.pylit.value.FloatValue;
import works.pylit.value.IntegerValue;
import works.pylit.value.PyValue;

import static works.pylit.exceptions.ErrorKind.MALFORMED_NUMBER;

/**
 * Reads one unsigned numeric literal: an integer in any radix, a float, or an imaginary number.
 * <p>
 * Signs are not part of the literal; the caller applies them.
 * Likewise, real-plus-imaginary composition is the caller's business.
 */
public final class NumericLiteralReader {
	private NumericLiteralReader() { }

	/**
	 * The reader must be positioned at a decimal digit or a {@code '.'}.
	 * Consumes the maximal numeric literal.
	 *
	 * @return an {@link IntegerValue}, {@link FloatValue}, or {@link ComplexValue} with a zero real part
	 * @throws PyLiteralSyntaxException with {@link ErrorKind#MALFORMED_NUMBER} if the text
	 * at the cursor isn't a valid numeric literal
	 */
	public static PyValue read(SourceReader in) {
		int start = in.position();
		if (in.peekChar() == '0') {
			int radix = switch (in.peekChar(1)) {
				case 'x', 'X' -> 16;
				case 'o', 'O' -> 8;
				case 'b', 'B' -> 2;
				default -> 0;
			};
			if (radix != 0) {
				return readRadixInteger(in, radix);
			}
		}

		// Collected in a form Double.parseDouble and BigInteger both accept
		StringBuilder digits = new StringBuilder();
		boolean isFloat = false;
		boolean hasIntegerPart = readDigitPart(in, digits);
		if (in.peekChar() == '.') {
			in.advance(1);
			digits.append('.');
			isFloat = true;
			boolean hasFraction = readDigitPart(in, digits);
			if (!hasIntegerPart && !hasFraction) {
				throw in.errorAt(ErrorKind.UNEXPECTED_TOKEN, "'.' does not begin a value", start);
			}
		}
		int e = in.peekChar();
		if (e == 'e' || e == 'E') {
			in.advance(1);
			digits.append('e');
			int sign = in.peekChar();
			if (sign == '+' || sign == '-') {
				in.advance(1);
				digits.append((char) sign);
			}
			if (!readDigitPart(in, digits)) {
				throw in.error(MALFORMED_NUMBER, "Exponent has no digits");
			}
			isFloat = true;
		}

		int j = in.peekChar();
		if (j == 'j' || j == 'J') {
			in.advance(1);
			checkTerminated(in, "imaginary");
			return ComplexValue.imaginary(Double.parseDouble(digits.toString()));
		}

		if (isFloat) {
			checkTerminated(in, "decimal");
			return new FloatValue(Double.parseDouble(digits.toString()));
		}

		checkTerminated(in, "decimal");
		String integer = digits.toString();
		if (integer.length() > 1 && integer.charAt(0) == '0' && !isAllZeros(integer)) {
			throw in.errorAt(MALFORMED_NUMBER, "Leading zeros in decimal integer literals are not permitted; use an 0o prefix for octal integers", start);
		}
		return new IntegerValue(new BigInteger(integer));
	}

	private static PyValue readRadixInteger(SourceReader in, int radix) {
		in.advance(2); // Skip the prefix
		StringBuilder digits = new StringBuilder();
		while (true) {
			int c = in.peekChar();
			if (c == '_') {
				// Python allows one underscore right after the prefix too, as in 0x_ff
				if (Util.digitValue(in.peekChar(1), radix) < 0) {
					throw in.error(MALFORMED_NUMBER, "Misplaced underscore in " + radixName(radix) + " literal");
				}
				in.advance(1);
			} else if (Util.digitValue(c, radix) >= 0) {
				digits.append((char) c);
				in.advance(1);
			} else {
				break;
			}
		}
		if (digits.isEmpty()) {
			throw in.error(MALFORMED_NUMBER, "Missing digits after " + radixName(radix) + " prefix");
		}
		checkTerminated(in, radixName(radix));
		return new IntegerValue(new BigInteger(digits.toString(), radix));
	}

	/**
	 * Reads Python's <em>digitpart</em>: decimal digits, each pair optionally separated by one underscore.
	 * Underscores are dropped.
	 *
	 * @return false if there were no digits at the cursor, in which case nothing is consumed
	 */
	private static boolean readDigitPart(SourceReader in, StringBuilder digits) {
		if (!Util.isDecimalDigit(in.peekChar())) {
			return false;
		}
		while (true) {
			int c = in.peekChar();
			if (Util.isDecimalDigit(c)) {
				digits.append((char) c);
				in.advance(1);
			} else if (c == '_') {
				if (!Util.isDecimalDigit(in.peekChar(1))) {
					throw in.error(MALFORMED_NUMBER, "Misplaced underscore in numeric literal");
				}
				in.advance(1);
			} else {
				return true;
			}
		}
	}

	/**
	 * A numeric literal must not run straight into an identifier or another dot,
	 * as in {@code 123abc}, {@code 0b102}, or {@code 1.2.3}.
	 */
	private static void checkTerminated(SourceReader in, String kind) {
		int c = in.peekChar();
		if (SourceReader.isIdentifierPart(c) || c == '.') {
			throw in.error(MALFORMED_NUMBER, "Invalid character '" + (char) c + "' in " + kind + " literal");
		}
	}

	private static boolean isAllZeros(String digits) {
		for (int i = 0; i < digits.length(); i++) {
			if (digits.charAt(i) != '0') {
				return false;
			}
		}
		return true;
	}

	private static String radixName(int radix) {
		return switch (radix) {
			case 2 -> "binary";
			case 8 -> "octal";
			case 16 -> "hexadecimal";
			default -> "base-" + radix;
		};
	}
}
