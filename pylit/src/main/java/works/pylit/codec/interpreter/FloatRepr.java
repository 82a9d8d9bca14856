package works.pylit.codec.interpreter;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Formats doubles the way Python's {@code repr} does:
 * the fewest significant digits that read back as the same double,
 * positional notation for decimal exponents in [-4, 16),
 * and scientific notation with a signed, two-digit-minimum exponent otherwise.
 * <p>
 * {@link Double#toString(double)} doesn't promise the shortest digits before JDK 19,
 * and its layout differs anyway, so we find the digits with {@link BigDecimal}.
 */
final class FloatRepr {
	private FloatRepr() { }

	/**
	 * Infinity reads back from {@code 1e999}, so that's how we write it.
	 * NaN has no literal spelling; we write {@code nan} as Python does.
	 */
	static String repr(double value) {
		if (Double.isNaN(value)) {
			return "nan";
		} else if (Double.isInfinite(value)) {
			return (value > 0)? "1e999" : "-1e999";
		} else if (value == 0.0) {
			return (Double.doubleToRawLongBits(value) < 0)? "-0.0" : "0.0";
		}

		BigDecimal shortest = shortestDecimal(Math.abs(value));
		String digits = shortest.unscaledValue().toString();
		int exponent = digits.length() - 1 - shortest.scale();

		StringBuilder sb = new StringBuilder(digits.length() + 8);
		if (value < 0) {
			sb.append('-');
		}
		if (-4 <= exponent && exponent < 16) {
			if (exponent < 0) {
				sb.append("0.");
				sb.append("0".repeat(-exponent - 1));
				sb.append(digits);
			} else if (digits.length() <= exponent + 1) {
				sb.append(digits);
				sb.append("0".repeat(exponent + 1 - digits.length()));
				sb.append(".0");
			} else {
				sb.append(digits, 0, exponent + 1);
				sb.append('.');
				sb.append(digits, exponent + 1, digits.length());
			}
		} else {
			sb.append(digits.charAt(0));
			if (digits.length() > 1) {
				sb.append('.');
				sb.append(digits, 1, digits.length());
			}
			sb.append('e');
			sb.append((exponent < 0)? '-' : '+');
			int magnitude = Math.abs(exponent);
			if (magnitude < 10) {
				sb.append('0');
			}
			sb.append(magnitude);
		}
		return sb.toString();
	}

	/**
	 * Like {@link #repr} but with any trailing {@code .0} dropped,
	 * which is how Python writes the parts of a complex number.
	 * Negative zero keeps its {@code .0}, since {@code -0} would read back as an integer zero.
	 */
	static String complexPartRepr(double value) {
		String result = repr(value);
		if (result.endsWith(".0") && !result.equals("-0.0")) {
			return result.substring(0, result.length() - 2);
		} else {
			return result;
		}
	}

	/**
	 * @param value positive and finite
	 */
	private static BigDecimal shortestDecimal(double value) {
		BigDecimal exact = new BigDecimal(value);
		for (int precision = 1; precision < 17; precision++) {
			BigDecimal candidate = exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
			if (candidate.doubleValue() == value) {
				return candidate.stripTrailingZeros();
			}
		}
		// Seventeen significant digits always suffice
		return exact.round(new MathContext(17, RoundingMode.HALF_EVEN)).stripTrailingZeros();
	}
}
