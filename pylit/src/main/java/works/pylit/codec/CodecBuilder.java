package works.pylit.codec;

import works.pylit.codec.interpreter.LiteralGenerator;
import works.pylit.codec.interpreter.LiteralParser;

import static java.util.Objects.requireNonNull;

/**
 * Builds a {@link Codec} according to the user's instructions.
 */
public class CodecBuilder {
	private final Settings settings;

	private CodecBuilder(Settings settings) {
		this.settings = requireNonNull(settings);
	}

	public static CodecBuilder using(Settings settings) {
		return new CodecBuilder(settings);
	}

	public Codec build() {
		Parser parser = new LiteralParser(settings);
		Generator generator = new LiteralGenerator(settings);
		return new Codec() {
			@Override
			public Parser parser() {
				return parser;
			}

			@Override
			public Generator generator() {
				return generator;
			}

			@Override
			public String toString() {
				return "Codec" + settings;
			}
		};
	}

	/**
	 * @param maxNestingDepth how many collections may enclose a value before parsing fails.
	 *                        Keeps pathological input from overflowing the stack,
	 *                        whether in the parser or later in {@code equals} and {@code hashCode}
	 *                        of the resulting values. The default of 200 is CPython's own parser limit.
	 * @param quoteStyle quote character used when generating strings and bytes
	 * @param asciiOnly if true, generated text escapes every non-ASCII character
	 */
	public record Settings(
		int maxNestingDepth,
		QuoteStyle quoteStyle,
		boolean asciiOnly
	) {
		public static final Settings DEFAULT = new Settings(200, QuoteStyle.DOUBLE, false);

		/**
		 * Output that looks like Python's own {@code ascii()} of a value.
		 */
		public static final Settings ASCII = new Settings(200, QuoteStyle.ADAPTIVE, true);

		public Settings {
			if (maxNestingDepth < 1) {
				throw new IllegalArgumentException("maxNestingDepth must be positive: " + maxNestingDepth);
			}
			requireNonNull(quoteStyle);
		}

		public Settings withMaxNestingDepth(int maxNestingDepth) {
			return new Settings(maxNestingDepth, quoteStyle, asciiOnly);
		}

		public Settings withQuoteStyle(QuoteStyle quoteStyle) {
			return new Settings(maxNestingDepth, quoteStyle, asciiOnly);
		}

		public Settings withAsciiOnly(boolean asciiOnly) {
			return new Settings(maxNestingDepth, quoteStyle, asciiOnly);
		}
	}
}
