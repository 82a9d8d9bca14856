package works.pylit.codec.interpreter;

import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.pylit.codec.CodecBuilder.Settings;
import works.pylit.codec.Generator;
import works.pylit.exceptions.PyLiteralProcessingException;
import works.pylit.value.BooleanValue;
import works.pylit.value.BytesValue;
import works.pylit.value.ComplexValue;
import works.pylit.value.DictValue;
import works.pylit.value.FloatValue;
import works.pylit.value.IntegerValue;
import works.pylit.value.ListValue;
import works.pylit.value.PyValue;
import works.pylit.value.SetValue;
import works.pylit.value.StringValue;
import works.pylit.value.TupleValue;

import static java.util.Objects.requireNonNull;

/**
 * Writes the canonical literal text for a {@link PyValue}.
 * <p>
 * For every value the {@link LiteralParser} can produce,
 * parsing the generated text gives back an equal value.
 * The exceptions are values the parser never produces:
 * an empty set is written {@code set()}, and NaN is written {@code nan}.
 */
public class LiteralGenerator implements Generator {
	private final Settings settings;

	public LiteralGenerator(Settings settings) {
		this.settings = requireNonNull(settings);
	}

	@Override
	public void generate(Appendable out, PyValue value) {
		LOGGER.debug("Generating literal text for {}", value.kind());
		try {
			new Session(out, settings).generateAny(value);
		} catch (IOException e) {
			throw new PyLiteralProcessingException("Unable to write literal text", e);
		}
	}

	static final class Session {
		final Appendable out;
		final Settings settings;

		Session(Appendable out, Settings settings) {
			this.out = out;
			this.settings = settings;
		}

		void generateAny(PyValue value) throws IOException {
			switch (value.kind()) {
				case NONE -> out.append("None");
				case BOOLEAN -> out.append(((BooleanValue) value).value()? "True" : "False");
				case INTEGER -> out.append(((IntegerValue) value).value().toString());
				case FLOAT -> out.append(FloatRepr.repr(((FloatValue) value).value()));
				case COMPLEX -> generateComplex((ComplexValue) value);
				case BYTES -> generateBytes((BytesValue) value);
				case STRING -> generateString(((StringValue) value).value());
				case TUPLE -> generateTuple((TupleValue) value);
				case LIST -> generateSequence("[", ((ListValue) value).elements(), "]");
				case SET -> generateSet((SetValue) value);
				case DICT -> generateDict((DictValue) value);
			}
		}

		/**
		 * Python omits a zero real part, but {@code -2j} parses as {@code (-0.0, -2.0)},
		 * so we omit it only when the result parses back to the same value.
		 */
		private void generateComplex(ComplexValue value) throws IOException {
			double real = value.real();
			double imag = value.imag();
			boolean imagIsNegative = Double.doubleToRawLongBits(imag) < 0;
			if (Double.doubleToRawLongBits(real) != 0L) {
				out.append(FloatRepr.complexPartRepr(real));
				out.append(imagIsNegative? '-' : '+');
			} else if (imagIsNegative) {
				out.append("0-");
			}
			out.append(FloatRepr.complexPartRepr(Math.abs(imag)));
			out.append('j');
		}

		private void generateString(String s) throws IOException {
			char quote = settings.quoteStyle().quoteFor(s);
			out.append(quote);
			for (int i = 0; i < s.length(); ) {
				int cp = s.codePointAt(i);
				switch (cp) {
					case '\\' -> out.append("\\\\");
					case '\n' -> out.append("\\n");
					case '\r' -> out.append("\\r");
					case '\t' -> out.append("\\t");
					default -> {
						if (cp == quote) {
							out.append('\\').append(quote);
						} else if (isPrintable(cp) && (cp < 0x7F || !settings.asciiOnly())) {
							out.append(s, i, i + Character.charCount(cp));
						} else if (cp <= 0xFF) {
							out.append(String.format("\\x%02x", cp));
						} else if (cp <= 0xFFFF) {
							out.append(String.format("\\u%04x", cp));
						} else {
							out.append(String.format("\\U%08x", cp));
						}
					}
				}
				i += Character.charCount(cp);
			}
			out.append(quote);
		}

		private void generateBytes(BytesValue value) throws IOException {
			byte[] bytes = value.bytes();
			StringBuilder asChars = new StringBuilder(bytes.length);
			for (byte b : bytes) {
				asChars.append((char) (b & 0xFF));
			}
			char quote = settings.quoteStyle().quoteFor(asChars);
			out.append('b').append(quote);
			for (byte b : bytes) {
				int c = b & 0xFF;
				switch (c) {
					case '\\' -> out.append("\\\\");
					case '\n' -> out.append("\\n");
					case '\r' -> out.append("\\r");
					case '\t' -> out.append("\\t");
					default -> {
						if (c == quote) {
							out.append('\\').append(quote);
						} else if (0x20 <= c && c < 0x7F) {
							out.append((char) c);
						} else {
							out.append(String.format("\\x%02x", c));
						}
					}
				}
			}
			out.append(quote);
		}

		private void generateTuple(TupleValue value) throws IOException {
			List<PyValue> elements = value.elements();
			if (elements.size() == 1) {
				// The comma is what makes it a tuple
				out.append('(');
				generateAny(elements.get(0));
				out.append(",)");
			} else {
				generateSequence("(", elements, ")");
			}
		}

		private void generateSet(SetValue value) throws IOException {
			if (value.elements().isEmpty()) {
				// There's no literal for an empty set; {} is a dict
				out.append("set()");
			} else {
				generateSequence("{", value.elements(), "}");
			}
		}

		private void generateSequence(String open, List<PyValue> elements, String close) throws IOException {
			out.append(open);
			String sep = "";
			for (PyValue element : elements) {
				out.append(sep);
				sep = ", ";
				generateAny(element);
			}
			out.append(close);
		}

		private void generateDict(DictValue value) throws IOException {
			out.append('{');
			String sep = "";
			for (DictValue.Entry entry : value.entries()) {
				out.append(sep);
				sep = ", ";
				generateAny(entry.key());
				out.append(": ");
				generateAny(entry.value());
			}
			out.append('}');
		}

		/**
		 * Approximates Python's {@code str.isprintable}.
		 * Lone surrogates count as unprintable, so they come out as escapes.
		 */
		static boolean isPrintable(int cp) {
			if (cp < 0x7F) {
				return cp >= 0x20;
			}
			return switch (Character.getType(cp)) {
				case Character.CONTROL,
					 Character.FORMAT,
					 Character.SURROGATE,
					 Character.PRIVATE_USE,
					 Character.UNASSIGNED,
					 Character.LINE_SEPARATOR,
					 Character.PARAGRAPH_SEPARATOR,
					 Character.SPACE_SEPARATOR ->
					false;
				default ->
					true;
			};
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(LiteralGenerator.class);
}
