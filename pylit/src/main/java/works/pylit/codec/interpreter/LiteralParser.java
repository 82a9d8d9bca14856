package works.pylit.codec.interpreter;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.pylit.codec.CodecBuilder.Settings;
import works.pylit.codec.Parser;
import works.pylit.codec.Token;
import works.pylit.codec.io.NumericLiteralReader;
import works.pylit.codec.io.SourceReader;
import works.pylit.codec.io.TextLiteralReader;
import works.pylit.exceptions.PyLiteralSyntaxException;
import works.pylit.value.BooleanValue;
import works.pylit.value.ComplexValue;
import works.pylit.value.DictValue;
import works.pylit.value.FloatValue;
import works.pylit.value.IntegerValue;
import works.pylit.value.ListValue;
import works.pylit.value.NoneValue;
import works.pylit.value.PyValue;
import works.pylit.value.SetValue;
import works.pylit.value.TupleValue;

import static java.util.Objects.requireNonNull;
import static works.pylit.codec.Token.COLON;
import static works.pylit.codec.Token.COMMA;
import static works.pylit.codec.Token.END_BRACE;
import static works.pylit.codec.Token.END_LIST;
import static works.pylit.codec.Token.END_TEXT;
import static works.pylit.codec.Token.END_TUPLE;
import static works.pylit.codec.Token.MINUS;
import static works.pylit.codec.Token.NUMBER;
import static works.pylit.codec.Token.PLUS;
import static works.pylit.codec.Token.START_BRACE;
import static works.pylit.codec.Token.START_LIST;
import static works.pylit.codec.Token.START_TUPLE;
import static works.pylit.exceptions.ErrorKind.MALFORMED_COLLECTION;
import static works.pylit.exceptions.ErrorKind.MALFORMED_NUMBER;
import static works.pylit.exceptions.ErrorKind.NESTING_TOO_DEEP;
import static works.pylit.exceptions.ErrorKind.TRAILING_INPUT;
import static works.pylit.exceptions.ErrorKind.UNEXPECTED_END_OF_INPUT;
import static works.pylit.exceptions.ErrorKind.UNEXPECTED_TOKEN;

/**
 * Recursive-descent parser for literal text.
 * <p>
 * Each method of the session handles one production,
 * delegating scalars to {@link NumericLiteralReader} and {@link TextLiteralReader}.
 */
public class LiteralParser implements Parser {
	final Settings settings;

	public LiteralParser(Settings settings) {
		this.settings = requireNonNull(settings);
	}

	@Override
	public PyValue parse(CharSequence text) {
		LOGGER.debug("Parsing {} chars of literal text", text.length());
		return new ParseSession(new SourceReader(text), settings.maxNestingDepth()).parseDocument();
	}

	/**
	 * A single parsing operation, consuming text from a given {@link SourceReader}.
	 */
	private static final class ParseSession {
		final SourceReader input;
		final int maxNestingDepth;

		ParseSession(SourceReader input, int maxNestingDepth) {
			this.input = input;
			this.maxNestingDepth = maxNestingDepth;
		}

		PyValue parseDocument() {
			if (input.peekToken() == END_TEXT) {
				throw input.error(UNEXPECTED_END_OF_INPUT, "Expected a value; the input is empty");
			}
			PyValue result = parseValue(0);
			if (input.peekToken() != END_TEXT) {
				throw input.error(TRAILING_INPUT, "Unexpected text after a complete value");
			}
			return result;
		}

		/**
		 * @param depth the number of collections enclosing this value
		 */
		PyValue parseValue(int depth) {
			logEntry("parseValue", depth);
			Token token = input.peekToken();
			return switch (token) {
				case NONE -> {
					input.consumeFixedToken(token);
					yield NoneValue.NONE;
				}
				case TRUE, FALSE -> {
					input.consumeFixedToken(token);
					yield BooleanValue.of(token == Token.TRUE);
				}
				case NUMBER, PLUS, MINUS -> parseNumberExpression();
				case STRING -> TextLiteralReader.read(input);
				case START_TUPLE -> parseParenthesized(depth + 1);
				case START_LIST -> parseList(depth + 1);
				case START_BRACE -> parseBraces(depth + 1);
				case END_TEXT -> throw input.error(UNEXPECTED_END_OF_INPUT, "Expected a value");
				case END_TUPLE, END_LIST, END_BRACE, COMMA, COLON ->
					throw input.error((depth == 0)? UNEXPECTED_TOKEN : MALFORMED_COLLECTION,
						"Expected a value, not '" + token.fixedRepresentation() + "'");
				case ERROR -> throw input.error(UNEXPECTED_TOKEN, "Unexpected character");
			};
		}

		/**
		 * A numeric literal with an optional sign, optionally followed by
		 * {@code +} or {@code -} and an imaginary literal, as in {@code -1.5+2j}.
		 */
		private PyValue parseNumberExpression() {
			int start = input.position();
			PyValue number = parseSignedNumber();

			Token operator = input.peekToken();
			if (operator != PLUS && operator != MINUS) {
				return number;
			}
			if (number instanceof ComplexValue) {
				throw input.error(MALFORMED_NUMBER, "Only a real number can be added to an imaginary number");
			}
			input.consumeFixedToken(operator);
			Token next = input.peekToken();
			if (next == END_TEXT) {
				throw input.error(UNEXPECTED_END_OF_INPUT, "Expected an imaginary literal after '" + operator.fixedRepresentation() + "'");
			} else if (next != NUMBER) {
				throw input.error(MALFORMED_NUMBER, "Expected an imaginary literal after '" + operator.fixedRepresentation() + "'");
			}
			int imagStart = input.position();
			PyValue rhs = NumericLiteralReader.read(input);
			if (!(rhs instanceof ComplexValue imaginary)) {
				throw input.errorAt(MALFORMED_NUMBER, "Only an imaginary number can be added to a real number", imagStart);
			}
			double real = realPart(number, start);
			double imag = (operator == MINUS)? -imaginary.imag() : imaginary.imag();

			Token after = input.peekToken();
			if (after == PLUS || after == MINUS) {
				throw input.error(MALFORMED_NUMBER, "Only one real and one imaginary number can be added");
			}
			return new ComplexValue(real, imag);
		}

		private PyValue parseSignedNumber() {
			Token sign = input.peekToken();
			if (sign == NUMBER) {
				return NumericLiteralReader.read(input);
			}
			input.consumeFixedToken(sign);
			Token next = input.peekToken();
			if (next == END_TEXT) {
				throw input.error(UNEXPECTED_END_OF_INPUT, "Expected a number after '" + sign.fixedRepresentation() + "'");
			} else if (next != NUMBER) {
				throw input.error(UNEXPECTED_TOKEN, "A sign must be followed by a numeric literal");
			}
			PyValue number = NumericLiteralReader.read(input);
			return (sign == MINUS)? negate(number) : number;
		}

		private static PyValue negate(PyValue number) {
			if (number instanceof IntegerValue i) {
				return i.negate();
			} else if (number instanceof FloatValue f) {
				return f.negate();
			} else {
				return ((ComplexValue) number).negate();
			}
		}

		private double realPart(PyValue number, int start) {
			if (number instanceof FloatValue f) {
				return f.value();
			}
			double result = ((IntegerValue) number).value().doubleValue();
			if (Double.isInfinite(result)) {
				throw input.errorAt(MALFORMED_NUMBER, "Integer is too large to convert to float", start);
			}
			return result;
		}

		/**
		 * Either a tuple, or a value in grouping parentheses.
		 * The difference is the comma: {@code (1)} is just {@code 1}, while {@code (1,)} is a tuple.
		 */
		private PyValue parseParenthesized(int depth) {
			enter(depth);
			input.consumeFixedToken(START_TUPLE);
			if (input.nextTokenIs(END_TUPLE)) {
				return TupleValue.EMPTY;
			}
			PyValue first = parseValue(depth);
			Token token = input.peekToken();
			if (token == END_TUPLE) {
				input.consumeFixedToken(token);
				return first;
			} else if (token != COMMA) {
				throw unexpectedInCollection(token, END_TUPLE);
			}
			List<PyValue> elements = new ArrayList<>();
			elements.add(first);
			parseRemainingElements(elements, END_TUPLE, depth);
			return new TupleValue(elements);
		}

		private PyValue parseList(int depth) {
			enter(depth);
			input.consumeFixedToken(START_LIST);
			List<PyValue> elements = new ArrayList<>();
			if (!input.nextTokenIs(END_LIST)) {
				elements.add(parseValue(depth));
				parseRemainingElements(elements, END_LIST, depth);
			}
			return new ListValue(elements);
		}

		/**
		 * The first entry decides: a colon means dict, anything else means set.
		 * {@code {}} is always a dict.
		 */
		private PyValue parseBraces(int depth) {
			enter(depth);
			input.consumeFixedToken(START_BRACE);
			if (input.nextTokenIs(END_BRACE)) {
				return DictValue.EMPTY;
			}
			PyValue first = parseValue(depth);
			if (input.nextTokenIs(COLON)) {
				return parseDictRemainder(first, depth);
			} else {
				List<PyValue> elements = new ArrayList<>();
				elements.add(first);
				parseRemainingElements(elements, END_BRACE, depth);
				return new SetValue(elements);
			}
		}

		/**
		 * Called just after the first key and its colon.
		 */
		private DictValue parseDictRemainder(PyValue firstKey, int depth) {
			List<DictValue.Entry> entries = new ArrayList<>();
			entries.add(new DictValue.Entry(firstKey, parseValue(depth)));
			while (true) {
				Token token = input.peekToken();
				if (token == END_BRACE) {
					input.consumeFixedToken(token);
					return new DictValue(entries);
				} else if (token != COMMA) {
					throw unexpectedInCollection(token, END_BRACE);
				}
				input.consumeFixedToken(token);
				if (input.nextTokenIs(END_BRACE)) {
					return new DictValue(entries);
				}
				PyValue key = parseValue(depth);
				Token colon = input.peekToken();
				if (colon == END_TEXT) {
					throw input.error(UNEXPECTED_END_OF_INPUT, "Expected ':' after dict key");
				} else if (colon != COLON) {
					throw input.error(MALFORMED_COLLECTION, "Expected ':' after dict key; set elements and dict entries can't be mixed");
				}
				input.consumeFixedToken(colon);
				entries.add(new DictValue.Entry(key, parseValue(depth)));
			}
		}

		/**
		 * Called just after the first element.
		 * Consumes the remaining elements, separated by commas, along with
		 * an optional trailing comma and the closing delimiter.
		 */
		private void parseRemainingElements(List<PyValue> elements, Token closer, int depth) {
			while (true) {
				Token token = input.peekToken();
				if (token == closer) {
					input.consumeFixedToken(token);
					return;
				} else if (token != COMMA) {
					throw unexpectedInCollection(token, closer);
				}
				input.consumeFixedToken(token);
				if (input.nextTokenIs(closer)) {
					return;
				}
				elements.add(parseValue(depth));
			}
		}

		private PyLiteralSyntaxException unexpectedInCollection(Token token, Token closer) {
			String expected = "Expected ',' or '" + closer.fixedRepresentation() + "'";
			if (token == END_TEXT) {
				return input.error(UNEXPECTED_END_OF_INPUT, expected);
			} else if (token == COLON && closer == END_BRACE) {
				return input.error(MALFORMED_COLLECTION, expected + "; set elements and dict entries can't be mixed");
			} else {
				return input.error(MALFORMED_COLLECTION, expected);
			}
		}

		private void enter(int depth) {
			if (depth > maxNestingDepth) {
				throw input.error(NESTING_TOO_DEEP, "Collections are nested more than " + maxNestingDepth + " deep");
			}
		}

		private void logEntry(String methodName, int depth) {
			if (LOGGER.isTraceEnabled()) {
				LOGGER.trace("{}({}) @ {}: |{}|", methodName, depth, input.position(), input.previewString(10));
			}
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(LiteralParser.class);
}
