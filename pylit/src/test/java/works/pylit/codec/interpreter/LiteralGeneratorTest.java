package works.pylit.codec.interpreter;

import java.io.IOException;
import java.io.Writer;
import java.math.BigInteger;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import works.pylit.codec.CodecBuilder.Settings;
import works.pylit.codec.QuoteStyle;
import works.pylit.exceptions.PyLiteralProcessingException;
import works.pylit.value.BytesValue;
import works.pylit.value.ComplexValue;
import works.pylit.value.DictValue;
import works.pylit.value.ListValue;
import works.pylit.value.NoneValue;
import works.pylit.value.PyValue;
import works.pylit.value.SetValue;
import works.pylit.value.TupleValue;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.params.provider.Arguments.arguments;

class LiteralGeneratorTest {

	@ParameterizedTest
	@MethodSource("canonicalForms")
	void canonicalForm(PyValue value, String expected) {
		assertEquals(expected, generate(Settings.DEFAULT, value));
	}

	static Stream<Arguments> canonicalForms() {
		return Stream.of(
			arguments(NoneValue.NONE, "None"),
			arguments(PyValue.of(true), "True"),
			arguments(PyValue.of(false), "False"),
			arguments(PyValue.of(-42), "-42"),
			arguments(PyValue.of(new BigInteger("123456789012345678901234567890")), "123456789012345678901234567890"),
			arguments(PyValue.of(1.0), "1.0"),
			arguments(PyValue.of(1e16), "1e+16"),
			arguments(PyValue.of(Double.NEGATIVE_INFINITY), "-1e999"),
			arguments(PyValue.of(Double.NaN), "nan"),
			arguments(new ComplexValue(1, 2), "1+2j"),
			arguments(new ComplexValue(1.5, -0.25), "1.5-0.25j"),
			arguments(new ComplexValue(0, 2), "2j"),
			arguments(new ComplexValue(0, -2), "0-2j"),
			arguments(new ComplexValue(-0.0, -2), "-0.0-2j"),
			arguments(new ComplexValue(-0.0, 2), "-0.0+2j"),
			arguments(new ComplexValue(0, -0.0), "0-0j"),
			arguments(new ComplexValue(-1, 0), "-1+0j"),
			arguments(new ComplexValue(1e16, 1e-5), "1e+16+1e-05j"),
			arguments(new ComplexValue(Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY), "1e999-1e999j"),
			arguments(PyValue.of(""), "\"\""),
			arguments(PyValue.of("it's"), "\"it's\""),
			arguments(PyValue.of("say \"hi\""), "\"say \\\"hi\\\"\""),
			arguments(PyValue.of("a\nb\tc\r\\"), "\"a\\nb\\tc\\r\\\\\""),
			arguments(PyValue.of("\0\u0007\u007f"), "\"\\x00\\x07\\x7f\""),
			arguments(PyValue.of("é中😀"), "\"é中😀\""),
			arguments(PyValue.of("\u00a0\u200b\u2028"), "\"\\xa0\\u200b\\u2028\""),
			arguments(PyValue.of("\ud800"), "\"\\ud800\""),
			arguments(new BytesValue(new byte[0]), "b\"\""),
			arguments(new BytesValue(new byte[] { 'h', 'i', '"', '\'', '\\', '\n', 0, (byte) 0x7f, (byte) 0xff }), "b\"hi\\\"'\\\\\\n\\x00\\x7f\\xff\""),
			arguments(TupleValue.EMPTY, "()"),
			arguments(TupleValue.of(PyValue.of(1)), "(1,)"),
			arguments(TupleValue.of(PyValue.of(1), PyValue.of(2)), "(1, 2)"),
			arguments(ListValue.of(), "[]"),
			arguments(ListValue.of(PyValue.of(1), ListValue.of(PyValue.of("x"))), "[1, [\"x\"]]"),
			arguments(new SetValue(List.of()), "set()"),
			arguments(SetValue.of(PyValue.of(3), PyValue.of(1), PyValue.of(2)), "{3, 1, 2}"),
			arguments(DictValue.EMPTY, "{}"),
			arguments(DictValue.builder().put(PyValue.of("b"), PyValue.of(1)).put(PyValue.of("a"), TupleValue.EMPTY).build(), "{\"b\": 1, \"a\": ()}")
		);
	}

	@ParameterizedTest
	@MethodSource("quoteStyles")
	void quoteStyle(QuoteStyle style, String text, String expected) {
		assertEquals(expected, generate(Settings.DEFAULT.withQuoteStyle(style), PyValue.of(text)));
	}

	static Stream<Arguments> quoteStyles() {
		return Stream.of(
			arguments(QuoteStyle.SINGLE, "abc", "'abc'"),
			arguments(QuoteStyle.SINGLE, "it's", "'it\\'s'"),
			arguments(QuoteStyle.SINGLE, "\"", "'\"'"),
			arguments(QuoteStyle.ADAPTIVE, "abc", "'abc'"),
			arguments(QuoteStyle.ADAPTIVE, "it's", "\"it's\""),
			arguments(QuoteStyle.ADAPTIVE, "\"", "'\"'"),
			arguments(QuoteStyle.ADAPTIVE, "'\"", "'\\'\"'"),
			arguments(QuoteStyle.DOUBLE, "'\"", "\"'\\\"\"")
		);
	}

	@Test
	void adaptiveBytes() {
		Settings settings = Settings.DEFAULT.withQuoteStyle(QuoteStyle.ADAPTIVE);
		assertEquals("b'x'", generate(settings, new BytesValue(new byte[] { 'x' })));
		assertEquals("b\"'\"", generate(settings, new BytesValue(new byte[] { '\'' })));
	}

	@Test
	void asciiOnly() {
		PyValue value = ListValue.of(PyValue.of("é中😀 it's"), PyValue.of("plain"));
		assertEquals("[\"\\xe9\\u4e2d\\U0001f600 it's\", 'plain']", generate(Settings.ASCII, value));
		assertEquals("\"\\xe9\"", generate(Settings.DEFAULT.withAsciiOnly(true), PyValue.of("é")));
	}

	@Test
	void appendsToExistingContent() {
		StringBuilder sb = new StringBuilder("x = ");
		new LiteralGenerator(Settings.DEFAULT).generate(sb, TupleValue.of(PyValue.of(1)));
		assertEquals("x = (1,)", sb.toString());
	}

	@Test
	void writerFailureIsWrapped() {
		Writer broken = new Writer() {
			@Override
			public void write(char[] cbuf, int off, int len) throws IOException {
				throw new IOException("disk on fire");
			}

			@Override
			public void flush() { }

			@Override
			public void close() { }
		};
		var e = assertThrows(PyLiteralProcessingException.class,
			() -> new LiteralGenerator(Settings.DEFAULT).generate(broken, PyValue.of("x")));
		assertInstanceOf(IOException.class, e.getCause());
	}

	@Test
	void printable() {
		assertTrue(LiteralGenerator.Session.isPrintable('a'));
		assertTrue(LiteralGenerator.Session.isPrintable(' '));
		assertTrue(LiteralGenerator.Session.isPrintable(0x4E2D));
		assertTrue(LiteralGenerator.Session.isPrintable(0x1F600));
		assertFalse(LiteralGenerator.Session.isPrintable('\n'));
		assertFalse(LiteralGenerator.Session.isPrintable(0x7F));
		assertFalse(LiteralGenerator.Session.isPrintable(0x85));
		assertFalse(LiteralGenerator.Session.isPrintable(0xA0));
		assertFalse(LiteralGenerator.Session.isPrintable(0xFEFF));
		assertFalse(LiteralGenerator.Session.isPrintable(0xE000));
		assertFalse(LiteralGenerator.Session.isPrintable(0x10FFFF));
	}

	private static String generate(Settings settings, PyValue value) {
		StringBuilder sb = new StringBuilder();
		new LiteralGenerator(settings).generate(sb, value);
		return sb.toString();
	}
}
