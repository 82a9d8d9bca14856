package works.pylit.codec.io;

import java.math.BigInteger;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;
import works.pylit.exceptions.ErrorKind;
import works.pylit.exceptions.PyLiteralSyntaxException;
import works.pylit.value.ComplexValue;
import works.pylit.value.FloatValue;
import works.pylit.value.IntegerValue;
import works.pylit.value.PyValue;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.params.provider.Arguments.arguments;

class NumericLiteralReaderTest {

	@ParameterizedTest
	@MethodSource("integers")
	void integer(String text, String expected) {
		assertEquals(new IntegerValue(new BigInteger(expected)), readAll(text));
	}

	static Stream<Arguments> integers() {
		return Stream.of(
			arguments("0", "0"),
			arguments("000", "0"),
			arguments("0_0", "0"),
			arguments("7", "7"),
			arguments("1_000_000", "1000000"),
			arguments("0x1A", "26"),
			arguments("0XfF", "255"),
			arguments("0x_ff", "255"),
			arguments("0o17", "15"),
			arguments("0O_7_7", "63"),
			arguments("0b1010", "10"),
			arguments("0B1_0", "2"),
			arguments("123456789012345678901234567890", "123456789012345678901234567890"),
			arguments("0xFFFFFFFFFFFFFFFFFFFF", "1208925819614629174706175")
		);
	}

	@ParameterizedTest
	@MethodSource("floats")
	void floatingPoint(String text, double expected) {
		assertEquals(new FloatValue(expected), readAll(text));
	}

	static Stream<Arguments> floats() {
		return Stream.of(
			arguments("1.5", 1.5),
			arguments("1.", 1.0),
			arguments(".5", 0.5),
			arguments("0.0", 0.0),
			arguments("1e3", 1000.0),
			arguments("1E-3", 0.001),
			arguments("1.5e+2", 150.0),
			arguments("1.e2", 100.0),
			arguments("1_0.2_5", 10.25),
			arguments("1e1_0", 1e10),
			arguments("09.5", 9.5),
			arguments("1e400", Double.POSITIVE_INFINITY),
			arguments("1e-400", 0.0)
		);
	}

	@ParameterizedTest
	@MethodSource("imaginaries")
	void imaginary(String text, double expected) {
		assertEquals(ComplexValue.imaginary(expected), readAll(text));
	}

	static Stream<Arguments> imaginaries() {
		return Stream.of(
			arguments("2j", 2.0),
			arguments("2J", 2.0),
			arguments("1.5j", 1.5),
			arguments(".5j", 0.5),
			arguments("1e2j", 100.0),
			arguments("09j", 9.0),
			arguments("0j", 0.0)
		);
	}

	@Test
	void stopsAtDelimiter() {
		SourceReader reader = new SourceReader("12, 3");
		assertEquals(PyValue.of(12), NumericLiteralReader.read(reader));
		assertEquals(2, reader.position());

		reader = new SourceReader("1+2j");
		assertEquals(PyValue.of(1), NumericLiteralReader.read(reader));
		assertEquals(1, reader.position());

		reader = new SourceReader("1e5-3");
		assertEquals(PyValue.of(1e5), NumericLiteralReader.read(reader));
		assertEquals(3, reader.position());
	}

	@ParameterizedTest
	@ValueSource(strings = {
		"123abc",
		"0b102",
		"0o8",
		"0x",
		"0xg",
		"0b",
		"1__0",
		"1_",
		"1_.5",
		"1._5",
		"1e",
		"1e+",
		"1e_5",
		"01",
		"007",
		"1.2.3",
		"1jj",
		"1.5L",
		"0x_",
		"0x__1",
	})
	void malformed(String text) {
		var e = assertThrows(PyLiteralSyntaxException.class, () -> readAll(text));
		assertEquals(ErrorKind.MALFORMED_NUMBER, e.kind(), e::getMessage);
	}

	@Test
	void loneDot() {
		var e = assertThrows(PyLiteralSyntaxException.class, () -> readAll("."));
		assertEquals(ErrorKind.UNEXPECTED_TOKEN, e.kind());
		assertEquals(0, e.offset());
	}

	@Test
	void leadingZeroErrorPointsAtLiteral() {
		var e = assertThrows(PyLiteralSyntaxException.class, () -> NumericLiteralReader.read(new SourceReader("0123")));
		assertEquals(0, e.offset());
	}

	private static PyValue readAll(String text) {
		SourceReader reader = new SourceReader(text);
		PyValue result = NumericLiteralReader.read(reader);
		assertEquals(text.length(), reader.position(), "Should consume the whole literal");
		return result;
	}
}
