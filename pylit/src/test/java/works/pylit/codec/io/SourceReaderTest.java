package works.pylit.codec.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import works.pylit.codec.Token;
import works.pylit.exceptions.ErrorKind;
import works.pylit.exceptions.PyLiteralSyntaxException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.pylit.codec.Token.COMMA;
import static works.pylit.codec.Token.END_LIST;
import static works.pylit.codec.Token.END_TEXT;
import static works.pylit.codec.Token.NONE;
import static works.pylit.codec.Token.START_LIST;
import static works.pylit.codec.Token.TRUE;

class SourceReaderTest {

	@ParameterizedTest
	@ValueSource(strings = {
		"",
		" ",
		"\n\t\r\f",
		"# just a comment",
		"  # comment\n  # another\n",
		"\\\n",
		"\\\r\n",
	})
	void onlyInsignificantText(String text) {
		SourceReader reader = new SourceReader(text);
		assertEquals(END_TEXT, reader.peekToken());
		assertTrue(reader.atEnd());
	}

	@Test
	void peekIsIdempotent() {
		SourceReader reader = new SourceReader("  [");
		assertEquals(START_LIST, reader.peekToken());
		assertEquals(START_LIST, reader.peekToken());
		assertEquals(2, reader.position());
	}

	@Test
	void fixedTokens() {
		SourceReader reader = new SourceReader("[ None , # comment\n True ]");
		assertTrue(reader.nextTokenIs(START_LIST));
		assertFalse(reader.nextTokenIs(COMMA));
		assertTrue(reader.nextTokenIs(NONE));
		assertTrue(reader.nextTokenIs(COMMA));
		assertTrue(reader.nextTokenIs(TRUE));
		assertTrue(reader.nextTokenIs(END_LIST));
		assertEquals(END_TEXT, reader.peekToken());
	}

	@ParameterizedTest
	@ValueSource(strings = {
		"Nonesuch",
		"Nope",
		"Truest",
		"Fals",
		"None_",
	})
	void misspelledKeyword(String text) {
		SourceReader reader = new SourceReader(text);
		Token token = reader.peekToken();
		var e = assertThrows(PyLiteralSyntaxException.class, () -> reader.consumeFixedToken(token));
		assertEquals(ErrorKind.UNEXPECTED_TOKEN, e.kind());
		assertEquals(0, e.offset());
	}

	@Test
	void errorPositionCountsLines() {
		SourceReader reader = new SourceReader("[\n  1,\r\n  2,\r  x");
		var e = reader.errorAt(ErrorKind.UNEXPECTED_TOKEN, "test", 15);
		assertEquals(15, e.offset());
		assertEquals(4, e.line());
		assertEquals(3, e.column());
		assertTrue(e.getMessage().contains("|x|"), e.getMessage());
	}

	@Test
	void errorAtEndHasNoPreview() {
		SourceReader reader = new SourceReader("ab");
		var e = reader.errorAt(ErrorKind.UNEXPECTED_END_OF_INPUT, "test", 2);
		assertEquals(1, e.line());
		assertEquals(3, e.column());
		assertFalse(e.getMessage().contains("|"), e.getMessage());
	}

	@Test
	void identifierParts() {
		assertTrue(SourceReader.isIdentifierPart('a'));
		assertTrue(SourceReader.isIdentifierPart('_'));
		assertTrue(SourceReader.isIdentifierPart('9'));
		assertFalse(SourceReader.isIdentifierPart('$'));
		assertFalse(SourceReader.isIdentifierPart('\''));
		assertFalse(SourceReader.isIdentifierPart(-1));
	}
}
