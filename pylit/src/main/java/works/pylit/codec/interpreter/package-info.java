/**
 * Implements {@link works.pylit.codec.Codec Codec} with a hand-written
 * recursive-descent {@link works.pylit.codec.interpreter.LiteralParser parser}
 * and a matching {@link works.pylit.codec.interpreter.LiteralGenerator generator}.
 */
package works.pylit.codec.interpreter;
