/**
 * Reads and writes Python literal values, the text accepted by Python's {@code ast.literal_eval}.
 * <p>
 * The major packages are:
 *
 * <ul>
 *     <li>
 *         {@link works.pylit.value}, the immutable value model;
 *     </li>
 *     <li>
 *         {@link works.pylit.codec}, which parses and generates literal text
 *         according to {@link works.pylit.codec.CodecBuilder.Settings Settings}; and
 *     </li>
 *     <li>
 *         {@link works.pylit.exceptions}, the errors raised along the way.
 *     </li>
 * </ul>
 *
 * {@link works.pylit.PyLiteral} offers the common operations with default settings.
 */
module works.pylit {
	requires org.slf4j;
	requires com.ibm.icu;

	exports works.pylit;
	exports works.pylit.codec;
	exports works.pylit.value;
	exports works.pylit.exceptions;
}
