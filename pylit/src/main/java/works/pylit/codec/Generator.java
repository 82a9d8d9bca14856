package works.pylit.codec;

import works.pylit.exceptions.PyLiteralProcessingException;
import works.pylit.value.PyValue;

/**
 * Emits literal text corresponding to {@link PyValue}s.
 */
public interface Generator {
	/**
	 * @throws PyLiteralProcessingException if {@code out} throws {@link java.io.IOException}
	 */
	void generate(Appendable out, PyValue value);
}
