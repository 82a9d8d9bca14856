package works.pylit.value;

import java.util.Arrays;
import works.pylit.PyLiteral;

/**
 * Python {@code bytes}.
 * The array is copied on the way in and on the way out.
 */
public record BytesValue(byte[] bytes) implements PyValue {
	public BytesValue {
		bytes = bytes.clone();
	}

	@Override
	public byte[] bytes() {
		return bytes.clone();
	}

	public int length() {
		return bytes.length;
	}

	/**
	 * @return the unsigned value of the byte at {@code index}
	 */
	public int byteAt(int index) {
		return bytes[index] & 0xFF;
	}

	@Override
	public Kind kind() {
		return Kind.BYTES;
	}

	@Override
	public boolean equals(Object obj) {
		return (obj instanceof BytesValue other) && Arrays.equals(bytes, other.bytes);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(bytes);
	}

	@Override
	public String toString() {
		return PyLiteral.format(this);
	}
}
