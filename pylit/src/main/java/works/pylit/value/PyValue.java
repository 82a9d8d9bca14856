package works.pylit.value;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * An immutable Python literal value.
 * <p>
 * The set of variants is closed; {@link #kind()} lets callers
 * {@code switch} over them exhaustively.
 * <p>
 * All variants use structural equality.
 * Floating-point components compare by bit pattern, so NaN equals NaN
 * and {@code 0.0} does not equal {@code -0.0}.
 * This keeps {@link SetValue} and {@link DictValue} membership total and deterministic.
 * <p>
 * The {@link Object#toString() toString} method of each variant returns
 * the canonical literal text produced by {@link works.pylit.PyLiteral#format}.
 */
public sealed interface PyValue permits
	NoneValue,
	BooleanValue,
	IntegerValue,
	FloatValue,
	ComplexValue,
	BytesValue,
	StringValue,
	TupleValue,
	ListValue,
	SetValue,
	DictValue
{
	enum Kind {
		NONE,
		BOOLEAN,
		INTEGER,
		FLOAT,
		COMPLEX,
		BYTES,
		STRING,
		TUPLE,
		LIST,
		SET,
		DICT,
	}

	Kind kind();

	default boolean isNone() { return kind() == Kind.NONE; }
	default boolean isBoolean() { return kind() == Kind.BOOLEAN; }
	default boolean isInteger() { return kind() == Kind.INTEGER; }
	default boolean isFloat() { return kind() == Kind.FLOAT; }
	default boolean isComplex() { return kind() == Kind.COMPLEX; }
	default boolean isBytes() { return kind() == Kind.BYTES; }
	default boolean isString() { return kind() == Kind.STRING; }
	default boolean isTuple() { return kind() == Kind.TUPLE; }
	default boolean isList() { return kind() == Kind.LIST; }
	default boolean isSet() { return kind() == Kind.SET; }
	default boolean isDict() { return kind() == Kind.DICT; }

	default Optional<Boolean> asBoolean() {
		return (this instanceof BooleanValue b)? Optional.of(b.value()) : Optional.empty();
	}

	default Optional<BigInteger> asInteger() {
		return (this instanceof IntegerValue i)? Optional.of(i.value()) : Optional.empty();
	}

	default Optional<Double> asFloat() {
		return (this instanceof FloatValue f)? Optional.of(f.value()) : Optional.empty();
	}

	default Optional<ComplexValue> asComplex() {
		return (this instanceof ComplexValue c)? Optional.of(c) : Optional.empty();
	}

	default Optional<byte[]> asBytes() {
		return (this instanceof BytesValue b)? Optional.of(b.bytes()) : Optional.empty();
	}

	default Optional<String> asString() {
		return (this instanceof StringValue s)? Optional.of(s.value()) : Optional.empty();
	}

	/**
	 * @return the elements of a {@link TupleValue}, {@link ListValue} or {@link SetValue};
	 * empty for other kinds
	 */
	default Optional<List<PyValue>> asSequence() {
		if (this instanceof TupleValue t) {
			return Optional.of(t.elements());
		} else if (this instanceof ListValue l) {
			return Optional.of(l.elements());
		} else if (this instanceof SetValue s) {
			return Optional.of(s.elements());
		} else {
			return Optional.empty();
		}
	}

	default Optional<DictValue> asDict() {
		return (this instanceof DictValue d)? Optional.of(d) : Optional.empty();
	}

	static PyValue none() {
		return NoneValue.NONE;
	}

	static PyValue of(boolean value) {
		return BooleanValue.of(value);
	}

	static PyValue of(long value) {
		return new IntegerValue(BigInteger.valueOf(value));
	}

	static PyValue of(BigInteger value) {
		return new IntegerValue(value);
	}

	static PyValue of(double value) {
		return new FloatValue(value);
	}

	static PyValue of(String value) {
		return new StringValue(value);
	}
}
