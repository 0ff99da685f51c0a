package works.convey.codec.scalar;

import com.google.common.primitives.UnsignedInteger;
import com.google.common.primitives.UnsignedLong;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.LongFunction;
import java.util.function.ToLongFunction;
import works.convey.codec.Converter;
import works.convey.codec.Mismatch;
import works.convey.tree.Node;
import works.convey.tree.ScalarNode;

import static works.convey.codec.scalar.ScalarGrammar.DECIMAL;
import static works.convey.codec.scalar.ScalarGrammar.HEX;
import static works.convey.codec.scalar.ScalarGrammar.OCTAL;

/**
 * Converts an integral type to and from plain decimal text.
 * <p>
 * Decoding also accepts {@code 0o}-prefixed octal and {@code 0x}-prefixed hex,
 * neither of which may carry a sign.
 * The digits are accumulated in 64 bits and then checked against the target range,
 * so any value that can't be represented exactly is rejected rather than truncated.
 * <p>
 * Unsigned types are held in Java as their bit patterns;
 * {@code max} is then interpreted as an unsigned quantity.
 */
public final class IntegralConverter<T> implements Converter<T> {
	public static final IntegralConverter<Byte> BYTE = signed("byte", Byte.MIN_VALUE, Byte.MAX_VALUE, Byte::longValue, l -> (byte) l);
	public static final IntegralConverter<Short> SHORT = signed("short", Short.MIN_VALUE, Short.MAX_VALUE, Short::longValue, l -> (short) l);
	public static final IntegralConverter<Integer> INTEGER = signed("int", Integer.MIN_VALUE, Integer.MAX_VALUE, Integer::longValue, l -> (int) l);
	public static final IntegralConverter<Long> LONG = signed("long", Long.MIN_VALUE, Long.MAX_VALUE, Long::longValue, l -> l);

	public static final IntegralConverter<Byte> UNSIGNED_BYTE = unsigned("unsigned byte", 0xFFL, Byte::toUnsignedLong, l -> (byte) l);
	public static final IntegralConverter<Short> UNSIGNED_SHORT = unsigned("unsigned short", 0xFFFFL, Short::toUnsignedLong, l -> (short) l);
	public static final IntegralConverter<UnsignedInteger> UNSIGNED_INTEGER = unsigned("unsigned int", 0xFFFF_FFFFL, UnsignedInteger::longValue, l -> UnsignedInteger.fromIntBits((int) l));
	public static final IntegralConverter<UnsignedLong> UNSIGNED_LONG = unsigned("unsigned long", -1L, UnsignedLong::longValue, UnsignedLong::fromLongBits);

	private final String name;
	private final boolean signed;
	private final long min;
	private final long max;
	private final ToLongFunction<? super T> widen;
	private final LongFunction<? extends T> narrow;

	private IntegralConverter(String name, boolean signed, long min, long max, ToLongFunction<? super T> widen, LongFunction<? extends T> narrow) {
		this.name = name;
		this.signed = signed;
		this.min = min;
		this.max = max;
		this.widen = widen;
		this.narrow = narrow;
	}

	/**
	 * @param widen must sign-extend
	 * @param narrow receives only values within [{@code min}, {@code max}]
	 */
	public static <T> IntegralConverter<T> signed(String name, long min, long max, ToLongFunction<? super T> widen, LongFunction<? extends T> narrow) {
		if (min > 0 || max < 0) {
			throw new IllegalArgumentException("Range of " + name + " must include zero: [" + min + "," + max + "]");
		}
		return new IntegralConverter<>(name, true, min, max, widen, narrow);
	}

	/**
	 * @param max as an unsigned quantity
	 * @param widen must zero-extend
	 * @param narrow receives only values within [0, {@code max}]
	 */
	public static <T> IntegralConverter<T> unsigned(String name, long max, ToLongFunction<? super T> widen, LongFunction<? extends T> narrow) {
		return new IntegralConverter<>(name, false, 0, max, widen, narrow);
	}

	@Override
	public Node encode(T value) {
		long bits = widen.applyAsLong(value);
		return Node.scalar(signed ? Long.toString(bits) : Long.toUnsignedString(bits));
	}

	@Override
	public Optional<T> decode(Node node) {
		if (!(node instanceof ScalarNode scalar)) {
			return Mismatch.SHAPE.reject(this, node);
		}
		String text = scalar.text();
		boolean negative = false;
		OptionalLong magnitude;
		if (DECIMAL.matches(text)) {
			char first = text.charAt(0);
			if (first == '-' || first == '+') {
				negative = (first == '-');
				magnitude = UnsignedAccumulator.parse(text.substring(1), 10);
			} else {
				magnitude = UnsignedAccumulator.parse(text, 10);
			}
		} else if (OCTAL.matches(text)) {
			magnitude = UnsignedAccumulator.parse(text.substring(2), 8);
		} else if (HEX.matches(text)) {
			magnitude = UnsignedAccumulator.parse(text.substring(2), 16);
		} else {
			return Mismatch.LEXICAL.reject(this, node);
		}
		if (magnitude.isEmpty()) {
			return Mismatch.RANGE.reject(this, node);
		}
		OptionalLong value = withinRange(negative, magnitude.getAsLong());
		if (value.isEmpty()) {
			return Mismatch.RANGE.reject(this, node);
		}
		return Optional.of(narrow.apply(value.getAsLong()));
	}

	private OptionalLong withinRange(boolean negative, long magnitude) {
		if (!negative || magnitude == 0) {
			// max is non-negative as a signed quantity, or any bits at all as an unsigned one
			return (Long.compareUnsigned(magnitude, max) <= 0)
				? OptionalLong.of(magnitude)
				: OptionalLong.empty();
		} else if (signed && Long.compareUnsigned(magnitude, -min) <= 0) {
			// For Long.MIN_VALUE, -min overflows to itself, which is 2^63 unsigned, as required
			return OptionalLong.of(-magnitude);
		} else {
			return OptionalLong.empty();
		}
	}

	@Override
	public String toString() {
		return name;
	}
}
