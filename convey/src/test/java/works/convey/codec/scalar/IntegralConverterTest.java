package works.convey.codec.scalar;

import com.google.common.primitives.UnsignedInteger;
import com.google.common.primitives.UnsignedLong;
import java.util.Optional;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;
import works.convey.codec.Converter;
import works.convey.tree.Node;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static works.convey.codec.scalar.IntegralConverter.BYTE;
import static works.convey.codec.scalar.IntegralConverter.INTEGER;
import static works.convey.codec.scalar.IntegralConverter.LONG;
import static works.convey.codec.scalar.IntegralConverter.SHORT;
import static works.convey.codec.scalar.IntegralConverter.UNSIGNED_BYTE;
import static works.convey.codec.scalar.IntegralConverter.UNSIGNED_INTEGER;
import static works.convey.codec.scalar.IntegralConverter.UNSIGNED_LONG;
import static works.convey.codec.scalar.IntegralConverter.UNSIGNED_SHORT;

class IntegralConverterTest {

	@ParameterizedTest
	@ValueSource(strings = {"42", "+42", "042", "0o52", "0x2a", "0x2A", "0x002a"})
	void fortyTwo(String text) {
		assertEquals(Optional.of(42), INTEGER.decode(Node.scalar(text)));
	}

	@ParameterizedTest
	@ValueSource(strings = {"-0x2a", "+0x2a", "-0o52", "42.", "4 2", " 42", "", "0b101010", "0o8", "1e3", "forty-two", "0x"})
	void notAnInteger(String text) {
		assertEquals(Optional.empty(), INTEGER.decode(Node.scalar(text)));
	}

	@Test
	void wrongShape() {
		assertEquals(Optional.empty(), INTEGER.decode(Node.nullNode()));
		assertEquals(Optional.empty(), INTEGER.decode(Node.sequence(Node.scalar("1"))));
		assertEquals(Optional.empty(), INTEGER.decode(Node.map()));
	}

	@Test
	void signedBoundaries() {
		assertEquals(Optional.of(Integer.MAX_VALUE), INTEGER.decode(Node.scalar("2147483647")));
		assertEquals(Optional.of(Integer.MIN_VALUE), INTEGER.decode(Node.scalar("-2147483648")));
		assertEquals(Optional.empty(), INTEGER.decode(Node.scalar("2147483648")));
		assertEquals(Optional.empty(), INTEGER.decode(Node.scalar("-2147483649")));

		assertEquals(Optional.of(Long.MAX_VALUE), LONG.decode(Node.scalar("9223372036854775807")));
		assertEquals(Optional.of(Long.MIN_VALUE), LONG.decode(Node.scalar("-9223372036854775808")));
		assertEquals(Optional.empty(), LONG.decode(Node.scalar("9223372036854775808")));
		assertEquals(Optional.empty(), LONG.decode(Node.scalar("-9223372036854775809")));
		assertEquals(Optional.empty(), LONG.decode(Node.scalar("0xffffffffffffffff")));

		assertEquals(Optional.of((byte) 127), BYTE.decode(Node.scalar("127")));
		assertEquals(Optional.of((byte) -128), BYTE.decode(Node.scalar("-128")));
		assertEquals(Optional.empty(), BYTE.decode(Node.scalar("128")));
		assertEquals(Optional.empty(), BYTE.decode(Node.scalar("0xff")));

		assertEquals(Optional.of((short) -32768), SHORT.decode(Node.scalar("-32768")));
		assertEquals(Optional.empty(), SHORT.decode(Node.scalar("32768")));
	}

	@Test
	void overflowingAccumulator() {
		assertEquals(Optional.empty(), INTEGER.decode(Node.scalar("99999999999999999999")));
		assertEquals(Optional.empty(), LONG.decode(Node.scalar("99999999999999999999")));
		assertEquals(Optional.empty(), UNSIGNED_LONG.decode(Node.scalar("18446744073709551616")));
		assertEquals(Optional.empty(), UNSIGNED_LONG.decode(Node.scalar("0x10000000000000000")));
		assertEquals(Optional.empty(), UNSIGNED_LONG.decode(Node.scalar("0o2000000000000000000000")));
	}

	@Test
	void negativeZero() {
		assertEquals(Optional.of(0), INTEGER.decode(Node.scalar("-0")));
		assertEquals(Optional.of(UnsignedInteger.ZERO), UNSIGNED_INTEGER.decode(Node.scalar("-0")));
	}

	@Test
	void unsignedRejectsNegatives() {
		assertEquals(Optional.empty(), UNSIGNED_INTEGER.decode(Node.scalar("-1")));
		assertEquals(Optional.empty(), UNSIGNED_BYTE.decode(Node.scalar("-1")));
		assertEquals(Optional.empty(), UNSIGNED_LONG.decode(Node.scalar("-1")));
	}

	@Test
	void unsignedBoundaries() {
		assertEquals(Optional.of((byte) -1), UNSIGNED_BYTE.decode(Node.scalar("255")));
		assertEquals(Optional.empty(), UNSIGNED_BYTE.decode(Node.scalar("256")));
		assertEquals(Node.scalar("255"), UNSIGNED_BYTE.encode((byte) -1));

		assertEquals(Optional.of((short) -1), UNSIGNED_SHORT.decode(Node.scalar("0xffff")));
		assertEquals(Optional.empty(), UNSIGNED_SHORT.decode(Node.scalar("65536")));
		assertEquals(Node.scalar("65535"), UNSIGNED_SHORT.encode((short) -1));

		assertEquals(Optional.of(UnsignedInteger.MAX_VALUE), UNSIGNED_INTEGER.decode(Node.scalar("4294967295")));
		assertEquals(Optional.empty(), UNSIGNED_INTEGER.decode(Node.scalar("4294967296")));
		assertEquals(Node.scalar("4294967295"), UNSIGNED_INTEGER.encode(UnsignedInteger.MAX_VALUE));

		assertEquals(Optional.of(UnsignedLong.MAX_VALUE), UNSIGNED_LONG.decode(Node.scalar("18446744073709551615")));
		assertEquals(Optional.of(UnsignedLong.MAX_VALUE), UNSIGNED_LONG.decode(Node.scalar("0xFFFFFFFFFFFFFFFF")));
		assertEquals(Node.scalar("18446744073709551615"), UNSIGNED_LONG.encode(UnsignedLong.MAX_VALUE));
	}

	@Test
	void encodeIsPlainDecimal() {
		assertEquals(Node.scalar("42"), INTEGER.encode(42));
		assertEquals(Node.scalar("-42"), INTEGER.encode(-42));
		assertEquals(Node.scalar("-9223372036854775808"), LONG.encode(Long.MIN_VALUE));
	}

	static Stream<Object[]> roundTripCases() {
		return Stream.of(
			new Object[]{BYTE, new Object[]{Byte.MIN_VALUE, (byte) -1, (byte) 0, (byte) 1, Byte.MAX_VALUE}},
			new Object[]{SHORT, new Object[]{Short.MIN_VALUE, (short) 0, Short.MAX_VALUE}},
			new Object[]{INTEGER, new Object[]{Integer.MIN_VALUE, -1, 0, 1, 1_000_000, Integer.MAX_VALUE}},
			new Object[]{LONG, new Object[]{Long.MIN_VALUE, -1L, 0L, Long.MAX_VALUE}},
			new Object[]{UNSIGNED_BYTE, new Object[]{(byte) 0, (byte) 0x7f, (byte) 0x80, (byte) 0xff}},
			new Object[]{UNSIGNED_SHORT, new Object[]{(short) 0, (short) 0x8000, (short) 0xffff}},
			new Object[]{UNSIGNED_INTEGER, new Object[]{UnsignedInteger.ZERO, UnsignedInteger.valueOf(0x8000_0000L), UnsignedInteger.MAX_VALUE}},
			new Object[]{UNSIGNED_LONG, new Object[]{UnsignedLong.ZERO, UnsignedLong.fromLongBits(Long.MIN_VALUE), UnsignedLong.MAX_VALUE}}
		);
	}

	@ParameterizedTest
	@MethodSource("roundTripCases")
	@SuppressWarnings("unchecked")
	void roundTrip(IntegralConverter<?> converter, Object[] values) {
		Converter<Object> c = (Converter<Object>) converter;
		for (Object value : values) {
			assertEquals(Optional.of(value), c.decode(c.encode(value)), () -> converter + " " + value);
		}
	}

	@Test
	void customRange() {
		IntegralConverter<Integer> percent = IntegralConverter.signed("percent", 0, 100, Integer::longValue, l -> (int) l);
		assertEquals(Optional.of(100), percent.decode(Node.scalar("100")));
		assertEquals(Optional.empty(), percent.decode(Node.scalar("101")));
		assertEquals(Optional.empty(), percent.decode(Node.scalar("-1")));
		assertThrows(IllegalArgumentException.class, () -> IntegralConverter.signed("bad", 1, 100, Integer::longValue, l -> (int) l));
	}
}
