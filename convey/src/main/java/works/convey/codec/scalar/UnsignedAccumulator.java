package works.convey.codec.scalar;

import java.util.OptionalLong;

/**
 * Parses digit strings into a 64-bit unsigned accumulator,
 * reporting overflow as an empty result rather than an exception.
 * The result's bits are to be interpreted with {@link Long#compareUnsigned} and friends.
 */
final class UnsignedAccumulator {
	private UnsignedAccumulator() { }

	/**
	 * @param digits non-empty, and every character a valid digit in {@code radix}
	 * @return the unsigned value, or empty if it exceeds 2<sup>64</sup>-1
	 */
	static OptionalLong parse(CharSequence digits, int radix) {
		long limit = Long.divideUnsigned(-1L, radix);
		long result = 0;
		for (int i = 0; i < digits.length(); i++) {
			int digit = Character.digit(digits.charAt(i), radix);
			assert digit >= 0: "Invalid digit '" + digits.charAt(i) + "' in radix " + radix;
			if (Long.compareUnsigned(result, limit) > 0) {
				return OptionalLong.empty();
			}
			result *= radix;
			if (Long.compareUnsigned(result, -1L - digit) > 0) {
				return OptionalLong.empty();
			}
			result += digit;
		}
		return OptionalLong.of(result);
	}
}
