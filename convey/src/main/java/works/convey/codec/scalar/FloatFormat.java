package works.convey.codec.scalar;

import java.math.BigDecimal;

import static works.convey.codec.scalar.ScalarGrammar.DECIMAL;

/**
 * Lays out the digits of a finite floating-point value the way C's {@code %g} does
 * with a precision of {@code maxDigits}: fixed notation for moderate exponents,
 * scientific notation otherwise, and no trailing zeros.
 * <p>
 * The digits themselves come from {@link Double#toString} or {@link Float#toString},
 * which produce as few as will read back as the same value.
 */
final class FloatFormat {
	static final int DOUBLE_DIGITS = 17;
	static final int FLOAT_DIGITS = 9;

	private FloatFormat() { }

	/**
	 * @param javaText the output of {@link Double#toString} or {@link Float#toString} for a finite value
	 * @param negativeZero true if the value is -0.0
	 * @param maxDigits the number of significant decimal digits that always suffices to round-trip the type
	 */
	static String format(String javaText, boolean negativeZero, int maxDigits) {
		String result;
		BigDecimal decimal = new BigDecimal(javaText);
		if (decimal.signum() == 0) {
			result = negativeZero ? "-0" : "0";
		} else {
			decimal = decimal.stripTrailingZeros();
			int exponent = decimal.precision() - decimal.scale() - 1;
			if (-4 <= exponent && exponent < maxDigits) {
				result = decimal.toPlainString();
			} else {
				result = scientific(decimal, exponent);
			}
		}
		if (DECIMAL.matches(result)) {
			// Would read back as an integer
			return result + ".";
		} else {
			return result;
		}
	}

	private static String scientific(BigDecimal decimal, int exponent) {
		String digits = decimal.unscaledValue().abs().toString();
		StringBuilder sb = new StringBuilder();
		if (decimal.signum() < 0) {
			sb.append('-');
		}
		sb.append(digits.charAt(0));
		if (digits.length() > 1) {
			sb.append('.').append(digits, 1, digits.length());
		}
		sb.append('e').append(exponent < 0 ? '-' : '+');
		int magnitude = Math.abs(exponent);
		if (magnitude < 10) {
			sb.append('0');
		}
		sb.append(magnitude);
		return sb.toString();
	}
}
