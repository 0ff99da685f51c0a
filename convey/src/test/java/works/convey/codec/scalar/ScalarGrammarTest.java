package works.convey.codec.scalar;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.convey.codec.scalar.ScalarGrammar.DECIMAL;
import static works.convey.codec.scalar.ScalarGrammar.FLOAT;
import static works.convey.codec.scalar.ScalarGrammar.HEX;
import static works.convey.codec.scalar.ScalarGrammar.INFINITY;
import static works.convey.codec.scalar.ScalarGrammar.NAN;
import static works.convey.codec.scalar.ScalarGrammar.OCTAL;

class ScalarGrammarTest {

	@ParameterizedTest
	@ValueSource(strings = {"0", "42", "-7", "+7", "007"})
	void decimal(String text) {
		assertTrue(DECIMAL.matches(text));
		assertFalse(OCTAL.matches(text));
		assertFalse(HEX.matches(text));
	}

	@ParameterizedTest
	@ValueSource(strings = {"", "-", "4 2", "42.", "1e3", "0x10"})
	void notDecimal(String text) {
		assertFalse(DECIMAL.matches(text));
	}

	@ParameterizedTest
	@ValueSource(strings = {"0o0", "0o52", "0o777"})
	void octal(String text) {
		assertTrue(OCTAL.matches(text));
	}

	@ParameterizedTest
	@ValueSource(strings = {"0o", "0o8", "-0o52", "0O52", "052o"})
	void notOctal(String text) {
		assertFalse(OCTAL.matches(text));
	}

	@ParameterizedTest
	@ValueSource(strings = {"0x0", "0x2a", "0x2A", "0xDeadBeef"})
	void hex(String text) {
		assertTrue(HEX.matches(text));
	}

	@ParameterizedTest
	@ValueSource(strings = {"0x", "0xg", "-0x2a", "0X2a"})
	void notHex(String text) {
		assertFalse(HEX.matches(text));
	}

	@ParameterizedTest
	@ValueSource(strings = {"1", "5.", ".5", "-1.5", "+1.5e10", "1E-3", "1.e+2"})
	void floats(String text) {
		assertTrue(FLOAT.matches(text));
	}

	@ParameterizedTest
	@ValueSource(strings = {"", ".", "e5", "1e", "1.5.2", "0x1p3", "Infinity", "NaN"})
	void notFloats(String text) {
		assertFalse(FLOAT.matches(text));
	}

	@ParameterizedTest
	@ValueSource(strings = {".inf", ".Inf", ".INF", "-.inf", "+.INF"})
	void infinity(String text) {
		assertTrue(INFINITY.matches(text));
	}

	@ParameterizedTest
	@ValueSource(strings = {".nan", ".NaN", ".NAN"})
	void nan(String text) {
		assertTrue(NAN.matches(text));
		assertFalse(INFINITY.matches(text));
	}

	@ParameterizedTest
	@ValueSource(strings = {"-.nan", ".Nan", "nan"})
	void notNan(String text) {
		assertFalse(NAN.matches(text));
	}
}
