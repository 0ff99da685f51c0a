package works.convey.codec.scalar;

import java.util.Optional;
import java.util.function.DoubleFunction;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;
import works.convey.codec.Converter;
import works.convey.codec.Mismatch;
import works.convey.tree.Node;
import works.convey.tree.ScalarNode;

/**
 * Converts a floating-point type to and from decimal text,
 * with {@code .inf}, {@code -.inf}, and {@code .nan} for the special values.
 * <p>
 * Encoded text always reads back as the same value,
 * and never looks like an integer: {@code 5.0} encodes as {@code "5."}.
 * <p>
 * Decoding rounds to the nearest representable value without any range check,
 * so text whose magnitude is too large for the type decodes as an infinity,
 * and text too close to zero decodes as a zero of the same sign.
 */
public final class FloatingPointConverter<T> implements Converter<T> {
	public static final FloatingPointConverter<Double> DOUBLE = new FloatingPointConverter<>(
		"double", FloatFormat.DOUBLE_DIGITS, Double::doubleValue, d -> Double.toString(d), Double::parseDouble, d -> d);
	public static final FloatingPointConverter<Float> FLOAT = new FloatingPointConverter<>(
		"float", FloatFormat.FLOAT_DIGITS, Float::doubleValue, f -> Float.toString(f), Float::parseFloat, d -> (float) d);

	private final String name;
	private final int maxDigits;
	private final ToDoubleFunction<? super T> widen;
	private final Function<? super T, String> javaText;
	private final Function<String, ? extends T> parse;
	private final DoubleFunction<? extends T> narrow;

	private FloatingPointConverter(
		String name,
		int maxDigits,
		ToDoubleFunction<? super T> widen,
		Function<? super T, String> javaText,
		Function<String, ? extends T> parse,
		DoubleFunction<? extends T> narrow
	) {
		this.name = name;
		this.maxDigits = maxDigits;
		this.widen = widen;
		this.javaText = javaText;
		this.parse = parse;
		this.narrow = narrow;
	}

	@Override
	public Node encode(T value) {
		double d = widen.applyAsDouble(value);
		if (Double.isNaN(d)) {
			return Node.scalar(".nan");
		} else if (d == Double.POSITIVE_INFINITY) {
			return Node.scalar(".inf");
		} else if (d == Double.NEGATIVE_INFINITY) {
			return Node.scalar("-.inf");
		} else {
			boolean negativeZero = (d == 0.0) && (1.0 / d < 0);
			return Node.scalar(FloatFormat.format(javaText.apply(value), negativeZero, maxDigits));
		}
	}

	@Override
	public Optional<T> decode(Node node) {
		if (!(node instanceof ScalarNode scalar)) {
			return Mismatch.SHAPE.reject(this, node);
		}
		String text = scalar.text();
		if (ScalarGrammar.FLOAT.matches(text)) {
			// The grammar admits nothing the JDK parser would reject
			return Optional.of(parse.apply(text));
		} else if (ScalarGrammar.INFINITY.matches(text)) {
			double infinity = (text.charAt(0) == '-') ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
			return Optional.of(narrow.apply(infinity));
		} else if (ScalarGrammar.NAN.matches(text)) {
			return Optional.of(narrow.apply(Double.NaN));
		} else {
			return Mismatch.LEXICAL.reject(this, node);
		}
	}

	@Override
	public String toString() {
		return name;
	}
}
