package works.convey.codec;

import java.util.Optional;
import java.util.function.Function;
import works.convey.tree.Node;

import static java.util.Objects.requireNonNull;

/**
 * An {@link Encoder} that can also go the other way.
 * <p>
 * Decoding is partial: a node of the wrong {@link works.convey.tree.NodeKind kind},
 * scalar text that doesn't match the type's grammar,
 * or a number out of the type's range all produce {@link Optional#empty()}.
 * Decoding never throws for such expected mismatches.
 * Implementations must be stateless and safe to share between threads.
 */
public interface Converter<T> extends Encoder<T> {
	/**
	 * @return the decoded value, which is never null, or empty if {@code node} doesn't represent one
	 */
	Optional<T> decode(Node node);

	/**
	 * Assembles a converter from separate encoding and decoding functions,
	 * typically for a user-defined type.
	 */
	static <T> Converter<T> of(Encoder<? super T> encoder, Function<? super Node, Optional<T>> decoder) {
		requireNonNull(encoder);
		requireNonNull(decoder);
		return new Converter<>() {
			@Override
			public Node encode(T value) {
				return encoder.encode(value);
			}

			@Override
			public Optional<T> decode(Node node) {
				return decoder.apply(node);
			}
		};
	}
}
