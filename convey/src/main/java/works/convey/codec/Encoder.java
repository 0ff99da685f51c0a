package works.convey.codec;

import works.convey.tree.Node;

/**
 * Converts values of type {@code T} into document nodes.
 * Encoding is total: every non-null value of type {@code T} has a representation.
 * <p>
 * Types that can be encoded but never decoded, such as arbitrary {@link CharSequence}s,
 * have only an {@code Encoder}. Everything else has a {@link Converter}.
 */
@FunctionalInterface
public interface Encoder<T> {
	/**
	 * @param value not null
	 */
	Node encode(T value);

	/**
	 * Like {@link #encode}, except that {@code null} becomes a null node.
	 */
	default Node encodeNullable(T value) {
		return (value == null) ? Node.nullNode() : encode(value);
	}
}
