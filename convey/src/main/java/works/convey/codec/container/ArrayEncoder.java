package works.convey.codec.container;

import java.lang.reflect.Array;
import works.convey.codec.Encoder;
import works.convey.tree.Node;
import works.convey.tree.SequenceNode;

import static java.util.Objects.requireNonNull;

/**
 * Encodes an array, of objects or of primitives, as a sequence node.
 *
 * @param <A> the array type, such as {@code String[]} or {@code int[]}
 * @see ArrayConverter
 */
public class ArrayEncoder<A> implements Encoder<A> {
	final Encoder<Object> element;

	/**
	 * @param element must accept the array's elements, boxed if they're primitive
	 */
	@SuppressWarnings("unchecked")
	public ArrayEncoder(Encoder<?> element) {
		this.element = (Encoder<Object>) requireNonNull(element);
	}

	@Override
	public Node encode(A value) {
		SequenceNode result = Node.sequence();
		int length = Array.getLength(value);
		for (int i = 0; i < length; i++) {
			result.append(element.encodeNullable(Array.get(value, i)));
		}
		return result;
	}

	@Override
	public String toString() {
		return element + "[]";
	}
}
