package works.convey.codec.container;

import works.convey.codec.Encoder;
import works.convey.tree.Node;
import works.convey.tree.SequenceNode;

import static java.util.Objects.requireNonNull;

/**
 * Encodes any {@link Iterable} as a sequence node, in iteration order.
 * Null elements become null nodes.
 *
 * @see SequenceConverter
 */
public class SequenceEncoder<E, C extends Iterable<E>> implements Encoder<C> {
	final Encoder<? super E> element;

	public SequenceEncoder(Encoder<? super E> element) {
		this.element = requireNonNull(element);
	}

	@Override
	public Node encode(C value) {
		SequenceNode result = Node.sequence();
		for (E e : value) {
			result.append(element.encodeNullable(e));
		}
		return result;
	}

	@Override
	public String toString() {
		return "Sequence<" + element + ">";
	}
}
