package works.convey.codec.scalar;

import java.util.Optional;
import works.convey.codec.Converter;
import works.convey.tree.Node;

/**
 * Passes document subtrees through untouched,
 * for values whose structure isn't known in advance.
 */
public record NodeConverter() implements Converter<Node> {
	@Override
	public Node encode(Node value) {
		return value;
	}

	@Override
	public Optional<Node> decode(Node node) {
		return Optional.of(node);
	}

	@Override
	public String toString() {
		return "Node";
	}
}
