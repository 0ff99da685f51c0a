package works.convey.codec.scalar;

import java.util.Optional;
import works.convey.codec.Converter;
import works.convey.codec.Mismatch;
import works.convey.tree.Node;
import works.convey.tree.ScalarNode;

/**
 * Copies scalar text verbatim.
 */
public record StringConverter() implements Converter<String> {
	@Override
	public Node encode(String value) {
		return Node.scalar(value);
	}

	@Override
	public Optional<String> decode(Node node) {
		if (node instanceof ScalarNode scalar) {
			return Optional.of(scalar.text());
		} else {
			return Mismatch.SHAPE.reject(this, node);
		}
	}

	@Override
	public String toString() {
		return "String";
	}
}
