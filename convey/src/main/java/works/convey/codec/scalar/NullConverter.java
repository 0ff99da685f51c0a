package works.convey.codec.scalar;

import java.util.Optional;
import works.convey.codec.Converter;
import works.convey.codec.Mismatch;
import works.convey.tree.Node;

public record NullConverter() implements Converter<Null> {
	@Override
	public Node encode(Null value) {
		return Node.nullNode();
	}

	@Override
	public Optional<Null> decode(Node node) {
		if (node.isNull()) {
			return Optional.of(Null.NULL);
		} else {
			return Mismatch.SHAPE.reject(this, node);
		}
	}

	@Override
	public String toString() {
		return "Null";
	}
}
