package works.convey.codec.scalar;

import java.util.Optional;
import works.convey.codec.Converter;
import works.convey.codec.Mismatch;
import works.convey.tree.Node;
import works.convey.tree.ScalarNode;

/**
 * A {@code char} is a scalar of exactly one UTF-16 code unit.
 */
public record CharacterConverter() implements Converter<Character> {
	@Override
	public Node encode(Character value) {
		return Node.scalar(String.valueOf(value.charValue()));
	}

	@Override
	public Optional<Character> decode(Node node) {
		if (!(node instanceof ScalarNode scalar)) {
			return Mismatch.SHAPE.reject(this, node);
		} else if (scalar.text().length() != 1) {
			return Mismatch.LEXICAL.reject(this, node);
		} else {
			return Optional.of(scalar.text().charAt(0));
		}
	}

	@Override
	public String toString() {
		return "char";
	}
}
