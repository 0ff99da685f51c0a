package works.convey.codec.scalar;

import java.util.Optional;
import works.convey.codec.Converter;
import works.convey.codec.Mismatch;
import works.convey.tree.Node;
import works.convey.tree.ScalarNode;

import static works.convey.codec.scalar.ScalarGrammar.FALSE;
import static works.convey.codec.scalar.ScalarGrammar.TRUE;

/**
 * Encodes {@code true} and {@code false} literally,
 * and decodes any of the spellings accepted by {@link ScalarGrammar#TRUE} and {@link ScalarGrammar#FALSE}.
 */
public record BooleanConverter() implements Converter<Boolean> {
	@Override
	public Node encode(Boolean value) {
		return Node.scalar(value ? "true" : "false");
	}

	@Override
	public Optional<Boolean> decode(Node node) {
		if (!(node instanceof ScalarNode scalar)) {
			return Mismatch.SHAPE.reject(this, node);
		} else if (TRUE.matches(scalar.text())) {
			return Optional.of(Boolean.TRUE);
		} else if (FALSE.matches(scalar.text())) {
			return Optional.of(Boolean.FALSE);
		} else {
			return Mismatch.LEXICAL.reject(this, node);
		}
	}

	@Override
	public String toString() {
		return "boolean";
	}
}
