package works.convey.codec.scalar;

import java.util.Optional;
import works.convey.codec.Converter;
import works.convey.codec.Mismatch;
import works.convey.tree.Node;
import works.convey.tree.ScalarNode;

import static java.util.Objects.requireNonNull;

/**
 * Represents {@link Binary} data as base64 scalar text.
 * <p>
 * The {@link Base64Codec} isn't required to validate its input,
 * so as a heuristic, non-empty text that decodes to no bytes at all is rejected.
 * Empty text is a valid encoding of an empty buffer.
 */
public record BinaryConverter(Base64Codec base64) implements Converter<Binary> {
	public BinaryConverter {
		requireNonNull(base64);
	}

	public BinaryConverter() {
		this(Base64Codec.standard());
	}

	@Override
	public Node encode(Binary value) {
		return Node.scalar(base64.encode(value.toByteArray()));
	}

	@Override
	public Optional<Binary> decode(Node node) {
		if (!(node instanceof ScalarNode scalar)) {
			return Mismatch.SHAPE.reject(this, node);
		}
		byte[] data = base64.decode(scalar.text());
		if (data.length == 0 && !scalar.text().isEmpty()) {
			return Mismatch.LEXICAL.reject(this, node);
		}
		return Optional.of(Binary.of(data));
	}

	@Override
	public String toString() {
		return "Binary";
	}
}
