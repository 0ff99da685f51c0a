package works.convey.codec.scalar;

import works.convey.codec.Encoder;
import works.convey.tree.Node;

/**
 * Encodes any {@link CharSequence} as scalar text.
 * <p>
 * There is no way to decode: a {@code CharSequence} may be a view
 * over storage the caller owns, so there's nothing sensible to construct.
 * Decode into {@link String} instead.
 */
public record StringLiteralEncoder() implements Encoder<CharSequence> {
	@Override
	public Node encode(CharSequence value) {
		return Node.scalar(value.toString());
	}

	@Override
	public String toString() {
		return "CharSequence";
	}
}
