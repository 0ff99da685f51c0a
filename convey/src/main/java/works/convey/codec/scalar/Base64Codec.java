package works.convey.codec.scalar;

/**
 * The byte codec behind {@link BinaryConverter}.
 * <p>
 * Decoding does no structural validation: malformed input simply produces
 * whatever bytes the implementation could make of it, possibly none.
 */
public interface Base64Codec {
	String encode(byte[] data);

	byte[] decode(String text);

	/**
	 * RFC 4648 base64 with padding, via {@link java.util.Base64}.
	 * Whitespace in the input is ignored, and input that is otherwise malformed decodes to nothing.
	 */
	static Base64Codec standard() {
		return StandardBase64Codec.INSTANCE;
	}
}
