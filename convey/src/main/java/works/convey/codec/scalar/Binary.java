package works.convey.codec.scalar;

import java.util.Arrays;

/**
 * An immutable buffer of opaque bytes, represented in documents as base64 text.
 * Equality is by content.
 */
public final class Binary {
	private static final Binary EMPTY = new Binary(new byte[0]);

	private final byte[] data;

	private Binary(byte[] data) {
		this.data = data;
	}

	/**
	 * @param data is copied
	 */
	public static Binary of(byte... data) {
		return (data.length == 0) ? EMPTY : new Binary(data.clone());
	}

	public static Binary empty() {
		return EMPTY;
	}

	/**
	 * @return a copy of the contents
	 */
	public byte[] toByteArray() {
		return data.clone();
	}

	public int size() {
		return data.length;
	}

	public boolean isEmpty() {
		return data.length == 0;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Binary other && Arrays.equals(data, other.data);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(data);
	}

	@Override
	public String toString() {
		return "Binary[" + data.length + " bytes]";
	}
}
