package works.convey.exceptions;

/**
 * A conversion rule was requested for a type that has none,
 * or a decoding rule for a type that can only be encoded.
 * <p>
 * This is a programming error rather than a problem with any particular document,
 * and it is thrown when the rule is looked up, before any node is examined.
 */
public final class UnsupportedTypeException extends ConveyException {
	public UnsupportedTypeException(String message) {
		super(message);
	}

	public UnsupportedTypeException(String message, Throwable cause) {
		super(message, cause);
	}
}
