package works.convey.exceptions;

/**
 * A node could not be decoded into the requested type.
 * <p>
 * Decoding ordinarily reports failure as an empty {@link java.util.Optional};
 * this is thrown only by entry points that promise a value, such as
 * {@link works.convey.registry.ConverterRegistry#require ConverterRegistry.require}.
 */
public final class NodeContentException extends ConveyException {
	public NodeContentException(String message) {
		super(message);
	}

	public NodeContentException(String message, Throwable cause) {
		super(message, cause);
	}
}
