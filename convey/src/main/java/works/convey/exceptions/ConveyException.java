package works.convey.exceptions;

public sealed abstract class ConveyException extends RuntimeException permits NodeContentException, UnsupportedTypeException {
	protected ConveyException(String message) {
		super(message);
	}

	protected ConveyException(String message, Throwable cause) {
		super(message, cause);
	}

	/**
	 * @return a new exception of the same class as {@code exception},
	 * with {@code context} prepended to its message and {@code exception} as its cause
	 */
	@SuppressWarnings("unchecked")
	public static <T extends ConveyException> T wrap(T exception, String context) {
		String newMessage = context + ": " + exception.getMessage();
		if (exception instanceof UnsupportedTypeException) {
			return (T) new UnsupportedTypeException(newMessage, exception);
		} else {
			return (T) new NodeContentException(newMessage, exception);
		}
	}
}
