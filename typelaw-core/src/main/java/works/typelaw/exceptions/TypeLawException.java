package works.typelaw.exceptions;

public sealed abstract class TypeLawException extends RuntimeException permits ConfigurationException, InvalidTypeException {
	protected TypeLawException(String message) {
		super(message);
	}

	protected TypeLawException(String message, Throwable cause) {
		super(message, cause);
	}

	@SuppressWarnings("unchecked")
	public static <T extends TypeLawException> T wrap(T exception, String context) {
		String newMessage = context + ": " + exception.getMessage();
		if (exception instanceof ConfigurationException) {
			return (T) new ConfigurationException(newMessage, exception);
		} else {
			return (T) new InvalidTypeException(newMessage, exception);
		}
	}
}
