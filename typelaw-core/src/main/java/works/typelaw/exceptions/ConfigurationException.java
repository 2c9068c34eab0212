package works.typelaw.exceptions;

/**
 * A compatibility profile or limit setting could not be read or is out of range.
 */
public final class ConfigurationException extends TypeLawException {
	public ConfigurationException(String message) {
		super(message);
	}

	public ConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}
}
