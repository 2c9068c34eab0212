package works.typelaw.logging;

public final class MdcKeys {
	private MdcKeys() {}

	/**
	 * Name of the {@link works.typelaw.TypeSystem} session on whose behalf a message is logged.
	 */
	public static final String SESSION = "typelaw.session";

	/**
	 * Which kind of query is running: <code>assignable</code>, <code>subtype</code>, <code>evaluate</code>...
	 */
	public static final String QUERY = "typelaw.query";
}
