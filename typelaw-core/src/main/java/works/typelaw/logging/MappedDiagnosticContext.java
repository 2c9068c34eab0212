package works.typelaw.logging;

import org.slf4j.MDC;

import static works.typelaw.logging.MdcKeys.QUERY;
import static works.typelaw.logging.MdcKeys.SESSION;

public final class MappedDiagnosticContext {
	private MappedDiagnosticContext() {}

	/**
	 * Sets the session and query MDC keys until the returned scope is closed,
	 * at which point the previous values are restored.
	 * Scopes nest, so a query started from inside another query
	 * is logged under the inner query's name until it returns.
	 */
	public static MDCScope setupMDC(String sessionName, String queryName) {
		MDCScope result = new MDCScope();
		MDC.put(SESSION, sessionName);
		MDC.put(QUERY, queryName);
		return result;
	}

	public static final class MDCScope implements AutoCloseable {
		private final String oldSession = MDC.get(SESSION);
		private final String oldQuery = MDC.get(QUERY);

		MDCScope() { }

		@Override
		public void close() {
			restore(SESSION, oldSession);
			restore(QUERY, oldQuery);
		}

		private static void restore(String key, String value) {
			if (value == null) {
				MDC.remove(key);
			} else {
				MDC.put(key, value);
			}
		}
	}
}
