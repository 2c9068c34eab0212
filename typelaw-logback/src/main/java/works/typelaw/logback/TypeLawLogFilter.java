package works.typelaw.logback;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Stream;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.slf4j.Marker;
import works.typelaw.TypeSystem;
import works.typelaw.logging.MdcKeys;

import static ch.qos.logback.core.spi.FilterReply.DENY;
import static ch.qos.logback.core.spi.FilterReply.NEUTRAL;
import static java.util.stream.Collectors.toMap;
import static works.typelaw.logging.MdcKeys.SESSION;

/**
 * A Logback {@link TurboFilter} that provides per-session logging control.
 * Intended to quiet the expected debug chatter of one {@link TypeSystem}
 * session, such as a test that deliberately exhausts budgets,
 * without affecting other sessions.
 * <p>
 * This class infers that a log message belongs to a session
 * by checking the MDC for the key {@link MdcKeys#SESSION},
 * which every {@link TypeSystem} query sets.
 * <p>
 * Log levels are determined using the following precedence:
 * <ol>
 *     <li>
 *         If the specific logger is configured with some level,
 *         that level is used;
 *     </li>
 *     <li>
 *         otherwise, if the message was logged by a session with a registered
 *         {@link LogController} that has an override for that specific logger,
 *         that override is used;
 *     </li>
 *     <li>
 *         otherwise, the usual Logback rules apply, which means
 *         that the logger inherits the level from its ancestors.
 *     </li>
 * </ol>
 */
public class TypeLawLogFilter extends TurboFilter {
	private static final ConcurrentHashMap<String, LogController> controllersBySession = new ConcurrentHashMap<>();

	public static final class LogController {
		final Map<String, Level> overrides = new ConcurrentHashMap<>();

		public void setLogging(Level level, Class<?>... loggers) {
			overrides.putAll(Stream.of(loggers).collect(toMap(Class::getName, c -> level)));
		}

		public void setLogging(Level level, String... loggers) {
			overrides.putAll(Stream.of(loggers).collect(toMap(Function.identity(), n -> level)));
		}
	}

	/**
	 * Causes <code>controller</code> to control logs emitted by queries
	 * of every session named <code>sessionName</code>, until the returned
	 * registration is closed.
	 *
	 * @throws IllegalStateException if the session already has a controller
	 */
	public static Registration withController(String sessionName, LogController controller) {
		LOGGER.debug("Registering controller {} for session \"{}\"", System.identityHashCode(controller), sessionName);
		LogController old = controllersBySession.putIfAbsent(sessionName, controller);
		if (old != null) {
			throw new IllegalStateException("Session \"" + sessionName + "\" already has a log controller");
		}
		return new Registration(sessionName, controller);
	}

	public record Registration(String sessionName, LogController controller) implements AutoCloseable {
		@Override
		public void close() {
			controllersBySession.remove(sessionName, controller);
		}
	}

	@Override
	public FilterReply decide(Marker marker, Logger logger, Level messageLevel, String format, Object[] params, Throwable t) {
		if (logger.getLevel() != null) {
			// Respect user-supplied log levels
			return NEUTRAL;
		}
		String session = MDC.get(SESSION);
		if (session == null) {
			return NEUTRAL;
		}
		var controller = controllersBySession.get(session);
		if (controller == null) {
			return NEUTRAL;
		}
		Level overrideLevel = controller.overrides.get(logger.getName());
		if (overrideLevel == null) {
			return NEUTRAL;
		}
		if (messageLevel.isGreaterOrEqual(overrideLevel)) {
			return NEUTRAL;
		} else {
			return DENY;
		}
	}

	private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(TypeLawLogFilter.class);
}
