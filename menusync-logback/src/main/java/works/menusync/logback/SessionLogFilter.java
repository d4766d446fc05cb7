package works.menusync.logback;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.filter.Filter;
import ch.qos.logback.core.spi.FilterReply;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import works.menusync.SyncSession;
import works.menusync.logging.MdcKeys;

import static ch.qos.logback.core.spi.FilterReply.DENY;
import static ch.qos.logback.core.spi.FilterReply.NEUTRAL;
import static java.util.stream.Collectors.toMap;
import static works.menusync.logging.MdcKeys.SESSION_NAME;

/**
 * Raises the log threshold of chosen loggers for chosen sessions only.
 * Useful in tests that provoke failures on purpose and don't want the
 * resulting warnings to drown out everything else.
 *
 * <p>
 * Add this filter to an appender in the Logback configuration, then
 * {@link #register} a {@link LogController} under a session's {@link SyncSession#name() name}.
 * Events logged outside any session, or for sessions with no controller, pass through untouched.
 */
public class SessionLogFilter extends Filter<ILoggingEvent> {
	private static final ConcurrentHashMap<String, LogController> controllersBySessionName = new ConcurrentHashMap<>();

	public static final class LogController {
		final Map<String, Level> overrides = new ConcurrentHashMap<>();

		// We'd like to use SLF4J's "Level" but that doesn't support OFF
		public void setLogging(Level level, Class<?>... loggers) {
			// Put them all in one atomic operation
			overrides.putAll(Stream.of(loggers).collect(toMap(Class::getName, c -> level)));
		}
	}

	public static Registration withOverrides(String sessionName, Level level, Class<?>... loggers) {
		LogController controller = new LogController();
		controller.setLogging(level, loggers);
		return register(sessionName, controller);
	}

	/**
	 * Causes the given <code>controller</code> to control logs emitted while the
	 * MDC key {@link MdcKeys#SESSION_NAME} equals <code>sessionName</code>.
	 *
	 * @throws IllegalStateException if <code>sessionName</code> already has a controller
	 */
	public static Registration register(String sessionName, LogController controller) {
		if (LOGGER.isDebugEnabled()) {
			LOGGER.debug("Registering controller {} for session \"{}\"", System.identityHashCode(controller), sessionName);
		}
		LogController old = controllersBySessionName.putIfAbsent(sessionName, controller);
		if (old != null) {
			throw new IllegalStateException("Session \"" + sessionName + "\" already has a log controller");
		}
		return () -> controllersBySessionName.remove(sessionName, controller);
	}

	/**
	 * Closing one of these unregisters its controller.
	 */
	@FunctionalInterface
	public interface Registration extends AutoCloseable {
		@Override
		void close();
	}

	@Override
	public FilterReply decide(ILoggingEvent event) {
		String sessionName = MDC.get(SESSION_NAME);
		if (sessionName == null) {
			return NEUTRAL;
		}
		var controller = controllersBySessionName.get(sessionName);
		if (controller == null) {
			return NEUTRAL;
		}
		Level level = controller.overrides.get(event.getLoggerName());
		if (level == null) {
			return NEUTRAL;
		}
		if (event.getLevel().isGreaterOrEqual(level)) {
			return NEUTRAL;
		} else {
			return DENY;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SessionLogFilter.class);
}
