package works.menusync.logging;

import org.slf4j.MDC;

import static works.menusync.logging.MdcKeys.SESSION_NAME;

public final class MappedDiagnosticContext {
	public static MDCScope setupMDC(String sessionName) {
		MDCScope result = new MDCScope();
		MDC.put(SESSION_NAME, sessionName);
		return result;
	}

	/**
	 * This is like {@link org.slf4j.MDC.MDCCloseable} except instead of
	 * deleting the MDC entry at the end, it restores it to its prior value,
	 * which allows us to nest these.
	 *
	 * <p>
	 * Note that for a try block using one of these, the catch and finally
	 * blocks will run after {@link #close()} and won't have the context.
	 */
	public static final class MDCScope implements AutoCloseable {
		final String oldValue = MDC.get(SESSION_NAME);

		@Override
		public void close() {
			if (oldValue == null) {
				MDC.remove(SESSION_NAME);
			} else {
				MDC.put(SESSION_NAME, oldValue);
			}
		}
	}

	private MappedDiagnosticContext() { }
}
