package works.menusync.exceptions;

/**
 * Base class for failures delivered to callers through completed futures.
 */
@SuppressWarnings("serial")
public abstract class MenuSyncException extends RuntimeException {
	protected MenuSyncException(String message) {
		super(message);
	}

	protected MenuSyncException(String message, Throwable cause) {
		super(message, cause);
	}
}
