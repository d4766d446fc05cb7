package works.menusync.exceptions;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;

/**
 * A remote call failed or timed out.
 */
@SuppressWarnings("serial")
public class TransportFailureException extends MenuSyncException {
	public TransportFailureException(String message) {
		super(message);
	}

	public TransportFailureException(String message, Throwable cause) {
		super(message, cause);
	}

	/**
	 * Wraps the failure of a remote call's future, unwrapping {@link CompletionException}
	 * so the cause chain names the real problem.
	 */
	public static TransportFailureException from(String method, Throwable failure) {
		Throwable cause = (failure instanceof CompletionException && failure.getCause() != null)
			? failure.getCause()
			: failure;
		if (cause instanceof TransportFailureException e) {
			return e;
		} else if (cause instanceof TimeoutException) {
			return new TransportFailureException(method + " timed out", cause);
		} else if (cause instanceof CancellationException) {
			return new TransportFailureException(method + " was cancelled", cause);
		} else {
			return new TransportFailureException(method + " failed: " + cause.getMessage(), cause);
		}
	}
}
