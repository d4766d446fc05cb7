package works.menusync.exceptions;

/**
 * Delivered to every callback still waiting when a session is closed.
 */
@SuppressWarnings("serial")
public class SessionShutdownException extends MenuSyncException {
	public SessionShutdownException(String sessionName) {
		super("Session \"" + sessionName + "\" shut down");
	}
}
