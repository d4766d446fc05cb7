package works.menusync.exceptions;

/**
 * A group property call succeeded, but its reply had no entry for this id.
 */
@SuppressWarnings("serial")
public class PropertiesUnavailableException extends MenuSyncException {
	public PropertiesUnavailableException(int id) {
		super("Properties unavailable for id " + id);
	}
}
