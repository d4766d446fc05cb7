package works.menusync.exceptions;

/**
 * Properties were requested for a node id that already has a request
 * waiting in the current batch. The earlier request is unaffected.
 */
@SuppressWarnings("serial")
public class DuplicateRequestException extends MenuSyncException {
	public DuplicateRequestException(int id) {
		super("Properties for id " + id + " already queued");
	}
}
