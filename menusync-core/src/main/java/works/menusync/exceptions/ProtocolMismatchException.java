package works.menusync.exceptions;

/**
 * A layout description from the remote side can't be applied to the local tree,
 * for example because its top-level id isn't the id of the node being patched.
 * The tree is left as it was.
 */
public class ProtocolMismatchException extends Exception {
	public ProtocolMismatchException(String message) {
		super(message);
	}
}
