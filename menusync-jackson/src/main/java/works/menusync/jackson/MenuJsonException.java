package works.menusync.jackson;

/**
 * A JSON document doesn't have the shape {@link MenuJson} expects.
 */
@SuppressWarnings("serial")
public class MenuJsonException extends RuntimeException {
	public MenuJsonException(String message) {
		super(message);
	}

	public MenuJsonException(String message, Throwable cause) {
		super(message, cause);
	}
}
