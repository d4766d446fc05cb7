package works.menusync.logging;

import works.menusync.SyncSession;

/**
 * Keys to use for SLF4J's Mapped Diagnostic Context.
 */
public final class MdcKeys {
	/**
	 * The value of {@link SyncSession#name()}.
	 */
	public static final String SESSION_NAME = "menusync.session";

	private MdcKeys() { }
}
