package works.menusync;

/**
 * Well-known keys in a {@link MenuNode}'s property map.
 * The remote side may send any other keys too; these are just the ones
 * the synchronization engine or common type handlers care about.
 */
public final class MenuProperties {
	/**
	 * Selects the {@link TypeHandler} for a newly realized node.
	 */
	public static final String TYPE = "type";

	/**
	 * Type tag used for dispatch when a node has no {@link #TYPE} property.
	 */
	public static final String DEFAULT_TYPE = "standard";

	public static final String LABEL = "label";
	public static final String ENABLED = "enabled";
	public static final String VISIBLE = "visible";
	public static final String ICON_NAME = "icon-name";
	public static final String SHORTCUT = "shortcut";
	public static final String TOGGLE_TYPE = "toggle-type";
	public static final String TOGGLE_STATE = "toggle-state";
	public static final String CHILDREN_DISPLAY = "children-display";

	private MenuProperties() { }
}
