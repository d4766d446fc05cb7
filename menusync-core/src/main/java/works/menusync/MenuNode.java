package works.menusync;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * One element of a mirrored menu.
 *
 * <p>
 * Nodes are created, linked and freed only by their {@link MenuTree}, which owns them.
 * Children and the parent are held as ids, not references, so a node never keeps
 * another node alive; use {@link MenuTree#childrenOf} and {@link MenuTree#parentOf}
 * to navigate.
 *
 * <p>
 * A node whose {@link #isRealized() realized} flag is false is still waiting for
 * its first property fetch and must not be handed to observers.
 */
public final class MenuNode {
	/**
	 * Reserved for the root of every tree.
	 */
	public static final int ROOT_ID = 0;

	/**
	 * Value of {@link #parentId()} for a node with no parent.
	 */
	public static final int NO_PARENT = -1;

	private final int id;
	private final Map<String, PropertyValue> properties = new HashMap<>();
	private final List<Integer> childIds = new ArrayList<>();
	private int parentId = NO_PARENT;
	private boolean realized = false;

	MenuNode(int id) {
		this.id = id;
	}

	public int id() {
		return id;
	}

	public int parentId() {
		return parentId;
	}

	public boolean isRoot() {
		return parentId == NO_PARENT;
	}

	public boolean isRealized() {
		return realized;
	}

	public List<Integer> childIds() {
		return Collections.unmodifiableList(childIds);
	}

	public Map<String, PropertyValue> properties() {
		return Collections.unmodifiableMap(properties);
	}

	public Set<String> propertyKeys() {
		return Collections.unmodifiableSet(properties.keySet());
	}

	public Optional<PropertyValue> property(String key) {
		return Optional.ofNullable(properties.get(key));
	}

	/**
	 * @return the property's value as a string, if it is a (possibly boxed) {@link PropertyValue.StringValue}.
	 */
	public Optional<String> stringProperty(String key) {
		return property(key)
			.map(PropertyValue::unboxed)
			.filter(v -> v instanceof PropertyValue.StringValue)
			.map(v -> ((PropertyValue.StringValue) v).value());
	}

	/**
	 * @return the tag that selects this node's {@link TypeHandler}.
	 */
	public String type() {
		return stringProperty(MenuProperties.TYPE).orElse(MenuProperties.DEFAULT_TYPE);
	}

	/**
	 * @return true if the stored value changed
	 */
	boolean setProperty(String key, PropertyValue value) {
		requireNonNull(key);
		requireNonNull(value);
		return !value.equals(properties.put(key, value));
	}

	/**
	 * @return true if the key was present
	 */
	boolean removeProperty(String key) {
		return properties.remove(key) != null;
	}

	void markRealized() {
		realized = true;
	}

	List<Integer> mutableChildIds() {
		return childIds;
	}

	void setParentId(int parentId) {
		this.parentId = parentId;
	}

	@Override
	public String toString() {
		return "MenuNode(" + id + (realized ? "" : ", unrealized") + ")";
	}
}
