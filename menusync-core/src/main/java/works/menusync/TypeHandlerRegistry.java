package works.menusync;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * The {@link TypeHandler}s of one {@link SyncSession}, keyed by type tag.
 */
public final class TypeHandlerRegistry {
	private final Map<String, TypeHandler> handlers = new LinkedHashMap<>();

	/**
	 * @throws IllegalArgumentException if <code>typeTag</code> already has a handler
	 */
	public void register(String typeTag, TypeHandler handler) {
		requireNonNull(typeTag);
		requireNonNull(handler);
		TypeHandler existing = handlers.putIfAbsent(typeTag, handler);
		if (existing != null) {
			throw new IllegalArgumentException("Type \"" + typeTag + "\" already has a registered handler");
		}
		LOGGER.debug("Registered handler for type \"{}\"", typeTag);
	}

	public Optional<TypeHandler> handlerFor(String typeTag) {
		return Optional.ofNullable(handlers.get(typeTag));
	}

	public boolean isEmpty() {
		return handlers.isEmpty();
	}

	/**
	 * Offers <code>node</code> to the handler for its {@link MenuNode#type() type}, if any.
	 * A handler that throws is logged and counts as not having handled the node.
	 *
	 * @return true if a handler took care of the node
	 */
	boolean dispatch(MenuNode node, MenuNode parent, SyncSession session) {
		String type = node.type();
		TypeHandler handler = handlers.get(type);
		if (handler == null) {
			return false;
		}
		try {
			return handler.onNewNode(node, parent, session);
		} catch (RuntimeException e) {
			LOGGER.warn("Handler for type \"{}\" failed on node {}", type, node.id(), e);
			return false;
		}
	}

	/**
	 * Removes every handler, giving each a chance to {@link TypeHandler#release() release} its resources.
	 */
	void releaseAll() {
		for (Map.Entry<String, TypeHandler> entry : handlers.entrySet()) {
			try {
				entry.getValue().release();
			} catch (RuntimeException e) {
				LOGGER.warn("Handler for type \"{}\" failed to release", entry.getKey(), e);
			}
		}
		int count = handlers.size();
		handlers.clear();
		if (count > 0) {
			LOGGER.debug("Released {} type handler{}", count, (count >= 2) ? "s" : "");
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TypeHandlerRegistry.class);
}
