package works.menusync.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import works.menusync.MenuNode;
import works.menusync.MenuTree;
import works.menusync.PropertyValue;
import works.menusync.PropertyValue.BooleanValue;
import works.menusync.PropertyValue.IntValue;
import works.menusync.PropertyValue.StringValue;
import works.menusync.PropertyValue.VariantValue;
import works.menusync.transport.LayoutDescription;

import static java.util.Objects.requireNonNull;

/**
 * Converts between menus and JSON documents shaped like this:
 *
 * <pre>
 * {
 *   "id": 0,
 *   "properties": { "label": "File", "enabled": true },
 *   "submenu": [ { "id": 1, ... }, ... ]
 * }
 * </pre>
 *
 * Property values are JSON strings, integers and booleans; a boxed value is
 * written <code>{"variant": value}</code>.
 *
 * <p>
 * {@link #dump} writes the properties inline, next to <code>"id"</code>, in sorted key order.
 * The readers accept either form.
 */
public class MenuJson {
	public static final String ID = "id";
	public static final String PROPERTIES = "properties";
	public static final String SUBMENU = "submenu";
	public static final String VARIANT = "variant";

	private final ObjectMapper mapper;
	private final JsonNodeFactory nodeFactory;

	public MenuJson() {
		this(new ObjectMapper());
	}

	public MenuJson(ObjectMapper mapper) {
		this.mapper = requireNonNull(mapper);
		this.nodeFactory = mapper.getNodeFactory();
	}

	public JsonNode parse(String json) {
		try {
			return mapper.readTree(json);
		} catch (JsonProcessingException e) {
			throw new MenuJsonException("Malformed JSON: " + e.getOriginalMessage(), e);
		}
	}

	public String toPrettyString(JsonNode node) {
		try {
			return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
		} catch (JsonProcessingException e) {
			throw new MenuJsonException("Unable to write JSON", e);
		}
	}

	public LayoutDescription readLayout(String json) {
		return readLayout(parse(json));
	}

	/**
	 * @return the structure of the menu in <code>document</code>, without its properties
	 */
	public LayoutDescription readLayout(JsonNode document) {
		int id = readId(document);
		List<LayoutDescription> children = new ArrayList<>();
		for (JsonNode child : submenu(document)) {
			children.add(readLayout(child));
		}
		return new LayoutDescription(id, children);
	}

	/**
	 * @return the properties of every node in <code>document</code>, keyed by id, in document order
	 */
	public Map<Integer, Map<String, PropertyValue>> readPropertyTable(JsonNode document) {
		Map<Integer, Map<String, PropertyValue>> result = new LinkedHashMap<>();
		Deque<JsonNode> stack = new ArrayDeque<>();
		stack.push(document);
		while (!stack.isEmpty()) {
			JsonNode node = stack.pop();
			int id = readId(node);
			if (result.put(id, readNodeProperties(node)) != null) {
				throw new MenuJsonException("Duplicate id " + id);
			}
			ArrayNode children = submenu(node);
			for (int i = children.size() - 1; i >= 0; i--) {
				stack.push(children.get(i));
			}
		}
		return result;
	}

	/**
	 * @param object a JSON object whose members are all property values
	 */
	public Map<String, PropertyValue> readProperties(JsonNode object) {
		if (!object.isObject()) {
			throw new MenuJsonException("Expected properties object; found " + object.getNodeType());
		}
		Map<String, PropertyValue> result = new LinkedHashMap<>();
		object.fields().forEachRemaining(e -> result.put(e.getKey(), readValue(e.getValue())));
		return result;
	}

	public PropertyValue readValue(JsonNode json) {
		if (json.isTextual()) {
			return new StringValue(json.textValue());
		} else if (json.isIntegralNumber() && json.canConvertToLong()) {
			return new IntValue(json.longValue());
		} else if (json.isBoolean()) {
			return new BooleanValue(json.booleanValue());
		} else if (json.isObject() && json.size() == 1 && json.has(VARIANT)) {
			return new VariantValue(readValue(json.get(VARIANT)));
		} else {
			throw new MenuJsonException("Unsupported property value: " + json);
		}
	}

	public JsonNode writeValue(PropertyValue value) {
		if (value instanceof StringValue s) {
			return nodeFactory.textNode(s.value());
		} else if (value instanceof IntValue i) {
			long n = i.value();
			return (n == (int) n) ? nodeFactory.numberNode((int) n) : nodeFactory.numberNode(n);
		} else if (value instanceof BooleanValue b) {
			return nodeFactory.booleanNode(b.value());
		} else if (value instanceof VariantValue v) {
			ObjectNode result = nodeFactory.objectNode();
			result.set(VARIANT, writeValue(v.value()));
			return result;
		} else {
			throw new AssertionError("Unexpected property value " + value.getClass());
		}
	}

	/**
	 * @return <code>from</code> and its descendants with inline properties, as described above
	 */
	public ObjectNode dump(MenuTree tree, MenuNode from) {
		ObjectNode result = dumpOne(from);
		Deque<Map.Entry<MenuNode, ObjectNode>> stack = new ArrayDeque<>();
		stack.push(Map.entry(from, result));
		while (!stack.isEmpty()) {
			var entry = stack.pop();
			List<MenuNode> children = tree.childrenOf(entry.getKey());
			if (children.isEmpty()) {
				continue;
			}
			ArrayNode submenu = entry.getValue().putArray(SUBMENU);
			for (MenuNode child : children) {
				ObjectNode childJson = dumpOne(child);
				submenu.add(childJson);
				stack.push(Map.entry(child, childJson));
			}
		}
		return result;
	}

	private ObjectNode dumpOne(MenuNode node) {
		ObjectNode result = nodeFactory.objectNode();
		result.put(ID, node.id());
		new TreeMap<>(node.properties()).forEach((key, value) -> result.set(key, writeValue(value)));
		return result;
	}

	private Map<String, PropertyValue> readNodeProperties(JsonNode node) {
		JsonNode properties = node.get(PROPERTIES);
		if (properties != null) {
			return readProperties(properties);
		}
		Map<String, PropertyValue> result = new LinkedHashMap<>();
		for (Iterator<Map.Entry<String, JsonNode>> iter = node.fields(); iter.hasNext(); ) {
			Map.Entry<String, JsonNode> field = iter.next();
			if (!ID.equals(field.getKey()) && !SUBMENU.equals(field.getKey())) {
				result.put(field.getKey(), readValue(field.getValue()));
			}
		}
		return result;
	}

	private static int readId(JsonNode node) {
		if (!node.isObject()) {
			throw new MenuJsonException("Expected menu node object; found " + node.getNodeType());
		}
		JsonNode id = node.get(ID);
		if (id == null || !id.isInt()) {
			throw new MenuJsonException("Menu node needs an integer \"" + ID + "\": " + node);
		}
		return id.intValue();
	}

	private static ArrayNode submenu(JsonNode node) {
		JsonNode submenu = node.get(SUBMENU);
		if (submenu == null || submenu.isNull()) {
			return JsonNodeFactory.instance.arrayNode();
		} else if (submenu.isArray()) {
			return (ArrayNode) submenu;
		} else {
			throw new MenuJsonException("\"" + SUBMENU + "\" must be an array: " + submenu);
		}
	}
}
