package works.menusync.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import works.menusync.MenuNode;
import works.menusync.MenuTree;
import works.menusync.PropertyValue;
import works.menusync.transport.LayoutDescription;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static works.menusync.transport.LayoutDescription.leaf;
import static works.menusync.transport.LayoutDescription.node;

class MenuJsonTest {
	final MenuJson json = new MenuJson();

	static final String DOCUMENT = """
		{
		  "id": 0,
		  "properties": { "children-display": "submenu" },
		  "submenu": [
		    { "id": 1, "properties": { "label": "File" }, "submenu": [
		      { "id": 11, "properties": { "label": "Open", "enabled": true } },
		      { "id": 12, "properties": { "type": "separator" } }
		    ] },
		    { "id": 2, "properties": { "label": "Edit", "toggle-state": { "variant": 1 } } }
		  ]
		}
		""";

	@Test
	void readLayout_structureOnly() {
		LayoutDescription expected = node(0,
			node(1, leaf(11), leaf(12)),
			leaf(2));
		assertEquals(expected, json.readLayout(DOCUMENT));
	}

	@Test
	void readPropertyTable_everyNodeInDocumentOrder() {
		Map<Integer, Map<String, PropertyValue>> table = json.readPropertyTable(json.parse(DOCUMENT));
		assertEquals(List.of(0, 1, 11, 12, 2), List.copyOf(table.keySet()));
		assertEquals(Map.of("label", PropertyValue.of("Open"), "enabled", PropertyValue.of(true)), table.get(11));
		assertEquals(PropertyValue.boxed(PropertyValue.of(1)), table.get(2).get("toggle-state"));
	}

	@Test
	void readPropertyTable_inlineProperties() {
		Map<Integer, Map<String, PropertyValue>> table = json.readPropertyTable(json.parse("""
			{ "id": 0, "submenu": [ { "id": 4, "label": "Quit", "visible": false } ] }
			"""));
		assertEquals(Map.of(), table.get(0));
		assertEquals(Map.of("label", PropertyValue.of("Quit"), "visible", PropertyValue.of(false)), table.get(4));
	}

	@Test
	void readPropertyTable_duplicateId_throws() {
		JsonNode document = json.parse("""
			{ "id": 0, "submenu": [ { "id": 3 }, { "id": 3 } ] }
			""");
		assertThrows(MenuJsonException.class, () -> json.readPropertyTable(document));
	}

	static Stream<Arguments> values() {
		return Stream.of(
			Arguments.of("\"Save\"", PropertyValue.of("Save")),
			Arguments.of("42", PropertyValue.of(42)),
			Arguments.of("true", PropertyValue.of(true)),
			Arguments.of("{\"variant\":\"x\"}", PropertyValue.boxed(PropertyValue.of("x"))),
			Arguments.of("{\"variant\":{\"variant\":false}}", PropertyValue.boxed(PropertyValue.boxed(PropertyValue.of(false))))
		);
	}

	@ParameterizedTest
	@MethodSource("values")
	void readValue(String text, PropertyValue expected) {
		assertEquals(expected, json.readValue(json.parse(text)));
		assertEquals(json.parse(text), json.writeValue(expected));
	}

	@ParameterizedTest
	@MethodSource("unsupportedValues")
	void readValue_unsupported(String text) {
		assertThrows(MenuJsonException.class, () -> json.readValue(json.parse(text)));
	}

	static Stream<String> unsupportedValues() {
		return Stream.of("1.5", "null", "[1]", "{\"other\":1}", "{\"variant\":1,\"extra\":2}");
	}

	@Test
	void malformed_throws() {
		MenuJsonException e = assertThrows(MenuJsonException.class, () -> json.readLayout("{\"id\": "));
		assertThat(e.getMessage(), containsString("Malformed JSON"));
		assertThrows(MenuJsonException.class, () -> json.readLayout("{\"submenu\": []}"));
		assertThrows(MenuJsonException.class, () -> json.readLayout("{\"id\": 0, \"submenu\": 5}"));
		assertThrows(MenuJsonException.class, () -> json.readLayout("[]"));
	}

	@Test
	void dump_sortedPropertiesAndSubmenu() {
		MenuTree tree = new MenuTree();
		MenuNode root = tree.createRoot(0);
		tree.insertChild(root, 7, 0);
		tree.insertChild(root, 3, 1);
		JsonNode dumped = json.dump(tree, root);
		assertEquals(json.parse("""
			{ "id": 0, "submenu": [ { "id": 7 }, { "id": 3 } ] }
			"""), dumped);
		assertEquals(node(0, leaf(7), leaf(3)), json.readLayout(dumped));
	}
}
