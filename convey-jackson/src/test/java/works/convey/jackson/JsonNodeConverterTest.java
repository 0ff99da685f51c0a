package works.convey.jackson;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.ObjectNode;
import works.convey.registry.ConverterRegistry;
import works.convey.tree.Node;
import works.convey.types.TypeReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonNodeConverterTest {
	final JsonMapper mapper = JsonMapper.builder().build();
	final ConverterRegistry registry = ConverterRegistry.builder()
		.add(JsonNodeConverter.directive())
		.build();

	@Test
	void parsedJsonDecodesAsTypedValues() {
		Node node = JsonNodeConverter.ANY.encode(mapper.readTree("""
			{"ports": [80, "0x1bb"], "ratio": 2.5}
			"""));
		var type = new TypeReference<Map<String, List<Double>>>() {};
		assertEquals(Optional.empty(), registry.decode(node, type), "0x1bb is not a float");

		Map<String, Node> fields = registry.require(node, new TypeReference<Map<String, Node>>() {});
		assertEquals(Optional.of(List.of(80, 443)), registry.decode(fields.get("ports"), new TypeReference<List<Integer>>() {}));
		assertEquals(Optional.of(2.5), registry.decode(fields.get("ratio"), double.class));
	}

	@Test
	void embeddedInLargerValue() {
		var type = new TypeReference<Map<String, JsonNode>>() {};
		JsonNode settings = mapper.readTree("{\"debug\": \"true\"}");
		Node node = registry.encode(Map.of("settings", settings), type);
		assertEquals(
			Node.map().insert(Node.scalar("settings"), Node.map().insert(Node.scalar("debug"), Node.scalar("true"))),
			node);
		assertEquals(Optional.of(Map.of("settings", settings)), registry.decode(node, type));
	}

	@Test
	void subclasses() {
		Node array = Node.sequence(Node.scalar("x"));
		assertInstanceOf(ArrayNode.class, registry.require(array, ArrayNode.class));
		assertEquals(Optional.empty(), registry.decode(array, ObjectNode.class));
		assertTrue(registry.decode(Node.map(), ObjectNode.class).isPresent());
	}

	@Test
	void nonScalarKeyFails() {
		Node node = Node.map().insert(Node.map(), Node.scalar("v"));
		assertEquals(Optional.empty(), registry.decode(node, JsonNode.class));
	}
}
