package works.convey.jackson;

import java.util.Map;
import java.util.Optional;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.JsonNodeFactory;
import tools.jackson.databind.node.ObjectNode;
import works.convey.codec.Mismatch;
import works.convey.tree.MapNode;
import works.convey.tree.Node;
import works.convey.tree.NullNode;
import works.convey.tree.ScalarNode;
import works.convey.tree.SequenceNode;

/**
 * Translates between Jackson's {@link JsonNode} trees and Convey {@link Node} trees.
 * <p>
 * Convey scalars are untyped text, so the translation into Convey loses
 * the distinction between, say, the number {@code 1} and the string {@code "1"};
 * the translation back to Jackson produces only string values.
 * The converters recover the types.
 */
public final class JacksonTrees {
	private static final JsonNodeFactory FACTORY = JsonNodeFactory.instance;

	private JacksonTrees() { }

	/**
	 * JSON null and missing nodes become null nodes;
	 * other value nodes become scalars holding their textual form.
	 */
	public static Node fromJackson(JsonNode json) {
		if (json == null || json.isNull() || json.isMissingNode()) {
			return Node.nullNode();
		} else if (json.isArray()) {
			SequenceNode result = Node.sequence();
			for (int i = 0; i < json.size(); i++) {
				result.append(fromJackson(json.get(i)));
			}
			return result;
		} else if (json.isObject()) {
			MapNode result = Node.map();
			for (Map.Entry<String, JsonNode> property : json.properties()) {
				result.forceInsert(Node.scalar(property.getKey()), fromJackson(property.getValue()));
			}
			return result;
		} else {
			return Node.scalar(json.asString());
		}
	}

	/**
	 * Scalars become JSON strings.
	 * If a map holds the same key twice, the later value wins.
	 *
	 * @return empty if any map key is not a scalar, since JSON property names must be strings
	 */
	public static Optional<JsonNode> toJackson(Node node) {
		if (node instanceof NullNode) {
			return Optional.of(FACTORY.nullNode());
		} else if (node instanceof ScalarNode scalar) {
			return Optional.of(FACTORY.stringNode(scalar.text()));
		} else if (node instanceof SequenceNode sequence) {
			ArrayNode result = FACTORY.arrayNode();
			for (Node child : sequence) {
				Optional<JsonNode> element = toJackson(child);
				if (element.isEmpty()) {
					return Optional.empty();
				}
				result.add(element.get());
			}
			return Optional.of(result);
		} else {
			ObjectNode result = FACTORY.objectNode();
			for (Map.Entry<Node, Node> entry : ((MapNode) node).entries()) {
				if (!(entry.getKey() instanceof ScalarNode key)) {
					return Mismatch.SHAPE.reject("JSON property name", entry.getKey());
				}
				Optional<JsonNode> value = toJackson(entry.getValue());
				if (value.isEmpty()) {
					return Optional.empty();
				}
				result.set(key.text(), value.get());
			}
			return Optional.of(result);
		}
	}
}
