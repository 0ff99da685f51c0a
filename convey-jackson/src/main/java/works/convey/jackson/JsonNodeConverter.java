package works.convey.jackson;

import java.util.Optional;
import tools.jackson.databind.JsonNode;
import works.convey.codec.Converter;
import works.convey.codec.Mismatch;
import works.convey.registry.Directive;
import works.convey.tree.Node;

import static java.util.Objects.requireNonNull;

/**
 * Converts Jackson {@link JsonNode} values using {@link JacksonTrees},
 * so that parsed JSON can be embedded in, or extracted from, a larger Convey tree.
 * <p>
 * For a subclass of {@link JsonNode}, decoding fails unless the node
 * translates to an instance of that subclass.
 */
public final class JsonNodeConverter<N extends JsonNode> implements Converter<N> {
	public static final JsonNodeConverter<JsonNode> ANY = new JsonNodeConverter<>(JsonNode.class);

	private final Class<N> nodeClass;

	private JsonNodeConverter(Class<N> nodeClass) {
		this.nodeClass = requireNonNull(nodeClass);
	}

	public static <N extends JsonNode> JsonNodeConverter<N> of(Class<N> nodeClass) {
		return new JsonNodeConverter<>(nodeClass);
	}

	/**
	 * Handles {@link JsonNode} and its subclasses.
	 * Add this to a {@link works.convey.registry.ConverterRegistry.Builder ConverterRegistry.Builder}.
	 */
	@SuppressWarnings({"unchecked", "rawtypes"})
	public static Directive directive() {
		return new Directive(
			"JsonNode",
			t -> JsonNode.class.isAssignableFrom(t.rawClass()),
			(t, r) -> of((Class) t.rawClass()));
	}

	@Override
	public Node encode(N value) {
		return JacksonTrees.fromJackson(value);
	}

	@Override
	public Optional<N> decode(Node node) {
		Optional<JsonNode> json = JacksonTrees.toJackson(node);
		if (json.isPresent() && !nodeClass.isInstance(json.get())) {
			return Mismatch.SHAPE.reject(this, node);
		}
		return json.map(nodeClass::cast);
	}

	@Override
	public String toString() {
		return nodeClass.getSimpleName();
	}
}
