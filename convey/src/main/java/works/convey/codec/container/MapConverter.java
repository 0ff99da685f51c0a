package works.convey.codec.container;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Supplier;
import works.convey.codec.Converter;
import works.convey.codec.Mismatch;
import works.convey.tree.MapNode;
import works.convey.tree.Node;

import static java.util.Objects.requireNonNull;

/**
 * Converts a {@link Map} to and from a map node.
 * <p>
 * When decoding, each key is decoded before its value.
 * If the node holds two keys that decode to equal values,
 * the later pair wins, just as it would for successive {@link Map#put} calls.
 * Decoding fails as soon as any key or value fails to decode,
 * and either way, no partially populated map is ever visible to the caller.
 */
public class MapConverter<K, V, M extends Map<K, V>> extends MapEncoder<K, V, M> implements Converter<M> {
	private final Converter<K> keyConverter;
	private final Converter<V> valueConverter;
	private final Supplier<? extends M> factory;

	/**
	 * @param factory supplies a new empty map each time it's called
	 */
	public MapConverter(Converter<K> key, Converter<V> value, Supplier<? extends M> factory) {
		super(key, value);
		this.keyConverter = key;
		this.valueConverter = value;
		this.factory = requireNonNull(factory);
	}

	public static <K, V> MapConverter<K, V, Map<K, V>> linkedHashMap(Converter<K> key, Converter<V> value) {
		return new MapConverter<>(key, value, LinkedHashMap::new);
	}

	public static <K, V> MapConverter<K, V, TreeMap<K, V>> treeMap(Converter<K> key, Converter<V> value) {
		return new MapConverter<>(key, value, TreeMap::new);
	}

	@Override
	public Optional<M> decode(Node node) {
		if (!(node instanceof MapNode mapNode)) {
			return Mismatch.SHAPE.reject(this, node);
		}
		M result = factory.get();
		for (Map.Entry<Node, Node> entry : mapNode.entries()) {
			Optional<K> k = keyConverter.decode(entry.getKey());
			if (k.isEmpty()) {
				return Optional.empty();
			}
			Optional<V> v = valueConverter.decode(entry.getValue());
			if (v.isEmpty()) {
				return Optional.empty();
			}
			result.put(k.get(), v.get());
		}
		return Optional.of(result);
	}

	/**
	 * Replaces the contents of {@code target} with the decoded pairs,
	 * or leaves it untouched if decoding fails.
	 *
	 * @return true if decoding succeeded
	 */
	public boolean decodeInto(Node node, Map<? super K, ? super V> target) {
		Optional<M> decoded = decode(node);
		if (decoded.isPresent()) {
			target.clear();
			target.putAll(decoded.get());
			return true;
		} else {
			return false;
		}
	}
}
