package works.convey.codec.container;

import java.util.Map;
import works.convey.codec.Encoder;
import works.convey.tree.MapNode;
import works.convey.tree.Node;

import static java.util.Objects.requireNonNull;

/**
 * Encodes a {@link Map} as a map node, in the map's own iteration order.
 * <p>
 * Pairs are added with {@link MapNode#forceInsert}:
 * the source map can't contain duplicate keys, so there's nothing to check.
 *
 * @see MapConverter
 */
public class MapEncoder<K, V, M extends Map<K, V>> implements Encoder<M> {
	final Encoder<? super K> key;
	final Encoder<? super V> value;

	public MapEncoder(Encoder<? super K> key, Encoder<? super V> value) {
		this.key = requireNonNull(key);
		this.value = requireNonNull(value);
	}

	@Override
	public Node encode(M map) {
		MapNode result = Node.map();
		map.forEach((k, v) -> result.forceInsert(key.encodeNullable(k), value.encodeNullable(v)));
		return result;
	}

	@Override
	public String toString() {
		return "Map<" + key + "," + value + ">";
	}
}
