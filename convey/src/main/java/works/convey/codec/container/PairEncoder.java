package works.convey.codec.container;

import java.util.Map;
import works.convey.codec.Encoder;
import works.convey.tree.Node;

import static java.util.Objects.requireNonNull;

/**
 * Encodes a {@link Map.Entry} as a two-element sequence: key, then value.
 *
 * @see PairConverter
 */
public class PairEncoder<K, V> implements Encoder<Map.Entry<K, V>> {
	final Encoder<? super K> first;
	final Encoder<? super V> second;

	public PairEncoder(Encoder<? super K> first, Encoder<? super V> second) {
		this.first = requireNonNull(first);
		this.second = requireNonNull(second);
	}

	@Override
	public Node encode(Map.Entry<K, V> value) {
		return Node.sequence(
			first.encodeNullable(value.getKey()),
			second.encodeNullable(value.getValue()));
	}

	@Override
	public String toString() {
		return "Pair<" + first + "," + second + ">";
	}
}
