package works.convey.codec.container;

import java.util.Map;
import java.util.Optional;
import works.convey.codec.Converter;
import works.convey.codec.Mismatch;
import works.convey.tree.Node;
import works.convey.tree.SequenceNode;

/**
 * Converts a {@link Map.Entry} to and from a sequence of exactly two children.
 * Decoded entries are immutable.
 */
public class PairConverter<K, V> extends PairEncoder<K, V> implements Converter<Map.Entry<K, V>> {
	private final Converter<K> firstConverter;
	private final Converter<V> secondConverter;

	public PairConverter(Converter<K> first, Converter<V> second) {
		super(first, second);
		this.firstConverter = first;
		this.secondConverter = second;
	}

	@Override
	public Optional<Map.Entry<K, V>> decode(Node node) {
		if (!(node instanceof SequenceNode sequence) || sequence.size() != 2) {
			return Mismatch.SHAPE.reject(this, node);
		}
		Optional<K> key = firstConverter.decode(sequence.get(0));
		if (key.isEmpty()) {
			return Optional.empty();
		}
		return secondConverter.decode(sequence.get(1))
			.map(value -> Map.entry(key.get(), value));
	}
}
