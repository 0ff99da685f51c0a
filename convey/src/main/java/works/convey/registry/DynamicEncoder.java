package works.convey.registry;

import java.util.Map;
import works.convey.codec.Encoder;
import works.convey.codec.container.ArrayEncoder;
import works.convey.codec.container.MapEncoder;
import works.convey.codec.container.PairEncoder;
import works.convey.codec.container.SequenceEncoder;
import works.convey.exceptions.UnsupportedTypeException;
import works.convey.tree.Node;
import works.convey.types.DataType;

/**
 * Encodes a value according to its runtime class rather than its static type.
 * <p>
 * Containers are recognized by the interface they implement,
 * and their contents are encoded dynamically too,
 * since the runtime class of a container reveals nothing about its elements.
 * Anything else goes through the registry's rule for its runtime class.
 */
final class DynamicEncoder implements Encoder<Object> {
	private final ConverterRegistry registry;
	private final MapEncoder<Object, Object, Map<Object, Object>> maps = new MapEncoder<>(this, this);
	private final PairEncoder<Object, Object> pairs = new PairEncoder<>(this, this);
	private final SequenceEncoder<Object, Iterable<Object>> sequences = new SequenceEncoder<>(this);
	private final ArrayEncoder<Object> arrays = new ArrayEncoder<>(this);

	DynamicEncoder(ConverterRegistry registry) {
		this.registry = registry;
	}

	@Override
	@SuppressWarnings("unchecked")
	public Node encode(Object value) {
		if (value instanceof Node node) {
			return node;
		} else if (value instanceof Map<?, ?> map) {
			return maps.encode((Map<Object, Object>) map);
		} else if (value instanceof Map.Entry<?, ?> entry) {
			return pairs.encode((Map.Entry<Object, Object>) entry);
		} else if (value instanceof Iterable<?> iterable) {
			return sequences.encode((Iterable<Object>) iterable);
		} else if (value.getClass().isArray()) {
			return arrays.encode(value);
		} else if (value.getClass() == Object.class) {
			throw new UnsupportedTypeException("Can't encode a plain Object");
		} else {
			Encoder<Object> encoder = (Encoder<Object>) registry.encoderFor(DataType.of(value.getClass()));
			return encoder.encode(value);
		}
	}

	@Override
	public String toString() {
		return "dynamic";
	}
}
