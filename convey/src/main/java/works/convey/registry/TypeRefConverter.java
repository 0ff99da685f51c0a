package works.convey.registry;

import java.util.Optional;
import works.convey.codec.Converter;
import works.convey.codec.Encoder;
import works.convey.tree.Node;
import works.convey.types.DataType;

import static java.util.Objects.requireNonNull;

/**
 * Stands in for the rule for {@code type} while that rule is still being resolved,
 * and looks it up in the {@code registry} each time it's used.
 * <p>
 * This is what makes self-referential types possible:
 * a rule can refer to itself before it exists.
 * Using this before resolution completes throws the same exception
 * the resolution itself would.
 */
record TypeRefConverter<T>(DataType type, ConverterRegistry registry) implements Converter<T> {
	TypeRefConverter {
		requireNonNull(type);
		requireNonNull(registry);
	}

	@Override
	@SuppressWarnings("unchecked")
	public Node encode(T value) {
		return ((Encoder<T>) registry.encoderFor(type)).encode(value);
	}

	@Override
	@SuppressWarnings("unchecked")
	public Optional<T> decode(Node node) {
		return ((Converter<T>) registry.converterFor(type)).decode(node);
	}

	@Override
	public String toString() {
		return "@" + type;
	}
}
