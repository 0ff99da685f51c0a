package works.convey.codec.container;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import works.convey.codec.Converter;
import works.convey.codec.Mismatch;
import works.convey.tree.Node;
import works.convey.tree.SequenceNode;

import static java.util.Objects.requireNonNull;

/**
 * Converts a {@link Collection} to and from a sequence node.
 * <p>
 * Decoding fails as soon as any child fails to decode,
 * and either way, no partially populated collection is ever visible to the caller.
 */
public class SequenceConverter<E, C extends Collection<E>> extends SequenceEncoder<E, C> implements Converter<C> {
	private final Converter<E> elementConverter;
	private final Supplier<? extends C> factory;

	/**
	 * @param factory supplies a new empty collection each time it's called
	 */
	public SequenceConverter(Converter<E> element, Supplier<? extends C> factory) {
		super(element);
		this.elementConverter = element;
		this.factory = requireNonNull(factory);
	}

	public static <E> SequenceConverter<E, List<E>> arrayList(Converter<E> element) {
		return new SequenceConverter<>(element, ArrayList::new);
	}

	public static <E> SequenceConverter<E, LinkedList<E>> linkedList(Converter<E> element) {
		return new SequenceConverter<>(element, LinkedList::new);
	}

	@Override
	public Optional<C> decode(Node node) {
		if (!(node instanceof SequenceNode sequence)) {
			return Mismatch.SHAPE.reject(this, node);
		}
		C result = factory.get();
		for (Node child : sequence) {
			Optional<E> decoded = elementConverter.decode(child);
			if (decoded.isEmpty()) {
				return Optional.empty();
			}
			result.add(decoded.get());
		}
		return Optional.of(result);
	}

	/**
	 * Replaces the contents of {@code target} with the decoded elements,
	 * or leaves it untouched if decoding fails.
	 *
	 * @return true if decoding succeeded
	 */
	public boolean decodeInto(Node node, Collection<? super E> target) {
		Optional<C> decoded = decode(node);
		if (decoded.isPresent()) {
			target.clear();
			target.addAll(decoded.get());
			return true;
		} else {
			return false;
		}
	}
}
