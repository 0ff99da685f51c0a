package works.convey.codec.container;

import java.lang.reflect.Array;
import java.util.Optional;
import works.convey.codec.Converter;
import works.convey.codec.Mismatch;
import works.convey.tree.Node;
import works.convey.tree.SequenceNode;

import static java.util.Objects.requireNonNull;

/**
 * Converts an array to and from a sequence node.
 * <p>
 * By default, any number of children is accepted, and the decoded array has that length.
 * A converter obtained from {@link #withLength} accepts only sequences of exactly that length,
 * and checks this before decoding any children.
 *
 * @param <A> the array type, such as {@code String[]} or {@code int[]}
 */
public class ArrayConverter<A> extends ArrayEncoder<A> implements Converter<A> {
	private static final int ANY_LENGTH = -1;

	private final Converter<?> elementConverter;
	private final Class<?> componentType;
	private final int requiredLength;

	private ArrayConverter(Converter<?> element, Class<?> componentType, int requiredLength) {
		super(element);
		this.elementConverter = element;
		this.componentType = requireNonNull(componentType);
		this.requiredLength = requiredLength;
	}

	/**
	 * @param arrayClass such as {@code int[].class}
	 * @param element decodes values of the array's component type, boxed if it's primitive
	 */
	public static <A> ArrayConverter<A> of(Class<A> arrayClass, Converter<?> element) {
		if (!arrayClass.isArray()) {
			throw new IllegalArgumentException("Not an array class: " + arrayClass);
		}
		return new ArrayConverter<>(element, arrayClass.getComponentType(), ANY_LENGTH);
	}

	/**
	 * @return a converter like this one, except that decoding requires exactly {@code length} children
	 */
	public ArrayConverter<A> withLength(int length) {
		if (length < 0) {
			throw new IllegalArgumentException("Negative array length: " + length);
		}
		return new ArrayConverter<>(elementConverter, componentType, length);
	}

	@Override
	public Optional<A> decode(Node node) {
		if (!(node instanceof SequenceNode sequence)) {
			return Mismatch.SHAPE.reject(this, node);
		}
		if (requiredLength != ANY_LENGTH && sequence.size() != requiredLength) {
			return Mismatch.SHAPE.reject(this, node);
		}
		return decodeElements(sequence);
	}

	/**
	 * Overwrites every element of {@code target} with the decoded values,
	 * or leaves it untouched if decoding fails.
	 * The sequence must have exactly as many children as {@code target} has elements.
	 *
	 * @return true if decoding succeeded
	 */
	public boolean decodeInto(Node node, A target) {
		int length = Array.getLength(target);
		if (!(node instanceof SequenceNode sequence) || sequence.size() != length) {
			Mismatch.SHAPE.reject(this, node);
			return false;
		}
		Optional<A> decoded = decodeElements(sequence);
		if (decoded.isPresent()) {
			System.arraycopy(decoded.get(), 0, target, 0, length);
			return true;
		} else {
			return false;
		}
	}

	@SuppressWarnings("unchecked")
	private Optional<A> decodeElements(SequenceNode sequence) {
		Object result = Array.newInstance(componentType, sequence.size());
		for (int i = 0; i < sequence.size(); i++) {
			Optional<?> decoded = elementConverter.decode(sequence.get(i));
			if (decoded.isEmpty()) {
				return Optional.empty();
			}
			Array.set(result, i, decoded.get());
		}
		return Optional.of((A) result);
	}

	@Override
	public String toString() {
		if (requiredLength == ANY_LENGTH) {
			return super.toString();
		} else {
			return element + "[" + requiredLength + "]";
		}
	}
}
