package works.convey.registry;

import com.google.common.primitives.UnsignedInteger;
import com.google.common.primitives.UnsignedLong;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.convey.codec.Converter;
import works.convey.codec.Encoder;
import works.convey.codec.container.ArrayConverter;
import works.convey.codec.container.ArrayEncoder;
import works.convey.codec.container.MapConverter;
import works.convey.codec.container.MapEncoder;
import works.convey.codec.container.PairConverter;
import works.convey.codec.container.PairEncoder;
import works.convey.codec.container.SequenceConverter;
import works.convey.codec.container.SequenceEncoder;
import works.convey.codec.scalar.Base64Codec;
import works.convey.codec.scalar.Binary;
import works.convey.codec.scalar.BinaryConverter;
import works.convey.codec.scalar.BooleanConverter;
import works.convey.codec.scalar.CharacterConverter;
import works.convey.codec.scalar.FloatingPointConverter;
import works.convey.codec.scalar.IntegralConverter;
import works.convey.codec.scalar.NodeConverter;
import works.convey.codec.scalar.Null;
import works.convey.codec.scalar.NullConverter;
import works.convey.codec.scalar.StringConverter;
import works.convey.codec.scalar.StringLiteralEncoder;
import works.convey.exceptions.ConveyException;
import works.convey.exceptions.NodeContentException;
import works.convey.exceptions.UnsupportedTypeException;
import works.convey.tree.Node;
import works.convey.types.ArrayType;
import works.convey.types.BoundType;
import works.convey.types.DataType;
import works.convey.types.TypeReference;

import static java.util.Objects.requireNonNull;
import static works.convey.registry.Directive.fixed;

/**
 * Chooses the {@link Encoder} or {@link Converter} for each {@link DataType}
 * and offers one-call encoding and decoding on top of that.
 * <p>
 * Rules come from an ordered list of {@link Directive}s:
 * first the built-in ones, then any added through the {@link Builder}.
 * The first directive whose pattern matches a type supplies its rule,
 * which is then remembered, so each type is resolved at most once
 * (or a few times, harmlessly, if threads race).
 * <p>
 * A registry is immutable once built, and is safe to share between threads.
 */
public final class ConverterRegistry {
	private final List<Directive> directives;
	private final Map<DataType, Encoder<?>> memo = new ConcurrentHashMap<>();
	private final ThreadLocal<Set<DataType>> inProgress = new ThreadLocal<>();
	private final DynamicEncoder dynamic = new DynamicEncoder(this);

	private ConverterRegistry(List<Directive> directives) {
		this.directives = List.copyOf(directives);
	}

	/**
	 * @return a shared registry with only the built-in rules
	 */
	public static ConverterRegistry standard() {
		return Standard.INSTANCE;
	}

	public static Builder builder() {
		return new Builder();
	}

	private static final class Standard {
		static final ConverterRegistry INSTANCE = builder().build();
	}

	//
	// Rule lookup
	//

	/**
	 * @throws UnsupportedTypeException if no directive handles {@code type}
	 */
	public Encoder<?> encoderFor(DataType type) {
		return ruleFor(type);
	}

	@SuppressWarnings("unchecked")
	public <T> Encoder<T> encoderFor(Class<T> type) {
		return (Encoder<T>) encoderFor(DataType.of(type));
	}

	@SuppressWarnings("unchecked")
	public <T> Encoder<T> encoderFor(TypeReference<T> type) {
		return (Encoder<T>) encoderFor(DataType.of(type));
	}

	/**
	 * @throws UnsupportedTypeException if no directive handles {@code type},
	 * or if values of that type can be encoded but not decoded
	 */
	public Converter<?> converterFor(DataType type) {
		Encoder<?> rule = ruleFor(type);
		if (rule instanceof Converter<?> converter) {
			return converter;
		} else {
			throw new UnsupportedTypeException("Type " + type + " can be encoded but not decoded");
		}
	}

	@SuppressWarnings("unchecked")
	public <T> Converter<T> converterFor(Class<T> type) {
		return (Converter<T>) converterFor(DataType.of(type));
	}

	@SuppressWarnings("unchecked")
	public <T> Converter<T> converterFor(TypeReference<T> type) {
		return (Converter<T>) converterFor(DataType.of(type));
	}

	/**
	 * @param arrayClass such as {@code int[].class}
	 * @return a converter that decodes only sequences with exactly {@code length} children
	 */
	@SuppressWarnings("unchecked")
	public <A> ArrayConverter<A> fixedArray(Class<A> arrayClass, int length) {
		if (!arrayClass.isArray()) {
			throw new UnsupportedTypeException("Not an array type: " + arrayClass.getSimpleName());
		}
		return ((ArrayConverter<A>) converterFor(DataType.of(arrayClass))).withLength(length);
	}

	//
	// Encoding
	//

	/**
	 * Encodes {@code value} according to its runtime class.
	 * Maps, map entries, iterables, and arrays are encoded as such,
	 * with their contents also encoded according to their runtime classes.
	 *
	 * @param value may be null, giving a null node
	 */
	public Node encode(Object value) {
		return dynamic.encodeNullable(value);
	}

	public <T> Node encode(T value, Class<T> type) {
		return encoderFor(type).encodeNullable(value);
	}

	public <T> Node encode(T value, TypeReference<T> type) {
		return encoderFor(type).encodeNullable(value);
	}

	//
	// Decoding
	//

	/**
	 * @return the decoded value, or empty if {@code node} doesn't represent a {@code T}
	 * @throws UnsupportedTypeException if {@code T} can't be decoded at all
	 */
	public <T> Optional<T> decode(Node node, Class<T> type) {
		return converterFor(type).decode(node);
	}

	public <T> Optional<T> decode(Node node, TypeReference<T> type) {
		return converterFor(type).decode(node);
	}

	/**
	 * @throws NodeContentException if {@code node} doesn't represent a {@code T}
	 */
	public <T> T require(Node node, Class<T> type) {
		return decode(node, type).orElseThrow(() -> cannotDecode(node, DataType.of(type)));
	}

	public <T> T require(Node node, TypeReference<T> type) {
		return decode(node, type).orElseThrow(() -> cannotDecode(node, DataType.of(type)));
	}

	/**
	 * @return the decoded value, or {@code fallback} if {@code node} doesn't represent a {@code T}
	 */
	public <T> T decodeOr(Node node, Class<T> type, T fallback) {
		return decode(node, type).orElse(fallback);
	}

	public <T> T decodeOr(Node node, TypeReference<T> type, T fallback) {
		return decode(node, type).orElse(fallback);
	}

	private static NodeContentException cannotDecode(Node node, DataType type) {
		return new NodeContentException("Can't decode " + type + " from " + node.kind() + " node " + node);
	}

	//
	// Resolution
	//

	private Encoder<?> ruleFor(DataType type) {
		Encoder<?> existing = memo.get(type);
		if (existing != null) {
			return existing;
		}
		Set<DataType> active = inProgress.get();
		boolean outermost = (active == null);
		if (outermost) {
			active = new HashSet<>();
			inProgress.set(active);
		} else if (active.contains(type)) {
			LOGGER.debug("Type {} refers to itself; using forward reference", type);
			return new TypeRefConverter<>(type, this);
		}
		active.add(type);
		Encoder<?> result;
		try {
			result = resolve(type);
		} finally {
			active.remove(type);
			if (outermost) {
				inProgress.remove();
			}
		}
		Encoder<?> winner = memo.putIfAbsent(type, result);
		return (winner == null) ? result : winner;
	}

	/**
	 * @return true if the current thread is partway through resolving a rule
	 */
	boolean isResolving() {
		return inProgress.get() != null;
	}

	private Encoder<?> resolve(DataType type) {
		for (Directive directive : directives) {
			if (directive.matches(type)) {
				Encoder<?> result = directive.rule().create(type, this);
				if (result == null) {
					throw new IllegalStateException(directive + " returned no rule for " + type);
				}
				LOGGER.debug("Type {} uses {} from {}", type, result, directive);
				return result;
			}
		}
		throw new UnsupportedTypeException("No rule for type " + type);
	}

	/**
	 * Like {@link #ruleFor}, but blames {@code container} for any failure.
	 */
	@SuppressWarnings("unchecked")
	private Encoder<Object> elementRule(DataType container, DataType element) {
		try {
			return (Encoder<Object>) ruleFor(element);
		} catch (UnsupportedTypeException e) {
			throw ConveyException.wrap(e, "In " + container);
		}
	}

	/**
	 * @return {@code type} as a {@link BoundType} with exactly {@code arity} type arguments
	 */
	private static BoundType generic(DataType type, int arity) {
		if (type instanceof BoundType bound) {
			if (bound.isRaw()) {
				throw new UnsupportedTypeException("Raw type " + type + " is unsupported; supply its type arguments");
			} else if (bound.bindings().size() == arity) {
				return bound;
			}
		}
		throw new UnsupportedTypeException("Type " + type + " needs " + arity + " type argument(s)");
	}

	//
	// Built-in directives
	//

	private static List<Directive> builtInDirectives(Base64Codec base64) {
		List<Directive> directives = new ArrayList<>();

		directives.add(fixed("node", new NodeConverter(), Node.class));
		directives.add(fixed("string", new StringConverter(), String.class));
		directives.add(new Directive(
			"literal text",
			t -> CharSequence.class.isAssignableFrom(t.rawClass()),
			(t, r) -> new StringLiteralEncoder()));
		directives.add(fixed("null", new NullConverter(), Null.class));
		directives.add(fixed("char", new CharacterConverter(), Character.class));

		// Signed integers, boxed and unboxed
		directives.add(fixed("byte", IntegralConverter.BYTE, Byte.class));
		directives.add(fixed("short", IntegralConverter.SHORT, Short.class));
		directives.add(fixed("int", IntegralConverter.INTEGER, Integer.class));
		directives.add(fixed("long", IntegralConverter.LONG, Long.class));

		directives.add(fixed("unsigned int", IntegralConverter.UNSIGNED_INTEGER, UnsignedInteger.class));
		directives.add(fixed("unsigned long", IntegralConverter.UNSIGNED_LONG, UnsignedLong.class));

		directives.add(fixed("float", FloatingPointConverter.FLOAT, Float.class));
		directives.add(fixed("double", FloatingPointConverter.DOUBLE, Double.class));

		directives.add(fixed("boolean", new BooleanConverter(), Boolean.class));

		// Sequences. Order matters: a List could be either, but we prefer ArrayList.
		directives.add(Directive.implementedBy(ArrayList.class, Iterable.class,
			(t, r) -> r.sequenceRule(t, ArrayList::new)));
		directives.add(Directive.implementedBy(LinkedList.class, Iterable.class,
			(t, r) -> r.sequenceRule(t, LinkedList::new)));

		directives.add(new Directive("arrays", t -> t instanceof ArrayType,
			(t, r) -> r.arrayRule((ArrayType) t)));

		// Maps, likewise
		directives.add(Directive.implementedBy(LinkedHashMap.class, Map.class,
			(t, r) -> r.mapRule(t, LinkedHashMap::new, false)));
		directives.add(Directive.implementedBy(TreeMap.class, Map.class,
			(t, r) -> r.mapRule(t, TreeMap::new, true)));

		directives.add(Directive.forClass(Map.Entry.class, (t, r) -> r.pairRule(t)));

		directives.add(fixed("binary", new BinaryConverter(base64), Binary.class));

		// Encode-only, since a node doesn't say what class to decode it as
		directives.add(new Directive("dynamic", DataType.OBJECT::equals, (t, r) -> r.dynamic));

		return directives;
	}

	private Encoder<?> sequenceRule(DataType type, Supplier<? extends Collection<Object>> factory) {
		Encoder<Object> element = elementRule(type, generic(type, 1).typeArgument(0));
		if (element instanceof Converter<Object> converter) {
			return new SequenceConverter<>(converter, factory);
		} else {
			return new SequenceEncoder<>(element);
		}
	}

	private Encoder<?> arrayRule(ArrayType type) {
		Encoder<Object> element = elementRule(type, type.elementType());
		if (element instanceof Converter<Object> converter) {
			return ArrayConverter.of(type.rawClass(), converter);
		} else {
			return new ArrayEncoder<>(element);
		}
	}

	/**
	 * @param sorted if true, the map orders its keys by their natural ordering,
	 * so it can be decoded only if the key type is {@link Comparable}
	 */
	private Encoder<?> mapRule(DataType type, Supplier<? extends Map<Object, Object>> factory, boolean sorted) {
		BoundType bound = generic(type, 2);
		DataType keyType = bound.typeArgument(0);
		Encoder<Object> key = elementRule(type, keyType);
		Encoder<Object> value = elementRule(type, bound.typeArgument(1));
		boolean orderable = !sorted || Comparable.class.isAssignableFrom(keyType.boxedClass());
		if (!orderable) {
			LOGGER.debug("Type {} has keys of incomparable type {}; it can be encoded but not decoded", type, keyType);
		}
		if (orderable && key instanceof Converter<Object> k && value instanceof Converter<Object> v) {
			return new MapConverter<>(k, v, factory);
		} else {
			return new MapEncoder<>(key, value);
		}
	}

	private Encoder<?> pairRule(DataType type) {
		BoundType bound = generic(type, 2);
		Encoder<Object> first = elementRule(type, bound.typeArgument(0));
		Encoder<Object> second = elementRule(type, bound.typeArgument(1));
		if (first instanceof Converter<Object> f && second instanceof Converter<Object> s) {
			return new PairConverter<>(f, s);
		} else {
			return new PairEncoder<>(first, second);
		}
	}

	/**
	 * Configures a {@link ConverterRegistry}.
	 * Rules added here are consulted after the built-in ones, in the order they were added,
	 * so they can add support for new types but can't change how built-in types are handled.
	 */
	public static final class Builder {
		private final List<Directive> userDirectives = new ArrayList<>();
		private final List<DataType> registeredTypes = new ArrayList<>();
		private Base64Codec base64 = Base64Codec.standard();

		private Builder() { }

		/**
		 * Handles exactly {@code type} with the given rule.
		 * Supply a {@link Converter} if values of this type should be decodable.
		 */
		public <T> Builder register(Class<T> type, Encoder<T> rule) {
			return register(DataType.of(type), rule);
		}

		public <T> Builder register(TypeReference<T> type, Encoder<T> rule) {
			return register(DataType.of(type), rule);
		}

		public Builder register(DataType type, Encoder<?> rule) {
			requireNonNull(rule);
			registeredTypes.add(type);
			return add(fixed(type, rule));
		}

		public Builder add(Directive directive) {
			userDirectives.add(requireNonNull(directive));
			return this;
		}

		/**
		 * Replaces the default {@link Base64Codec#standard() base64} codec used for {@link Binary} values.
		 */
		public Builder base64Codec(Base64Codec base64) {
			this.base64 = requireNonNull(base64);
			return this;
		}

		/**
		 * @throws IllegalArgumentException if a type passed to {@code register}
		 * is already handled by a built-in directive
		 */
		public ConverterRegistry build() {
			List<Directive> builtIns = builtInDirectives(base64);
			for (DataType type : registeredTypes) {
				for (Directive builtIn : builtIns) {
					if (builtIn.matches(type)) {
						throw new IllegalArgumentException("Type " + type + " is already handled by built-in " + builtIn);
					}
				}
			}
			List<Directive> all = new ArrayList<>(builtIns);
			all.addAll(userDirectives);
			LOGGER.debug("Building registry with {} built-in and {} added directives", builtIns.size(), userDirectives.size());
			return new ConverterRegistry(all);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ConverterRegistry.class);
}
