package works.convey.registry;

import java.util.Set;
import java.util.function.Predicate;
import works.convey.codec.Encoder;
import works.convey.types.BoundType;
import works.convey.types.DataType;

import static java.util.Objects.requireNonNull;

/**
 * Tells a {@link ConverterRegistry} how to handle the types matching {@link #pattern}.
 * <p>
 * When resolving a type, the registry consults its directives in order,
 * and the first whose pattern matches supplies the rule.
 * The {@link RuleFactory} receives the registry itself so it can resolve
 * rules for any type arguments.
 *
 * @param description appears in log messages and {@link #toString()}
 */
public record Directive(
	String description,
	Predicate<? super DataType> pattern,
	RuleFactory rule
) {
	public Directive {
		requireNonNull(description);
		requireNonNull(pattern);
		requireNonNull(rule);
	}

	@FunctionalInterface
	public interface RuleFactory {
		/**
		 * @param type matches the directive's pattern
		 * @return a {@link works.convey.codec.Converter Converter} if {@code type} can be decoded;
		 * otherwise just an {@link Encoder}
		 * @throws works.convey.exceptions.UnsupportedTypeException if, on closer inspection,
		 * the type can't be handled after all
		 */
		Encoder<?> create(DataType type, ConverterRegistry registry);
	}

	public boolean matches(DataType type) {
		return pattern.test(type);
	}

	/**
	 * Matches the given classes exactly, plus the primitive type of any wrapper class among them.
	 */
	public static Directive fixed(String description, Encoder<?> encoder, Class<?>... classes) {
		Set<Class<?>> set = Set.of(classes);
		return new Directive(
			description,
			t -> set.contains(t.boxedClass()),
			(t, r) -> encoder);
	}

	/**
	 * Matches the given type exactly.
	 */
	public static Directive fixed(DataType type, Encoder<?> encoder) {
		return new Directive(type.toString(), type::equals, (t, r) -> encoder);
	}

	/**
	 * Matches any instantiation of the given class, generic or not.
	 */
	public static Directive forClass(Class<?> rawClass, RuleFactory rule) {
		return new Directive(rawClass.getSimpleName(), t -> t.rawClass().equals(rawClass), rule);
	}

	/**
	 * Matches types {@code T} such that {@code T} is a subtype of {@code bound}
	 * and {@code implementation} is a subtype of {@code T}.
	 * This selects the interfaces and superclasses for which {@code implementation}
	 * is a suitable thing to construct.
	 */
	public static Directive implementedBy(Class<?> implementation, Class<?> bound, RuleFactory rule) {
		return new Directive(
			bound.getSimpleName() + " as " + implementation.getSimpleName(),
			t -> t instanceof BoundType
				&& bound.isAssignableFrom(t.rawClass())
				&& t.rawClass().isAssignableFrom(implementation),
			rule);
	}

	@Override
	public String toString() {
		return "Directive[" + description + "]";
	}
}
