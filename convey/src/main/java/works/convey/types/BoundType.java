package works.convey.types;

import java.util.List;

import static java.util.stream.Collectors.joining;

/**
 * A class or interface type accompanied by its generic type arguments.
 * Not to be confused with a <em>bounded type</em>;
 * this is about <em>bindings</em>, not <em>bounds</em>.
 * <p>
 * For ordinary classes, {@code bindings} will be empty,
 * indicating that the class has no type parameters.
 * A generic class with empty {@code bindings} is a raw type.
 */
public record BoundType(Class<?> rawClass, List<? extends DataType> bindings) implements DataType {

	public BoundType {
		bindings = List.copyOf(bindings);
	}

	public BoundType(Class<?> rawClass, DataType... bindings) {
		this(rawClass, List.of(bindings));
	}

	public DataType typeArgument(int index) {
		return bindings().get(index);
	}

	public boolean isRaw() {
		return bindings.isEmpty() && rawClass.getTypeParameters().length != 0;
	}

	@Override
	public String toString() {
		String simpleName = this.rawClass().getSimpleName();
		if (simpleName.isEmpty()) {
			// Anonymous classes
			simpleName = this.rawClass().getName();
			simpleName = simpleName.substring(simpleName.lastIndexOf('.') + 1);
		}
		if (this.bindings().isEmpty()) {
			return simpleName;
		} else {
			return simpleName + "<"
				+ this.bindings().stream()
				.map(DataType::toString)
				.collect(joining(","))
				+ ">";
		}
	}
}
