package works.convey.types;

import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.List;
import java.util.stream.Stream;
import works.convey.exceptions.UnsupportedTypeException;

/**
 * A Java type, including its generic type arguments,
 * suitable for use as a lookup key.
 * <p>
 * Only fully concrete types are representable:
 * type variables and wildcards have no single conversion rule,
 * so {@link #of(Type)} rejects them.
 */
public sealed interface DataType permits PrimitiveType, BoundType, ArrayType {
	PrimitiveType BOOLEAN = new PrimitiveType(boolean.class);
	PrimitiveType BYTE = new PrimitiveType(byte.class);
	PrimitiveType SHORT = new PrimitiveType(short.class);
	PrimitiveType INT = new PrimitiveType(int.class);
	PrimitiveType LONG = new PrimitiveType(long.class);
	PrimitiveType FLOAT = new PrimitiveType(float.class);
	PrimitiveType DOUBLE = new PrimitiveType(double.class);
	PrimitiveType CHAR = new PrimitiveType(char.class);
	BoundType STRING = (BoundType) DataType.of(String.class);
	BoundType OBJECT = (BoundType) DataType.of(Object.class);

	/**
	 * @throws UnsupportedTypeException if {@code type} is, or contains,
	 * a type variable or a wildcard
	 */
	static DataType of(Type type) {
		if (type instanceof Class<?> clazz) {
			if (clazz.isArray()) {
				return new ArrayType(of(clazz.getComponentType()));
			} else if (clazz.isPrimitive()) {
				return new PrimitiveType(clazz);
			} else {
				// A generic class used without arguments is "raw";
				// directives that need the arguments will decline it.
				return new BoundType(clazz, List.of());
			}
		} else if (type instanceof ParameterizedType pt) {
			return new BoundType(
				(Class<?>) pt.getRawType(),
				Stream.of(pt.getActualTypeArguments()).map(DataType::of).toList());
		} else if (type instanceof GenericArrayType t) {
			return new ArrayType(of(t.getGenericComponentType()));
		}
		throw new UnsupportedTypeException("Unsupported type: " + type);
	}

	static DataType of(TypeReference<?> ref) {
		return of(ref.reflectionType());
	}

	/**
	 * @return the class that values of this type have (or, for interfaces, implement)
	 */
	Class<?> rawClass();

	/**
	 * @return {@link #rawClass()}, except that primitive types give their wrapper class
	 */
	default Class<?> boxedClass() {
		return rawClass();
	}
}
