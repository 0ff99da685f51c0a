package works.convey.types;

import java.util.Map;

public record PrimitiveType(Class<?> rawClass) implements DataType {
	private static final Map<Class<?>, Class<?>> BOXES = Map.of(
		boolean.class, Boolean.class,
		byte.class, Byte.class,
		short.class, Short.class,
		int.class, Integer.class,
		long.class, Long.class,
		float.class, Float.class,
		double.class, Double.class,
		char.class, Character.class,
		void.class, Void.class);

	public PrimitiveType {
		assert rawClass.isPrimitive();
	}

	@Override
	public Class<?> boxedClass() {
		return BOXES.get(rawClass);
	}

	@Override
	public String toString() {
		return rawClass.getSimpleName();
	}
}
