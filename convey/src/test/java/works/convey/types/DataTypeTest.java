package works.convey.types;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import works.convey.exceptions.UnsupportedTypeException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DataTypeTest {

	@Test
	void primitives() {
		assertEquals(DataType.INT, DataType.of(int.class));
		assertEquals(Integer.class, DataType.INT.boxedClass());
		assertEquals(int.class, DataType.INT.rawClass());
	}

	@Test
	void parameterized() {
		DataType type = DataType.of(new TypeReference<Map<String, List<Integer>>>() {});
		assertEquals(
			new BoundType(Map.class, DataType.STRING, new BoundType(List.class, DataType.of(Integer.class))),
			type);
		assertEquals("Map<String,List<Integer>>", type.toString());
	}

	@Test
	void rawTypes() {
		assertTrue(((BoundType) DataType.of(List.class)).isRaw());
		assertFalse(((BoundType) DataType.of(String.class)).isRaw());
	}

	@Test
	void arrays() {
		ArrayType primitive = (ArrayType) DataType.of(int[].class);
		assertEquals(DataType.INT, primitive.elementType());
		assertEquals(int[].class, primitive.rawClass());

		ArrayType generic = (ArrayType) DataType.of(new TypeReference<List<String>[]>() {});
		assertEquals(new BoundType(List.class, DataType.STRING), generic.elementType());
		assertEquals(List[].class, generic.rawClass());
	}

	@Test
	void typeVariablesRejected() {
		TypeReference<?> ref = listOfTypeVariable();
		assertThrows(UnsupportedTypeException.class, () -> DataType.of(ref));
	}

	private static <T> TypeReference<List<T>> listOfTypeVariable() {
		return new TypeReference<List<T>>() {};
	}

	@Test
	void wildcardsRejected() {
		assertThrows(UnsupportedTypeException.class, () -> DataType.of(new TypeReference<List<? extends Number>>() {}));
	}
}
