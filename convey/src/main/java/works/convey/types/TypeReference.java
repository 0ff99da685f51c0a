package works.convey.types;

/**
 * Captures a generic type that can't be expressed as a class literal.
 * Use an anonymous subclass:
 *
 * <pre>
 *  DataType.of(new TypeReference&lt;Map&lt;String, List&lt;Integer&gt;&gt;&gt;() {})
 * </pre>
 */
@SuppressWarnings("unused") // The type parameter is used only via reflection
public abstract class TypeReference<T> {
	java.lang.reflect.Type reflectionType() {
		return ((java.lang.reflect.ParameterizedType) getClass()
			.getGenericSuperclass()).getActualTypeArguments()[0];
	}
}
