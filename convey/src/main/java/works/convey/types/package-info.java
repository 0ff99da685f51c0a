/**
 * Abstract datatype representing concrete Java types, rooted at {@link works.convey.types.DataType}.
 * <p>
 * Provides the generic type information that {@link java.lang.Class} erases,
 * so that a {@code List<Integer>} and a {@code List<String>} can be told apart.
 */
package works.convey.types;
