/**
 * Conversion between Java values and {@link works.convey.tree.Node document nodes}.
 * <p>
 * An {@link works.convey.codec.Encoder} turns a value into a node and always succeeds.
 * A {@link works.convey.codec.Converter} can also turn a node back into a value,
 * reporting failure as an empty {@link java.util.Optional}.
 * <p>
 * The leaf converters live in {@link works.convey.codec.scalar},
 * and the generic ones for collections, arrays, entries and maps in {@link works.convey.codec.container}.
 * Most callers don't construct these directly, but obtain them from a
 * {@link works.convey.registry.ConverterRegistry ConverterRegistry}.
 */
package works.convey.codec;
