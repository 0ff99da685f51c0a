/**
 * Selects the conversion rule for each type.
 * <p>
 * Most callers need only {@link works.convey.registry.ConverterRegistry#standard()}
 * and its {@code encode} and {@code decode} methods.
 * Support for additional types is added with a
 * {@link works.convey.registry.ConverterRegistry.Builder Builder}.
 */
package works.convey.registry;
