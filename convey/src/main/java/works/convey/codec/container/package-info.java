/**
 * Converters for values with children: collections, arrays, map entries, and maps.
 * <p>
 * Each comes in two parts. The {@code *Encoder} class needs only an
 * {@link works.convey.codec.Encoder Encoder} for its elements,
 * while its {@code *Converter} subclass needs a full {@link works.convey.codec.Converter Converter}
 * and adds decoding. That way, a container of something that can't be decoded
 * can still be encoded, but can't be decoded either.
 */
package works.convey.codec.container;
