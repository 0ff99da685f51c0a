package works.convey.codec.scalar;

/**
 * A placeholder for an explicit null in the document,
 * for use where Java would otherwise need a {@code null} reference.
 */
public enum Null {
	NULL
}
