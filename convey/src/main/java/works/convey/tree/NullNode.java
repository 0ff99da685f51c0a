package works.convey.tree;

/**
 * The absence of a value. All instances are equal.
 */
public record NullNode() implements Node {
	static final NullNode INSTANCE = new NullNode();

	@Override
	public NodeKind kind() {
		return NodeKind.NULL;
	}

	@Override
	public String toString() {
		return "~";
	}
}
