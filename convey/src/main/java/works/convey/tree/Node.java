package works.convey.tree;

/**
 * A value in a document tree: one of {@link NullNode}, {@link ScalarNode},
 * {@link SequenceNode}, or {@link MapNode}.
 * <p>
 * Nodes compare structurally.
 * Scalars carry only text; interpreting that text as a number, boolean, and so on
 * is the job of a {@link works.convey.codec.Converter Converter}.
 */
public sealed interface Node permits NullNode, ScalarNode, SequenceNode, MapNode {
	NodeKind kind();

	static NullNode nullNode() {
		return NullNode.INSTANCE;
	}

	static ScalarNode scalar(String text) {
		return new ScalarNode(text);
	}

	static SequenceNode sequence() {
		return new SequenceNode();
	}

	static SequenceNode sequence(Node... children) {
		SequenceNode result = new SequenceNode();
		for (Node child : children) {
			result.append(child);
		}
		return result;
	}

	static MapNode map() {
		return new MapNode();
	}

	default boolean isNull() {
		return kind() == NodeKind.NULL;
	}

	default boolean isScalar() {
		return kind() == NodeKind.SCALAR;
	}

	default boolean isSequence() {
		return kind() == NodeKind.SEQUENCE;
	}

	default boolean isMap() {
		return kind() == NodeKind.MAP;
	}
}
