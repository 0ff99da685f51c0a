package works.convey.tree;

import static java.util.Objects.requireNonNull;

/**
 * A leaf value, held as the text that appeared in the document
 * after any quoting and escaping has been resolved.
 */
public record ScalarNode(String text) implements Node {
	public ScalarNode {
		requireNonNull(text);
	}

	@Override
	public NodeKind kind() {
		return NodeKind.SCALAR;
	}

	@Override
	public String toString() {
		return "\"" + text + "\"";
	}
}
