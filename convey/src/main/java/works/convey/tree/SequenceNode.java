package works.convey.tree;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * An ordered list of child nodes. Children can only be appended.
 */
public final class SequenceNode implements Node, Iterable<Node> {
	private final List<Node> children = new ArrayList<>();

	SequenceNode() { }

	@Override
	public NodeKind kind() {
		return NodeKind.SEQUENCE;
	}

	/**
	 * @return this
	 */
	public SequenceNode append(Node child) {
		children.add(requireNonNull(child));
		return this;
	}

	public int size() {
		return children.size();
	}

	/**
	 * @throws IndexOutOfBoundsException if {@code index} is not less than {@link #size()}
	 */
	public Node get(int index) {
		return children.get(index);
	}

	/**
	 * @return an unmodifiable view
	 */
	public List<Node> children() {
		return unmodifiableList(children);
	}

	@Override
	public Iterator<Node> iterator() {
		return children().iterator();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof SequenceNode other && children.equals(other.children);
	}

	@Override
	public int hashCode() {
		return children.hashCode();
	}

	@Override
	public String toString() {
		return children.stream()
			.map(Node::toString)
			.collect(joining(", ", "[", "]"));
	}
}
