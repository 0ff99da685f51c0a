package works.convey.tree;

import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * An ordered collection of key/value pairs, where keys are themselves nodes.
 * <p>
 * Whether keys are unique depends on which insertion method is used:
 * {@link #insert} keeps them unique, while {@link #forceInsert} does not check,
 * which is how a parser can faithfully represent a document that repeats a key.
 */
public final class MapNode implements Node {
	private final List<Map.Entry<Node, Node>> entries = new ArrayList<>();

	MapNode() { }

	@Override
	public NodeKind kind() {
		return NodeKind.MAP;
	}

	/**
	 * If a key equal to {@code key} is already present, its value is replaced
	 * and it keeps its original position; otherwise the pair is appended.
	 *
	 * @return this
	 */
	public MapNode insert(Node key, Node value) {
		requireNonNull(key);
		requireNonNull(value);
		for (int i = 0; i < entries.size(); i++) {
			if (entries.get(i).getKey().equals(key)) {
				entries.set(i, new SimpleImmutableEntry<>(entries.get(i).getKey(), value));
				return this;
			}
		}
		entries.add(new SimpleImmutableEntry<>(key, value));
		return this;
	}

	/**
	 * Appends the pair without looking for an existing equal key.
	 *
	 * @return this
	 */
	public MapNode forceInsert(Node key, Node value) {
		entries.add(new SimpleImmutableEntry<>(requireNonNull(key), requireNonNull(value)));
		return this;
	}

	/**
	 * @return the value of the last pair whose key equals {@code key}
	 */
	public Optional<Node> get(Node key) {
		for (int i = entries.size() - 1; i >= 0; i--) {
			if (entries.get(i).getKey().equals(key)) {
				return Optional.of(entries.get(i).getValue());
			}
		}
		return Optional.empty();
	}

	public int size() {
		return entries.size();
	}

	/**
	 * @return an unmodifiable view of the pairs in insertion order
	 */
	public List<Map.Entry<Node, Node>> entries() {
		return unmodifiableList(entries);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof MapNode other && entries.equals(other.entries);
	}

	@Override
	public int hashCode() {
		return entries.hashCode();
	}

	@Override
	public String toString() {
		return entries.stream()
			.map(e -> e.getKey() + ": " + e.getValue())
			.collect(joining(", ", "{", "}"));
	}
}
