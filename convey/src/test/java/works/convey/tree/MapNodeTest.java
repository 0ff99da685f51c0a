package works.convey.tree;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MapNodeTest {
	final ScalarNode a = Node.scalar("a");
	final ScalarNode b = Node.scalar("b");

	@Test
	void insertReplacesInPlace() {
		MapNode map = Node.map()
			.insert(a, Node.scalar("1"))
			.insert(b, Node.scalar("2"))
			.insert(a, Node.scalar("3"));
		assertEquals(2, map.size());
		assertEquals(a, map.entries().get(0).getKey());
		assertEquals(Node.scalar("3"), map.entries().get(0).getValue());
		assertEquals(Optional.of(Node.scalar("2")), map.get(b));
	}

	@Test
	void forceInsertKeepsDuplicates() {
		MapNode map = Node.map()
			.forceInsert(a, Node.scalar("1"))
			.forceInsert(a, Node.scalar("2"));
		assertEquals(2, map.size());
		assertEquals(Optional.of(Node.scalar("2")), map.get(a), "Last pair wins");
	}

	@Test
	void missingKey() {
		assertEquals(Optional.empty(), Node.map().insert(a, b).get(b));
	}

	@Test
	void structuralEquality() {
		MapNode first = Node.map().insert(a, Node.sequence(b));
		MapNode second = Node.map().insert(Node.scalar("a"), Node.sequence(Node.scalar("b")));
		assertEquals(first, second);
		assertEquals(first.hashCode(), second.hashCode());
		assertNotEquals(first, Node.map().insert(b, Node.sequence(a)));
	}

	@Test
	void orderMatters() {
		MapNode ab = Node.map().insert(a, Node.nullNode()).insert(b, Node.nullNode());
		MapNode ba = Node.map().insert(b, Node.nullNode()).insert(a, Node.nullNode());
		assertNotEquals(ab, ba);
	}

	@Test
	void entriesAreUnmodifiable() {
		MapNode map = Node.map().insert(a, b);
		List<?> entries = map.entries();
		assertThrows(UnsupportedOperationException.class, entries::clear);
	}

	@Test
	void nullsRejected() {
		assertThrows(NullPointerException.class, () -> Node.map().insert(null, a));
		assertThrows(NullPointerException.class, () -> Node.map().forceInsert(a, null));
	}

	@Test
	void kind() {
		assertEquals(NodeKind.MAP, Node.map().kind());
	}
}
