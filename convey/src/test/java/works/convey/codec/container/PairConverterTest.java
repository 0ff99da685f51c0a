package works.convey.codec.container;

import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import works.convey.codec.scalar.BooleanConverter;
import works.convey.codec.scalar.StringConverter;
import works.convey.tree.Node;

import static org.junit.jupiter.api.Assertions.assertEquals;

class PairConverterTest {
	final PairConverter<String, Boolean> converter = new PairConverter<>(new StringConverter(), new BooleanConverter());

	@Test
	void roundTrip() {
		Node node = converter.encode(Map.entry("enabled", true));
		assertEquals(Node.sequence(Node.scalar("enabled"), Node.scalar("true")), node);
		assertEquals(Optional.of(Map.entry("enabled", true)), converter.decode(node));
	}

	@Test
	void wrongLength() {
		assertEquals(Optional.empty(), converter.decode(Node.sequence(Node.scalar("a"))));
		assertEquals(Optional.empty(), converter.decode(Node.sequence(Node.scalar("a"), Node.scalar("yes"), Node.scalar("no"))));
	}

	@Test
	void wrongShape() {
		assertEquals(Optional.empty(), converter.decode(Node.map().insert(Node.scalar("a"), Node.scalar("yes"))));
	}

	@Test
	void failingMember() {
		assertEquals(Optional.empty(), converter.decode(Node.sequence(Node.scalar("a"), Node.scalar("maybe"))));
		assertEquals(Optional.empty(), converter.decode(Node.sequence(Node.nullNode(), Node.scalar("yes"))));
	}
}
