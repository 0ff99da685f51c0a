package works.convey.codec;

import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.convey.tree.Node;

/**
 * The reasons a node can fail to decode.
 * <p>
 * Callers only ever see an empty {@link Optional};
 * the distinction exists for the trace log.
 */
public enum Mismatch {
	/**
	 * The node's kind or number of children doesn't suit the target type.
	 */
	SHAPE,

	/**
	 * The scalar text matches none of the target type's grammars.
	 */
	LEXICAL,

	/**
	 * The scalar text is a well-formed number that the target type can't hold.
	 */
	RANGE,
	;

	/**
	 * @return empty
	 */
	public <T> Optional<T> reject(Object target, Node node) {
		if (LOGGER.isTraceEnabled()) {
			LOGGER.trace("{} mismatch decoding {} from {}", this, target, node);
		}
		return Optional.empty();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Mismatch.class);
}
