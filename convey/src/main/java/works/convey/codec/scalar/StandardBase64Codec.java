package works.convey.codec.scalar;

import java.util.Base64;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

enum StandardBase64Codec implements Base64Codec {
	INSTANCE;

	private static final Pattern WHITESPACE = Pattern.compile("\\s+");

	@Override
	public String encode(byte[] data) {
		return Base64.getEncoder().encodeToString(data);
	}

	@Override
	public byte[] decode(String text) {
		String compact = WHITESPACE.matcher(text).replaceAll("");
		try {
			return Base64.getDecoder().decode(compact);
		} catch (IllegalArgumentException e) {
			LOGGER.trace("Malformed base64 decodes as empty", e);
			return new byte[0];
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(StandardBase64Codec.class);
}
