package works.convey.codec.scalar;

import java.util.regex.Pattern;

/**
 * The lexical forms that scalar text can take.
 * Each grammar matches the whole text or nothing.
 * <p>
 * The integer grammars are mutually exclusive,
 * and only {@link #DECIMAL} permits a sign.
 */
public enum ScalarGrammar {
	TRUE("y|Y|yes|Yes|YES|true|True|TRUE|on|On|ON"),
	FALSE("n|N|no|No|NO|false|False|FALSE|off|Off|OFF"),
	DECIMAL("[-+]?[0-9]+"),
	OCTAL("0o[0-7]+"),
	HEX("0x[0-9a-fA-F]+"),
	FLOAT("[-+]?(\\.[0-9]+|[0-9]+(\\.[0-9]*)?)([eE][-+]?[0-9]+)?"),
	INFINITY("[-+]?(\\.inf|\\.Inf|\\.INF)"),
	NAN("\\.nan|\\.NaN|\\.NAN"),
	;

	private final Pattern pattern;

	ScalarGrammar(String regex) {
		this.pattern = Pattern.compile(regex);
	}

	public boolean matches(CharSequence text) {
		return pattern.matcher(text).matches();
	}
}
