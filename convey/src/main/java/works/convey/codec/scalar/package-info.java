/**
 * Converters for values represented by a single node with no children,
 * along with the {@link works.convey.codec.scalar.ScalarGrammar grammars} they use to read scalar text.
 */
package works.convey.codec.scalar;
