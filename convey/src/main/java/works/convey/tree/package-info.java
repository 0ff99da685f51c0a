/**
 * A minimal in-memory document tree, rooted at {@link works.convey.tree.Node}.
 * <p>
 * This is the value model a YAML or JSON parser produces once all the syntax is gone:
 * nulls, scalar text, sequences, and maps.
 * It offers only what transcoding needs:
 * inspecting a node's {@link works.convey.tree.NodeKind kind} and contents,
 * constructing nodes, appending to sequences, and inserting into maps.
 */
package works.convey.tree;
