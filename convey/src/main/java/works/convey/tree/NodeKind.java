package works.convey.tree;

public enum NodeKind {
	NULL,
	SCALAR,
	SEQUENCE,
	MAP,
}
