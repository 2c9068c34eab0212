package works.typelaw.guard;

/**
 * The {@link Limits} a query can run out of.
 */
public enum Budget {
	SUBTYPE_DEPTH,
	RELATION_OPERATIONS,
	IN_PROGRESS_PAIRS,
	INSTANTIATION_DEPTH,
	EVALUATION_DEPTH,
	TEMPLATE_EXPANSION,
	MAPPED_KEYS,
}
