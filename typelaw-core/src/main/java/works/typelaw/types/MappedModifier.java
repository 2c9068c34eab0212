package works.typelaw.types;

/**
 * How a mapped type treats the <code>readonly</code> or <code>?</code> modifier
 * of the properties it produces.
 */
public enum MappedModifier {
	/**
	 * Copy the modifier from the source property of a homomorphic mapping.
	 */
	PRESERVE,
	ADD,
	REMOVE,
}
