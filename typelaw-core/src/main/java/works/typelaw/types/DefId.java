package works.typelaw.types;

/**
 * Identifies a named declaration (an interface, class, alias, or enum)
 * owned by whatever binder populates the {@link works.typelaw.env.TypeEnvironment}.
 */
public record DefId(int value) {
	@Override
	public String toString() {
		return "def#" + value;
	}
}
