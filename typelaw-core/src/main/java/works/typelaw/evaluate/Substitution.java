package works.typelaw.evaluate;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import works.typelaw.types.TypeId;

/**
 * An immutable mapping from type parameter names to the types that replace them.
 */
public final class Substitution {
	public static final Substitution EMPTY = new Substitution(Map.of());

	private final Map<String, TypeId> bindings;

	private Substitution(Map<String, TypeId> bindings) {
		this.bindings = bindings;
	}

	public static Substitution of(Map<String, TypeId> bindings) {
		return bindings.isEmpty() ? EMPTY : new Substitution(Map.copyOf(bindings));
	}

	public @Nullable TypeId get(String name) {
		return bindings.get(name);
	}

	public boolean isEmpty() {
		return bindings.isEmpty();
	}

	public Map<String, TypeId> bindings() {
		return bindings;
	}

	public Substitution with(String name, TypeId type) {
		Map<String, TypeId> result = new LinkedHashMap<>(bindings);
		result.put(name, type);
		return new Substitution(Map.copyOf(result));
	}

	/**
	 * @return this substitution minus the given names, as when entering a scope that shadows them
	 */
	public Substitution without(Collection<String> names) {
		if (names.stream().noneMatch(bindings::containsKey)) {
			return this;
		}
		Map<String, TypeId> result = new LinkedHashMap<>(bindings);
		result.keySet().removeAll(names);
		return of(result);
	}

	@Override
	public String toString() {
		return "Substitution" + bindings;
	}
}
