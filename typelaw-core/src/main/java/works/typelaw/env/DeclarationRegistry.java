package works.typelaw.env;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import works.typelaw.types.DefId;

import static java.util.Objects.requireNonNull;

/**
 * A simple in-memory {@link DeclarationProvider} that hands out its own {@link DefId}s.
 * <p>
 * Self-referential declarations {@link #reserve reserve} an id first,
 * build their lowering around it, then {@link #define define} it.
 */
public final class DeclarationRegistry implements DeclarationProvider {
	private final AtomicInteger nextId = new AtomicInteger(1);
	private final ConcurrentHashMap<DefId, Declaration> declarations = new ConcurrentHashMap<>();

	public DefId reserve() {
		return new DefId(nextId.getAndIncrement());
	}

	public DefId register(Declaration declaration) {
		DefId result = reserve();
		define(result, declaration);
		return result;
	}

	/**
	 * @throws IllegalStateException if <code>def</code> is already defined
	 */
	public void define(DefId def, Declaration declaration) {
		Declaration existing = declarations.putIfAbsent(requireNonNull(def), requireNonNull(declaration));
		if (existing != null) {
			throw new IllegalStateException("Declaration " + def + " is already defined as \"" + existing.name() + "\"");
		}
	}

	@Override
	public Optional<Declaration> find(DefId def) {
		return Optional.ofNullable(declarations.get(def));
	}

	public int size() {
		return declarations.size();
	}
}
