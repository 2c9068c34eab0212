package works.typelaw.env;

import java.util.Optional;
import works.typelaw.types.DefId;

/**
 * The binder-facing side of the environment: looks up declarations by id.
 * Implementations must be safe to call from multiple threads.
 */
@FunctionalInterface
public interface DeclarationProvider {
	Optional<Declaration> find(DefId def);

	DeclarationProvider EMPTY = def -> Optional.empty();
}
