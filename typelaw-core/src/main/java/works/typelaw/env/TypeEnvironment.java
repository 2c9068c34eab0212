package works.typelaw.env;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.typelaw.types.DefId;
import works.typelaw.types.TypeFactory;
import works.typelaw.types.TypeId;
import works.typelaw.types.TypeParamInfo;

import static java.util.Objects.requireNonNull;

/**
 * Resolves {@link DefId}s to their lowered types on demand, and caches the results.
 * <p>
 * A declaration the provider doesn't know (yet) resolves to {@link TypeId#UNRESOLVED}.
 * That outcome is not cached, so a binder may still supply the declaration later.
 * Once a declaration has been lowered, its resolution never changes.
 */
public final class TypeEnvironment {
	private final TypeFactory factory;
	private final DeclarationProvider provider;
	private final LibraryTypes library;
	private final ConcurrentHashMap<DefId, Resolution> resolutions = new ConcurrentHashMap<>();
	// Declarations the current thread is lowering; other threads may be lowering the same ones
	private final ThreadLocal<Set<DefId>> lowering = ThreadLocal.withInitial(HashSet::new);

	public TypeEnvironment(TypeFactory factory, DeclarationProvider provider, LibraryTypes library) {
		this.factory = requireNonNull(factory);
		this.provider = requireNonNull(provider);
		this.library = requireNonNull(library);
	}

	public TypeFactory factory() {
		return factory;
	}

	public LibraryTypes library() {
		return library;
	}

	public Optional<Resolution> resolve(DefId def) {
		Resolution existing = resolutions.get(def);
		if (existing != null) {
			return Optional.of(existing);
		}
		Optional<Declaration> declaration = provider.find(def);
		if (declaration.isEmpty()) {
			LOGGER.debug("No declaration for {}", def);
			return Optional.empty();
		}

		Set<DefId> inProgress = lowering.get();
		if (!inProgress.add(def)) {
			// Lowering asked for its own result; it should have used a lazy reference
			LOGGER.warn("Declaration {} \"{}\" refers to itself eagerly during lowering", def, declaration.get().name());
			return Optional.empty();
		}
		try {
			Resolution lowered = lower(def, declaration.get());
			Resolution winner = resolutions.putIfAbsent(def, lowered);
			return Optional.of(winner == null ? lowered : winner);
		} finally {
			inProgress.remove(def);
		}
	}

	private Resolution lower(DefId def, Declaration declaration) {
		LOGGER.trace("Lowering {} \"{}\"", def, declaration.name());
		TypeId declaredType = requireNonNull(declaration.lowerType(factory), "declared type");
		TypeId valueType = declaration.lowerValueType(factory);
		return new Resolution(
			def,
			declaration.name(),
			declaration.kind(),
			declaration.typeParameters(),
			declaredType,
			valueType == null ? TypeId.UNRESOLVED : valueType);
	}

	public TypeId declaredType(DefId def) {
		return resolve(def).map(Resolution::declaredType).orElse(TypeId.UNRESOLVED);
	}

	public TypeId valueType(DefId def) {
		return resolve(def).map(Resolution::valueType).orElse(TypeId.UNRESOLVED);
	}

	public List<TypeParamInfo> typeParameters(DefId def) {
		return resolve(def).map(Resolution::typeParameters).orElse(List.of());
	}

	/**
	 * Doesn't lower the declaration, so it's safe to call while formatting.
	 */
	public String nameOf(DefId def) {
		Resolution resolution = resolutions.get(def);
		if (resolution != null) {
			return resolution.name();
		}
		return provider.find(def).map(Declaration::name).orElse(def.toString());
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TypeEnvironment.class);
}
