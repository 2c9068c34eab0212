package works.typelaw.env;

import java.util.List;
import java.util.function.Function;
import org.jetbrains.annotations.Nullable;
import works.typelaw.types.TypeFactory;
import works.typelaw.types.TypeId;
import works.typelaw.types.TypeParamInfo;

import static java.util.Objects.requireNonNull;

/**
 * What a binder knows about one named declaration.
 * <p>
 * Lowering to types is deferred until the environment first needs it,
 * so declarations may refer to each other (and to themselves) freely
 * through {@link TypeFactory#lazy lazy} references.
 */
public interface Declaration {
	String name();

	DeclarationKind kind();

	/**
	 * Empty unless the declaration is generic. The declared type refers to
	 * these by name as {@link works.typelaw.types.TypeKey.TypeParameter type parameters}.
	 */
	List<TypeParamInfo> typeParameters();

	/**
	 * @return the type this declaration denotes in a type position
	 */
	TypeId lowerType(TypeFactory factory);

	/**
	 * @return the type of the value this declaration introduces, as seen by <code>typeof</code>,
	 * or null if it introduces no value
	 */
	default @Nullable TypeId lowerValueType(TypeFactory factory) {
		return null;
	}

	static Declaration alias(String name, List<TypeParamInfo> typeParameters, Function<TypeFactory, TypeId> lowering) {
		return new Simple(name, DeclarationKind.TYPE_ALIAS, typeParameters, lowering, null);
	}

	static Declaration alias(String name, Function<TypeFactory, TypeId> lowering) {
		return alias(name, List.of(), lowering);
	}

	static Declaration interfaceDeclaration(String name, List<TypeParamInfo> typeParameters, Function<TypeFactory, TypeId> lowering) {
		return new Simple(name, DeclarationKind.INTERFACE, typeParameters, lowering, null);
	}

	/**
	 * An enum is both a type (the union of its members) and a value (the enum object).
	 */
	static Declaration enumDeclaration(String name, Function<TypeFactory, TypeId> lowering, @Nullable Function<TypeFactory, TypeId> objectLowering) {
		return new Simple(name, DeclarationKind.ENUM, List.of(), lowering, objectLowering);
	}

	static Declaration classDeclaration(String name, List<TypeParamInfo> typeParameters, Function<TypeFactory, TypeId> instanceLowering, Function<TypeFactory, TypeId> constructorLowering) {
		return new Simple(name, DeclarationKind.CLASS, typeParameters, instanceLowering, constructorLowering);
	}

	/**
	 * A value-only declaration. Used as a type, it is unresolved.
	 */
	static Declaration variable(String name, Function<TypeFactory, TypeId> valueLowering) {
		return new Simple(name, DeclarationKind.VARIABLE, List.of(), f -> TypeId.UNRESOLVED, valueLowering);
	}

	record Simple(
		String name,
		DeclarationKind kind,
		List<TypeParamInfo> typeParameters,
		Function<TypeFactory, TypeId> typeLowering,
		@Nullable Function<TypeFactory, TypeId> valueLowering
	) implements Declaration {
		public Simple {
			requireNonNull(name);
			requireNonNull(kind);
			typeParameters = List.copyOf(typeParameters);
			requireNonNull(typeLowering);
		}

		@Override
		public TypeId lowerType(TypeFactory factory) {
			return typeLowering.apply(factory);
		}

		@Override
		public @Nullable TypeId lowerValueType(TypeFactory factory) {
			return valueLowering == null ? null : valueLowering.apply(factory);
		}
	}
}
