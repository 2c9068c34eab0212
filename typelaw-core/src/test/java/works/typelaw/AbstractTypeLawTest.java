package works.typelaw;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import works.typelaw.env.Declaration;
import works.typelaw.env.DeclarationRegistry;
import works.typelaw.types.DefId;
import works.typelaw.types.LiteralValue;
import works.typelaw.types.MappedModifier;
import works.typelaw.types.ObjectShape;
import works.typelaw.types.ParamInfo;
import works.typelaw.types.PropertyInfo;
import works.typelaw.types.TypeFactory;
import works.typelaw.types.TypeId;
import works.typelaw.types.TypeKey;
import works.typelaw.types.TypeParamInfo;

import static works.typelaw.types.TypeId.ANY;
import static works.typelaw.types.TypeId.FALSE;
import static works.typelaw.types.TypeId.NEVER;
import static works.typelaw.types.TypeId.TRUE;

/**
 * Sets up a fresh session for each test, along with the handful of
 * standard library aliases the tests lean on.
 */
public abstract class AbstractTypeLawTest {
	protected DeclarationRegistry registry;
	protected TypeSystem types;
	protected TypeFactory f;

	@BeforeEach
	protected void setupTypeSystem() {
		registry = new DeclarationRegistry();
		types = new TypeSystem(registry, config());
		f = types.factory();
	}

	protected TypeSystemConfig config() {
		return TypeSystemConfig.simple();
	}

	protected TypeId str(String value) {
		return f.literal(value);
	}

	protected TypeId num(double value) {
		return f.literal(value);
	}

	protected TypeId param(String name) {
		return f.typeParameter(name);
	}

	protected TypeId object(PropertyInfo... properties) {
		return f.object(properties);
	}

	protected TypeId alias(String name, Function<TypeFactory, TypeId> lowering) {
		return f.lazy(registry.register(Declaration.alias(name, lowering)));
	}

	protected TypeId generic(String name, List<TypeParamInfo> typeParameters, Function<TypeFactory, TypeId> lowering) {
		return f.lazy(registry.register(Declaration.alias(name, typeParameters, lowering)));
	}

	protected TypeId apply(TypeId generic, TypeId... arguments) {
		return f.application(generic, arguments);
	}

	/**
	 * Declares an enum whose members are given as alternating names and values.
	 */
	protected TypeId enumType(String name, Object... namesAndValues) {
		Map<String, LiteralValue> members = new LinkedHashMap<>();
		for (int i = 0; i < namesAndValues.length; i += 2) {
			Object value = namesAndValues[i + 1];
			members.put((String) namesAndValues[i], value instanceof String s
				? LiteralValue.of(s)
				: LiteralValue.of(((Number) value).doubleValue()));
		}
		DefId def = registry.reserve();
		registry.define(def, Declaration.enumDeclaration(name, factory -> factory.enumType(def, members), null));
		return f.enumType(def, members);
	}

	protected TypeId enumMember(TypeId enumType, String memberName) {
		TypeKey.Enum e = (TypeKey.Enum) f.lookup(enumType);
		for (TypeId member : f.interner().typeList(e.members())) {
			if (((TypeKey.EnumMember) f.lookup(member)).name().equals(memberName)) {
				return member;
			}
		}
		throw new IllegalArgumentException("No member " + memberName + " in " + types.format(enumType));
	}

	protected ObjectShape shapeOf(TypeId id) {
		return f.interner().objectShapeOf(id);
	}

	// Standard library aliases

	/**
	 * <code>type Exclude&lt;T, U&gt; = T extends U ? never : T</code>
	 */
	protected TypeId excludeAlias() {
		return generic("Exclude", List.of(TypeParamInfo.of("T"), TypeParamInfo.of("U")),
			f -> f.conditional(f.typeParameter("T"), f.typeParameter("U"), NEVER, f.typeParameter("T")));
	}

	/**
	 * <code>type Extract&lt;T, U&gt; = T extends U ? T : never</code>
	 */
	protected TypeId extractAlias() {
		return generic("Extract", List.of(TypeParamInfo.of("T"), TypeParamInfo.of("U")),
			f -> f.conditional(f.typeParameter("T"), f.typeParameter("U"), f.typeParameter("T"), NEVER));
	}

	/**
	 * <code>type Partial&lt;T&gt; = { [K in keyof T]?: T[K] }</code>
	 */
	protected TypeId partialAlias() {
		return homomorphic("Partial", MappedModifier.PRESERVE, MappedModifier.ADD);
	}

	/**
	 * <code>type Required&lt;T&gt; = { [K in keyof T]-?: T[K] }</code>
	 */
	protected TypeId requiredAlias() {
		return homomorphic("Required", MappedModifier.PRESERVE, MappedModifier.REMOVE);
	}

	/**
	 * <code>type Readonly&lt;T&gt; = { readonly [K in keyof T]: T[K] }</code>
	 */
	protected TypeId readonlyAlias() {
		return homomorphic("Readonly", MappedModifier.ADD, MappedModifier.PRESERVE);
	}

	private TypeId homomorphic(String name, MappedModifier readonly, MappedModifier optional) {
		return generic(name, List.of(TypeParamInfo.of("T")), f -> {
			TypeId t = f.typeParameter("T");
			return f.mapped(TypeParamInfo.of("K"), f.keyOf(t), f.indexAccess(t, f.typeParameter("K")), null, readonly, optional);
		});
	}

	/**
	 * <code>type Record&lt;K, V&gt; = { [P in K]: V }</code>
	 */
	protected TypeId recordAlias() {
		return generic("Record", List.of(TypeParamInfo.of("K"), TypeParamInfo.of("V")),
			f -> f.mapped(TypeParamInfo.of("P"), f.typeParameter("K"), f.typeParameter("V"), null, MappedModifier.PRESERVE, MappedModifier.PRESERVE));
	}

	/**
	 * <code>type ReturnType&lt;T&gt; = T extends (...args: any) =&gt; infer R ? R : any</code>
	 */
	protected TypeId returnTypeAlias() {
		return generic("ReturnType", List.of(TypeParamInfo.of("T")), f -> f.conditional(
			f.typeParameter("T"),
			f.function(List.of(ParamInfo.rest("args", ANY)), f.infer("R")),
			f.typeParameter("R"),
			ANY));
	}

	/**
	 * <code>type Parameters&lt;T&gt; = T extends (...args: infer P) =&gt; any ? P : never</code>
	 */
	protected TypeId parametersAlias() {
		return generic("Parameters", List.of(TypeParamInfo.of("T")), f -> f.conditional(
			f.typeParameter("T"),
			f.function(List.of(ParamInfo.rest("args", f.infer("P"))), ANY),
			f.typeParameter("P"),
			NEVER));
	}

	/**
	 * <code>type IsNever&lt;T&gt; = [T] extends [never] ? true : false</code>
	 */
	protected TypeId isNeverAlias() {
		return generic("IsNever", List.of(TypeParamInfo.of("T")),
			f -> f.conditional(f.tuple(f.typeParameter("T")), f.tuple(NEVER), TRUE, FALSE));
	}
}
