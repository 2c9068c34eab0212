package works.typelaw.testing;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import works.typelaw.TypeSystem;
import works.typelaw.env.Declaration;
import works.typelaw.env.DeclarationRegistry;
import works.typelaw.types.DefId;
import works.typelaw.types.LiteralValue;
import works.typelaw.types.MappedModifier;
import works.typelaw.types.ObjectShape;
import works.typelaw.types.ParamInfo;
import works.typelaw.types.PropertyInfo;
import works.typelaw.types.StringIntrinsicKind;
import works.typelaw.types.TemplateSpan;
import works.typelaw.types.TypeFactory;
import works.typelaw.types.TypeId;
import works.typelaw.types.TypeKey;
import works.typelaw.types.TypeParamInfo;

import static works.typelaw.types.TypeId.ANY;
import static works.typelaw.types.TypeId.BOOLEAN;
import static works.typelaw.types.TypeId.FALSE;
import static works.typelaw.types.TypeId.NEVER;
import static works.typelaw.types.TypeId.NULL;
import static works.typelaw.types.TypeId.NUMBER;
import static works.typelaw.types.TypeId.STRING;
import static works.typelaw.types.TypeId.TRUE;
import static works.typelaw.types.TypeId.UNDEFINED;
import static works.typelaw.types.TypeId.VOID;

/**
 * A varied collection of types, declared in one session, for suites that
 * check properties that ought to hold for every type.
 */
public class TypeFixtures {
	private final TypeFactory f;
	private final DeclarationRegistry registry;

	public final TypeId point;
	public final TypeId weakOptions;
	public final TypeId dictionary;
	public final TypeId stringList;
	public final TypeId stringChain;
	public final TypeId numberList;
	public final TypeId callback;
	public final TypeId withMethod;
	public final TypeId pair;
	public final TypeId numbers;
	public final TypeId direction;
	public final TypeId up;
	public final TypeId color;
	public final TypeId idTemplate;

	public final TypeId partial;
	public final TypeId exclude;
	public final TypeId returnType;
	public final TypeId isNever;
	public final TypeId record;
	public final TypeId nest;

	/**
	 * @param registry the declaration provider <code>types</code> was created with
	 */
	public TypeFixtures(TypeSystem types, DeclarationRegistry registry) {
		this.f = types.factory();
		this.registry = registry;

		point = declare("Point", f -> f.object(PropertyInfo.of("x", NUMBER), PropertyInfo.of("y", NUMBER)));
		weakOptions = f.object(PropertyInfo.optional("verbose", BOOLEAN), PropertyInfo.optional("depth", NUMBER));
		dictionary = f.object(ObjectShape.builder().stringIndex(f.union(STRING, NUMBER)).build());
		stringList = list("StringList", STRING);
		stringChain = list("StringChain", STRING);
		numberList = list("NumberList", NUMBER);
		callback = f.function(List.of(ParamInfo.of("value", STRING), ParamInfo.optional("index", NUMBER)), VOID);
		withMethod = f.object(
			PropertyInfo.readonly("name", STRING),
			PropertyInfo.method("handle", f.method(List.of(ParamInfo.of("event", f.union(STRING, NUMBER))), BOOLEAN)));
		pair = f.tuple(STRING, NUMBER);
		numbers = f.array(NUMBER);
		direction = enumType("Direction", "Up", LiteralValue.of(0), "Down", LiteralValue.of(1));
		up = memberOf(direction, "Up", LiteralValue.of(0));
		color = enumType("Color", "Red", LiteralValue.of("red"), "Green", LiteralValue.of("green"));
		idTemplate = f.templateLiteral(TemplateSpan.text("id-"), TemplateSpan.placeholder(NUMBER));

		partial = generic("Partial", List.of(TypeParamInfo.of("T")), f -> {
			TypeId t = f.typeParameter("T");
			return f.mapped(TypeParamInfo.of("K"), f.keyOf(t), f.indexAccess(t, f.typeParameter("K")), null, MappedModifier.PRESERVE, MappedModifier.ADD);
		});
		exclude = generic("Exclude", List.of(TypeParamInfo.of("T"), TypeParamInfo.of("U")),
			f -> f.conditional(f.typeParameter("T"), f.typeParameter("U"), NEVER, f.typeParameter("T")));
		returnType = generic("ReturnType", List.of(TypeParamInfo.of("T")), f -> f.conditional(
			f.typeParameter("T"),
			f.function(List.of(ParamInfo.rest("args", ANY)), f.infer("R")),
			f.typeParameter("R"),
			ANY));
		isNever = generic("IsNever", List.of(TypeParamInfo.of("T")),
			f -> f.conditional(f.tuple(f.typeParameter("T")), f.tuple(NEVER), TRUE, FALSE));
		record = generic("Record", List.of(TypeParamInfo.of("K"), TypeParamInfo.of("V")),
			f -> f.mapped(TypeParamInfo.of("P"), f.typeParameter("K"), f.typeParameter("V"), null, MappedModifier.PRESERVE, MappedModifier.PRESERVE));
		DefId nestDef = registry.reserve();
		nest = f.lazy(nestDef);
		registry.define(nestDef, Declaration.alias("Nest", List.of(TypeParamInfo.of("X")),
			f -> f.application(nest, f.tuple(f.typeParameter("X")))));
	}

	public TypeFactory factory() {
		return f;
	}

	/**
	 * Types with no unresolved references, of every kind a value can have.
	 */
	public List<TypeId> concrete() {
		return List.of(
			ANY, TypeId.UNKNOWN, NEVER, VOID, NULL, UNDEFINED,
			STRING, NUMBER, BOOLEAN, TypeId.OBJECT, TypeId.EMPTY_OBJECT,
			f.literal("hello"), f.literal(42), TRUE,
			f.union(STRING, NULL),
			point, weakOptions, dictionary,
			stringList, numberList,
			callback, withMethod,
			pair, numbers,
			direction, up, color,
			idTemplate
		);
	}

	/**
	 * Object types that can be meaningfully combined with intersections.
	 */
	public List<TypeId> objects() {
		return List.of(point, dictionary, stringList, withMethod, f.object(PropertyInfo.of("label", STRING)));
	}

	/**
	 * Derived types whose evaluation completes within the default limits.
	 */
	public List<TypeId> derived() {
		TypeId letters = f.union(f.literal("a"), f.literal("b"), f.literal("c"));
		return List.of(
			f.application(partial, point),
			f.application(partial, f.application(partial, point)),
			f.keyOf(point),
			f.keyOf(f.union(point, f.object(PropertyInfo.of("x", STRING)))),
			f.indexAccess(point, f.literal("x")),
			f.indexAccess(pair, NUMBER),
			f.application(exclude, letters, f.literal("b")),
			f.application(exclude, f.union(STRING, NUMBER, BOOLEAN), BOOLEAN),
			f.application(returnType, callback),
			f.application(isNever, NEVER),
			f.application(isNever, STRING),
			f.application(record, f.union(f.literal("a"), f.literal("b")), NUMBER),
			f.templateLiteral(TemplateSpan.placeholder(f.union(f.literal("a"), f.literal("b"))), TemplateSpan.text("-"),
				TemplateSpan.placeholder(f.union(f.literal("x"), f.literal("y")))),
			f.stringIntrinsic(StringIntrinsicKind.UPPERCASE, letters),
			f.conditional(STRING, f.union(STRING, NUMBER), f.literal("yes"), f.literal("no"))
		);
	}

	/**
	 * A union of <code>count</code> string literals named <code>prefix0</code>, <code>prefix1</code>, ...
	 */
	public TypeId literals(String prefix, int count) {
		List<TypeId> members = new ArrayList<>(count);
		for (int i = 0; i < count; i++) {
			members.add(f.literal(prefix + i));
		}
		return f.union(members);
	}

	private TypeId declare(String name, Function<TypeFactory, TypeId> lowering) {
		return f.lazy(registry.register(Declaration.alias(name, lowering)));
	}

	private TypeId generic(String name, List<TypeParamInfo> typeParameters, Function<TypeFactory, TypeId> lowering) {
		return f.lazy(registry.register(Declaration.alias(name, typeParameters, lowering)));
	}

	/**
	 * <code>type Name = { value: element; next: Name | null }</code>
	 */
	private TypeId list(String name, TypeId element) {
		DefId def = registry.reserve();
		TypeId self = f.lazy(def);
		registry.define(def, Declaration.alias(name, f -> f.object(
			PropertyInfo.of("value", element),
			PropertyInfo.of("next", f.union(self, NULL)))));
		return self;
	}

	private TypeId enumType(String name, String firstName, LiteralValue firstValue, String secondName, LiteralValue secondValue) {
		Map<String, LiteralValue> ordered = new LinkedHashMap<>();
		ordered.put(firstName, firstValue);
		ordered.put(secondName, secondValue);
		DefId def = registry.reserve();
		registry.define(def, Declaration.enumDeclaration(name, factory -> factory.enumType(def, ordered), null));
		return f.enumType(def, ordered);
	}

	private TypeId memberOf(TypeId enumType, String name, LiteralValue value) {
		DefId def = ((TypeKey.Enum) f.lookup(enumType)).def();
		return f.enumMember(def, name, value);
	}
}
