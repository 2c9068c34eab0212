package works.typelaw.evaluate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.typelaw.env.LibraryTypes;
import works.typelaw.env.Resolution;
import works.typelaw.env.TypeEnvironment;
import works.typelaw.guard.Limits;
import works.typelaw.guard.QueryContext;
import works.typelaw.types.FunctionShape;
import works.typelaw.types.IndexSignature;
import works.typelaw.types.JsNumberFormat;
import works.typelaw.types.LiteralValue;
import works.typelaw.types.ObjectShape;
import works.typelaw.types.PropertyInfo;
import works.typelaw.types.TupleElement;
import works.typelaw.types.TypeFactory;
import works.typelaw.types.TypeId;
import works.typelaw.types.TypeInterner;
import works.typelaw.types.TypeKey;
import works.typelaw.types.TypeParamInfo;

import static java.util.Objects.requireNonNull;
import static works.typelaw.types.TypeId.ANY;
import static works.typelaw.types.TypeId.NEVER;
import static works.typelaw.types.TypeId.NUMBER;
import static works.typelaw.types.TypeId.STRING;
import static works.typelaw.types.TypeId.SYMBOL;
import static works.typelaw.types.TypeId.UNDEFINED;
import static works.typelaw.types.TypeId.UNKNOWN;
import static works.typelaw.types.TypeId.UNRESOLVED;

/**
 * Reduces derived types (generic applications, conditional, mapped and template literal
 * types, <code>keyof</code> and indexed access) to the types they denote.
 * <p>
 * Evaluation is lazy and shallow: the result's own kind is concrete, but its members
 * may still be derived, and are reduced only when something looks at them. That keeps
 * recursive aliases such as <code>type List&lt;T&gt; = { next: List&lt;T&gt; }</code> finite.
 * <p>
 * A derived type that still mentions a free type parameter is left as it is.
 * Evaluation is idempotent: evaluating an evaluated type returns it unchanged.
 * <p>
 * The <code>extends</code> test of conditional types is delegated to an {@link ExtendsRelation},
 * normally the assignability relation of the session's default profile.
 */
public final class Evaluator {
	private final TypeFactory factory;
	private final TypeInterner interner;
	private final TypeEnvironment environment;
	private final Limits limits;
	private final ExtendsRelation relation;
	private final TypeScanner scanner;
	private final Instantiator instantiator;
	private final InferMatcher inference;
	private final MappedTypes mappedTypes;
	private final TemplateExpander templates;

	public Evaluator(TypeFactory factory, TypeEnvironment environment, Limits limits, ExtendsRelation relation) {
		this.factory = requireNonNull(factory);
		this.interner = factory.interner();
		this.environment = requireNonNull(environment);
		this.limits = requireNonNull(limits);
		this.relation = requireNonNull(relation);
		this.scanner = new TypeScanner(interner);
		this.instantiator = new Instantiator(factory, scanner, this);
		this.inference = new InferMatcher(factory, this, scanner, relation);
		this.mappedTypes = new MappedTypes(factory, this, instantiator);
		this.templates = new TemplateExpander(factory, this);
	}

	public TypeFactory factory() {
		return factory;
	}

	public TypeEnvironment environment() {
		return environment;
	}

	public TypeId evaluate(TypeId id) {
		return evaluateWithStatus(id).type();
	}

	public EvaluationResult evaluateWithStatus(TypeId id) {
		QueryContext ctx = new QueryContext(limits);
		TypeId result = evaluate(id, ctx);
		if (ctx.truncated()) {
			LOGGER.debug("Evaluation of {} truncated by {}", id, ctx.exhaustedBudgets());
		}
		return new EvaluationResult(result, ctx.truncated(), ctx.exhaustedBudgets());
	}

	public TypeId evaluate(TypeId id, QueryContext ctx) {
		if (id.isIntrinsic()) {
			return id;
		}
		TypeKey key = interner.lookup(id);
		switch (key.kind()) {
			case PRIMITIVE, LITERAL, OBJECT, ARRAY, TUPLE, FUNCTION, CONSTRUCTOR, TYPE_PARAMETER, INFER, ENUM, ENUM_MEMBER:
				return id;
			default:
				break;
		}
		TypeId cached = ctx.cachedEvaluation(id);
		if (cached != null) {
			return cached;
		}
		if (!ctx.enterEvaluation()) {
			return ANY;
		}
		TypeId result;
		try {
			result = reduce(id, key, ctx);
		} finally {
			ctx.exitEvaluation();
		}
		LOGGER.trace("Evaluated {} to {}", id, result);
		ctx.cacheEvaluation(id, result);
		return result;
	}

	private TypeId reduce(TypeId id, TypeKey key, QueryContext ctx) {
		return switch (key.kind()) {
			case UNION -> factory.union(evaluateAll(interner.typeList(((TypeKey.Union) key).members()), ctx));
			case INTERSECTION -> factory.intersection(evaluateAll(interner.typeList(((TypeKey.Intersection) key).members()), ctx));
			case LAZY, TYPE_QUERY -> evaluate(resolveReference(id, ctx), ctx);
			case APPLICATION -> application(id, (TypeKey.Application) key, ctx);
			case CONDITIONAL -> conditional(id, (TypeKey.Conditional) key, ctx);
			case MAPPED -> mappedTypes.evaluate(id, (TypeKey.Mapped) key, ctx);
			case TEMPLATE_LITERAL -> templates.expand(interner.spanList(((TypeKey.TemplateLiteral) key).spans()), ctx);
			case STRING_INTRINSIC -> stringIntrinsic(id, (TypeKey.StringIntrinsic) key, ctx);
			case KEY_OF -> keyOf(((TypeKey.KeyOf) key).operand(), ctx);
			case INDEX_ACCESS -> indexAccess(((TypeKey.IndexAccess) key).object(), ((TypeKey.IndexAccess) key).index(), ctx);
			default -> id;
		};
	}

	private List<TypeId> evaluateAll(List<TypeId> ids, QueryContext ctx) {
		List<TypeId> result = new ArrayList<>(ids.size());
		for (TypeId id : ids) {
			result.add(evaluate(id, ctx));
		}
		return result;
	}

	/**
	 * Looks through a {@link TypeKey.Lazy} or {@link TypeKey.TypeQuery} reference.
	 *
	 * @return the referenced type, {@link TypeId#UNRESOLVED} if there's no such declaration,
	 * or <code>id</code> itself if it isn't a reference
	 */
	public TypeId resolveReference(TypeId id, QueryContext ctx) {
		TypeKey key = interner.lookup(id);
		if (key instanceof TypeKey.Lazy lazy) {
			return environment.declaredType(lazy.def());
		} else if (key instanceof TypeKey.TypeQuery query) {
			return environment.valueType(query.def());
		}
		return id;
	}

	public boolean containsTypeParameters(TypeId id) {
		return scanner.containsTypeParameters(id);
	}

	public TypeId substitute(TypeId id, Map<String, TypeId> bindings, QueryContext ctx) {
		return instantiator.substitute(id, Substitution.of(bindings), ctx);
	}

	// Generic application

	public TypeId instantiate(TypeId generic, List<TypeId> arguments) {
		return instantiate(generic, arguments, new QueryContext(limits));
	}

	public TypeId instantiate(TypeId generic, List<TypeId> arguments, QueryContext ctx) {
		return evaluate(factory.application(generic, arguments), ctx);
	}

	private TypeId application(TypeId id, TypeKey.Application app, QueryContext ctx) {
		List<TypeId> arguments = interner.typeList(app.arguments());
		if (interner.lookup(app.base()) instanceof TypeKey.Lazy lazy) {
			Optional<Resolution> resolution = environment.resolve(lazy.def());
			if (resolution.isEmpty()) {
				LOGGER.debug("Application of unresolved {}", lazy.def());
				return UNRESOLVED;
			}
			return instantiateDeclaration(app.base(), resolution.get(), arguments, ctx);
		}
		TypeId base = evaluate(app.base(), ctx);
		TypeKey baseKey = interner.lookup(base);
		if (baseKey instanceof TypeKey.FunctionType f && interner.functionShape(f.shape()).isGeneric()) {
			FunctionShape shape = interner.functionShape(f.shape());
			return factory.function(instantiator.instantiateSignature(shape, bind(shape.typeParameters(), arguments, ctx), ctx));
		} else if (baseKey instanceof TypeKey.ConstructorType c && interner.functionShape(c.shape()).isGeneric()) {
			FunctionShape shape = interner.functionShape(c.shape());
			return factory.constructor(instantiator.instantiateSignature(shape, bind(shape.typeParameters(), arguments, ctx), ctx));
		}
		if (scanner.containsTypeParameters(base)) {
			return id;
		}
		return base;
	}

	private TypeId instantiateDeclaration(TypeId base, Resolution resolution, List<TypeId> arguments, QueryContext ctx) {
		if (!resolution.isGeneric()) {
			return evaluate(resolution.declaredType(), ctx);
		}
		TypeId cached = ctx.cachedInstantiation(base, arguments);
		if (cached != null) {
			return cached;
		}
		if (!ctx.enterInstantiation()) {
			return ANY;
		}
		TypeId result;
		try {
			Substitution bindings = bind(resolution.typeParameters(), arguments, ctx);
			result = evaluate(instantiator.substitute(resolution.declaredType(), bindings, ctx), ctx);
		} finally {
			ctx.exitInstantiation();
		}
		ctx.cacheInstantiation(base, arguments, result);
		return result;
	}

	/**
	 * Pairs parameters with arguments. Missing arguments take the parameter's default,
	 * which may refer to earlier parameters, or <code>unknown</code> if it has none.
	 */
	private Substitution bind(List<TypeParamInfo> parameters, List<TypeId> arguments, QueryContext ctx) {
		Substitution result = Substitution.EMPTY;
		for (int i = 0; i < parameters.size(); i++) {
			TypeParamInfo p = parameters.get(i);
			TypeId argument;
			if (i < arguments.size()) {
				argument = arguments.get(i);
			} else if (p.defaultType() != null) {
				argument = instantiator.substitute(p.defaultType(), result, ctx);
			} else {
				argument = UNKNOWN;
			}
			result = result.with(p.name(), argument);
		}
		return result;
	}

	/**
	 * Replaces a generic signature's type parameters with <code>any</code>,
	 * or with their constraints, yielding a non-generic signature.
	 */
	public FunctionShape eraseTypeParameters(FunctionShape shape, boolean toAny, QueryContext ctx) {
		if (!shape.isGeneric()) {
			return shape;
		}
		Substitution erased = Substitution.EMPTY;
		for (TypeParamInfo p : shape.typeParameters()) {
			TypeId replacement;
			if (toAny) {
				replacement = ANY;
			} else {
				replacement = p.constraint() == null ? UNKNOWN : p.constraint();
			}
			erased = erased.with(p.name(), replacement);
		}
		return instantiator.instantiateSignature(shape, erased, ctx);
	}

	// Conditional types

	private TypeId conditional(TypeId id, TypeKey.Conditional c, QueryContext ctx) {
		TypeId check = evaluate(c.check(), ctx);
		TypeId extendsType = evaluate(c.extendsType(), ctx);
		if (scanner.containsTypeParameters(check) || scanner.containsTypeParameters(extendsType)) {
			return id;
		}
		Set<String> inferNames = scanner.inferNames(extendsType);

		if (check.equals(ANY)) {
			Substitution anything = Substitution.EMPTY;
			for (String name : inferNames) {
				anything = anything.with(name, ANY);
			}
			TypeId whenTrue = evaluate(instantiator.substitute(c.trueType(), anything, ctx), ctx);
			if (extendsType.equals(ANY) || extendsType.equals(UNKNOWN)) {
				return whenTrue;
			}
			return factory.union(whenTrue, evaluate(c.falseType(), ctx));
		}

		Substitution bindings = Substitution.EMPTY;
		TypeId target = extendsType;
		if (!inferNames.isEmpty()) {
			Optional<Map<String, TypeId>> inferred = inference.infer(check, extendsType, inferNames, ctx);
			if (inferred.isEmpty()) {
				return evaluate(c.falseType(), ctx);
			}
			bindings = Substitution.of(inferred.get());
			target = instantiator.substitute(extendsType, bindings, ctx);
		}
		boolean holds = relation.extendsType(check, target, ctx);
		LOGGER.trace("Conditional {} extends {} is {}", check, target, holds);
		TypeId branch = holds ? instantiator.substitute(c.trueType(), bindings, ctx) : c.falseType();
		return evaluate(branch, ctx);
	}

	// String intrinsics

	private TypeId stringIntrinsic(TypeId id, TypeKey.StringIntrinsic si, QueryContext ctx) {
		TypeId operand = evaluate(si.operand(), ctx);
		if (operand.equals(ANY) || operand.equals(NEVER)) {
			return operand;
		}
		TypeKey key = interner.lookup(operand);
		if (key instanceof TypeKey.Literal l && l.value() instanceof LiteralValue.StringLiteral str) {
			return factory.literal(si.intrinsic().apply(str.value()));
		}
		if (key instanceof TypeKey.Union u) {
			List<TypeId> results = new ArrayList<>();
			for (TypeId member : interner.typeList(u.members())) {
				results.add(evaluate(factory.stringIntrinsic(si.intrinsic(), member), ctx));
			}
			return factory.union(results);
		}
		return operand.equals(si.operand()) ? id : factory.stringIntrinsic(si.intrinsic(), operand);
	}

	// keyof

	public TypeId keyOf(TypeId type, QueryContext ctx) {
		TypeId t = evaluate(type, ctx);
		if (t.equals(ANY) || t.equals(NEVER)) {
			return factory.union(STRING, NUMBER, SYMBOL);
		}
		if (t.equals(UNKNOWN) || t.equals(TypeId.NULL) || t.equals(UNDEFINED) || t.equals(TypeId.VOID) || t.equals(TypeId.OBJECT)) {
			return NEVER;
		}
		TypeKey key = interner.lookup(t);
		if (key instanceof TypeKey.Mapped m && m.nameType() == null) {
			return m.constraint();
		}
		if (scanner.containsTypeParameters(t)) {
			return factory.keyOf(t);
		}
		switch (key.kind()) {
			case UNION: {
				List<TypeId> keySets = new ArrayList<>();
				for (TypeId member : interner.typeList(((TypeKey.Union) key).members())) {
					keySets.add(keyOf(member, ctx));
				}
				return factory.intersection(keySets);
			}
			case INTERSECTION: {
				List<TypeId> keySets = new ArrayList<>();
				for (TypeId member : interner.typeList(((TypeKey.Intersection) key).members())) {
					keySets.add(keyOf(member, ctx));
				}
				return factory.union(keySets);
			}
			case OBJECT:
				return shapeKeys(interner.objectShapeOf(t));
			case TUPLE: {
				List<TypeId> keys = new ArrayList<>();
				List<TupleElement> elements = interner.tupleList(((TypeKey.TupleType) key).elements());
				for (int i = 0; i < elements.size(); i++) {
					if (!elements.get(i).rest()) {
						keys.add(factory.literal(String.valueOf(i)));
					}
				}
				keys.add(keyOf(apparentType(t, ctx), ctx));
				return factory.union(keys);
			}
			case FUNCTION:
			case CONSTRUCTOR:
				return NEVER;
			case ARRAY:
			case PRIMITIVE:
			case LITERAL:
			case ENUM:
			case ENUM_MEMBER: {
				TypeId apparent = apparentType(t, ctx);
				return apparent.equals(t) ? NEVER : keyOf(apparent, ctx);
			}
			default:
				return factory.keyOf(t);
		}
	}

	private TypeId shapeKeys(ObjectShape shape) {
		List<TypeId> keys = new ArrayList<>();
		for (PropertyInfo p : shape.properties()) {
			keys.add(factory.literal(p.name()));
		}
		if (shape.stringIndex() != null) {
			keys.add(STRING);
			keys.add(NUMBER);
		} else if (shape.numberIndex() != null) {
			keys.add(NUMBER);
		}
		return factory.union(keys);
	}

	// Indexed access

	public TypeId indexAccess(TypeId object, TypeId index, QueryContext ctx) {
		TypeId o = evaluate(object, ctx);
		TypeId i = evaluate(index, ctx);
		if (o.equals(ANY) || i.equals(ANY)) {
			return ANY;
		}
		if (i.equals(NEVER)) {
			return NEVER;
		}
		if (scanner.containsTypeParameters(o) || scanner.containsTypeParameters(i)) {
			return factory.indexAccess(o, i);
		}
		TypeKey ik = interner.lookup(i);
		if (ik instanceof TypeKey.Union u) {
			List<TypeId> results = new ArrayList<>();
			for (TypeId member : interner.typeList(u.members())) {
				results.add(indexAccess(o, member, ctx));
			}
			return results.contains(UNRESOLVED) ? UNRESOLVED : factory.union(results);
		}
		TypeKey ok = interner.lookup(o);
		if (ok instanceof TypeKey.Union u) {
			List<TypeId> results = new ArrayList<>();
			for (TypeId member : interner.typeList(u.members())) {
				results.add(indexAccess(member, i, ctx));
			}
			return results.contains(UNRESOLVED) ? UNRESOLVED : factory.union(results);
		}
		if (ok instanceof TypeKey.Intersection x) {
			List<TypeId> found = new ArrayList<>();
			for (TypeId member : interner.typeList(x.members())) {
				TypeId result = indexAccess(member, i, ctx);
				if (!result.equals(UNRESOLVED)) {
					found.add(result);
				}
			}
			return found.isEmpty() ? UNRESOLVED : factory.intersection(found);
		}
		TypeId result = lookupMember(o, ok, i, ctx);
		if (result.equals(UNRESOLVED)) {
			LOGGER.debug("No member {} in {}", i, o);
		}
		return result;
	}

	private TypeId lookupMember(TypeId o, TypeKey ok, TypeId index, QueryContext ctx) {
		String name = memberName(index);
		if (ok instanceof TypeKey.ArrayType array) {
			if (index.equals(NUMBER) || (name != null && JsNumberFormat.isNumericName(name))) {
				return array.element();
			}
		} else if (ok instanceof TypeKey.TupleType tuple) {
			TypeId element = tupleMember(tuple, index, name, ctx);
			if (element != null) {
				return element;
			}
		} else if (ok instanceof TypeKey.ObjectType) {
			return shapeMember(interner.objectShapeOf(o), index, name);
		}
		TypeId apparent = apparentType(o, ctx);
		if (!apparent.equals(o) && interner.lookup(apparent) instanceof TypeKey.ObjectType) {
			return shapeMember(interner.objectShapeOf(apparent), index, name);
		}
		return UNRESOLVED;
	}

	private TypeId shapeMember(ObjectShape shape, TypeId index, @Nullable String name) {
		if (name != null) {
			PropertyInfo p = shape.property(name);
			if (p != null) {
				return p.optional() ? factory.union(p.readType(), UNDEFINED) : p.readType();
			}
			IndexSignature signature = shape.applicableIndex(name);
			return signature == null ? UNRESOLVED : signature.valueType();
		}
		if (index.equals(STRING)) {
			return shape.stringIndex() == null ? UNRESOLVED : shape.stringIndex().valueType();
		}
		if (index.equals(NUMBER)) {
			IndexSignature signature = shape.numberIndex() != null ? shape.numberIndex() : shape.stringIndex();
			return signature == null ? UNRESOLVED : signature.valueType();
		}
		return UNRESOLVED;
	}

	private @Nullable TypeId tupleMember(TypeKey.TupleType tuple, TypeId index, @Nullable String name, QueryContext ctx) {
		List<TupleElement> elements = interner.tupleList(tuple.elements());
		if (index.equals(NUMBER)) {
			return restElementType(factory.tuple(elements), ctx);
		}
		if (name == null) {
			return null;
		}
		if ("length".equals(name)) {
			boolean fixed = elements.stream().noneMatch(e -> e.optional() || e.rest());
			return fixed ? factory.literal(elements.size()) : NUMBER;
		}
		if (!JsNumberFormat.isNumericName(name)) {
			return null;
		}
		double position = Double.parseDouble(name);
		if (position < 0 || position != Math.floor(position)) {
			return null;
		}
		int at = (int) Math.min(position, Integer.MAX_VALUE);
		for (int i = 0; i < elements.size(); i++) {
			TupleElement e = elements.get(i);
			if (e.rest()) {
				return restElementType(e.type(), ctx);
			}
			if (i == at) {
				return e.optional() ? factory.union(e.type(), UNDEFINED) : e.type();
			}
		}
		return null;
	}

	private @Nullable String memberName(TypeId index) {
		TypeKey key = interner.lookup(index);
		if (key instanceof TypeKey.Literal l
			&& (l.value() instanceof LiteralValue.StringLiteral || l.value() instanceof LiteralValue.NumberLiteral)) {
			return l.value().asString();
		} else if (key instanceof TypeKey.EnumMember m) {
			return m.value().asString();
		}
		return null;
	}

	// Apparent types

	/**
	 * The object type whose members a value of type <code>id</code> offers:
	 * the library interface for primitives and their literals, the array interface
	 * for arrays and tuples, <code>Function</code> for signatures, and the constraint
	 * of a type parameter. Other types are their own apparent type.
	 */
	public TypeId apparentType(TypeId id, QueryContext ctx) {
		TypeId t = evaluate(id, ctx);
		LibraryTypes library = environment.library();
		TypeKey key = interner.lookup(t);
		switch (key.kind()) {
			case PRIMITIVE:
				if (t.equals(STRING)) {
					return library.string();
				} else if (t.equals(NUMBER)) {
					return library.number();
				} else if (t.equals(TypeId.BOOLEAN)) {
					return library.booleanType();
				} else if (t.equals(TypeId.BIGINT)) {
					return library.bigint();
				} else if (t.equals(SYMBOL)) {
					return library.symbol();
				} else if (t.equals(TypeId.OBJECT)) {
					return TypeId.EMPTY_OBJECT;
				}
				return t;
			case LITERAL:
				return apparentType(((TypeKey.Literal) key).value().base(), ctx);
			case ENUM_MEMBER:
				return apparentType(((TypeKey.EnumMember) key).value().base(), ctx);
			case ENUM: {
				TypeKey.Enum e = (TypeKey.Enum) key;
				return switch (e.enumKind()) {
					case NUMERIC -> library.number();
					case STRING -> library.string();
					case HETEROGENEOUS -> t;
				};
			}
			case ARRAY: {
				TypeKey.ArrayType array = (TypeKey.ArrayType) key;
				return arrayInterface(array.element(), array.readonly(), ctx);
			}
			case TUPLE: {
				TypeKey.TupleType tuple = (TypeKey.TupleType) key;
				return arrayInterface(restElementType(t, ctx), tuple.readonly(), ctx);
			}
			case FUNCTION:
			case CONSTRUCTOR:
				return library.function();
			case TYPE_PARAMETER: {
				TypeId constraint = ((TypeKey.TypeParameter) key).info().constraint();
				return constraint == null ? TypeId.EMPTY_OBJECT : apparentType(constraint, ctx);
			}
			default:
				return t;
		}
	}

	private TypeId arrayInterface(TypeId element, boolean readonly, QueryContext ctx) {
		LibraryTypes library = environment.library();
		TypeId generic = readonly ? library.readonlyArray() : library.array();
		return instantiator.substitute(generic, Substitution.of(Map.of(library.arrayElement().name(), element)), ctx);
	}

	/**
	 * The type of one element of an array or tuple, as spread by a rest element or parameter.
	 */
	public TypeId restElementType(TypeId id, QueryContext ctx) {
		TypeId t = evaluate(id, ctx);
		TypeKey key = interner.lookup(t);
		if (key instanceof TypeKey.ArrayType array) {
			return array.element();
		}
		if (key instanceof TypeKey.TupleType tuple) {
			List<TypeId> types = new ArrayList<>();
			for (TupleElement e : interner.tupleList(tuple.elements())) {
				types.add(e.rest() ? restElementType(e.type(), ctx) : e.type());
			}
			return factory.union(types);
		}
		return t;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Evaluator.class);
}
