package works.typelaw.types;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Builds types in canonical form and interns them.
 * <p>
 * Unions and intersections are flattened, deduplicated, sorted and
 * simplified, so that equivalent constructions yield the same {@link TypeId}.
 * All other keys are interned as given.
 * <p>
 * A factory holds no state of its own beyond its interner and is safe to share.
 */
public final class TypeFactory {
	public static final int DEFAULT_MAX_DISTRIBUTION_SIZE = 100;

	private final TypeInterner interner;
	private final int maxDistributionSize;

	public TypeFactory(TypeInterner interner) {
		this(interner, DEFAULT_MAX_DISTRIBUTION_SIZE);
	}

	/**
	 * @param maxDistributionSize the largest number of intersections that distributing
	 *                            an intersection over its union members may produce;
	 *                            beyond this the intersection is kept undistributed
	 */
	public TypeFactory(TypeInterner interner, int maxDistributionSize) {
		this.interner = requireNonNull(interner);
		this.maxDistributionSize = maxDistributionSize;
	}

	public TypeInterner interner() {
		return interner;
	}

	public TypeKey lookup(TypeId id) {
		return interner.lookup(id);
	}

	public TypeId intern(TypeKey key) {
		return interner.intern(key);
	}

	// Literals

	public TypeId literal(String value) {
		return intern(new TypeKey.Literal(LiteralValue.of(value)));
	}

	public TypeId literal(double value) {
		return intern(new TypeKey.Literal(LiteralValue.of(value)));
	}

	public TypeId literal(boolean value) {
		return value ? TypeId.TRUE : TypeId.FALSE;
	}

	public TypeId literal(LiteralValue value) {
		return intern(new TypeKey.Literal(value));
	}

	public TypeId bigintLiteral(String digits) {
		return intern(new TypeKey.Literal(new LiteralValue.BigIntLiteral(digits)));
	}

	// Objects

	public TypeId object(ObjectShape shape) {
		return intern(new TypeKey.ObjectType(interner.objectShape(shape)));
	}

	public TypeId object(List<PropertyInfo> properties) {
		return object(ObjectShape.of(properties));
	}

	public TypeId object(PropertyInfo... properties) {
		return object(ObjectShape.of(Arrays.asList(properties)));
	}

	/**
	 * The type of an object literal expression, subject to excess property checks.
	 */
	public TypeId freshObject(PropertyInfo... properties) {
		return object(ObjectShape.of(Arrays.asList(properties)).withFlags(ObjectShape.FRESH_LITERAL));
	}

	/**
	 * @return the same type with object literal freshness removed
	 */
	public TypeId regular(TypeId id) {
		if (lookup(id) instanceof TypeKey.ObjectType o) {
			ObjectShape shape = interner.objectShape(o.shape());
			if (shape.isFresh()) {
				return object(shape.withFlags(shape.flags() & ~ObjectShape.FRESH_LITERAL));
			}
		}
		return id;
	}

	public TypeId array(TypeId element) {
		return intern(new TypeKey.ArrayType(element, false));
	}

	public TypeId readonlyArray(TypeId element) {
		return intern(new TypeKey.ArrayType(element, true));
	}

	public TypeId tuple(List<TupleElement> elements) {
		return intern(new TypeKey.TupleType(interner.tupleList(elements), false));
	}

	public TypeId tuple(TypeId... elementTypes) {
		List<TupleElement> elements = new ArrayList<>();
		for (TypeId t : elementTypes) {
			elements.add(TupleElement.required(t));
		}
		return tuple(elements);
	}

	public TypeId readonlyTuple(List<TupleElement> elements) {
		return intern(new TypeKey.TupleType(interner.tupleList(elements), true));
	}

	// Signatures

	public TypeId function(List<ParamInfo> params, TypeId returnType) {
		return function(List.of(), params, returnType);
	}

	public TypeId function(List<TypeParamInfo> typeParameters, List<ParamInfo> params, TypeId returnType) {
		return function(new FunctionShape(typeParameters, interner.paramList(params), null, returnType, false));
	}

	public TypeId method(List<ParamInfo> params, TypeId returnType) {
		return function(new FunctionShape(List.of(), interner.paramList(params), null, returnType, true));
	}

	public TypeId function(FunctionShape shape) {
		return intern(new TypeKey.FunctionType(interner.functionShape(shape)));
	}

	public TypeId constructor(List<ParamInfo> params, TypeId instanceType) {
		return constructor(new FunctionShape(List.of(), interner.paramList(params), null, instanceType, false));
	}

	public TypeId constructor(FunctionShape shape) {
		return intern(new TypeKey.ConstructorType(interner.functionShape(shape)));
	}

	public FunctionShape signature(List<TypeParamInfo> typeParameters, List<ParamInfo> params, @Nullable TypeId thisType, TypeId returnType, boolean method) {
		return new FunctionShape(typeParameters, interner.paramList(params), thisType, returnType, method);
	}

	// Generics

	public TypeId typeParameter(String name) {
		return typeParameter(TypeParamInfo.of(name));
	}

	public TypeId typeParameter(TypeParamInfo info) {
		return intern(new TypeKey.TypeParameter(info));
	}

	public TypeId infer(String name) {
		return intern(new TypeKey.Infer(TypeParamInfo.of(name)));
	}

	public TypeId infer(TypeParamInfo info) {
		return intern(new TypeKey.Infer(info));
	}

	public TypeId application(TypeId base, List<TypeId> arguments) {
		return intern(new TypeKey.Application(base, interner.typeList(arguments)));
	}

	public TypeId application(TypeId base, TypeId... arguments) {
		return application(base, Arrays.asList(arguments));
	}

	/**
	 * The result is distributive exactly when <code>check</code> is a bare type parameter.
	 */
	public TypeId conditional(TypeId check, TypeId extendsType, TypeId trueType, TypeId falseType) {
		boolean distributive = lookup(check) instanceof TypeKey.TypeParameter;
		return intern(new TypeKey.Conditional(check, extendsType, trueType, falseType, distributive));
	}

	public TypeId mapped(TypeParamInfo keyParameter, TypeId constraint, TypeId template, @Nullable TypeId nameType, MappedModifier readonly, MappedModifier optional) {
		return intern(new TypeKey.Mapped(keyParameter, constraint, template, nameType, readonly, optional));
	}

	public TypeId keyOf(TypeId operand) {
		return intern(new TypeKey.KeyOf(operand));
	}

	public TypeId indexAccess(TypeId object, TypeId index) {
		return intern(new TypeKey.IndexAccess(object, index));
	}

	public TypeId stringIntrinsic(StringIntrinsicKind intrinsic, TypeId operand) {
		return intern(new TypeKey.StringIntrinsic(intrinsic, operand));
	}

	/**
	 * Adjacent text spans are merged and empty ones dropped.
	 * A template with no placeholders is just a string literal,
	 * and <code>`${string}`</code> is just <code>string</code>.
	 */
	public TypeId templateLiteral(List<TemplateSpan> spans) {
		List<TemplateSpan> normalized = new ArrayList<>();
		StringBuilder pending = new StringBuilder();
		boolean hasPlaceholder = false;
		for (TemplateSpan span : spans) {
			if (span instanceof TemplateSpan.Text t) {
				pending.append(t.text());
			} else {
				if (pending.length() > 0) {
					normalized.add(TemplateSpan.text(pending.toString()));
					pending.setLength(0);
				}
				normalized.add(span);
				hasPlaceholder = true;
			}
		}
		if (!hasPlaceholder) {
			return literal(pending.toString());
		}
		if (pending.length() > 0) {
			normalized.add(TemplateSpan.text(pending.toString()));
		}
		if (normalized.size() == 1 && ((TemplateSpan.Placeholder) normalized.get(0)).type().equals(TypeId.STRING)) {
			return TypeId.STRING;
		}
		return intern(new TypeKey.TemplateLiteral(interner.spanList(normalized)));
	}

	public TypeId templateLiteral(TemplateSpan... spans) {
		return templateLiteral(Arrays.asList(spans));
	}

	// References

	public TypeId lazy(DefId def) {
		return intern(new TypeKey.Lazy(def));
	}

	public TypeId typeQuery(DefId def) {
		return intern(new TypeKey.TypeQuery(def));
	}

	public TypeId enumMember(DefId def, String name, LiteralValue value) {
		return intern(new TypeKey.EnumMember(def, name, value));
	}

	/**
	 * Builds an enum type together with its members.
	 *
	 * @param members member names mapped to their string or number values, in declaration order
	 */
	public TypeId enumType(DefId def, Map<String, LiteralValue> members) {
		List<TypeId> memberIds = new ArrayList<>();
		boolean anyString = false;
		boolean anyNumber = false;
		for (Map.Entry<String, LiteralValue> entry : new LinkedHashMap<>(members).entrySet()) {
			memberIds.add(enumMember(def, entry.getKey(), entry.getValue()));
			if (entry.getValue() instanceof LiteralValue.StringLiteral) {
				anyString = true;
			} else {
				anyNumber = true;
			}
		}
		EnumKind kind;
		if (anyString && anyNumber) {
			kind = EnumKind.HETEROGENEOUS;
		} else if (anyString) {
			kind = EnumKind.STRING;
		} else {
			kind = EnumKind.NUMERIC;
		}
		return intern(new TypeKey.Enum(def, kind, interner.typeList(memberIds)));
	}

	// Unions and intersections

	public TypeId union(TypeId... members) {
		return union(Arrays.asList(members));
	}

	public TypeId union(Collection<TypeId> members) {
		TreeSet<TypeId> set = new TreeSet<>();
		for (TypeId m : members) {
			set.addAll(interner.unionMembers(requireNonNull(m)));
		}
		if (set.contains(TypeId.ANY)) {
			return TypeId.ANY;
		}
		if (set.contains(TypeId.UNKNOWN)) {
			return TypeId.UNKNOWN;
		}
		set.remove(TypeId.NEVER);
		if (set.contains(TypeId.TRUE) && set.contains(TypeId.FALSE)) {
			set.remove(TypeId.TRUE);
			set.remove(TypeId.FALSE);
			set.add(TypeId.BOOLEAN);
		}
		set.removeIf(m -> isAbsorbedInUnion(m, set));
		if (set.isEmpty()) {
			return TypeId.NEVER;
		} else if (set.size() == 1) {
			return set.first();
		}
		return intern(new TypeKey.Union(interner.typeList(new ArrayList<>(set))));
	}

	private boolean isAbsorbedInUnion(TypeId member, TreeSet<TypeId> set) {
		TypeKey key = lookup(member);
		if (key instanceof TypeKey.Literal l) {
			return set.contains(l.value().base());
		} else if (key instanceof TypeKey.EnumMember em) {
			for (TypeId other : set) {
				if (lookup(other) instanceof TypeKey.Enum e && e.def().equals(em.def())) {
					return true;
				}
			}
		}
		return false;
	}

	public TypeId intersection(TypeId... members) {
		return intersection(Arrays.asList(members));
	}

	public TypeId intersection(Collection<TypeId> members) {
		TreeSet<TypeId> set = new TreeSet<>();
		for (TypeId m : members) {
			set.addAll(interner.intersectionMembers(requireNonNull(m)));
		}
		if (set.contains(TypeId.NEVER)) {
			return TypeId.NEVER;
		}
		if (set.contains(TypeId.ANY)) {
			return TypeId.ANY;
		}
		set.remove(TypeId.UNKNOWN);
		if (set.isEmpty()) {
			return TypeId.UNKNOWN;
		}
		if (isDisjoint(set)) {
			return TypeId.NEVER;
		}
		// A literal makes its own primitive redundant
		set.removeIf(m -> m.isIntrinsic() && set.stream().anyMatch(o -> lookup(o) instanceof TypeKey.Literal l && l.value().base().equals(m)));
		if (set.size() == 1) {
			return set.first();
		}

		List<TypeId> unions = set.stream().filter(m -> lookup(m) instanceof TypeKey.Union).toList();
		if (!unions.isEmpty()) {
			long combinations = 1;
			for (TypeId u : unions) {
				combinations *= interner.unionMembers(u).size();
				if (combinations > maxDistributionSize) {
					break;
				}
			}
			if (combinations <= maxDistributionSize) {
				return distribute(new ArrayList<>(set));
			}
		}
		return intern(new TypeKey.Intersection(interner.typeList(new ArrayList<>(set))));
	}

	/**
	 * <code>(A | B) &amp; C</code> becomes <code>(A &amp; C) | (B &amp; C)</code>.
	 */
	private TypeId distribute(List<TypeId> members) {
		List<List<TypeId>> combos = new ArrayList<>();
		combos.add(List.of());
		for (TypeId m : members) {
			List<List<TypeId>> next = new ArrayList<>();
			for (List<TypeId> prefix : combos) {
				for (TypeId alternative : interner.unionMembers(m)) {
					List<TypeId> extended = new ArrayList<>(prefix);
					extended.add(alternative);
					next.add(extended);
				}
			}
			combos = next;
		}
		List<TypeId> results = new ArrayList<>();
		for (List<TypeId> combo : combos) {
			results.add(intersection(combo));
		}
		return union(results);
	}

	/**
	 * True if no value can inhabit every member: two different literals,
	 * a literal and a different primitive, or two different primitives.
	 */
	private boolean isDisjoint(TreeSet<TypeId> set) {
		TypeId primitive = null;
		LiteralValue literal = null;
		boolean nonPrimitiveObject = false;
		boolean nullish = false;
		for (TypeId m : set) {
			TypeKey key = lookup(m);
			TypeId domain;
			if (key instanceof TypeKey.Literal l) {
				if (literal != null && !literal.equals(l.value())) {
					return true;
				}
				literal = l.value();
				domain = l.value().base();
			} else if (isPrimitiveDomain(m)) {
				domain = m.equals(TypeId.VOID) ? TypeId.UNDEFINED : m;
			} else {
				if (m.equals(TypeId.OBJECT) || key instanceof TypeKey.ArrayType || key instanceof TypeKey.TupleType) {
					nonPrimitiveObject = true;
				}
				continue;
			}
			if (primitive != null && !primitive.equals(domain)) {
				return true;
			}
			primitive = domain;
			if (domain.equals(TypeId.NULL) || domain.equals(TypeId.UNDEFINED)) {
				nullish = true;
			}
		}
		return primitive != null && (nonPrimitiveObject || (nullish && set.size() > 1 && hasObjectMember(set)));
	}

	private boolean hasObjectMember(TreeSet<TypeId> set) {
		return set.stream().anyMatch(m -> {
			TypeKey.Kind kind = lookup(m).kind();
			return kind == TypeKey.Kind.OBJECT || kind == TypeKey.Kind.FUNCTION || kind == TypeKey.Kind.CONSTRUCTOR;
		});
	}

	private static boolean isPrimitiveDomain(TypeId id) {
		return id.equals(TypeId.STRING)
			|| id.equals(TypeId.NUMBER)
			|| id.equals(TypeId.BOOLEAN)
			|| id.equals(TypeId.BIGINT)
			|| id.equals(TypeId.SYMBOL)
			|| id.equals(TypeId.NULL)
			|| id.equals(TypeId.UNDEFINED)
			|| id.equals(TypeId.VOID);
	}

	/**
	 * @return <code>id</code> with <code>undefined</code> removed from it, if it is a union
	 */
	public TypeId removeUndefined(TypeId id) {
		List<TypeId> members = interner.unionMembers(id);
		if (!members.contains(TypeId.UNDEFINED) || members.size() == 1) {
			return id;
		}
		List<TypeId> kept = new ArrayList<>(members);
		kept.remove(TypeId.UNDEFINED);
		return union(kept);
	}

	/**
	 * Replaces a literal with the primitive it belongs to.
	 */
	public TypeId widenLiteral(TypeId id) {
		if (lookup(id) instanceof TypeKey.Literal l) {
			return l.value().base();
		}
		return id;
	}
}
