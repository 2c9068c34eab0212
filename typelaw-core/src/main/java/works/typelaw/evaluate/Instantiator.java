package works.typelaw.evaluate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import works.typelaw.guard.QueryContext;
import works.typelaw.types.FunctionShape;
import works.typelaw.types.IndexSignature;
import works.typelaw.types.ObjectShape;
import works.typelaw.types.ParamInfo;
import works.typelaw.types.PropertyInfo;
import works.typelaw.types.TemplateSpan;
import works.typelaw.types.TupleElement;
import works.typelaw.types.TypeFactory;
import works.typelaw.types.TypeId;
import works.typelaw.types.TypeInterner;
import works.typelaw.types.TypeKey;
import works.typelaw.types.TypeParamInfo;

/**
 * Replaces type parameters with their bound types throughout a type.
 * <p>
 * Binders nested inside the type (generic signatures, mapped-type keys,
 * <code>infer</code> placeholders) shadow outer bindings of the same name.
 * A distributive conditional whose checked parameter is bound to a union
 * is distributed here, member by member, since that is the last point at which
 * the union is known to have come from the parameter.
 */
final class Instantiator {
	private final TypeFactory factory;
	private final TypeInterner interner;
	private final TypeScanner scanner;
	private final Evaluator evaluator;

	Instantiator(TypeFactory factory, TypeScanner scanner, Evaluator evaluator) {
		this.factory = factory;
		this.interner = factory.interner();
		this.scanner = scanner;
		this.evaluator = evaluator;
	}

	TypeId substitute(TypeId id, Substitution substitution, QueryContext ctx) {
		if (substitution.isEmpty()) {
			return id;
		}
		return new Walk(ctx).apply(id, substitution);
	}

	FunctionShape substitute(FunctionShape shape, Substitution substitution, QueryContext ctx) {
		if (substitution.isEmpty()) {
			return shape;
		}
		return new Walk(ctx).signature(shape, substitution);
	}

	/**
	 * Binds a generic signature's own type parameters, producing a non-generic signature.
	 */
	FunctionShape instantiateSignature(FunctionShape shape, Substitution bindings, QueryContext ctx) {
		FunctionShape open = new FunctionShape(List.of(), shape.parameters(), shape.thisType(), shape.returnType(), shape.method());
		return substitute(open, bindings, ctx);
	}

	/**
	 * One substitution pass, memoized on the (type, scope) pairs it has visited.
	 */
	private final class Walk {
		private final QueryContext ctx;
		private final Map<Visit, TypeId> done = new HashMap<>();

		Walk(QueryContext ctx) {
			this.ctx = ctx;
		}

		TypeId apply(TypeId id, Substitution s) {
			if (s.isEmpty() || id.isIntrinsic()) {
				return id;
			}
			if (!scanner.containsTypeParameters(id) && !scanner.containsInfer(id)) {
				return id;
			}
			TypeKey key = interner.lookup(id);
			Visit visit = new Visit(id, s);
			TypeId existing = done.get(visit);
			if (existing != null) {
				return existing;
			}
			TypeId result = rebuild(id, key, s);
			done.put(visit, result);
			return result;
		}

		private TypeId rebuild(TypeId id, TypeKey key, Substitution s) {
			if (key instanceof TypeKey.TypeParameter p) {
				TypeId bound = s.get(p.info().name());
				return bound == null ? id : bound;
			} else if (key instanceof TypeKey.Infer p) {
				TypeId bound = s.get(p.info().name());
				return bound == null ? id : bound;
			} else if (key instanceof TypeKey.ObjectType o) {
				return factory.object(shape(interner.objectShape(o.shape()), s));
			} else if (key instanceof TypeKey.ArrayType a) {
				TypeId element = apply(a.element(), s);
				return a.readonly() ? factory.readonlyArray(element) : factory.array(element);
			} else if (key instanceof TypeKey.TupleType t) {
				List<TupleElement> elements = tupleElements(interner.tupleList(t.elements()), s);
				return t.readonly() ? factory.readonlyTuple(elements) : factory.tuple(elements);
			} else if (key instanceof TypeKey.Union u) {
				return factory.union(applyAll(interner.typeList(u.members()), s));
			} else if (key instanceof TypeKey.Intersection i) {
				return factory.intersection(applyAll(interner.typeList(i.members()), s));
			} else if (key instanceof TypeKey.FunctionType f) {
				return factory.function(signature(interner.functionShape(f.shape()), s));
			} else if (key instanceof TypeKey.ConstructorType c) {
				return factory.constructor(signature(interner.functionShape(c.shape()), s));
			} else if (key instanceof TypeKey.Application app) {
				return factory.application(apply(app.base(), s), applyAll(interner.typeList(app.arguments()), s));
			} else if (key instanceof TypeKey.Conditional c) {
				return conditional(c, s);
			} else if (key instanceof TypeKey.Mapped m) {
				Substitution inner = s.without(Set.of(m.keyParameter().name()));
				return factory.mapped(
					m.keyParameter(),
					apply(m.constraint(), s),
					apply(m.template(), inner),
					m.nameType() == null ? null : apply(m.nameType(), inner),
					m.readonlyModifier(),
					m.optionalModifier());
			} else if (key instanceof TypeKey.TemplateLiteral t) {
				List<TemplateSpan> spans = new ArrayList<>();
				for (TemplateSpan span : interner.spanList(t.spans())) {
					if (span instanceof TemplateSpan.Placeholder p) {
						spans.add(TemplateSpan.placeholder(apply(p.type(), s)));
					} else {
						spans.add(span);
					}
				}
				return factory.templateLiteral(spans);
			} else if (key instanceof TypeKey.StringIntrinsic si) {
				return factory.stringIntrinsic(si.intrinsic(), apply(si.operand(), s));
			} else if (key instanceof TypeKey.KeyOf k) {
				return factory.keyOf(apply(k.operand(), s));
			} else if (key instanceof TypeKey.IndexAccess ia) {
				return factory.indexAccess(apply(ia.object(), s), apply(ia.index(), s));
			}
			return id;
		}

		private List<TypeId> applyAll(List<TypeId> ids, Substitution s) {
			List<TypeId> result = new ArrayList<>(ids.size());
			for (TypeId id : ids) {
				result.add(apply(id, s));
			}
			return result;
		}

		private ObjectShape shape(ObjectShape shape, Substitution s) {
			List<PropertyInfo> properties = new ArrayList<>(shape.properties().size());
			for (PropertyInfo p : shape.properties()) {
				TypeId read = apply(p.readType(), s);
				TypeId write = p.writeType().equals(p.readType()) ? read : apply(p.writeType(), s);
				properties.add(p.withTypes(read, write));
			}
			return shape
				.withProperties(properties)
				.withIndexes(index(shape.stringIndex(), s), index(shape.numberIndex(), s));
		}

		private @Nullable IndexSignature index(@Nullable IndexSignature index, Substitution s) {
			return index == null ? null : index.withValueType(apply(index.valueType(), s));
		}

		/**
		 * A rest element whose type becomes a tuple is spliced into the enclosing tuple.
		 */
		private List<TupleElement> tupleElements(List<TupleElement> elements, Substitution s) {
			List<TupleElement> result = new ArrayList<>();
			for (TupleElement e : elements) {
				TypeId type = apply(e.type(), s);
				if (e.rest() && interner.lookup(type) instanceof TypeKey.TupleType spliced) {
					result.addAll(interner.tupleList(spliced.elements()));
				} else {
					result.add(e.withType(type));
				}
			}
			return result;
		}

		FunctionShape signature(FunctionShape shape, Substitution outer) {
			Substitution s = outer;
			List<TypeParamInfo> typeParameters = shape.typeParameters();
			if (shape.isGeneric()) {
				s = outer.without(typeParameters.stream().map(TypeParamInfo::name).toList());
				List<TypeParamInfo> rebuilt = new ArrayList<>(typeParameters.size());
				for (TypeParamInfo tp : typeParameters) {
					rebuilt.add(new TypeParamInfo(
						tp.name(),
						tp.constraint() == null ? null : apply(tp.constraint(), s),
						tp.defaultType() == null ? null : apply(tp.defaultType(), s)));
				}
				typeParameters = rebuilt;
			}
			List<ParamInfo> params = new ArrayList<>();
			for (ParamInfo p : interner.paramList(shape.parameters())) {
				TypeId type = apply(p.type(), s);
				if (p.rest() && interner.lookup(type) instanceof TypeKey.TupleType spread) {
					spreadParameters(p.name(), interner.tupleList(spread.elements()), params);
				} else {
					params.add(p.withType(type));
				}
			}
			TypeId thisType = shape.thisType() == null ? null : apply(shape.thisType(), s);
			return factory.signature(typeParameters, params, thisType, apply(shape.returnType(), s), shape.method());
		}

		/**
		 * <code>(...args: [a: A, b?: B])</code> is the same signature as <code>(a: A, b?: B)</code>.
		 */
		private void spreadParameters(String name, List<TupleElement> elements, List<ParamInfo> params) {
			for (int i = 0; i < elements.size(); i++) {
				TupleElement e = elements.get(i);
				String paramName = e.label() != null ? e.label() : name + "_" + i;
				params.add(new ParamInfo(paramName, e.type(), e.optional(), e.rest()));
			}
		}

		private TypeId conditional(TypeKey.Conditional c, Substitution s) {
			if (c.distributive() && interner.lookup(c.check()) instanceof TypeKey.TypeParameter p) {
				TypeId bound = s.get(p.info().name());
				if (bound != null) {
					List<TypeId> members = distributionMembers(evaluator.evaluate(bound, ctx));
					if (members.isEmpty()) {
						return TypeId.NEVER;
					}
					if (members.size() > 1) {
						List<TypeId> results = new ArrayList<>(members.size());
						for (TypeId member : members) {
							results.add(conditionalBranch(c, s.with(p.info().name(), member)));
						}
						return factory.union(results);
					}
				}
			}
			return conditionalBranch(c, s);
		}

		private TypeId conditionalBranch(TypeKey.Conditional c, Substitution s) {
			Set<String> inferred = scanner.inferNames(c.extendsType());
			Substitution inner = s.without(inferred);
			return factory.conditional(
				apply(c.check(), s),
				apply(c.extendsType(), inner),
				apply(c.trueType(), inner),
				apply(c.falseType(), s));
		}

		/**
		 * @return the members a distributive conditional visits; empty for <code>never</code>
		 */
		private List<TypeId> distributionMembers(TypeId type) {
			if (type.equals(TypeId.NEVER)) {
				return List.of();
			}
			List<TypeId> result = new ArrayList<>();
			for (TypeId member : interner.unionMembers(type)) {
				TypeKey key = interner.lookup(member);
				if (member.equals(TypeId.BOOLEAN)) {
					result.add(TypeId.FALSE);
					result.add(TypeId.TRUE);
				} else if (key instanceof TypeKey.Enum e) {
					result.addAll(interner.typeList(e.members()));
				} else {
					result.add(member);
				}
			}
			return result;
		}
	}

	private record Visit(TypeId id, Substitution scope) { }
}
