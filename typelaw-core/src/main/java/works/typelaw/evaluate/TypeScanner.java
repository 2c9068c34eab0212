package works.typelaw.evaluate;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import works.typelaw.types.FunctionShape;
import works.typelaw.types.IndexSignature;
import works.typelaw.types.ObjectShape;
import works.typelaw.types.ParamInfo;
import works.typelaw.types.PropertyInfo;
import works.typelaw.types.TemplateSpan;
import works.typelaw.types.TupleElement;
import works.typelaw.types.TypeId;
import works.typelaw.types.TypeInterner;
import works.typelaw.types.TypeKey;
import works.typelaw.types.TypeParamInfo;

/**
 * Answers questions about which type parameters a type mentions.
 * <p>
 * The walk stops at {@link TypeKey.Lazy} and {@link TypeKey.TypeQuery} references,
 * since declarations are closed, so it always terminates.
 */
final class TypeScanner {
	private final TypeInterner interner;
	private final ConcurrentHashMap<TypeId, Boolean> generic = new ConcurrentHashMap<>();
	private final ConcurrentHashMap<TypeId, Boolean> inferring = new ConcurrentHashMap<>();

	TypeScanner(TypeInterner interner) {
		this.interner = interner;
	}

	/**
	 * @return true if <code>id</code> mentions a type parameter it does not itself bind
	 */
	boolean containsTypeParameters(TypeId id) {
		Boolean cached = generic.get(id);
		if (cached != null) {
			return cached;
		}
		Set<String> free = new LinkedHashSet<>();
		collect(id, Set.of(), free, false, new HashSet<>());
		boolean result = !free.isEmpty();
		generic.putIfAbsent(id, result);
		return result;
	}

	/**
	 * @return names of the <code>infer</code> placeholders in <code>id</code>
	 */
	Set<String> inferNames(TypeId id) {
		Set<String> result = new LinkedHashSet<>();
		collect(id, Set.of(), result, true, new HashSet<>());
		return result;
	}

	boolean containsInfer(TypeId id) {
		Boolean cached = inferring.get(id);
		if (cached != null) {
			return cached;
		}
		boolean result = !inferNames(id).isEmpty();
		inferring.putIfAbsent(id, result);
		return result;
	}

	private void collect(TypeId id, Set<String> bound, Set<String> out, boolean infer, Set<Visit> visited) {
		if (id.isIntrinsic() || !visited.add(new Visit(id, bound))) {
			return;
		}
		TypeKey key = interner.lookup(id);
		if (key instanceof TypeKey.TypeParameter p) {
			if (!infer && !bound.contains(p.info().name())) {
				out.add(p.info().name());
			}
			collectParam(p.info(), bound, out, infer, visited);
		} else if (key instanceof TypeKey.Infer p) {
			if (infer) {
				out.add(p.info().name());
			}
			collectParam(p.info(), bound, out, infer, visited);
		} else if (key instanceof TypeKey.ObjectType o) {
			ObjectShape shape = interner.objectShape(o.shape());
			for (PropertyInfo p : shape.properties()) {
				collect(p.readType(), bound, out, infer, visited);
				collect(p.writeType(), bound, out, infer, visited);
			}
			collectIndex(shape.stringIndex(), bound, out, infer, visited);
			collectIndex(shape.numberIndex(), bound, out, infer, visited);
		} else if (key instanceof TypeKey.ArrayType a) {
			collect(a.element(), bound, out, infer, visited);
		} else if (key instanceof TypeKey.TupleType t) {
			for (TupleElement e : interner.tupleList(t.elements())) {
				collect(e.type(), bound, out, infer, visited);
			}
		} else if (key instanceof TypeKey.Union u) {
			collectAll(interner.typeList(u.members()), bound, out, infer, visited);
		} else if (key instanceof TypeKey.Intersection i) {
			collectAll(interner.typeList(i.members()), bound, out, infer, visited);
		} else if (key instanceof TypeKey.FunctionType f) {
			collectSignature(interner.functionShape(f.shape()), bound, out, infer, visited);
		} else if (key instanceof TypeKey.ConstructorType c) {
			collectSignature(interner.functionShape(c.shape()), bound, out, infer, visited);
		} else if (key instanceof TypeKey.Application app) {
			collect(app.base(), bound, out, infer, visited);
			collectAll(interner.typeList(app.arguments()), bound, out, infer, visited);
		} else if (key instanceof TypeKey.Conditional c) {
			collect(c.check(), bound, out, infer, visited);
			collect(c.extendsType(), bound, out, infer, visited);
			Set<String> inferred = inferNames(c.extendsType());
			collect(c.trueType(), union(bound, inferred), out, infer, visited);
			collect(c.falseType(), bound, out, infer, visited);
		} else if (key instanceof TypeKey.Mapped m) {
			collect(m.constraint(), bound, out, infer, visited);
			Set<String> inner = union(bound, Set.of(m.keyParameter().name()));
			collect(m.template(), inner, out, infer, visited);
			if (m.nameType() != null) {
				collect(m.nameType(), inner, out, infer, visited);
			}
		} else if (key instanceof TypeKey.TemplateLiteral t) {
			for (TemplateSpan span : interner.spanList(t.spans())) {
				if (span instanceof TemplateSpan.Placeholder p) {
					collect(p.type(), bound, out, infer, visited);
				}
			}
		} else if (key instanceof TypeKey.StringIntrinsic si) {
			collect(si.operand(), bound, out, infer, visited);
		} else if (key instanceof TypeKey.KeyOf k) {
			collect(k.operand(), bound, out, infer, visited);
		} else if (key instanceof TypeKey.IndexAccess ia) {
			collect(ia.object(), bound, out, infer, visited);
			collect(ia.index(), bound, out, infer, visited);
		}
		// Primitives, literals, enums and references mention no parameters
	}

	private void collectAll(List<TypeId> ids, Set<String> bound, Set<String> out, boolean infer, Set<Visit> visited) {
		for (TypeId id : ids) {
			collect(id, bound, out, infer, visited);
		}
	}

	private void collectParam(TypeParamInfo info, Set<String> bound, Set<String> out, boolean infer, Set<Visit> visited) {
		if (info.constraint() != null) {
			collect(info.constraint(), bound, out, infer, visited);
		}
	}

	private void collectIndex(IndexSignature index, Set<String> bound, Set<String> out, boolean infer, Set<Visit> visited) {
		if (index != null) {
			collect(index.valueType(), bound, out, infer, visited);
		}
	}

	private void collectSignature(FunctionShape shape, Set<String> bound, Set<String> out, boolean infer, Set<Visit> visited) {
		Set<String> inner = bound;
		if (shape.isGeneric()) {
			Set<String> names = new HashSet<>();
			for (TypeParamInfo tp : shape.typeParameters()) {
				names.add(tp.name());
			}
			inner = union(bound, names);
			for (TypeParamInfo tp : shape.typeParameters()) {
				collectParam(tp, inner, out, infer, visited);
			}
		}
		for (ParamInfo p : interner.paramList(shape.parameters())) {
			collect(p.type(), inner, out, infer, visited);
		}
		if (shape.thisType() != null) {
			collect(shape.thisType(), inner, out, infer, visited);
		}
		collect(shape.returnType(), inner, out, infer, visited);
	}

	private static Set<String> union(Set<String> a, Set<String> b) {
		if (b.isEmpty()) {
			return a;
		}
		Set<String> result = new HashSet<>(a);
		result.addAll(b);
		return Set.copyOf(result);
	}

	private record Visit(TypeId id, Set<String> bound) { }
}
