package works.typelaw.types;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import works.typelaw.exceptions.InvalidTypeException;

import static java.util.Objects.requireNonNull;

/**
 * Hash-consing store that maps each distinct {@link TypeKey} to one {@link TypeId}.
 * <p>
 * Interning is thread-safe and lock-free on the read path.
 * Once issued, an id's key never changes and is never freed,
 * so ids can be compared by value and shared across threads freely.
 * <p>
 * Keys are stored verbatim. Normalization such as flattening unions
 * is the job of {@link TypeFactory}.
 */
public final class TypeInterner {
	private final ShardedTable<TypeKey> types = new ShardedTable<>("type", TypeId.FIRST_DYNAMIC);
	private final ShardedTable<List<TypeId>> typeLists = new ShardedTable<>("type list", 0);
	private final ShardedTable<List<TupleElement>> tupleLists = new ShardedTable<>("tuple list", 0);
	private final ShardedTable<List<ParamInfo>> paramLists = new ShardedTable<>("parameter list", 0);
	private final ShardedTable<List<TemplateSpan>> spanLists = new ShardedTable<>("template span", 0);
	private final ShardedTable<ObjectShape> objectShapes = new ShardedTable<>("object shape", 0);
	private final ShardedTable<FunctionShape> functionShapes = new ShardedTable<>("function shape", 0);

	private final TypeKey[] intrinsicKeys = new TypeKey[TypeId.FIRST_DYNAMIC];
	private final Map<TypeKey, TypeId> intrinsicIds = new HashMap<>();

	public TypeInterner() {
		for (PrimitiveKind p : PrimitiveKind.values()) {
			reserve(p.id(), new TypeKey.Primitive(p));
		}
		reserve(TypeId.TRUE, new TypeKey.Literal(LiteralValue.of(true)));
		reserve(TypeId.FALSE, new TypeKey.Literal(LiteralValue.of(false)));
		reserve(TypeId.EMPTY_OBJECT, new TypeKey.ObjectType(objectShape(ObjectShape.EMPTY)));
	}

	private void reserve(TypeId id, TypeKey key) {
		intrinsicKeys[id.index()] = key;
		intrinsicIds.put(key, id);
	}

	public TypeId intern(TypeKey key) {
		TypeId intrinsic = intrinsicIds.get(requireNonNull(key));
		if (intrinsic != null) {
			return intrinsic;
		}
		return new TypeId(types.intern(key));
	}

	/**
	 * @throws InvalidTypeException if <code>id</code> was not issued by this interner
	 */
	public TypeKey lookup(TypeId id) {
		if (id.isIntrinsic()) {
			TypeKey result = intrinsicKeys[id.index()];
			if (result == null) {
				throw new InvalidTypeException("Unassigned intrinsic type id " + id);
			}
			return result;
		}
		return types.get(id.index());
	}

	public TypeKey.Kind kindOf(TypeId id) {
		return lookup(id).kind();
	}

	/**
	 * @return the number of distinct non-intrinsic types interned so far
	 */
	public int size() {
		return types.size();
	}

	public Handle<List<TypeId>> typeList(List<TypeId> members) {
		return new Handle<>(typeLists.intern(List.copyOf(members)));
	}

	public List<TypeId> typeList(Handle<List<TypeId>> handle) {
		return typeLists.get(handle.index());
	}

	public Handle<List<TupleElement>> tupleList(List<TupleElement> elements) {
		return new Handle<>(tupleLists.intern(List.copyOf(elements)));
	}

	public List<TupleElement> tupleList(Handle<List<TupleElement>> handle) {
		return tupleLists.get(handle.index());
	}

	public Handle<List<ParamInfo>> paramList(List<ParamInfo> params) {
		return new Handle<>(paramLists.intern(List.copyOf(params)));
	}

	public List<ParamInfo> paramList(Handle<List<ParamInfo>> handle) {
		return paramLists.get(handle.index());
	}

	public Handle<List<TemplateSpan>> spanList(List<TemplateSpan> spans) {
		return new Handle<>(spanLists.intern(List.copyOf(spans)));
	}

	public List<TemplateSpan> spanList(Handle<List<TemplateSpan>> handle) {
		return spanLists.get(handle.index());
	}

	public Handle<ObjectShape> objectShape(ObjectShape shape) {
		return new Handle<>(objectShapes.intern(requireNonNull(shape)));
	}

	public ObjectShape objectShape(Handle<ObjectShape> handle) {
		return objectShapes.get(handle.index());
	}

	public Handle<FunctionShape> functionShape(FunctionShape shape) {
		return new Handle<>(functionShapes.intern(requireNonNull(shape)));
	}

	public FunctionShape functionShape(Handle<FunctionShape> handle) {
		return functionShapes.get(handle.index());
	}

	// Typed accessors for callers that already know the kind

	public ObjectShape objectShapeOf(TypeId id) {
		TypeKey key = lookup(id);
		if (key instanceof TypeKey.ObjectType o) {
			return objectShape(o.shape());
		}
		throw new InvalidTypeException("Not an object type: " + id + " is " + key.kind());
	}

	public FunctionShape functionShapeOf(TypeId id) {
		TypeKey key = lookup(id);
		if (key instanceof TypeKey.FunctionType f) {
			return functionShape(f.shape());
		} else if (key instanceof TypeKey.ConstructorType c) {
			return functionShape(c.shape());
		}
		throw new InvalidTypeException("Not a signature type: " + id + " is " + key.kind());
	}

	/**
	 * @return the members of a union, or a singleton list for any other type
	 */
	public List<TypeId> unionMembers(TypeId id) {
		if (lookup(id) instanceof TypeKey.Union u) {
			return typeList(u.members());
		}
		return List.of(id);
	}

	/**
	 * @return the members of an intersection, or a singleton list for any other type
	 */
	public List<TypeId> intersectionMembers(TypeId id) {
		if (lookup(id) instanceof TypeKey.Intersection i) {
			return typeList(i.members());
		}
		return List.of(id);
	}
}
