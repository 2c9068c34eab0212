package works.typelaw.lawyer;

import org.jetbrains.annotations.Nullable;
import works.typelaw.env.LibraryTypes;
import works.typelaw.evaluate.Evaluator;
import works.typelaw.guard.QueryContext;
import works.typelaw.judge.Relater;
import works.typelaw.types.ObjectShape;
import works.typelaw.types.TypeFactory;
import works.typelaw.types.TypeId;
import works.typelaw.types.TypeInterner;
import works.typelaw.types.TypeKey;

/**
 * What a {@link CompatRule} can see and do while it checks one pair of types.
 */
public final class RuleContext {
	private final TypeFactory factory;
	private final Evaluator evaluator;
	private final CompatProfile profile;
	private final QueryContext query;
	private final Relater nested;
	private final boolean topLevel;

	RuleContext(TypeFactory factory, Evaluator evaluator, CompatProfile profile, QueryContext query, Relater nested, boolean topLevel) {
		this.factory = factory;
		this.evaluator = evaluator;
		this.profile = profile;
		this.query = query;
		this.nested = nested;
		this.topLevel = topLevel;
	}

	public TypeFactory factory() {
		return factory;
	}

	public TypeInterner interner() {
		return factory.interner();
	}

	public Evaluator evaluator() {
		return evaluator;
	}

	public LibraryTypes library() {
		return evaluator.environment().library();
	}

	public CompatProfile profile() {
		return profile;
	}

	public QueryContext query() {
		return query;
	}

	/**
	 * @return true if the pair under consideration is the outermost pair of the query
	 */
	public boolean topLevel() {
		return topLevel;
	}

	/**
	 * Relates a pair of types as a nested position, with every rule of
	 * {@link CompatRule.Scope#EVERY_LEVEL every-level scope} in force.
	 */
	public boolean relate(TypeId source, TypeId target) {
		return nested.relate(source, target, query);
	}

	/**
	 * Looks through references and reduces derived types, so a rule sees
	 * the type a name or computation stands for.
	 */
	public TypeId normalize(TypeId id) {
		return evaluator.evaluate(id, query);
	}

	/**
	 * @return the members a value of type <code>id</code> offers, counting the
	 * apparent members of primitives; or null if it offers none
	 */
	public @Nullable ObjectShape shapeOf(TypeId id) {
		TypeId t = normalize(id);
		if (t.equals(TypeId.NULL) || t.equals(TypeId.UNDEFINED) || t.equals(TypeId.VOID)
			|| t.equals(TypeId.NEVER) || t.equals(TypeId.ANY) || t.equals(TypeId.UNKNOWN) || t.equals(TypeId.UNRESOLVED)) {
			return null;
		}
		TypeKey key = interner().lookup(t);
		if (key instanceof TypeKey.ObjectType) {
			return interner().objectShapeOf(t);
		}
		switch (key.kind()) {
			case PRIMITIVE, LITERAL, ENUM_MEMBER, ARRAY, TUPLE, FUNCTION, CONSTRUCTOR, TYPE_PARAMETER:
				break;
			default:
				return null;
		}
		TypeId apparent = normalize(evaluator.apparentType(t, query));
		if (!apparent.equals(t) && interner().lookup(apparent) instanceof TypeKey.ObjectType) {
			return interner().objectShapeOf(apparent);
		}
		return null;
	}

	@Override
	public String toString() {
		return "RuleContext{" +
			"profile=" + profile +
			", topLevel=" + topLevel +
			'}';
	}
}
