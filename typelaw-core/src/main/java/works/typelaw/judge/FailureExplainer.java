package works.typelaw.judge;

import java.util.List;
import works.typelaw.evaluate.Evaluator;
import works.typelaw.guard.QueryContext;
import works.typelaw.types.FunctionShape;
import works.typelaw.types.IndexSignature;
import works.typelaw.types.ObjectShape;
import works.typelaw.types.PropertyInfo;
import works.typelaw.types.TupleElement;
import works.typelaw.types.TypeId;
import works.typelaw.types.TypeInterner;
import works.typelaw.types.TypeKey;

/**
 * Re-walks a comparison that failed, following the first conflict it finds
 * down to a leaf, and describes the path as a {@link FailureReason}.
 * <p>
 * The walk asks the same relater the failed comparison used, so
 * it reuses that query's memo and never disagrees with the verdict.
 */
final class FailureExplainer {
	private static final int MAX_DEPTH = 16;

	private final Judge judge;
	private final TypeInterner interner;
	private final Evaluator evaluator;
	private final QueryContext ctx;
	private final Relater relater;

	FailureExplainer(Judge judge, QueryContext ctx, Relater relater) {
		this.judge = judge;
		this.interner = judge.factory().interner();
		this.evaluator = judge.evaluator();
		this.ctx = ctx;
		this.relater = relater;
	}

	FailureReason explain(TypeId source, TypeId target) {
		return explain(source, target, 0);
	}

	private FailureReason explain(TypeId source, TypeId target, int depth) {
		if (ctx.truncated()) {
			return new FailureReason.BudgetExceeded(ctx.exhaustedBudgets());
		}
		FailureReason preempted = relater.preemptReason(source, target, ctx);
		if (preempted != null) {
			return preempted;
		}
		FailureReason.TypeMismatch mismatch = new FailureReason.TypeMismatch(source, target);
		if (depth > MAX_DEPTH) {
			return mismatch;
		}

		TypeId s = normalize(source);
		TypeId t = normalize(target);
		if (!s.equals(source) || !t.equals(target)) {
			return explain(s, t, depth + 1);
		}
		TypeKey sk = interner.lookup(s);
		TypeKey tk = interner.lookup(t);

		if (sk instanceof TypeKey.Union u) {
			for (TypeId member : interner.typeList(u.members())) {
				if (!relater.relate(member, t, ctx)) {
					return explain(member, t, depth + 1);
				}
			}
			return mismatch;
		}
		if (tk instanceof TypeKey.Intersection i) {
			for (TypeId member : interner.typeList(i.members())) {
				if (!relater.relate(s, member, ctx)) {
					return explain(s, member, depth + 1);
				}
			}
			return mismatch;
		}
		if (tk instanceof TypeKey.ObjectType o) {
			ObjectShape sourceShape = judge.sourceShape(s, sk, ctx);
			if (sourceShape == null) {
				return mismatch;
			}
			return explainShapes(sourceShape, interner.objectShape(o.shape()), mismatch, depth);
		}
		if ((tk instanceof TypeKey.FunctionType && sk instanceof TypeKey.FunctionType)
			|| (tk instanceof TypeKey.ConstructorType && sk instanceof TypeKey.ConstructorType)) {
			return explainSignatures(interner.functionShapeOf(s), interner.functionShapeOf(t), false, mismatch, depth);
		}
		if (tk instanceof TypeKey.TupleType tt && sk instanceof TypeKey.TupleType st) {
			return explainTuples(st, tt, mismatch, depth);
		}
		if (tk instanceof TypeKey.ArrayType ta && sk instanceof TypeKey.ArrayType sa) {
			if (!relater.relate(sa.element(), ta.element(), ctx)) {
				return explain(sa.element(), ta.element(), depth + 1);
			}
		}
		return mismatch;
	}

	private TypeId normalize(TypeId id) {
		TypeKey.Kind kind = interner.kindOf(id);
		if (kind.isReference()) {
			return evaluator.resolveReference(id, ctx);
		} else if (kind.isDerived()) {
			return evaluator.evaluate(id, ctx);
		}
		return id;
	}

	private FailureReason explainShapes(ObjectShape source, ObjectShape target, FailureReason fallback, int depth) {
		for (PropertyInfo tp : target.properties()) {
			PropertyInfo sp = source.property(tp.name());
			if (sp == null) {
				if (!tp.optional()) {
					return new FailureReason.PropertyMissing(tp.name());
				}
				IndexSignature index = source.applicableIndex(tp.name());
				if (index != null && !relater.relateOptionalProperty(index.valueType(), tp.readType(), ctx)) {
					return new FailureReason.PropertyTypeMismatch(tp.name(), explain(index.valueType(), tp.readType(), depth + 1));
				}
				continue;
			}
			if (sp.optional() && !tp.optional()) {
				return new FailureReason.OptionalityMismatch(tp.name());
			}
			if (sp.readonly() && !tp.readonly() && !relater.allowsReadonlyToMutable()) {
				return new FailureReason.ReadonlyMismatch(tp.name());
			}
			if (!judge.relateProperty(sp, tp, ctx, relater)) {
				if (tp.method()
					&& interner.lookup(sp.readType()) instanceof TypeKey.FunctionType
					&& interner.lookup(tp.readType()) instanceof TypeKey.FunctionType) {
					FailureReason.TypeMismatch leaf = new FailureReason.TypeMismatch(sp.readType(), tp.readType());
					return new FailureReason.PropertyTypeMismatch(tp.name(),
						explainSignatures(interner.functionShapeOf(sp.readType()), interner.functionShapeOf(tp.readType()), true, leaf, depth + 1));
				}
				boolean readOk = tp.optional()
					? relater.relateOptionalProperty(sp.readType(), tp.readType(), ctx)
					: relater.relate(sp.readType(), tp.readType(), ctx);
				if (!readOk) {
					return new FailureReason.PropertyTypeMismatch(tp.name(), explain(sp.readType(), tp.readType(), depth + 1));
				}
				return new FailureReason.PropertyTypeMismatch(tp.name(), explain(tp.writeType(), sp.writeType(), depth + 1));
			}
		}
		IndexSignature targetString = target.stringIndex();
		if (targetString != null) {
			for (PropertyInfo sp : source.properties()) {
				if (!relater.relate(sp.readType(), targetString.valueType(), ctx)) {
					return new FailureReason.PropertyTypeMismatch(sp.name(), explain(sp.readType(), targetString.valueType(), depth + 1));
				}
			}
		}
		return fallback;
	}

	private FailureReason explainSignatures(FunctionShape sourceShape, FunctionShape targetShape, boolean methodMember, FailureReason fallback, int depth) {
		FunctionShape source = evaluator.eraseTypeParameters(sourceShape, true, ctx);
		FunctionShape target = evaluator.eraseTypeParameters(targetShape, false, ctx);
		boolean method = methodMember || target.method();
		Judge.Parameters s = Judge.Parameters.of(interner.paramList(source.parameters()));
		Judge.Parameters t = Judge.Parameters.of(interner.paramList(target.parameters()));
		if (s.required() > t.fixed().size() && t.rest() == null) {
			return new FailureReason.ArityMismatch(s.required(), t.fixed().size());
		}
		int positions = Math.max(s.fixed().size(), t.fixed().size());
		for (int i = 0; i < positions; i++) {
			TypeId sp = s.typeAt(i, evaluator, ctx);
			TypeId tp = t.typeAt(i, evaluator, ctx);
			if (sp != null && tp != null && !relater.relateParameter(sp, tp, method, ctx)) {
				return new FailureReason.ParameterIncompatible(i, explain(tp, sp, depth + 1));
			}
		}
		if (!relater.relateReturn(source.returnType(), target.returnType(), ctx)) {
			return new FailureReason.ReturnIncompatible(explain(source.returnType(), target.returnType(), depth + 1));
		}
		return fallback;
	}

	private FailureReason explainTuples(TypeKey.TupleType source, TypeKey.TupleType target, FailureReason fallback, int depth) {
		Judge.TupleArity s = Judge.TupleArity.of(interner.tupleList(source.elements()));
		Judge.TupleArity t = Judge.TupleArity.of(interner.tupleList(target.elements()));
		if (s.required() < t.required() || (s.fixed().size() > t.fixed().size() && t.rest() == null)) {
			return new FailureReason.ArityMismatch(s.required(), t.fixed().size());
		}
		List<TupleElement> sourceElements = s.fixed();
		for (int i = 0; i < sourceElements.size() && i < t.fixed().size(); i++) {
			TypeId se = sourceElements.get(i).type();
			TypeId te = t.fixed().get(i).type();
			if (!relater.relate(se, te, ctx)) {
				return new FailureReason.PropertyTypeMismatch(String.valueOf(i), explain(se, te, depth + 1));
			}
		}
		return fallback;
	}
}
