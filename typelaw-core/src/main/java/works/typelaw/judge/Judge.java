package works.typelaw.judge;

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.typelaw.evaluate.Evaluator;
import works.typelaw.evaluate.TemplateMatcher;
import works.typelaw.guard.Budget;
import works.typelaw.guard.Limits;
import works.typelaw.guard.QueryContext;
import works.typelaw.guard.RelationKey;
import works.typelaw.types.FunctionShape;
import works.typelaw.types.IndexSignature;
import works.typelaw.types.JsNumberFormat;
import works.typelaw.types.LiteralValue;
import works.typelaw.types.ObjectShape;
import works.typelaw.types.ParamInfo;
import works.typelaw.types.PropertyInfo;
import works.typelaw.types.TemplateSpan;
import works.typelaw.types.TupleElement;
import works.typelaw.types.TypeFactory;
import works.typelaw.types.TypeId;
import works.typelaw.types.TypeInterner;
import works.typelaw.types.TypeKey;

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
 * The strict structural relation: identity and subtyping with no
 * language-specific leniency.
 * <p>
 * Every nested comparison is routed through a {@link Relater}, which is how
 * a compatibility layer reuses this structural walk while substituting its own
 * rules at each level. Judge itself only ever uses its {@link #strictRelater() strict relater}.
 * <p>
 * Recursive types are compared coinductively: a pair met again while it is still
 * being compared is assumed to hold. Depth and operation budgets bound the walk;
 * a query that exhausts one answers <code>false</code> and reports itself truncated.
 */
public final class Judge {
	private final TypeInterner interner;
	private final TypeFactory factory;
	private final Evaluator evaluator;
	private final Limits limits;
	private final TemplateMatcher templates;
	private final Relater strict = new StrictRelater();

	public Judge(TypeFactory factory, Evaluator evaluator, Limits limits) {
		this.factory = requireNonNull(factory);
		this.interner = factory.interner();
		this.evaluator = requireNonNull(evaluator);
		this.limits = requireNonNull(limits);
		this.templates = new TemplateMatcher(interner);
	}

	public Relater strictRelater() {
		return strict;
	}

	public Evaluator evaluator() {
		return evaluator;
	}

	public TypeFactory factory() {
		return factory;
	}

	public boolean isSubtype(TypeId source, TypeId target) {
		return subtype(source, target).holds();
	}

	public RelationResult subtype(TypeId source, TypeId target) {
		QueryContext ctx = new QueryContext(limits);
		boolean holds = relate(source, target, ctx, strict);
		return conclude(holds, ctx, source, target);
	}

	/**
	 * Two types are identical if they are the same type, or each is a subtype of the other.
	 */
	public boolean isIdentical(TypeId a, TypeId b) {
		return identical(a, b).holds();
	}

	public RelationResult identical(TypeId a, TypeId b) {
		if (a.equals(b)) {
			return RelationResult.proven(true);
		}
		QueryContext ctx = new QueryContext(limits);
		boolean holds = relate(a, b, ctx, strict) && relate(b, a, ctx, strict);
		return conclude(holds, ctx, a, b);
	}

	private RelationResult conclude(boolean holds, QueryContext ctx, TypeId source, TypeId target) {
		if (ctx.truncated()) {
			LOGGER.debug("Relation {} <: {} truncated by {}", source, target, ctx.exhaustedBudgets());
			return new RelationResult(false, true, ctx.exhaustedBudgets());
		}
		LOGGER.trace("Relation {} <: {} is {}", source, target, holds);
		return RelationResult.proven(holds);
	}

	/**
	 * Explains why <code>source</code> does not relate to <code>target</code>
	 * under the given relater.
	 */
	public FailureReason explain(TypeId source, TypeId target, QueryContext ctx, Relater relater) {
		return new FailureExplainer(this, ctx, relater).explain(source, target);
	}

	/**
	 * The memoized, budgeted entry point for one comparison within a query.
	 */
	public boolean relate(TypeId source, TypeId target, QueryContext ctx, Relater relater) {
		if (source.equals(target)) {
			return true;
		}
		if (!ctx.tick()) {
			return false;
		}
		RelationKey key = new RelationKey(source, target, relater.mode());
		switch (ctx.relations().begin(key)) {
			case PROVEN, IN_PROGRESS:
				return true;
			case DISPROVEN:
				return false;
			case OVERFLOW:
				ctx.exhaust(Budget.IN_PROGRESS_PAIRS);
				return false;
			case STARTED:
				break;
		}
		if (!ctx.enterRelation()) {
			ctx.relations().abandon(key);
			return false;
		}
		boolean completed = false;
		boolean result = false;
		try {
			Boolean preempted = relater.preempt(source, target, ctx);
			result = (preempted != null) ? preempted : structural(source, target, ctx, relater);
			completed = true;
		} finally {
			ctx.exitRelation();
			if (completed && !ctx.truncated()) {
				ctx.relations().finish(key, result);
			} else {
				ctx.relations().abandon(key);
			}
		}
		return result;
	}

	boolean structural(TypeId s, TypeId t, QueryContext ctx, Relater r) {
		TypeKey sk = interner.lookup(s);
		TypeKey tk = interner.lookup(t);

		if (sk.kind().isReference()) {
			return r.relate(evaluator.resolveReference(s, ctx), t, ctx);
		}
		if (tk.kind().isReference()) {
			return r.relate(s, evaluator.resolveReference(t, ctx), ctx);
		}
		if (s.equals(UNRESOLVED) || t.equals(UNRESOLVED)) {
			return false;
		}
		if (s.equals(NEVER) || t.equals(UNKNOWN) || t.equals(ANY)) {
			return true;
		}
		if (s.equals(ANY) || s.equals(UNKNOWN)) {
			return false;
		}

		if (sk.kind().isDerived()) {
			TypeId evaluated = evaluator.evaluate(s, ctx);
			if (!evaluated.equals(s)) {
				return r.relate(evaluated, t, ctx);
			}
		}
		if (tk.kind().isDerived()) {
			TypeId evaluated = evaluator.evaluate(t, ctx);
			if (!evaluated.equals(t)) {
				return r.relate(s, evaluated, ctx);
			}
		}

		if (sk instanceof TypeKey.Union u) {
			for (TypeId member : interner.typeList(u.members())) {
				if (!r.relate(member, t, ctx)) {
					return false;
				}
			}
			return true;
		}
		if (tk instanceof TypeKey.Union u) {
			for (TypeId member : interner.typeList(u.members())) {
				if (r.relate(s, member, ctx)) {
					return true;
				}
			}
			if (s.equals(TypeId.BOOLEAN)) {
				return r.relate(TypeId.TRUE, t, ctx) && r.relate(TypeId.FALSE, t, ctx);
			}
			if (sk instanceof TypeKey.Enum e) {
				return allRelate(interner.typeList(e.members()), t, ctx, r);
			}
			return false;
		}
		if (tk instanceof TypeKey.Intersection i) {
			for (TypeId member : interner.typeList(i.members())) {
				if (!r.relate(s, member, ctx)) {
					return false;
				}
			}
			return true;
		}
		if (sk instanceof TypeKey.Intersection i) {
			for (TypeId member : interner.typeList(i.members())) {
				if (r.relate(member, t, ctx)) {
					return true;
				}
			}
			return false;
		}

		if (sk instanceof TypeKey.TypeParameter p) {
			return relateConstraint(p.info().constraint(), t, ctx, r);
		} else if (sk instanceof TypeKey.Infer p) {
			return relateConstraint(p.info().constraint(), t, ctx, r);
		}
		if (tk.kind() == TypeKey.Kind.TYPE_PARAMETER || tk.kind() == TypeKey.Kind.INFER) {
			return false;
		}

		if (sk instanceof TypeKey.EnumMember member) {
			if (tk instanceof TypeKey.Enum e && e.def().equals(member.def())) {
				return true;
			}
			return r.relate(factory.literal(member.value()), t, ctx);
		}
		if (sk instanceof TypeKey.Enum e) {
			return allRelate(interner.typeList(e.members()), t, ctx, r);
		}

		if (tk.kind().isDerived()) {
			return deferredTarget(s, sk, t, tk, ctx, r);
		}
		if (sk.kind().isDerived()) {
			return deferredSource(sk, t, ctx, r);
		}

		return switch (tk.kind()) {
			case PRIMITIVE -> primitiveTarget(s, sk, t);
			case OBJECT -> objectTarget(s, sk, interner.objectShapeOf(t), ctx, r);
			case ARRAY -> arrayTarget(sk, (TypeKey.ArrayType) tk, ctx, r);
			case TUPLE -> tupleTarget(sk, (TypeKey.TupleType) tk, ctx, r);
			case FUNCTION -> sk instanceof TypeKey.FunctionType
				&& relateSignatures(interner.functionShapeOf(s), interner.functionShapeOf(t), false, ctx, r);
			case CONSTRUCTOR -> sk instanceof TypeKey.ConstructorType
				&& relateSignatures(interner.functionShapeOf(s), interner.functionShapeOf(t), false, ctx, r);
			// Distinct literals, enums and enum members never relate structurally
			default -> false;
		};
	}

	private boolean allRelate(List<TypeId> sources, TypeId target, QueryContext ctx, Relater r) {
		for (TypeId source : sources) {
			if (!r.relate(source, target, ctx)) {
				return false;
			}
		}
		return true;
	}

	private boolean relateConstraint(@Nullable TypeId constraint, TypeId t, QueryContext ctx, Relater r) {
		if (constraint == null) {
			return false;
		}
		return r.relate(constraint, t, ctx);
	}

	private boolean primitiveTarget(TypeId s, TypeKey sk, TypeId t) {
		if (t.equals(TypeId.VOID)) {
			return s.equals(UNDEFINED);
		}
		if (t.equals(TypeId.OBJECT)) {
			return switch (sk.kind()) {
				case OBJECT, ARRAY, TUPLE, FUNCTION, CONSTRUCTOR -> true;
				default -> false;
			};
		}
		if (sk instanceof TypeKey.Literal l) {
			return l.value().base().equals(t);
		}
		return false;
	}

	/**
	 * The target is a derived type the evaluator could not reduce any further,
	 * typically because it mentions a type parameter.
	 */
	private boolean deferredTarget(TypeId s, TypeKey sk, TypeId t, TypeKey tk, QueryContext ctx, Relater r) {
		if (tk instanceof TypeKey.TemplateLiteral template) {
			return templateTarget(sk, interner.spanList(template.spans()), ctx, r);
		}
		if (tk instanceof TypeKey.StringIntrinsic target) {
			if (sk instanceof TypeKey.Literal l && l.value() instanceof LiteralValue.StringLiteral str) {
				return target.intrinsic().apply(str.value()).equals(str.value()) && r.relate(s, target.operand(), ctx);
			}
			if (sk instanceof TypeKey.StringIntrinsic source && source.intrinsic() == target.intrinsic()) {
				return r.relate(source.operand(), target.operand(), ctx);
			}
			return false;
		}
		if (tk instanceof TypeKey.KeyOf target) {
			if (sk instanceof TypeKey.KeyOf source) {
				// keyof is contravariant
				return r.relate(target.operand(), source.operand(), ctx);
			}
			TypeKey operand = interner.lookup(target.operand());
			if (operand instanceof TypeKey.TypeParameter p && p.info().constraint() != null) {
				TypeId constraintKeys = evaluator.keyOf(p.info().constraint(), ctx);
				return interner.kindOf(constraintKeys) != TypeKey.Kind.KEY_OF && r.relate(s, constraintKeys, ctx);
			}
			return false;
		}
		if (tk instanceof TypeKey.IndexAccess target && sk instanceof TypeKey.IndexAccess source) {
			return r.relate(source.object(), target.object(), ctx)
				&& r.relate(source.index(), target.index(), ctx)
				&& r.relate(target.index(), source.index(), ctx);
		}
		if (tk instanceof TypeKey.Conditional target && sk instanceof TypeKey.Conditional source) {
			return source.check().equals(target.check())
				&& source.extendsType().equals(target.extendsType())
				&& r.relate(source.trueType(), target.trueType(), ctx)
				&& r.relate(source.falseType(), target.falseType(), ctx);
		}
		if (tk instanceof TypeKey.Application target && sk instanceof TypeKey.Application source && source.base().equals(target.base())) {
			List<TypeId> sourceArgs = interner.typeList(source.arguments());
			List<TypeId> targetArgs = interner.typeList(target.arguments());
			if (sourceArgs.size() != targetArgs.size()) {
				return false;
			}
			// Without variance measurement, unevaluable applications are compared invariantly
			for (int i = 0; i < sourceArgs.size(); i++) {
				if (!r.relate(sourceArgs.get(i), targetArgs.get(i), ctx) || !r.relate(targetArgs.get(i), sourceArgs.get(i), ctx)) {
					return false;
				}
			}
			return true;
		}
		if (sk.kind().isDerived()) {
			return deferredSource(sk, t, ctx, r);
		}
		return false;
	}

	/**
	 * The source is an unreducible derived type. It relates to the target
	 * if its constraint, the widest type it could become, does.
	 */
	private boolean deferredSource(TypeKey sk, TypeId t, QueryContext ctx, Relater r) {
		if (sk instanceof TypeKey.TemplateLiteral || sk instanceof TypeKey.StringIntrinsic) {
			return r.relate(STRING, t, ctx);
		}
		if (sk instanceof TypeKey.KeyOf) {
			return r.relate(factory.union(STRING, NUMBER, SYMBOL), t, ctx);
		}
		if (sk instanceof TypeKey.Conditional c) {
			return r.relate(c.trueType(), t, ctx) && r.relate(c.falseType(), t, ctx);
		}
		if (sk instanceof TypeKey.IndexAccess access
			&& interner.lookup(access.object()) instanceof TypeKey.TypeParameter p
			&& p.info().constraint() != null) {
			TypeId constrained = evaluator.evaluate(factory.indexAccess(p.info().constraint(), access.index()), ctx);
			return interner.kindOf(constrained) != TypeKey.Kind.INDEX_ACCESS && r.relate(constrained, t, ctx);
		}
		return false;
	}

	private boolean templateTarget(TypeKey sk, List<TemplateSpan> targetSpans, QueryContext ctx, Relater r) {
		if (sk instanceof TypeKey.Literal l && l.value() instanceof LiteralValue.StringLiteral str) {
			return templates.matches(str.value(), targetSpans, (piece, type) -> r.relate(factory.literal(piece), type, ctx));
		}
		if (sk instanceof TypeKey.TemplateLiteral source) {
			List<TemplateSpan> sourceSpans = interner.spanList(source.spans());
			if (sourceSpans.size() != targetSpans.size()) {
				return false;
			}
			for (int i = 0; i < sourceSpans.size(); i++) {
				TemplateSpan a = sourceSpans.get(i);
				TemplateSpan b = targetSpans.get(i);
				if (a instanceof TemplateSpan.Text ta && b instanceof TemplateSpan.Text tb) {
					if (!ta.text().equals(tb.text())) {
						return false;
					}
				} else if (a instanceof TemplateSpan.Placeholder pa && b instanceof TemplateSpan.Placeholder pb) {
					if (!r.relate(pa.type(), pb.type(), ctx)) {
						return false;
					}
				} else {
					return false;
				}
			}
			return true;
		}
		return false;
	}

	private boolean objectTarget(TypeId s, TypeKey sk, ObjectShape target, QueryContext ctx, Relater r) {
		ObjectShape source = sourceShape(s, sk, ctx);
		if (source == null) {
			return false;
		}
		return relateShapes(source, target, ctx, r);
	}

	/**
	 * @return the members <code>s</code> offers to an object target, or null if it has none
	 */
	@Nullable ObjectShape sourceShape(TypeId s, TypeKey sk, QueryContext ctx) {
		switch (sk.kind()) {
			case OBJECT:
				return interner.objectShapeOf(s);
			case PRIMITIVE:
				if (s.equals(TypeId.OBJECT)) {
					return ObjectShape.EMPTY;
				} else if (s.equals(TypeId.NULL) || s.equals(UNDEFINED) || s.equals(TypeId.VOID)) {
					return null;
				}
				break;
			case LITERAL:
			case ARRAY:
			case TUPLE:
			case FUNCTION:
			case CONSTRUCTOR:
				break;
			default:
				return null;
		}
		TypeId apparent = evaluator.apparentType(s, ctx);
		if (!apparent.equals(s) && interner.kindOf(apparent) == TypeKey.Kind.OBJECT) {
			return interner.objectShapeOf(apparent);
		}
		return null;
	}

	boolean relateShapes(ObjectShape source, ObjectShape target, QueryContext ctx, Relater r) {
		for (PropertyInfo tp : target.properties()) {
			PropertyInfo sp = source.property(tp.name());
			if (sp == null) {
				if (!tp.optional()) {
					return false;
				}
				IndexSignature index = source.applicableIndex(tp.name());
				if (index != null && !r.relateOptionalProperty(index.valueType(), tp.readType(), ctx)) {
					return false;
				}
				continue;
			}
			if (!relateProperty(sp, tp, ctx, r)) {
				return false;
			}
		}
		return relateIndexSignatures(source, target, ctx, r);
	}

	boolean relateProperty(PropertyInfo sp, PropertyInfo tp, QueryContext ctx, Relater r) {
		if (sp.optional() && !tp.optional()) {
			return false;
		}
		if (sp.readonly() && !tp.readonly() && !r.allowsReadonlyToMutable()) {
			return false;
		}
		if (!relatePropertyRead(sp, tp, ctx, r)) {
			return false;
		}
		if (!tp.readonly() && (sp.hasSplitAccessor() || tp.hasSplitAccessor())) {
			return r.relate(tp.writeType(), sp.writeType(), ctx);
		}
		return true;
	}

	private boolean relatePropertyRead(PropertyInfo sp, PropertyInfo tp, QueryContext ctx, Relater r) {
		if (tp.method()
			&& interner.lookup(sp.readType()) instanceof TypeKey.FunctionType
			&& interner.lookup(tp.readType()) instanceof TypeKey.FunctionType) {
			return sp.readType().equals(tp.readType())
				|| relateSignatures(interner.functionShapeOf(sp.readType()), interner.functionShapeOf(tp.readType()), true, ctx, r);
		}
		if (tp.optional()) {
			return r.relateOptionalProperty(sp.readType(), tp.readType(), ctx);
		}
		return r.relate(sp.readType(), tp.readType(), ctx);
	}

	boolean relateIndexSignatures(ObjectShape source, ObjectShape target, QueryContext ctx, Relater r) {
		IndexSignature targetString = target.stringIndex();
		if (targetString != null) {
			for (PropertyInfo sp : source.properties()) {
				if (!r.relate(sp.readType(), targetString.valueType(), ctx)) {
					return false;
				}
			}
			if (!relateIndexValue(source.stringIndex(), targetString, ctx, r)
				|| !relateIndexValue(source.numberIndex(), targetString, ctx, r)) {
				return false;
			}
		}
		IndexSignature targetNumber = target.numberIndex();
		if (targetNumber != null) {
			for (PropertyInfo sp : source.properties()) {
				if (JsNumberFormat.isNumericName(sp.name()) && !r.relate(sp.readType(), targetNumber.valueType(), ctx)) {
					return false;
				}
			}
			if (!relateIndexValue(source.numberIndex(), targetNumber, ctx, r)
				|| !relateIndexValue(source.stringIndex(), targetNumber, ctx, r)) {
				return false;
			}
		}
		return true;
	}

	private boolean relateIndexValue(@Nullable IndexSignature source, IndexSignature target, QueryContext ctx, Relater r) {
		if (source == null) {
			return true;
		}
		if (source.readonly() && !target.readonly() && !r.allowsReadonlyToMutable()) {
			return false;
		}
		return r.relate(source.valueType(), target.valueType(), ctx);
	}

	private boolean arrayTarget(TypeKey sk, TypeKey.ArrayType target, QueryContext ctx, Relater r) {
		if (sk instanceof TypeKey.ArrayType source) {
			if (source.readonly() && !target.readonly()) {
				return false;
			}
			return r.relate(source.element(), target.element(), ctx);
		}
		if (sk instanceof TypeKey.TupleType source) {
			if (source.readonly() && !target.readonly()) {
				return false;
			}
			for (TupleElement e : interner.tupleList(source.elements())) {
				TypeId elementType = e.rest() ? evaluator.restElementType(e.type(), ctx) : e.type();
				if (!r.relate(elementType, target.element(), ctx)) {
					return false;
				}
			}
			return true;
		}
		return false;
	}

	private boolean tupleTarget(TypeKey sk, TypeKey.TupleType target, QueryContext ctx, Relater r) {
		if (!(sk instanceof TypeKey.TupleType source)) {
			return false;
		}
		if (source.readonly() && !target.readonly()) {
			return false;
		}
		TupleArity s = TupleArity.of(interner.tupleList(source.elements()));
		TupleArity t = TupleArity.of(interner.tupleList(target.elements()));
		if (s.rest != null && t.rest == null) {
			return false;
		}
		if (s.fixed.size() > t.fixed.size() && t.rest == null) {
			return false;
		}
		if (s.required < t.required) {
			return false;
		}
		for (int i = 0; i < s.fixed.size(); i++) {
			TypeId targetType = (i < t.fixed.size())
				? t.fixed.get(i).type()
				: evaluator.restElementType(t.rest.type(), ctx);
			if (!r.relate(s.fixed.get(i).type(), targetType, ctx)) {
				return false;
			}
		}
		if (s.rest != null) {
			TypeId sourceRest = evaluator.restElementType(s.rest.type(), ctx);
			for (int i = s.fixed.size(); i < t.fixed.size(); i++) {
				if (!r.relate(sourceRest, t.fixed.get(i).type(), ctx)) {
					return false;
				}
			}
			return r.relate(sourceRest, evaluator.restElementType(t.rest.type(), ctx), ctx);
		}
		return true;
	}

	/**
	 * Splits a tuple's elements into its fixed prefix and trailing rest element.
	 */
	record TupleArity(List<TupleElement> fixed, @Nullable TupleElement rest, int required) {
		static TupleArity of(List<TupleElement> elements) {
			List<TupleElement> fixed = new ArrayList<>();
			TupleElement rest = null;
			int required = 0;
			for (TupleElement e : elements) {
				if (e.rest()) {
					rest = e;
				} else {
					fixed.add(e);
					if (!e.optional()) {
						required++;
					}
				}
			}
			return new TupleArity(fixed, rest, required);
		}
	}

	boolean relateSignatures(FunctionShape sourceShape, FunctionShape targetShape, boolean methodMember, QueryContext ctx, Relater r) {
		FunctionShape source = evaluator.eraseTypeParameters(sourceShape, true, ctx);
		FunctionShape target = evaluator.eraseTypeParameters(targetShape, false, ctx);
		boolean method = methodMember || target.method();
		Parameters s = Parameters.of(interner.paramList(source.parameters()));
		Parameters t = Parameters.of(interner.paramList(target.parameters()));

		if (s.required > t.fixed.size() && t.rest == null) {
			return false;
		}
		if (source.thisType() != null && target.thisType() != null
			&& !r.relateParameter(source.thisType(), target.thisType(), method, ctx)) {
			return false;
		}
		int positions = Math.max(s.fixed.size(), t.fixed.size());
		for (int i = 0; i < positions; i++) {
			TypeId sp = s.typeAt(i, evaluator, ctx);
			TypeId tp = t.typeAt(i, evaluator, ctx);
			if (sp == null || tp == null) {
				continue;
			}
			if (!r.relateParameter(sp, tp, method, ctx)) {
				return false;
			}
		}
		if (s.rest != null && t.rest != null
			&& !r.relateParameter(evaluator.restElementType(s.rest.type(), ctx), evaluator.restElementType(t.rest.type(), ctx), method, ctx)) {
			return false;
		}
		return r.relateReturn(source.returnType(), target.returnType(), ctx);
	}

	/**
	 * A signature's parameters split into fixed positions and an optional rest parameter.
	 */
	record Parameters(List<ParamInfo> fixed, @Nullable ParamInfo rest, int required) {
		static Parameters of(List<ParamInfo> params) {
			List<ParamInfo> fixed = new ArrayList<>();
			ParamInfo rest = null;
			int required = 0;
			for (ParamInfo p : params) {
				if (p.rest()) {
					rest = p;
				} else {
					fixed.add(p);
					if (!p.optional()) {
						required++;
					}
				}
			}
			return new Parameters(fixed, rest, required);
		}

		/**
		 * @return the type of the argument at <code>index</code>, or null if this signature has no such position
		 */
		@Nullable TypeId typeAt(int index, Evaluator evaluator, QueryContext ctx) {
			if (index < fixed.size()) {
				return fixed.get(index).type();
			} else if (rest != null) {
				return evaluator.restElementType(rest.type(), ctx);
			}
			return null;
		}
	}

	private final class StrictRelater implements Relater {
		@Override
		public Object mode() {
			return "strict";
		}

		@Override
		public boolean relate(TypeId source, TypeId target, QueryContext ctx) {
			return Judge.this.relate(source, target, ctx, this);
		}

		@Override
		public boolean relateParameter(TypeId sourceParameter, TypeId targetParameter, boolean method, QueryContext ctx) {
			return relate(targetParameter, sourceParameter, ctx);
		}

		@Override
		public boolean relateReturn(TypeId sourceReturn, TypeId targetReturn, QueryContext ctx) {
			return relate(sourceReturn, targetReturn, ctx);
		}

		@Override
		public boolean relateOptionalProperty(TypeId sourceType, TypeId targetType, QueryContext ctx) {
			return relate(sourceType, targetType, ctx);
		}

		@Override
		public boolean allowsReadonlyToMutable() {
			return false;
		}

		@Override
		public String toString() {
			return "StrictRelater";
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Judge.class);
}
