package works.typelaw.lawyer;

import java.util.List;
import java.util.function.Predicate;
import org.jetbrains.annotations.Nullable;
import works.typelaw.judge.FailureReason;
import works.typelaw.types.DefId;
import works.typelaw.types.EnumKind;
import works.typelaw.types.JsNumberFormat;
import works.typelaw.types.LiteralValue;
import works.typelaw.types.ObjectShape;
import works.typelaw.types.PropertyInfo;
import works.typelaw.types.TypeId;
import works.typelaw.types.TypeInterner;
import works.typelaw.types.TypeKey;

import static works.typelaw.lawyer.CompatRule.Scope.EVERY_LEVEL;
import static works.typelaw.lawyer.CompatRule.Scope.TOP_LEVEL;
import static works.typelaw.types.TypeId.ANY;
import static works.typelaw.types.TypeId.NEVER;
import static works.typelaw.types.TypeId.NULL;
import static works.typelaw.types.TypeId.NUMBER;
import static works.typelaw.types.TypeId.STRING;
import static works.typelaw.types.TypeId.UNDEFINED;
import static works.typelaw.types.TypeId.UNKNOWN;
import static works.typelaw.types.TypeId.UNRESOLVED;
import static works.typelaw.types.TypeId.VOID;

/**
 * The standard compatibility rules, in the order the compiler applies them.
 */
public final class CompatRules {
	private CompatRules() {}

	public static final String IDENTITY = "identity";
	public static final String ANY_PROPAGATION = "any-propagation";
	public static final String UNRESOLVED_SENTINEL = "unresolved-sentinel";
	public static final String NULLISH_WITHOUT_STRICT_NULL_CHECKS = "nullish-without-strict-null-checks";
	public static final String TOP_AND_BOTTOM = "top-and-bottom";
	public static final String ENUM_OPACITY = "enum-opacity";
	public static final String WEAK_TYPE = "weak-type";
	public static final String EXCESS_PROPERTY = "excess-property";
	public static final String ROOT_OBJECT = "root-object";
	public static final String STRUCTURAL = "structural";

	public static List<CompatRule> defaults() {
		return List.of(
			new Identity(),
			new AnyPropagation(),
			new UnresolvedSentinel(),
			new NullishWithoutStrictNullChecks(),
			new TopAndBottom(),
			new EnumOpacity(),
			new WeakType(),
			new ExcessProperty(),
			new RootObject(),
			new Structural()
		);
	}

	private static Verdict mismatch(TypeId source, TypeId target) {
		return Verdict.reject(new FailureReason.TypeMismatch(source, target));
	}

	private abstract static class NamedRule implements CompatRule {
		private final String name;
		private final Scope scope;

		NamedRule(String name, Scope scope) {
			this.name = name;
			this.scope = scope;
		}

		@Override
		public final String name() {
			return name;
		}

		@Override
		public final Scope scope() {
			return scope;
		}

		@Override
		public String toString() {
			return name;
		}
	}

	public static final class Identity extends NamedRule {
		public Identity() {
			super(IDENTITY, EVERY_LEVEL);
		}

		@Override
		public Verdict check(TypeId source, TypeId target, RuleContext context) {
			return source.equals(target) ? Verdict.ACCEPT : Verdict.CONTINUE;
		}
	}

	/**
	 * Everything is assignable to <code>any</code>, and <code>any</code> is assignable to
	 * everything but <code>never</code>. With {@link CompatProfile#strictAnyPropagation()},
	 * <code>any</code> is assignable only to top types.
	 */
	public static final class AnyPropagation extends NamedRule {
		public AnyPropagation() {
			super(ANY_PROPAGATION, EVERY_LEVEL);
		}

		@Override
		public Verdict check(TypeId source, TypeId target, RuleContext context) {
			if (target.equals(ANY)) {
				return Verdict.ACCEPT;
			}
			if (!source.equals(ANY)) {
				return Verdict.CONTINUE;
			}
			if (target.equals(UNKNOWN)) {
				return Verdict.ACCEPT;
			}
			if (target.equals(NEVER) || context.profile().strictAnyPropagation()) {
				return mismatch(source, target);
			}
			return Verdict.ACCEPT;
		}
	}

	/**
	 * A reference that couldn't be resolved must not make errors disappear,
	 * so it relates to nothing but itself and <code>any</code>.
	 */
	public static final class UnresolvedSentinel extends NamedRule {
		public UnresolvedSentinel() {
			super(UNRESOLVED_SENTINEL, EVERY_LEVEL);
		}

		@Override
		public Verdict check(TypeId source, TypeId target, RuleContext context) {
			if (source.equals(UNRESOLVED) || target.equals(UNRESOLVED)) {
				return mismatch(source, target);
			}
			return Verdict.CONTINUE;
		}
	}

	public static final class NullishWithoutStrictNullChecks extends NamedRule {
		public NullishWithoutStrictNullChecks() {
			super(NULLISH_WITHOUT_STRICT_NULL_CHECKS, EVERY_LEVEL);
		}

		@Override
		public Verdict check(TypeId source, TypeId target, RuleContext context) {
			if (!context.profile().strictNullChecks() && (source.equals(NULL) || source.equals(UNDEFINED))) {
				return Verdict.ACCEPT;
			}
			return Verdict.CONTINUE;
		}
	}

	public static final class TopAndBottom extends NamedRule {
		public TopAndBottom() {
			super(TOP_AND_BOTTOM, EVERY_LEVEL);
		}

		@Override
		public Verdict check(TypeId source, TypeId target, RuleContext context) {
			if (target.equals(UNKNOWN) || source.equals(NEVER)) {
				return Verdict.ACCEPT;
			}
			if (source.equals(UNKNOWN)) {
				return mismatch(source, target);
			}
			return Verdict.CONTINUE;
		}
	}

	/**
	 * Enums are nominal. Members of different enums never mix; a numeric enum
	 * member may be used as a number, but only number literals that are the value
	 * of some member go the other way; string enums and strings don't mix at all.
	 */
	public static final class EnumOpacity extends NamedRule {
		public EnumOpacity() {
			super(ENUM_OPACITY, EVERY_LEVEL);
		}

		@Override
		public Verdict check(TypeId source, TypeId target, RuleContext context) {
			TypeInterner interner = context.interner();
			TypeId s = context.normalize(source);
			TypeId t = context.normalize(target);
			TypeKey sk = interner.lookup(s);
			TypeKey tk = interner.lookup(t);
			DefId sourceEnum = enumOf(sk);
			DefId targetEnum = enumOf(tk);
			if (sourceEnum == null && targetEnum == null) {
				return Verdict.CONTINUE;
			}
			Verdict violation = Verdict.reject(new FailureReason.EnumOpacityViolation(source, target));
			if (sourceEnum != null && targetEnum != null) {
				return sourceEnum.equals(targetEnum) ? Verdict.CONTINUE : violation;
			}
			if (targetEnum != null) {
				if (isNumeric(tk)) {
					if (s.equals(NUMBER)) {
						return violation;
					}
					if (sk instanceof TypeKey.Literal l && l.value() instanceof LiteralValue.NumberLiteral) {
						return memberValues(tk, interner).contains(l.value()) ? Verdict.ACCEPT : violation;
					}
				} else if (isString(tk) && isStringLike(s, sk)) {
					return violation;
				}
				return Verdict.CONTINUE;
			}
			if (isString(sk) && isStringLike(t, tk)) {
				return violation;
			}
			return Verdict.CONTINUE;
		}

		private static @Nullable DefId enumOf(TypeKey key) {
			if (key instanceof TypeKey.Enum e) {
				return e.def();
			} else if (key instanceof TypeKey.EnumMember m) {
				return m.def();
			}
			return null;
		}

		private static boolean isNumeric(TypeKey key) {
			if (key instanceof TypeKey.Enum e) {
				return e.enumKind() == EnumKind.NUMERIC;
			}
			return key instanceof TypeKey.EnumMember m && m.value() instanceof LiteralValue.NumberLiteral;
		}

		private static boolean isString(TypeKey key) {
			if (key instanceof TypeKey.Enum e) {
				return e.enumKind() == EnumKind.STRING;
			}
			return key instanceof TypeKey.EnumMember m && m.value() instanceof LiteralValue.StringLiteral;
		}

		private static boolean isStringLike(TypeId id, TypeKey key) {
			return id.equals(STRING)
				|| (key instanceof TypeKey.Literal l && l.value() instanceof LiteralValue.StringLiteral);
		}

		private static List<LiteralValue> memberValues(TypeKey key, TypeInterner interner) {
			if (key instanceof TypeKey.EnumMember m) {
				return List.of(m.value());
			}
			return interner.typeList(((TypeKey.Enum) key).members()).stream()
				.map(member -> ((TypeKey.EnumMember) interner.lookup(member)).value())
				.toList();
		}
	}

	/**
	 * A weak type, whose properties are all optional, accepts only sources
	 * that share at least one of its properties or declare none at all.
	 */
	public static final class WeakType extends NamedRule {
		public WeakType() {
			super(WEAK_TYPE, TOP_LEVEL);
		}

		@Override
		public Verdict check(TypeId source, TypeId target, RuleContext context) {
			TypeId t = context.normalize(target);
			if (!(context.interner().lookup(t) instanceof TypeKey.ObjectType)) {
				return Verdict.CONTINUE;
			}
			ObjectShape weak = context.interner().objectShapeOf(t);
			if (!weak.isWeak()) {
				return Verdict.CONTINUE;
			}
			if (lacksCommonProperty(source, weak, context)) {
				return Verdict.reject(new FailureReason.NoCommonProperties(source, target));
			}
			return Verdict.CONTINUE;
		}

		private static boolean lacksCommonProperty(TypeId source, ObjectShape weak, RuleContext context) {
			TypeId s = context.normalize(source);
			if (context.interner().lookup(s) instanceof TypeKey.Union u) {
				return context.interner().typeList(u.members()).stream()
					.allMatch(member -> lacksCommonProperty(member, weak, context));
			}
			ObjectShape shape = context.shapeOf(s);
			if (shape == null || shape.properties().isEmpty() || shape.hasIndexSignature()) {
				return false;
			}
			for (PropertyInfo property : shape.properties()) {
				if (weak.property(property.name()) != null) {
					return false;
				}
			}
			return true;
		}
	}

	/**
	 * An object literal may only name properties its target declares,
	 * unless the target has a string index signature.
	 * If a property the target does declare has the wrong type, that mismatch
	 * is reported instead.
	 */
	public static final class ExcessProperty extends NamedRule {
		public ExcessProperty() {
			super(EXCESS_PROPERTY, TOP_LEVEL);
		}

		@Override
		public Verdict check(TypeId source, TypeId target, RuleContext context) {
			TypeInterner interner = context.interner();
			TypeId s = context.normalize(source);
			if (!(interner.lookup(s) instanceof TypeKey.ObjectType)) {
				return Verdict.CONTINUE;
			}
			ObjectShape literal = interner.objectShapeOf(s);
			if (!literal.isFresh()) {
				return Verdict.CONTINUE;
			}
			TypeId t = context.normalize(target);
			Predicate<String> declared = declaredNames(t, true, context);
			if (declared == null) {
				return Verdict.CONTINUE;
			}
			String excess = null;
			for (PropertyInfo property : literal.properties()) {
				if (!declared.test(property.name())) {
					excess = property.name();
					break;
				}
			}
			if (excess == null || commonMemberMismatch(s, literal, t, context)) {
				return Verdict.CONTINUE;
			}
			return Verdict.reject(new FailureReason.ExcessProperty(excess));
		}

		/**
		 * @param emptyAcceptsAll whether an empty object type means "accepts any properties"
		 * @return a test for whether a property name is known to <code>t</code>,
		 * or null if <code>t</code> doesn't limit the names a literal may use
		 */
		private static @Nullable Predicate<String> declaredNames(TypeId t, boolean emptyAcceptsAll, RuleContext context) {
			TypeInterner interner = context.interner();
			TypeKey key = interner.lookup(t);
			if (key instanceof TypeKey.ObjectType) {
				ObjectShape shape = interner.objectShapeOf(t);
				if (shape.stringIndex() != null || (emptyAcceptsAll && shape.isEmpty())) {
					return null;
				}
				return name -> shape.property(name) != null
					|| (shape.numberIndex() != null && JsNumberFormat.isNumericName(name));
			}
			List<TypeId> members;
			if (key instanceof TypeKey.Union u) {
				members = interner.typeList(u.members());
			} else if (key instanceof TypeKey.Intersection i) {
				members = interner.typeList(i.members());
				emptyAcceptsAll = false;
			} else {
				return null;
			}
			Predicate<String> result = null;
			for (TypeId member : members) {
				TypeId m = context.normalize(member);
				TypeKey mk = interner.lookup(m);
				if (!(mk instanceof TypeKey.ObjectType || mk instanceof TypeKey.Union || mk instanceof TypeKey.Intersection)) {
					// Members that aren't object types don't constrain a literal's names
					continue;
				}
				Predicate<String> names = declaredNames(m, emptyAcceptsAll, context);
				if (names == null) {
					return null;
				}
				result = (result == null) ? names : result.or(names);
			}
			return result;
		}

		private static boolean commonMemberMismatch(TypeId s, ObjectShape literal, TypeId t, RuleContext context) {
			if (!(context.interner().lookup(t) instanceof TypeKey.ObjectType)) {
				return !context.relate(s, t);
			}
			ObjectShape target = context.interner().objectShapeOf(t);
			for (PropertyInfo sp : literal.properties()) {
				PropertyInfo tp = target.property(sp.name());
				if (tp == null) {
					continue;
				}
				TypeId expected = tp.readType();
				if (tp.optional() && !context.profile().exactOptionalPropertyTypes()) {
					expected = context.factory().union(expected, UNDEFINED);
				}
				if (!context.relate(sp.readType(), expected)) {
					return true;
				}
			}
			return false;
		}
	}

	/**
	 * The empty object type and the library's root <code>Object</code> interface
	 * accept every value except <code>null</code>, <code>undefined</code> and <code>void</code>.
	 */
	public static final class RootObject extends NamedRule {
		public RootObject() {
			super(ROOT_OBJECT, EVERY_LEVEL);
		}

		@Override
		public Verdict check(TypeId source, TypeId target, RuleContext context) {
			TypeId t = context.normalize(target);
			if (!isRoot(t, context)) {
				return Verdict.CONTINUE;
			}
			return acceptsAnyObject(source, context) ? Verdict.ACCEPT : mismatch(source, target);
		}

		private static boolean isRoot(TypeId t, RuleContext context) {
			if (t.equals(TypeId.EMPTY_OBJECT)) {
				return true;
			}
			if (context.interner().lookup(t) instanceof TypeKey.ObjectType && context.interner().objectShapeOf(t).isEmpty()) {
				return true;
			}
			return t.equals(context.normalize(context.library().rootObject()));
		}

		private static boolean acceptsAnyObject(TypeId source, RuleContext context) {
			TypeId s = context.normalize(source);
			if (s.equals(NULL) || s.equals(UNDEFINED) || s.equals(VOID) || s.equals(UNKNOWN) || s.equals(UNRESOLVED)) {
				return false;
			}
			TypeInterner interner = context.interner();
			TypeKey key = interner.lookup(s);
			if (key instanceof TypeKey.Union u) {
				return interner.typeList(u.members()).stream().allMatch(member -> acceptsAnyObject(member, context));
			} else if (key instanceof TypeKey.Intersection i) {
				return interner.typeList(i.members()).stream().anyMatch(member -> acceptsAnyObject(member, context));
			} else if (key instanceof TypeKey.TypeParameter p) {
				return p.info().constraint() != null && acceptsAnyObject(p.info().constraint(), context);
			}
			return true;
		}
	}

	/**
	 * Compares the pair member by member. This is the last rule in the standard order.
	 */
	public static final class Structural extends NamedRule {
		public Structural() {
			super(STRUCTURAL, EVERY_LEVEL);
		}

		@Override
		public Verdict check(TypeId source, TypeId target, RuleContext context) {
			return Verdict.STRUCTURAL;
		}
	}
}
