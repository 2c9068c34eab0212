package works.typelaw.lawyer;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.typelaw.evaluate.Evaluator;
import works.typelaw.guard.Limits;
import works.typelaw.guard.QueryContext;
import works.typelaw.judge.FailureReason;
import works.typelaw.judge.Judge;
import works.typelaw.judge.Relater;
import works.typelaw.types.TypeFactory;
import works.typelaw.types.TypeId;

import static java.util.Objects.requireNonNull;

/**
 * Decides assignability: the {@link Judge}'s structural relation, adjusted by
 * an ordered list of {@link CompatRule}s and a {@link CompatProfile}.
 * <p>
 * The Lawyer never walks structure itself. For each pair of types, including
 * every nested pair Judge reaches, it asks its rules first; only a pair that
 * the rules send to {@link Verdict#STRUCTURAL} is compared member by member,
 * through a {@link Relater} that applies the profile's leniencies.
 * Rules with {@link CompatRule.Scope#TOP_LEVEL top-level scope} see only the
 * outermost pair.
 */
public final class Lawyer {
	private final Judge judge;
	private final Evaluator evaluator;
	private final TypeFactory factory;
	private final Limits limits;
	private final List<CompatRule> rules;
	private final @Nullable RelationCache cache;
	private final ConcurrentHashMap<CompatProfile, Relaters> relaters = new ConcurrentHashMap<>();

	public Lawyer(Judge judge, Limits limits) {
		this(judge, limits, CompatRules.defaults(), null);
	}

	public Lawyer(Judge judge, Limits limits, List<CompatRule> rules, @Nullable RelationCache cache) {
		this.judge = requireNonNull(judge);
		this.evaluator = judge.evaluator();
		this.factory = judge.factory();
		this.limits = requireNonNull(limits);
		this.rules = List.copyOf(rules);
		this.cache = cache;
	}

	public List<CompatRule> rules() {
		return rules;
	}

	public boolean isAssignable(TypeId source, TypeId target, CompatProfile profile) {
		return assignable(source, target, profile).ok();
	}

	public AssignabilityResult assignable(TypeId source, TypeId target, CompatProfile profile) {
		if (cache != null) {
			AssignabilityResult cached = cache.get(source, target, profile);
			if (cached != null) {
				return cached;
			}
		}
		QueryContext ctx = new QueryContext(limits);
		Relaters r = relaters(profile);
		boolean ok = judge.relate(source, target, ctx, r.top());
		AssignabilityResult result;
		if (ctx.truncated()) {
			LOGGER.debug("Assignability {} -> {} truncated by {}", source, target, ctx.exhaustedBudgets());
			result = AssignabilityResult.truncated(new FailureReason.BudgetExceeded(ctx.exhaustedBudgets()));
		} else if (ok) {
			LOGGER.trace("{} is assignable to {}", source, target);
			result = AssignabilityResult.OK;
		} else {
			FailureReason reason = explain(source, target, ctx, r);
			LOGGER.debug("{} is not assignable to {}: {}", source, target, reason);
			result = AssignabilityResult.rejected(reason);
		}
		if (cache != null) {
			cache.put(source, target, profile, result);
		}
		return result;
	}

	/**
	 * Relates two types as a nested pair of a query that is already running.
	 * Conditional types use this to decide their <code>extends</code> clause.
	 */
	public boolean relate(TypeId source, TypeId target, CompatProfile profile, QueryContext ctx) {
		return judge.relate(source, target, ctx, relaters(profile).nested());
	}

	/**
	 * The relater that applies every rule to the outermost pair, for callers
	 * that drive {@link Judge} themselves.
	 */
	public Relater relater(CompatProfile profile) {
		return relaters(profile).top();
	}

	private FailureReason explain(TypeId source, TypeId target, QueryContext ctx, Relaters r) {
		Verdict topLevel = decide(source, target, ctx, r.top());
		if (topLevel instanceof Verdict.Reject reject) {
			return reject.reason();
		}
		return judge.explain(source, target, ctx, r.nested());
	}

	private Relaters relaters(CompatProfile profile) {
		return relaters.computeIfAbsent(requireNonNull(profile), p -> {
			PolicyRelater nested = new PolicyRelater(p, false, null);
			return new Relaters(new PolicyRelater(p, true, nested), nested);
		});
	}

	/**
	 * Runs the rules in order until one decides.
	 * If none does, the pair is rejected.
	 */
	private Verdict decide(TypeId source, TypeId target, QueryContext ctx, PolicyRelater relater) {
		RuleContext context = new RuleContext(factory, evaluator, relater.profile, ctx, relater.nested(), relater.topLevel);
		for (CompatRule rule : rules) {
			if (rule.scope() == CompatRule.Scope.TOP_LEVEL && !relater.topLevel) {
				continue;
			}
			if (!relater.profile.isEnabled(rule.name())) {
				continue;
			}
			Verdict verdict = rule.check(source, target, context);
			if (verdict instanceof Verdict.Continue) {
				continue;
			}
			if (verdict instanceof Verdict.Reject reject) {
				LOGGER.trace("Rule {} rejected {} -> {}: {}", rule.name(), source, target, reject.reason());
			}
			return verdict;
		}
		return Verdict.reject(new FailureReason.TypeMismatch(source, target));
	}

	private record Relaters(PolicyRelater top, PolicyRelater nested) { }

	/**
	 * Relation memo entries made under different profiles, or at the top level
	 * versus nested, must not be confused.
	 */
	private record Mode(CompatProfile profile, boolean topLevel) { }

	private final class PolicyRelater implements Relater {
		final CompatProfile profile;
		final boolean topLevel;
		final Mode mode;
		private final @Nullable PolicyRelater nested;

		/**
		 * @param nested the relater for nested pairs, or null if this is that relater
		 */
		PolicyRelater(CompatProfile profile, boolean topLevel, @Nullable PolicyRelater nested) {
			this.profile = profile;
			this.topLevel = topLevel;
			this.mode = new Mode(profile, topLevel);
			this.nested = nested;
		}

		PolicyRelater nested() {
			return nested == null ? this : nested;
		}

		@Override
		public Object mode() {
			return mode;
		}

		@Override
		public boolean relate(TypeId source, TypeId target, QueryContext ctx) {
			return judge.relate(source, target, ctx, nested());
		}

		@Override
		public @Nullable Boolean preempt(TypeId source, TypeId target, QueryContext ctx) {
			Verdict verdict = decide(source, target, ctx, this);
			if (verdict instanceof Verdict.Structural) {
				return null;
			}
			return verdict instanceof Verdict.Accept;
		}

		@Override
		public @Nullable FailureReason preemptReason(TypeId source, TypeId target, QueryContext ctx) {
			return Optional.of(decide(source, target, ctx, this))
				.filter(Verdict.Reject.class::isInstance)
				.map(v -> ((Verdict.Reject) v).reason())
				.orElse(null);
		}

		@Override
		public boolean relateParameter(TypeId sourceParameter, TypeId targetParameter, boolean method, QueryContext ctx) {
			boolean bivariant = !profile.strictFunctionTypes() || (method && profile.bivariantMethodCheck());
			if (relate(targetParameter, sourceParameter, ctx)) {
				return true;
			}
			return bivariant && relate(sourceParameter, targetParameter, ctx);
		}

		@Override
		public boolean relateReturn(TypeId sourceReturn, TypeId targetReturn, QueryContext ctx) {
			if (profile.voidReturnLeniency() && targetReturn.equals(TypeId.VOID)) {
				return true;
			}
			return relate(sourceReturn, targetReturn, ctx);
		}

		@Override
		public boolean relateOptionalProperty(TypeId sourceType, TypeId targetType, QueryContext ctx) {
			if (profile.exactOptionalPropertyTypes()) {
				return relate(sourceType, targetType, ctx);
			}
			return relate(sourceType, factory.union(targetType, TypeId.UNDEFINED), ctx);
		}

		@Override
		public boolean allowsReadonlyToMutable() {
			return profile.readonlyPropertyLeniency();
		}

		@Override
		public String toString() {
			return "PolicyRelater{" +
				"profile=" + profile +
				", topLevel=" + topLevel +
				'}';
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Lawyer.class);
}
