package works.typelaw.guard;

import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.typelaw.types.TypeId;

import static java.util.Objects.requireNonNull;

/**
 * Per-query scratch state: budgets, relation memo, and evaluation caches.
 * <p>
 * One context lives for the duration of one top-level question and
 * is confined to the thread asking it. Anything that must outlive a query
 * belongs in a shared cache instead.
 */
public final class QueryContext {
	private final Limits limits;
	private final CycleTracker<RelationKey> relations;
	private final Map<TypeId, TypeId> evaluations = new HashMap<>();
	private final Map<InstantiationKey, TypeId> instantiations = new HashMap<>();
	private final EnumSet<Budget> exhausted = EnumSet.noneOf(Budget.class);

	private int relationDepth = 0;
	private int relationOperations = 0;
	private int instantiationDepth = 0;
	private int evaluationDepth = 0;

	public QueryContext(Limits limits) {
		this.limits = requireNonNull(limits);
		this.relations = new CycleTracker<>(limits.maxInProgressPairs());
	}

	public Limits limits() {
		return limits;
	}

	public CycleTracker<RelationKey> relations() {
		return relations;
	}

	/**
	 * Counts one relation step.
	 *
	 * @return false if the operation budget is spent
	 */
	public boolean tick() {
		if (++relationOperations > limits.maxRelationOperations()) {
			exhaust(Budget.RELATION_OPERATIONS);
			return false;
		}
		return true;
	}

	/**
	 * @return false if the relation would nest too deeply, in which case
	 * the caller must not call {@link #exitRelation}
	 */
	public boolean enterRelation() {
		if (relationDepth >= limits.maxSubtypeDepth()) {
			exhaust(Budget.SUBTYPE_DEPTH);
			return false;
		}
		relationDepth++;
		return true;
	}

	public void exitRelation() {
		relationDepth--;
	}

	public boolean enterInstantiation() {
		if (instantiationDepth >= limits.maxInstantiationDepth()) {
			exhaust(Budget.INSTANTIATION_DEPTH);
			return false;
		}
		instantiationDepth++;
		return true;
	}

	public void exitInstantiation() {
		instantiationDepth--;
	}

	public boolean enterEvaluation() {
		if (evaluationDepth >= limits.maxEvaluationDepth()) {
			exhaust(Budget.EVALUATION_DEPTH);
			return false;
		}
		evaluationDepth++;
		return true;
	}

	public void exitEvaluation() {
		evaluationDepth--;
	}

	public void exhaust(Budget budget) {
		if (exhausted.add(budget)) {
			LOGGER.debug("Query exhausted {} budget", budget);
		}
	}

	/**
	 * @return true if any budget ran out, meaning answers from this query are conservative
	 */
	public boolean truncated() {
		return !exhausted.isEmpty();
	}

	public Set<Budget> exhaustedBudgets() {
		return Collections.unmodifiableSet(exhausted);
	}

	public int relationOperations() {
		return relationOperations;
	}

	public TypeId cachedEvaluation(TypeId id) {
		return evaluations.get(id);
	}

	public void cacheEvaluation(TypeId id, TypeId result) {
		evaluations.put(id, result);
	}

	public TypeId cachedInstantiation(TypeId generic, List<TypeId> arguments) {
		return instantiations.get(new InstantiationKey(generic, arguments));
	}

	public void cacheInstantiation(TypeId generic, List<TypeId> arguments, TypeId result) {
		instantiations.put(new InstantiationKey(generic, List.copyOf(arguments)), result);
	}

	private record InstantiationKey(TypeId generic, List<TypeId> arguments) { }

	private static final Logger LOGGER = LoggerFactory.getLogger(QueryContext.class);
}
