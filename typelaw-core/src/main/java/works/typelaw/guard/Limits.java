package works.typelaw.guard;

import works.typelaw.exceptions.ConfigurationException;

/**
 * Budgets that bound the work any single query may do.
 * A query that exhausts one of these returns a conservative answer
 * and is marked truncated instead of running away.
 *
 * @param maxSubtypeDepth nesting depth of structural relation checks
 * @param maxRelationOperations total relation steps per query
 * @param maxInProgressPairs type pairs simultaneously under comparison
 * @param maxInstantiationDepth nested generic instantiations
 * @param maxEvaluationDepth nested evaluations of derived types
 * @param templateExpansionLimit literal combinations a template literal may expand to
 * @param maxMappedKeys keys a mapped type may produce
 * @param maxDistributionSize members an intersection may distribute over
 */
public record Limits(
	int maxSubtypeDepth,
	int maxRelationOperations,
	int maxInProgressPairs,
	int maxInstantiationDepth,
	int maxEvaluationDepth,
	int templateExpansionLimit,
	int maxMappedKeys,
	int maxDistributionSize
) {
	public static final Limits DEFAULT = new Limits(100, 100_000, 10_000, 50, 100, 100_000, 500, 100);

	public Limits {
		requirePositive("maxSubtypeDepth", maxSubtypeDepth);
		requirePositive("maxRelationOperations", maxRelationOperations);
		requirePositive("maxInProgressPairs", maxInProgressPairs);
		requirePositive("maxInstantiationDepth", maxInstantiationDepth);
		requirePositive("maxEvaluationDepth", maxEvaluationDepth);
		requirePositive("templateExpansionLimit", templateExpansionLimit);
		requirePositive("maxMappedKeys", maxMappedKeys);
		requirePositive("maxDistributionSize", maxDistributionSize);
	}

	private static void requirePositive(String name, int value) {
		if (value <= 0) {
			throw new ConfigurationException("Limit " + name + " must be positive; got " + value);
		}
	}

	public Limits withMaxSubtypeDepth(int value) {
		return new Limits(value, maxRelationOperations, maxInProgressPairs, maxInstantiationDepth, maxEvaluationDepth, templateExpansionLimit, maxMappedKeys, maxDistributionSize);
	}

	public Limits withMaxRelationOperations(int value) {
		return new Limits(maxSubtypeDepth, value, maxInProgressPairs, maxInstantiationDepth, maxEvaluationDepth, templateExpansionLimit, maxMappedKeys, maxDistributionSize);
	}

	public Limits withMaxInProgressPairs(int value) {
		return new Limits(maxSubtypeDepth, maxRelationOperations, value, maxInstantiationDepth, maxEvaluationDepth, templateExpansionLimit, maxMappedKeys, maxDistributionSize);
	}

	public Limits withMaxInstantiationDepth(int value) {
		return new Limits(maxSubtypeDepth, maxRelationOperations, maxInProgressPairs, value, maxEvaluationDepth, templateExpansionLimit, maxMappedKeys, maxDistributionSize);
	}

	public Limits withMaxEvaluationDepth(int value) {
		return new Limits(maxSubtypeDepth, maxRelationOperations, maxInProgressPairs, maxInstantiationDepth, value, templateExpansionLimit, maxMappedKeys, maxDistributionSize);
	}

	public Limits withTemplateExpansionLimit(int value) {
		return new Limits(maxSubtypeDepth, maxRelationOperations, maxInProgressPairs, maxInstantiationDepth, maxEvaluationDepth, value, maxMappedKeys, maxDistributionSize);
	}

	public Limits withMaxMappedKeys(int value) {
		return new Limits(maxSubtypeDepth, maxRelationOperations, maxInProgressPairs, maxInstantiationDepth, maxEvaluationDepth, templateExpansionLimit, value, maxDistributionSize);
	}

	public Limits withMaxDistributionSize(int value) {
		return new Limits(maxSubtypeDepth, maxRelationOperations, maxInProgressPairs, maxInstantiationDepth, maxEvaluationDepth, templateExpansionLimit, maxMappedKeys, value);
	}
}
