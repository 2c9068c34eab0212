package works.typelaw.guard;

import org.junit.jupiter.api.Test;
import works.typelaw.exceptions.ConfigurationException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class LimitsTest {

	@Test
	void defaults() {
		Limits limits = Limits.DEFAULT;
		assertEquals(100, limits.maxSubtypeDepth());
		assertEquals(100_000, limits.maxRelationOperations());
		assertEquals(10_000, limits.maxInProgressPairs());
		assertEquals(50, limits.maxInstantiationDepth());
		assertEquals(100, limits.maxEvaluationDepth());
		assertEquals(100_000, limits.templateExpansionLimit());
		assertEquals(500, limits.maxMappedKeys());
		assertEquals(100, limits.maxDistributionSize());
	}

	@Test
	void withX_changesOnlyThatLimit() {
		Limits changed = Limits.DEFAULT.withMaxMappedKeys(3);
		assertEquals(3, changed.maxMappedKeys());
		assertEquals(Limits.DEFAULT.withMaxMappedKeys(500), Limits.DEFAULT);
		assertEquals(Limits.DEFAULT.maxSubtypeDepth(), changed.maxSubtypeDepth());
	}

	@Test
	void nonPositiveLimit_rejected() {
		ConfigurationException e = assertThrows(ConfigurationException.class, () -> Limits.DEFAULT.withMaxSubtypeDepth(0));
		assertThat(e.getMessage(), containsString("maxSubtypeDepth"));
		assertThrows(ConfigurationException.class, () -> Limits.DEFAULT.withTemplateExpansionLimit(-5));
	}
}
