package works.typelaw.guard;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import works.typelaw.types.TypeId;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class QueryContextTest {

	@Test
	void operationBudget_truncates() {
		QueryContext ctx = new QueryContext(Limits.DEFAULT.withMaxRelationOperations(2));
		assertTrue(ctx.tick());
		assertTrue(ctx.tick());
		assertFalse(ctx.truncated());
		assertFalse(ctx.tick());
		assertTrue(ctx.truncated());
		assertEquals(Set.of(Budget.RELATION_OPERATIONS), ctx.exhaustedBudgets());
	}

	@Test
	void depthBudgets_areReleasedOnExit() {
		QueryContext ctx = new QueryContext(Limits.DEFAULT.withMaxSubtypeDepth(1).withMaxInstantiationDepth(1));
		assertTrue(ctx.enterRelation());
		ctx.exitRelation();
		assertTrue(ctx.enterRelation());
		assertFalse(ctx.enterRelation());
		ctx.exitRelation();

		assertTrue(ctx.enterInstantiation());
		assertFalse(ctx.enterInstantiation());
		ctx.exitInstantiation();

		assertEquals(Set.of(Budget.SUBTYPE_DEPTH, Budget.INSTANTIATION_DEPTH), ctx.exhaustedBudgets());
	}

	@Test
	void caches_arePerContext() {
		QueryContext first = new QueryContext(Limits.DEFAULT);
		QueryContext second = new QueryContext(Limits.DEFAULT);
		TypeId generic = new TypeId(100);
		first.cacheEvaluation(generic, TypeId.STRING);
		first.cacheInstantiation(generic, List.of(TypeId.NUMBER), TypeId.NUMBER);

		assertEquals(TypeId.STRING, first.cachedEvaluation(generic));
		assertEquals(TypeId.NUMBER, first.cachedInstantiation(generic, List.of(TypeId.NUMBER)));
		assertNull(first.cachedInstantiation(generic, List.of(TypeId.STRING)));
		assertNull(second.cachedEvaluation(generic));
	}
}
