package works.typelaw.testing;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import works.typelaw.TypeSystemConfig;
import works.typelaw.evaluate.EvaluationResult;
import works.typelaw.guard.Budget;
import works.typelaw.types.TemplateSpan;
import works.typelaw.types.TypeFactory;
import works.typelaw.types.TypeId;
import works.typelaw.types.TypeKey;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.typelaw.types.TypeId.ANY;
import static works.typelaw.types.TypeId.NUMBER;
import static works.typelaw.types.TypeId.STRING;

/**
 * Checks properties of type evaluation that hold regardless of compatibility policy.
 * <p>
 * Use this by extending it and supplying a value for
 * the {@link #config} to test.
 */
public abstract class EvaluatorConformanceTest extends AbstractTypeSystemTest {
	// Subclass can initialize this as desired
	protected TypeSystemConfig config = TypeSystemConfig.simple();

	@Test
	void nonDerivedTypes_evaluateToThemselves() {
		setupTypeSystems(config);
		for (TypeId t : fixtures.concrete()) {
			TypeKey.Kind kind = types.interner().kindOf(t);
			if (kind.isDerived() || kind.isReference()) {
				continue;
			}
			EvaluationResult result = types.evaluate(t);
			assertEquals(t, result.type(), () -> types.format(t));
			assertFalse(result.truncated());
		}
	}

	@Test
	void evaluation_isIdempotent() {
		setupTypeSystems(config);
		for (TypeId d : fixtures.derived()) {
			EvaluationResult once = types.evaluate(d);
			assertFalse(once.truncated(), () -> types.format(d));
			EvaluationResult twice = types.evaluate(once.type());
			assertEquals(once.type(), twice.type(), () -> types.format(d) + " evaluated to " + types.format(once.type()));
		}
	}

	@Test
	void evaluation_isDeterministicAcrossSessions() {
		setupTypeSystems(config);
		for (TypeId d : fixtures.derived()) {
			assertEquals(types.evaluate(d).type(), canonical.evaluate(d).type(), () -> types.format(d));
		}
	}

	@Test
	void distributiveConditional_isUnionOfMembers() {
		setupTypeSystems(config);
		TypeFactory f = types.factory();
		TypeId letters = fixtures.literals("letter", 5);
		TypeId excluded = f.union(f.literal("letter1"), f.literal("letter3"));
		List<TypeId> perMember = new ArrayList<>();
		for (TypeId member : types.interner().unionMembers(letters)) {
			perMember.add(types.evaluate(f.application(fixtures.exclude, member, excluded)).type());
		}
		TypeId whole = types.evaluate(f.application(fixtures.exclude, letters, excluded)).type();
		assertEquals(f.union(perMember), whole);
		assertEquals(f.union(f.literal("letter0"), f.literal("letter2"), f.literal("letter4")), whole);
	}

	@Test
	void keyOf_namesEveryProperty() {
		setupTypeSystems(config);
		TypeFactory f = types.factory();
		assertEquals(f.union(f.literal("x"), f.literal("y")), types.keyOf(fixtures.point).type());
		assertEquals(f.union(f.literal("value"), f.literal("next")), types.keyOf(fixtures.stringList).type());
	}

	@Test
	void mappedTypes_preserveEveryKey() {
		setupTypeSystems(config);
		TypeFactory f = types.factory();
		TypeId partialPoint = types.evaluate(f.application(fixtures.partial, fixtures.point)).type();
		assertEquals(types.keyOf(fixtures.point).type(), types.keyOf(partialPoint).type());
		assertTrue(types.isAssignable(types.factory().object(), partialPoint));
		assertTrue(types.isAssignable(fixtures.point, partialPoint));
		assertFalse(types.isSubtype(partialPoint, fixtures.point));
	}

	@Test
	void runawayInstantiation_terminates() {
		setupTypeSystems(config);
		EvaluationResult result = types.evaluate(types.factory().application(fixtures.nest, STRING));
		assertEquals(ANY, result.type());
		assertTrue(result.truncated());
	}

	@Test
	void oversizedTemplate_widensToString() {
		setupTypeSystems(config);
		TypeFactory f = types.factory();
		TypeId digit = fixtures.literals("", 10);
		List<TemplateSpan> spans = new ArrayList<>();
		long combinations = 1;
		while (combinations <= config.limits().templateExpansionLimit()) {
			spans.add(TemplateSpan.placeholder(digit));
			combinations *= 10;
		}
		EvaluationResult result = types.evaluate(f.templateLiteral(spans));
		assertEquals(STRING, result.type());
		assertTrue(result.exhausted().contains(Budget.TEMPLATE_EXPANSION));
	}

	@Test
	void indexAccess_readsPropertyTypes() {
		setupTypeSystems(config);
		TypeFactory f = types.factory();
		assertEquals(NUMBER, types.indexAccess(fixtures.point, f.literal("x")).type());
		assertEquals(f.union(STRING, NUMBER), types.indexAccess(fixtures.pair, NUMBER).type());
	}
}
