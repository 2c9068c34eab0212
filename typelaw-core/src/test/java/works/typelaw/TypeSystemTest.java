package works.typelaw;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import works.typelaw.env.Declaration;
import works.typelaw.env.DeclarationRegistry;
import works.typelaw.evaluate.EvaluationResult;
import works.typelaw.exceptions.ConfigurationException;
import works.typelaw.lawyer.CompatProfile;
import works.typelaw.lawyer.CompatRule;
import works.typelaw.lawyer.CompatRules;
import works.typelaw.lawyer.RelationCache;
import works.typelaw.lawyer.RuleContext;
import works.typelaw.lawyer.Verdict;
import works.typelaw.logging.MdcKeys;
import works.typelaw.types.PropertyInfo;
import works.typelaw.types.TypeId;
import works.typelaw.types.TypeInterner;
import works.typelaw.types.TypeParamInfo;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.typelaw.types.TypeId.NULL;
import static works.typelaw.types.TypeId.NUMBER;
import static works.typelaw.types.TypeId.STRING;

public class TypeSystemTest extends AbstractTypeLawTest {

	@Test
	void relationCache_answersRepeatQueries() {
		RelationCache cache = types.relationCache().orElseThrow();
		TypeId source = object(PropertyInfo.of("a", num(1)));
		TypeId target = object(PropertyInfo.of("a", NUMBER));
		assertTrue(types.isAssignable(source, target));
		long hits = cache.hits();
		assertTrue(types.isAssignable(source, target));
		assertEquals(hits + 1, cache.hits());
	}

	@Test
	void relationCache_canBeDisabled() {
		TypeSystem uncached = new TypeSystem(registry, TypeSystemConfig.builder().relationCache(false).build());
		assertTrue(uncached.relationCache().isEmpty());
		assertTrue(uncached.isAssignable(NULL, STRING));
	}

	@Test
	void configValidation() {
		assertThrows(ConfigurationException.class, () -> TypeSystemConfig.builder().relationCacheCapacity(-1));
		assertEquals(0, TypeSystemConfig.builder().relationCacheCapacity(0).build().relationCacheCapacity());
		assertEquals(TypeSystemConfig.DEFAULT_RELATION_CACHE_CAPACITY, TypeSystemConfig.simple().relationCacheCapacity());
		assertEquals(CompatRules.defaults().size(), TypeSystemConfig.simple().rules().size());
	}

	@Test
	void conditionalTypes_useTheDefaultProfile() {
		TypeId isString = generic("IsString", List.of(TypeParamInfo.of("T")),
			f -> f.conditional(f.tuple(f.typeParameter("T")), f.tuple(STRING), f.literal("y"), f.literal("n")));

		assertEquals(str("y"), types.evaluate(apply(isString, NULL)).type());

		DeclarationRegistry strictRegistry = new DeclarationRegistry();
		TypeSystem strict = new TypeSystem(strictRegistry, TypeSystemConfig.builder()
			.defaultProfile(CompatProfile.STRICT)
			.build());
		TypeId strictIsString = strict.factory().lazy(strictRegistry.register(Declaration.alias(
			"IsString", List.of(TypeParamInfo.of("T")),
			f -> f.conditional(f.tuple(f.typeParameter("T")), f.tuple(STRING), f.literal("y"), f.literal("n")))));
		EvaluationResult result = strict.evaluate(strict.factory().application(strictIsString, NULL));
		assertEquals(strict.factory().literal("n"), result.type());
	}

	@Test
	void sessionsMayShareAnInterner() {
		TypeInterner shared = new TypeInterner();
		TypeSystem first = new TypeSystem(shared, new DeclarationRegistry(), TypeSystemConfig.simple());
		TypeSystem second = new TypeSystem(shared, new DeclarationRegistry(), TypeSystemConfig.simple());
		TypeId a = first.factory().object(PropertyInfo.of("a", STRING));
		TypeId b = second.factory().object(PropertyInfo.of("a", STRING));
		assertEquals(a, b);
		assertTrue(second.isSubtype(a, b));
	}

	@Test
	void queries_runWithSessionMDC() {
		List<String> seen = new ArrayList<>();
		CompatRule spy = new CompatRule() {
			@Override
			public String name() {
				return "spy";
			}

			@Override
			public Scope scope() {
				return Scope.TOP_LEVEL;
			}

			@Override
			public Verdict check(TypeId source, TypeId target, RuleContext context) {
				seen.add(MDC.get(MdcKeys.SESSION) + "/" + MDC.get(MdcKeys.QUERY));
				return Verdict.CONTINUE;
			}
		};
		List<CompatRule> rules = new ArrayList<>();
		rules.add(spy);
		rules.addAll(CompatRules.defaults());
		TypeSystem spied = new TypeSystem(registry, TypeSystemConfig.builder()
			.sessionName("checker-1")
			.rules(rules)
			.relationCache(false)
			.build());

		MDC.put(MdcKeys.QUERY, "outer");
		try {
			assertFalse(spied.isAssignable(NUMBER, STRING));
			assertEquals("checker-1/assignable", seen.get(0));
			assertEquals("outer", MDC.get(MdcKeys.QUERY), "Previous value is restored");
			assertNull(MDC.get(MdcKeys.SESSION));
		} finally {
			MDC.remove(MdcKeys.QUERY);
		}
	}

	@Test
	void format() {
		TypeId point = alias("Point", f -> f.object(PropertyInfo.of("x", NUMBER), PropertyInfo.of("y", NUMBER)));
		assertEquals("Point", types.format(point));
		assertEquals("{ x: number; y: number; }", types.format(f.object(PropertyInfo.of("x", NUMBER), PropertyInfo.of("y", NUMBER))));
		assertEquals("string | Point", types.format(f.union(STRING, point)));
	}
}
