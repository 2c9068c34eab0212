package works.typelaw.env;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import works.typelaw.types.DefId;
import works.typelaw.types.PropertyInfo;
import works.typelaw.types.TypeFactory;
import works.typelaw.types.TypeId;
import works.typelaw.types.TypeInterner;
import works.typelaw.types.TypeParamInfo;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.typelaw.types.TypeId.NUMBER;
import static works.typelaw.types.TypeId.STRING;
import static works.typelaw.types.TypeId.UNRESOLVED;

public class TypeEnvironmentTest {
	DeclarationRegistry registry;
	TypeFactory f;
	TypeEnvironment env;

	@BeforeEach
	void setup() {
		registry = new DeclarationRegistry();
		f = new TypeFactory(new TypeInterner());
		env = new TypeEnvironment(f, registry, BuiltinLibrary.create(f));
	}

	@Test
	void unknownDeclaration_isUnresolved() {
		DefId missing = registry.reserve();
		assertTrue(env.resolve(missing).isEmpty());
		assertEquals(UNRESOLVED, env.declaredType(missing));
		assertEquals(UNRESOLVED, env.valueType(missing));
		assertEquals(List.of(), env.typeParameters(missing));
	}

	@Test
	void lateDeclaration_resolvesOnceDefined() {
		DefId def = registry.reserve();
		assertEquals(UNRESOLVED, env.declaredType(def));
		registry.define(def, Declaration.alias("Late", f -> STRING));
		assertEquals(STRING, env.declaredType(def), "Unresolved outcome must not be cached");
	}

	@Test
	void lowering_happensOnce() {
		AtomicInteger lowerings = new AtomicInteger();
		DefId def = registry.register(Declaration.alias("Counted", f -> {
			lowerings.incrementAndGet();
			return f.object(PropertyInfo.of("a", NUMBER));
		}));
		Resolution first = env.resolve(def).orElseThrow();
		Resolution second = env.resolve(def).orElseThrow();
		assertSame(first, second);
		assertEquals(1, lowerings.get());
		assertEquals("Counted", first.name());
		assertEquals(DeclarationKind.TYPE_ALIAS, first.kind());
	}

	@Test
	void selfReferenceThroughLazy_isFine() {
		DefId def = registry.reserve();
		registry.define(def, Declaration.interfaceDeclaration("Node", List.of(),
			f -> f.object(PropertyInfo.of("next", f.lazy(def)))));
		TypeId node = env.declaredType(def);
		assertEquals(f.object(PropertyInfo.of("next", f.lazy(def))), node);
	}

	@Test
	void eagerSelfReference_isUnresolvedInside() {
		AtomicReference<TypeId> seenInside = new AtomicReference<>();
		DefId def = registry.reserve();
		registry.define(def, Declaration.alias("Eager", f -> {
			seenInside.set(env.declaredType(def));
			return STRING;
		}));
		assertEquals(STRING, env.declaredType(def));
		assertEquals(UNRESOLVED, seenInside.get());
	}

	@Test
	void eagerSelfReference_whileAnotherThreadLowers() throws Exception {
		CountDownLatch firstLowering = new CountDownLatch(1);
		CountDownLatch release = new CountDownLatch(1);
		AtomicInteger lowerings = new AtomicInteger();
		AtomicReference<TypeId> seenInside = new AtomicReference<>();
		DefId def = registry.reserve();
		registry.define(def, Declaration.alias("Contended", f -> {
			if (lowerings.incrementAndGet() == 1) {
				firstLowering.countDown();
				awaitQuietly(release);
			} else {
				seenInside.set(env.declaredType(def));
			}
			return STRING;
		}));

		ExecutorService executor = Executors.newFixedThreadPool(2);
		try {
			Future<TypeId> blocked = executor.submit(() -> env.declaredType(def));
			assertTrue(firstLowering.await(10, TimeUnit.SECONDS));
			Future<TypeId> eager = executor.submit(() -> env.declaredType(def));
			assertEquals(STRING, eager.get(10, TimeUnit.SECONDS));
			assertEquals(UNRESOLVED, seenInside.get());
			release.countDown();
			assertEquals(STRING, blocked.get(10, TimeUnit.SECONDS));
			assertEquals(2, lowerings.get());
		} finally {
			release.countDown();
			executor.shutdownNow();
		}
	}

	private static void awaitQuietly(CountDownLatch latch) {
		try {
			if (!latch.await(10, TimeUnit.SECONDS)) {
				throw new IllegalStateException("Timed out waiting for release");
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException(e);
		}
	}

	@Test
	void genericDeclaration_exposesTypeParameters() {
		TypeParamInfo t = TypeParamInfo.of("T");
		DefId box = registry.register(Declaration.alias("Box", List.of(t), f -> f.object(PropertyInfo.of("value", f.typeParameter(t)))));
		assertEquals(List.of(t), env.typeParameters(box));
		assertTrue(env.resolve(box).orElseThrow().isGeneric());
	}

	@Test
	void valueTypes() {
		DefId variable = registry.register(Declaration.variable("answer", f -> NUMBER));
		assertEquals(NUMBER, env.valueType(variable));
		assertEquals(UNRESOLVED, env.declaredType(variable), "A variable is not a type");

		TypeId instance = f.object(PropertyInfo.of("x", NUMBER));
		DefId point = registry.register(Declaration.classDeclaration("Point", List.of(),
			f -> instance,
			f -> f.constructor(List.of(), instance)));
		assertEquals(instance, env.declaredType(point));
		assertEquals(f.constructor(List.of(), instance), env.valueType(point));

		DefId alias = registry.register(Declaration.alias("Alias", f -> STRING));
		assertEquals(UNRESOLVED, env.valueType(alias));
	}

	@Test
	void nameOf_doesNotLower() {
		AtomicInteger lowerings = new AtomicInteger();
		DefId def = registry.register(Declaration.alias("Named", f -> {
			lowerings.incrementAndGet();
			return STRING;
		}));
		assertEquals("Named", env.nameOf(def));
		assertEquals(0, lowerings.get());
		DefId undefinedYet = registry.reserve();
		assertEquals(undefinedYet.toString(), env.nameOf(undefinedYet));
	}

	@Test
	void redefinition_rejected() {
		DefId def = registry.register(Declaration.alias("Once", f -> STRING));
		assertThrows(IllegalStateException.class, () -> registry.define(def, Declaration.alias("Twice", f -> NUMBER)));
	}

	@Test
	void concurrentResolution_agrees() throws Exception {
		DefId def = registry.register(Declaration.alias("Shared", f -> f.object(PropertyInfo.of("a", STRING))));
		ExecutorService executor = Executors.newFixedThreadPool(4);
		try {
			List<Callable<Resolution>> tasks = new ArrayList<>();
			for (int i = 0; i < 16; i++) {
				tasks.add(() -> env.resolve(def).orElseThrow());
			}
			Resolution expected = env.resolve(def).orElseThrow();
			for (Future<Resolution> result : executor.invokeAll(tasks)) {
				assertSame(expected, result.get());
			}
		} finally {
			executor.shutdownNow();
		}
	}

	@Test
	void builtinLibrary_hasRootObject() {
		LibraryTypes library = env.library();
		assertFalse(f.interner().objectShapeOf(library.rootObject()).isEmpty());
		assertEquals("T", library.arrayElement().name());
	}
}
