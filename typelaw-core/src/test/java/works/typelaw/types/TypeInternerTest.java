package works.typelaw.types;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;
import works.typelaw.exceptions.InvalidTypeException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TypeInternerTest {

	@Test
	void equalKeys_sameId() {
		TypeInterner interner = new TypeInterner();
		TypeId first = interner.intern(new TypeKey.Literal(LiteralValue.of("hello")));
		TypeId second = interner.intern(new TypeKey.Literal(LiteralValue.of("hello")));
		assertEquals(first, second);
		assertEquals(new TypeKey.Literal(LiteralValue.of("hello")), interner.lookup(first));
		assertEquals(1, interner.size());
	}

	@Test
	void differentKeys_differentIds() {
		TypeInterner interner = new TypeInterner();
		TypeId a = interner.intern(new TypeKey.Literal(LiteralValue.of("a")));
		TypeId b = interner.intern(new TypeKey.Literal(LiteralValue.of("b")));
		TypeId one = interner.intern(new TypeKey.Literal(LiteralValue.of(1)));
		assertNotEquals(a, b);
		assertNotEquals(a, one);
		assertTrue(!a.isIntrinsic() && !b.isIntrinsic(), "Literals are not intrinsic");
	}

	@Test
	void intrinsicKeys_internToReservedIds() {
		TypeInterner interner = new TypeInterner();
		for (PrimitiveKind p : PrimitiveKind.values()) {
			assertEquals(p.id(), interner.intern(new TypeKey.Primitive(p)), p.keyword());
		}
		assertEquals(TypeId.TRUE, interner.intern(new TypeKey.Literal(LiteralValue.of(true))));
		assertEquals(TypeId.FALSE, interner.intern(new TypeKey.Literal(LiteralValue.of(false))));
		assertEquals(0, interner.size(), "Intrinsics don't occupy the dynamic table");
	}

	@Test
	void emptyObject_isIntrinsic() {
		TypeFactory factory = new TypeFactory(new TypeInterner());
		assertEquals(TypeId.EMPTY_OBJECT, factory.object(ObjectShape.EMPTY));
		assertEquals(TypeId.EMPTY_OBJECT, factory.object());
	}

	@Test
	void negativeZero_isZero() {
		TypeFactory factory = new TypeFactory(new TypeInterner());
		assertEquals(factory.literal(0.0), factory.literal(-0.0));
	}

	@Test
	void foreignId_throws() {
		TypeInterner mine = new TypeInterner();
		TypeInterner theirs = new TypeInterner();
		TypeId foreign = theirs.intern(new TypeKey.Literal(LiteralValue.of("elsewhere")));
		InvalidTypeException e = assertThrows(InvalidTypeException.class, () -> mine.lookup(foreign));
		assertThat(e.getMessage(), containsString(String.valueOf(foreign.index())));
	}

	@Test
	void negativeIndex_rejected() {
		assertThrows(IllegalArgumentException.class, () -> new TypeId(-1));
	}

	@Test
	void concurrentInterning_agreesOnIds() throws Exception {
		TypeInterner interner = new TypeInterner();
		int threads = 8;
		int keys = 2_000;
		ExecutorService executor = Executors.newFixedThreadPool(threads);
		try {
			List<Callable<List<TypeId>>> tasks = new ArrayList<>();
			for (int t = 0; t < threads; t++) {
				tasks.add(() -> {
					List<TypeId> ids = new ArrayList<>(keys);
					for (int k = 0; k < keys; k++) {
						ids.add(interner.intern(new TypeKey.Literal(LiteralValue.of("key" + k))));
					}
					return ids;
				});
			}
			List<Future<List<TypeId>>> results = executor.invokeAll(tasks);
			List<TypeId> expected = results.get(0).get();
			for (Future<List<TypeId>> result : results) {
				assertEquals(expected, result.get());
			}
			assertEquals(keys, interner.size());
			for (int k = 0; k < keys; k++) {
				assertEquals(new TypeKey.Literal(LiteralValue.of("key" + k)), interner.lookup(expected.get(k)));
			}
		} finally {
			executor.shutdownNow();
		}
	}

	@Test
	void sideTables_internByValue() {
		TypeInterner interner = new TypeInterner();
		Handle<List<TypeId>> first = interner.typeList(List.of(TypeId.STRING, TypeId.NUMBER));
		Handle<List<TypeId>> second = interner.typeList(new ArrayList<>(List.of(TypeId.STRING, TypeId.NUMBER)));
		assertEquals(first, second);
		assertEquals(List.of(TypeId.STRING, TypeId.NUMBER), interner.typeList(first));
	}

	@Test
	void objectShapeOf_nonObject_throws() {
		TypeInterner interner = new TypeInterner();
		assertThrows(InvalidTypeException.class, () -> interner.objectShapeOf(TypeId.STRING));
		assertThrows(InvalidTypeException.class, () -> interner.functionShapeOf(TypeId.EMPTY_OBJECT));
	}
}
