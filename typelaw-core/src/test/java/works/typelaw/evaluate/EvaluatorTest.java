package works.typelaw.evaluate;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import works.typelaw.AbstractTypeLawTest;
import works.typelaw.env.Declaration;
import works.typelaw.guard.Budget;
import works.typelaw.types.ObjectShape;
import works.typelaw.types.ParamInfo;
import works.typelaw.types.PropertyInfo;
import works.typelaw.types.StringIntrinsicKind;
import works.typelaw.types.TemplateSpan;
import works.typelaw.types.TupleElement;
import works.typelaw.types.TypeId;
import works.typelaw.types.TypeParamInfo;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.typelaw.types.TypeId.ANY;
import static works.typelaw.types.TypeId.BOOLEAN;
import static works.typelaw.types.TypeId.FALSE;
import static works.typelaw.types.TypeId.NEVER;
import static works.typelaw.types.TypeId.NUMBER;
import static works.typelaw.types.TypeId.STRING;
import static works.typelaw.types.TypeId.SYMBOL;
import static works.typelaw.types.TypeId.TRUE;
import static works.typelaw.types.TypeId.UNDEFINED;
import static works.typelaw.types.TypeId.UNRESOLVED;

public class EvaluatorTest extends AbstractTypeLawTest {

	TypeId evaluate(TypeId id) {
		EvaluationResult result = types.evaluate(id);
		assertFalse(result.truncated(), () -> "Unexpected truncation: " + result.exhausted());
		return result.type();
	}

	@Test
	void exclude_distributes() {
		TypeId abc = f.union(str("a"), str("b"), str("c"));
		assertEquals(f.union(str("b"), str("c")), evaluate(apply(excludeAlias(), abc, str("a"))));
	}

	@Test
	void extract_splitsBoolean() {
		TypeId source = f.union(STRING, NUMBER, BOOLEAN);
		assertEquals(f.union(STRING, BOOLEAN), evaluate(apply(extractAlias(), source, f.union(STRING, BOOLEAN))));
	}

	@Test
	void distributiveConditional_overNever_isNever() {
		TypeId naive = generic("NaiveIsNever", List.of(TypeParamInfo.of("T")),
			f -> f.conditional(f.typeParameter("T"), NEVER, TRUE, FALSE));
		assertEquals(NEVER, evaluate(apply(naive, NEVER)));
	}

	@Test
	void wrappedConditional_overNever_decides() {
		assertEquals(TRUE, evaluate(apply(isNeverAlias(), NEVER)));
		assertEquals(FALSE, evaluate(apply(isNeverAlias(), STRING)));
		assertEquals(FALSE, evaluate(apply(isNeverAlias(), f.union(str("a"), str("b")))), "The union is compared whole");
	}

	@Test
	void conditional_anyCheck_takesBothBranches() {
		assertEquals(f.union(str("y"), str("n")), evaluate(f.conditional(ANY, STRING, str("y"), str("n"))));
	}

	@Test
	void conditional_withFreeParameter_isDeferred() {
		TypeId deferred = f.conditional(param("T"), STRING, TRUE, FALSE);
		assertEquals(deferred, evaluate(deferred));
	}

	@Test
	void returnType_infers() {
		TypeId fn = f.function(List.of(), STRING);
		assertEquals(STRING, evaluate(apply(returnTypeAlias(), fn)));
		assertEquals(ANY, evaluate(apply(returnTypeAlias(), ANY)));
	}

	@Test
	void parameters_infersTuple() {
		TypeId fn = f.function(List.of(ParamInfo.of("a", STRING), ParamInfo.of("b", NUMBER)), TypeId.VOID);
		TypeId expected = f.tuple(List.of(
			new TupleElement(STRING, "a", false, false),
			new TupleElement(NUMBER, "b", false, false)));
		assertEquals(expected, evaluate(apply(parametersAlias(), fn)));
		assertEquals(NEVER, evaluate(apply(parametersAlias(), STRING)));
	}

	@Test
	void templateInference_splitsAtFirstSeparator() {
		TypeId head = generic("Head", List.of(TypeParamInfo.of("T")), f -> f.conditional(
			f.typeParameter("T"),
			f.templateLiteral(TemplateSpan.placeholder(f.infer("H")), TemplateSpan.text("-"), TemplateSpan.placeholder(f.infer("R"))),
			f.typeParameter("H"),
			NEVER));
		assertEquals(str("foo"), evaluate(apply(head, str("foo-bar-baz"))));
		assertEquals(NEVER, evaluate(apply(head, str("nodash"))));
	}

	@Test
	void partial_makesEveryPropertyOptional() {
		TypeId source = object(PropertyInfo.of("a", NUMBER), PropertyInfo.of("b", STRING));
		ObjectShape shape = shapeOf(evaluate(apply(partialAlias(), source)));
		assertEquals(2, shape.properties().size());
		PropertyInfo a = shape.property("a");
		assertNotNull(a);
		assertTrue(a.optional());
		assertFalse(a.readonly());
		assertEquals(NUMBER, a.readType());
		assertTrue(shape.property("b").optional());
		assertEquals(STRING, shape.property("b").readType());
	}

	@Test
	void partial_isIdempotentOnOptionalProperties() {
		TypeId source = object(PropertyInfo.optional("a", NUMBER));
		assertEquals(source, evaluate(apply(partialAlias(), source)));
	}

	@Test
	void required_dropsOptionalityAndUndefined() {
		TypeId source = object(PropertyInfo.optional("a", NUMBER), PropertyInfo.readonly("b", STRING));
		ObjectShape shape = shapeOf(evaluate(apply(requiredAlias(), source)));
		assertFalse(shape.property("a").optional());
		assertEquals(NUMBER, shape.property("a").readType());
		assertTrue(shape.property("b").readonly(), "Readonly is preserved");
	}

	@Test
	void readonly_addsReadonly() {
		TypeId source = object(PropertyInfo.of("a", NUMBER), PropertyInfo.optional("b", STRING));
		ObjectShape shape = shapeOf(evaluate(apply(readonlyAlias(), source)));
		assertTrue(shape.property("a").readonly());
		assertFalse(shape.property("a").optional());
		assertTrue(shape.property("b").readonly());
		assertTrue(shape.property("b").optional(), "Optionality is preserved");
	}

	@Test
	void readonly_overArray_isReadonlyArray() {
		assertEquals(f.readonlyArray(STRING), evaluate(apply(readonlyAlias(), f.array(STRING))));
	}

	@Test
	void record_overLiteralKeys() {
		ObjectShape shape = shapeOf(evaluate(apply(recordAlias(), f.union(str("a"), str("b")), NUMBER)));
		assertEquals(2, shape.properties().size());
		assertEquals(NUMBER, shape.property("a").readType());
		assertEquals(NUMBER, shape.property("b").readType());
		assertNull(shape.stringIndex());
	}

	@Test
	void record_overString_isIndexSignature() {
		ObjectShape shape = shapeOf(evaluate(apply(recordAlias(), STRING, NUMBER)));
		assertTrue(shape.properties().isEmpty());
		assertEquals(NUMBER, shape.stringIndex().valueType());
	}

	@Test
	void evaluation_isIdempotent() {
		TypeId once = evaluate(apply(partialAlias(), object(PropertyInfo.of("a", NUMBER))));
		assertEquals(once, evaluate(once));
		TypeId excluded = evaluate(apply(excludeAlias(), f.union(str("a"), str("b")), str("a")));
		assertEquals(excluded, evaluate(excluded));
	}

	@Test
	void templateLiteral_expandsCrossProduct() {
		TypeId template = f.templateLiteral(
			TemplateSpan.placeholder(f.union(str("a"), str("b"))),
			TemplateSpan.text("-"),
			TemplateSpan.placeholder(f.union(str("x"), str("y"))));
		assertEquals(f.union(str("a-x"), str("a-y"), str("b-x"), str("b-y")), evaluate(template));
	}

	@Test
	void templateLiteral_overBudget_widensToString() {
		List<TypeId> digits = new ArrayList<>();
		for (int d = 0; d < 10; d++) {
			digits.add(str(String.valueOf(d)));
		}
		TypeId digit = f.union(digits);
		List<TemplateSpan> spans = new ArrayList<>();
		for (int i = 0; i < 6; i++) {
			spans.add(TemplateSpan.placeholder(digit));
		}
		EvaluationResult result = types.evaluate(f.templateLiteral(spans));
		assertEquals(STRING, result.type());
		assertTrue(result.truncated());
		assertTrue(result.exhausted().contains(Budget.TEMPLATE_EXPANSION));
	}

	@Test
	void templateLiteral_rendersNumbersShortest() {
		assertEquals(str("n=282879384806159000"), evaluate(f.templateLiteral(TemplateSpan.text("n="), TemplateSpan.placeholder(num(2.82879384806159E17)))));
		assertEquals(str("1e+23"), evaluate(f.templateLiteral(TemplateSpan.placeholder(num(1e23)), TemplateSpan.text(""))));
	}

	@Test
	void templateLiteral_neverOutranksAny() {
		TypeId anyFirst = f.templateLiteral(TemplateSpan.placeholder(ANY), TemplateSpan.text("-"), TemplateSpan.placeholder(NEVER));
		TypeId neverFirst = f.templateLiteral(TemplateSpan.placeholder(NEVER), TemplateSpan.text("-"), TemplateSpan.placeholder(ANY));
		assertEquals(NEVER, evaluate(anyFirst));
		assertEquals(NEVER, evaluate(neverFirst));
		assertEquals(STRING, evaluate(f.templateLiteral(TemplateSpan.text("x"), TemplateSpan.placeholder(ANY), TemplateSpan.placeholder(str("y")))));
	}

	@Test
	void templateLiteral_withInfiniteHole_staysTemplate() {
		TypeId template = f.templateLiteral(TemplateSpan.text("id-"), TemplateSpan.placeholder(NUMBER));
		assertEquals(template, evaluate(template));
	}

	@Test
	void runawayRecursion_isTruncated() {
		var def = registry.reserve();
		TypeId nest = f.lazy(def);
		registry.define(def, Declaration.alias("Nest", List.of(TypeParamInfo.of("X")),
			f -> f.application(nest, f.tuple(f.typeParameter("X")))));
		EvaluationResult result = types.evaluate(apply(nest, STRING));
		assertEquals(ANY, result.type());
		assertTrue(result.truncated());
		assertTrue(result.exhausted().contains(Budget.INSTANTIATION_DEPTH));
	}

	@Test
	void recursiveGeneric_evaluatesLazily() {
		var def = registry.reserve();
		TypeId list = f.lazy(def);
		registry.define(def, Declaration.alias("List", List.of(TypeParamInfo.of("T")), f -> f.object(
			PropertyInfo.of("value", f.typeParameter("T")),
			PropertyInfo.optional("next", f.application(list, f.typeParameter("T"))))));
		ObjectShape shape = shapeOf(evaluate(apply(list, STRING)));
		assertEquals(STRING, shape.property("value").readType());
		assertEquals(apply(list, STRING), shape.property("next").readType());
	}

	@Test
	void unresolvedGeneric_isUnresolved() {
		assertEquals(UNRESOLVED, evaluate(apply(f.lazy(registry.reserve()), STRING)));
	}

	@Test
	void defaultTypeArguments() {
		TypeId box = generic("Box", List.of(TypeParamInfo.of("T").withDefault(STRING)),
			f -> f.object(PropertyInfo.of("value", f.typeParameter("T"))));
		assertEquals(object(PropertyInfo.of("value", STRING)), evaluate(apply(box)));
		assertEquals(object(PropertyInfo.of("value", NUMBER)), evaluate(apply(box, NUMBER)));
	}

	@Test
	void genericSignature_instantiates() {
		TypeParamInfo t = TypeParamInfo.of("T");
		TypeId identity = f.function(List.of(t), List.of(ParamInfo.of("x", f.typeParameter(t))), f.typeParameter(t));
		TypeId instantiated = types.instantiate(identity, List.of(NUMBER)).type();
		assertEquals(f.function(List.of(ParamInfo.of("x", NUMBER)), NUMBER), instantiated);
	}

	@Test
	void keyOf() {
		TypeId ab = object(PropertyInfo.of("a", NUMBER), PropertyInfo.optional("b", STRING));
		assertEquals(f.union(str("a"), str("b")), types.keyOf(ab).type());
		assertEquals(f.union(STRING, NUMBER, SYMBOL), types.keyOf(ANY).type());
		assertEquals(NEVER, types.keyOf(TypeId.UNKNOWN).type());
		assertEquals(f.union(STRING, NUMBER), types.keyOf(f.object(ObjectShape.builder().stringIndex(BOOLEAN).build())).type());
	}

	@Test
	void keyOf_unionIsCommonKeys_intersectionIsAllKeys() {
		TypeId ab = object(PropertyInfo.of("a", NUMBER), PropertyInfo.of("b", NUMBER));
		TypeId bc = object(PropertyInfo.of("b", NUMBER), PropertyInfo.of("c", NUMBER));
		assertEquals(str("b"), types.keyOf(f.union(ab, bc)).type());
		assertEquals(f.union(str("a"), str("b"), str("c")), types.keyOf(f.intersection(ab, bc)).type());
	}

	@Test
	void keyOf_freeParameter_isDeferred() {
		TypeId t = param("T");
		assertEquals(f.keyOf(t), types.keyOf(t).type());
	}

	@Test
	void indexAccess() {
		TypeId source = object(PropertyInfo.of("a", NUMBER), PropertyInfo.optional("b", STRING));
		assertEquals(NUMBER, types.indexAccess(source, str("a")).type());
		assertEquals(f.union(STRING, UNDEFINED), types.indexAccess(source, str("b")).type());
		assertEquals(f.union(NUMBER, STRING, UNDEFINED), types.indexAccess(source, f.union(str("a"), str("b"))).type());
		assertEquals(UNRESOLVED, types.indexAccess(source, str("c")).type());
	}

	@Test
	void indexAccess_arraysTuplesAndPrimitives() {
		TypeId pair = f.tuple(STRING, NUMBER);
		assertEquals(STRING, types.indexAccess(pair, num(0)).type());
		assertEquals(NUMBER, types.indexAccess(pair, str("1")).type());
		assertEquals(f.union(STRING, NUMBER), types.indexAccess(pair, NUMBER).type());
		assertEquals(num(2), types.indexAccess(pair, str("length")).type());
		assertEquals(STRING, types.indexAccess(f.array(STRING), NUMBER).type());
		assertEquals(NUMBER, types.indexAccess(STRING, str("length")).type());
		assertEquals(ANY, types.indexAccess(ANY, str("whatever")).type());
	}

	@Test
	void stringIntrinsics() {
		TypeId upper = f.stringIntrinsic(StringIntrinsicKind.UPPERCASE, f.union(str("ab"), str("cd")));
		assertEquals(f.union(str("AB"), str("CD")), evaluate(upper));
		assertEquals(str("Hello"), evaluate(f.stringIntrinsic(StringIntrinsicKind.CAPITALIZE, str("hello"))));
		assertEquals(str("hELLO"), evaluate(f.stringIntrinsic(StringIntrinsicKind.UNCAPITALIZE, str("HELLO"))));
		TypeId deferred = f.stringIntrinsic(StringIntrinsicKind.LOWERCASE, STRING);
		assertEquals(deferred, evaluate(deferred));
	}

	@Test
	void apparentTypes() {
		var library = types.environment().library();
		assertEquals(library.string(), types.apparentType(STRING).type());
		assertEquals(library.string(), types.apparentType(str("a")).type());
		assertEquals(library.number(), types.apparentType(num(1)).type());
		assertEquals(library.function(), types.apparentType(f.function(List.of(), STRING)).type());
		assertEquals(library.string(), types.apparentType(f.typeParameter(TypeParamInfo.constrained("T", STRING))).type());
		assertEquals(TypeId.EMPTY_OBJECT, types.apparentType(param("U")).type());
		TypeId plain = object(PropertyInfo.of("a", NUMBER));
		assertEquals(plain, types.apparentType(plain).type());
		ObjectShape arrayShape = shapeOf(types.apparentType(f.array(BOOLEAN)).type());
		assertEquals(BOOLEAN, arrayShape.numberIndex().valueType());
	}
}
