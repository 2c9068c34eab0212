package works.typelaw.evaluate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.typelaw.guard.QueryContext;
import works.typelaw.types.FunctionShape;
import works.typelaw.types.JsNumberFormat;
import works.typelaw.types.LiteralValue;
import works.typelaw.types.ObjectShape;
import works.typelaw.types.ParamInfo;
import works.typelaw.types.PropertyInfo;
import works.typelaw.types.TemplateSpan;
import works.typelaw.types.TupleElement;
import works.typelaw.types.TypeFactory;
import works.typelaw.types.TypeId;
import works.typelaw.types.TypeInterner;
import works.typelaw.types.TypeKey;
import works.typelaw.types.TypeParamInfo;

/**
 * Infers the types captured by <code>infer X</code> placeholders by matching
 * the checked type against the extends clause of a conditional.
 * <p>
 * Matching never decides the conditional by itself. It only proposes candidates;
 * the caller substitutes them and asks the extends relation for the verdict.
 * Candidates from covariant positions are combined with a union, those from
 * contravariant positions (parameters) with an intersection.
 */
final class InferMatcher {
	private final TypeFactory factory;
	private final TypeInterner interner;
	private final Evaluator evaluator;
	private final TypeScanner scanner;
	private final ExtendsRelation relation;

	InferMatcher(TypeFactory factory, Evaluator evaluator, TypeScanner scanner, ExtendsRelation relation) {
		this.factory = factory;
		this.interner = factory.interner();
		this.evaluator = evaluator;
		this.scanner = scanner;
		this.relation = relation;
	}

	/**
	 * @return a binding for every name in <code>names</code>, or empty if some
	 * inferred type violates its placeholder's constraint
	 */
	Optional<Map<String, TypeId>> infer(TypeId source, TypeId pattern, Set<String> names, QueryContext ctx) {
		Candidates candidates = new Candidates();
		match(source, pattern, false, candidates, ctx);

		Map<String, TypeId> result = new LinkedHashMap<>();
		for (String name : names) {
			TypeParamInfo info = candidates.infos.get(name);
			TypeId inferred = candidates.resolve(name);
			if (inferred == null) {
				inferred = (info != null && info.constraint() != null) ? info.constraint() : TypeId.UNKNOWN;
			} else if (info != null && info.constraint() != null && !relation.extendsType(inferred, info.constraint(), ctx)) {
				LOGGER.trace("Inferred {} for {} violates its constraint", inferred, name);
				return Optional.empty();
			}
			result.put(name, inferred);
		}
		return Optional.of(result);
	}

	private void match(TypeId source, TypeId pattern, boolean contravariant, Candidates out, QueryContext ctx) {
		if (!scanner.containsInfer(pattern)) {
			return;
		}
		TypeKey pk = interner.lookup(pattern);
		if (pk instanceof TypeKey.Infer infer) {
			out.add(infer.info(), source, contravariant);
			return;
		}
		if (source.equals(TypeId.ANY)) {
			for (String name : scanner.inferNames(pattern)) {
				out.add(TypeParamInfo.of(name), TypeId.ANY, contravariant);
			}
			return;
		}
		TypeId s = evaluator.evaluate(source, ctx);
		TypeKey sk = interner.lookup(s);

		if (pk instanceof TypeKey.Union u) {
			matchUnionPattern(s, interner.typeList(u.members()), contravariant, out, ctx);
		} else if (pk instanceof TypeKey.Intersection i) {
			for (TypeId member : interner.typeList(i.members())) {
				match(s, member, contravariant, out, ctx);
			}
		} else if (pk instanceof TypeKey.ArrayType a) {
			if (sk instanceof TypeKey.ArrayType sa) {
				match(sa.element(), a.element(), contravariant, out, ctx);
			} else if (sk instanceof TypeKey.TupleType) {
				match(evaluator.restElementType(s, ctx), a.element(), contravariant, out, ctx);
			}
		} else if (pk instanceof TypeKey.TupleType t) {
			matchTuple(s, sk, interner.tupleList(t.elements()), contravariant, out, ctx);
		} else if (pk instanceof TypeKey.ObjectType o) {
			matchObject(s, sk, interner.objectShape(o.shape()), contravariant, out, ctx);
		} else if (pk instanceof TypeKey.FunctionType f) {
			if (sk instanceof TypeKey.FunctionType) {
				matchSignature(interner.functionShapeOf(s), interner.functionShape(f.shape()), contravariant, out, ctx);
			}
		} else if (pk instanceof TypeKey.ConstructorType c) {
			if (sk instanceof TypeKey.ConstructorType) {
				matchSignature(interner.functionShapeOf(s), interner.functionShape(c.shape()), contravariant, out, ctx);
			}
		} else if (pk instanceof TypeKey.Application app) {
			if (sk instanceof TypeKey.Application sa && sa.base().equals(app.base())) {
				List<TypeId> sourceArgs = interner.typeList(sa.arguments());
				List<TypeId> patternArgs = interner.typeList(app.arguments());
				for (int i = 0; i < Math.min(sourceArgs.size(), patternArgs.size()); i++) {
					match(sourceArgs.get(i), patternArgs.get(i), contravariant, out, ctx);
				}
			} else {
				TypeId expanded = evaluator.evaluate(pattern, ctx);
				if (!expanded.equals(pattern)) {
					match(s, expanded, contravariant, out, ctx);
				}
			}
		} else if (pk instanceof TypeKey.TemplateLiteral template) {
			if (sk instanceof TypeKey.Literal l && l.value() instanceof LiteralValue.StringLiteral str) {
				matchTemplate(str.value(), interner.spanList(template.spans()), contravariant, out);
			}
		}
	}

	/**
	 * Source members that satisfy a pattern member without placeholders are set aside;
	 * the rest are matched against the members that have them.
	 */
	private void matchUnionPattern(TypeId source, List<TypeId> patternMembers, boolean contravariant, Candidates out, QueryContext ctx) {
		List<TypeId> fixed = new ArrayList<>();
		List<TypeId> inferring = new ArrayList<>();
		for (TypeId member : patternMembers) {
			(scanner.containsInfer(member) ? inferring : fixed).add(member);
		}
		for (TypeId s : interner.unionMembers(source)) {
			if (fixed.stream().anyMatch(f -> relation.extendsType(s, f, ctx))) {
				continue;
			}
			for (TypeId p : inferring) {
				match(s, p, contravariant, out, ctx);
			}
		}
	}

	private void matchTuple(TypeId s, TypeKey sk, List<TupleElement> pattern, boolean contravariant, Candidates out, QueryContext ctx) {
		if (sk instanceof TypeKey.ArrayType sa) {
			for (TupleElement p : pattern) {
				match(p.rest() ? s : sa.element(), p.type(), contravariant, out, ctx);
			}
			return;
		}
		if (!(sk instanceof TypeKey.TupleType st)) {
			return;
		}
		List<TupleElement> source = interner.tupleList(st.elements());
		int restIndex = -1;
		for (int i = 0; i < pattern.size(); i++) {
			if (pattern.get(i).rest()) {
				restIndex = i;
			}
		}
		if (restIndex < 0) {
			for (int i = 0; i < Math.min(source.size(), pattern.size()); i++) {
				match(source.get(i).type(), pattern.get(i).type(), contravariant, out, ctx);
			}
			return;
		}
		// Leading and trailing fixed elements align from each end; the rest takes the middle
		int trailing = pattern.size() - restIndex - 1;
		int middleEnd = source.size() - trailing;
		if (middleEnd < restIndex) {
			return;
		}
		for (int i = 0; i < restIndex; i++) {
			match(source.get(i).type(), pattern.get(i).type(), contravariant, out, ctx);
		}
		for (int i = 0; i < trailing; i++) {
			match(source.get(middleEnd + i).type(), pattern.get(restIndex + 1 + i).type(), contravariant, out, ctx);
		}
		TypeId middle = st.readonly()
			? factory.readonlyTuple(source.subList(restIndex, middleEnd))
			: factory.tuple(source.subList(restIndex, middleEnd));
		match(middle, pattern.get(restIndex).type(), contravariant, out, ctx);
	}

	private void matchObject(TypeId s, TypeKey sk, ObjectShape pattern, boolean contravariant, Candidates out, QueryContext ctx) {
		TypeId shaped = (sk instanceof TypeKey.ObjectType) ? s : evaluator.apparentType(s, ctx);
		if (!(interner.lookup(shaped) instanceof TypeKey.ObjectType)) {
			return;
		}
		ObjectShape source = interner.objectShapeOf(shaped);
		for (PropertyInfo p : pattern.properties()) {
			PropertyInfo sp = source.property(p.name());
			if (sp != null) {
				match(sp.readType(), p.readType(), contravariant, out, ctx);
			}
		}
		if (pattern.stringIndex() != null && source.stringIndex() != null) {
			match(source.stringIndex().valueType(), pattern.stringIndex().valueType(), contravariant, out, ctx);
		}
		if (pattern.numberIndex() != null) {
			if (source.numberIndex() != null) {
				match(source.numberIndex().valueType(), pattern.numberIndex().valueType(), contravariant, out, ctx);
			} else if (source.stringIndex() != null) {
				match(source.stringIndex().valueType(), pattern.numberIndex().valueType(), contravariant, out, ctx);
			}
		}
	}

	private void matchSignature(FunctionShape sourceShape, FunctionShape pattern, boolean contravariant, Candidates out, QueryContext ctx) {
		FunctionShape source = evaluator.eraseTypeParameters(sourceShape, false, ctx);
		List<ParamInfo> sourceParams = interner.paramList(source.parameters());
		List<ParamInfo> patternParams = interner.paramList(pattern.parameters());
		for (int i = 0; i < patternParams.size(); i++) {
			ParamInfo p = patternParams.get(i);
			if (p.rest()) {
				// Whatever parameters remain become a tuple
				List<ParamInfo> remaining = i < sourceParams.size() ? sourceParams.subList(i, sourceParams.size()) : List.of();
				match(parametersAsTuple(remaining), p.type(), !contravariant, out, ctx);
				break;
			}
			if (i < sourceParams.size()) {
				ParamInfo sp = sourceParams.get(i);
				TypeId sourceType = sp.rest() ? evaluator.restElementType(sp.type(), ctx) : sp.type();
				match(sourceType, p.type(), !contravariant, out, ctx);
			}
		}
		if (source.thisType() != null && pattern.thisType() != null) {
			match(source.thisType(), pattern.thisType(), !contravariant, out, ctx);
		}
		match(source.returnType(), pattern.returnType(), contravariant, out, ctx);
	}

	private TypeId parametersAsTuple(List<ParamInfo> params) {
		List<TupleElement> elements = new ArrayList<>(params.size());
		for (ParamInfo p : params) {
			elements.add(new TupleElement(p.type(), p.name(), p.optional(), p.rest()));
		}
		return factory.tuple(elements);
	}

	/**
	 * Splits a string literal along the pattern's text spans. A placeholder followed by text
	 * takes the shortest piece that lets the text match; one followed directly by another
	 * placeholder takes a single character.
	 */
	private void matchTemplate(String value, List<TemplateSpan> spans, boolean contravariant, Candidates out) {
		int position = 0;
		Map<TemplateSpan.Placeholder, String> pieces = new HashMap<>();
		List<TemplateSpan.Placeholder> order = new ArrayList<>();
		for (int i = 0; i < spans.size(); i++) {
			TemplateSpan span = spans.get(i);
			if (span instanceof TemplateSpan.Text text) {
				if (!value.startsWith(text.text(), position)) {
					return;
				}
				position += text.text().length();
				continue;
			}
			TemplateSpan.Placeholder placeholder = (TemplateSpan.Placeholder) span;
			int end;
			if (i == spans.size() - 1) {
				end = value.length();
			} else if (spans.get(i + 1) instanceof TemplateSpan.Text next) {
				end = (i + 1 == spans.size() - 1)
					? value.length() - next.text().length()
					: value.indexOf(next.text(), position);
				if (end < position || !value.startsWith(next.text(), end)) {
					return;
				}
			} else {
				end = Math.min(position + 1, value.length());
			}
			pieces.put(placeholder, value.substring(position, end));
			order.add(placeholder);
			position = end;
		}
		if (position != value.length()) {
			return;
		}
		for (TemplateSpan.Placeholder placeholder : order) {
			if (interner.lookup(placeholder.type()) instanceof TypeKey.Infer infer) {
				TypeId inferred = pieceType(pieces.get(placeholder), infer.info());
				if (inferred != null) {
					out.add(infer.info(), inferred, contravariant);
				}
			}
		}
	}

	/**
	 * A placeholder constrained to <code>number</code> captures the number the text spells,
	 * provided the text is that number's canonical form.
	 */
	private @Nullable TypeId pieceType(String piece, TypeParamInfo info) {
		if (info.constraint() != null && info.constraint().equals(TypeId.NUMBER)) {
			if (JsNumberFormat.isNumericName(piece) && JsNumberFormat.isNumericString(piece)) {
				return factory.literal(Double.parseDouble(piece));
			}
			return JsNumberFormat.isNumericString(piece) ? TypeId.NUMBER : null;
		}
		return factory.literal(piece);
	}

	private final class Candidates {
		final Map<String, TypeParamInfo> infos = new HashMap<>();
		final Map<String, List<TypeId>> covariant = new HashMap<>();
		final Map<String, List<TypeId>> contravariant = new HashMap<>();

		void add(TypeParamInfo info, TypeId type, boolean contra) {
			infos.putIfAbsent(info.name(), info);
			(contra ? contravariant : covariant).computeIfAbsent(info.name(), n -> new ArrayList<>()).add(type);
		}

		@Nullable TypeId resolve(String name) {
			List<TypeId> co = covariant.get(name);
			if (co != null) {
				return factory.union(co);
			}
			List<TypeId> contra = contravariant.get(name);
			if (contra != null) {
				return factory.intersection(contra);
			}
			return null;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(InferMatcher.class);
}
