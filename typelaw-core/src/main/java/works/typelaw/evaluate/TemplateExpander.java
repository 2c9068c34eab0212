package works.typelaw.evaluate;

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import works.typelaw.guard.Budget;
import works.typelaw.guard.QueryContext;
import works.typelaw.types.TemplateSpan;
import works.typelaw.types.TypeFactory;
import works.typelaw.types.TypeId;
import works.typelaw.types.TypeInterner;
import works.typelaw.types.TypeKey;

/**
 * Reduces template literal types to the union of the strings they can spell,
 * when every placeholder has finitely many string forms.
 */
final class TemplateExpander {
	private final TypeFactory factory;
	private final TypeInterner interner;
	private final Evaluator evaluator;

	TemplateExpander(TypeFactory factory, Evaluator evaluator) {
		this.factory = factory;
		this.interner = factory.interner();
		this.evaluator = evaluator;
	}

	TypeId expand(List<TemplateSpan> spans, QueryContext ctx) {
		List<TemplateSpan> evaluated = new ArrayList<>(spans.size());
		List<List<String>> choices = new ArrayList<>(spans.size());
		boolean expandable = true;
		boolean widened = false;
		for (TemplateSpan span : spans) {
			if (span instanceof TemplateSpan.Text text) {
				evaluated.add(span);
				choices.add(List.of(text.text()));
				continue;
			}
			TypeId type = evaluator.evaluate(((TemplateSpan.Placeholder) span).type(), ctx);
			if (type.equals(TypeId.NEVER)) {
				return TypeId.NEVER;
			}
			if (type.equals(TypeId.ANY)) {
				// A later never placeholder still wins
				widened = true;
				continue;
			}
			evaluated.add(TemplateSpan.placeholder(type));
			List<String> strings = expandable ? stringForms(type) : null;
			if (strings == null) {
				expandable = false;
			} else {
				choices.add(strings);
			}
		}
		if (widened) {
			return TypeId.STRING;
		}
		if (!expandable) {
			return factory.templateLiteral(evaluated);
		}

		long combinations = 1;
		int limit = ctx.limits().templateExpansionLimit();
		for (List<String> choice : choices) {
			combinations *= choice.size();
			if (combinations > limit) {
				ctx.exhaust(Budget.TEMPLATE_EXPANSION);
				return TypeId.STRING;
			}
		}

		List<String> results = List.of("");
		for (List<String> choice : choices) {
			List<String> next = new ArrayList<>(results.size() * choice.size());
			for (String prefix : results) {
				for (String suffix : choice) {
					next.add(prefix + suffix);
				}
			}
			results = next;
		}
		List<TypeId> literals = new ArrayList<>(results.size());
		for (String result : results) {
			literals.add(factory.literal(result));
		}
		return factory.union(literals);
	}

	/**
	 * @return every string a value of <code>type</code> converts to, or null if there are too many to list
	 */
	private @Nullable List<String> stringForms(TypeId type) {
		if (type.equals(TypeId.BOOLEAN)) {
			return List.of("false", "true");
		} else if (type.equals(TypeId.NULL)) {
			return List.of("null");
		} else if (type.equals(TypeId.UNDEFINED)) {
			return List.of("undefined");
		}
		TypeKey key = interner.lookup(type);
		if (key instanceof TypeKey.Literal l) {
			return List.of(l.value().asString());
		} else if (key instanceof TypeKey.EnumMember m) {
			return List.of(m.value().asString());
		} else if (key instanceof TypeKey.Enum e) {
			return unionForms(interner.typeList(e.members()));
		} else if (key instanceof TypeKey.Union u) {
			return unionForms(interner.typeList(u.members()));
		}
		return null;
	}

	private @Nullable List<String> unionForms(List<TypeId> members) {
		List<String> result = new ArrayList<>();
		for (TypeId member : members) {
			List<String> forms = stringForms(member);
			if (forms == null) {
				return null;
			}
			result.addAll(forms);
		}
		return result;
	}
}
