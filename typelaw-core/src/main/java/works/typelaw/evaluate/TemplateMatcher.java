package works.typelaw.evaluate;

import java.util.List;
import java.util.function.BiPredicate;
import works.typelaw.types.JsNumberFormat;
import works.typelaw.types.TemplateSpan;
import works.typelaw.types.TypeId;
import works.typelaw.types.TypeInterner;
import works.typelaw.types.TypeKey;

import static java.util.Objects.requireNonNull;

/**
 * Matches concrete strings against template literal patterns such as
 * <code>`prefix-${number}`</code>.
 * <p>
 * Placeholders may match any number of characters, so matching backtracks
 * over the possible split points. Placeholder types this class doesn't
 * understand are handed to a caller-supplied fallback.
 */
public final class TemplateMatcher {
	private final TypeInterner interner;

	public TemplateMatcher(TypeInterner interner) {
		this.interner = requireNonNull(interner);
	}

	/**
	 * @param fallback decides whether a piece of text matches a placeholder type
	 *                 this matcher can't judge on its own
	 */
	public boolean matches(String value, List<TemplateSpan> spans, BiPredicate<String, TypeId> fallback) {
		return matchFrom(value, 0, spans, 0, fallback);
	}

	private boolean matchFrom(String value, int position, List<TemplateSpan> spans, int spanIndex, BiPredicate<String, TypeId> fallback) {
		if (spanIndex == spans.size()) {
			return position == value.length();
		}
		TemplateSpan span = spans.get(spanIndex);
		if (span instanceof TemplateSpan.Text text) {
			return value.startsWith(text.text(), position)
				&& matchFrom(value, position + text.text().length(), spans, spanIndex + 1, fallback);
		}
		TypeId type = ((TemplateSpan.Placeholder) span).type();
		if (spanIndex == spans.size() - 1) {
			return accepts(value.substring(position), type, fallback);
		}
		for (int end = position; end <= value.length(); end++) {
			if (spans.get(spanIndex + 1) instanceof TemplateSpan.Text next && !value.startsWith(next.text(), end)) {
				continue;
			}
			if (accepts(value.substring(position, end), type, fallback)
				&& matchFrom(value, end, spans, spanIndex + 1, fallback)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * @return true if the text could be the string form of a value of <code>type</code>
	 */
	public boolean accepts(String piece, TypeId type, BiPredicate<String, TypeId> fallback) {
		if (type.equals(TypeId.STRING) || type.equals(TypeId.ANY)) {
			return true;
		}
		if (type.equals(TypeId.NUMBER)) {
			return JsNumberFormat.isNumericString(piece);
		}
		if (type.equals(TypeId.BIGINT)) {
			return isBigIntText(piece);
		}
		if (type.equals(TypeId.BOOLEAN)) {
			return piece.equals("true") || piece.equals("false");
		}
		if (type.equals(TypeId.NULL)) {
			return piece.equals("null");
		}
		if (type.equals(TypeId.UNDEFINED)) {
			return piece.equals("undefined");
		}
		if (type.equals(TypeId.NEVER)) {
			return false;
		}
		TypeKey key = interner.lookup(type);
		if (key instanceof TypeKey.Literal l) {
			return l.value().asString().equals(piece);
		}
		if (key instanceof TypeKey.EnumMember m) {
			return m.value().asString().equals(piece);
		}
		if (key instanceof TypeKey.Union u) {
			for (TypeId member : interner.typeList(u.members())) {
				if (accepts(piece, member, fallback)) {
					return true;
				}
			}
			return false;
		}
		if (key instanceof TypeKey.TemplateLiteral nested) {
			return matches(piece, interner.spanList(nested.spans()), fallback);
		}
		return fallback.test(piece, type);
	}

	private static boolean isBigIntText(String piece) {
		String digits = piece.startsWith("-") ? piece.substring(1) : piece;
		if (digits.isEmpty()) {
			return false;
		}
		for (int i = 0; i < digits.length(); i++) {
			char c = digits.charAt(i);
			if (c < '0' || c > '9') {
				return false;
			}
		}
		return true;
	}
}
