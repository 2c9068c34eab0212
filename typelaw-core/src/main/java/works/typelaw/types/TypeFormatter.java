package works.typelaw.types;

import java.util.List;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * Renders types in TypeScript syntax for diagnostics and logging.
 * Declarations are named by a caller-supplied function, since only the
 * binder knows their source names.
 */
public final class TypeFormatter {
	private static final int MAX_DEPTH = 8;

	private final TypeInterner interner;
	private final Function<DefId, String> declarationNames;

	public TypeFormatter(TypeInterner interner) {
		this(interner, DefId::toString);
	}

	public TypeFormatter(TypeInterner interner, Function<DefId, String> declarationNames) {
		this.interner = requireNonNull(interner);
		this.declarationNames = requireNonNull(declarationNames);
	}

	public String format(TypeId id) {
		StringBuilder sb = new StringBuilder();
		append(sb, id, 0);
		return sb.toString();
	}

	private void append(StringBuilder sb, TypeId id, int depth) {
		if (depth > MAX_DEPTH) {
			sb.append("...");
			return;
		}
		TypeKey key = interner.lookup(id);
		if (key instanceof TypeKey.Primitive p) {
			sb.append(p.primitive().keyword());
		} else if (key instanceof TypeKey.Literal l) {
			appendLiteral(sb, l.value());
		} else if (key instanceof TypeKey.ObjectType o) {
			appendObject(sb, interner.objectShape(o.shape()), depth);
		} else if (key instanceof TypeKey.ArrayType a) {
			if (a.readonly()) {
				sb.append("readonly ");
			}
			appendOperand(sb, a.element(), depth);
			sb.append("[]");
		} else if (key instanceof TypeKey.TupleType t) {
			if (t.readonly()) {
				sb.append("readonly ");
			}
			sb.append('[');
			List<TupleElement> elements = interner.tupleList(t.elements());
			for (int i = 0; i < elements.size(); i++) {
				if (i > 0) {
					sb.append(", ");
				}
				TupleElement e = elements.get(i);
				if (e.rest()) {
					sb.append("...");
				}
				if (e.label() != null) {
					sb.append(e.label()).append(e.optional() ? "?: " : ": ");
					append(sb, e.type(), depth + 1);
				} else {
					append(sb, e.type(), depth + 1);
					if (e.optional()) {
						sb.append('?');
					}
				}
			}
			sb.append(']');
		} else if (key instanceof TypeKey.Union u) {
			appendJoined(sb, interner.typeList(u.members()), " | ", depth);
		} else if (key instanceof TypeKey.Intersection i) {
			appendJoined(sb, interner.typeList(i.members()), " & ", depth);
		} else if (key instanceof TypeKey.FunctionType f) {
			appendSignature(sb, interner.functionShape(f.shape()), false, depth);
		} else if (key instanceof TypeKey.ConstructorType c) {
			appendSignature(sb, interner.functionShape(c.shape()), true, depth);
		} else if (key instanceof TypeKey.TypeParameter tp) {
			sb.append(tp.info().name());
		} else if (key instanceof TypeKey.Infer inf) {
			sb.append("infer ").append(inf.info().name());
			if (inf.info().constraint() != null) {
				sb.append(" extends ");
				append(sb, inf.info().constraint(), depth + 1);
			}
		} else if (key instanceof TypeKey.Application app) {
			append(sb, app.base(), depth + 1);
			sb.append('<');
			appendJoined(sb, interner.typeList(app.arguments()), ", ", depth);
			sb.append('>');
		} else if (key instanceof TypeKey.Conditional c) {
			appendOperand(sb, c.check(), depth);
			sb.append(" extends ");
			appendOperand(sb, c.extendsType(), depth);
			sb.append(" ? ");
			append(sb, c.trueType(), depth + 1);
			sb.append(" : ");
			append(sb, c.falseType(), depth + 1);
		} else if (key instanceof TypeKey.Mapped m) {
			appendMapped(sb, m, depth);
		} else if (key instanceof TypeKey.TemplateLiteral t) {
			sb.append('`');
			for (TemplateSpan span : interner.spanList(t.spans())) {
				if (span instanceof TemplateSpan.Text text) {
					sb.append(text.text().replace("`", "\\`").replace("${", "\\${"));
				} else {
					sb.append("${");
					append(sb, ((TemplateSpan.Placeholder) span).type(), depth + 1);
					sb.append('}');
				}
			}
			sb.append('`');
		} else if (key instanceof TypeKey.StringIntrinsic si) {
			sb.append(si.intrinsic().displayName()).append('<');
			append(sb, si.operand(), depth + 1);
			sb.append('>');
		} else if (key instanceof TypeKey.KeyOf k) {
			sb.append("keyof ");
			appendOperand(sb, k.operand(), depth);
		} else if (key instanceof TypeKey.IndexAccess ia) {
			appendOperand(sb, ia.object(), depth);
			sb.append('[');
			append(sb, ia.index(), depth + 1);
			sb.append(']');
		} else if (key instanceof TypeKey.Enum e) {
			sb.append(declarationNames.apply(e.def()));
		} else if (key instanceof TypeKey.EnumMember em) {
			sb.append(declarationNames.apply(em.def())).append('.').append(em.name());
		} else if (key instanceof TypeKey.Lazy lazy) {
			sb.append(declarationNames.apply(lazy.def()));
		} else if (key instanceof TypeKey.TypeQuery q) {
			sb.append("typeof ").append(declarationNames.apply(q.def()));
		} else {
			throw new AssertionError("Unexpected type key: " + key);
		}
	}

	/**
	 * Parenthesizes types that would otherwise bind too loosely in postfix or operand position.
	 */
	private void appendOperand(StringBuilder sb, TypeId id, int depth) {
		TypeKey.Kind kind = interner.kindOf(id);
		boolean parens = switch (kind) {
			case UNION, INTERSECTION, FUNCTION, CONSTRUCTOR, CONDITIONAL, KEY_OF -> true;
			default -> false;
		};
		if (parens) {
			sb.append('(');
		}
		append(sb, id, depth + 1);
		if (parens) {
			sb.append(')');
		}
	}

	private void appendJoined(StringBuilder sb, List<TypeId> members, String separator, int depth) {
		for (int i = 0; i < members.size(); i++) {
			if (i > 0) {
				sb.append(separator);
			}
			if (separator.equals(", ")) {
				append(sb, members.get(i), depth + 1);
			} else {
				appendOperand(sb, members.get(i), depth);
			}
		}
	}

	private void appendObject(StringBuilder sb, ObjectShape shape, int depth) {
		if (shape.isEmpty()) {
			sb.append("{}");
			return;
		}
		sb.append("{ ");
		for (PropertyInfo p : shape.properties()) {
			if (p.readonly()) {
				sb.append("readonly ");
			}
			sb.append(propertyName(p.name()));
			if (p.optional()) {
				sb.append('?');
			}
			sb.append(": ");
			append(sb, p.readType(), depth + 1);
			sb.append("; ");
		}
		appendIndex(sb, "string", shape.stringIndex(), depth);
		appendIndex(sb, "number", shape.numberIndex(), depth);
		sb.append('}');
	}

	private void appendIndex(StringBuilder sb, String keyType, IndexSignature index, int depth) {
		if (index == null) {
			return;
		}
		if (index.readonly()) {
			sb.append("readonly ");
		}
		sb.append("[key: ").append(keyType).append("]: ");
		append(sb, index.valueType(), depth + 1);
		sb.append("; ");
	}

	private void appendSignature(StringBuilder sb, FunctionShape shape, boolean construct, int depth) {
		if (construct) {
			sb.append("new ");
		}
		if (shape.isGeneric()) {
			sb.append('<');
			List<TypeParamInfo> typeParameters = shape.typeParameters();
			for (int i = 0; i < typeParameters.size(); i++) {
				if (i > 0) {
					sb.append(", ");
				}
				TypeParamInfo tp = typeParameters.get(i);
				sb.append(tp.name());
				if (tp.constraint() != null) {
					sb.append(" extends ");
					append(sb, tp.constraint(), depth + 1);
				}
			}
			sb.append('>');
		}
		sb.append('(');
		boolean first = true;
		if (shape.thisType() != null) {
			sb.append("this: ");
			append(sb, shape.thisType(), depth + 1);
			first = false;
		}
		for (ParamInfo p : interner.paramList(shape.parameters())) {
			if (!first) {
				sb.append(", ");
			}
			first = false;
			if (p.rest()) {
				sb.append("...");
			}
			sb.append(p.name());
			if (p.optional()) {
				sb.append('?');
			}
			sb.append(": ");
			append(sb, p.type(), depth + 1);
		}
		sb.append(") => ");
		append(sb, shape.returnType(), depth + 1);
	}

	private void appendMapped(StringBuilder sb, TypeKey.Mapped m, int depth) {
		sb.append("{ ");
		sb.append(modifierPrefix(m.readonlyModifier())).append(m.readonlyModifier() == MappedModifier.PRESERVE ? "" : "readonly ");
		sb.append('[').append(m.keyParameter().name()).append(" in ");
		append(sb, m.constraint(), depth + 1);
		if (m.nameType() != null) {
			sb.append(" as ");
			append(sb, m.nameType(), depth + 1);
		}
		sb.append(']');
		sb.append(modifierPrefix(m.optionalModifier())).append(m.optionalModifier() == MappedModifier.PRESERVE ? "" : "?");
		sb.append(": ");
		append(sb, m.template(), depth + 1);
		sb.append("; }");
	}

	private static String modifierPrefix(MappedModifier modifier) {
		return switch (modifier) {
			case ADD, PRESERVE -> "";
			case REMOVE -> "-";
		};
	}

	private static String propertyName(String name) {
		if (name.matches("[A-Za-z_$][A-Za-z0-9_$]*") || JsNumberFormat.isNumericName(name)) {
			return name;
		}
		return quote(name);
	}

	private static void appendLiteral(StringBuilder sb, LiteralValue value) {
		if (value instanceof LiteralValue.StringLiteral s) {
			sb.append(quote(s.value()));
		} else if (value instanceof LiteralValue.BigIntLiteral b) {
			sb.append(b.digits()).append('n');
		} else {
			sb.append(value.asString());
		}
	}

	private static String quote(String s) {
		return '"' + s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + '"';
	}
}
