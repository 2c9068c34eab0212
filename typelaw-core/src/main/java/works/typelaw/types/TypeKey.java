package works.typelaw.types;

import java.util.List;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * The structural description of a type, as stored in a {@link TypeInterner}.
 * <p>
 * Keys are immutable value objects: two keys that are {@link Object#equals equal}
 * intern to the same {@link TypeId}. Composite keys refer to their parts by id
 * and to variable-length data by {@link Handle}, so equality never recurses.
 * <p>
 * Keys are usually built through a {@link TypeFactory}, which normalizes
 * unions, intersections and template literals before interning.
 */
public sealed interface TypeKey {
	Kind kind();

	enum Kind {
		PRIMITIVE,
		LITERAL,
		OBJECT,
		ARRAY,
		TUPLE,
		UNION,
		INTERSECTION,
		FUNCTION,
		CONSTRUCTOR,
		TYPE_PARAMETER,
		INFER,
		APPLICATION,
		CONDITIONAL,
		MAPPED,
		TEMPLATE_LITERAL,
		STRING_INTRINSIC,
		KEY_OF,
		INDEX_ACCESS,
		ENUM,
		ENUM_MEMBER,
		LAZY,
		TYPE_QUERY,
		;

		/**
		 * Derived kinds describe a computation rather than a value,
		 * and are reduced by the evaluator.
		 */
		public boolean isDerived() {
			return switch (this) {
				case APPLICATION, CONDITIONAL, MAPPED, TEMPLATE_LITERAL, STRING_INTRINSIC, KEY_OF, INDEX_ACCESS -> true;
				default -> false;
			};
		}

		/**
		 * Reference kinds name a declaration that must be looked up in the environment.
		 */
		public boolean isReference() {
			return this == LAZY || this == TYPE_QUERY;
		}
	}

	record Primitive(PrimitiveKind primitive) implements TypeKey {
		public Primitive {
			requireNonNull(primitive);
		}

		@Override
		public Kind kind() {
			return Kind.PRIMITIVE;
		}
	}

	record Literal(LiteralValue value) implements TypeKey {
		public Literal {
			requireNonNull(value);
		}

		@Override
		public Kind kind() {
			return Kind.LITERAL;
		}
	}

	record ObjectType(Handle<ObjectShape> shape) implements TypeKey {
		public ObjectType {
			requireNonNull(shape);
		}

		@Override
		public Kind kind() {
			return Kind.OBJECT;
		}
	}

	record ArrayType(TypeId element, boolean readonly) implements TypeKey {
		public ArrayType {
			requireNonNull(element);
		}

		@Override
		public Kind kind() {
			return Kind.ARRAY;
		}
	}

	record TupleType(Handle<List<TupleElement>> elements, boolean readonly) implements TypeKey {
		public TupleType {
			requireNonNull(elements);
		}

		@Override
		public Kind kind() {
			return Kind.TUPLE;
		}
	}

	/**
	 * @param members at least two members, sorted by id, none of them unions
	 */
	record Union(Handle<List<TypeId>> members) implements TypeKey {
		public Union {
			requireNonNull(members);
		}

		@Override
		public Kind kind() {
			return Kind.UNION;
		}
	}

	/**
	 * @param members at least two members, sorted by id, none of them intersections
	 */
	record Intersection(Handle<List<TypeId>> members) implements TypeKey {
		public Intersection {
			requireNonNull(members);
		}

		@Override
		public Kind kind() {
			return Kind.INTERSECTION;
		}
	}

	record FunctionType(Handle<FunctionShape> shape) implements TypeKey {
		public FunctionType {
			requireNonNull(shape);
		}

		@Override
		public Kind kind() {
			return Kind.FUNCTION;
		}
	}

	record ConstructorType(Handle<FunctionShape> shape) implements TypeKey {
		public ConstructorType {
			requireNonNull(shape);
		}

		@Override
		public Kind kind() {
			return Kind.CONSTRUCTOR;
		}
	}

	record TypeParameter(TypeParamInfo info) implements TypeKey {
		public TypeParameter {
			requireNonNull(info);
		}

		@Override
		public Kind kind() {
			return Kind.TYPE_PARAMETER;
		}
	}

	/**
	 * An <code>infer X</code> placeholder in the extends clause of a conditional type.
	 * The true branch refers to the inferred type as a {@link TypeParameter} of the same name.
	 */
	record Infer(TypeParamInfo info) implements TypeKey {
		public Infer {
			requireNonNull(info);
		}

		@Override
		public Kind kind() {
			return Kind.INFER;
		}
	}

	/**
	 * A generic applied to type arguments, such as <code>Partial&lt;T&gt;</code>.
	 *
	 * @param base usually a {@link Lazy} reference to a generic declaration
	 */
	record Application(TypeId base, Handle<List<TypeId>> arguments) implements TypeKey {
		public Application {
			requireNonNull(base);
			requireNonNull(arguments);
		}

		@Override
		public Kind kind() {
			return Kind.APPLICATION;
		}
	}

	/**
	 * <code>check extends extendsType ? trueType : falseType</code>
	 *
	 * @param distributive true when <code>check</code> is a bare type parameter,
	 *                     so the conditional distributes over a union substituted for it
	 */
	record Conditional(TypeId check, TypeId extendsType, TypeId trueType, TypeId falseType, boolean distributive) implements TypeKey {
		public Conditional {
			requireNonNull(check);
			requireNonNull(extendsType);
			requireNonNull(trueType);
			requireNonNull(falseType);
		}

		@Override
		public Kind kind() {
			return Kind.CONDITIONAL;
		}
	}

	/**
	 * <code>{ [K in constraint as nameType]: template }</code> with optional modifiers.
	 */
	record Mapped(
		TypeParamInfo keyParameter,
		TypeId constraint,
		TypeId template,
		@Nullable TypeId nameType,
		MappedModifier readonlyModifier,
		MappedModifier optionalModifier
	) implements TypeKey {
		public Mapped {
			requireNonNull(keyParameter);
			requireNonNull(constraint);
			requireNonNull(template);
			requireNonNull(readonlyModifier);
			requireNonNull(optionalModifier);
		}

		@Override
		public Kind kind() {
			return Kind.MAPPED;
		}
	}

	record TemplateLiteral(Handle<List<TemplateSpan>> spans) implements TypeKey {
		public TemplateLiteral {
			requireNonNull(spans);
		}

		@Override
		public Kind kind() {
			return Kind.TEMPLATE_LITERAL;
		}
	}

	record StringIntrinsic(StringIntrinsicKind intrinsic, TypeId operand) implements TypeKey {
		public StringIntrinsic {
			requireNonNull(intrinsic);
			requireNonNull(operand);
		}

		@Override
		public Kind kind() {
			return Kind.STRING_INTRINSIC;
		}
	}

	record KeyOf(TypeId operand) implements TypeKey {
		public KeyOf {
			requireNonNull(operand);
		}

		@Override
		public Kind kind() {
			return Kind.KEY_OF;
		}
	}

	record IndexAccess(TypeId object, TypeId index) implements TypeKey {
		public IndexAccess {
			requireNonNull(object);
			requireNonNull(index);
		}

		@Override
		public Kind kind() {
			return Kind.INDEX_ACCESS;
		}
	}

	/**
	 * The type of an enum as a whole, equivalent to the union of its members
	 * but opaque to unrelated types.
	 */
	record Enum(DefId def, EnumKind enumKind, Handle<List<TypeId>> members) implements TypeKey {
		public Enum {
			requireNonNull(def);
			requireNonNull(enumKind);
			requireNonNull(members);
		}

		@Override
		public Kind kind() {
			return Kind.ENUM;
		}
	}

	record EnumMember(DefId def, String name, LiteralValue value) implements TypeKey {
		public EnumMember {
			requireNonNull(def);
			requireNonNull(name);
			requireNonNull(value);
			if (!(value instanceof LiteralValue.StringLiteral) && !(value instanceof LiteralValue.NumberLiteral)) {
				throw new IllegalArgumentException("Enum member value must be a string or number: " + value);
			}
		}

		@Override
		public Kind kind() {
			return Kind.ENUM_MEMBER;
		}
	}

	/**
	 * A deferred reference to the declared type of a named declaration.
	 */
	record Lazy(DefId def) implements TypeKey {
		public Lazy {
			requireNonNull(def);
		}

		@Override
		public Kind kind() {
			return Kind.LAZY;
		}
	}

	/**
	 * <code>typeof x</code>: a deferred reference to the value type of a declaration.
	 */
	record TypeQuery(DefId def) implements TypeKey {
		public TypeQuery {
			requireNonNull(def);
		}

		@Override
		public Kind kind() {
			return Kind.TYPE_QUERY;
		}
	}
}
