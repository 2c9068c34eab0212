package works.typelaw.evaluate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import works.typelaw.guard.Budget;
import works.typelaw.guard.QueryContext;
import works.typelaw.types.IndexSignature;
import works.typelaw.types.LiteralValue;
import works.typelaw.types.MappedModifier;
import works.typelaw.types.ObjectShape;
import works.typelaw.types.PropertyInfo;
import works.typelaw.types.TupleElement;
import works.typelaw.types.TypeFactory;
import works.typelaw.types.TypeId;
import works.typelaw.types.TypeInterner;
import works.typelaw.types.TypeKey;

/**
 * Reduces mapped types by iterating their key set.
 * <p>
 * A mapped type over <code>keyof S</code> is homomorphic: each output property
 * starts from the modifiers of the same property in <code>S</code>, and mapping over
 * an array or tuple yields an array or tuple.
 */
final class MappedTypes {
	private final TypeFactory factory;
	private final TypeInterner interner;
	private final Evaluator evaluator;
	private final Instantiator instantiator;

	MappedTypes(TypeFactory factory, Evaluator evaluator, Instantiator instantiator) {
		this.factory = factory;
		this.interner = factory.interner();
		this.evaluator = evaluator;
		this.instantiator = instantiator;
	}

	TypeId evaluate(TypeId id, TypeKey.Mapped mapped, QueryContext ctx) {
		ObjectShape modifiersSource = null;
		if (interner.lookup(mapped.constraint()) instanceof TypeKey.KeyOf keyOf) {
			TypeId source = evaluator.evaluate(keyOf.operand(), ctx);
			if (evaluator.containsTypeParameters(source)) {
				return id;
			}
			TypeKey sourceKey = interner.lookup(source);
			if (mapped.nameType() == null) {
				if (sourceKey instanceof TypeKey.ArrayType array) {
					return mapArray(mapped, array, ctx);
				} else if (sourceKey instanceof TypeKey.TupleType tuple) {
					return mapTuple(mapped, tuple, ctx);
				}
			}
			modifiersSource = shapeOf(source, ctx);
		}

		TypeId keys = evaluator.evaluate(mapped.constraint(), ctx);
		if (evaluator.containsTypeParameters(keys)) {
			return id;
		}
		List<TypeId> keyMembers = keys.equals(TypeId.NEVER) ? List.of() : interner.unionMembers(keys);
		if (keyMembers.size() > ctx.limits().maxMappedKeys()) {
			ctx.exhaust(Budget.MAPPED_KEYS);
			TypeId value = templateFor(mapped, TypeId.STRING, ctx);
			return factory.object(ObjectShape.builder().stringIndex(value).build());
		}

		Map<String, PropertyInfo> properties = new LinkedHashMap<>();
		IndexSignature stringIndex = null;
		IndexSignature numberIndex = null;
		for (TypeId key : keyMembers) {
			List<TypeId> names = remappedNames(mapped, key, ctx);
			if (names.isEmpty()) {
				continue;
			}
			TypeId value = templateFor(mapped, key, ctx);
			for (TypeId name : names) {
				String propertyName = propertyName(name);
				if (propertyName != null) {
					PropertyInfo base = modifiersSource == null ? null : modifiersSource.property(propertyName);
					PropertyInfo property = property(mapped, propertyName, value, base);
					properties.merge(propertyName, property, (a, b) -> a.withType(factory.union(a.readType(), b.readType())));
				} else if (name.equals(TypeId.STRING)) {
					IndexSignature base = modifiersSource == null ? null : modifiersSource.stringIndex();
					stringIndex = new IndexSignature(value, apply(mapped.readonlyModifier(), base != null && base.readonly()));
				} else if (name.equals(TypeId.NUMBER)) {
					IndexSignature base = modifiersSource == null ? null : modifiersSource.numberIndex();
					numberIndex = new IndexSignature(value, apply(mapped.readonlyModifier(), base != null && base.readonly()));
				}
				// Symbol keys have no representation among named properties
			}
		}
		return factory.object(new ObjectShape(new ArrayList<>(properties.values()), stringIndex, numberIndex, 0));
	}

	private PropertyInfo property(TypeKey.Mapped mapped, String name, TypeId value, @Nullable PropertyInfo base) {
		boolean optional = apply(mapped.optionalModifier(), base != null && base.optional());
		boolean readonly = apply(mapped.readonlyModifier(), base != null && base.readonly());
		TypeId type = value;
		if (mapped.optionalModifier() == MappedModifier.REMOVE) {
			type = factory.removeUndefined(type);
		} else if (optional && base != null && base.optional() && !interner.unionMembers(base.readType()).contains(TypeId.UNDEFINED)) {
			// Reading the optional source property added undefined; the optional output property implies it again
			type = factory.removeUndefined(type);
		}
		return new PropertyInfo(name, type, type, optional, readonly, false);
	}

	private static boolean apply(MappedModifier modifier, boolean inherited) {
		return switch (modifier) {
			case ADD -> true;
			case REMOVE -> false;
			case PRESERVE -> inherited;
		};
	}

	/**
	 * @return the keys the <code>as</code> clause maps <code>key</code> to; empty if it maps to never
	 */
	private List<TypeId> remappedNames(TypeKey.Mapped mapped, TypeId key, QueryContext ctx) {
		if (mapped.nameType() == null) {
			return List.of(key);
		}
		TypeId remapped = evaluator.evaluate(bindKey(mapped, mapped.nameType(), key, ctx), ctx);
		if (remapped.equals(TypeId.NEVER)) {
			return List.of();
		}
		return interner.unionMembers(remapped);
	}

	private TypeId templateFor(TypeKey.Mapped mapped, TypeId key, QueryContext ctx) {
		return evaluator.evaluate(bindKey(mapped, mapped.template(), key, ctx), ctx);
	}

	private TypeId bindKey(TypeKey.Mapped mapped, TypeId body, TypeId key, QueryContext ctx) {
		return instantiator.substitute(body, Substitution.of(Map.of(mapped.keyParameter().name(), key)), ctx);
	}

	private @Nullable String propertyName(TypeId key) {
		TypeKey k = interner.lookup(key);
		if (k instanceof TypeKey.Literal l
			&& (l.value() instanceof LiteralValue.StringLiteral || l.value() instanceof LiteralValue.NumberLiteral)) {
			return l.value().asString();
		} else if (k instanceof TypeKey.EnumMember m) {
			return m.value().asString();
		}
		return null;
	}

	private @Nullable ObjectShape shapeOf(TypeId source, QueryContext ctx) {
		TypeId shaped = evaluator.apparentType(source, ctx);
		if (interner.lookup(shaped) instanceof TypeKey.ObjectType) {
			return interner.objectShapeOf(shaped);
		}
		return null;
	}

	private TypeId mapArray(TypeKey.Mapped mapped, TypeKey.ArrayType array, QueryContext ctx) {
		TypeId element = templateFor(mapped, TypeId.NUMBER, ctx);
		if (mapped.optionalModifier() == MappedModifier.REMOVE) {
			element = factory.removeUndefined(element);
		}
		boolean readonly = apply(mapped.readonlyModifier(), array.readonly());
		return readonly ? factory.readonlyArray(element) : factory.array(element);
	}

	private TypeId mapTuple(TypeKey.Mapped mapped, TypeKey.TupleType tuple, QueryContext ctx) {
		List<TupleElement> elements = interner.tupleList(tuple.elements());
		List<TupleElement> result = new ArrayList<>(elements.size());
		for (int i = 0; i < elements.size(); i++) {
			TupleElement e = elements.get(i);
			if (e.rest()) {
				TypeId element = templateFor(mapped, TypeId.NUMBER, ctx);
				result.add(new TupleElement(factory.array(element), e.label(), false, true));
				continue;
			}
			TypeId value = templateFor(mapped, factory.literal(String.valueOf(i)), ctx);
			boolean optional = apply(mapped.optionalModifier(), e.optional());
			if (mapped.optionalModifier() == MappedModifier.REMOVE || (optional && e.optional())) {
				value = factory.removeUndefined(value);
			}
			result.add(new TupleElement(value, e.label(), optional, false));
		}
		boolean readonly = apply(mapped.readonlyModifier(), tuple.readonly());
		return readonly ? factory.readonlyTuple(result) : factory.tuple(result);
	}
}
