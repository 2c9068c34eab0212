package works.typelaw.types;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * The members of an object type: its properties in declaration order,
 * plus optional string and number index signatures.
 * <p>
 * Property names are unique within a shape.
 * Two shapes with the same properties in a different order are distinct shapes,
 * though they are mutually assignable.
 */
public final class ObjectShape {
	/**
	 * Marks the type of an object literal expression that has not yet been
	 * widened by assignment. Only fresh objects are subject to excess property checks.
	 */
	public static final int FRESH_LITERAL = 1;

	public static final ObjectShape EMPTY = new ObjectShape(List.of(), null, null, 0);

	private final List<PropertyInfo> properties;
	private final @Nullable IndexSignature stringIndex;
	private final @Nullable IndexSignature numberIndex;
	private final int flags;
	private final Map<String, PropertyInfo> byName;

	public ObjectShape(
		List<PropertyInfo> properties,
		@Nullable IndexSignature stringIndex,
		@Nullable IndexSignature numberIndex,
		int flags
	) {
		this.properties = List.copyOf(properties);
		this.stringIndex = stringIndex;
		this.numberIndex = numberIndex;
		this.flags = flags;
		Map<String, PropertyInfo> map = new HashMap<>();
		for (PropertyInfo p : this.properties) {
			if (map.put(p.name(), p) != null) {
				throw new IllegalArgumentException("Duplicate property \"" + p.name() + "\"");
			}
		}
		this.byName = map;
	}

	public static ObjectShape of(List<PropertyInfo> properties) {
		return new ObjectShape(properties, null, null, 0);
	}

	public static Builder builder() {
		return new Builder();
	}

	public List<PropertyInfo> properties() {
		return properties;
	}

	public @Nullable PropertyInfo property(String name) {
		return byName.get(name);
	}

	public @Nullable IndexSignature stringIndex() {
		return stringIndex;
	}

	public @Nullable IndexSignature numberIndex() {
		return numberIndex;
	}

	public int flags() {
		return flags;
	}

	public boolean isFresh() {
		return (flags & FRESH_LITERAL) != 0;
	}

	public boolean hasIndexSignature() {
		return stringIndex != null || numberIndex != null;
	}

	public boolean isEmpty() {
		return properties.isEmpty() && !hasIndexSignature();
	}

	/**
	 * A weak shape has at least one property, every property optional,
	 * and no index signatures.
	 */
	public boolean isWeak() {
		return !properties.isEmpty()
			&& !hasIndexSignature()
			&& properties.stream().allMatch(PropertyInfo::optional);
	}

	/**
	 * @return the index signature that governs a property named <code>name</code>,
	 * or null if there is none
	 */
	public @Nullable IndexSignature applicableIndex(String name) {
		if (numberIndex != null && JsNumberFormat.isNumericName(name)) {
			return numberIndex;
		}
		return stringIndex;
	}

	public ObjectShape withFlags(int flags) {
		return new ObjectShape(properties, stringIndex, numberIndex, flags);
	}

	public ObjectShape withProperties(List<PropertyInfo> properties) {
		return new ObjectShape(properties, stringIndex, numberIndex, flags);
	}

	public ObjectShape withIndexes(@Nullable IndexSignature stringIndex, @Nullable IndexSignature numberIndex) {
		return new ObjectShape(properties, stringIndex, numberIndex, flags);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		ObjectShape that = (ObjectShape) o;
		return flags == that.flags
			&& properties.equals(that.properties)
			&& Objects.equals(stringIndex, that.stringIndex)
			&& Objects.equals(numberIndex, that.numberIndex);
	}

	@Override
	public int hashCode() {
		return Objects.hash(properties, stringIndex, numberIndex, flags);
	}

	@Override
	public String toString() {
		return "ObjectShape" + properties + (stringIndex == null ? "" : "[string]") + (numberIndex == null ? "" : "[number]");
	}

	public static final class Builder {
		private final Map<String, PropertyInfo> properties = new LinkedHashMap<>();
		private IndexSignature stringIndex;
		private IndexSignature numberIndex;
		private int flags;

		Builder() { }

		/**
		 * A later property with the same name replaces the earlier one in place.
		 */
		public Builder property(PropertyInfo property) {
			properties.put(property.name(), requireNonNull(property));
			return this;
		}

		public Builder property(String name, TypeId type) {
			return property(PropertyInfo.of(name, type));
		}

		public Builder optional(String name, TypeId type) {
			return property(PropertyInfo.optional(name, type));
		}

		public Builder readonly(String name, TypeId type) {
			return property(PropertyInfo.readonly(name, type));
		}

		public Builder method(String name, TypeId functionType) {
			return property(PropertyInfo.method(name, functionType));
		}

		public Builder stringIndex(TypeId valueType) {
			this.stringIndex = IndexSignature.of(valueType);
			return this;
		}

		public Builder stringIndex(IndexSignature signature) {
			this.stringIndex = signature;
			return this;
		}

		public Builder numberIndex(TypeId valueType) {
			this.numberIndex = IndexSignature.of(valueType);
			return this;
		}

		public Builder numberIndex(IndexSignature signature) {
			this.numberIndex = signature;
			return this;
		}

		public Builder fresh() {
			this.flags |= FRESH_LITERAL;
			return this;
		}

		public ObjectShape build() {
			return new ObjectShape(new ArrayList<>(properties.values()), stringIndex, numberIndex, flags);
		}
	}
}
