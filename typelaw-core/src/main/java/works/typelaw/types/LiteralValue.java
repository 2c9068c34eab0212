package works.typelaw.types;

import java.math.BigInteger;

import static java.util.Objects.requireNonNull;

/**
 * The value carried by a literal type.
 */
public sealed interface LiteralValue {
	/**
	 * @return the primitive type this literal widens to
	 */
	TypeId base();

	/**
	 * @return the text this value produces when substituted into a template literal
	 */
	String asString();

	static LiteralValue of(String value) {
		return new StringLiteral(value);
	}

	static LiteralValue of(double value) {
		return new NumberLiteral(value);
	}

	static LiteralValue of(boolean value) {
		return new BooleanLiteral(value);
	}

	record StringLiteral(String value) implements LiteralValue {
		public StringLiteral {
			requireNonNull(value);
		}

		@Override
		public TypeId base() {
			return TypeId.STRING;
		}

		@Override
		public String asString() {
			return value;
		}
	}

	record NumberLiteral(double value) implements LiteralValue {
		public NumberLiteral {
			// -0 and 0 are the same literal type
			if (value == 0.0) {
				value = 0.0;
			}
		}

		@Override
		public TypeId base() {
			return TypeId.NUMBER;
		}

		@Override
		public String asString() {
			return JsNumberFormat.format(value);
		}
	}

	/**
	 * @param digits decimal digits with an optional leading minus sign and no <code>n</code> suffix
	 */
	record BigIntLiteral(String digits) implements LiteralValue {
		public BigIntLiteral {
			if (!digits.matches("-?[0-9]+")) {
				throw new IllegalArgumentException("Not a decimal bigint: \"" + digits + "\"");
			}
			digits = new BigInteger(digits).toString();
		}

		@Override
		public TypeId base() {
			return TypeId.BIGINT;
		}

		@Override
		public String asString() {
			return digits;
		}
	}

	record BooleanLiteral(boolean value) implements LiteralValue {
		@Override
		public TypeId base() {
			return TypeId.BOOLEAN;
		}

		@Override
		public String asString() {
			return Boolean.toString(value);
		}
	}
}
