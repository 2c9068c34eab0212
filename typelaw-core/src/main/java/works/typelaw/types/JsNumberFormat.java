package works.typelaw.types;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.regex.Pattern;

/**
 * Renders a double the way ECMAScript's <code>Number.prototype.toString()</code> does,
 * which is how numeric literals appear in property names and template literals.
 */
public final class JsNumberFormat {
	private JsNumberFormat() {}

	public static String format(double value) {
		if (Double.isNaN(value)) {
			return "NaN";
		} else if (value == 0.0) {
			return "0";
		} else if (value < 0) {
			return "-" + format(-value);
		} else if (Double.isInfinite(value)) {
			return "Infinity";
		}

		BigDecimal decimal = shortestDecimal(value);
		String digits = decimal.unscaledValue().toString();
		int k = digits.length();
		// value == 0.digits * 10^n
		int n = decimal.precision() - decimal.scale();

		if (k <= n && n <= 21) {
			return digits + "0".repeat(n - k);
		} else if (0 < n && n <= 21) {
			return digits.substring(0, n) + "." + digits.substring(n);
		} else if (-6 < n && n <= 0) {
			return "0." + "0".repeat(-n) + digits;
		}

		int exponent = n - 1;
		String sign = exponent < 0 ? "-" : "+";
		String mantissa = (k == 1) ? digits : digits.charAt(0) + "." + digits.substring(1);
		return mantissa + "e" + sign + Math.abs(exponent);
	}

	/**
	 * The decimal with the fewest significant digits that reads back as <code>value</code>,
	 * choosing the one nearest to <code>value</code> among equally short candidates.
	 * <p>
	 * {@link Double#toString(double)} doesn't guarantee this before JDK 19.
	 */
	private static BigDecimal shortestDecimal(double value) {
		BigDecimal exact = new BigDecimal(value);
		for (int precision = 1; precision < MAX_SIGNIFICANT_DIGITS; precision++) {
			BigDecimal candidate = exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
			if (Double.parseDouble(candidate.toString()) == value) {
				return candidate.stripTrailingZeros();
			}
		}
		return exact.round(new MathContext(MAX_SIGNIFICANT_DIGITS, RoundingMode.HALF_EVEN)).stripTrailingZeros();
	}

	// Every double round-trips through this many significant digits
	private static final int MAX_SIGNIFICANT_DIGITS = 17;

	/**
	 * @return true if <code>name</code> is the canonical rendering of some number,
	 * meaning a numeric index signature applies to a property with that name.
	 */
	public static boolean isNumericName(String name) {
		if (name.isEmpty()) {
			return false;
		}
		double parsed;
		try {
			parsed = Double.parseDouble(name);
		} catch (NumberFormatException e) {
			return "NaN".equals(name);
		}
		return format(parsed).equals(name);
	}

	private static final Pattern DECIMAL = Pattern.compile("[+-]?([0-9]+\\.?[0-9]*|\\.[0-9]+)([eE][+-]?[0-9]+)?");
	private static final Pattern RADIX = Pattern.compile("0[xX][0-9a-fA-F]+|0[oO][0-7]+|0[bB][01]+");

	/**
	 * @return true if converting <code>text</code> to a number yields a finite value,
	 * which is what a <code>number</code> placeholder in a template literal accepts
	 */
	public static boolean isNumericString(String text) {
		if (RADIX.matcher(text).matches()) {
			return true;
		}
		if (!DECIMAL.matcher(text).matches()) {
			return false;
		}
		return Double.isFinite(Double.parseDouble(text));
	}
}
