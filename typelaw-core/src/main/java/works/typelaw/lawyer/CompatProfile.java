package works.typelaw.lawyer;

import java.util.HashSet;
import java.util.Set;

/**
 * The compiler options that change what counts as assignable.
 *
 * @param strictNullChecks if false, <code>null</code> and <code>undefined</code> are assignable to everything
 * @param strictFunctionTypes if true, function-typed parameters are compared contravariantly;
 *                            otherwise bivariantly
 * @param exactOptionalPropertyTypes if false, an optional target property also accepts <code>undefined</code>
 * @param bivariantMethodCheck if true, parameters of methods stay bivariant even under <code>strictFunctionTypes</code>
 * @param strictAnyPropagation if true, <code>any</code> relates only to top types instead of to everything
 * @param readonlyPropertyLeniency if true, a readonly source property satisfies a mutable target property
 * @param voidReturnLeniency if true, a function returning anything satisfies a function type returning <code>void</code>
 * @param disabledRules names of {@link CompatRule}s to skip
 */
public record CompatProfile(
	boolean strictNullChecks,
	boolean strictFunctionTypes,
	boolean exactOptionalPropertyTypes,
	boolean bivariantMethodCheck,
	boolean strictAnyPropagation,
	boolean readonlyPropertyLeniency,
	boolean voidReturnLeniency,
	Set<String> disabledRules
) {
	/**
	 * The compiler's behaviour with no options set.
	 */
	public static final CompatProfile DEFAULT = new CompatProfile(false, false, false, true, false, true, true, Set.of());

	/**
	 * The compiler's behaviour under <code>"strict": true</code>.
	 */
	public static final CompatProfile STRICT = new CompatProfile(true, true, false, true, false, true, true, Set.of());

	public CompatProfile {
		disabledRules = Set.copyOf(disabledRules);
	}

	public boolean isEnabled(String ruleName) {
		return !disabledRules.contains(ruleName);
	}

	public CompatProfile withStrictNullChecks(boolean value) {
		return new CompatProfile(value, strictFunctionTypes, exactOptionalPropertyTypes, bivariantMethodCheck, strictAnyPropagation, readonlyPropertyLeniency, voidReturnLeniency, disabledRules);
	}

	public CompatProfile withStrictFunctionTypes(boolean value) {
		return new CompatProfile(strictNullChecks, value, exactOptionalPropertyTypes, bivariantMethodCheck, strictAnyPropagation, readonlyPropertyLeniency, voidReturnLeniency, disabledRules);
	}

	public CompatProfile withExactOptionalPropertyTypes(boolean value) {
		return new CompatProfile(strictNullChecks, strictFunctionTypes, value, bivariantMethodCheck, strictAnyPropagation, readonlyPropertyLeniency, voidReturnLeniency, disabledRules);
	}

	public CompatProfile withBivariantMethodCheck(boolean value) {
		return new CompatProfile(strictNullChecks, strictFunctionTypes, exactOptionalPropertyTypes, value, strictAnyPropagation, readonlyPropertyLeniency, voidReturnLeniency, disabledRules);
	}

	public CompatProfile withStrictAnyPropagation(boolean value) {
		return new CompatProfile(strictNullChecks, strictFunctionTypes, exactOptionalPropertyTypes, bivariantMethodCheck, value, readonlyPropertyLeniency, voidReturnLeniency, disabledRules);
	}

	public CompatProfile withReadonlyPropertyLeniency(boolean value) {
		return new CompatProfile(strictNullChecks, strictFunctionTypes, exactOptionalPropertyTypes, bivariantMethodCheck, strictAnyPropagation, value, voidReturnLeniency, disabledRules);
	}

	public CompatProfile withVoidReturnLeniency(boolean value) {
		return new CompatProfile(strictNullChecks, strictFunctionTypes, exactOptionalPropertyTypes, bivariantMethodCheck, strictAnyPropagation, readonlyPropertyLeniency, value, disabledRules);
	}

	public CompatProfile withRuleDisabled(String ruleName) {
		Set<String> rules = new HashSet<>(disabledRules);
		rules.add(ruleName);
		return new CompatProfile(strictNullChecks, strictFunctionTypes, exactOptionalPropertyTypes, bivariantMethodCheck, strictAnyPropagation, readonlyPropertyLeniency, voidReturnLeniency, rules);
	}

	public CompatProfile withRuleEnabled(String ruleName) {
		Set<String> rules = new HashSet<>(disabledRules);
		rules.remove(ruleName);
		return new CompatProfile(strictNullChecks, strictFunctionTypes, exactOptionalPropertyTypes, bivariantMethodCheck, strictAnyPropagation, readonlyPropertyLeniency, voidReturnLeniency, rules);
	}
}
