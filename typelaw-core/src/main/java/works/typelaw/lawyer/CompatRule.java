package works.typelaw.lawyer;

import works.typelaw.types.TypeId;

/**
 * One named piece of compatibility policy.
 * <p>
 * The {@link Lawyer} consults its rules in order for every pair of types it compares;
 * the first rule that returns something other than {@link Verdict#CONTINUE} decides the pair.
 * A rule can be switched off by name with {@link CompatProfile#withRuleDisabled}.
 */
public interface CompatRule {
	/**
	 * A stable, kebab-case name, used in {@link CompatProfile#disabledRules()} and in logs.
	 */
	String name();

	Scope scope();

	Verdict check(TypeId source, TypeId target, RuleContext context);

	enum Scope {
		/**
		 * Applies only to the outermost pair of an assignability query.
		 */
		TOP_LEVEL,

		/**
		 * Applies to the outermost pair and to every nested pair.
		 */
		EVERY_LEVEL,
	}
}
