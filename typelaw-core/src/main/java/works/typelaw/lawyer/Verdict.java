package works.typelaw.lawyer;

import works.typelaw.judge.FailureReason;

import static java.util.Objects.requireNonNull;

/**
 * What a {@link CompatRule} concludes about a pair of types.
 */
public sealed interface Verdict {
	Verdict ACCEPT = new Accept();
	Verdict CONTINUE = new Continue();
	Verdict STRUCTURAL = new Structural();

	static Verdict reject(FailureReason reason) {
		return new Reject(reason);
	}

	record Accept() implements Verdict { }

	record Reject(FailureReason reason) implements Verdict {
		public Reject {
			requireNonNull(reason);
		}
	}

	/**
	 * The rule has no opinion; ask the next one.
	 */
	record Continue() implements Verdict { }

	/**
	 * Compare the pair structurally, consulting the rules again for each nested pair.
	 */
	record Structural() implements Verdict { }
}
