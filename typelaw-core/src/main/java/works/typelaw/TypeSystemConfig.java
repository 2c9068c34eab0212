package works.typelaw;

import java.util.List;
import java.util.function.Function;
import works.typelaw.env.BuiltinLibrary;
import works.typelaw.env.LibraryTypes;
import works.typelaw.exceptions.ConfigurationException;
import works.typelaw.guard.Limits;
import works.typelaw.lawyer.CompatProfile;
import works.typelaw.lawyer.CompatRule;
import works.typelaw.lawyer.CompatRules;
import works.typelaw.types.TypeFactory;

import static java.util.Objects.requireNonNull;

public final class TypeSystemConfig {
	private final String sessionName;
	private final Limits limits;
	private final CompatProfile defaultProfile;
	private final List<CompatRule> rules;
	private final int relationCacheCapacity;
	private final Function<TypeFactory, LibraryTypes> library;

	private TypeSystemConfig(
		String sessionName,
		Limits limits,
		CompatProfile defaultProfile,
		List<CompatRule> rules,
		int relationCacheCapacity,
		Function<TypeFactory, LibraryTypes> library
	) {
		this.sessionName = sessionName;
		this.limits = limits;
		this.defaultProfile = defaultProfile;
		this.rules = rules;
		this.relationCacheCapacity = relationCacheCapacity;
		this.library = library;
	}

	public static TypeSystemConfig simple() {
		return SIMPLE_CONFIG;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Appears in the <code>typelaw.session</code> MDC key of everything the session logs.
	 */
	public String sessionName() {
		return sessionName;
	}

	public Limits limits() {
		return limits;
	}

	/**
	 * The profile used by queries that don't name one, and by conditional types.
	 */
	public CompatProfile defaultProfile() {
		return defaultProfile;
	}

	public List<CompatRule> rules() {
		return rules;
	}

	/**
	 * @return how many assignability answers to remember across queries; zero disables the cache
	 */
	public int relationCacheCapacity() {
		return relationCacheCapacity;
	}

	/**
	 * Builds the standard library interfaces used for apparent types.
	 */
	public Function<TypeFactory, LibraryTypes> library() {
		return library;
	}

	@Override
	public String toString() {
		return "TypeSystemConfig(sessionName=" + sessionName
			+ ", limits=" + limits
			+ ", defaultProfile=" + defaultProfile
			+ ", rules=" + rules
			+ ", relationCacheCapacity=" + relationCacheCapacity + ")";
	}

	public static class Builder {
		private String sessionName = DEFAULT_SESSION_NAME;
		private Limits limits = Limits.DEFAULT;
		private CompatProfile defaultProfile = CompatProfile.DEFAULT;
		private List<CompatRule> rules = CompatRules.defaults();
		private int relationCacheCapacity = DEFAULT_RELATION_CACHE_CAPACITY;
		private Function<TypeFactory, LibraryTypes> library = BuiltinLibrary::create;

		Builder() { }

		public Builder sessionName(String sessionName) {
			this.sessionName = requireNonNull(sessionName);
			return this;
		}

		public Builder limits(Limits limits) {
			this.limits = requireNonNull(limits);
			return this;
		}

		public Builder defaultProfile(CompatProfile defaultProfile) {
			this.defaultProfile = requireNonNull(defaultProfile);
			return this;
		}

		/**
		 * Replaces the standard rule list. Rules are consulted in the given order.
		 */
		public Builder rules(List<CompatRule> rules) {
			this.rules = List.copyOf(rules);
			return this;
		}

		public Builder relationCache(boolean enabled) {
			this.relationCacheCapacity = enabled ? DEFAULT_RELATION_CACHE_CAPACITY : 0;
			return this;
		}

		public Builder relationCacheCapacity(int capacity) {
			if (capacity < 0) {
				throw new ConfigurationException("Relation cache capacity must not be negative; got " + capacity);
			}
			this.relationCacheCapacity = capacity;
			return this;
		}

		public Builder library(Function<TypeFactory, LibraryTypes> library) {
			this.library = requireNonNull(library);
			return this;
		}

		public TypeSystemConfig build() {
			if (rules.stream().map(CompatRule::name).distinct().count() != rules.size()) {
				throw new ConfigurationException("Rule names must be unique: " + rules);
			}
			return new TypeSystemConfig(sessionName, limits, defaultProfile, rules, relationCacheCapacity, library);
		}

		@Override
		public String toString() {
			return "TypeSystemConfig.Builder(sessionName=" + sessionName
				+ ", limits=" + limits
				+ ", defaultProfile=" + defaultProfile
				+ ", rules=" + rules
				+ ", relationCacheCapacity=" + relationCacheCapacity + ")";
		}
	}

	public static final String DEFAULT_SESSION_NAME = "typelaw";
	public static final int DEFAULT_RELATION_CACHE_CAPACITY = 100_000;
	private static final TypeSystemConfig SIMPLE_CONFIG = builder().build();
}
