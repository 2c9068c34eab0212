package works.typelaw.lawyer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.core.json.JsonReadFeature;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.typelaw.exceptions.ConfigurationException;

import static tools.jackson.databind.DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES;

/**
 * Reads a {@link CompatProfile} from the text of a <code>tsconfig.json</code>.
 * <p>
 * Comments and trailing commas are allowed, as the compiler allows them.
 * <code>"strict"</code> sets the whole strict family; individual flags override it.
 * Options that don't affect assignability are ignored. Settings with no compiler
 * option of their own can be given in a top-level <code>"typelaw"</code> object.
 */
public final class ProfileLoader {
	private final ObjectMapper mapper;
	private final CompatProfile base;

	public ProfileLoader() {
		this(CompatProfile.DEFAULT);
	}

	/**
	 * @param base supplies every setting the file leaves out
	 */
	public ProfileLoader(CompatProfile base) {
		this.base = base;
		this.mapper = JsonMapper.builder()
			.enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
			.enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
			.disable(FAIL_ON_UNKNOWN_PROPERTIES)
			.build();
	}

	public CompatProfile load(Path path) {
		String text;
		try {
			text = Files.readString(path);
		} catch (IOException e) {
			throw new ConfigurationException("Unable to read " + path, e);
		}
		try {
			return parse(text);
		} catch (ConfigurationException e) {
			throw ConfigurationException.wrap(e, path.toString());
		}
	}

	public CompatProfile parse(String tsconfig) {
		TsConfig config;
		try {
			config = mapper.readValue(tsconfig, TsConfig.class);
		} catch (JacksonException e) {
			throw new ConfigurationException("Malformed tsconfig: " + e.getOriginalMessage(), e);
		}
		if (config == null) {
			throw new ConfigurationException("Malformed tsconfig: expected an object");
		}
		CompatProfile result = base;
		CompilerOptions options = config.compilerOptions();
		if (options != null) {
			if (options.strict() != null) {
				result = result
					.withStrictNullChecks(options.strict())
					.withStrictFunctionTypes(options.strict());
			}
			if (options.strictNullChecks() != null) {
				result = result.withStrictNullChecks(options.strictNullChecks());
			}
			if (options.strictFunctionTypes() != null) {
				result = result.withStrictFunctionTypes(options.strictFunctionTypes());
			}
			if (options.exactOptionalPropertyTypes() != null) {
				result = result.withExactOptionalPropertyTypes(options.exactOptionalPropertyTypes());
			}
		}
		TypeLawOptions extra = config.typelaw();
		if (extra != null) {
			if (extra.strictAnyPropagation() != null) {
				result = result.withStrictAnyPropagation(extra.strictAnyPropagation());
			}
			if (extra.bivariantMethodCheck() != null) {
				result = result.withBivariantMethodCheck(extra.bivariantMethodCheck());
			}
			if (extra.readonlyPropertyLeniency() != null) {
				result = result.withReadonlyPropertyLeniency(extra.readonlyPropertyLeniency());
			}
			if (extra.voidReturnLeniency() != null) {
				result = result.withVoidReturnLeniency(extra.voidReturnLeniency());
			}
			if (extra.disabledRules() != null) {
				for (String rule : extra.disabledRules()) {
					result = result.withRuleDisabled(rule);
				}
			}
		}
		LOGGER.debug("Loaded {}", result);
		return result;
	}

	record TsConfig(@Nullable CompilerOptions compilerOptions, @Nullable TypeLawOptions typelaw) { }

	record CompilerOptions(
		@Nullable Boolean strict,
		@Nullable Boolean strictNullChecks,
		@Nullable Boolean strictFunctionTypes,
		@Nullable Boolean exactOptionalPropertyTypes
	) { }

	record TypeLawOptions(
		@Nullable Boolean strictAnyPropagation,
		@Nullable Boolean bivariantMethodCheck,
		@Nullable Boolean readonlyPropertyLeniency,
		@Nullable Boolean voidReturnLeniency,
		@Nullable List<String> disabledRules
	) { }

	private static final Logger LOGGER = LoggerFactory.getLogger(ProfileLoader.class);
}
