package works.typelaw.lawyer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import works.typelaw.exceptions.ConfigurationException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ProfileLoaderTest {
	final ProfileLoader loader = new ProfileLoader();

	@Test
	void emptyConfig_isBase() {
		assertEquals(CompatProfile.DEFAULT, loader.parse("{}"));
		assertEquals(CompatProfile.STRICT, new ProfileLoader(CompatProfile.STRICT).parse("{ \"compilerOptions\": {} }"));
	}

	@Test
	void strict_setsTheStrictFamily() {
		CompatProfile profile = loader.parse("""
			{
				// As generated by tsc --init
				"compilerOptions": {
					"target": "es2016",
					"strict": true,
				},
			}
			""");
		assertEquals(CompatProfile.STRICT, profile);
	}

	@Test
	void individualFlags_overrideStrict() {
		CompatProfile profile = loader.parse("""
			{
				"compilerOptions": {
					"strictFunctionTypes": false,
					"strict": true,
					"exactOptionalPropertyTypes": true
				}
			}
			""");
		assertTrue(profile.strictNullChecks());
		assertFalse(profile.strictFunctionTypes(), "An explicit flag wins regardless of order");
		assertTrue(profile.exactOptionalPropertyTypes());
	}

	@Test
	void typelawSection() {
		CompatProfile profile = loader.parse("""
			{
				/* Settings the compiler doesn't have */
				"typelaw": {
					"strictAnyPropagation": true,
					"bivariantMethodCheck": false,
					"readonlyPropertyLeniency": false,
					"voidReturnLeniency": false,
					"disabledRules": ["excess-property", "weak-type"]
				}
			}
			""");
		assertTrue(profile.strictAnyPropagation());
		assertFalse(profile.bivariantMethodCheck());
		assertFalse(profile.readonlyPropertyLeniency());
		assertFalse(profile.voidReturnLeniency());
		assertEquals(Set.of(CompatRules.EXCESS_PROPERTY, CompatRules.WEAK_TYPE), profile.disabledRules());
		assertFalse(profile.isEnabled(CompatRules.WEAK_TYPE));
		assertTrue(profile.isEnabled(CompatRules.STRUCTURAL));
	}

	@Test
	void malformed_throws() {
		ConfigurationException e = assertThrows(ConfigurationException.class, () -> loader.parse("{ \"compilerOptions\": "));
		assertThat(e.getMessage(), startsWith("Malformed tsconfig"));
		assertThrows(ConfigurationException.class, () -> loader.parse("[true]"));
		assertThrows(ConfigurationException.class, () -> loader.parse("{ \"compilerOptions\": { \"strict\": \"very\" } }"));
		ConfigurationException nullDocument = assertThrows(ConfigurationException.class, () -> loader.parse("null"));
		assertThat(nullDocument.getMessage(), containsString("expected an object"));
	}

	@Test
	void load_readsFile(@TempDir Path dir) throws IOException {
		Path file = dir.resolve("tsconfig.json");
		Files.writeString(file, "{ \"compilerOptions\": { \"strictNullChecks\": true } }");
		CompatProfile profile = loader.load(file);
		assertEquals(CompatProfile.DEFAULT.withStrictNullChecks(true), profile);
	}

	@Test
	void load_malformedFile_namesThePath(@TempDir Path dir) throws IOException {
		Path file = dir.resolve("tsconfig.json");
		Files.writeString(file, "{ oops");
		ConfigurationException e = assertThrows(ConfigurationException.class, () -> loader.load(file));
		assertThat(e.getMessage(), startsWith(file + ": Malformed tsconfig"));
		assertTrue(e.getCause() instanceof ConfigurationException);
	}

	@Test
	void load_missingFile_throws(@TempDir Path dir) {
		Path missing = dir.resolve("nope.json");
		ConfigurationException e = assertThrows(ConfigurationException.class, () -> loader.load(missing));
		assertThat(e.getMessage(), containsString("Unable to read"));
		assertTrue(e.getCause() instanceof IOException);
	}
}
