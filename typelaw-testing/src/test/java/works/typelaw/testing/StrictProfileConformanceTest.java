package works.typelaw.testing;

import org.junit.jupiter.api.BeforeEach;
import works.typelaw.TypeSystemConfig;
import works.typelaw.lawyer.CompatProfile;

public class StrictProfileConformanceTest extends RelationConformanceTest {

	@BeforeEach
	void setupConfig() {
		config = TypeSystemConfig.builder()
			.defaultProfile(CompatProfile.STRICT
				.withExactOptionalPropertyTypes(true)
				.withStrictAnyPropagation(true)
				.withBivariantMethodCheck(false)
				.withReadonlyPropertyLeniency(false)
				.withVoidReturnLeniency(false))
			.build();
	}

}
