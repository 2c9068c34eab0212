package works.typelaw.testing;

import org.junit.jupiter.api.BeforeEach;
import works.typelaw.TypeSystemConfig;
import works.typelaw.lawyer.CompatProfile;

/**
 * A cache that fills up partway through the suite must still give the same answers.
 */
public class SmallCacheConformanceTest extends RelationConformanceTest {

	@BeforeEach
	void setupConfig() {
		config = TypeSystemConfig.builder()
			.defaultProfile(CompatProfile.STRICT)
			.relationCacheCapacity(50)
			.build();
	}

}
