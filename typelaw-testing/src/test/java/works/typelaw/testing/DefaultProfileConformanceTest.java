package works.typelaw.testing;

/**
 * Runs {@link RelationConformanceTest} against the default configuration.
 */
public class DefaultProfileConformanceTest extends RelationConformanceTest {
}
