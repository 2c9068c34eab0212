package works.typelaw.testing;

public class DefaultEvaluatorConformanceTest extends EvaluatorConformanceTest {
}
