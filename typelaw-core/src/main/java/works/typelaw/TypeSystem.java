package works.typelaw;

import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.typelaw.env.DeclarationProvider;
import works.typelaw.env.TypeEnvironment;
import works.typelaw.evaluate.EvaluationResult;
import works.typelaw.evaluate.Evaluator;
import works.typelaw.guard.QueryContext;
import works.typelaw.judge.Judge;
import works.typelaw.judge.RelationResult;
import works.typelaw.lawyer.AssignabilityResult;
import works.typelaw.lawyer.CompatProfile;
import works.typelaw.lawyer.Lawyer;
import works.typelaw.lawyer.RelationCache;
import works.typelaw.types.TypeFactory;
import works.typelaw.types.TypeFormatter;
import works.typelaw.types.TypeId;
import works.typelaw.types.TypeInterner;

import static java.util.Objects.requireNonNull;
import static works.typelaw.logging.MappedDiagnosticContext.setupMDC;

/**
 * The queries a checker asks of the type system, for one session.
 * <p>
 * A session owns an environment, so declarations are resolved once per session;
 * the interner may be shared among sessions. Every method is safe to call from
 * multiple threads, and each call is an independent query with its own budgets.
 */
public final class TypeSystem {
	private final TypeSystemConfig config;
	private final TypeInterner interner;
	private final TypeFactory factory;
	private final TypeEnvironment environment;
	private final Evaluator evaluator;
	private final Judge judge;
	private final Lawyer lawyer;
	private final @Nullable RelationCache relationCache;
	private final TypeFormatter formatter;

	public TypeSystem(DeclarationProvider declarations) {
		this(new TypeInterner(), declarations, TypeSystemConfig.simple());
	}

	public TypeSystem(DeclarationProvider declarations, TypeSystemConfig config) {
		this(new TypeInterner(), declarations, config);
	}

	public TypeSystem(TypeInterner interner, DeclarationProvider declarations, TypeSystemConfig config) {
		this.config = requireNonNull(config);
		this.interner = requireNonNull(interner);
		this.factory = new TypeFactory(interner, config.limits().maxDistributionSize());
		this.environment = new TypeEnvironment(factory, requireNonNull(declarations), config.library().apply(factory));
		this.evaluator = new Evaluator(factory, environment, config.limits(), this::extendsType);
		this.judge = new Judge(factory, evaluator, config.limits());
		this.relationCache = config.relationCacheCapacity() > 0 ? new RelationCache(config.relationCacheCapacity()) : null;
		this.lawyer = new Lawyer(judge, config.limits(), config.rules(), relationCache);
		this.formatter = new TypeFormatter(interner, environment::nameOf);
		LOGGER.info("Created type system session {} with {}", config.sessionName(), config);
	}

	/**
	 * The <code>extends</code> test of a conditional type is assignability
	 * under the session's default profile.
	 */
	private boolean extendsType(TypeId check, TypeId extendsType, QueryContext ctx) {
		return lawyer.relate(check, extendsType, config.defaultProfile(), ctx);
	}

	public TypeSystemConfig config() {
		return config;
	}

	public TypeInterner interner() {
		return interner;
	}

	public TypeFactory factory() {
		return factory;
	}

	public TypeEnvironment environment() {
		return environment;
	}

	public Evaluator evaluator() {
		return evaluator;
	}

	public Judge judge() {
		return judge;
	}

	public Lawyer lawyer() {
		return lawyer;
	}

	public Optional<RelationCache> relationCache() {
		return Optional.ofNullable(relationCache);
	}

	public AssignabilityResult assignable(TypeId source, TypeId target) {
		return assignable(source, target, config.defaultProfile());
	}

	public AssignabilityResult assignable(TypeId source, TypeId target, CompatProfile profile) {
		try (var ignored = setupMDC(config.sessionName(), "assignable")) {
			return lawyer.assignable(source, target, profile);
		}
	}

	public boolean isAssignable(TypeId source, TypeId target) {
		return assignable(source, target).ok();
	}

	public RelationResult subtype(TypeId source, TypeId target) {
		try (var ignored = setupMDC(config.sessionName(), "subtype")) {
			return judge.subtype(source, target);
		}
	}

	public boolean isSubtype(TypeId source, TypeId target) {
		return subtype(source, target).holds();
	}

	public RelationResult identical(TypeId a, TypeId b) {
		try (var ignored = setupMDC(config.sessionName(), "identical")) {
			return judge.identical(a, b);
		}
	}

	public EvaluationResult evaluate(TypeId id) {
		try (var ignored = setupMDC(config.sessionName(), "evaluate")) {
			return evaluator.evaluateWithStatus(id);
		}
	}

	/**
	 * Applies a generic declaration or signature to type arguments and evaluates the result.
	 */
	public EvaluationResult instantiate(TypeId generic, List<TypeId> arguments) {
		try (var ignored = setupMDC(config.sessionName(), "instantiate")) {
			QueryContext ctx = new QueryContext(config.limits());
			TypeId result = evaluator.instantiate(generic, arguments, ctx);
			return conclude("Instantiation of " + generic, result, ctx);
		}
	}

	public EvaluationResult apparentType(TypeId id) {
		try (var ignored = setupMDC(config.sessionName(), "apparentType")) {
			QueryContext ctx = new QueryContext(config.limits());
			TypeId result = evaluator.apparentType(id, ctx);
			return conclude("Apparent type of " + id, result, ctx);
		}
	}

	public EvaluationResult keyOf(TypeId id) {
		try (var ignored = setupMDC(config.sessionName(), "keyOf")) {
			QueryContext ctx = new QueryContext(config.limits());
			TypeId result = evaluator.keyOf(id, ctx);
			return conclude("keyof " + id, result, ctx);
		}
	}

	public EvaluationResult indexAccess(TypeId object, TypeId index) {
		try (var ignored = setupMDC(config.sessionName(), "indexAccess")) {
			QueryContext ctx = new QueryContext(config.limits());
			TypeId result = evaluator.indexAccess(object, index, ctx);
			return conclude("Index access " + object + "[" + index + "]", result, ctx);
		}
	}

	public String format(TypeId id) {
		return formatter.format(id);
	}

	private static EvaluationResult conclude(String what, TypeId result, QueryContext ctx) {
		if (ctx.truncated()) {
			LOGGER.debug("{} truncated by {}", what, ctx.exhaustedBudgets());
		}
		return new EvaluationResult(result, ctx.truncated(), ctx.exhaustedBudgets());
	}

	@Override
	public String toString() {
		return "TypeSystem(" + config.sessionName() + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TypeSystem.class);
}
