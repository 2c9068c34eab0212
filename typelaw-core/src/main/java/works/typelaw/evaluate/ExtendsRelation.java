package works.typelaw.evaluate;

import works.typelaw.guard.QueryContext;
import works.typelaw.types.TypeId;

/**
 * Decides the <code>extends</code> test of a conditional type.
 * Supplied by whoever wires the evaluator to a relation,
 * since the test follows assignability rather than strict subtyping.
 */
@FunctionalInterface
public interface ExtendsRelation {
	boolean extendsType(TypeId check, TypeId extendsType, QueryContext ctx);
}
