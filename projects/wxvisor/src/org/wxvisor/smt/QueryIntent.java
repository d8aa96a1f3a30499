package org.wxvisor.smt;

/**
 * <p>What a satisfiable answer means for a query.</p>
 *
 * <p>A {@link #WITNESS} query asks whether some page-table configuration
 * realizes the asserted facts: SAT is the expected outcome and the model is
 * an example. A {@link #COUNTEREXAMPLE} query asserts the negation of a
 * property that must hold for every configuration: UNSAT means the property
 * holds, SAT means the model is a violating page table.</p>
 */
public enum QueryIntent {
    WITNESS,
    COUNTEREXAMPLE
}
