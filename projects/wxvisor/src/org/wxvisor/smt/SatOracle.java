package org.wxvisor.smt;

import com.microsoft.z3.*;

/**
 * <p>The satisfiability oracle an {@link Encoder} talks to. One oracle is one
 * solver session: it is used for exactly one query and then closed.</p>
 *
 * <p>Terms are built with the oracle's own term factory ({@link #getCtx()});
 * the encoder relies on nothing else from the solver beyond the methods
 * declared here.</p>
 */
public interface SatOracle extends AutoCloseable {

    Context getCtx();

    BitVecExpr declareSymbol(String name, int width);

    BoolExpr declareBool(String name);

    <R extends Sort> FuncDecl<R> declareFunction(String name, Sort domain, R range);

    void add(BoolExpr formula);

    /**
     * Assert a formula and name it with a tracking literal so that it can be
     * reported in an unsat core.
     */
    void addTracked(BoolExpr formula, BoolExpr tracker);

    int getNumAssertions();

    Status checkSat();

    /**
     * Only valid after {@link #checkSat()} returned {@link Status#SATISFIABLE}.
     */
    Model getModel();

    BoolExpr[] getUnsatCore();

    String getReasonUnknown();

    @Override
    void close();

}
