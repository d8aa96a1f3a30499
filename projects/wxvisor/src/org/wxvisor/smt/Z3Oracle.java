package org.wxvisor.smt;

import com.microsoft.z3.*;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.wxvisor.common.OracleUnavailableException;
import org.wxvisor.datamodel.EncoderSettings;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * A {@link SatOracle} backed by a private Z3 context and solver.
 */
public class Z3Oracle implements SatOracle {

    private static final Logger LOGGER = LogManager.getLogger(Z3Oracle.class);

    private Context _ctx;

    private Solver _solver;

    public Z3Oracle(EncoderSettings settings) {
        HashMap<String, String> cfg = new HashMap<>();
        cfg.put("model", "true");

        // allows for unsat core when tracking constraints
        if (settings.getUnsatCore()) {
            cfg.put("unsat_core", "true");
        }

        _ctx = mkContext(cfg, Context::new);
        _solver = _ctx.mkSolver();

        if (settings.getTimeout() > 0) {
            Params p = _ctx.mkParams();
            p.add("timeout", settings.getTimeout());
            _solver.setParameters(p);
        }
        LOGGER.debug("Created Z3 session ({})", settings);
    }

    /*
     * Create the context, reporting any failure to load or start Z3 as an
     * unavailable oracle.
     */
    static Context mkContext(Map<String, String> cfg,
            Function<Map<String, String>, Context> factory) {
        try {
            return factory.apply(cfg);
        } catch (UnsatisfiedLinkError | ExceptionInInitializerError | NoClassDefFoundError e) {
            throw new OracleUnavailableException("Unable to load the Z3 native library", e);
        } catch (Z3Exception e) {
            throw new OracleUnavailableException("Unable to create a Z3 context", e);
        }
    }

    @Override
    public Context getCtx() {
        return _ctx;
    }

    @Override
    public BitVecExpr declareSymbol(String name, int width) {
        return _ctx.mkBVConst(name, width);
    }

    @Override
    public BoolExpr declareBool(String name) {
        return _ctx.mkBoolConst(name);
    }

    @Override
    public <R extends Sort> FuncDecl<R> declareFunction(String name, Sort domain, R range) {
        return _ctx.mkFuncDecl(name, domain, range);
    }

    @Override
    public void add(BoolExpr formula) {
        _solver.add(formula);
    }

    @Override
    public void addTracked(BoolExpr formula, BoolExpr tracker) {
        _solver.assertAndTrack(formula, tracker);
    }

    @Override
    public int getNumAssertions() {
        return _solver.getNumAssertions();
    }

    @Override
    public Status checkSat() {
        return _solver.check();
    }

    @Override
    public Model getModel() {
        return _solver.getModel();
    }

    @Override
    public BoolExpr[] getUnsatCore() {
        return _solver.getUnsatCore();
    }

    @Override
    public String getReasonUnknown() {
        return _solver.getReasonUnknown();
    }

    @Override
    public void close() {
        if (_ctx != null) {
            _ctx.close();
            _ctx = null;
            _solver = null;
        }
    }
}
