package org.wxvisor.smt;


import com.microsoft.z3.*;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.wxvisor.common.ConfigurationException;
import org.wxvisor.common.WxvisorException;
import org.wxvisor.datamodel.AddressKind;
import org.wxvisor.datamodel.EncoderSettings;

import java.math.BigInteger;
import java.util.*;


/**
 * <p>A class responsible for building the symbolic encoding of a single
 * query: it declares the address and permission symbols, accumulates the
 * asserted constraints and finally hands their conjunction to the
 * satisfiability oracle.</p>
 *
 * <p>An encoder owns a private oracle session, so every query lives in a
 * fresh symbol namespace. The lifecycle is strictly forward:
 * {@code IDLE -> BUILDING -> ASSERTED -> SOLVED -> DONE}. Nothing can be
 * declared or asserted once the query has been handed to the oracle, and a
 * query is verified at most once.</p>
 *
 * <p>Terms registered with {@link #observe(String, Expr)} make up the
 * witness reported for a satisfiable query.</p>
 */
public class Encoder implements AutoCloseable {

    private static final Logger LOGGER = LogManager.getLogger(Encoder.class);

    private EncoderSettings _settings;

    private int _numStages;

    private SatOracle _oracle;

    private Context _ctx;

    private BitVecSort _addressSort;

    private QueryState _state;

    private Set<String> _symbolNames;

    private List<Expr<?>> _allVariables;

    private Map<String, Expr<?>> _witnessTerms;

    private Map<String, SymbolicEnum<?>> _witnessEnums;

    private UnsatCore _unsatCore;

    /**
     * Create an encoder with its own Z3 session.
     * @param settings  The width, page size, timeout and policy of the encoding
     * @param numStages  The number of translation stages of the model
     */
    public Encoder(EncoderSettings settings, int numStages) {
        this(settings, numStages, null);
    }

    /**
     * Create an encoder that talks to the given oracle. The settings are
     * checked before the oracle is touched. If the oracle is null, then a
     * new Z3 session is created.
     */
    public Encoder(EncoderSettings settings, int numStages, SatOracle oracle) {
        checkConfiguration(settings, numStages);
        _settings = new EncoderSettings(settings);
        _numStages = numStages;
        _oracle = (oracle == null ? new Z3Oracle(_settings) : oracle);
        _ctx = _oracle.getCtx();
        _addressSort = _ctx.mkBitVecSort(_settings.getAddressWidth());
        _state = QueryState.IDLE;
        _symbolNames = new HashSet<>();
        _allVariables = new ArrayList<>();
        _witnessTerms = new LinkedHashMap<>();
        _witnessEnums = new LinkedHashMap<>();
        _unsatCore = new UnsatCore(_settings.getUnsatCore());
    }

    private static void checkConfiguration(EncoderSettings settings, int numStages) {
        if (settings == null) {
            throw new ConfigurationException("Missing encoder settings");
        }
        settings.validate();
        if (numStages < 1) {
            throw new ConfigurationException("At least one translation stage is required, got " +
                    numStages);
        }
    }

    /*
     * Symbol declaration
     */

    /**
     * Declare a fresh, unconstrained address.
     */
    public SymbolicAddress mkAddress(AddressKind kind, String name) {
        BitVecExpr var = _oracle.declareSymbol(freshName(name), _settings.getAddressWidth());
        _allVariables.add(var);
        _witnessTerms.put(name, var);
        return new SymbolicAddress(kind, name, var);
    }

    /**
     * Declare an address and pin it to a concrete value. A null value leaves
     * the address unconstrained.
     */
    public SymbolicAddress mkAddress(AddressKind kind, String name, Long value) {
        BitVecExpr concrete = (value == null ? null : Addr(value));
        SymbolicAddress a = mkAddress(kind, name);
        if (concrete != null) {
            add(name + " = " + hex(value), Eq(a.getExpr(), concrete));
        }
        return a;
    }

    public BoolExpr mkBool(String name) {
        BoolExpr var = _oracle.declareBool(freshName(name));
        _allVariables.add(var);
        _witnessTerms.put(name, var);
        return var;
    }

    BitVecExpr mkBitVec(String name, int numBits) {
        BitVecExpr var = _oracle.declareSymbol(freshName(name), numBits);
        _allVariables.add(var);
        return var;
    }

    public TranslationFunction declareTranslation(String name, AddressKind domain,
            AddressKind range) {
        FuncDecl<BitVecSort> decl = _oracle.declareFunction(freshName(name), _addressSort,
                _addressSort);
        return new TranslationFunction(this, name, domain, range, decl);
    }

    public PermissionTable declarePermissionTable(String name, AddressKind kind) {
        BoolSort bool = _ctx.mkBoolSort();
        FuncDecl<BoolSort> ro = _oracle.declareFunction(freshName(name + "_ro"), _addressSort,
                bool);
        FuncDecl<BoolSort> nx = _oracle.declareFunction(freshName(name + "_nx"), _addressSort,
                bool);
        return new PermissionTable(this, name, kind, ro, nx);
    }

    private String freshName(String name) {
        checkBuilding();
        if (!_symbolNames.add(name)) {
            throw new WxvisorException("Symbol already declared in this query: " + name);
        }
        return name;
    }

    // A concrete address of the configured width
    public BitVecExpr Addr(long value) {
        if (!_settings.fits(value)) {
            throw new ConfigurationException("Address " + hex(value) + " does not fit in " +
                    _settings.getAddressWidth() + " bits");
        }
        return _ctx.mkBV(Long.toUnsignedString(value), _settings.getAddressWidth());
    }

    /**
     * The address has all of its page-offset bits clear.
     */
    public BoolExpr pageAligned(SymbolicAddress a) {
        int bits = _settings.getPageOffsetBits();
        if (bits == 0) {
            return True();
        }
        String mask = BigInteger.ONE.shiftLeft(bits).subtract(BigInteger.ONE).toString();
        BitVecExpr offset = _ctx.mkBVAND(a.getExpr(), _ctx.mkBV(mask, _settings.getAddressWidth()));
        return Eq(offset, _ctx.mkBV(0, _settings.getAddressWidth()));
    }

    // Symbolic true value
    public BoolExpr True() {
        return _ctx.mkTrue();
    }

    // Symbolic false value
    public BoolExpr False() {
        return _ctx.mkFalse();
    }

    // Symbolic boolean negation
    public BoolExpr Not(BoolExpr e) {
        return _ctx.mkNot(e);
    }

    // Symbolic boolean conjunction
    public BoolExpr And(BoolExpr... vals) {
        return _ctx.mkAnd(vals);
    }

    // Symbolic boolean disjunction
    public BoolExpr Or(BoolExpr... vals) {
        return _ctx.mkOr(vals);
    }

    // Symbolic boolean implication
    public BoolExpr Implies(BoolExpr e1, BoolExpr e2) {
        return _ctx.mkImplies(e1, e2);
    }

    // Symbolic equality of expressions
    public BoolExpr Eq(BoolExpr e1, BoolExpr e2) {
        return _ctx.mkEq(e1, e2);
    }

    public BoolExpr Eq(BitVecExpr e1, BitVecExpr e2) {
        return _ctx.mkEq(e1, e2);
    }

    // Pairwise distinct addresses
    public BoolExpr Distinct(SymbolicAddress... addresses) {
        BitVecExpr[] exprs = new BitVecExpr[addresses.length];
        for (int i = 0; i < addresses.length; i++) {
            exprs[i] = addresses[i].getExpr();
        }
        return _ctx.mkDistinct(exprs);
    }

    /**
     * Assert a named constraint. The label shows up in the unsat core when
     * constraint tracking is enabled.
     */
    public void add(String label, BoolExpr e) {
        checkBuilding();
        if (_unsatCore.isTracking()) {
            BoolExpr tracker = _oracle.declareBool(trackerName());
            _unsatCore.track(_oracle, tracker, label, e);
        } else {
            _oracle.add(e);
        }
    }

    /*
     * Tracking literals share the symbol namespace of the query. A tracker
     * skips any name already declared, and later declarations cannot reuse it.
     */
    private String trackerName() {
        String name = _unsatCore.nextName();
        while (_symbolNames.contains(name)) {
            name = _unsatCore.nextName();
        }
        return freshName(name);
    }

    /**
     * Report the value of a term in the witness of a satisfiable query.
     */
    public void observe(String label, Expr<?> e) {
        _witnessTerms.put(label, e);
    }

    void observe(String label, SymbolicEnum<?> e) {
        _witnessEnums.put(label, e);
    }

    private void checkBuilding() {
        if (_state == QueryState.IDLE) {
            _state = QueryState.BUILDING;
        }
        if (_state != QueryState.BUILDING) {
            throw new WxvisorException("Query is " + _state + ", no more constraints can be added");
        }
    }

    /**
     * <p>Hand the conjunction of all asserted constraints to the oracle and
     * interpret its answer. The intent tells whether SAT is the expected
     * outcome or a counterexample to a property.</p>
     *
     * @return A VerificationResult with the verdict and, if SAT, the witness.
     */
    public VerificationResult verify(QueryIntent intent) {
        if (_state != QueryState.IDLE && _state != QueryState.BUILDING) {
            throw new WxvisorException("Query is " + _state + " and cannot be verified again");
        }
        _state = QueryState.ASSERTED;

        int numVariables = _allVariables.size();
        int numConstraints = _oracle.getNumAssertions();
        long start = System.currentTimeMillis();
        Status status = _oracle.checkSat();
        long time = System.currentTimeMillis() - start;
        _state = QueryState.SOLVED;

        VerificationStats stats = new VerificationStats(_numStages, numVariables,
                numConstraints, time);
        LOGGER.debug("Solved {} constraints over {} variables in {} ms: {}", numConstraints,
                numVariables, time, status);

        Verdict verdict = Verdict.of(status);
        switch (verdict) {
            case SAT:
                return new VerificationResult(verdict, intent, witness(_oracle.getModel()), null,
                        null, stats);
            case UNSAT:
                List<String> core = null;
                if (_unsatCore.isTracking()) {
                    core = _unsatCore.labels(_oracle.getUnsatCore());
                }
                return new VerificationResult(verdict, intent, null, core, null, stats);
            default:
                String reason = _oracle.getReasonUnknown();
                LOGGER.warn("Satisfiability unknown: {}", reason);
                return new VerificationResult(verdict, intent, null, null, reason, stats);
        }
    }

    private SortedMap<String, String> witness(Model m) {
        SortedMap<String, String> model = new TreeMap<>();
        _witnessTerms.forEach((label, e) -> {
            model.put(label, format(m.evaluate(e, true)));
        });
        _witnessEnums.forEach((label, e) -> {
            Object value;
            if (e.getIndex() == null) {
                value = e.decode(0);
            } else {
                BitVecNum n = (BitVecNum) m.evaluate(e.getIndex(), true);
                value = e.decode(n.getInt());
            }
            model.put(label, value.toString());
        });
        return model;
    }

    private static String format(Expr<?> val) {
        if (val instanceof BitVecNum) {
            return "0x" + ((BitVecNum) val).getBigInteger().toString(16);
        }
        if (val.isTrue()) {
            return "true";
        }
        if (val.isFalse()) {
            return "false";
        }
        return val.toString();
    }

    static String hex(long value) {
        return "0x" + Long.toHexString(value);
    }

    /**
     * Release the oracle session. The query cannot be used afterwards.
     */
    @Override
    public void close() {
        if (_state != QueryState.DONE) {
            _state = QueryState.DONE;
            _oracle.close();
        }
    }

    /*
     * Getters
     */

    public Context getCtx() {
        return _ctx;
    }

    public EncoderSettings getSettings() {
        return _settings;
    }

    public int getNumStages() {
        return _numStages;
    }

    public QueryState getState() {
        return _state;
    }

    List<Expr<?>> getAllVariables() {
        return _allVariables;
    }
}
