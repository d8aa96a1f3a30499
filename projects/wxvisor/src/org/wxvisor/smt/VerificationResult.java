package org.wxvisor.smt;


import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

public class VerificationResult {

    private static final String VERDICT_VAR = "verdict";

    private static final String INTENT_VAR = "intent";

    private static final String MODEL_VAR = "model";

    private static final String UNSAT_CORE_VAR = "unsatCore";

    private static final String REASON_UNKNOWN_VAR = "reasonUnknown";

    private static final String STATISTICS_VAR = "statistics";

    private Verdict _verdict;

    private QueryIntent _intent;

    private SortedMap<String, String> _model;

    private List<String> _unsatCore;

    private String _reasonUnknown;

    private VerificationStats _statistics;

    @JsonCreator
    public VerificationResult(
            @JsonProperty(VERDICT_VAR) Verdict verdict,
            @JsonProperty(INTENT_VAR) QueryIntent intent,
            @JsonProperty(MODEL_VAR) SortedMap<String, String> model,
            @JsonProperty(UNSAT_CORE_VAR) List<String> unsatCore,
            @JsonProperty(REASON_UNKNOWN_VAR) String reasonUnknown,
            @JsonProperty(STATISTICS_VAR) VerificationStats statistics) {
        _verdict = verdict;
        _intent = intent;
        _model = (model == null ? new TreeMap<>() : model);
        _unsatCore = (unsatCore == null ? Collections.emptyList() : unsatCore);
        _reasonUnknown = reasonUnknown;
        _statistics = statistics;
    }

    @JsonProperty(VERDICT_VAR)
    public Verdict getVerdict() {
        return _verdict;
    }

    @JsonProperty(INTENT_VAR)
    public QueryIntent getIntent() {
        return _intent;
    }

    /**
     * A witness query is verified when SAT, a counterexample query when UNSAT.
     * An UNKNOWN verdict never verifies anything.
     */
    @JsonIgnore
    public boolean getVerified() {
        if (_intent == QueryIntent.WITNESS) {
            return _verdict == Verdict.SAT;
        }
        return _verdict == Verdict.UNSAT;
    }

    @JsonIgnore
    public boolean isInconclusive() {
        return _verdict == Verdict.UNKNOWN;
    }

    /**
     * The witness assignment, empty unless the verdict is SAT.
     */
    @JsonProperty(MODEL_VAR)
    public SortedMap<String, String> getModel() {
        return _model;
    }

    @JsonProperty(UNSAT_CORE_VAR)
    public List<String> getUnsatCore() {
        return _unsatCore;
    }

    @JsonProperty(REASON_UNKNOWN_VAR)
    public String getReasonUnknown() {
        return _reasonUnknown;
    }

    @JsonProperty(STATISTICS_VAR)
    public VerificationStats getStatistics() {
        return _statistics;
    }

    public String prettyPrint(String indent) {
        StringBuilder sb = new StringBuilder();
        sb.append(_verdict).append("\n");
        if (_verdict == Verdict.SAT) {
            _model.forEach((var, val) -> {
                sb.append(indent).append(var).append(" -> ").append(val).append("\n");
            });
        } else if (_verdict == Verdict.UNKNOWN && _reasonUnknown != null) {
            sb.append(indent).append("reason: ").append(_reasonUnknown).append("\n");
        } else if (!_unsatCore.isEmpty()) {
            sb.append(indent).append("core: ").append(String.join(", ", _unsatCore)).append("\n");
        }
        return sb.toString();
    }

}
