package org.wxvisor.smt;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public class VerificationStats {

    private static final String NUM_STAGES_VAR = "numStages";

    private static final String NUM_VARIABLES_VAR = "numVariables";

    private static final String NUM_CONSTRAINTS_VAR = "numConstraints";

    private static final String TIME_VAR = "time";

    private int _numStages;

    private int _numVariables;

    private int _numConstraints;

    private long _time;

    @JsonCreator
    public VerificationStats(
            @JsonProperty(NUM_STAGES_VAR) int s,
            @JsonProperty(NUM_VARIABLES_VAR) int v,
            @JsonProperty(NUM_CONSTRAINTS_VAR) int c,
            @JsonProperty(TIME_VAR) long t) {
        _numStages = s;
        _numVariables = v;
        _numConstraints = c;
        _time = t;
    }

    @JsonProperty(NUM_STAGES_VAR)
    public int getNumStages() {
        return _numStages;
    }

    @JsonProperty(NUM_VARIABLES_VAR)
    public int getNumVariables() {
        return _numVariables;
    }

    @JsonProperty(NUM_CONSTRAINTS_VAR)
    public int getNumConstraints() {
        return _numConstraints;
    }

    @JsonProperty(TIME_VAR)
    public long getTime() {
        return _time;
    }

}
