package org.wxvisor.smt;

import com.microsoft.z3.Status;

/**
 * The verdict of the oracle for one query, reported verbatim.
 */
public enum Verdict {
    SAT,
    UNSAT,
    UNKNOWN;

    static Verdict of(Status status) {
        switch (status) {
            case SATISFIABLE:
                return SAT;
            case UNSATISFIABLE:
                return UNSAT;
            default:
                return UNKNOWN;
        }
    }

    @Override
    public String toString() {
        return name().toLowerCase();
    }
}
