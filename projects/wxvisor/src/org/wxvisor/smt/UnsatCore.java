package org.wxvisor.smt;

import com.microsoft.z3.BoolExpr;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Names every asserted constraint so that, when tracking is enabled, an
 * unsatisfiable query can report which constraints conflict.
 */
public class UnsatCore {

    private boolean _doTrack;

    private Map<String, String> _trackingVars;

    private int _trackingNum;

    public UnsatCore(boolean doTrack) {
        _doTrack = doTrack;
        _trackingVars = new HashMap<>();
        _trackingNum = 0;
    }

    /*
     * Candidate name for the next tracking literal.
     */
    String nextName() {
        String name = "Pred" + _trackingNum;
        _trackingNum = _trackingNum + 1;
        return name;
    }

    public void track(SatOracle oracle, BoolExpr tracker, String label, BoolExpr be) {
        _trackingVars.put(tracker.toString(), label);
        oracle.addTracked(be, tracker);
    }

    /*
     * Translate the tracking literals of a core back into constraint labels.
     */
    public List<String> labels(BoolExpr[] core) {
        List<String> result = new ArrayList<>();
        for (BoolExpr be : core) {
            String label = _trackingVars.get(be.toString());
            result.add(label == null ? be.toString() : label);
        }
        return result;
    }

    public boolean isTracking() {
        return _doTrack;
    }
}
