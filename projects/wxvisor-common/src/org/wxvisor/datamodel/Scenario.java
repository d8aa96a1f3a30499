package org.wxvisor.datamodel;

/**
 * <p>The four theories that can be asserted, from plain paging up to
 * nested WXvisor translation with aliasing.</p>
 */
public enum Scenario {
    BASIC_PAGING(1, false, false),
    ALIASING(1, true, false),
    SINGLE_LEVEL_WX(1, true, true),
    NESTED_WXVISOR(2, true, true);

    private final int _numStages;

    private final boolean _aliasing;

    private final boolean _wxPolicy;

    Scenario(int numStages, boolean aliasing, boolean wxPolicy) {
        _numStages = numStages;
        _aliasing = aliasing;
        _wxPolicy = wxPolicy;
    }

    public int getNumStages() {
        return _numStages;
    }

    public boolean hasAliasing() {
        return _aliasing;
    }

    public boolean hasWxPolicy() {
        return _wxPolicy;
    }

    public boolean isNested() {
        return _numStages > 1;
    }
}
