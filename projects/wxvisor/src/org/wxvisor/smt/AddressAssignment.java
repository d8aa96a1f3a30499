package org.wxvisor.smt;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Concrete values for the named addresses of a scenario. A {@code null}
 * entry leaves that address free.
 */
public class AddressAssignment {

    private static final String VA_VAR = "va";

    private static final String VA1_VAR = "va1";

    private static final String VA2_VAR = "va2";

    private static final String IPA_VAR = "ipa";

    private static final String PA_VAR = "pa";

    private final Long _va;

    private final Long _va1;

    private final Long _va2;

    private final Long _ipa;

    private final Long _pa;

    @JsonCreator
    public AddressAssignment(
            @JsonProperty(VA_VAR) Long va,
            @JsonProperty(VA1_VAR) Long va1,
            @JsonProperty(VA2_VAR) Long va2,
            @JsonProperty(IPA_VAR) Long ipa,
            @JsonProperty(PA_VAR) Long pa) {
        _va = va;
        _va1 = va1;
        _va2 = va2;
        _ipa = ipa;
        _pa = pa;
    }

    public static AddressAssignment free() {
        return new AddressAssignment(null, null, null, null, null);
    }

    @JsonProperty(VA_VAR)
    public Long getVa() {
        return _va;
    }

    @JsonProperty(VA1_VAR)
    public Long getVa1() {
        return _va1;
    }

    @JsonProperty(VA2_VAR)
    public Long getVa2() {
        return _va2;
    }

    @JsonProperty(IPA_VAR)
    public Long getIpa() {
        return _ipa;
    }

    @JsonProperty(PA_VAR)
    public Long getPa() {
        return _pa;
    }

    Long[] values() {
        return new Long[] {_va, _va1, _va2, _ipa, _pa};
    }
}
