package org.wxvisor.smt;

import org.junit.Test;
import org.wxvisor.common.ConfigurationException;
import org.wxvisor.common.WxvisorException;
import org.wxvisor.datamodel.EncoderSettings;
import org.wxvisor.datamodel.Scenario;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThrows;

public class ScenarioEncoderTest {

    private static final AddressAssignment ADDRESSES =
            new AddressAssignment(0x12345000L, 0x23456000L, null, null, null);

    @Test
    public void everyScenarioIsSatisfiable() {
        for (Scenario s : Scenario.values()) {
            try (ScenarioEncoder enc = new ScenarioEncoder(s, new EncoderSettings(), ADDRESSES)) {
                enc.computeEncoding();
                VerificationResult r = enc.verify(QueryIntent.WITNESS);
                assertThat(s.toString(), r.getVerdict(), equalTo(Verdict.SAT));
                assertThat(r.getModel(), hasEntry("va", "0x12345000"));
            }
        }
    }

    @Test
    public void nestedWitnessShowsBothStages() {
        AddressAssignment a = new AddressAssignment(0x1000L, null, null, 0x5000L, 0x9000L);
        try (ScenarioEncoder enc = new ScenarioEncoder(Scenario.NESTED_WXVISOR,
                new EncoderSettings(), a)) {
            VerificationResult r = enc.verify(QueryIntent.WITNESS);
            assertThat(r.getVerdict(), equalTo(Verdict.SAT));
            assertThat(r.getModel(), hasEntry("mmu1(va)", "0x5000"));
            assertThat(r.getModel(), hasEntry("mmu2(ipa)", "0x9000"));
            assertThat(r.getModel(), hasKey("pt2_ro(mmu1(va))"));
            assertThat(r.getModel(), hasKey("phy_nx(pa)"));
        }
    }

    @Test
    public void aliasesReachTheSameFrame() {
        try (ScenarioEncoder enc = new ScenarioEncoder(Scenario.ALIASING,
                new EncoderSettings(), ADDRESSES)) {
            VerificationResult r = enc.verify(QueryIntent.WITNESS);
            assertThat(r.getModel().get("mmu1(va1)"), equalTo(r.getModel().get("mmu1(va)")));
            assertThat(r.getModel().get("mmu1(va2)"), equalTo(r.getModel().get("pa")));
        }
    }

    @Test
    public void nestedTracksIntermediateAddresses() {
        try (ScenarioEncoder enc = new ScenarioEncoder(Scenario.NESTED_WXVISOR,
                new EncoderSettings(), ADDRESSES)) {
            enc.computeEncoding();
            enc.mkIpa("ipa2", null);
            assertThat(enc.getIpaTerms().size(), equalTo(5));
        }
    }

    @Test
    public void singleLevelHasNoIntermediateAddresses() {
        try (ScenarioEncoder enc = new ScenarioEncoder(Scenario.SINGLE_LEVEL_WX,
                new EncoderSettings(), ADDRESSES)) {
            assertThat(enc.getIpa(), nullValue());
            assertThrows(WxvisorException.class, () -> enc.mkIpa("ipa2", null));
        }
    }

    @Test
    public void encodingIsComputedOnce() {
        try (ScenarioEncoder enc = new ScenarioEncoder(Scenario.BASIC_PAGING,
                new EncoderSettings(), ADDRESSES)) {
            enc.computeEncoding();
            assertThrows(WxvisorException.class, enc::computeEncoding);
        }
    }

    @Test
    public void addressMustFitWidth() {
        EncoderSettings s = new EncoderSettings();
        s.setAddressWidth(16);
        assertThrows(ConfigurationException.class,
                () -> new ScenarioEncoder(Scenario.BASIC_PAGING, s, ADDRESSES));
    }

    @Test
    public void missingScenarioIsRejected() {
        assertThrows(ConfigurationException.class,
                () -> new ScenarioEncoder(null, new EncoderSettings(), ADDRESSES));
    }

    @Test
    public void nestedQueryCannotBeVerifiedTwice() {
        try (ScenarioEncoder enc = new ScenarioEncoder(Scenario.NESTED_WXVISOR,
                new EncoderSettings(), ADDRESSES)) {
            enc.computeEncoding();
            assertThat(enc.verify(QueryIntent.WITNESS).getVerdict(), equalTo(Verdict.SAT));
            WxvisorException e = assertThrows(WxvisorException.class,
                    () -> enc.verify(QueryIntent.WITNESS));
            assertThat(e.getMessage(), containsString("cannot be verified again"));
        }
    }
}
