package org.wxvisor.smt;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Status;
import org.junit.Test;
import org.wxvisor.common.ConfigurationException;
import org.wxvisor.common.WxvisorException;
import org.wxvisor.datamodel.AddressKind;
import org.wxvisor.datamodel.EncoderSettings;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThrows;

public class EncoderTest {

    private static EncoderSettings settings(int width) {
        EncoderSettings s = new EncoderSettings();
        s.setAddressWidth(width);
        return s;
    }

    @Test
    public void rejectsNonPositiveWidth() {
        assertThrows(ConfigurationException.class, () -> new Encoder(settings(0), 1));
        assertThrows(ConfigurationException.class, () -> new Encoder(settings(-8), 1));
    }

    @Test
    public void rejectsMissingStages() {
        assertThrows(ConfigurationException.class, () -> new Encoder(settings(32), 0));
    }

    @Test
    public void rejectsBadPageOffsetAndTimeout() {
        EncoderSettings s = settings(16);
        s.setPageOffsetBits(16);
        assertThrows(ConfigurationException.class, () -> new Encoder(s, 1));

        EncoderSettings t = settings(32);
        t.setTimeout(-1);
        assertThrows(ConfigurationException.class, () -> new Encoder(t, 1));
    }

    @Test
    public void rejectsAddressWiderThanWidth() {
        try (Encoder enc = new Encoder(settings(16), 1)) {
            assertThrows(ConfigurationException.class,
                    () -> enc.mkAddress(AddressKind.VA, "va", 0x10000L));
            assertThat(enc.Addr(0xffffL), notNullValue());
        }
    }

    @Test
    public void witnessReportsPinnedMapping() {
        try (Encoder enc = new Encoder(settings(32), 1)) {
            SymbolicAddress va = enc.mkAddress(AddressKind.VA, "va", 0x1000L);
            SymbolicAddress pa = enc.mkAddress(AddressKind.PA, "pa", 0x9000L);
            TranslationFunction mmu1 = enc.declareTranslation("mmu1", AddressKind.VA,
                    AddressKind.PA);
            mmu1.assertMapping(va, pa);

            VerificationResult r = enc.verify(QueryIntent.WITNESS);
            assertThat(r.getVerdict(), equalTo(Verdict.SAT));
            assertThat(r.getVerified(), is(true));
            assertThat(r.getModel(), hasEntry("va", "0x1000"));
            assertThat(r.getModel(), hasEntry("mmu1(va)", "0x9000"));
            assertThat(r.getStatistics().getNumStages(), equalTo(1));
        }
    }

    @Test
    public void contradictoryPinningIsUnsat() {
        EncoderSettings s = settings(32);
        s.setUnsatCore(true);
        try (Encoder enc = new Encoder(s, 1)) {
            SymbolicAddress va = enc.mkAddress(AddressKind.VA, "va", 0x1000L);
            SymbolicAddress pa = enc.mkAddress(AddressKind.PA, "pa", 0x9000L);
            SymbolicAddress other = enc.mkAddress(AddressKind.PA, "other", 0xa000L);
            TranslationFunction mmu1 = enc.declareTranslation("mmu1", AddressKind.VA,
                    AddressKind.PA);
            mmu1.assertMapping(va, pa);
            mmu1.assertMapping(va, other);

            VerificationResult r = enc.verify(QueryIntent.WITNESS);
            assertThat(r.getVerdict(), equalTo(Verdict.UNSAT));
            assertThat(r.getVerified(), is(false));
            assertThat(r.getUnsatCore(), hasItems("map mmu1(va) = pa", "map mmu1(va) = other"));
        }
    }

    @Test
    public void unalignedAddressIsUnsat() {
        try (Encoder enc = new Encoder(settings(32), 1)) {
            SymbolicAddress va = enc.mkAddress(AddressKind.VA, "va", 0x1001L);
            enc.add("aligned va", enc.pageAligned(va));
            assertThat(enc.verify(QueryIntent.WITNESS).getVerdict(), equalTo(Verdict.UNSAT));
        }
    }

    @Test
    public void unknownIsInconclusive() {
        EncoderSettings s = settings(32);
        Z3Oracle oracle = new Z3Oracle(s) {
            @Override
            public Status checkSat() {
                return Status.UNKNOWN;
            }

            @Override
            public String getReasonUnknown() {
                return "timeout";
            }
        };
        try (Encoder enc = new Encoder(s, 1, oracle)) {
            enc.mkAddress(AddressKind.VA, "va", 0x1000L);
            VerificationResult r = enc.verify(QueryIntent.COUNTEREXAMPLE);
            assertThat(r.getVerdict(), equalTo(Verdict.UNKNOWN));
            assertThat(r.isInconclusive(), is(true));
            assertThat(r.getVerified(), is(false));
            assertThat(r.getReasonUnknown(), equalTo("timeout"));
            assertThat(r.getModel().isEmpty(), is(true));
        }
    }

    @Test
    public void lifecycleMovesForward() {
        Encoder enc = new Encoder(settings(32), 1);
        assertThat(enc.getState(), equalTo(QueryState.IDLE));
        SymbolicAddress va = enc.mkAddress(AddressKind.VA, "va");
        assertThat(enc.getState(), equalTo(QueryState.BUILDING));
        enc.verify(QueryIntent.WITNESS);
        assertThat(enc.getState(), equalTo(QueryState.SOLVED));

        assertThrows(WxvisorException.class, () -> enc.add("late", enc.pageAligned(va)));
        assertThrows(WxvisorException.class, () -> enc.mkAddress(AddressKind.PA, "pa"));
        assertThrows(WxvisorException.class, () -> enc.verify(QueryIntent.WITNESS));

        enc.close();
        assertThat(enc.getState(), equalTo(QueryState.DONE));
    }

    @Test
    public void duplicateSymbolIsRejected() {
        try (Encoder enc = new Encoder(settings(32), 1)) {
            enc.mkAddress(AddressKind.VA, "va");
            assertThrows(WxvisorException.class, () -> enc.mkAddress(AddressKind.VA, "va"));
        }
    }

    @Test
    public void trackersDoNotCaptureUserSymbols() {
        EncoderSettings s = settings(32);
        s.setUnsatCore(true);
        try (Encoder enc = new Encoder(s, 1)) {
            BoolExpr pred0 = enc.mkBool("Pred0");
            enc.add("Pred0 false", enc.Not(pred0));
            VerificationResult r = enc.verify(QueryIntent.WITNESS);
            assertThat(r.getVerdict(), equalTo(Verdict.SAT));
            assertThat(r.getModel(), hasEntry("Pred0", "false"));
        }
    }
}
