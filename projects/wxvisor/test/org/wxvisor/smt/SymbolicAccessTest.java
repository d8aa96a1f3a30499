package org.wxvisor.smt;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.wxvisor.datamodel.AccessKind;
import org.wxvisor.datamodel.AddressKind;
import org.wxvisor.datamodel.EncoderSettings;

import java.util.Collections;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasEntry;

public class SymbolicAccessTest {

    private Encoder _enc;

    private PermissionTable _pt1;

    private SymbolicAddress _va;

    private SymbolicAccess _access;

    @Before
    public void setup() {
        EncoderSettings s = new EncoderSettings();
        s.setAddressWidth(32);
        _enc = new Encoder(s, 1);
        TranslationFunction mmu1 = _enc.declareTranslation("mmu1", AddressKind.VA,
                AddressKind.PA);
        _pt1 = _enc.declarePermissionTable("pt1", AddressKind.VA);
        ComposedPermission composed = new ComposedPermission(_enc,
                Collections.singletonList(new TranslationStage(mmu1, _pt1)));
        _va = _enc.mkAddress(AddressKind.VA, "va", 0x1000L);
        _access = new SymbolicAccess(_enc, composed, _va, "access");
    }

    @After
    public void teardown() {
        _enc.close();
    }

    @Test
    public void solverPicksTheKind() {
        _pt1.assertPermission(PermissionBit.RO, _va, true);
        _pt1.assertPermission(PermissionBit.NX, _va, true);
        _enc.add("granted", _access.getGranted());
        VerificationResult r = _enc.verify(QueryIntent.WITNESS);
        assertThat(r.getVerdict(), equalTo(Verdict.SAT));
        assertThat(r.getModel(), hasEntry("access_kind", "READ"));
        assertThat(r.getModel(), hasEntry("access_granted", "true"));
    }

    @Test
    public void deniedKindIsNotGranted() {
        _pt1.assertPermission(PermissionBit.NX, _va, true);
        _enc.add("execute", _access.isKind(AccessKind.EXECUTE));
        _enc.add("granted", _access.getGranted());
        assertThat(_enc.verify(QueryIntent.COUNTEREXAMPLE).getVerdict(),
                equalTo(Verdict.UNSAT));
    }
}
