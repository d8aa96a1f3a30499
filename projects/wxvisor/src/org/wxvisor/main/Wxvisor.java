package org.wxvisor.main;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.wxvisor.common.plugin.IWxvisor;
import org.wxvisor.datamodel.AccessKind;
import org.wxvisor.datamodel.EncoderSettings;
import org.wxvisor.datamodel.Scenario;
import org.wxvisor.datamodel.answers.AnswerElement;
import org.wxvisor.smt.AddressAssignment;
import org.wxvisor.smt.PropertyChecker;
import org.wxvisor.smt.VerificationResult;
import org.wxvisor.smt.answers.SmtManyAnswerElement;
import org.wxvisor.smt.answers.SmtOneAnswerElement;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Runs the battery of checks of each scenario.
 */
public class Wxvisor implements IWxvisor {

    private static final Logger LOGGER = LogManager.getLogger(Wxvisor.class);

    private static final List<AccessKind> GUARDED_KINDS =
            Arrays.asList(AccessKind.WRITE, AccessKind.EXECUTE);

    private static List<AccessKind> kinds(AccessKind kind) {
        return kind == null ? GUARDED_KINDS : Collections.singletonList(kind);
    }

    private static void add(SmtManyAnswerElement answer, String name, VerificationResult r) {
        answer.addResult(name, r);
        if (r.isInconclusive()) {
            LOGGER.warn("{} is inconclusive: {}", name, r.getReasonUnknown());
        } else if (!r.getVerified()) {
            LOGGER.warn("{} did not verify, got {}", name, r.getVerdict());
        }
    }

    /**
     * One access kind gives a single answer, no kind runs all three.
     */
    @Override
    public AnswerElement smtBasicPaging(EncoderSettings settings, Long va, Long pa,
            AccessKind kind) {
        AddressAssignment addresses = new AddressAssignment(va, null, null, null, pa);
        if (kind != null) {
            return new SmtOneAnswerElement("basic-mapping(" + kind.label() + ")",
                    PropertyChecker.checkBasicMapping(settings, addresses, kind));
        }
        SmtManyAnswerElement answer = new SmtManyAnswerElement();
        for (AccessKind k : AccessKind.values()) {
            add(answer, "basic-mapping(" + k.label() + ")",
                    PropertyChecker.checkBasicMapping(settings, addresses, k));
        }
        return answer;
    }

    @Override
    public AnswerElement smtAliasing(EncoderSettings settings, Long va, Long va1, Long va2,
            Long pa, AccessKind kind) {
        AddressAssignment addresses = new AddressAssignment(va, va1, va2, null, pa);
        Scenario s = Scenario.ALIASING;
        SmtManyAnswerElement answer = new SmtManyAnswerElement();
        add(answer, "alias-permission-split",
                PropertyChecker.checkAliasPermissionSplit(settings, addresses));
        for (AccessKind k : kinds(kind)) {
            add(answer, "alias-soundness(" + k.label() + ")",
                    PropertyChecker.checkAliasSoundness(s, settings, addresses, k));
            add(answer, "alias-access-split(" + k.label() + ")",
                    PropertyChecker.checkAliasAccessSplit(s, settings, addresses, k));
        }
        return answer;
    }

    @Override
    public AnswerElement smtSingleLevelWx(EncoderSettings settings, Long va, Long va1,
            Long va2, Long pa) {
        AddressAssignment addresses = new AddressAssignment(va, va1, va2, null, pa);
        SmtManyAnswerElement answer = new SmtManyAnswerElement();
        wxBattery(answer, Scenario.SINGLE_LEVEL_WX, settings, addresses);
        return answer;
    }

    @Override
    public AnswerElement smtWxvisor(EncoderSettings settings, Long va, Long va1, Long va2,
            Long ipa, Long pa) {
        AddressAssignment addresses = new AddressAssignment(va, va1, va2, ipa, pa);
        Scenario s = Scenario.NESTED_WXVISOR;
        SmtManyAnswerElement answer = new SmtManyAnswerElement();
        add(answer, "alias-mapping", PropertyChecker.checkAliasMapping(settings, addresses));
        wxBattery(answer, s, settings, addresses);
        for (AccessKind k : GUARDED_KINDS) {
            add(answer, "alias-soundness(" + k.label() + ")",
                    PropertyChecker.checkAliasSoundness(s, settings, addresses, k));
        }
        add(answer, "stage2-alias", PropertyChecker.checkStage2Alias(settings, addresses));
        return answer;
    }

    @Override
    public AnswerElement smtLeastPrivilege(EncoderSettings settings, Long va, Long ipa,
            Long pa, AccessKind kind) {
        AddressAssignment addresses = new AddressAssignment(va, null, null, ipa, pa);
        SmtManyAnswerElement answer = new SmtManyAnswerElement();
        for (AccessKind k : kinds(kind)) {
            add(answer, "least-privilege(" + k.label() + ")",
                    PropertyChecker.checkLeastPrivilege(settings, addresses, k));
            add(answer, "wx-enforcement(" + k.label() + ")", PropertyChecker
                    .checkWxEnforcement(Scenario.NESTED_WXVISOR, settings, addresses, k));
        }
        return answer;
    }

    /*
     * The checks shared by both W^X scenarios
     */
    private void wxBattery(SmtManyAnswerElement answer, Scenario s, EncoderSettings settings,
            AddressAssignment addresses) {
        for (AccessKind k : GUARDED_KINDS) {
            add(answer, "access(" + k.label() + ")",
                    PropertyChecker.checkAccess(s, settings, addresses, k));
        }
        add(answer, "write-and-execute",
                PropertyChecker.checkWriteAndExecute(s, settings, addresses));
        for (AccessKind k : GUARDED_KINDS) {
            add(answer, "alias-access-split(" + k.label() + ")",
                    PropertyChecker.checkAliasAccessSplit(s, settings, addresses, k));
            add(answer, "wx-enforcement(" + k.label() + ")",
                    PropertyChecker.checkWxEnforcement(s, settings, addresses, k));
        }
    }
}
