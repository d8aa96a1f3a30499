package org.wxvisor.smt;


import com.microsoft.z3.BoolExpr;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.wxvisor.common.ConfigurationException;
import org.wxvisor.datamodel.AccessKind;
import org.wxvisor.datamodel.EncoderSettings;
import org.wxvisor.datamodel.Scenario;

import java.util.function.Consumer;

/**
 * <p>The individual isolation properties. Each check builds its scenario on
 * a fresh encoder, adds the property (negated when it is universal) and
 * solves it once.</p>
 */
public class PropertyChecker {

    private static final Logger LOGGER = LogManager.getLogger(PropertyChecker.class);

    /*
     * Build the scenario, add the property and solve.
     */
    private static VerificationResult check(String name, Scenario scenario,
            EncoderSettings settings, AddressAssignment addresses, QueryIntent intent,
            Consumer<ScenarioEncoder> property) {
        try (ScenarioEncoder enc = new ScenarioEncoder(scenario, settings, addresses)) {
            enc.computeEncoding();
            property.accept(enc);
            VerificationResult result = enc.verify(intent);
            LOGGER.info("{} [{}]: {}", name, scenario, result.getVerdict());
            return result;
        }
    }

    private static void requireAliasing(Scenario scenario) {
        if (!scenario.hasAliasing()) {
            throw new ConfigurationException(scenario + " has no aliases");
        }
    }

    private static void requireWxPolicy(Scenario scenario) {
        if (!scenario.hasWxPolicy()) {
            throw new ConfigurationException(scenario + " does not enforce W^X");
        }
    }

    private static PermissionBit requireBit(AccessKind kind) {
        PermissionBit bit = PermissionBit.governing(kind);
        if (bit == null) {
            throw new ConfigurationException("No permission bit governs " + kind.label() +
                    " accesses");
        }
        return bit;
    }

    /**
     * <p>The pinned mapping {@code mmu1(va) = pa} is realizable together with
     * a page-table entry that grants the requested access: the bit governing
     * the access kind is pinned clear and the access is requested.</p>
     */
    public static VerificationResult checkBasicMapping(EncoderSettings settings,
            AddressAssignment addresses, AccessKind kind) {
        return check("basic-mapping(" + kind.label() + ")", Scenario.BASIC_PAGING, settings,
                addresses, QueryIntent.WITNESS, enc -> {
                    PermissionBit bit = PermissionBit.governing(kind);
                    if (bit != null) {
                        enc.getPt1().assertPermission(bit, enc.getVa(), false);
                    }
                    AccessRequest request = new AccessRequest(enc.getVa(), kind);
                    enc.getEncoder().add(request + " granted",
                            enc.getComposed().granted(request));
                });
    }

    /**
     * Two synonyms of one frame cannot disagree on their page-table bits.
     */
    public static VerificationResult checkAliasPermissionSplit(EncoderSettings settings,
            AddressAssignment addresses) {
        return check("alias-permission-split", Scenario.ALIASING, settings, addresses,
                QueryIntent.COUNTEREXAMPLE, enc -> {
                    Encoder e = enc.getEncoder();
                    PermissionTable pt1 = enc.getPt1();
                    BoolExpr roSplit = e.Not(e.Eq(pt1.ro(enc.getVa()), pt1.ro(enc.getVa1())));
                    BoolExpr nxSplit = e.Not(e.Eq(pt1.nx(enc.getVa()), pt1.nx(enc.getVa1())));
                    e.add("permission split va ~ va1", e.Or(roSplit, nxSplit));
                });
    }

    /**
     * Two synonyms of one frame get the same composed outcome for an access.
     */
    public static VerificationResult checkAliasSoundness(Scenario scenario,
            EncoderSettings settings, AddressAssignment addresses, AccessKind kind) {
        requireAliasing(scenario);
        return check("alias-soundness(" + kind.label() + ")", scenario, settings, addresses,
                QueryIntent.COUNTEREXAMPLE, enc -> {
                    Encoder e = enc.getEncoder();
                    ComposedPermission c = enc.getComposed();
                    e.add("outcome split va1 ~ va2", e.Not(e.Eq(c.granted(enc.getVa1(), kind),
                            c.granted(enc.getVa2(), kind))));
                });
    }

    /**
     * Synonyms can exist under nested translation.
     */
    public static VerificationResult checkAliasMapping(EncoderSettings settings,
            AddressAssignment addresses) {
        return check("alias-mapping", Scenario.NESTED_WXVISOR, settings, addresses,
                QueryIntent.WITNESS, enc -> {
                });
    }

    /**
     * Some page table grants the access to {@code va}.
     */
    public static VerificationResult checkAccess(Scenario scenario, EncoderSettings settings,
            AddressAssignment addresses, AccessKind kind) {
        return check("access(" + kind.label() + ")", scenario, settings, addresses,
                QueryIntent.WITNESS, enc -> {
                    AccessRequest request = new AccessRequest(enc.getVa(), kind);
                    enc.getEncoder().add(request + " granted",
                            enc.getComposed().granted(request));
                });
    }

    /**
     * No page table grants both write and execute to {@code va}.
     */
    public static VerificationResult checkWriteAndExecute(Scenario scenario,
            EncoderSettings settings, AddressAssignment addresses) {
        requireWxPolicy(scenario);
        return check("write-and-execute", scenario, settings, addresses,
                QueryIntent.COUNTEREXAMPLE, enc -> {
                    Encoder e = enc.getEncoder();
                    ComposedPermission c = enc.getComposed();
                    e.add("write and execute va", e.And(c.granted(enc.getVa(), AccessKind.WRITE),
                            c.granted(enc.getVa(), AccessKind.EXECUTE)));
                });
    }

    /**
     * An access granted through {@code va} is also granted through its alias.
     */
    public static VerificationResult checkAliasAccessSplit(Scenario scenario,
            EncoderSettings settings, AddressAssignment addresses, AccessKind kind) {
        requireAliasing(scenario);
        return check("alias-access-split(" + kind.label() + ")", scenario, settings, addresses,
                QueryIntent.COUNTEREXAMPLE, enc -> {
                    Encoder e = enc.getEncoder();
                    ComposedPermission c = enc.getComposed();
                    AccessRequest direct = new AccessRequest(enc.getVa(), kind);
                    AccessRequest alias = new AccessRequest(enc.getVa1(), kind);
                    e.add(direct + " granted but not " + alias,
                            e.And(c.granted(direct), e.Not(c.granted(alias))));
                });
    }

    /**
     * <p>An access of the given kind is never granted when the bit governing
     * it is set on the physical frame. The solver chooses the access kind,
     * which is then constrained to the one under test.</p>
     */
    public static VerificationResult checkWxEnforcement(Scenario scenario,
            EncoderSettings settings, AddressAssignment addresses, AccessKind kind) {
        PermissionBit bit = requireBit(kind);
        return check("wx-enforcement(" + kind.label() + ")", scenario, settings, addresses,
                QueryIntent.COUNTEREXAMPLE, enc -> {
                    Encoder e = enc.getEncoder();
                    SymbolicAccess access = new SymbolicAccess(e, enc.getComposed(),
                            enc.getVa(), "access");
                    enc.getPhysical().getFrames().assertPermission(bit, enc.getPa(), true);
                    e.add("access is " + kind.label(), access.isKind(kind));
                    e.add("access granted", access.getGranted());
                });
    }

    /**
     * <p>The guest table grants the access, the hypervisor table denies it:
     * the composed access must be denied.</p>
     */
    public static VerificationResult checkLeastPrivilege(EncoderSettings settings,
            AddressAssignment addresses, AccessKind kind) {
        PermissionBit bit = requireBit(kind);
        return check("least-privilege(" + kind.label() + ")", Scenario.NESTED_WXVISOR, settings,
                addresses, QueryIntent.COUNTEREXAMPLE, enc -> {
                    SymbolicAddress va = enc.getVa();
                    enc.getPt1().assertPermission(bit, va, false);
                    enc.getPt2().assertPermission(bit, enc.getMmu1().apply(va), true);
                    AccessRequest request = new AccessRequest(va, kind);
                    enc.getEncoder().add(request + " granted",
                            enc.getComposed().granted(request));
                });
    }

    /**
     * The hypervisor never maps two intermediate addresses to one frame.
     */
    public static VerificationResult checkStage2Alias(EncoderSettings settings,
            AddressAssignment addresses) {
        return check("stage2-alias", Scenario.NESTED_WXVISOR, settings, addresses,
                QueryIntent.COUNTEREXAMPLE, enc -> {
                    SymbolicAddress other = enc.mkIpa("ipa2", null);
                    enc.getAliases().assertAlias(enc.getIpa(), other, enc.getMmu2());
                });
    }
}
