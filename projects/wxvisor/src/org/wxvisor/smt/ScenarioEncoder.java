package org.wxvisor.smt;


import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.wxvisor.common.ConfigurationException;
import org.wxvisor.common.WxvisorException;
import org.wxvisor.datamodel.AddressKind;
import org.wxvisor.datamodel.EncoderSettings;
import org.wxvisor.datamodel.Scenario;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;


/**
 * <p>Builds the theory of one {@link Scenario} on a fresh {@link Encoder}.
 * The scenario decides which steps are asserted:</p>
 *
 * <ul>
 *     <li>{@code va} and {@code pa} are page aligned and {@code mmu1(va)} is
 *     pinned to {@code pa}, or to {@code ipa} with {@code mmu2(ipa) = pa}
 *     when translation is nested.</li>
 *     <li>With aliasing, {@code va1} and {@code va2} are distinct synonyms
 *     of {@code va} at the first stage.</li>
 *     <li>Every mapping is bound to the permissions of its physical frame.</li>
 *     <li>W^X is asserted on the virtual addresses for single-level
 *     translation and on the physical frame for nested translation.</li>
 * </ul>
 *
 * <p>Properties are added on top of the computed encoding before
 * {@link #verify} is called.</p>
 */
public class ScenarioEncoder implements AutoCloseable {

    private static final Logger LOGGER = LogManager.getLogger(ScenarioEncoder.class);

    private Scenario _scenario;

    private AddressAssignment _addresses;

    private Encoder _enc;

    private SymbolicAddress _va;

    private SymbolicAddress _va1;

    private SymbolicAddress _va2;

    private SymbolicAddress _ipa;

    private SymbolicAddress _pa;

    private TranslationFunction _mmu1;

    private TranslationFunction _mmu2;

    private PermissionTable _pt1;

    private PermissionTable _pt2;

    private ComposedPermission _composed;

    private PhysicalMemory _physical;

    private AliasConstraints _aliases;

    private List<SymbolicAddress> _ipaTerms;

    private boolean _encoded;

    public ScenarioEncoder(Scenario scenario, EncoderSettings settings,
            AddressAssignment addresses) {
        this(scenario, settings, addresses, null);
    }

    public ScenarioEncoder(Scenario scenario, EncoderSettings settings,
            AddressAssignment addresses, SatOracle oracle) {
        checkConfiguration(scenario, settings, addresses);
        _scenario = scenario;
        _addresses = (addresses == null ? AddressAssignment.free() : addresses);
        _enc = new Encoder(settings, scenario.getNumStages(), oracle);
        _ipaTerms = new ArrayList<>();
        _encoded = false;
        initSymbols();
    }

    private static void checkConfiguration(Scenario scenario, EncoderSettings settings,
            AddressAssignment addresses) {
        if (scenario == null) {
            throw new ConfigurationException("Missing scenario");
        }
        if (settings == null) {
            throw new ConfigurationException("Missing encoder settings");
        }
        settings.validate();
        if (addresses != null) {
            for (Long value : addresses.values()) {
                if (value != null && !settings.fits(value)) {
                    throw new ConfigurationException("Address " + Encoder.hex(value) +
                            " does not fit in " + settings.getAddressWidth() + " bits");
                }
            }
        }
    }

    /*
     * Declare the addresses, translations and page tables of the scenario
     */
    private void initSymbols() {
        _va = _enc.mkAddress(AddressKind.VA, "va", _addresses.getVa());
        _pa = _enc.mkAddress(AddressKind.PA, "pa", _addresses.getPa());

        List<TranslationStage> stages = new ArrayList<>();
        if (_scenario.isNested()) {
            _ipa = _enc.mkAddress(AddressKind.IPA, "ipa", _addresses.getIpa());
            _ipaTerms.add(_ipa);
            _mmu1 = _enc.declareTranslation("mmu1", AddressKind.VA, AddressKind.IPA);
            _mmu2 = _enc.declareTranslation("mmu2", AddressKind.IPA, AddressKind.PA);
            _pt1 = _enc.declarePermissionTable("pt1", AddressKind.VA);
            _pt2 = _enc.declarePermissionTable("pt2", AddressKind.IPA);
            stages.add(new TranslationStage(_mmu1, _pt1));
            stages.add(new TranslationStage(_mmu2, _pt2));
        } else {
            _mmu1 = _enc.declareTranslation("mmu1", AddressKind.VA, AddressKind.PA);
            _pt1 = _enc.declarePermissionTable("pt1", AddressKind.VA);
            stages.add(new TranslationStage(_mmu1, _pt1));
        }

        if (_scenario.hasAliasing()) {
            _va1 = _enc.mkAddress(AddressKind.VA, "va1", _addresses.getVa1());
            _va2 = _enc.mkAddress(AddressKind.VA, "va2", _addresses.getVa2());
        }

        _composed = new ComposedPermission(_enc, stages);
        _physical = new PhysicalMemory(_enc);
        _aliases = new AliasConstraints(_enc);
    }

    /**
     * Assert the constraints of the scenario. Must be called once, before
     * any property is added.
     */
    public void computeEncoding() {
        if (_encoded) {
            throw new WxvisorException("Encoding of " + _scenario + " already computed");
        }
        _encoded = true;

        _enc.add("aligned va", _enc.pageAligned(_va));
        _enc.add("aligned pa", _enc.pageAligned(_pa));

        SymbolicAddress target = _pa;
        if (_scenario.isNested()) {
            _enc.add("aligned ipa", _enc.pageAligned(_ipa));
            _mmu2.assertMapping(_ipa, _pa);
            target = _ipa;
        }
        _mmu1.assertMapping(_va, target);

        List<SymbolicAddress> mapped = new ArrayList<>();
        mapped.add(_va);
        if (_scenario.hasAliasing()) {
            _enc.add("aligned va1", _enc.pageAligned(_va1));
            _enc.add("aligned va2", _enc.pageAligned(_va2));
            _aliases.assertDistinct(_va, _va1, _va2);
            _aliases.assertAlias(_va, _va1, _mmu1);
            _aliases.assertAlias(_va, _va2, _mmu1);
            mapped.add(_va1);
            mapped.add(_va2);
        }

        for (SymbolicAddress a : mapped) {
            if (_scenario.isNested()) {
                _ipaTerms.add(_mmu1.apply(a));
            }
            _physical.bind(_composed, a);
            _composed.observe(a);
        }

        if (_scenario.hasWxPolicy()) {
            if (_scenario.isNested()) {
                _physical.assertWxPolicy(_pa, getSettings().getWxPolicy());
            } else {
                for (SymbolicAddress a : mapped) {
                    _enc.add("W^X on " + a.getName(),
                            _composed.wxPolicy(a, getSettings().getWxPolicy()));
                }
            }
        }
        _physical.getFrames().observe(_pa);

        LOGGER.debug("Encoded {} with {} variables", _scenario, _enc.getAllVariables().size());
    }

    /**
     * Declare another intermediate physical address. It takes part in the
     * injectivity of the second stage like every other IPA of the query.
     */
    public SymbolicAddress mkIpa(String name, Long value) {
        if (!_scenario.isNested()) {
            throw new WxvisorException(_scenario + " has no intermediate physical addresses");
        }
        SymbolicAddress a = _enc.mkAddress(AddressKind.IPA, name, value);
        _enc.add("aligned " + name, _enc.pageAligned(a));
        _ipaTerms.add(a);
        return a;
    }

    /**
     * Solve the query. With nested translation, the second stage is first
     * constrained to be injective over every IPA the query mentions.
     */
    public VerificationResult verify(QueryIntent intent) {
        if (!_encoded) {
            computeEncoding();
        }
        // once solved, leave the lifecycle error to the encoder
        if (_scenario.isNested() && _enc.getState() == QueryState.BUILDING) {
            _aliases.assertInjective(_mmu2, _ipaTerms);
        }
        return _enc.verify(intent);
    }

    @Override
    public void close() {
        _enc.close();
    }

    /*
     * Getters
     */

    public Scenario getScenario() {
        return _scenario;
    }

    public EncoderSettings getSettings() {
        return _enc.getSettings();
    }

    public Encoder getEncoder() {
        return _enc;
    }

    public SymbolicAddress getVa() {
        return _va;
    }

    public SymbolicAddress getVa1() {
        return _va1;
    }

    public SymbolicAddress getVa2() {
        return _va2;
    }

    public SymbolicAddress getIpa() {
        return _ipa;
    }

    public SymbolicAddress getPa() {
        return _pa;
    }

    public TranslationFunction getMmu1() {
        return _mmu1;
    }

    public TranslationFunction getMmu2() {
        return _mmu2;
    }

    public PermissionTable getPt1() {
        return _pt1;
    }

    public PermissionTable getPt2() {
        return _pt2;
    }

    public ComposedPermission getComposed() {
        return _composed;
    }

    public PhysicalMemory getPhysical() {
        return _physical;
    }

    public AliasConstraints getAliases() {
        return _aliases;
    }

    public List<SymbolicAddress> getIpaTerms() {
        return Collections.unmodifiableList(_ipaTerms);
    }
}
