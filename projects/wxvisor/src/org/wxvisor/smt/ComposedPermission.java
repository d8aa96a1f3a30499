package org.wxvisor.smt;

import com.microsoft.z3.BoolExpr;
import org.wxvisor.common.WxvisorException;
import org.wxvisor.datamodel.AccessKind;
import org.wxvisor.datamodel.WxPolicy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * <p>Derives the effective permission of an access that walks a chain of
 * translation stages, e.g. {@code va --mmu1--> ipa --mmu2--> pa}.</p>
 *
 * <p>The effective grant is the conjunction of the grants of every stage,
 * each stage looking up its own page table at the address that enters it:</p>
 *
 * <pre>
 * effective(va, k) = stage1(va, k) AND stage2(mmu1(va), k) AND ...
 * </pre>
 *
 * <p>Any stage denying an access denies the composed access.</p>
 */
public class ComposedPermission {

    private Encoder _enc;

    private List<TranslationStage> _stages;

    public ComposedPermission(Encoder enc, List<TranslationStage> stages) {
        if (stages.size() != enc.getNumStages()) {
            throw new WxvisorException("Encoder models " + enc.getNumStages() +
                    " stages but " + stages.size() + " were given");
        }
        for (int i = 1; i < stages.size(); i++) {
            TranslationFunction prev = stages.get(i - 1).getMmu();
            TranslationFunction next = stages.get(i).getMmu();
            if (prev.getRange() != next.getDomain()) {
                throw new WxvisorException("Cannot compose " + next.getName() + " after " +
                        prev.getName());
            }
        }
        _enc = enc;
        _stages = Collections.unmodifiableList(new ArrayList<>(stages));
    }

    /**
     * The addresses visited by a translation, starting with the input
     * and ending with the final output address.
     */
    public List<SymbolicAddress> path(SymbolicAddress va) {
        List<SymbolicAddress> path = new ArrayList<>();
        SymbolicAddress current = va;
        path.add(current);
        for (TranslationStage stage : _stages) {
            current = stage.getMmu().apply(current);
            path.add(current);
        }
        return path;
    }

    public SymbolicAddress translate(SymbolicAddress va) {
        List<SymbolicAddress> path = path(va);
        return path.get(path.size() - 1);
    }

    public BoolExpr granted(AccessRequest request) {
        return granted(request.getAddress(), request.getKind());
    }

    public BoolExpr granted(SymbolicAddress va, AccessKind kind) {
        List<SymbolicAddress> path = path(va);
        BoolExpr[] grants = new BoolExpr[_stages.size()];
        for (int i = 0; i < _stages.size(); i++) {
            grants[i] = _stages.get(i).getTable().grants(path.get(i), kind);
        }
        return _enc.And(grants);
    }

    /**
     * The bit is set at some traversed stage.
     */
    public BoolExpr bitSet(PermissionBit bit, SymbolicAddress va) {
        List<SymbolicAddress> path = path(va);
        BoolExpr[] bits = new BoolExpr[_stages.size()];
        for (int i = 0; i < _stages.size(); i++) {
            bits[i] = _stages.get(i).getTable().getBit(bit, path.get(i));
        }
        return _enc.Or(bits);
    }

    public BoolExpr wxPolicy(SymbolicAddress va, WxPolicy policy) {
        return wxPolicy(_enc, granted(va, AccessKind.WRITE), granted(va, AccessKind.EXECUTE),
                policy);
    }

    /*
     * The W^X rule over a pair of write and execute grants.
     */
    static BoolExpr wxPolicy(Encoder enc, BoolExpr write, BoolExpr execute, WxPolicy policy) {
        switch (policy) {
            case TOGGLE:
                return enc.Not(enc.Eq(write, execute));
            case EXCLUSIVE:
            default:
                return enc.Not(enc.And(write, execute));
        }
    }

    /**
     * Report every address and permission bit on the translation path
     * of {@code va} in the witness.
     */
    public void observe(SymbolicAddress va) {
        List<SymbolicAddress> path = path(va);
        for (int i = 0; i < _stages.size(); i++) {
            _stages.get(i).getTable().observe(path.get(i));
            SymbolicAddress next = path.get(i + 1);
            _enc.observe(next.getName(), next.getExpr());
        }
    }

    public List<TranslationStage> getStages() {
        return _stages;
    }
}
