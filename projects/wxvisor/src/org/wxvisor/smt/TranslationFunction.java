package org.wxvisor.smt;

import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.BitVecSort;
import com.microsoft.z3.FuncDecl;
import org.wxvisor.common.WxvisorException;
import org.wxvisor.datamodel.AddressKind;

/**
 * <p>One translation stage of the MMU, for example {@code mmu1: VA -> IPA}.
 * The stage is an uninterpreted function: it is total and deterministic in
 * every model, and its table is otherwise left to the solver except where
 * specific entries are pinned with {@link #assertMapping}.</p>
 */
public class TranslationFunction {

    private Encoder _enc;

    private String _name;

    private AddressKind _domain;

    private AddressKind _range;

    private FuncDecl<BitVecSort> _decl;

    TranslationFunction(Encoder enc, String name, AddressKind domain, AddressKind range,
            FuncDecl<BitVecSort> decl) {
        _enc = enc;
        _name = name;
        _domain = domain;
        _range = range;
        _decl = decl;
    }

    /**
     * The image of an address under this stage, named {@code name(input)}.
     */
    public SymbolicAddress apply(SymbolicAddress input) {
        if (input.getKind() != _domain) {
            throw new WxvisorException(_name + " translates " + _domain + " addresses, not " +
                    input);
        }
        BitVecExpr image = (BitVecExpr) _enc.getCtx().mkApp(_decl, input.getExpr());
        return new SymbolicAddress(_range, _name + "(" + input.getName() + ")", image);
    }

    /**
     * Pin one entry of the table: {@code name(input) = output}. Two pinnings
     * of the same input to different outputs make the query unsatisfiable.
     */
    public void assertMapping(SymbolicAddress input, SymbolicAddress output) {
        if (output.getKind() != _range) {
            throw new WxvisorException(_name + " maps to " + _range + " addresses, not " + output);
        }
        SymbolicAddress image = apply(input);
        _enc.add("map " + image.getName() + " = " + output.getName(),
                _enc.Eq(image.getExpr(), output.getExpr()));
        _enc.observe(image.getName(), image.getExpr());
    }

    public String getName() {
        return _name;
    }

    public AddressKind getDomain() {
        return _domain;
    }

    public AddressKind getRange() {
        return _range;
    }
}
