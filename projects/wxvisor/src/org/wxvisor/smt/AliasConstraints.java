package org.wxvisor.smt;

import com.microsoft.z3.BoolExpr;

import java.util.List;

/**
 * Builds the constraints that relate several addresses through one
 * translation stage: synonyms that share a frame, and stages that forbid them.
 */
public class AliasConstraints {

    private Encoder _enc;

    public AliasConstraints(Encoder enc) {
        _enc = enc;
    }

    /**
     * {@code va1 != va2 AND fn(va1) == fn(va2)}
     */
    public void assertAlias(SymbolicAddress va1, SymbolicAddress va2, TranslationFunction fn) {
        SymbolicAddress t1 = fn.apply(va1);
        SymbolicAddress t2 = fn.apply(va2);
        _enc.add("alias " + va1.getName() + " ~ " + va2.getName() + " via " + fn.getName(),
                _enc.And(_enc.Distinct(va1, va2), _enc.Eq(t1.getExpr(), t2.getExpr())));
        _enc.observe(t1.getName(), t1.getExpr());
        _enc.observe(t2.getName(), t2.getExpr());
    }

    public void assertDistinct(SymbolicAddress... addresses) {
        StringBuilder sb = new StringBuilder("distinct");
        for (SymbolicAddress a : addresses) {
            sb.append(" ").append(a.getName());
        }
        _enc.add(sb.toString(), _enc.Distinct(addresses));
    }

    /**
     * <p>Forbid aliasing at a stage: no two distinct inputs among the given
     * terms reach the same output.</p>
     *
     * <p>Injectivity is instantiated for every pair of terms rather than
     * quantified. This is equisatisfiable with global injectivity because
     * any injection on finitely many bit-vectors extends to a bijection of
     * the whole address space.</p>
     */
    public void assertInjective(TranslationFunction fn, List<SymbolicAddress> inputs) {
        for (int i = 0; i < inputs.size(); i++) {
            for (int j = i + 1; j < inputs.size(); j++) {
                SymbolicAddress x = inputs.get(i);
                SymbolicAddress y = inputs.get(j);
                BoolExpr images = _enc.Distinct(fn.apply(x), fn.apply(y));
                _enc.add("no alias " + x.getName() + " ~ " + y.getName() + " via " + fn.getName(),
                        _enc.Implies(_enc.Distinct(x, y), images));
            }
        }
    }
}
