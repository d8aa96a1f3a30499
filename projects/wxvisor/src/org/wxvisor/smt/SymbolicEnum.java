package org.wxvisor.smt;

import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.BitVecNum;
import com.microsoft.z3.BoolExpr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * <p>A solver-chosen value out of a short, fixed list. The choice is encoded
 * as the index of the value in a bit-vector just wide enough to hold the
 * largest index. Indices past the end of the list are ruled out.</p>
 *
 * <p>A list of one value needs no symbol at all.</p>
 *
 * @param <T> The type of the listed values
 */
class SymbolicEnum<T> {

    private final Encoder _enc;

    private final String _name;

    private final List<T> _choices;

    private final int _width;

    private final BitVecExpr _index;

    SymbolicEnum(Encoder enc, String name, List<T> choices) {
        if (choices.isEmpty()) {
            throw new IllegalArgumentException("No choices for " + name);
        }
        _enc = enc;
        _name = name;
        _choices = Collections.unmodifiableList(new ArrayList<>(choices));
        _width = indexWidth(_choices.size());

        if (_width == 0) {
            _index = null;
        } else {
            _index = enc.mkBitVec(name, _width);
            int last = _choices.size() - 1;
            if (last != (1 << _width) - 1) {
                enc.add(name + " in range", enc.getCtx().mkBVULE(_index, code(last)));
            }
        }
    }

    /*
     * Bits needed to write every index below size.
     */
    static int indexWidth(int size) {
        return size <= 1 ? 0 : Integer.SIZE - Integer.numberOfLeadingZeros(size - 1);
    }

    private BitVecNum code(int i) {
        return _enc.getCtx().mkBV(i, _width);
    }

    /**
     * The chosen value is {@code choice}. False for a value outside the list.
     */
    BoolExpr is(T choice) {
        int i = _choices.indexOf(choice);
        if (i < 0) {
            return _enc.False();
        }
        if (_index == null) {
            return _enc.True();
        }
        return _enc.Eq(_index, code(i));
    }

    /**
     * Decode the value of the index in a model.
     */
    T decode(int index) {
        return _choices.get(index);
    }

    BitVecExpr getIndex() {
        return _index;
    }

    String getName() {
        return _name;
    }
}
