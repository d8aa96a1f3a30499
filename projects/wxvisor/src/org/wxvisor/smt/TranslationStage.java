package org.wxvisor.smt;

import org.wxvisor.common.WxvisorException;

/**
 * A translation function paired with the page table whose permissions apply
 * to the addresses entering that translation.
 */
public class TranslationStage {

    private final TranslationFunction _mmu;

    private final PermissionTable _table;

    public TranslationStage(TranslationFunction mmu, PermissionTable table) {
        if (mmu.getDomain() != table.getKind()) {
            throw new WxvisorException("Page table " + table.getName() + " is indexed by " +
                    table.getKind() + " but " + mmu.getName() + " translates " + mmu.getDomain());
        }
        _mmu = mmu;
        _table = table;
    }

    public TranslationFunction getMmu() {
        return _mmu;
    }

    public PermissionTable getTable() {
        return _table;
    }
}
