package org.wxvisor.datamodel;

/**
 * The address spaces of a nested translation: va --mmu1--> ipa --mmu2--> pa.
 */
public enum AddressKind {
    VA,
    IPA,
    PA
}
