package org.aether.verification.vcgen;

public enum VcKind {
    PRECONDITION("precondition"),
    POSTCONDITION("postcondition"),
    LOOP_INVARIANT_ENTRY("loop_invariant_entry"),
    LOOP_INVARIANT_PRESERVATION("loop_invariant_preservation"),
    TERMINATION("termination"),
    ASSERTION("assertion"),
    ARRAY_BOUNDS("array_bounds"),
    DIVISION_BY_ZERO("div_by_zero"),
    NULL_POINTER("null_pointer"),
    INVARIANT("invariant");

    private final String tag;

    VcKind(String tag) {
        this.tag = tag;
    }

    /**
     * VC 名称的前缀。
     */
    public String getTag() {
        return tag;
    }
}
