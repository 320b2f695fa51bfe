package com.synclab.laddersim.engine.model;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * The simulated instruction vocabulary. Anything else parses to {@link #UNSUPPORTED}.
 */
public enum Opcode {
    XIC(Category.CONTACT),
    XIO(Category.CONTACT),
    ONS(Category.CONTACT),
    OSR(Category.CONTACT),
    OSF(Category.CONTACT),

    EQU(Category.COMPARISON),
    NEQ(Category.COMPARISON),
    LES(Category.COMPARISON),
    LEQ(Category.COMPARISON),
    GRT(Category.COMPARISON),
    GEQ(Category.COMPARISON),
    LIM(Category.COMPARISON),
    CMP(Category.COMPARISON),

    OTE(Category.COIL),
    OTL(Category.COIL),
    OTU(Category.COIL),

    TON(Category.TIMER),
    TOF(Category.TIMER),
    RTO(Category.TIMER),
    TONR(Category.TIMER),
    TOFR(Category.TIMER),

    CTU(Category.COUNTER),
    CTD(Category.COUNTER),
    CTUD(Category.COUNTER),
    RES(Category.COUNTER),

    ADD(Category.MATH),
    SUB(Category.MATH),
    MUL(Category.MATH),
    DIV(Category.MATH),
    MOD(Category.MATH),
    NEG(Category.MATH),
    ABS(Category.MATH),
    CPT(Category.MATH),

    MOV(Category.MOVE),
    MVM(Category.MOVE),
    COP(Category.MOVE),
    FLL(Category.MOVE),
    CLR(Category.MOVE),

    UNSUPPORTED(Category.UNSUPPORTED);

    public enum Category {
        CONTACT,
        COMPARISON,
        COIL,
        TIMER,
        COUNTER,
        MATH,
        MOVE,
        UNSUPPORTED
    }

    private static final Map<String, Opcode> BY_MNEMONIC = new HashMap<>();

    static {
        for (Opcode opcode : values()) {
            if (opcode != UNSUPPORTED) {
                BY_MNEMONIC.put(opcode.name(), opcode);
            }
        }
    }

    private final Category category;

    Opcode(Category category) {
        this.category = category;
    }

    public Category getCategory() {
        return category;
    }

    /**
     * Gating instructions decide whether power continues past them. Everything else is an
     * output-side element that passes its input wire through unchanged.
     */
    public boolean isGating() {
        switch (this) {
            case XIC:
            case XIO:
            case ONS:
                return true;
            default:
                return category == Category.COMPARISON;
        }
    }

    public static Opcode parse(String mnemonic) {
        if (mnemonic == null) {
            return UNSUPPORTED;
        }
        Opcode opcode = BY_MNEMONIC.get(mnemonic.trim().toUpperCase(Locale.ROOT));
        return opcode != null ? opcode : UNSUPPORTED;
    }
}
