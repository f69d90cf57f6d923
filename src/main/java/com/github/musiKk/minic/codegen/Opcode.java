package com.github.musiKk.minic.codegen;

/**
 * Instructions of the emitted intermediate form together with their effect on
 * the operand stack. {@link #CALL} and {@link #RET} depend on the callee or
 * the enclosing method and are accounted for by {@link Assembly.MethodBuilder}.
 */
public enum Opcode {

    LDC_I4("ldc.i4", 0, 1), LDSTR("ldstr", 0, 1),
    LDLOC("ldloc", 0, 1), STLOC("stloc", 1, 0),
    LDARG("ldarg", 0, 1), STARG("starg", 1, 0),
    LDSFLD("ldsfld", 0, 1), STSFLD("stsfld", 1, 0),

    ADD("add", 2, 1), SUB("sub", 2, 1), MUL("mul", 2, 1), DIV("div", 2, 1), REM("rem", 2, 1),
    AND("and", 2, 1), OR("or", 2, 1),
    CEQ("ceq", 2, 1), CGT("cgt", 2, 1), CGT_UN("cgt.un", 2, 1), CLT("clt", 2, 1),
    NEG("neg", 1, 1),
    CONV_U2("conv.u2", 1, 1),

    DUP("dup", 1, 2), POP("pop", 1, 0),

    BR("br", 0, 0), BRFALSE("brfalse", 1, 0), BRTRUE("brtrue", 1, 0),

    NEWARR("newarr", 1, 1),
    LDELEM_I4("ldelem.i4", 2, 1), LDELEM_I1("ldelem.i1", 2, 1), LDELEM_U2("ldelem.u2", 2, 1),
    STELEM_I4("stelem.i4", 3, 0), STELEM_I1("stelem.i1", 3, 0), STELEM_I2("stelem.i2", 3, 0),

    CALL("call", 0, 0),
    RET("ret", 0, 0);

    public final String mnemonic;
    public final int pops;
    public final int pushes;

    Opcode(String mnemonic, int pops, int pushes) {
        this.mnemonic = mnemonic;
        this.pops = pops;
        this.pushes = pushes;
    }

    public boolean isBranch() {
        return this == BR || this == BRFALSE || this == BRTRUE;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
