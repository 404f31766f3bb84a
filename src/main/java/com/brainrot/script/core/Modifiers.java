package com.brainrot.script.core;

/** Declaration modifiers attached to variables and parameters. */
public final class Modifiers {

    public static final Modifiers NONE = new Modifiers(false, false, false);

    public final boolean isConst;
    public final boolean isUnsigned;
    public final boolean isVolatile;

    public Modifiers(boolean isConst, boolean isUnsigned, boolean isVolatile) {
        this.isConst = isConst;
        this.isUnsigned = isUnsigned;
        this.isVolatile = isVolatile;
    }

    public static Modifiers constant() { return new Modifiers(true, false, false); }
    public static Modifiers unsigned() { return new Modifiers(false, true, false); }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (isConst) sb.append("const ");
        if (isUnsigned) sb.append("unsigned ");
        if (isVolatile) sb.append("volatile ");
        return sb.toString().trim();
    }
}
