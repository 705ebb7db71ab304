package io.rpcmeta.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Bit set of real parameter properties.
 *
 * @param bits raw flag bits, a combination of the constants of this class
 */
public record ParamFlags(int bits) {

    public static final int CONTEXTUAL = 1;
    public static final int LAZY = 1 << 1;
    public static final int VARIADIC = 1 << 2;
    public static final int HAS_DEFAULT = 1 << 3;
    public static final int SYNTHETIC = 1 << 4;

    private static final int ALL = CONTEXTUAL | LAZY | VARIADIC | HAS_DEFAULT | SYNTHETIC;

    public static final ParamFlags EMPTY = new ParamFlags(0);

    public ParamFlags {
        if ((bits & ~ALL) != 0) {
            throw new IllegalArgumentException("unknown parameter flag bits: " + Integer.toBinaryString(bits));
        }
    }

    public static ParamFlags of(
            boolean contextual, boolean lazy, boolean variadic, boolean hasDefault, boolean synthetic) {
        int bits = 0;
        if (contextual) bits |= CONTEXTUAL;
        if (lazy) bits |= LAZY;
        if (variadic) bits |= VARIADIC;
        if (hasDefault) bits |= HAS_DEFAULT;
        if (synthetic) bits |= SYNTHETIC;
        return new ParamFlags(bits);
    }

    public boolean isContextual() {
        return (bits & CONTEXTUAL) != 0;
    }

    public boolean isLazy() {
        return (bits & LAZY) != 0;
    }

    public boolean isVariadic() {
        return (bits & VARIADIC) != 0;
    }

    public boolean hasDefault() {
        return (bits & HAS_DEFAULT) != 0;
    }

    public boolean isSynthetic() {
        return (bits & SYNTHETIC) != 0;
    }

    @Override
    public String toString() {
        List<String> names = new ArrayList<>();
        if (isContextual()) names.add("contextual");
        if (isLazy()) names.add("lazy");
        if (isVariadic()) names.add("variadic");
        if (hasDefault()) names.add("hasDefault");
        if (isSynthetic()) names.add("synthetic");
        return "ParamFlags" + names;
    }
}
