package com.tangle.marking;

/**
 * Read and write flags of an indirect access. Each flag is tri-state: {@code TRUE}, {@code FALSE},
 * or {@code null} for "not known".
 */
public record IndirectAccess(Boolean read, Boolean write) {

    public static final IndirectAccess NONE = new IndirectAccess(false, false);

    public IndirectAccess withRead(Boolean value) {
        return new IndirectAccess(value, write);
    }

    public IndirectAccess withWrite(Boolean value) {
        return new IndirectAccess(read, value);
    }

    /** Flag-wise Kleene OR. Commutative and idempotent. */
    public IndirectAccess or(IndirectAccess other) {
        return new IndirectAccess(or(read, other.read), or(write, other.write));
    }

    static Boolean or(Boolean a, Boolean b) {
        if (Boolean.TRUE.equals(a) || Boolean.TRUE.equals(b)) return true;
        if (a == null || b == null) return null;
        return false;
    }
}
