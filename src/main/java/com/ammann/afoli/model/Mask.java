/* (C)2026 */
package com.ammann.afoli.model;

import com.ammann.afoli.exception.ValidationException;
import java.util.Arrays;

/**
 * Per-channel exclusion flags of a spectrum, {@code true} meaning the channel is
 * excluded from the continuum estimate.
 *
 * <p>A mask never changes once built. Every processing stage derives a new mask
 * through {@link #toArray()} and {@link #of(boolean[])}, so stages never share
 * mutable state.
 */
public final class Mask {

    private final boolean[] flags;

    private Mask(boolean[] flags) {
        this.flags = flags;
    }

    /** Creates a mask from a copy of the given flags. */
    public static Mask of(boolean... flags) {
        return new Mask(flags.clone());
    }

    /** Creates a mask of the given length with no channel excluded. */
    public static Mask none(int length) {
        return new Mask(new boolean[length]);
    }

    /** Creates a mask of the given length with every channel excluded. */
    public static Mask all(int length) {
        boolean[] flags = new boolean[length];
        Arrays.fill(flags, true);
        return new Mask(flags);
    }

    public int length() {
        return flags.length;
    }

    public boolean isMasked(int channel) {
        return flags[channel];
    }

    public int maskedCount() {
        int count = 0;
        for (boolean flag : flags) {
            if (flag) count++;
        }
        return count;
    }

    public int unmaskedCount() {
        return flags.length - maskedCount();
    }

    public boolean isFullyMasked() {
        return maskedCount() == flags.length;
    }

    /**
     * Returns {@code true} when every channel excluded here is also excluded by
     * {@code other}.
     */
    public boolean isSubsetOf(Mask other) {
        if (other.length() != flags.length) {
            return false;
        }
        for (int i = 0; i < flags.length; i++) {
            if (flags[i] && !other.flags[i]) {
                return false;
            }
        }
        return true;
    }

    /** Channels masked here or in {@code other}. */
    public Mask union(Mask other) {
        if (other.length() != flags.length) {
            throw ValidationException.lengthMismatch("mask", flags.length, "other mask", other.length());
        }
        boolean[] merged = new boolean[flags.length];
        for (int i = 0; i < flags.length; i++) {
            merged[i] = flags[i] || other.flags[i];
        }
        return new Mask(merged);
    }

    /** Returns a copy of the flags. */
    public boolean[] toArray() {
        return flags.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Mask other)) return false;
        return Arrays.equals(flags, other.flags);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(flags);
    }

    @Override
    public String toString() {
        return "Mask[" + maskedCount() + "/" + flags.length + " masked]";
    }
}
