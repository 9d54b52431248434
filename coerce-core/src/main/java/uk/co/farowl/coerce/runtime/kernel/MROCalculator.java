// Copyright (c)2024 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coerce.runtime.kernel;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

import uk.co.farowl.coerce.runtime.NamedType;
import uk.co.farowl.coerce.support.TypeSystemError;

/**
 * Class to calculate one MRO and retain the result. We make this a
 * class (rather than just a static method) so that in the event of a
 * failure, the evidence is there about which bases it proved impossible
 * to merge.
 */
class MROCalculator {
    private final Base[] bases;
    private final Map<NamedType, TypeSeen> typeIndex;

    private static class TypeSeen {
        int uses = 1;
    }

    /**
     * Create an object to store that MRO calculation.
     *
     * @param bases excluding the type under construction
     */
    MROCalculator(List<NamedType> bases) {

        final int n = bases.size();
        this.typeIndex = new LinkedHashMap<>(4 * n);

        /*
         * Scan the MROs of the bases and record how many times each
         * type has appeared.
         */
        for (NamedType base : bases) {
            for (NamedType t : base.getMRO()) {
                TypeSeen seen = typeIndex.get(t);
                if (seen == null) {
                    typeIndex.put(t, new TypeSeen());
                } else {
                    seen.uses += 1;
                }
            }
        }

        // A table of base MROs for the algorithm to work with.
        this.bases = new Base[n];
        for (int i = 0; i < n; i++) {
            this.bases[i] = new Base(bases.get(i).getMRO());
        }
    }

    /**
     * Calculate an MRO from a type and a list of its bases. The
     * algorithm is the C3 Linearisation
     * (https://en.wikipedia.org/wiki/C3_linearization).
     *
     * @param type under construction
     * @param bases to analyse
     * @return the MRO, beginning with {@code type}
     * @throws TypeSystemError if no consistent MRO exists
     */
    static List<NamedType> getMRO(NamedType type, List<NamedType> bases)
            throws TypeSystemError {
        List<NamedType> mro;
        if (bases.isEmpty()) {
            // A root type
            mro = new ArrayList<>(1);
        } else if (bases.size() == 1) {
            // Fast path when there is a single base.
            mro = new ArrayList<>(bases.get(0).getMRO());
        } else {
            MROCalculator calc = new MROCalculator(bases);
            mro = calc.calculate();
            if (mro == null) {
                StringJoiner sj = new StringJoiner(",", "(", ")");
                for (NamedType b : calc.remainingHeads()) {
                    sj.add(b.getName());
                }
                throw new TypeSystemError(NO_CONSISTENT_MRO,
                        type.getName(), sj);
            }
        }
        mro.add(0, type);
        return mro;
    }

    private static final String NO_CONSISTENT_MRO =
            "Cannot create a consistent method resolution order (MRO)"
                    + " for '%s' (failed to merge %s)";

    /**
     * Calculate the MRO using the tables created by the constructor.
     *
     * @return computed MRO or {@code null} if one not possible
     */
    List<NamedType> calculate() {
        List<NamedType> mro = new LinkedList<>();
        boolean done = bases.length == 0;
        while (!done) {
            // Find a head that is not in any tail
            NamedType h = null;
            for (int i = 0; i < bases.length; i++) {
                if ((h = goodNextType(i)) != null) { break; }
            }
            if (h != null) {
                mro.add(h);
                // Remove from every head (and check not done).
                done = true;
                for (Base b : bases) {
                    if (b.peek() == h) { b.pop(); }
                    done &= b.empty();
                }
            } else {
                // Stuck: each head is behind another head somewhere.
                return null;
            }
        }
        return mro;
    }

    /**
     * Return the types, found along the MRO of the original bases, that
     * failed to merge during {@link #calculate()}. (There will be at
     * least two.)
     *
     * @return the types that failed to merge.
     */
    Set<NamedType> remainingHeads() {
        Set<NamedType> remaining = new LinkedHashSet<>();
        for (Base b : bases) {
            if (!b.empty()) { remaining.add(b.peek()); }
        }
        return remaining;
    }

    /**
     * Inspect {@code bases[i]}, and if it has a head {@code h}, and that
     * head is not in the tail of any base, then return it.
     *
     * @param i position in the bases array to inspect
     * @return {@code bases[i].peek()} or {@code null}
     */
    private NamedType goodNextType(int i) {
        NamedType h = bases[i].peek();
        if (h != null) {
            // How many uses of h are there in total?
            int u = typeIndex.get(h).uses;
            // Count down each use of h in a head
            for (Base b : bases) {
                if (b.peek() == h) {
                    // If this accounts for the last use return h.
                    if (--u == 0) { return h; }
                }
            }
        }
        return null;
    }

    /**
     * Holds the MRO of one base while we process it, and an index to the
     * first type in it we have not yet dealt with.
     */
    private static class Base {
        private int head = 0;
        final List<NamedType> mro;

        Base(List<NamedType> mro) { this.mro = mro; }

        /** @return true iff no unconsumed types left. */
        boolean empty() { return head >= mro.size(); }

        /** @return first remaining type or null on empty **/
        NamedType peek() { return head < mro.size() ? mro.get(head) : null; }

        /** Discard first in list. */
        void pop() { head++; }

        @Override
        public String toString() {
            return mro.subList(head, mro.size()).toString();
        }
    }
}
