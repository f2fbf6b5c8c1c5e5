package com.product.resolution.core.model;

import java.util.Objects;

/**
 * An unordered pair of record ids selected for scoring.
 * The ids are stored in natural {@link String} order, so {@code of(a, b).equals(of(b, a))}.
 */
public record CandidatePair(String idA, String idB) implements Comparable<CandidatePair> {

    public CandidatePair {
        Objects.requireNonNull(idA, "idA is required");
        Objects.requireNonNull(idB, "idB is required");
        if (idA.equals(idB)) {
            throw new IllegalArgumentException("A candidate pair needs two distinct ids, got '" + idA + "' twice");
        }
        if (idA.compareTo(idB) > 0) {
            String swap = idA;
            idA = idB;
            idB = swap;
        }
    }

    public static CandidatePair of(String first, String second) {
        return new CandidatePair(first, second);
    }

    /**
     * Returns true if the given id is one of the two members.
     */
    public boolean contains(String id) {
        return idA.equals(id) || idB.equals(id);
    }

    @Override
    public int compareTo(CandidatePair other) {
        int cmp = idA.compareTo(other.idA);
        return cmp != 0 ? cmp : idB.compareTo(other.idB);
    }

    @Override
    public String toString() {
        return "(" + idA + ", " + idB + ")";
    }
}
