package com.product.resolution.blocking;

import com.product.resolution.core.model.CandidatePair;

import java.util.List;

/**
 * Records sharing one blocking key and the candidate pairs this bucket owns.
 * A pair produced by an earlier bucket (in key order) is not repeated here.
 *
 * @param key       the blocking key, or {@link Blocker#OVERFLOW_KEY}
 * @param memberIds member record ids in ascending order
 * @param pairs     candidate pairs owned by this bucket, in ascending order
 * @param overflow  whether this is the overflow bucket
 */
public record Bucket(String key, List<String> memberIds, List<CandidatePair> pairs, boolean overflow) {

    public Bucket {
        memberIds = List.copyOf(memberIds);
        pairs = List.copyOf(pairs);
    }

    public int size() {
        return memberIds.size();
    }
}
