package com.product.resolution.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A cluster of vendor records that describe one real-world product.
 * The id is a function of the sorted member ids only, so unchanged input
 * reproduces the same ids on every run.
 *
 * @param id             deterministic golden-record id
 * @param representative consolidated field set
 * @param memberIds      member record ids in ascending order
 * @param sourceKeys     distinct source keys of the members in ascending order
 */
public record GoldenRecord(
        String id,
        Representative representative,
        List<String> memberIds,
        List<String> sourceKeys
) {
    public GoldenRecord {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(representative, "representative is required");
        memberIds = List.copyOf(memberIds);
        sourceKeys = List.copyOf(sourceKeys);
        if (memberIds.isEmpty()) {
            throw new IllegalArgumentException("A golden record needs at least one member");
        }
    }

    public int size() {
        return memberIds.size();
    }

    public boolean isSingleton() {
        return memberIds.size() == 1;
    }

    public boolean contains(String recordId) {
        return memberIds.contains(recordId);
    }
}
