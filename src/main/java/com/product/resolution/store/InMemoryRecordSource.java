package com.product.resolution.store;

import com.product.resolution.core.model.ProductRecord;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Record source over an in-memory collection. Record ids must be unique.
 */
public class InMemoryRecordSource implements RecordSource {

    private final Map<String, ProductRecord> records;

    public InMemoryRecordSource(Collection<ProductRecord> records) {
        Map<String, ProductRecord> byId = new LinkedHashMap<>();
        for (ProductRecord record : records) {
            if (byId.putIfAbsent(record.id(), record) != null) {
                throw new IllegalArgumentException("Duplicate record id: " + record.id());
            }
        }
        this.records = Collections.unmodifiableMap(byId);
    }

    @Override
    public Stream<ProductRecord> streamAll() {
        return records.values().stream();
    }

    @Override
    public Optional<ProductRecord> get(String id) {
        return Optional.ofNullable(records.get(id));
    }

    public int size() {
        return records.size();
    }
}
