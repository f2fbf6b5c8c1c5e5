package com.product.resolution.store;

import com.product.resolution.core.model.ProductRecord;

import java.util.Optional;
import java.util.stream.Stream;

/**
 * Read boundary of the engine: where product records come from.
 * Implementations report backend failures as {@link StoreException}.
 */
public interface RecordSource {

    /**
     * Streams every record. Each call starts a fresh pass; callers close the stream.
     */
    Stream<ProductRecord> streamAll();

    Optional<ProductRecord> get(String id);
}
