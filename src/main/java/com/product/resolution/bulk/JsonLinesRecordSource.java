package com.product.resolution.bulk;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.product.resolution.core.model.ProductRecord;
import com.product.resolution.store.RecordSource;
import com.product.resolution.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * Record source over a JSON Lines file: one JSON object per line.
 *
 * <pre>
 * {"id": "A-1", "source_key": "contract-7", "manufacturer": "3M Company", "part_number": "14NV-4123"}
 * {"id": "B-9", "sourceKey": "catalog-2", "manufacturer": "3M", "partNumber": "14NV4123", "gtin": "00012345678905"}
 * </pre>
 *
 * <p>Keys may be snake_case or camelCase. Numeric values (UNSPSC and GTIN are often exported
 * as numbers) are read as text. Malformed lines and objects without an id are skipped
 * with a warning.</p>
 */
public class JsonLinesRecordSource implements RecordSource {
    private static final Logger log = LoggerFactory.getLogger(JsonLinesRecordSource.class);
    private static final int PROGRESS_INTERVAL = 1_000;

    private final Path path;
    private final ObjectMapper mapper;
    private final ProgressCallback callback;
    private volatile Map<String, ProductRecord> index;

    public JsonLinesRecordSource(Path path) {
        this(path, new ObjectMapper(), ProgressCallback.NOOP);
    }

    public JsonLinesRecordSource(Path path, ObjectMapper mapper, ProgressCallback callback) {
        this.path = Objects.requireNonNull(path, "path is required");
        this.mapper = Objects.requireNonNull(mapper, "mapper is required");
        this.callback = callback != null ? callback : ProgressCallback.NOOP;
    }

    @Override
    public Stream<ProductRecord> streamAll() {
        BufferedReader reader;
        try {
            reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StoreException("Cannot read record source " + path, e);
        }
        AtomicLong lineNumber = new AtomicLong();
        AtomicLong count = new AtomicLong();
        return reader.lines()
                .map(line -> parse(line, lineNumber.incrementAndGet()))
                .flatMap(Optional::stream)
                .peek(record -> {
                    long n = count.incrementAndGet();
                    if (n % PROGRESS_INTERVAL == 0) {
                        callback.onProgress(n, -1, "Read " + n + " records");
                    }
                })
                .onClose(() -> {
                    try {
                        reader.close();
                    } catch (IOException e) {
                        log.warn("source.close.failed path={} error={}", path, e.getMessage());
                    }
                    callback.onProgress(count.get(), count.get(), "Read completed");
                });
    }

    @Override
    public Optional<ProductRecord> get(String id) {
        Map<String, ProductRecord> current = index;
        if (current == null) {
            synchronized (this) {
                current = index;
                if (current == null) {
                    Map<String, ProductRecord> built = new HashMap<>();
                    try (Stream<ProductRecord> records = streamAll()) {
                        records.forEach(record -> built.putIfAbsent(record.id(), record));
                    }
                    index = built;
                    current = built;
                }
            }
        }
        return Optional.ofNullable(current.get(id));
    }

    private Optional<ProductRecord> parse(String line, long lineNumber) {
        if (line.isBlank()) {
            return Optional.empty();
        }
        JsonNode node;
        try {
            node = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            log.warn("source.row.skipped path={} line={} reason='{}'", path, lineNumber, e.getOriginalMessage());
            return Optional.empty();
        }
        if (node == null || !node.isObject()) {
            log.warn("source.row.skipped path={} line={} reason='not a JSON object'", path, lineNumber);
            return Optional.empty();
        }
        String id = text(node, "id");
        if (id.isEmpty()) {
            log.warn("source.row.skipped path={} line={} reason='missing id'", path, lineNumber);
            return Optional.empty();
        }
        return Optional.of(ProductRecord.builder()
                .id(id)
                .sourceKey(text(node, "source_key", "sourceKey", "source"))
                .manufacturer(text(node, "manufacturer", "manufacturer_raw", "manufacturerRaw"))
                .partNumber(text(node, "part_number", "partNumber", "part_number_raw", "partNumberRaw"))
                .title(text(node, "title"))
                .description(text(node, "description"))
                .unspsc(text(node, "unspsc"))
                .gtin(text(node, "gtin"))
                .build());
    }

    private static String text(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && !value.isNull()) {
                return value.isValueNode() ? value.asText().trim() : value.toString();
            }
        }
        return "";
    }
}
