package com.product.resolution.bulk;

import com.product.resolution.core.model.ProductRecord;
import com.product.resolution.store.RecordSource;
import com.product.resolution.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * Record source over a UTF-8 CSV file with a header row.
 *
 * <pre>
 * id,source_key,manufacturer,part_number,title,description,unspsc,gtin
 * A-1,contract-7,"3M Company",14NV-4123,"Tape, 2in",,31201500,
 * </pre>
 *
 * <p>Columns are matched by name (snake_case or camelCase; {@code manufacturer_raw} and
 * {@code part_number_raw} are accepted too). Rows without an id or with an unterminated
 * quote are skipped with a warning. An unreadable file is a {@link StoreException}.</p>
 */
public class CsvRecordSource implements RecordSource {
    private static final Logger log = LoggerFactory.getLogger(CsvRecordSource.class);
    private static final int PROGRESS_INTERVAL = 1_000;

    private final Path path;
    private final ProgressCallback callback;
    private volatile Map<String, ProductRecord> index;

    public CsvRecordSource(Path path) {
        this(path, ProgressCallback.NOOP);
    }

    public CsvRecordSource(Path path, ProgressCallback callback) {
        this.path = Objects.requireNonNull(path, "path is required");
        this.callback = callback != null ? callback : ProgressCallback.NOOP;
    }

    @Override
    public Stream<ProductRecord> streamAll() {
        BufferedReader reader;
        Map<String, Integer> header;
        try {
            reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
            String headerLine = reader.readLine();
            if (headerLine == null) {
                reader.close();
                return Stream.empty();
            }
            header = CsvSupport.headerIndex(headerLine);
        } catch (IOException e) {
            throw new StoreException("Cannot read record source " + path, e);
        }
        if (!header.containsKey("id")) {
            closeQuietly(reader);
            throw new StoreException("Record source " + path + " has no 'id' column");
        }

        AtomicLong lineNumber = new AtomicLong(1);
        AtomicLong count = new AtomicLong();
        return reader.lines()
                .map(line -> parse(line, lineNumber.incrementAndGet(), header))
                .flatMap(Optional::stream)
                .peek(record -> {
                    long n = count.incrementAndGet();
                    if (n % PROGRESS_INTERVAL == 0) {
                        callback.onProgress(n, -1, "Read " + n + " records");
                    }
                })
                .onClose(() -> {
                    closeQuietly(reader);
                    callback.onProgress(count.get(), count.get(), "Read completed");
                });
    }

    @Override
    public Optional<ProductRecord> get(String id) {
        return Optional.ofNullable(index().get(id));
    }

    private Map<String, ProductRecord> index() {
        Map<String, ProductRecord> current = index;
        if (current == null) {
            synchronized (this) {
                current = index;
                if (current == null) {
                    current = new HashMap<>();
                    try (Stream<ProductRecord> records = streamAll()) {
                        for (ProductRecord record : (Iterable<ProductRecord>) records::iterator) {
                            current.putIfAbsent(record.id(), record);
                        }
                    } catch (UncheckedIOException e) {
                        throw new StoreException("Cannot read record source " + path, e.getCause());
                    }
                    index = current;
                }
            }
        }
        return current;
    }

    private Optional<ProductRecord> parse(String line, long lineNumber, Map<String, Integer> header) {
        if (line.isBlank()) {
            return Optional.empty();
        }
        List<String> row;
        try {
            row = CsvSupport.parseLine(line);
        } catch (IllegalArgumentException e) {
            log.warn("source.row.skipped path={} line={} reason='{}'", path, lineNumber, e.getMessage());
            return Optional.empty();
        }
        String id = CsvSupport.field(row, header, "id");
        if (id.isEmpty()) {
            log.warn("source.row.skipped path={} line={} reason='missing id'", path, lineNumber);
            return Optional.empty();
        }
        return Optional.of(ProductRecord.builder()
                .id(id)
                .sourceKey(CsvSupport.field(row, header, "source_key", "sourcekey", "source"))
                .manufacturer(CsvSupport.field(row, header, "manufacturer", "manufacturer_raw"))
                .partNumber(CsvSupport.field(row, header, "part_number", "partnumber", "part_number_raw"))
                .title(CsvSupport.field(row, header, "title"))
                .description(CsvSupport.field(row, header, "description"))
                .unspsc(CsvSupport.field(row, header, "unspsc"))
                .gtin(CsvSupport.field(row, header, "gtin"))
                .build());
    }

    private void closeQuietly(BufferedReader reader) {
        try {
            reader.close();
        } catch (IOException e) {
            log.warn("source.close.failed path={} error={}", path, e.getMessage());
        }
    }
}
