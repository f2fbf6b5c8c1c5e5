package com.product.resolution.bulk;

import com.product.resolution.core.model.ComponentScore;
import com.product.resolution.core.model.GoldenRecord;
import com.product.resolution.core.model.PairScore;
import com.product.resolution.core.model.Representative;
import com.product.resolution.store.ResolutionSink;
import com.product.resolution.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Writes a run's output as three CSV files in an output directory.
 *
 * <ul>
 *   <li>{@code golden_records.csv}: one row per golden record with its representative fields</li>
 *   <li>{@code links.csv}: golden record id to member record id</li>
 *   <li>{@code pair_scores.csv}: component scores per candidate pair, blank when not applicable</li>
 * </ul>
 *
 * <p>Files are written to a staging directory and moved into place on commit; an aborted
 * run deletes the staging directory and leaves the previous files untouched. Commit first
 * moves the previous files into the staging directory, so a failed move puts all three back
 * and the output directory never mixes two runs.</p>
 */
public class CsvResolutionSink implements ResolutionSink {
    private static final Logger log = LoggerFactory.getLogger(CsvResolutionSink.class);

    static final String GOLDEN_RECORDS_FILE = "golden_records.csv";
    static final String LINKS_FILE = "links.csv";
    static final String PAIR_SCORES_FILE = "pair_scores.csv";
    private static final List<String> FILES = List.of(GOLDEN_RECORDS_FILE, LINKS_FILE, PAIR_SCORES_FILE);
    private static final String PREVIOUS_DIR = "previous";

    private final Path outputDir;
    private final ProgressCallback callback;
    private Path stagingDir;
    private String runId;
    private long rowsWritten;

    public CsvResolutionSink(Path outputDir) {
        this(outputDir, ProgressCallback.NOOP);
    }

    public CsvResolutionSink(Path outputDir, ProgressCallback callback) {
        this.outputDir = Objects.requireNonNull(outputDir, "outputDir is required");
        this.callback = callback != null ? callback : ProgressCallback.NOOP;
    }

    @Override
    public synchronized void begin(String runId) {
        if (this.runId != null) {
            throw new StoreException("Run " + this.runId + " is still open; cannot begin " + runId);
        }
        try {
            Files.createDirectories(outputDir);
            Path staging = outputDir.resolve(".staging-" + runId);
            deleteRecursively(staging);
            Files.createDirectories(staging);
            writeLine(staging.resolve(GOLDEN_RECORDS_FILE),
                    "golden_record_id,size,manufacturer,canonical_manufacturer,part_number,normalized_part_number,"
                            + "title,description,unspsc,gtin,source_keys");
            writeLine(staging.resolve(LINKS_FILE), "golden_record_id,record_id");
            writeLine(staging.resolve(PAIR_SCORES_FILE),
                    "id_a,id_b,part_number,manufacturer,text,unspsc,gtin,synergy_bonus,overall_score");
            this.stagingDir = staging;
            this.runId = runId;
            this.rowsWritten = 0;
        } catch (IOException e) {
            throw new StoreException("Cannot prepare staging directory in " + outputDir, e);
        }
    }

    @Override
    public synchronized void writePairScores(List<PairScore> scores) {
        requireOpenRun();
        try (BufferedWriter writer = append(PAIR_SCORES_FILE)) {
            for (PairScore score : scores) {
                writer.write(String.join(",",
                        CsvSupport.escape(score.pair().idA()),
                        CsvSupport.escape(score.pair().idB()),
                        component(score.partNumber()),
                        component(score.manufacturer()),
                        component(score.text()),
                        component(score.unspsc()),
                        component(score.gtin()),
                        number(score.synergyBonus()),
                        number(score.overallScore())));
                writer.newLine();
            }
        } catch (IOException e) {
            throw new StoreException("Cannot write pair scores for run " + runId, e);
        }
        progress(scores.size());
    }

    @Override
    public synchronized void writeGoldenRecords(List<GoldenRecord> goldenRecords) {
        requireOpenRun();
        try (BufferedWriter golden = append(GOLDEN_RECORDS_FILE);
             BufferedWriter links = append(LINKS_FILE)) {
            for (GoldenRecord record : goldenRecords) {
                Representative rep = record.representative();
                golden.write(String.join(",",
                        CsvSupport.escape(record.id()),
                        Integer.toString(record.size()),
                        CsvSupport.escape(rep.manufacturer()),
                        CsvSupport.escape(rep.canonicalManufacturer()),
                        CsvSupport.escape(rep.partNumber()),
                        CsvSupport.escape(rep.normalizedPartNumber()),
                        CsvSupport.escape(rep.title()),
                        CsvSupport.escape(rep.description()),
                        CsvSupport.escape(rep.unspsc()),
                        CsvSupport.escape(rep.gtin()),
                        CsvSupport.escape(String.join("|", record.sourceKeys()))));
                golden.newLine();
                for (String memberId : record.memberIds()) {
                    links.write(CsvSupport.escape(record.id()) + "," + CsvSupport.escape(memberId));
                    links.newLine();
                }
            }
        } catch (IOException e) {
            throw new StoreException("Cannot write golden records for run " + runId, e);
        }
        progress(goldenRecords.size());
    }

    @Override
    public synchronized void commit(String runId) {
        requireRun(runId);
        try {
            for (String file : FILES) {
                Path target = outputDir.resolve(file);
                if (Files.isDirectory(target)) {
                    throw new IOException("Output path is a directory: " + target);
                }
            }
            publish();
            deleteRecursively(stagingDir);
        } catch (IOException e) {
            throw new StoreException("Cannot publish run " + runId + " to " + outputDir, e);
        }
        log.info("sink.committed runId={} outputDir={} rows={}", runId, outputDir, rowsWritten);
        callback.onProgress(rowsWritten, rowsWritten, "Run " + runId + " committed");
        clear();
    }

    @Override
    public synchronized void abort(String runId) {
        if (this.runId == null || !this.runId.equals(runId)) {
            return;
        }
        try {
            deleteRecursively(stagingDir);
        } catch (IOException e) {
            log.warn("sink.abort.cleanup.failed runId={} stagingDir={} error={}", runId, stagingDir, e.getMessage());
        }
        log.warn("sink.aborted runId={} outputDir={}", runId, outputDir);
        clear();
    }

    private void publish() throws IOException {
        Path previousDir = stagingDir.resolve(PREVIOUS_DIR);
        Files.createDirectories(previousDir);
        List<String> published = new ArrayList<>();
        try {
            for (String file : FILES) {
                Path target = outputDir.resolve(file);
                if (Files.exists(target)) {
                    move(target, previousDir.resolve(file));
                }
                move(stagingDir.resolve(file), target);
                published.add(file);
            }
        } catch (IOException e) {
            restore(previousDir, published, e);
            throw e;
        }
    }

    private void restore(Path previousDir, List<String> published, IOException failure) {
        for (String file : FILES) {
            Path target = outputDir.resolve(file);
            Path previous = previousDir.resolve(file);
            try {
                if (Files.exists(previous)) {
                    move(previous, target);
                } else if (published.contains(file)) {
                    Files.deleteIfExists(target);
                }
            } catch (IOException restoreFailure) {
                failure.addSuppressed(restoreFailure);
            }
        }
        log.error("sink.commit.rolledback runId={} outputDir={} error={}", runId, outputDir, failure.getMessage());
    }

    private BufferedWriter append(String file) throws IOException {
        return Files.newBufferedWriter(stagingDir.resolve(file), StandardCharsets.UTF_8,
                StandardOpenOption.APPEND);
    }

    private static void writeLine(Path file, String line) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writer.write(line);
            writer.newLine();
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteRecursively(Path dir) throws IOException {
        if (dir == null || !Files.exists(dir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            for (Path path : (Iterable<Path>) paths.sorted(Comparator.reverseOrder())::iterator) {
                Files.delete(path);
            }
        }
    }

    private static String component(ComponentScore component) {
        return component.applicable() ? number(component.score()) : "";
    }

    private static String number(double value) {
        return String.format(Locale.ROOT, "%.6f", value);
    }

    private void progress(int rows) {
        rowsWritten += rows;
        callback.onProgress(rowsWritten, -1, "Wrote " + rowsWritten + " rows");
    }

    private void requireOpenRun() {
        if (runId == null) {
            throw new StoreException("No open run; call begin() first");
        }
    }

    private void requireRun(String runId) {
        requireOpenRun();
        if (!this.runId.equals(runId)) {
            throw new StoreException("Open run is " + this.runId + ", not " + runId);
        }
    }

    private void clear() {
        runId = null;
        stagingDir = null;
    }
}
