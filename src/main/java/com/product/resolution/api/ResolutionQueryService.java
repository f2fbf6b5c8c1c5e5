package com.product.resolution.api;

import com.product.resolution.api.NotFoundException.ResourceType;
import com.product.resolution.core.model.CandidatePair;
import com.product.resolution.core.model.GoldenRecord;
import com.product.resolution.core.model.PairScore;
import com.product.resolution.core.model.ProductRecord;
import com.product.resolution.features.FeatureExtractor;
import com.product.resolution.logging.LogContext;
import com.product.resolution.scoring.PairScorer;
import com.product.resolution.store.RecordSource;
import com.product.resolution.store.ResolutionReadStore;
import com.product.resolution.store.ResolutionSnapshot;
import com.product.resolution.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Read-only queries over the source records and the latest published resolution.
 *
 * <p>Every method reads one snapshot of the store, so a single call never mixes two
 * generations. Ids are validated before any lookup: malformed ids raise
 * {@link IllegalArgumentException}, unknown ids raise {@link NotFoundException}.</p>
 */
public class ResolutionQueryService {
    private static final Logger log = LoggerFactory.getLogger(ResolutionQueryService.class);

    private final RecordSource recordSource;
    private final ResolutionReadStore store;
    private final FeatureExtractor featureExtractor;
    private final PairScorer pairScorer;

    public ResolutionQueryService(RecordSource recordSource, ResolutionReadStore store,
                                  FeatureExtractor featureExtractor, PairScorer pairScorer) {
        this.recordSource = Objects.requireNonNull(recordSource, "recordSource is required");
        this.store = Objects.requireNonNull(store, "store is required");
        this.featureExtractor = Objects.requireNonNull(featureExtractor, "featureExtractor is required");
        this.pairScorer = Objects.requireNonNull(pairScorer, "pairScorer is required");
    }

    // ========== Point lookups ==========

    public ProductRecord getRecord(String id) {
        InputValidator.validateId(id, "recordId");
        return lookup(id);
    }

    public GoldenRecord getGoldenRecord(String id) {
        InputValidator.validateId(id, "goldenRecordId");
        return store.current().getGoldenRecord(id)
                .orElseThrow(() -> new NotFoundException(ResourceType.GOLDEN_RECORD, id));
    }

    /**
     * Finds the golden record a record belongs to. Empty when the record exists in the
     * source but was not part of the published run.
     *
     * @throws NotFoundException if the record does not exist in the source
     */
    public Optional<GoldenRecord> findGoldenRecordForRecord(String recordId) {
        InputValidator.validateId(recordId, "recordId");
        Optional<GoldenRecord> golden = store.current().getGoldenRecordForRecord(recordId);
        if (golden.isEmpty() && recordSource.get(recordId).isEmpty()) {
            throw new NotFoundException(ResourceType.RECORD, recordId);
        }
        return golden;
    }

    /**
     * Returns the member records of a golden record in ascending id order. Members that
     * have since disappeared from the source are left out.
     */
    public List<ProductRecord> getMembers(String goldenRecordId) {
        GoldenRecord golden = getGoldenRecord(goldenRecordId);
        List<ProductRecord> members = new ArrayList<>(golden.size());
        for (String memberId : golden.memberIds()) {
            Optional<ProductRecord> record = recordSource.get(memberId);
            if (record.isPresent()) {
                members.add(record.get());
            } else {
                log.warn("query.member.missing goldenRecordId={} recordId={}", goldenRecordId, memberId);
            }
        }
        return members;
    }

    /**
     * Returns the records a source contributed, in ascending id order.
     *
     * @throws StoreException if reading the source fails
     */
    public List<ProductRecord> listRecordsBySourceKey(String sourceKey) {
        InputValidator.validateId(sourceKey, "sourceKey");
        try (Stream<ProductRecord> records = recordSource.streamAll()) {
            return records.filter(record -> sourceKey.equals(record.sourceKey()))
                    .sorted(Comparator.comparing(ProductRecord::id))
                    .toList();
        } catch (UncheckedIOException e) {
            throw new StoreException("Cannot read records for source " + sourceKey, e.getCause());
        }
    }

    /**
     * Looks a record up by id within one source. Empty when the id is unknown or belongs
     * to another source.
     */
    public Optional<ProductRecord> findRecordInSource(String sourceKey, String recordId) {
        InputValidator.validateId(sourceKey, "sourceKey");
        InputValidator.validateId(recordId, "recordId");
        return recordSource.get(recordId).filter(record -> sourceKey.equals(record.sourceKey()));
    }

    // ========== Listings ==========

    public Page<GoldenRecord> listGoldenRecords(GoldenRecordFilter filter, PageRequest pageRequest) {
        Objects.requireNonNull(pageRequest, "pageRequest is required");
        List<GoldenRecord> matching = streamGoldenRecords(filter, pageRequest.sort()).toList();
        return Page.slice(matching, pageRequest);
    }

    /**
     * Streams matching golden records of the current snapshot. The stream is lazy and finite;
     * calling again starts a new pass over the then-current snapshot.
     */
    public Stream<GoldenRecord> streamGoldenRecords(GoldenRecordFilter filter, GoldenRecordSort sort) {
        GoldenRecordFilter effectiveFilter = filter != null ? filter : GoldenRecordFilter.none();
        GoldenRecordSort effectiveSort = sort != null ? sort : GoldenRecordSort.byId();
        Stream<GoldenRecord> matching = store.current().getGoldenRecords().stream().filter(effectiveFilter);
        // Snapshot records are already in id order
        if (effectiveSort.equals(GoldenRecordSort.byId())) {
            return matching;
        }
        return matching.sorted(effectiveSort.comparator());
    }

    public ResolutionStatistics statistics() {
        return ResolutionStatistics.of(store.current().getGoldenRecords(), ResolutionStatistics.DEFAULT_TOP_LIMIT);
    }

    // ========== Comparison ==========

    /**
     * Returns the score of two records: the published score when the pair was scored in
     * the current generation, otherwise a score computed now with the same scorer.
     */
    public PairScore compare(String idA, String idB) {
        validatePair(idA, idB);
        return compareRecords(lookup(idA), lookup(idB));
    }

    /**
     * Returns the full similarity breakdown with {@code idA} reported as product A.
     */
    public ComparisonResult compareDetailed(String idA, String idB) {
        validatePair(idA, idB);
        ProductRecord first = lookup(idA);
        ProductRecord second = lookup(idB);
        return ComparisonResult.of(first, second, compareRecords(first, second));
    }

    private static void validatePair(String idA, String idB) {
        InputValidator.validateId(idA, "idA");
        InputValidator.validateId(idB, "idB");
        if (idA.equals(idB)) {
            throw new IllegalArgumentException("Cannot compare record " + idA + " with itself");
        }
    }

    private ProductRecord lookup(String id) {
        return recordSource.get(id).orElseThrow(() -> new NotFoundException(ResourceType.RECORD, id));
    }

    private PairScore compareRecords(ProductRecord first, ProductRecord second) {
        CandidatePair pair = CandidatePair.of(first.id(), second.id());
        ResolutionSnapshot snapshot = store.current();
        Optional<PairScore> published = snapshot.getPairScore(pair);
        if (published.isPresent()) {
            return published.get();
        }
        try (LogContext ctx = LogContext.forComparison(pair.idA(), pair.idB())) {
            PairScore score = pairScorer.score(featureExtractor.extract(first), featureExtractor.extract(second));
            log.debug("compare.on_demand pair={} overallScore={}", pair, score.overallScore());
            return score;
        }
    }
}
