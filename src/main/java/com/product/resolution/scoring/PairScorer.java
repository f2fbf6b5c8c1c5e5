package com.product.resolution.scoring;

import com.product.resolution.core.model.CandidatePair;
import com.product.resolution.core.model.ComponentScore;
import com.product.resolution.core.model.GtinComparison;
import com.product.resolution.core.model.ManufacturerComparison;
import com.product.resolution.core.model.PairScore;
import com.product.resolution.core.model.PartNumberComparison;
import com.product.resolution.core.model.TextComparison;
import com.product.resolution.core.model.UnspscComparison;
import com.product.resolution.features.RecordFeatures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Scores a candidate pair on five components and combines them:
 * {@code overall = clamp(sum(weight * component) + synergyBonus, 0, 1)}.
 * The synergy bonus is added only when enough applicable components are strong.
 *
 * <p>The two records are put in id order before anything is computed, so
 * {@code score(a, b)} and {@code score(b, a)} are the same value. Thread-safe.</p>
 */
public class PairScorer {
    private static final Logger log = LoggerFactory.getLogger(PairScorer.class);

    private final ScoringConfig config;
    private final ComponentScorer<PartNumberComparison> partNumberScorer;
    private final ComponentScorer<ManufacturerComparison> manufacturerScorer;
    private final ComponentScorer<TextComparison> textScorer;
    private final ComponentScorer<UnspscComparison> unspscScorer;
    private final ComponentScorer<GtinComparison> gtinScorer;

    public PairScorer() {
        this(ScoringConfig.defaults());
    }

    public PairScorer(ScoringConfig config) {
        this.config = Objects.requireNonNull(config, "config is required");
        this.partNumberScorer = new PartNumberScorer(config);
        this.manufacturerScorer = new ManufacturerScorer(config);
        this.textScorer = new TextScorer(config);
        this.unspscScorer = new UnspscScorer(config);
        this.gtinScorer = new GtinScorer(config);
    }

    public ScoringConfig getConfig() {
        return config;
    }

    public PairScore score(RecordFeatures first, RecordFeatures second) {
        CandidatePair pair = new CandidatePair(first.id(), second.id());
        RecordFeatures a = first.id().equals(pair.idA()) ? first : second;
        RecordFeatures b = a == first ? second : first;

        PartNumberComparison partNumber = partNumberScorer.score(a, b);
        ManufacturerComparison manufacturer = manufacturerScorer.score(a, b);
        TextComparison text = textScorer.score(a, b);
        UnspscComparison unspsc = unspscScorer.score(a, b);
        GtinComparison gtin = gtinScorer.score(a, b);

        List<ComponentScore> components = List.of(partNumber, manufacturer, text, unspsc, gtin);
        double weightedSum = 0.0;
        int strong = 0;
        for (ComponentScore component : components) {
            weightedSum += component.contribution();
            if (component.applicable() && component.score() >= config.getStrongThreshold()) {
                strong++;
            }
        }
        double bonus = strong >= config.getSynergyMinComponents() ? config.getSynergyBonus() : 0.0;
        double overall = Math.max(0.0, Math.min(1.0, weightedSum + bonus));

        if (log.isDebugEnabled()) {
            log.debug("pair.scored pair={} partNumber={} manufacturer={} text={} unspsc={} gtin={} synergy={} overall={}",
                    pair, format(partNumber), format(manufacturer), format(text), format(unspsc), format(gtin),
                    bonus, String.format("%.4f", overall));
        }
        return new PairScore(pair, partNumber, manufacturer, text, unspsc, gtin, weightedSum, bonus, overall);
    }

    private static String format(ComponentScore component) {
        return component.applicable() ? String.format("%.3f", component.score()) : "n/a";
    }
}
