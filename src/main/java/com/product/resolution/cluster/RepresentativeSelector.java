package com.product.resolution.cluster;

import com.product.resolution.core.model.Representative;
import com.product.resolution.features.RecordFeatures;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Chooses the consolidated field set of a cluster, one field at a time.
 * Members must be passed in ascending id order; every tie goes to the lowest member id.
 *
 * <ul>
 *   <li>title, description: longest non-blank value</li>
 *   <li>manufacturer: most frequent canonical identity; raw value of the first member having it</li>
 *   <li>part number: most frequent normalized value; raw value of the first member having it</li>
 *   <li>UNSPSC, GTIN: most frequent present value</li>
 * </ul>
 */
public class RepresentativeSelector {

    public Representative select(List<RecordFeatures> members) {
        if (members.isEmpty()) {
            throw new IllegalArgumentException("Cannot select a representative of an empty cluster");
        }

        String canonicalManufacturer = mostFrequent(members, f -> f.manufacturer().name());
        String rawManufacturer = firstRawFor(members, canonicalManufacturer,
                f -> f.manufacturer().name(), f -> f.record().manufacturer());

        String normalizedPartNumber = mostFrequent(members, RecordFeatures::normalizedPartNumber);
        String rawPartNumber = firstRawFor(members, normalizedPartNumber,
                RecordFeatures::normalizedPartNumber, f -> f.record().partNumber());

        return new Representative(
                rawManufacturer,
                canonicalManufacturer,
                rawPartNumber,
                normalizedPartNumber,
                longest(members, f -> f.record().title()),
                longest(members, f -> f.record().description()),
                mostFrequent(members, RecordFeatures::unspsc),
                mostFrequent(members, RecordFeatures::gtin));
    }

    private static String longest(List<RecordFeatures> members, Function<RecordFeatures, String> field) {
        String best = "";
        for (RecordFeatures member : members) {
            String value = field.apply(member).trim();
            if (value.length() > best.length()) {
                best = value;
            }
        }
        return best;
    }

    private static String mostFrequent(List<RecordFeatures> members, Function<RecordFeatures, String> field) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (RecordFeatures member : members) {
            String value = field.apply(member);
            if (!value.isEmpty()) {
                counts.merge(value, 1, Integer::sum);
            }
        }
        String best = "";
        int bestCount = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }

    private static String firstRawFor(List<RecordFeatures> members, String value,
                                      Function<RecordFeatures, String> key,
                                      Function<RecordFeatures, String> raw) {
        if (value.isEmpty()) {
            return "";
        }
        for (RecordFeatures member : members) {
            if (key.apply(member).equals(value)) {
                return raw.apply(member);
            }
        }
        return "";
    }
}
