package com.product.resolution.blocking;

import com.product.resolution.features.RecordFeatures;

import java.util.Set;
import java.util.TreeSet;

/**
 * Blocks on canonical manufacturer plus a UNSPSC prefix, and separately on GTIN.
 *
 * <ul>
 *   <li>{@code mfr:<canonical>|unspsc:<prefix>} when both are present</li>
 *   <li>{@code mfr:<canonical>} when the UNSPSC code is absent or the prefix length is 0</li>
 *   <li>{@code unspsc:<prefix>} when the manufacturer is absent</li>
 *   <li>{@code gtin:<gtin>} whenever a GTIN is present</li>
 * </ul>
 */
public class DefaultBlockingKeyStrategy implements BlockingKeyStrategy {

    public static final int DEFAULT_UNSPSC_PREFIX_LENGTH = 4;

    private final int unspscPrefixLength;

    public DefaultBlockingKeyStrategy() {
        this(DEFAULT_UNSPSC_PREFIX_LENGTH);
    }

    public DefaultBlockingKeyStrategy(int unspscPrefixLength) {
        if (unspscPrefixLength < 0 || unspscPrefixLength > 8) {
            throw new IllegalArgumentException("unspscPrefixLength must be between 0 and 8, got " + unspscPrefixLength);
        }
        this.unspscPrefixLength = unspscPrefixLength;
    }

    public int getUnspscPrefixLength() {
        return unspscPrefixLength;
    }

    @Override
    public Set<String> generateKeys(RecordFeatures features) {
        Set<String> keys = new TreeSet<>();
        String unspscPrefix = unspscPrefixLength == 0 || !features.hasUnspsc()
                ? ""
                : features.unspsc().substring(0, Math.min(unspscPrefixLength, features.unspsc().length()));

        if (features.hasManufacturer()) {
            String mfrKey = "mfr:" + features.manufacturer().name();
            keys.add(unspscPrefix.isEmpty() ? mfrKey : mfrKey + "|unspsc:" + unspscPrefix);
        } else if (!unspscPrefix.isEmpty()) {
            keys.add("unspsc:" + unspscPrefix);
        }
        if (features.hasGtin()) {
            keys.add("gtin:" + features.gtin());
        }
        return keys;
    }
}
