package com.product.resolution.core.model;

/**
 * One similarity signal of a {@link PairScore}.
 * A component that is not applicable (field absent on either side) contributes nothing
 * to the weighted sum instead of counting as a mismatch.
 */
public interface ComponentScore {

    /**
     * Returns the component name used in logs and the comparison view.
     */
    String name();

    /**
     * Whether both records carry the underlying field.
     */
    boolean applicable();

    /**
     * The component score in [0, 1]; 0 when not applicable.
     */
    double score();

    /**
     * The configured weight of this component.
     */
    double weight();

    /**
     * The amount this component adds to the weighted sum.
     */
    default double contribution() {
        return applicable() ? weight() * score() : 0.0;
    }
}
