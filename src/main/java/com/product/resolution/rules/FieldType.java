package com.product.resolution.rules;

/**
 * Product fields that carry their own normalization rule set.
 */
public enum FieldType {
    PART_NUMBER,
    MANUFACTURER
}
