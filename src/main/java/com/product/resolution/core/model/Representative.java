package com.product.resolution.core.model;

/**
 * The consolidated field set shown for a golden record.
 * Each field is chosen independently from the cluster members.
 *
 * @param manufacturer          raw manufacturer of the member that supplied the winning canonical value
 * @param canonicalManufacturer most frequent canonical manufacturer among members
 * @param partNumber            raw part number of the member that supplied the winning normalized value
 * @param normalizedPartNumber  most frequent normalized part number among members
 * @param title                 longest non-empty title
 * @param description           longest non-empty description
 * @param unspsc                most frequent UNSPSC code, or empty
 * @param gtin                  most frequent GTIN, or empty
 */
public record Representative(
        String manufacturer,
        String canonicalManufacturer,
        String partNumber,
        String normalizedPartNumber,
        String title,
        String description,
        String unspsc,
        String gtin
) {
}
