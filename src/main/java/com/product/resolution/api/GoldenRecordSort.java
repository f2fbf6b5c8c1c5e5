package com.product.resolution.api;

import com.product.resolution.core.model.GoldenRecord;

import java.util.Comparator;
import java.util.Objects;

/**
 * Ordering of golden records in listings. Ties are always broken by ascending id,
 * so every ordering is total and stable across calls.
 */
public record GoldenRecordSort(Field field, Direction direction) {

    public enum Field {
        ID, SIZE, MANUFACTURER
    }

    public enum Direction {
        ASC, DESC
    }

    private static final Comparator<GoldenRecord> BY_ID = Comparator.comparing(GoldenRecord::id);

    public GoldenRecordSort {
        Objects.requireNonNull(field, "field is required");
        Objects.requireNonNull(direction, "direction is required");
    }

    public static GoldenRecordSort byId() {
        return new GoldenRecordSort(Field.ID, Direction.ASC);
    }

    public static GoldenRecordSort bySizeDescending() {
        return new GoldenRecordSort(Field.SIZE, Direction.DESC);
    }

    public static GoldenRecordSort byManufacturer() {
        return new GoldenRecordSort(Field.MANUFACTURER, Direction.ASC);
    }

    public Comparator<GoldenRecord> comparator() {
        Comparator<GoldenRecord> primary = switch (field) {
            case ID -> BY_ID;
            case SIZE -> Comparator.comparingInt(GoldenRecord::size);
            case MANUFACTURER -> Comparator.comparing(g -> g.representative().canonicalManufacturer());
        };
        if (direction == Direction.DESC) {
            primary = primary.reversed();
        }
        return field == Field.ID ? primary : primary.thenComparing(BY_ID);
    }
}
