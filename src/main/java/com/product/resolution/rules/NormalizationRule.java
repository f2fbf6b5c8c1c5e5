package com.product.resolution.rules;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * One case-insensitive regex rewrite in the normalization pipeline. Rules run in ascending
 * {@code priority}; a rule scoped to no field rewrites every field. Two rules with the same
 * name are the same rule.
 *
 * @param name        identifier used for logging and {@link NormalizationEngine#removeRule(String)}
 * @param priority    position in the pipeline, lower first
 * @param pattern     compiled match pattern
 * @param replacement replacement text, may reference groups
 * @param fields      field types the rule rewrites; empty for all
 */
public record NormalizationRule(String name, int priority, Pattern pattern, String replacement,
                                Set<FieldType> fields) {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    public NormalizationRule {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(pattern, "pattern is required");
        Objects.requireNonNull(replacement, "replacement is required");
        fields = fields == null || fields.isEmpty() ? Set.of() : Set.copyOf(fields);
    }

    /**
     * A rule rewriting every field.
     */
    public static NormalizationRule anyField(String name, int priority, String regex, String replacement) {
        return new NormalizationRule(name, priority, Pattern.compile(regex, FLAGS), replacement, Set.of());
    }

    /**
     * A rule rewriting only the given fields.
     */
    public static NormalizationRule forFields(String name, int priority, String regex, String replacement,
                                              FieldType first, FieldType... rest) {
        return new NormalizationRule(name, priority, Pattern.compile(regex, FLAGS), replacement,
                EnumSet.of(first, rest));
    }

    public boolean appliesTo(FieldType field) {
        return fields.isEmpty() || fields.contains(field);
    }

    public String apply(String input) {
        return input == null ? null : pattern.matcher(input).replaceAll(replacement);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof NormalizationRule other && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name + "(" + priority + ": /" + pattern.pattern() + "/ -> '" + replacement + "' on "
                + (fields.isEmpty() ? "all fields" : fields) + ")";
    }
}
