package com.product.resolution.rules;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands a normalized part number into an ordered, bounded set of plausible alternate spellings.
 *
 * <p>Candidates are produced in a fixed order: the input itself, the input with spaces
 * removed, trailing unit/packaging/revision suffixes dropped, a leading manufacturer prefix
 * dropped, letter/digit groups swapped and OCR-confusable characters folded. Duplicates
 * are dropped and the list is truncated to {@code maxVariants}, so the input is always
 * the first element and identical input gives an identical list.</p>
 */
public class VariantGenerator {

    public static final int DEFAULT_MAX_VARIANTS = 12;

    private static final String SUFFIX_WORDS = "EA|EACH|PCS|PIECE|PIECES|PK|PACK|UNIT|UNITS|CT|COUNT|QTY|QUANTITY"
            + "|BULK|RETAIL|CONSUMER|COMMERCIAL|STD|STANDARD|NEW|OLD|ORIGINAL|REPLACEMENT|REFURB";
    private static final Pattern SUFFIX_TOKEN =
            Pattern.compile("(?:" + SUFFIX_WORDS + "|REV\\d{1,3}|VERSION\\d{1,3}|V\\d{1,3}|R\\d{1,3})");
    // Suffix glued to a token ending in a digit: 4111EA
    private static final Pattern GLUED_SUFFIX =
            Pattern.compile("^(.*\\d)(?:" + SUFFIX_WORDS + "|REV\\d{1,3})$");
    private static final Pattern LETTERS_ONLY = Pattern.compile("[A-Z]{2,6}");
    private static final Pattern GLUED_PREFIX = Pattern.compile("^([A-Z]{2,6})(\\d.*)$");
    private static final Pattern LETTERS_THEN_DIGITS = Pattern.compile("^([A-Z]+)(\\d+)$");
    private static final Pattern DIGITS_THEN_LETTERS = Pattern.compile("^(\\d+)([A-Z]+)$");
    private static final int MIN_CORE_LENGTH = 3;

    private final int maxVariants;

    public VariantGenerator() {
        this(DEFAULT_MAX_VARIANTS);
    }

    public VariantGenerator(int maxVariants) {
        if (maxVariants < 1) {
            throw new IllegalArgumentException("maxVariants must be at least 1, got " + maxVariants);
        }
        this.maxVariants = maxVariants;
    }

    public int getMaxVariants() {
        return maxVariants;
    }

    /**
     * Generates variants without manufacturer context.
     */
    public List<String> generate(String normalized) {
        return generate(normalized, null);
    }

    /**
     * Generates variants of an already normalized part number.
     *
     * @param normalized       output of {@link PartNumberNormalizer#normalize(String)}
     * @param manufacturerHint canonical manufacturer of the record, or {@code null}; enables
     *                         dropping a manufacturer prefix glued to the part number
     * @return ordered, duplicate-free variants, the input first
     */
    public List<String> generate(String normalized, String manufacturerHint) {
        if (normalized == null || normalized.isEmpty()) {
            return List.of("");
        }

        Set<String> variants = new LinkedHashSet<>();
        variants.add(normalized);
        variants.add(joined(normalized));

        List<String> tokens = new ArrayList<>(Arrays.asList(normalized.split(" ")));

        List<String> withoutSuffix = stripSuffixes(tokens, variants);
        List<String> core = stripPrefix(withoutSuffix, manufacturerHint, variants);

        String joinedCore = String.join("", core);
        Set<String> knownPrefixes = manufacturerPrefixes(manufacturerHint);
        if (!knownPrefixes.isEmpty()) {
            Matcher glued = GLUED_PREFIX.matcher(joinedCore);
            if (glued.matches() && knownPrefixes.contains(glued.group(1))
                    && glued.group(2).length() >= MIN_CORE_LENGTH) {
                joinedCore = glued.group(2);
                variants.add(joinedCore);
            }
        }

        String swapped = swapGroups(joinedCore);
        if (swapped != null) {
            variants.add(swapped);
        }

        String folded = ocrFold(joinedCore);
        if (!folded.equals(joinedCore)) {
            variants.add(folded);
        }

        variants.remove("");
        List<String> result = new ArrayList<>(variants);
        if (result.size() > maxVariants) {
            result = result.subList(0, maxVariants);
        }
        return Collections.unmodifiableList(new ArrayList<>(result));
    }

    /**
     * Whether a variant is too short, relative to the original normalized part number,
     * to be trusted as an exact match.
     */
    public static boolean isShortVariant(int originalLength, String variant) {
        int length = variant.length();
        if (originalLength <= 5) {
            return false;
        }
        if (originalLength <= 8) {
            return length <= 3;
        }
        if (originalLength <= 12) {
            return length <= 4;
        }
        return length < originalLength * 0.4;
    }

    /**
     * Prefix candidates derived from a manufacturer name: its first word, truncations,
     * consonant skeleton and acronym.
     */
    static Set<String> manufacturerPrefixes(String manufacturer) {
        Set<String> prefixes = new LinkedHashSet<>();
        if (manufacturer == null || manufacturer.isBlank()) {
            return prefixes;
        }
        String name = manufacturer.toUpperCase(Locale.ROOT).trim();
        String[] words = name.split("\\s+");
        String squeezed = String.join("", words).replaceAll("[^A-Z0-9]", "");
        if (squeezed.isEmpty()) {
            return prefixes;
        }

        prefixes.add(words[0]);
        prefixes.add(squeezed);
        for (int len = 2; len <= 4 && len <= squeezed.length(); len++) {
            prefixes.add(squeezed.substring(0, len));
        }

        String consonants = squeezed.charAt(0) + squeezed.substring(1).replaceAll("[AEIOU]", "");
        for (int len = 2; len <= 4 && len <= consonants.length(); len++) {
            prefixes.add(consonants.substring(0, len));
        }

        if (words.length > 1) {
            StringBuilder acronym = new StringBuilder();
            for (String word : words) {
                acronym.append(word.charAt(0));
            }
            prefixes.add(acronym.toString());
        }
        return prefixes;
    }

    private static List<String> stripSuffixes(List<String> tokens, Set<String> variants) {
        List<String> current = new ArrayList<>(tokens);
        boolean changed = true;
        while (changed && !current.isEmpty()) {
            changed = false;
            String last = current.get(current.size() - 1);
            if (current.size() > 1 && SUFFIX_TOKEN.matcher(last).matches()) {
                List<String> remaining = current.subList(0, current.size() - 1);
                if (String.join("", remaining).length() >= MIN_CORE_LENGTH) {
                    current = new ArrayList<>(remaining);
                    changed = true;
                }
            } else {
                Matcher glued = GLUED_SUFFIX.matcher(last);
                if (glued.matches()) {
                    List<String> remaining = new ArrayList<>(current.subList(0, current.size() - 1));
                    remaining.add(glued.group(1));
                    if (String.join("", remaining).length() >= MIN_CORE_LENGTH) {
                        current = remaining;
                        changed = true;
                    }
                }
            }
            if (changed) {
                variants.add(String.join(" ", current));
                variants.add(String.join("", current));
            }
        }
        return current;
    }

    private static List<String> stripPrefix(List<String> tokens, String manufacturerHint, Set<String> variants) {
        if (tokens.size() < 2) {
            return tokens;
        }
        String first = tokens.get(0);
        List<String> rest = tokens.subList(1, tokens.size());
        String restJoined = String.join("", rest);

        boolean drop;
        Set<String> knownPrefixes = manufacturerPrefixes(manufacturerHint);
        if (!knownPrefixes.isEmpty()) {
            drop = knownPrefixes.contains(first);
        } else {
            drop = LETTERS_ONLY.matcher(first).matches() && restJoined.chars().anyMatch(Character::isDigit);
        }
        if (!drop || restJoined.length() < MIN_CORE_LENGTH) {
            return tokens;
        }
        variants.add(String.join(" ", rest));
        variants.add(restJoined);
        return new ArrayList<>(rest);
    }

    private static String swapGroups(String core) {
        Matcher lettersFirst = LETTERS_THEN_DIGITS.matcher(core);
        if (lettersFirst.matches()) {
            return lettersFirst.group(2) + lettersFirst.group(1);
        }
        Matcher digitsFirst = DIGITS_THEN_LETTERS.matcher(core);
        if (digitsFirst.matches()) {
            return digitsFirst.group(2) + digitsFirst.group(1);
        }
        return null;
    }

    private static String ocrFold(String core) {
        return core.replace('O', '0').replace('I', '1').replace('L', '1');
    }

    private static String joined(String value) {
        return value.replace(" ", "");
    }
}
