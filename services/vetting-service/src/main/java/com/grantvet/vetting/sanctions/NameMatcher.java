package com.grantvet.vetting.sanctions;

import com.grantvet.common.exception.GrantVetException;
import com.grantvet.common.exception.InvalidArgumentException;
import com.grantvet.common.exception.UpstreamUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.text.similarity.JaroWinklerSimilarity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Exact and fuzzy screening of organization names against a sanctions list.
 *
 * The list is normalized once into an immutable index: a hash map from
 * normalized name (primary or alias) to the entries carrying it, and the
 * entity keys bucketed by length with a precomputed character histogram each.
 * Fuzzy lookups score candidates with Jaro-Winkler similarity, but first skip
 * whole length buckets and then single keys whose best achievable similarity
 * is below the threshold. Both bounds never undercut the real score, so
 * pruning changes latency and never the result.
 *
 * Lookups read a volatile snapshot and never block; {@link #reload()} swaps in
 * a freshly built index.
 */
@Slf4j
public class NameMatcher implements SanctionsScreener {

    static final String SOURCE_NAME = "sanctions-list";

    private static final JaroWinklerSimilarity JARO_WINKLER = new JaroWinklerSimilarity();
    private static final int ALPHABET_SIZE = 38;
    private static final int MAX_PREFIX = 4;

    private static final Comparator<String> ENTITY_NUMBER_ORDER = (left, right) -> {
        boolean leftNumeric = isNumeric(left);
        boolean rightNumeric = isNumeric(right);
        if (leftNumeric && rightNumeric) {
            int byLength = Integer.compare(stripLeadingZeros(left).length(), stripLeadingZeros(right).length());
            return byLength != 0 ? byLength : stripLeadingZeros(left).compareTo(stripLeadingZeros(right));
        }
        if (leftNumeric != rightNumeric) {
            return leftNumeric ? -1 : 1;
        }
        return left.compareTo(right);
    };

    private final SanctionsListSource source;
    private volatile Index index;

    public NameMatcher(SanctionsListSource source) {
        this.source = source;
    }

    /**
     * Rebuild the index from the source.
     *
     * @throws UpstreamUnavailableException if the source cannot provide the list
     */
    public synchronized void reload() {
        List<SanctionsEntry> entries;
        try {
            entries = source.entries();
        } catch (GrantVetException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new UpstreamUnavailableException(SOURCE_NAME, "Sanctions list could not be loaded", e);
        }
        if (entries == null) {
            throw new UpstreamUnavailableException(SOURCE_NAME, "Sanctions list source returned no snapshot");
        }
        Index rebuilt = Index.build(entries);
        this.index = rebuilt;
        log.info("Sanctions index loaded: {} entries, {} distinct normalized names",
                entries.size(), rebuilt.byName.size());
    }

    public int size() {
        return index().entryCount;
    }

    @Override
    public List<SanctionsMatch> exactLookup(String name) {
        NormalizedName candidate = NameNormalizer.normalize(name);
        if (candidate.isEmpty()) {
            return List.of();
        }
        List<IndexedName> hits = index().byName.getOrDefault(candidate.getValue(), List.of());

        Map<String, SanctionsMatch> byEntity = new LinkedHashMap<>();
        for (IndexedName hit : hits) {
            SanctionsMatch match = toMatch(hit, hit.basis, null);
            // a primary-name hit outranks an alias hit on the same entry
            byEntity.merge(hit.entry.getEntityNumber(), match,
                    (existing, incoming) -> existing.getBasis() == MatchBasis.EXACT ? existing : incoming);
        }
        List<SanctionsMatch> matches = new ArrayList<>(byEntity.values());
        matches.sort(Comparator.comparing(SanctionsMatch::getEntityNumber, ENTITY_NUMBER_ORDER));
        return Collections.unmodifiableList(matches);
    }

    @Override
    public List<SanctionsMatch> fuzzyLookup(String name, double threshold) {
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new InvalidArgumentException(
                    "Invalid fuzzy match threshold: " + threshold + ". Must be between 0.0 and 1.0");
        }
        NormalizedName candidate = NameNormalizer.normalize(name);
        if (candidate.isEmpty()) {
            return List.of();
        }
        Index current = index();
        String value = candidate.getValue();

        int[] histogram = histogram(value);

        Map<String, SanctionsMatch> bestByEntity = new HashMap<>();
        for (Map.Entry<Integer, List<IndexedKey>> bucket : current.entityKeysByLength.entrySet()) {
            if (similarityUpperBound(value.length(), bucket.getKey()) < threshold) {
                continue;
            }
            for (IndexedKey key : bucket.getValue()) {
                // slack absorbs rounding differences against the library's own arithmetic
                if (key.upperBound(value, histogram) + 1e-9 < threshold) {
                    continue;
                }
                double similarity = JARO_WINKLER.apply(value, key.value);
                if (similarity < threshold) {
                    continue;
                }
                for (IndexedName hit : current.byName.get(key.value)) {
                    if (!hit.entry.isEntity()) {
                        continue;
                    }
                    SanctionsMatch match = toMatch(hit, MatchBasis.FUZZY, similarity);
                    bestByEntity.merge(hit.entry.getEntityNumber(), match,
                            (existing, incoming) -> incoming.getSimilarity() > existing.getSimilarity() ? incoming : existing);
                }
            }
        }

        List<SanctionsMatch> matches = new ArrayList<>(bestByEntity.values());
        matches.sort(Comparator.comparing(SanctionsMatch::getSimilarity, Comparator.reverseOrder())
                .thenComparing(SanctionsMatch::getEntityNumber, ENTITY_NUMBER_ORDER));
        return Collections.unmodifiableList(matches);
    }

    /**
     * Highest Jaro-Winkler similarity two strings of the given lengths can reach:
     * at most min(a, b) characters match, and the prefix bonus adds at most 0.4 of the remainder.
     */
    static double similarityUpperBound(int lengthA, int lengthB) {
        if (lengthA == 0 || lengthB == 0) {
            return 0.0;
        }
        double ratio = (double) Math.min(lengthA, lengthB) / Math.max(lengthA, lengthB);
        double jaro = (2.0 + ratio) / 3.0;
        return jaro < 0.7 ? jaro : jaro + 0.4 * (1.0 - jaro);
    }

    /**
     * Tighter bound from the characters themselves: Jaro can only pair equal
     * characters, so the match count is at most the shared character multiset,
     * and the Winkler bonus is at most 0.1 per character of common prefix (up to 4).
     */
    static double similarityUpperBound(String left, String right) {
        return new IndexedKey(right).upperBound(left, histogram(left));
    }

    private static double similarityUpperBound(int lengthA, int lengthB, int sharedCharacters, int commonPrefix) {
        if (sharedCharacters == 0) {
            return 0.0;
        }
        double jaro = ((double) sharedCharacters / lengthA + (double) sharedCharacters / lengthB + 1.0) / 3.0;
        return jaro < 0.7 ? jaro : jaro + 0.1 * commonPrefix * (1.0 - jaro);
    }

    private static int symbol(char c) {
        if (c >= 'a' && c <= 'z') {
            return c - 'a';
        }
        if (c >= '0' && c <= '9') {
            return 26 + (c - '0');
        }
        // normalized names only carry [a-z0-9 ]; anything else shares one slot
        return c == ' ' ? 36 : 37;
    }

    private static int[] histogram(String value) {
        int[] counts = new int[ALPHABET_SIZE];
        for (int i = 0; i < value.length(); i++) {
            counts[symbol(value.charAt(i))]++;
        }
        return counts;
    }

    private Index index() {
        Index current = index;
        if (current == null) {
            synchronized (this) {
                if (index == null) {
                    reload();
                }
                current = index;
            }
        }
        return current;
    }

    private static SanctionsMatch toMatch(IndexedName hit, MatchBasis basis, Double similarity) {
        return SanctionsMatch.builder()
                .entityNumber(hit.entry.getEntityNumber())
                .matchedName(hit.rawName)
                .entityType(hit.entry.getEntityType())
                .program(hit.entry.getProgram())
                .basis(basis)
                .similarity(similarity)
                .build();
    }

    private static boolean isNumeric(String value) {
        return value != null && !value.isEmpty() && value.chars().allMatch(Character::isDigit);
    }

    private static String stripLeadingZeros(String digits) {
        int i = 0;
        while (i < digits.length() - 1 && digits.charAt(i) == '0') {
            i++;
        }
        return digits.substring(i);
    }

    private static final class IndexedName {
        private final SanctionsEntry entry;
        private final String rawName;
        private final MatchBasis basis;

        private IndexedName(SanctionsEntry entry, String rawName, MatchBasis basis) {
            this.entry = entry;
            this.rawName = rawName;
            this.basis = basis;
        }
    }

    /** A normalized name with its character histogram stored sparsely. */
    private static final class IndexedKey {
        private final String value;
        private final int[] symbols;
        private final int[] counts;

        private IndexedKey(String value) {
            this.value = value;
            int[] full = histogram(value);
            int distinct = 0;
            for (int count : full) {
                if (count > 0) {
                    distinct++;
                }
            }
            this.symbols = new int[distinct];
            this.counts = new int[distinct];
            int next = 0;
            for (int symbol = 0; symbol < full.length; symbol++) {
                if (full[symbol] > 0) {
                    symbols[next] = symbol;
                    counts[next] = full[symbol];
                    next++;
                }
            }
        }

        double upperBound(String candidate, int[] candidateHistogram) {
            int shared = 0;
            for (int i = 0; i < symbols.length; i++) {
                shared += Math.min(counts[i], candidateHistogram[symbols[i]]);
            }
            int limit = Math.min(MAX_PREFIX, Math.min(candidate.length(), value.length()));
            int prefix = 0;
            while (prefix < limit && candidate.charAt(prefix) == value.charAt(prefix)) {
                prefix++;
            }
            return similarityUpperBound(candidate.length(), value.length(), shared, prefix);
        }
    }

    private static final class Index {
        private final Map<String, List<IndexedName>> byName;
        private final TreeMap<Integer, List<IndexedKey>> entityKeysByLength;
        private final int entryCount;

        private Index(Map<String, List<IndexedName>> byName, TreeMap<Integer, List<IndexedKey>> entityKeysByLength,
                      int entryCount) {
            this.byName = byName;
            this.entityKeysByLength = entityKeysByLength;
            this.entryCount = entryCount;
        }

        static Index build(List<SanctionsEntry> entries) {
            Map<String, List<IndexedName>> byName = new HashMap<>();
            for (SanctionsEntry entry : entries) {
                add(byName, entry, entry.getPrimaryName(), MatchBasis.EXACT);
                for (String alias : entry.getAliases()) {
                    add(byName, entry, alias, MatchBasis.ALIAS);
                }
            }
            // fuzzy matching only reports entities, so keys carried solely by individuals are left out
            TreeMap<Integer, List<IndexedKey>> entityKeysByLength = new TreeMap<>();
            for (Map.Entry<String, List<IndexedName>> named : byName.entrySet()) {
                if (named.getValue().stream().noneMatch(hit -> hit.entry.isEntity())) {
                    continue;
                }
                String key = named.getKey();
                entityKeysByLength.computeIfAbsent(key.length(), length -> new ArrayList<>()).add(new IndexedKey(key));
            }
            return new Index(byName, entityKeysByLength, entries.size());
        }

        private static void add(Map<String, List<IndexedName>> byName, SanctionsEntry entry, String rawName, MatchBasis basis) {
            NormalizedName normalized = NameNormalizer.normalize(rawName);
            if (normalized.isEmpty()) {
                return;
            }
            byName.computeIfAbsent(normalized.getValue(), key -> new ArrayList<>())
                    .add(new IndexedName(entry, rawName, basis));
        }
    }
}
