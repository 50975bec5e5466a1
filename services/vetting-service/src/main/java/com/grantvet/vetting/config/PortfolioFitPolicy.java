package com.grantvet.vetting.config;

import com.grantvet.vetting.domain.Ein;
import lombok.Builder;
import lombok.Value;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Platform policy deciding which organizations fall inside the funding portfolio.
 *
 * EIN lists are held in stripped nine-digit form and NTEE prefixes upper-cased,
 * so membership checks are plain set lookups.
 */
@Value
@Builder
public class PortfolioFitPolicy {

    /**
     * Major NTEE groups the platform funds. Q (international), T (philanthropy),
     * V (social science), X (religion), Y (mutual benefit) and Z (unknown) are left out.
     */
    public static final List<String> DEFAULT_NTEE_PREFIXES = List.of(
            "A", "B", "C", "D", "E", "F", "G", "H", "I", "J", "K", "L", "M", "N", "O", "P",
            "R", "S", "U", "W");

    @Builder.Default
    boolean enabled = true;
    @Builder.Default
    Set<String> excludedEins = Set.of();
    @Builder.Default
    Set<String> includedEins = Set.of();
    @Builder.Default
    List<String> allowedNteePrefixes = DEFAULT_NTEE_PREFIXES;

    public static PortfolioFitPolicy defaults() {
        return builder().build();
    }

    public static PortfolioFitPolicy of(boolean enabled, Collection<String> excludedEins,
                                        Collection<String> includedEins, Collection<String> allowedNteePrefixes) {
        return PortfolioFitPolicy.builder()
                .enabled(enabled)
                .excludedEins(stripAll(excludedEins))
                .includedEins(stripAll(includedEins))
                .allowedNteePrefixes(allowedNteePrefixes == null ? List.of() : allowedNteePrefixes.stream()
                        .filter(prefix -> prefix != null && !prefix.isBlank())
                        .map(prefix -> prefix.trim().toUpperCase(Locale.ROOT))
                        .distinct()
                        .collect(Collectors.toUnmodifiableList()))
                .build();
    }

    public boolean isExcluded(String ein) {
        return excludedEins.contains(Ein.strip(ein));
    }

    public boolean isIncluded(String ein) {
        return includedEins.contains(Ein.strip(ein));
    }

    /**
     * Case-insensitive prefix match of the organization's NTEE code; blank codes never match.
     */
    public String matchingPrefix(String nteeCode) {
        if (nteeCode == null || nteeCode.isBlank()) {
            return null;
        }
        String code = nteeCode.trim().toUpperCase(Locale.ROOT);
        return allowedNteePrefixes.stream()
                .filter(prefix -> code.startsWith(prefix.toUpperCase(Locale.ROOT)))
                .findFirst()
                .orElse(null);
    }

    private static Set<String> stripAll(Collection<String> eins) {
        if (eins == null) {
            return Set.of();
        }
        return eins.stream()
                .map(Ein::strip)
                .filter(ein -> !ein.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }
}
