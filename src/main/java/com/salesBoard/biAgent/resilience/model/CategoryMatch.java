package com.salesBoard.biAgent.resilience.model;

import java.util.Objects;

/**
 * Normalized value of a vocabulary-backed field: either mapped onto a canonical term,
 * or unmapped and bucketed as {@value #UNKNOWN}.
 * 
 * Unmapped is a usable value, not a failure; distribution metrics still count it.
 */
public final class CategoryMatch {

    public static final String UNKNOWN = "Unknown";

    private final String canonical;
    private final String unmappedText;

    private CategoryMatch(String canonical, String unmappedText) {
        this.canonical = canonical;
        this.unmappedText = unmappedText;
    }

    public static CategoryMatch mapped(String canonical) {
        return new CategoryMatch(Objects.requireNonNull(canonical, "canonical"), null);
    }

    public static CategoryMatch unmapped(String text) {
        return new CategoryMatch(null, text);
    }

    public boolean isMapped() {
        return canonical != null;
    }

    /**
     * Canonical term, or {@value #UNKNOWN} for unmapped values.
     */
    public String label() {
        return isMapped() ? canonical : UNKNOWN;
    }

    /**
     * Original text of an unmapped value; null when mapped.
     */
    public String getUnmappedText() {
        return unmappedText;
    }

    public boolean is(String term) {
        return label().equalsIgnoreCase(term);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CategoryMatch)) {
            return false;
        }
        CategoryMatch that = (CategoryMatch) o;
        // all unmapped values share the Unknown bucket
        return Objects.equals(canonical, that.canonical);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(canonical);
    }

    @Override
    public String toString() {
        return isMapped() ? "Mapped(" + canonical + ")" : "Unmapped(" + unmappedText + ")";
    }
}
