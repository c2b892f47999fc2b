package com.salesBoard.biAgent.resilience.normalizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Canonical terms of a category together with their synonyms.
 * 
 * Some synonyms are safe for looking up a field value but too common in plain English to be
 * read as a filter out of a question ("it", "new", "done"); those are registered as
 * lookup-only and left out of {@link #freeTextTerms()}. Instances are immutable.
 */
public final class Vocabulary {

    private static final Pattern SEPARATORS = Pattern.compile("[\\s_\\-]+");

    private final String name;
    private final List<String> canonicalTerms;
    private final Map<String, String> lookup;
    private final Map<String, String> freeText;

    private Vocabulary(String name, List<String> canonicalTerms, Map<String, String> lookup,
                       Map<String, String> freeText) {
        this.name = name;
        this.canonicalTerms = Collections.unmodifiableList(canonicalTerms);
        this.lookup = Collections.unmodifiableMap(lookup);
        this.freeText = Collections.unmodifiableMap(freeText);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Folds case, whitespace, dashes and underscores so "closed-won" matches "Closed Won".
     */
    public static String fold(String text) {
        return SEPARATORS.matcher(text.strip().toLowerCase(Locale.ROOT)).replaceAll(" ");
    }

    public String getName() {
        return name;
    }

    /**
     * Canonical terms in their declared order.
     */
    public List<String> getCanonicalTerms() {
        return canonicalTerms;
    }

    public Optional<String> lookup(String text) {
        if (text == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(lookup.get(fold(text)));
    }

    /**
     * Folded term to canonical term, for terms that may be matched inside free text.
     */
    public Map<String, String> freeTextTerms() {
        return freeText;
    }

    public static final class Builder {

        private final String name;
        private final List<String> canonicalTerms = new ArrayList<>();
        private final Map<String, String> lookup = new LinkedHashMap<>();
        private final Map<String, String> freeText = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        /**
         * Adds a canonical term and synonyms usable both for lookup and in free text.
         */
        public Builder term(String canonical, String... synonyms) {
            canonicalTerms.add(canonical);
            register(canonical, canonical, true);
            for (String synonym : synonyms) {
                register(synonym, canonical, true);
            }
            return this;
        }

        /**
         * Adds synonyms of an already declared term that are only used for field lookup.
         */
        public Builder lookupOnly(String canonical, String... synonyms) {
            if (!canonicalTerms.contains(canonical)) {
                throw new IllegalArgumentException("Unknown canonical term '" + canonical + "' in " + name);
            }
            for (String synonym : synonyms) {
                register(synonym, canonical, false);
            }
            return this;
        }

        public Vocabulary build() {
            return new Vocabulary(name, List.copyOf(canonicalTerms), new LinkedHashMap<>(lookup),
                    new LinkedHashMap<>(freeText));
        }

        private void register(String synonym, String canonical, boolean inFreeText) {
            String key = fold(synonym);
            String existing = lookup.putIfAbsent(key, canonical);
            if (existing != null && !existing.equals(canonical)) {
                throw new IllegalArgumentException(
                        "Synonym '" + synonym + "' maps to both " + existing + " and " + canonical + " in " + name);
            }
            if (inFreeText) {
                freeText.put(key, canonical);
            }
        }
    }
}
