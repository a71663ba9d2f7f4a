package com.knowledge.graph.normalization;

import org.tartarus.snowball.ext.PorterStemmer;

import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Canonicalizes a mention into the string used for entity keys and alias lookups.
 *
 * <p>Steps: lowercase, trim, drop possessives ({@code 's}) from every word, split on
 * whitespace and punctuation, Porter-stem each token, rejoin with single spaces.
 * The result is deterministic and independent of the process or client.</p>
 *
 * <p>Stemming is aggressive. Distinct words can collapse onto one stem
 * ("university" and "universe" both become "univers"), which makes such mentions
 * resolve to the same entity. That false-positive merge is an accepted trade-off
 * for catching plural and inflected forms.</p>
 */
public final class EntityNameNormalizer {

    private static final Pattern POSSESSIVE = Pattern.compile("['’]s\\b");
    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}]+");

    private EntityNameNormalizer() {
    }

    /**
     * Normalizes a name.
     *
     * @param name the raw mention
     * @return the normalized form, empty when the name has no word characters
     * @throws IllegalArgumentException if name is null
     */
    public static String normalize(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Name must not be null");
        }
        String lowered = name.toLowerCase(Locale.ROOT).trim();
        lowered = POSSESSIVE.matcher(lowered).replaceAll("");

        // the stemmer keeps internal state, so one instance per call
        PorterStemmer stemmer = new PorterStemmer();
        return Arrays.stream(TOKEN_SEPARATOR.split(lowered))
                .filter(token -> !token.isEmpty())
                .map(token -> stem(stemmer, token))
                .collect(Collectors.joining(" "));
    }

    private static String stem(PorterStemmer stemmer, String token) {
        stemmer.setCurrent(token);
        stemmer.stem();
        return stemmer.getCurrent();
    }
}
