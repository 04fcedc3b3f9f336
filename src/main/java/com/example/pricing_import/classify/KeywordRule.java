package com.example.pricing_import.classify;

import java.util.List;
import java.util.regex.Pattern;

/**
 * One keyword rule: any keyword found as a whole word (or phrase) in the normalized name assigns the category.
 */
public record KeywordRule(Category category, List<String> keywords, List<Pattern> patterns) {

    public static KeywordRule of(Category category, String... keywords) {
        List<String> kw = List.of(keywords);
        List<Pattern> patterns = kw.stream()
                .map(k -> Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(k) + "(?![\\p{L}\\p{N}])"))
                .toList();
        return new KeywordRule(category, kw, patterns);
    }

    public boolean matches(String normalizedName) {
        for (Pattern p : patterns) {
            if (p.matcher(normalizedName).find()) {
                return true;
            }
        }
        return false;
    }
}
