package com.secrecon.semantic;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/** Maps any of a set of case-insensitive substrings to a {@link ConceptRole}. */
public final class KeywordRule {
    private final ConceptRole role;
    private final List<String> keywords;

    public KeywordRule(ConceptRole role, List<String> keywords) {
        this.role = Objects.requireNonNull(role, "role");
        if (keywords.isEmpty()) {
            throw new IllegalArgumentException("Rule for " + role + " needs at least one keyword");
        }
        this.keywords = keywords.stream().map(keyword -> keyword.toLowerCase(Locale.ROOT)).toList();
    }

    public static KeywordRule of(ConceptRole role, String... keywords) {
        return new KeywordRule(role, List.of(keywords));
    }

    public ConceptRole getRole() {
        return role;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    public boolean matches(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return role + keywords.toString();
    }
}
