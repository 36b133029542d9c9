package com.purchasingpower.chatgateway.fallback;

/**
 * Picks one of {@code candidateCount} templates. Injected so tests can fix the choice.
 */
@FunctionalInterface
public interface TemplateSelector {

    /**
     * @param candidateCount number of candidates, always at least 1
     * @return an index; values outside {@code [0, candidateCount)} are wrapped
     */
    int select(int candidateCount);

    static TemplateSelector first() {
        return count -> 0;
    }
}
