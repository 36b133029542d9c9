package com.purchasingpower.chatgateway.fallback;

import java.util.Random;

/**
 * {@link TemplateSelector} backed by {@link Random}; a fixed seed makes the sequence reproducible.
 */
public class RandomTemplateSelector implements TemplateSelector {

    private final Random random;

    public RandomTemplateSelector() {
        this.random = new Random();
    }

    public RandomTemplateSelector(long seed) {
        this.random = new Random(seed);
    }

    @Override
    public int select(int candidateCount) {
        return random.nextInt(candidateCount);
    }
}
