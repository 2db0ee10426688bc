package com.lambdastepper.lambda;

public class NormalizationResult {
    private final Term term;
    private final int steps;
    private final boolean normalForm;

    NormalizationResult(Term term, int steps, boolean normalForm) {
        this.term = term;
        this.steps = steps;
        this.normalForm = normalForm;
    }

    public Term getTerm() {
        return term;
    }

    public int getSteps() {
        return steps;
    }

    // false when the step budget ran out first
    public boolean reachedNormalForm() {
        return normalForm;
    }
}
