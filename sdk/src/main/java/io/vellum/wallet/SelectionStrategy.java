package io.vellum.wallet;

public enum SelectionStrategy {
    // every spendable coin, one aggregated change output
    ALL,
    // ascending by amount until the target is covered
    SMALLEST,
    // fewest inputs, then the smallest leftover for that input count
    LEAST_LEFTOVER
}
