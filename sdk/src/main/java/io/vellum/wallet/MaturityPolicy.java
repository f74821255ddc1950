package io.vellum.wallet;

import io.vellum.output.OutputData;

/**
 * Decides whether an output may already be spent regardless of the caller's confirmation threshold.
 */
@FunctionalInterface
public interface MaturityPolicy {

    boolean isMature(OutputData output, long chainHeight);
}
