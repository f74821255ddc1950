package io.vellum.transaction;

@FunctionalInterface
public interface FeeCalculator {
    long calculateFee(long feeBase, int numInputs, int numOutputs, int numKernels);
}
