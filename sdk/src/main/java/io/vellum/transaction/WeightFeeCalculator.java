package io.vellum.transaction;

/**
 * Fee proportional to the transaction weight: outputs weigh 4, kernels 1, inputs -1, with a minimum weight of 1.
 */
public class WeightFeeCalculator implements FeeCalculator {
    public static final int OUTPUT_WEIGHT = 4;
    public static final int KERNEL_WEIGHT = 1;
    public static final int INPUT_WEIGHT = 1;

    @Override
    public long calculateFee(long feeBase, int numInputs, int numOutputs, int numKernels) {
        if (feeBase < 0)
            throw new IllegalArgumentException("Fee base must be >= 0.");
        long weight = (long) numOutputs * OUTPUT_WEIGHT + (long) numKernels * KERNEL_WEIGHT - (long) numInputs * INPUT_WEIGHT;
        return Math.max(weight, 1) * feeBase;
    }
}
