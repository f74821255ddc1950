package io.vellum.transaction;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import io.vellum.crypto.Commitment;
import io.vellum.cryptolibprovider.CommitmentFunctions;
import io.vellum.transaction.exception.TransactionSemanticValidityException;
import io.vellum.utils.BytesUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * Fully signed, broadcastable transaction. Inputs and outputs are kept in canonical (sorted) order so two
 * transactions with the same content have the same id.
 */
public final class Transaction {
    public static final int OFFSET_LENGTH = 32;

    private final byte[] offset;
    private final List<Commitment> inputs;
    private final List<Commitment> outputs;
    private final TransactionKernel kernel;

    private String id;

    @JsonCreator
    public Transaction(@JsonProperty("offset") byte[] offset,
                       @JsonProperty("inputs") List<Commitment> inputs,
                       @JsonProperty("outputs") List<Commitment> outputs,
                       @JsonProperty("kernel") TransactionKernel kernel) {
        Objects.requireNonNull(offset, "offset must be defined");
        Objects.requireNonNull(inputs, "inputs must be defined");
        Objects.requireNonNull(outputs, "outputs must be defined");
        Objects.requireNonNull(kernel, "kernel must be defined");
        if (offset.length != OFFSET_LENGTH)
            throw new IllegalArgumentException(String.format("Incorrect offset length, %d expected, %d found", OFFSET_LENGTH, offset.length));

        this.offset = Arrays.copyOf(offset, OFFSET_LENGTH);
        this.inputs = sorted(inputs);
        this.outputs = sorted(outputs);
        this.kernel = kernel;
    }

    private static List<Commitment> sorted(List<Commitment> commitments) {
        List<Commitment> copy = new ArrayList<>(commitments);
        copy.sort(Comparator.comparing(Commitment::toString));
        return Collections.unmodifiableList(copy);
    }

    @JsonProperty("offset")
    public byte[] offset() {
        return Arrays.copyOf(offset, OFFSET_LENGTH);
    }

    @JsonProperty("inputs")
    public List<Commitment> inputs() {
        return inputs;
    }

    @JsonProperty("outputs")
    public List<Commitment> outputs() {
        return outputs;
    }

    @JsonProperty("kernel")
    public TransactionKernel kernel() {
        return kernel;
    }

    @JsonIgnore
    public long fee() {
        return kernel.fee();
    }

    @JsonIgnore
    public synchronized String id() {
        if (id == null) {
            Hasher hasher = Hashing.sha256().newHasher();
            hasher.putBytes(offset);
            for (Commitment input : inputs)
                hasher.putBytes(input.toBytes());
            for (Commitment output : outputs)
                hasher.putBytes(output.toBytes());
            hasher.putBytes(kernel.excess().toBytes());
            hasher.putBytes(kernel.excessSignature().toBytes());
            hasher.putBytes(kernel.signatureMessage());
            id = BytesUtils.toHexString(hasher.hash().asBytes());
        }
        return id;
    }

    // Checks the kernel signature and that sum(outputs) - sum(inputs) + fee*H == excess + offset*G.
    public void semanticValidity(CommitmentFunctions functions) throws TransactionSemanticValidityException {
        if (inputs.isEmpty())
            throw new TransactionSemanticValidityException("Transaction has no inputs");
        if (outputs.isEmpty())
            throw new TransactionSemanticValidityException("Transaction has no outputs");
        if (new HashSet<>(inputs).size() != inputs.size())
            throw new TransactionSemanticValidityException("Transaction spends the same input twice");
        if (new HashSet<>(outputs).size() != outputs.size())
            throw new TransactionSemanticValidityException("Transaction creates the same output twice");
        for (Commitment output : outputs) {
            if (inputs.contains(output))
                throw new TransactionSemanticValidityException("Transaction output is also spent as input: " + output);
        }

        if (!functions.verify(kernel.excessSignature(), kernel.excess(), kernel.signatureMessage()))
            throw new TransactionSemanticValidityException("Kernel excess signature is invalid");

        if (!functions.isBalanced(outputs, inputs, kernel.fee(), kernel.excess(), offset))
            throw new TransactionSemanticValidityException("Transaction commitments do not balance");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Transaction that = (Transaction) o;
        return Arrays.equals(offset, that.offset) &&
                inputs.equals(that.inputs) &&
                outputs.equals(that.outputs) &&
                kernel.equals(that.kernel);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(inputs, outputs, kernel);
        result = 31 * result + Arrays.hashCode(offset);
        return result;
    }

    @Override
    public String toString() {
        return String.format("Transaction(id: %s, inputs: %d, outputs: %d, fee: %d)", id(), inputs.size(), outputs.size(), fee());
    }
}
