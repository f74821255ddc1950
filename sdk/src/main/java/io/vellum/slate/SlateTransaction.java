package io.vellum.slate;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.vellum.crypto.Commitment;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

// Transaction body under negotiation: kernel offset, inputs and outputs, without the kernel itself.
public final class SlateTransaction {
    private final byte[] offset;
    private final List<Commitment> inputs;
    private final List<Commitment> outputs;

    @JsonCreator
    public SlateTransaction(@JsonProperty("offset") byte[] offset,
                            @JsonProperty("inputs") List<Commitment> inputs,
                            @JsonProperty("outputs") List<Commitment> outputs) {
        this.offset = offset == null ? null : Arrays.copyOf(offset, offset.length);
        this.inputs = inputs == null ? null : Collections.unmodifiableList(new ArrayList<>(inputs));
        this.outputs = outputs == null ? null : Collections.unmodifiableList(new ArrayList<>(outputs));
    }

    @JsonProperty("offset")
    public byte[] offset() {
        return offset == null ? null : Arrays.copyOf(offset, offset.length);
    }

    @JsonProperty("inputs")
    public List<Commitment> inputs() {
        return inputs;
    }

    @JsonProperty("outputs")
    public List<Commitment> outputs() {
        return outputs;
    }

    public SlateTransaction withOutput(Commitment output) {
        List<Commitment> newOutputs = new ArrayList<>(outputs);
        newOutputs.add(output);
        return new SlateTransaction(offset, inputs, newOutputs);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SlateTransaction that = (SlateTransaction) o;
        return Arrays.equals(offset, that.offset) &&
                Objects.equals(inputs, that.inputs) &&
                Objects.equals(outputs, that.outputs);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(inputs, outputs);
        result = 31 * result + Arrays.hashCode(offset);
        return result;
    }
}
