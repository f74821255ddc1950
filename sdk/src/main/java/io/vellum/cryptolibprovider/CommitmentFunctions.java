package io.vellum.cryptolibprovider;

import io.vellum.crypto.Commitment;
import io.vellum.crypto.PublicKey;
import io.vellum.crypto.Signature;

import java.util.List;

/**
 * Homomorphic commitment and aggregatable Schnorr signature primitives.
 * Secret keys, blinding factors and nonces are passed as big-endian scalars of {@link #secretKeyLength()} bytes.
 */
public interface CommitmentFunctions {

    int secretKeyLength();

    byte[] generateSecretKey();

    // Deterministic scalar from arbitrary key material, never zero.
    byte[] secretKeyFromBytes(byte[] material);

    // sum(positive) - sum(negative) modulo the group order
    byte[] sumSecretKeys(List<byte[]> positive, List<byte[]> negative);

    PublicKey publicKey(byte[] secretKey);

    PublicKey sumPublicKeys(List<PublicKey> publicKeys);

    Commitment commit(long value, byte[] blindingFactor);

    // sum(outputs) - sum(inputs) + value*H == excess + offset*G
    boolean isBalanced(List<Commitment> outputs, List<Commitment> inputs, long value, PublicKey excess, byte[] offset);

    boolean isValidPublicKey(byte[] encoded);

    // Partial signature of one participant, the challenge commits to both aggregates.
    Signature signPartial(byte[] secretKey, byte[] secretNonce, PublicKey aggregateNonce, PublicKey aggregateExcess, byte[] message);

    boolean verifyPartial(Signature partialSignature, PublicKey publicNonce, PublicKey publicExcess, PublicKey aggregateExcess, byte[] message);

    Signature aggregateSignatures(List<Signature> partialSignatures, PublicKey aggregateNonce);

    Signature sign(byte[] secretKey, byte[] message);

    boolean verify(Signature signature, PublicKey publicKey, byte[] message);
}
