package io.vellum.slate;

import com.google.common.hash.Hashing;
import com.google.common.primitives.Bytes;
import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;
import io.vellum.crypto.Commitment;
import io.vellum.crypto.PublicKey;
import io.vellum.cryptolibprovider.CommitmentFunctions;
import io.vellum.slate.exception.InvalidSlateException;
import io.vellum.transaction.Transaction;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Checks slates received from a counterparty. Structural defects throw {@link InvalidSlateException};
 * cryptographic consistency checks return a boolean so the caller decides how to reject.
 */
public class SlateValidator {
    private static final Logger log = LogManager.getLogger(SlateValidator.class);

    private final CommitmentFunctions functions;

    public SlateValidator(CommitmentFunctions functions) {
        this.functions = Objects.requireNonNull(functions, "functions must be defined");
    }

    // Digest signed by a participant's message signature, bound to the slate and the participant.
    public static byte[] messageDigest(UUID slateId, int participantId, Optional<String> message) {
        return Hashing.sha256().hashBytes(Bytes.concat(
                Longs.toByteArray(slateId.getMostSignificantBits()),
                Longs.toByteArray(slateId.getLeastSignificantBits()),
                Ints.toByteArray(participantId),
                message.orElse("").getBytes(StandardCharsets.UTF_8))).asBytes();
    }

    public void validateStructure(Slate slate) throws InvalidSlateException {
        if (slate == null)
            throw new InvalidSlateException("Slate is missing");
        if (slate.version() != Slate.CURRENT_VERSION)
            throw new InvalidSlateException(String.format("Unsupported slate version %d, %d expected", slate.version(), Slate.CURRENT_VERSION));
        if (slate.id() == null)
            throw new InvalidSlateException("Slate id is missing");
        if (slate.numParticipants() != Slate.NUM_PARTICIPANTS)
            throw new InvalidSlateException(String.format("Incorrect number of participants, %d expected, %d found",
                    Slate.NUM_PARTICIPANTS, slate.numParticipants()));
        if (slate.amount() < 0 || slate.fee() < 0)
            throw new InvalidSlateException("Slate amount and fee must be >= 0");
        if (slate.amount() > Long.MAX_VALUE - slate.fee())
            throw new InvalidSlateException("Slate amount plus fee overflows");
        if (slate.height() < 0 || slate.lockHeight() < 0)
            throw new InvalidSlateException("Slate heights must be >= 0");

        SlateState state = slate.state();
        if (state == null)
            throw new InvalidSlateException("Slate state is missing");

        validateTransaction(slate.transaction(), state);
        validateParticipants(slate.participantData(), state);
    }

    private void validateTransaction(SlateTransaction transaction, SlateState state) throws InvalidSlateException {
        if (transaction == null)
            throw new InvalidSlateException("Slate transaction is missing");
        byte[] offset = transaction.offset();
        if (offset == null || offset.length != Transaction.OFFSET_LENGTH)
            throw new InvalidSlateException("Slate kernel offset is missing or has a wrong length");
        if (transaction.inputs() == null || transaction.inputs().isEmpty())
            throw new InvalidSlateException("Slate has no inputs");
        if (transaction.outputs() == null)
            throw new InvalidSlateException("Slate outputs are missing");
        if (state != SlateState.CREATED && transaction.outputs().isEmpty())
            throw new InvalidSlateException("Slate has no outputs");

        Set<Commitment> seen = new HashSet<>();
        validateCommitments(transaction.inputs(), seen);
        validateCommitments(transaction.outputs(), seen);
    }

    private void validateCommitments(List<Commitment> commitments, Set<Commitment> seen) throws InvalidSlateException {
        for (Commitment commitment : commitments) {
            if (commitment == null || !functions.isValidPublicKey(commitment.toBytes()))
                throw new InvalidSlateException("Slate contains an invalid commitment");
            if (!seen.add(commitment))
                throw new InvalidSlateException("Slate contains commitment " + commitment + " twice");
        }
    }

    private void validateParticipants(List<ParticipantData> participants, SlateState state) throws InvalidSlateException {
        if (participants == null)
            throw new InvalidSlateException("Slate participant data is missing");
        int expected = state == SlateState.CREATED ? 1 : Slate.NUM_PARTICIPANTS;
        if (participants.size() != expected)
            throw new InvalidSlateException(String.format("Incorrect participant data count for state %s, %d expected, %d found",
                    state, expected, participants.size()));

        Set<Integer> ids = new HashSet<>();
        for (ParticipantData participant : participants) {
            if (participant == null)
                throw new InvalidSlateException("Slate participant data entry is missing");
            if (participant.id() < 0 || participant.id() >= expected || !ids.add(participant.id()))
                throw new InvalidSlateException("Unexpected participant id " + participant.id());
            if (!isValidKey(participant.publicBlindExcess()) || !isValidKey(participant.publicNonce()))
                throw new InvalidSlateException("Participant " + participant.id() + " has an invalid public excess or nonce");
            if (participant.messageSignature() == null)
                throw new InvalidSlateException("Participant " + participant.id() + " has no message signature");

            boolean signed = participant.partialSignature().isPresent();
            boolean mustBeSigned = state == SlateState.FINALIZED
                    || (state == SlateState.RECEIVED && participant.id() == Slate.RECEIVER_ID);
            if (signed != mustBeSigned)
                throw new InvalidSlateException(String.format("Participant %d partial signature is %s in state %s",
                        participant.id(), signed ? "unexpected" : "missing", state));
        }
    }

    private boolean isValidKey(PublicKey key) {
        return key != null && functions.isValidPublicKey(key.toBytes());
    }

    /**
     * Sender side of a structurally valid slate: its inputs and outputs must balance against amount plus fee with
     * the published sender excess, and the sender must prove knowledge of that excess.
     */
    public boolean isSenderConsistent(Slate slate) {
        ParticipantData sender = slate.participant(Slate.SENDER_ID).orElse(null);
        if (sender == null)
            return false;

        SlateTransaction tx = slate.transaction();
        if (!functions.isBalanced(tx.outputs(), tx.inputs(), slate.amount() + slate.fee(), sender.publicBlindExcess(), tx.offset())) {
            log.warn("Slate {} commitments are inconsistent with amount {} and fee {}", slate.id(), slate.amount(), slate.fee());
            return false;
        }
        if (!hasValidMessageSignature(slate.id(), sender)) {
            log.warn("Slate {} sender message signature is invalid", slate.id());
            return false;
        }
        return true;
    }

    public boolean hasValidMessageSignature(UUID slateId, ParticipantData participant) {
        return functions.verify(participant.messageSignature(), participant.publicBlindExcess(),
                messageDigest(slateId, participant.id(), participant.message()));
    }
}
