package io.vellum.slate;

import io.vellum.crypto.Commitment;
import io.vellum.crypto.PublicKey;
import io.vellum.crypto.Signature;
import io.vellum.cryptolibprovider.CommitmentFunctions;
import io.vellum.node.NodeClient;
import io.vellum.output.OutputData;
import io.vellum.secret.BlindingFactor;
import io.vellum.secret.KeyChain;
import io.vellum.secret.KeyId;
import io.vellum.secret.WalletSeed;
import io.vellum.slate.exception.InvalidSlateException;
import io.vellum.transaction.KernelFeatures;
import io.vellum.transaction.Transaction;
import io.vellum.transaction.TransactionKernel;
import io.vellum.transaction.exception.TransactionSemanticValidityException;
import io.vellum.utils.BytesUtils;
import io.vellum.wallet.SelectionStrategy;
import io.vellum.wallet.SendContext;
import io.vellum.wallet.SendStatus;
import io.vellum.wallet.Wallet;
import io.vellum.wallet.exception.InsufficientFundsException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs the three protocol steps: the sender builds a slate, the receiver adds its output and partial signature,
 * the sender aggregates both signatures into the final transaction.
 * <p>
 * The sender keeps no secrets between the steps. Its excess is recomputed from the blinding factors of the reserved
 * outputs and the stored kernel offset, its nonce from the seed and the slate id.
 */
public class SlateBuilder {
    private static final Logger log = LogManager.getLogger(SlateBuilder.class);

    private final CommitmentFunctions functions;
    private final SlateValidator validator;
    private final NodeClient nodeClient;
    private final int minimumConfirmations;

    public SlateBuilder(CommitmentFunctions functions, NodeClient nodeClient, int minimumConfirmations) {
        this.functions = Objects.requireNonNull(functions, "functions must be defined");
        this.nodeClient = Objects.requireNonNull(nodeClient, "nodeClient must be defined");
        this.validator = new SlateValidator(functions);
        if (minimumConfirmations < 0)
            throw new IllegalArgumentException("Minimum confirmations must be >= 0.");
        this.minimumConfirmations = minimumConfirmations;
    }

    public SlateValidator getValidator() {
        return validator;
    }

    public Slate buildSendSlate(Wallet wallet, WalletSeed seed, long amount, long feeBase, String message,
                                SelectionStrategy strategy) throws InsufficientFundsException {
        UUID slateId = UUID.randomUUID();
        byte[] offset = functions.generateSecretKey();
        long height = nodeClient.getChainHeight();

        try (KeyChain keys = KeyChain.fromSeed(seed, functions)) {
            SendContext context = wallet.reserveCoins(keys, slateId, offset, amount, feeBase, strategy, height, minimumConfirmations);

            List<Commitment> inputs = commitments(wallet.outputs(context.inputKeyIds()));
            List<Commitment> outputs = new ArrayList<>();
            context.changeKeyId().ifPresent(keyId -> outputs.add(wallet.outputs(List.of(keyId)).get(0).commitment()));

            byte[] excess = senderExcess(keys, wallet, context);
            byte[] nonce = keys.deriveNonce(slateId);
            try {
                ParticipantData sender = new ParticipantData(Slate.SENDER_ID,
                        functions.publicKey(excess),
                        functions.publicKey(nonce),
                        null,
                        message,
                        functions.sign(excess, SlateValidator.messageDigest(slateId, Slate.SENDER_ID, Optional.ofNullable(message))));

                Slate slate = new Slate(Slate.CURRENT_VERSION, slateId, Slate.NUM_PARTICIPANTS, amount, context.fee(),
                        height, 0, SlateState.CREATED, new SlateTransaction(offset, inputs, outputs), List.of(sender));
                log.info("Slate {} created by wallet {}: amount {}, fee {}", slateId, wallet.getUsername(), amount, context.fee());
                return slate;
            } finally {
                BytesUtils.wipe(excess);
                BytesUtils.wipe(nonce);
            }
        }
    }

    /**
     * Receiver step. Returns false, leaving wallet and slate untouched, if the slate must not be answered:
     * wrong state, zero amount, a replayed slate id or sender nonce, or sender data that doesn't add up.
     */
    public boolean addReceiverData(Wallet wallet, WalletSeed seed, Slate slate, String message) throws InvalidSlateException {
        validator.validateStructure(slate);
        UUID slateId = slate.id();

        if (slate.state() != SlateState.CREATED) {
            log.warn("Slate {} rejected by wallet {}: state {}, CREATED expected", slateId, wallet.getUsername(), slate.state());
            return false;
        }
        if (slate.amount() == 0) {
            log.warn("Slate {} rejected by wallet {}: zero amount", slateId, wallet.getUsername());
            return false;
        }
        if (!validator.isSenderConsistent(slate))
            return false;

        ParticipantData sender = slate.participant(Slate.SENDER_ID).get();
        try (KeyChain keys = KeyChain.fromSeed(seed, functions)) {
            Optional<OutputData> received = wallet.receiveOutput(keys, slateId, sender.publicNonce(), slate.amount());
            if (received.isEmpty()) {
                log.warn("Slate {} rejected by wallet {}: slate or nonce seen before", slateId, wallet.getUsername());
                return false;
            }
            OutputData output = received.get();

            byte[] excess;
            try (BlindingFactor blind = keys.deriveBlindingFactor(output.keyId())) {
                excess = blind.bytes();
            }
            // Fresh random nonce: the receiver never signs for this slate again.
            byte[] nonce = functions.generateSecretKey();
            try {
                PublicKey publicExcess = functions.publicKey(excess);
                PublicKey publicNonce = functions.publicKey(nonce);
                PublicKey aggregateExcess = functions.sumPublicKeys(List.of(sender.publicBlindExcess(), publicExcess));
                PublicKey aggregateNonce = functions.sumPublicKeys(List.of(sender.publicNonce(), publicNonce));

                Signature partial = functions.signPartial(excess, nonce, aggregateNonce, aggregateExcess, kernelMessage(slate));
                ParticipantData receiver = new ParticipantData(Slate.RECEIVER_ID, publicExcess, publicNonce, partial, message,
                        functions.sign(excess, SlateValidator.messageDigest(slateId, Slate.RECEIVER_ID, Optional.ofNullable(message))));

                List<ParticipantData> participants = new ArrayList<>(slate.participantData());
                participants.add(receiver);
                slate.update(SlateState.RECEIVED, slate.transaction().withOutput(output.commitment()), participants);
                log.info("Slate {} received by wallet {}: amount {}", slateId, wallet.getUsername(), slate.amount());
                return true;
            } finally {
                BytesUtils.wipe(excess);
                BytesUtils.wipe(nonce);
            }
        }
    }

    /**
     * Sender step closing the protocol. Finalizing the same slate again returns the stored transaction.
     */
    public Transaction finalize(Wallet wallet, WalletSeed seed, Slate slate) throws InvalidSlateException {
        validator.validateStructure(slate);
        UUID slateId = slate.id();
        if (slate.state() == SlateState.CREATED)
            throw new InvalidSlateException(String.format("Slate %s is in state %s, RECEIVED expected", slateId, slate.state()));

        wallet.releaseExpiredLocks();
        SendContext context = wallet.sendContext(slateId)
                .orElseThrow(() -> new InvalidSlateException("Slate " + slateId + " was not sent by this wallet"));
        if (context.status() == SendStatus.CANCELED)
            throw new InvalidSlateException("Slate " + slateId + " was canceled");
        if (slate.state() == SlateState.FINALIZED && context.status() != SendStatus.FINALIZED)
            throw new InvalidSlateException("Slate " + slateId + " claims to be finalized but was never finalized by this wallet");

        ParticipantData sender = slate.participant(Slate.SENDER_ID).get();
        ParticipantData receiver = slate.participant(Slate.RECEIVER_ID).get();
        SlateTransaction body = slate.transaction();

        try (KeyChain keys = KeyChain.fromSeed(seed, functions)) {
            byte[] excess = senderExcess(keys, wallet, context);
            byte[] nonce = keys.deriveNonce(slateId);
            try {
                checkSenderData(wallet, context, slate, sender, functions.publicKey(excess), functions.publicKey(nonce));

                if (!validator.hasValidMessageSignature(slateId, receiver))
                    throw new InvalidSlateException("Slate " + slateId + " receiver message signature is invalid");
                PublicKey aggregateExcess = functions.sumPublicKeys(List.of(sender.publicBlindExcess(), receiver.publicBlindExcess()));
                PublicKey aggregateNonce = functions.sumPublicKeys(List.of(sender.publicNonce(), receiver.publicNonce()));
                byte[] kernelMessage = kernelMessage(slate);

                Signature receiverPartial = receiver.partialSignature().get();
                if (!Arrays.equals(Arrays.copyOf(receiverPartial.toBytes(), PublicKey.LENGTH), aggregateNonce.toBytes())
                        || !functions.verifyPartial(receiverPartial, receiver.publicNonce(), receiver.publicBlindExcess(), aggregateExcess, kernelMessage))
                    throw new InvalidSlateException("Slate " + slateId + " receiver partial signature is invalid");

                if (context.status() == SendStatus.FINALIZED)
                    return sameFinalization(context, slate, aggregateExcess, aggregateNonce);

                Signature senderPartial = functions.signPartial(excess, nonce, aggregateNonce, aggregateExcess, kernelMessage);
                Signature signature = functions.aggregateSignatures(List.of(senderPartial, receiverPartial), aggregateNonce);
                TransactionKernel kernel = new TransactionKernel(kernelFeatures(slate), slate.fee(), slate.lockHeight(), aggregateExcess, signature);
                Transaction transaction = new Transaction(body.offset(), body.inputs(), body.outputs(), kernel);

                try {
                    transaction.semanticValidity(functions);
                } catch (TransactionSemanticValidityException e) {
                    throw new InvalidSlateException("Slate " + slateId + " doesn't produce a valid transaction: " + e.getMessage(), e);
                }

                Transaction stored = wallet.completeSend(slateId, transaction)
                        .orElseThrow(() -> new InvalidSlateException("Slate " + slateId + " was canceled before finalization"));
                if (!stored.equals(transaction))
                    throw new InvalidSlateException("Slate " + slateId + " was already finalized with a different transaction");

                List<ParticipantData> participants = List.of(sender.withPartialSignature(senderPartial), receiver);
                slate.update(SlateState.FINALIZED, body, participants);
                return transaction;
            } finally {
                BytesUtils.wipe(excess);
                BytesUtils.wipe(nonce);
            }
        }
    }

    public boolean cancel(Wallet wallet, UUID slateId) {
        return wallet.cancel(slateId);
    }

    // x_s = r_change - sum(r_inputs) - offset
    private byte[] senderExcess(KeyChain keys, Wallet wallet, SendContext context) {
        List<byte[]> positive = new ArrayList<>();
        List<byte[]> negative = new ArrayList<>();
        try {
            context.changeKeyId().ifPresent(keyId -> positive.add(blindingBytes(keys, keyId)));
            for (KeyId keyId : context.inputKeyIds())
                negative.add(blindingBytes(keys, keyId));
            negative.add(context.offset());
            return functions.sumSecretKeys(positive, negative);
        } finally {
            positive.forEach(BytesUtils::wipe);
            negative.forEach(BytesUtils::wipe);
        }
    }

    private static byte[] blindingBytes(KeyChain keys, KeyId keyId) {
        try (BlindingFactor blind = keys.deriveBlindingFactor(keyId)) {
            return blind.bytes();
        }
    }

    private void checkSenderData(Wallet wallet, SendContext context, Slate slate, ParticipantData sender,
                                 PublicKey expectedExcess, PublicKey expectedNonce) throws InvalidSlateException {
        UUID slateId = slate.id();
        if (!sender.publicBlindExcess().equals(expectedExcess) || !sender.publicNonce().equals(expectedNonce))
            throw new InvalidSlateException("Slate " + slateId + " sender excess or nonce was altered");
        if (!validator.hasValidMessageSignature(slateId, sender))
            throw new InvalidSlateException("Slate " + slateId + " sender message signature was altered");
        if (slate.amount() != context.amount() || slate.fee() != context.fee() || slate.lockHeight() != 0)
            throw new InvalidSlateException("Slate " + slateId + " amount, fee or lock height was altered");

        SlateTransaction body = slate.transaction();
        if (!Arrays.equals(body.offset(), context.offset()))
            throw new InvalidSlateException("Slate " + slateId + " kernel offset was altered");
        List<Commitment> expectedInputs = commitments(wallet.outputs(context.inputKeyIds()));
        if (!new HashSet<>(body.inputs()).equals(new HashSet<>(expectedInputs)) || body.inputs().size() != expectedInputs.size())
            throw new InvalidSlateException("Slate " + slateId + " inputs were altered");

        int expectedOutputs = context.changeKeyId().isPresent() ? 2 : 1;
        if (body.outputs().size() != expectedOutputs)
            throw new InvalidSlateException(String.format("Slate %s has %d outputs, %d expected", slateId, body.outputs().size(), expectedOutputs));
        if (context.changeKeyId().isPresent()) {
            Commitment change = wallet.outputs(List.of(context.changeKeyId().get())).get(0).commitment();
            if (!body.outputs().contains(change))
                throw new InvalidSlateException("Slate " + slateId + " change output was removed");
        }
    }

    // The sender nonce must never sign under a second challenge, so only the identical finalization is repeated.
    private Transaction sameFinalization(SendContext context, Slate slate, PublicKey aggregateExcess, PublicKey aggregateNonce)
            throws InvalidSlateException {
        Transaction stored = context.transaction()
                .orElseThrow(() -> new IllegalStateException("Finalized send context without transaction"));
        TransactionKernel kernel = stored.kernel();
        boolean same = kernel.excess().equals(aggregateExcess)
                && Arrays.equals(Arrays.copyOf(kernel.excessSignature().toBytes(), PublicKey.LENGTH), aggregateNonce.toBytes())
                && new HashSet<>(stored.outputs()).equals(new HashSet<>(slate.transaction().outputs()));
        if (!same)
            throw new InvalidSlateException("Slate " + slate.id() + " was already finalized with a different receiver contribution");
        log.info("Slate {} finalized again, returning transaction {}", slate.id(), stored.id());
        return stored;
    }

    private static KernelFeatures kernelFeatures(Slate slate) {
        return slate.lockHeight() > 0 ? KernelFeatures.HEIGHT_LOCKED : KernelFeatures.PLAIN;
    }

    private static byte[] kernelMessage(Slate slate) {
        return TransactionKernel.signatureMessage(kernelFeatures(slate), slate.fee(), slate.lockHeight());
    }

    private static List<Commitment> commitments(List<OutputData> outputs) {
        List<Commitment> result = new ArrayList<>();
        for (OutputData output : outputs)
            result.add(output.commitment());
        return result;
    }
}
