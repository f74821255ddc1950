package io.vellum.slate;

import io.vellum.crypto.Commitment;
import io.vellum.crypto.PublicKey;
import io.vellum.crypto.Signature;
import io.vellum.fixtures.FailingWalletStorage;
import io.vellum.fixtures.WalletFixtureClass;
import io.vellum.node.NodeClient;
import io.vellum.output.OutputData;
import io.vellum.output.OutputStatus;
import io.vellum.secret.WalletSeed;
import io.vellum.slate.exception.InvalidSlateException;
import io.vellum.storage.InMemoryWalletStorage;
import io.vellum.storage.exception.StorageException;
import io.vellum.transaction.Transaction;
import io.vellum.wallet.SelectionStrategy;
import io.vellum.wallet.SendStatus;
import io.vellum.wallet.Wallet;
import io.vellum.wallet.WalletSummary;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class SlateBuilderTest extends WalletFixtureClass {
    private SlateBuilder builder;
    private Wallet alice;
    private Wallet bob;
    private WalletSeed aliceSeed;
    private WalletSeed bobSeed;
    private FailingWalletStorage storage;

    @Before
    public void setUp() {
        NodeClient node = mock(NodeClient.class);
        when(node.getChainHeight()).thenReturn(CHAIN_HEIGHT);
        builder = new SlateBuilder(functions, node, MIN_CONFIRMATIONS);

        storage = new FailingWalletStorage();
        alice = getWallet("alice", storage, Duration.ofHours(1));
        bob = getWallet("bob", storage, Duration.ofHours(1));
        aliceSeed = getSeed(1);
        bobSeed = getSeed(2);

        fund(alice, aliceSeed, 10);
        fund(alice, aliceSeed, 20);
        fund(alice, aliceSeed, 30);
    }

    private Slate send(long amount) throws Exception {
        return builder.buildSendSlate(alice, aliceSeed, amount, 1, "for the coffee", SelectionStrategy.LEAST_LEFTOVER);
    }

    @Test
    public void receiverCanRetryAfterFailedWrite() throws Exception {
        Slate slate = send(15);

        storage.failNextReceivedOutput();
        assertThrows(StorageException.class, () -> builder.addReceiverData(bob, bobSeed, slate, "thanks"));
        assertEquals(SlateState.CREATED, slate.state());
        assertEquals(0, bob.summary(bobSeed, CHAIN_HEIGHT, MIN_CONFIRMATIONS).total());

        assertTrue("Same slate is accepted again.", builder.addReceiverData(bob, bobSeed, slate, "thanks"));
        builder.finalize(alice, aliceSeed, slate);
        assertEquals(15, bob.summary(bobSeed, CHAIN_HEIGHT, MIN_CONFIRMATIONS).total());
    }

    @Test
    public void sendReceiveFinalizeRoundTrip() throws Exception {
        Slate slate = send(15);
        assertEquals(SlateState.CREATED, slate.state());
        assertEquals(15, slate.amount());
        assertEquals(1, slate.fee());
        assertEquals(CHAIN_HEIGHT, slate.height());
        assertEquals("Only the 20 coin is needed.", 1, slate.transaction().inputs().size());
        assertEquals("Change output only.", 1, slate.transaction().outputs().size());

        assertTrue(builder.addReceiverData(bob, bobSeed, slate, "thanks"));
        assertEquals(SlateState.RECEIVED, slate.state());
        assertEquals(2, slate.transaction().outputs().size());

        Transaction transaction = builder.finalize(alice, aliceSeed, slate);
        assertEquals(SlateState.FINALIZED, slate.state());
        assertTrue(slate.participant(Slate.SENDER_ID).get().partialSignature().isPresent());

        transaction.semanticValidity(functions);
        assertEquals(1, transaction.fee());
        assertTrue("Kernel must balance inputs against outputs and fee.",
                functions.isBalanced(transaction.outputs(), transaction.inputs(), transaction.fee(),
                        transaction.kernel().excess(), transaction.offset()));

        WalletSummary aliceSummary = alice.summary(aliceSeed, CHAIN_HEIGHT, MIN_CONFIRMATIONS);
        assertEquals("10 and 30 remain, the 20 is spent.", 40, aliceSummary.spendable());
        assertEquals("Change of 4 waits for confirmation.", 4, aliceSummary.awaitingConfirmation());
        assertEquals(0, aliceSummary.locked());

        WalletSummary bobSummary = bob.summary(bobSeed, CHAIN_HEIGHT, MIN_CONFIRMATIONS);
        assertEquals(15, bobSummary.awaitingConfirmation());
        assertEquals(15, bobSummary.total());
    }

    @Test
    public void finalizeIsIdempotent() throws Exception {
        Slate slate = send(15);
        assertTrue(builder.addReceiverData(bob, bobSeed, slate, null));
        Slate received = slate.copy();

        Transaction first = builder.finalize(alice, aliceSeed, slate);
        Transaction second = builder.finalize(alice, aliceSeed, received);
        Transaction third = builder.finalize(alice, aliceSeed, slate);

        assertEquals("Replayed finalize must return the same transaction.", first, second);
        assertEquals(first, third);
        assertEquals(first.id(), second.id());
    }

    @Test
    public void differentReceiverContributionAfterFinalizeIsRejected() throws Exception {
        Slate slate = send(15);
        Slate forCarol = slate.copy();
        assertTrue(builder.addReceiverData(bob, bobSeed, slate, null));
        builder.finalize(alice, aliceSeed, slate);

        Wallet carol = getWallet("carol", new InMemoryWalletStorage(), Duration.ofHours(1));
        assertTrue(builder.addReceiverData(carol, getSeed(3), forCarol, null));

        assertThrows(InvalidSlateException.class, () -> builder.finalize(alice, aliceSeed, forCarol));
    }

    @Test
    public void receiverRejectsSlatesNotInCreatedState() throws Exception {
        Slate slate = send(15);
        assertTrue(builder.addReceiverData(bob, bobSeed, slate, null));

        assertFalse("RECEIVED slate must be rejected.", builder.addReceiverData(bob, bobSeed, slate, null));
        Wallet carol = getWallet("carol", new InMemoryWalletStorage(), Duration.ofHours(1));
        assertFalse(builder.addReceiverData(carol, getSeed(3), slate, null));

        builder.finalize(alice, aliceSeed, slate);
        assertFalse("FINALIZED slate must be rejected.", builder.addReceiverData(carol, getSeed(3), slate, null));
    }

    @Test
    public void receiverRejectsReplayedSlate() throws Exception {
        Slate slate = send(15);
        Slate replay = slate.copy();

        assertTrue(builder.addReceiverData(bob, bobSeed, slate, null));
        assertFalse("Same CREATED slate twice must be rejected.", builder.addReceiverData(bob, bobSeed, replay, null));
        assertEquals("Rejected slate must stay untouched.", SlateState.CREATED, replay.state());
        assertEquals(15, bob.summary(bobSeed, CHAIN_HEIGHT, MIN_CONFIRMATIONS).total());
    }

    @Test
    public void receiverRejectsInconsistentAmount() throws Exception {
        Slate slate = send(15);
        Slate inflated = new Slate(slate.version(), slate.id(), slate.numParticipants(), 16, slate.fee(), slate.height(),
                slate.lockHeight(), slate.state(), slate.transaction(), slate.participantData());

        assertFalse(builder.addReceiverData(bob, bobSeed, inflated, null));
        assertEquals(SlateState.CREATED, inflated.state());
        assertEquals("No output may be created for a rejected slate.", 0, bob.summary(bobSeed, CHAIN_HEIGHT, MIN_CONFIRMATIONS).total());
        assertTrue("Rejection must not burn the slate id.", builder.addReceiverData(bob, bobSeed, slate, null));
    }

    @Test
    public void receiverRejectsForgedMessageSignature() throws Exception {
        Slate slate = send(15);
        ParticipantData sender = slate.participant(Slate.SENDER_ID).get();
        ParticipantData forged = new ParticipantData(sender.id(), sender.publicBlindExcess(), sender.publicNonce(), null,
                "pay somebody else", sender.messageSignature());
        Slate tampered = new Slate(slate.version(), slate.id(), slate.numParticipants(), slate.amount(), slate.fee(),
                slate.height(), slate.lockHeight(), slate.state(), slate.transaction(), List.of(forged));

        assertFalse(builder.addReceiverData(bob, bobSeed, tampered, null));
    }

    @Test
    public void malformedSlatesThrow() throws Exception {
        Slate slate = send(15);

        Slate wrongVersion = new Slate(2, slate.id(), slate.numParticipants(), slate.amount(), slate.fee(), slate.height(),
                slate.lockHeight(), slate.state(), slate.transaction(), slate.participantData());
        assertThrows(InvalidSlateException.class, () -> builder.addReceiverData(bob, bobSeed, wrongVersion, null));

        Slate threeParties = new Slate(slate.version(), slate.id(), 3, slate.amount(), slate.fee(), slate.height(),
                slate.lockHeight(), slate.state(), slate.transaction(), slate.participantData());
        assertThrows(InvalidSlateException.class, () -> builder.addReceiverData(bob, bobSeed, threeParties, null));

        Slate negativeFee = new Slate(slate.version(), slate.id(), slate.numParticipants(), slate.amount(), -1, slate.height(),
                slate.lockHeight(), slate.state(), slate.transaction(), slate.participantData());
        assertThrows(InvalidSlateException.class, () -> builder.addReceiverData(bob, bobSeed, negativeFee, null));

        Slate noParticipants = new Slate(slate.version(), slate.id(), slate.numParticipants(), slate.amount(), slate.fee(),
                slate.height(), slate.lockHeight(), slate.state(), slate.transaction(), null);
        assertThrows(InvalidSlateException.class, () -> builder.addReceiverData(bob, bobSeed, noParticipants, null));

        SlateTransaction noInputs = new SlateTransaction(slate.transaction().offset(), List.of(), slate.transaction().outputs());
        Slate withoutInputs = new Slate(slate.version(), slate.id(), slate.numParticipants(), slate.amount(), slate.fee(),
                slate.height(), slate.lockHeight(), slate.state(), noInputs, slate.participantData());
        assertThrows(InvalidSlateException.class, () -> builder.addReceiverData(bob, bobSeed, withoutInputs, null));

        assertThrows(InvalidSlateException.class, () -> builder.addReceiverData(bob, bobSeed, null, null));
    }

    @Test
    public void zeroAmountIsRejected() throws Exception {
        Slate slate = send(15);
        Slate zero = new Slate(slate.version(), slate.id(), slate.numParticipants(), 0, slate.fee(), slate.height(),
                slate.lockHeight(), slate.state(), slate.transaction(), slate.participantData());

        assertFalse(builder.addReceiverData(bob, bobSeed, zero, null));
    }

    @Test
    public void finalizeRejectsCreatedSlate() throws Exception {
        Slate slate = send(15);
        assertThrows(InvalidSlateException.class, () -> builder.finalize(alice, aliceSeed, slate));
    }

    @Test
    public void finalizeRejectsForeignSlate() throws Exception {
        Slate slate = send(15);
        assertTrue(builder.addReceiverData(bob, bobSeed, slate, null));

        InvalidSlateException e = assertThrows(InvalidSlateException.class, () -> builder.finalize(bob, bobSeed, slate));
        assertTrue(e.getMessage().contains("not sent by this wallet"));
    }

    @Test
    public void finalizeRejectsTamperedReceiverSignature() throws Exception {
        Slate slate = send(15);
        assertTrue(builder.addReceiverData(bob, bobSeed, slate, null));

        ParticipantData receiver = slate.participant(Slate.RECEIVER_ID).get();
        byte[] signature = receiver.partialSignature().get().toBytes();
        signature[Signature.LENGTH - 1] ^= 0x01;
        List<ParticipantData> participants = List.of(slate.participant(Slate.SENDER_ID).get(),
                receiver.withPartialSignature(new Signature(signature)));
        Slate tampered = new Slate(slate.version(), slate.id(), slate.numParticipants(), slate.amount(), slate.fee(),
                slate.height(), slate.lockHeight(), slate.state(), slate.transaction(), participants);

        assertThrows(InvalidSlateException.class, () -> builder.finalize(alice, aliceSeed, tampered));
        assertEquals("Wallet must stay unchanged.", SendStatus.PENDING, alice.sendContext(slate.id()).get().status());

        builder.finalize(alice, aliceSeed, slate).semanticValidity(functions);
    }

    @Test
    public void finalizeRejectsAlteredSenderData() throws Exception {
        Slate slate = send(15);
        assertTrue(builder.addReceiverData(bob, bobSeed, slate, null));

        // receiver output replaced by one of higher value: balance no longer holds
        List<Commitment> outputs = new ArrayList<>(slate.transaction().outputs());
        outputs.set(1, functions.commit(1000, functions.generateSecretKey()));
        Slate inflated = new Slate(slate.version(), slate.id(), slate.numParticipants(), slate.amount(), slate.fee(),
                slate.height(), slate.lockHeight(), slate.state(),
                new SlateTransaction(slate.transaction().offset(), slate.transaction().inputs(), outputs), slate.participantData());
        assertThrows(InvalidSlateException.class, () -> builder.finalize(alice, aliceSeed, inflated));

        Slate cheaper = new Slate(slate.version(), slate.id(), slate.numParticipants(), slate.amount(), 0,
                slate.height(), slate.lockHeight(), slate.state(), slate.transaction(), slate.participantData());
        assertThrows(InvalidSlateException.class, () -> builder.finalize(alice, aliceSeed, cheaper));

        ParticipantData sender = slate.participant(Slate.SENDER_ID).get();
        PublicKey otherNonce = functions.publicKey(functions.generateSecretKey());
        ParticipantData renonced = new ParticipantData(sender.id(), sender.publicBlindExcess(), otherNonce, null,
                sender.messageOrNull(), sender.messageSignature());
        Slate withOtherNonce = new Slate(slate.version(), slate.id(), slate.numParticipants(), slate.amount(), slate.fee(),
                slate.height(), slate.lockHeight(), slate.state(), slate.transaction(),
                List.of(renonced, slate.participant(Slate.RECEIVER_ID).get()));
        assertThrows(InvalidSlateException.class, () -> builder.finalize(alice, aliceSeed, withOtherNonce));

        assertEquals(SendStatus.PENDING, alice.sendContext(slate.id()).get().status());
    }

    @Test
    public void canceledSlateCantBeFinalized() throws Exception {
        Slate slate = send(15);
        assertTrue(builder.addReceiverData(bob, bobSeed, slate, null));

        assertTrue(builder.cancel(alice, slate.id()));
        assertThrows(InvalidSlateException.class, () -> builder.finalize(alice, aliceSeed, slate));
        assertEquals(60, alice.summary(aliceSeed, CHAIN_HEIGHT, MIN_CONFIRMATIONS).spendable());
    }

    @Test
    public void expiredSlateCantBeFinalized() throws Exception {
        Slate slate = send(15);
        assertTrue(builder.addReceiverData(bob, bobSeed, slate, null));

        clock.advance(Duration.ofHours(2));
        assertThrows(InvalidSlateException.class, () -> builder.finalize(alice, aliceSeed, slate));
        for (OutputData output : alice.outputs(alice.sendContext(slate.id()).get().inputKeyIds()))
            assertEquals(OutputStatus.UNSPENT, output.status());
    }

    @Test
    public void sendWithoutChange() throws Exception {
        // 30 coin, amount 29 and fee 1 leave nothing
        Slate slate = send(29);
        assertTrue(slate.transaction().outputs().isEmpty());
        assertNull(alice.sendContext(slate.id()).get().changeKeyIdOrNull());

        assertTrue(builder.addReceiverData(bob, bobSeed, slate, null));
        builder.finalize(alice, aliceSeed, slate).semanticValidity(functions);
    }
}
