package io.vellum.secret;

import org.junit.Test;

import java.security.SecureRandom;
import java.util.Collections;

import static org.junit.Assert.*;

public class Bip39MnemonicCodecTest {
    private final MnemonicCodec codec = new Bip39MnemonicCodec();

    @Test
    public void mnemonicRestoresEntropy() {
        byte[] entropy = new byte[WalletSeed.SEED_LENGTH];
        new SecureRandom().nextBytes(entropy);

        String mnemonic = codec.createMnemonic(entropy);

        assertEquals("32 bytes of entropy give 24 words.", 24, mnemonic.split(" ").length);
        assertArrayEquals(entropy, codec.toEntropy(mnemonic));
    }

    @Test
    public void zeroEntropyGivesReferenceWords() {
        byte[] entropy = new byte[WalletSeed.SEED_LENGTH];
        String expected = String.join(" ", Collections.nCopies(23, "abandon")) + " art";
        assertEquals(expected, codec.createMnemonic(entropy));
    }

    @Test
    public void invalidMnemonicIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> codec.toEntropy("abandon abandon abandon"));
    }
}
