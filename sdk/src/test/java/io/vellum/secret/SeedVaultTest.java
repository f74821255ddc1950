package io.vellum.secret;

import io.vellum.secret.exception.AuthenticationException;
import io.vellum.secret.exception.CryptoException;
import io.vellum.serialization.ApplicationJsonSerializer;
import org.junit.Test;

import java.security.SecureRandom;

import static org.junit.Assert.*;

public class SeedVaultTest {
    private final SeedVault vault = new SeedVault(1024, 8, 1);

    @Test
    public void encryptDecryptRoundTrip() throws Exception {
        WalletSeed seed = WalletSeed.generate(new SecureRandom());
        EncryptedSeed encrypted = vault.encryptWalletSeed(seed, "correct horse");

        try (WalletSeed decrypted = vault.decryptWalletSeed(encrypted, "correct horse")) {
            assertEquals("Decrypted seed must equal the original one.", seed, decrypted);
        }
        assertEquals("Salt length is wrong.", SeedVault.SALT_LENGTH, encrypted.salt().length);
        assertEquals("Nonce length is wrong.", SeedVault.NONCE_LENGTH, encrypted.nonce().length);
        assertEquals("KDF parameters must be stored.", 1024, encrypted.scryptN());
    }

    @Test
    public void wrongPassphraseFails() {
        WalletSeed seed = WalletSeed.generate(new SecureRandom());
        EncryptedSeed encrypted = vault.encryptWalletSeed(seed, "correct horse");

        AuthenticationException e = assertThrows(AuthenticationException.class,
                () -> vault.decryptWalletSeed(encrypted, "battery staple"));
        assertEquals("Wallet seed could not be decrypted", e.getMessage());
    }

    @Test
    public void corruptedCiphertextFailsLikeWrongPassphrase() {
        EncryptedSeed encrypted = vault.encryptWalletSeed(WalletSeed.generate(new SecureRandom()), "pass");
        byte[] cipherText = encrypted.encryptedSeedBytes();
        cipherText[0] ^= 0x01;
        EncryptedSeed corrupted = new EncryptedSeed(encrypted.version(), encrypted.salt(), encrypted.nonce(), cipherText,
                encrypted.scryptN(), encrypted.scryptR(), encrypted.scryptP());

        AuthenticationException e = assertThrows(AuthenticationException.class, () -> vault.decryptWalletSeed(corrupted, "pass"));
        assertEquals("Wallet seed could not be decrypted", e.getMessage());
    }

    @Test
    public void freshSaltAndNonceForEveryEncryption() {
        WalletSeed seed = WalletSeed.generate(new SecureRandom());
        EncryptedSeed first = vault.encryptWalletSeed(seed, "pass");
        EncryptedSeed second = vault.encryptWalletSeed(seed, "pass");

        assertFalse("Salt must not be reused.", java.util.Arrays.equals(first.salt(), second.salt()));
        assertFalse("Nonce must not be reused.", java.util.Arrays.equals(first.nonce(), second.nonce()));
        assertNotEquals("Ciphertexts must differ.", first, second);
    }

    @Test
    public void unsupportedVersionIsRejected() {
        EncryptedSeed encrypted = vault.encryptWalletSeed(WalletSeed.generate(new SecureRandom()), "pass");
        EncryptedSeed future = new EncryptedSeed(2, encrypted.salt(), encrypted.nonce(), encrypted.encryptedSeedBytes(),
                encrypted.scryptN(), encrypted.scryptR(), encrypted.scryptP());

        assertThrows(CryptoException.class, () -> vault.decryptWalletSeed(future, "pass"));
    }

    @Test
    public void encryptedSeedSurvivesJson() throws Exception {
        WalletSeed seed = WalletSeed.generate(new SecureRandom());
        EncryptedSeed encrypted = vault.encryptWalletSeed(seed, "pass");
        ApplicationJsonSerializer serializer = ApplicationJsonSerializer.getInstance();

        String json = serializer.serialize(encrypted);
        EncryptedSeed restored = serializer.deserialize(json, EncryptedSeed.class);

        assertEquals("Encrypted seed must survive json.", encrypted, restored);
        try (WalletSeed decrypted = vault.decryptWalletSeed(restored, "pass")) {
            assertEquals(seed, decrypted);
        }
    }

    @Test
    public void invalidKdfParametersAreRejected() {
        boolean exceptionOccurred = false;
        try {
            new SeedVault(1000, 8, 1);
        }
        catch (IllegalArgumentException e) {
            exceptionOccurred = true;
        }
        assertTrue("N must be a power of two.", exceptionOccurred);
    }

    @Test
    public void wipedSeedCantBeRead() {
        WalletSeed seed = WalletSeed.generate(new SecureRandom());
        seed.close();

        assertTrue(seed.isWiped());
        assertThrows(IllegalStateException.class, seed::bytes);
        assertEquals("Seed must never be printed.", "WalletSeed{***}", seed.toString());
    }
}
