package io.vellum.secret;

import io.vellum.secret.exception.AuthenticationException;
import io.vellum.secret.exception.CryptoException;
import io.vellum.utils.BytesUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.bouncycastle.crypto.generators.SCrypt;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;

/**
 * Encrypts and decrypts the wallet seed under a passphrase: scrypt key derivation with a fresh salt,
 * AES-256-GCM with a fresh nonce. Stateless apart from the KDF cost parameters.
 */
public class SeedVault {
    private static final Logger log = LogManager.getLogger(SeedVault.class);

    public static final int SALT_LENGTH = 16;
    public static final int NONCE_LENGTH = 12;
    private static final int KEY_LENGTH = 32;
    private static final int TAG_LENGTH_BITS = 128;
    private static final String CIPHER = "AES/GCM/NoPadding";
    private static final byte[] ASSOCIATED_DATA = ("vellum-seed-v" + EncryptedSeed.CURRENT_VERSION).getBytes(StandardCharsets.UTF_8);

    private final int scryptN;
    private final int scryptR;
    private final int scryptP;
    private final SecureRandom random;

    public SeedVault(int scryptN, int scryptR, int scryptP) {
        this(scryptN, scryptR, scryptP, new SecureRandom());
    }

    public SeedVault(int scryptN, int scryptR, int scryptP, SecureRandom random) {
        if (scryptN < 2 || (scryptN & (scryptN - 1)) != 0)
            throw new IllegalArgumentException("scrypt N must be a power of 2 greater than 1");
        if (scryptR < 1 || scryptP < 1)
            throw new IllegalArgumentException("scrypt r and p must be positive");
        this.scryptN = scryptN;
        this.scryptR = scryptR;
        this.scryptP = scryptP;
        this.random = random;
    }

    public EncryptedSeed encryptWalletSeed(WalletSeed seed, String passphrase) {
        byte[] salt = new byte[SALT_LENGTH];
        byte[] nonce = new byte[NONCE_LENGTH];
        random.nextBytes(salt);
        random.nextBytes(nonce);

        byte[] key = deriveKey(passphrase, salt, scryptN, scryptR, scryptP);
        byte[] plain = seed.bytes();
        try {
            Cipher cipher = Cipher.getInstance(CIPHER);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_LENGTH_BITS, nonce));
            cipher.updateAAD(ASSOCIATED_DATA);
            byte[] encrypted = cipher.doFinal(plain);
            log.debug("Wallet seed encrypted, scrypt parameters N={} r={} p={}", scryptN, scryptR, scryptP);
            return new EncryptedSeed(EncryptedSeed.CURRENT_VERSION, salt, nonce, encrypted, scryptN, scryptR, scryptP);
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Wallet seed encryption failed", e);
        } finally {
            BytesUtils.wipe(key);
            BytesUtils.wipe(plain);
        }
    }

    // Wrong passphrase and corrupted ciphertext both end up as the same AuthenticationException.
    public WalletSeed decryptWalletSeed(EncryptedSeed encryptedSeed, String passphrase) throws AuthenticationException {
        if (encryptedSeed.version() != EncryptedSeed.CURRENT_VERSION)
            throw new CryptoException("Unsupported encrypted seed version " + encryptedSeed.version());

        byte[] key = deriveKey(passphrase, encryptedSeed.salt(), encryptedSeed.scryptN(), encryptedSeed.scryptR(), encryptedSeed.scryptP());
        byte[] plain = null;
        try {
            Cipher cipher = Cipher.getInstance(CIPHER);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_LENGTH_BITS, encryptedSeed.nonce()));
            cipher.updateAAD(ASSOCIATED_DATA);
            plain = cipher.doFinal(encryptedSeed.encryptedSeedBytes());
            return new WalletSeed(plain);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new AuthenticationException("Wallet seed could not be decrypted");
        } finally {
            BytesUtils.wipe(key);
            BytesUtils.wipe(plain);
        }
    }

    private static byte[] deriveKey(String passphrase, byte[] salt, int n, int r, int p) {
        if (passphrase == null)
            throw new IllegalArgumentException("Passphrase must be defined");
        byte[] passphraseBytes = passphrase.getBytes(StandardCharsets.UTF_8);
        try {
            return SCrypt.generate(passphraseBytes, salt, n, r, p, KEY_LENGTH);
        } catch (RuntimeException e) {
            throw new CryptoException("Key derivation failed", e);
        } finally {
            BytesUtils.wipe(passphraseBytes);
        }
    }
}
