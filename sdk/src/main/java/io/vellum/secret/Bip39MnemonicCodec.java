package io.vellum.secret;

import io.vellum.secret.exception.CryptoException;
import org.web3j.crypto.MnemonicUtils;

/**
 * BIP-39 English word list encoding of the seed entropy. The entropy itself is the wallet seed, the
 * words are never stretched with a BIP-39 passphrase.
 */
public class Bip39MnemonicCodec implements MnemonicCodec {

    @Override
    public String createMnemonic(byte[] entropy) {
        try {
            return MnemonicUtils.generateMnemonic(entropy);
        } catch (IllegalArgumentException e) {
            throw new CryptoException("Mnemonic could not be generated", e);
        }
    }

    @Override
    public byte[] toEntropy(String mnemonic) {
        if (!MnemonicUtils.validateMnemonic(mnemonic))
            throw new IllegalArgumentException("Mnemonic is not a valid BIP-39 phrase");
        return MnemonicUtils.generateEntropy(mnemonic);
    }
}
