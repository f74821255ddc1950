package io.vellum.secret;

public interface MnemonicCodec {

    // Human-readable backup of the seed entropy, shown once at wallet creation.
    String createMnemonic(byte[] entropy);

    byte[] toEntropy(String mnemonic);
}
