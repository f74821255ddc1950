package io.vellum.cryptolibprovider;

public final class CryptoLibProvider {
    public static final CommitmentFunctions commitmentFunctions = new Secp256k1CommitmentFunctions();

    private CryptoLibProvider() {
    }
}
