package io.vellum.storage;

public class InMemoryWalletStorageTest extends WalletStorageContract {

    @Override
    protected WalletStorage storage() {
        return new InMemoryWalletStorage();
    }
}
