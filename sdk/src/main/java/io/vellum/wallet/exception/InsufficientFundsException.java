package io.vellum.wallet.exception;

public class InsufficientFundsException extends Exception {
    private final long needed;
    private final long available;

    public InsufficientFundsException(long needed, long available) {
        super(String.format("Not enough funds in the wallet: %d needed, %d spendable.", needed, available));
        this.needed = needed;
        this.available = available;
    }

    public long getNeeded() {
        return needed;
    }

    public long getAvailable() {
        return available;
    }
}
