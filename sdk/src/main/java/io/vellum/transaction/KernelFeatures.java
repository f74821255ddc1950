package io.vellum.transaction;

public enum KernelFeatures {
    PLAIN((byte) 0),
    COINBASE((byte) 1),
    HEIGHT_LOCKED((byte) 2);

    private final byte id;

    KernelFeatures(byte id) {
        this.id = id;
    }

    public byte id() {
        return id;
    }
}
