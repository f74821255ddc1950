package io.vellum.output;

public enum OutputFeatures {
    PLAIN,
    COINBASE
}
