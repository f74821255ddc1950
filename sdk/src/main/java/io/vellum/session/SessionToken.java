package io.vellum.session;

import com.google.common.io.BaseEncoding;

import java.security.SecureRandom;
import java.util.Objects;

/**
 * Capability handle of a logged in session: 32 random bytes, URL-safe base64. Carries no information about
 * the user it belongs to.
 */
public final class SessionToken {
    public static final int TOKEN_LENGTH = 32;
    private static final BaseEncoding ENCODING = BaseEncoding.base64Url().omitPadding();

    private final String value;

    private SessionToken(String value) {
        this.value = value;
    }

    public static SessionToken generate(SecureRandom random) {
        byte[] bytes = new byte[TOKEN_LENGTH];
        random.nextBytes(bytes);
        return new SessionToken(ENCODING.encode(bytes));
    }

    public static SessionToken fromString(String value) {
        Objects.requireNonNull(value, "value must be defined");
        byte[] bytes;
        try {
            bytes = ENCODING.decode(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Session token is not url-safe base64", e);
        }
        if (bytes.length != TOKEN_LENGTH)
            throw new IllegalArgumentException(String.format("Incorrect session token length, %d expected, %d found", TOKEN_LENGTH, bytes.length));
        return new SessionToken(value);
    }

    public String value() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return value.equals(((SessionToken) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "SessionToken{" + value.substring(0, 4) + "...}";
    }
}
