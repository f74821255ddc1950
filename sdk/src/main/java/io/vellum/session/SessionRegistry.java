package io.vellum.session;

import io.vellum.secret.EncryptedSeed;
import io.vellum.secret.SeedVault;
import io.vellum.secret.WalletSeed;
import io.vellum.secret.exception.AuthenticationException;
import io.vellum.session.exception.InvalidSessionException;
import io.vellum.storage.WalletStorage;
import io.vellum.wallet.Wallet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.security.SecureRandom;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Process-local binding of session tokens to decrypted seeds and wallets. Lookups run concurrently,
 * login and logout are serialized by the write lock.
 */
public class SessionRegistry {
    private static final Logger log = LogManager.getLogger(SessionRegistry.class);

    private final WalletStorage storage;
    private final SeedVault vault;
    private final Function<String, Wallet> walletProvider;
    private final SecureRandom random;
    // decrypted instead of a missing user's seed, so unknown users cost as much as wrong passphrases
    private final EncryptedSeed decoySeed;

    private final Map<SessionToken, Session> sessions = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public SessionRegistry(WalletStorage storage, SeedVault vault, Function<String, Wallet> walletProvider) {
        this(storage, vault, walletProvider, new SecureRandom());
    }

    public SessionRegistry(WalletStorage storage, SeedVault vault, Function<String, Wallet> walletProvider, SecureRandom random) {
        this.storage = Objects.requireNonNull(storage, "storage must be defined");
        this.vault = Objects.requireNonNull(vault, "vault must be defined");
        this.walletProvider = Objects.requireNonNull(walletProvider, "walletProvider must be defined");
        this.random = Objects.requireNonNull(random, "random must be defined");
        try (WalletSeed decoy = WalletSeed.generate(random)) {
            this.decoySeed = vault.encryptWalletSeed(decoy, SessionToken.generate(random).value());
        }
    }

    public SessionToken login(String username, String passphrase) throws AuthenticationException {
        Optional<EncryptedSeed> stored = storage.loadEncryptedSeed(username);
        WalletSeed seed = vault.decryptWalletSeed(stored.orElse(decoySeed), passphrase);
        if (stored.isEmpty()) {
            seed.close();
            throw new AuthenticationException("Wallet seed could not be decrypted");
        }
        return activate(username, seed);
    }

    // For a seed the caller already holds, e.g. right after wallet creation. The registry keeps its own copy.
    public SessionToken login(String username, WalletSeed seed) {
        return activate(username, seed.copy());
    }

    public void logout(SessionToken token) {
        Session session;
        lock.writeLock().lock();
        try {
            session = sessions.remove(token);
            if (session != null)
                session.seed.close();
        } finally {
            lock.writeLock().unlock();
        }
        if (session != null)
            log.info("User {} logged out", session.username);
    }

    public void logoutAll() {
        lock.writeLock().lock();
        try {
            for (Session session : sessions.values())
                session.seed.close();
            if (!sessions.isEmpty())
                log.info("{} sessions closed", sessions.size());
            sessions.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    // The caller owns the returned copy and must close it.
    public WalletSeed getSeed(SessionToken token) {
        return withSession(token, session -> session.seed.copy());
    }

    public Wallet getWallet(SessionToken token) {
        return withSession(token, session -> session.wallet);
    }

    public String getUsername(SessionToken token) {
        return withSession(token, session -> session.username);
    }

    public boolean isActive(SessionToken token) {
        lock.readLock().lock();
        try {
            return token != null && sessions.containsKey(token);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int activeSessions() {
        lock.readLock().lock();
        try {
            return sessions.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private SessionToken activate(String username, WalletSeed seed) {
        Wallet wallet = walletProvider.apply(username);
        SessionToken token = SessionToken.generate(random);
        lock.writeLock().lock();
        try {
            sessions.put(token, new Session(username, seed, wallet));
        } finally {
            lock.writeLock().unlock();
        }
        log.info("User {} logged in", username);
        return token;
    }

    private <T> T withSession(SessionToken token, Function<Session, T> reader) {
        lock.readLock().lock();
        try {
            Session session = token == null ? null : sessions.get(token);
            if (session == null)
                throw new InvalidSessionException("Session token is unknown or logged out");
            return reader.apply(session);
        } finally {
            lock.readLock().unlock();
        }
    }

    private static final class Session {
        private final String username;
        private final WalletSeed seed;
        private final Wallet wallet;

        private Session(String username, WalletSeed seed, Wallet wallet) {
            this.username = username;
            this.seed = seed;
            this.wallet = wallet;
        }
    }
}
