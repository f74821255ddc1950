package io.vellum.settings;

import java.time.Duration;
import java.util.Objects;

/**
 * Typed view of the {@code vellum.wallet} configuration section.
 */
public final class WalletSettings {
    public enum StorageType { MEMORY, FILE }

    private final int scryptN;
    private final int scryptR;
    private final int scryptP;
    private final int minimumConfirmations;
    private final int coinbaseMaturity;
    private final Duration lockExpiry;
    private final StorageType storageType;
    private final String storageDirectory;
    private final LogInfo logInfo;

    public WalletSettings(int scryptN, int scryptR, int scryptP, int minimumConfirmations, int coinbaseMaturity,
                          Duration lockExpiry, StorageType storageType, String storageDirectory, LogInfo logInfo) {
        this.scryptN = scryptN;
        this.scryptR = scryptR;
        this.scryptP = scryptP;
        this.minimumConfirmations = minimumConfirmations;
        this.coinbaseMaturity = coinbaseMaturity;
        this.lockExpiry = Objects.requireNonNull(lockExpiry, "lockExpiry must be defined");
        this.storageType = Objects.requireNonNull(storageType, "storageType must be defined");
        this.storageDirectory = Objects.requireNonNull(storageDirectory, "storageDirectory must be defined");
        this.logInfo = Objects.requireNonNull(logInfo, "logInfo must be defined");
        if (minimumConfirmations < 0 || coinbaseMaturity < 0)
            throw new IllegalArgumentException("Confirmation thresholds must be >= 0.");
        if (lockExpiry.isNegative())
            throw new IllegalArgumentException("Lock expiry must not be negative.");
    }

    public int getScryptN() {
        return scryptN;
    }

    public int getScryptR() {
        return scryptR;
    }

    public int getScryptP() {
        return scryptP;
    }

    public int getMinimumConfirmations() {
        return minimumConfirmations;
    }

    public int getCoinbaseMaturity() {
        return coinbaseMaturity;
    }

    public Duration getLockExpiry() {
        return lockExpiry;
    }

    public StorageType getStorageType() {
        return storageType;
    }

    public String getStorageDirectory() {
        return storageDirectory;
    }

    public LogInfo getLogInfo() {
        return logInfo;
    }

    public static final class LogInfo {
        private final String logDir;
        private final String logFileName;
        private final String logFileLevel;
        private final String logConsoleLevel;

        public LogInfo(String logDir, String logFileName, String logFileLevel, String logConsoleLevel) {
            this.logDir = logDir;
            this.logFileName = logFileName;
            this.logFileLevel = logFileLevel;
            this.logConsoleLevel = logConsoleLevel;
        }

        public String getLogDir() {
            return logDir;
        }

        public String getLogFileName() {
            return logFileName;
        }

        public String getLogFileLevel() {
            return logFileLevel;
        }

        public String getLogConsoleLevel() {
            return logConsoleLevel;
        }
    }
}
