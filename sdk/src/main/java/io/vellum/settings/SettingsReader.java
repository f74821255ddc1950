package io.vellum.settings;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.vellum.settings.WalletSettings.LogInfo;
import io.vellum.settings.WalletSettings.StorageType;

import java.io.File;
import java.util.Locale;
import java.util.Optional;

public class SettingsReader {
    public static final String CONFIG_PATH = "vellum.wallet";

    private final WalletSettings walletSettings;
    private final Config config;

    public SettingsReader(Optional<String> userConfigPath) {
        this.config = readConfigFromPath(userConfigPath);
        this.walletSettings = fromConfig(this.config);
        // init log4j logging system as soon as possible after having read the settings
        LogInitializer.initLogManager(this.walletSettings);
    }

    public WalletSettings getWalletSettings() {
        return this.walletSettings;
    }

    public Config getConfig() {
        return this.config;
    }

    // User file first, then application.conf and reference.conf from the classpath.
    public static Config readConfigFromPath(Optional<String> userConfigPath) {
        Config defaults = ConfigFactory.load();
        if (userConfigPath.isEmpty())
            return defaults;

        File file = new File(userConfigPath.get());
        if (!file.exists())
            throw new IllegalArgumentException("Config file " + file.getAbsolutePath() + " doesn't exist");
        return ConfigFactory.parseFile(file).withFallback(defaults).resolve();
    }

    public static WalletSettings fromConfig(Config root) {
        Config config = root.getConfig(CONFIG_PATH);
        Config scrypt = config.getConfig("scrypt");
        Config storage = config.getConfig("storage");
        Config log = config.getConfig("log");

        StorageType storageType;
        try {
            storageType = StorageType.valueOf(storage.getString("type").toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown storage type " + storage.getString("type"), e);
        }

        return new WalletSettings(
                scrypt.getInt("N"),
                scrypt.getInt("r"),
                scrypt.getInt("p"),
                config.getInt("minimumConfirmations"),
                config.getInt("coinbaseMaturity"),
                config.getDuration("lockExpiry"),
                storageType,
                storage.getString("directory"),
                new LogInfo(log.getString("dir"), log.getString("fileName"), log.getString("fileLevel"), log.getString("consoleLevel")));
    }
}
