package io.vellum.settings;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.util.List;

/**
 * Publishes the log settings as system properties consumed by {@code log4j2.xml}. Must run before the first
 * logger is created, later calls are ignored.
 */
public class LogInitializer {
    // ordered from most to least verbose
    private static final List<String> LEVELS = List.of("all", "trace", "debug", "info", "warn", "error", "fatal", "off");
    private static boolean initDone = false;

    public static synchronized void initLogManager(String logDir, String logFileName, String logFileLevel, String logConsoleLevel) {
        if (initDone) return;
        initDone = true;

        String checkedFileLevel = getCheckedLevel(logFileLevel);
        String checkedConsoleLevel = getCheckedLevel(logConsoleLevel);
        // root level is the more verbose of the two appender levels
        String logRootLevel = LEVELS.get(Math.min(LEVELS.indexOf(checkedFileLevel), LEVELS.indexOf(checkedConsoleLevel)));

        if (!logDir.isBlank() && !logDir.endsWith(File.separator)) {
            logDir = logDir + File.separator;
        }

        System.setProperty("logDir", logDir);
        System.setProperty("logFileName", logFileName);
        System.setProperty("logRootLevel", logRootLevel);
        System.setProperty("logFileLevel", checkedFileLevel);
        System.setProperty("logConsoleLevel", checkedConsoleLevel);

        Logger logger = LogManager.getLogger(LogInitializer.class);
        logger.log(
            Level.INFO, "Logging system started, log file: [{}], file log level: [{}], console log level: [{}]",
            logDir + logFileName, checkedFileLevel, checkedConsoleLevel
        );
    }

    public static void initLogManager(WalletSettings settings) {
        WalletSettings.LogInfo logInfo = settings.getLogInfo();
        initLogManager(logInfo.getLogDir(), logInfo.getLogFileName(), logInfo.getLogFileLevel(), logInfo.getLogConsoleLevel());
    }

    public static String getCheckedLevel(String inLevel) {
        String level = inLevel == null ? "" : inLevel.toLowerCase();
        if (LEVELS.contains(level)) {
            return level;
        }
        System.err.println("ERROR: specified log4j level: [" + inLevel + "] not valid: defaulting to [info]");
        return "info";
    }
}
