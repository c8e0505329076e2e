/*
 * DavMail POP/IMAP/SMTP/CalDav/LDAP Exchange Gateway
 * Copyright (C) 2009  Mickael Guessant
 *
 * This program is free software; you can redistribute it and/or
 * modify it under the terms of the GNU General Public License
 * as published by the Free Software Foundation; either version 2
 * of the License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program; if not, write to the Free Software
 * Foundation, Inc., 51 Franklin Street, Fifth Floor, Boston, MA  02110-1301, USA.
 */
package davcal;

import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;
import org.apache.log4j.RollingFileAppender;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Settings facade.
 * DavCal settings are stored in the davcal.properties file in the current
 * directory or in the file specified on the command line.
 */
public final class Settings {

    public static final String DEFAULT_CONFIG_FILE = "davcal.properties";
    public static final String DEFAULT_PRODUCT_ID = "-//DavCal//CalDAV Server//EN";

    private static final Properties SETTINGS_PROPERTIES = new Properties();
    private static String configFilePath;

    private Settings() {
    }

    /**
     * Set config file path (from command line parameter).
     *
     * @param path davcal properties file path
     */
    public static synchronized void setConfigFilePath(String path) {
        configFilePath = path;
    }

    /**
     * Load properties from provided stream.
     *
     * @param inputStream properties stream
     * @throws IOException on error
     */
    public static synchronized void load(InputStream inputStream) throws IOException {
        SETTINGS_PROPERTIES.load(inputStream);
        updateLoggingConfig();
    }

    /**
     * Load properties from current file path (command line or default).
     * Missing file means default settings.
     */
    public static synchronized void load() {
        setDefaultSettings();
        try {
            if (configFilePath == null) {
                configFilePath = DEFAULT_CONFIG_FILE;
            }
            File configFile = new File(configFilePath);
            if (configFile.exists()) {
                try (FileInputStream fileInputStream = new FileInputStream(configFile)) {
                    load(fileInputStream);
                }
            } else {
                DavGatewayLog.info(new BundleMessage("LOG_SETTINGS_FILE_NOT_FOUND", configFilePath));
            }
        } catch (IOException e) {
            DavGatewayLog.error(new BundleMessage("LOG_UNABLE_TO_LOAD_SETTINGS"), e);
        }
        updateLoggingConfig();
    }

    /**
     * Set all settings to default values.
     */
    public static synchronized void setDefaultSettings() {
        SETTINGS_PROPERTIES.clear();
        SETTINGS_PROPERTIES.put("davcal.caldavPort", "5232");
        SETTINGS_PROPERTIES.put("davcal.bindAddress", "");
        SETTINGS_PROPERTIES.put("davcal.allowRemote", Boolean.FALSE.toString());
        SETTINGS_PROPERTIES.put("davcal.clientSoTimeout", "");
        SETTINGS_PROPERTIES.put("davcal.pathPrefix", "");
        SETTINGS_PROPERTIES.put("davcal.realm", "DavCal");
        SETTINGS_PROPERTIES.put("davcal.productId", DEFAULT_PRODUCT_ID);
        SETTINGS_PROPERTIES.put("davcal.recurrence.maxOccurrences", "100");
        SETTINGS_PROPERTIES.put("davcal.recurrence.windowDays", "90");
        SETTINGS_PROPERTIES.put("davcal.users", "");

        // logging
        SETTINGS_PROPERTIES.put("log4j.rootLogger", Level.WARN.toString());
        SETTINGS_PROPERTIES.put("log4j.logger.davcal", Level.INFO.toString());
        SETTINGS_PROPERTIES.put("davcal.logFilePath", "");
    }

    /**
     * Update Log4J config from settings.
     * File appender is only attached when davcal.logFilePath is set.
     */
    public static synchronized void updateLoggingConfig() {
        String logFilePath = getProperty("davcal.logFilePath");
        if (logFilePath != null) {
            File logFile = new File(logFilePath);
            if (logFile.isDirectory()) {
                logFile = new File(logFile, "davcal.log");
            }
            File logFileDir = logFile.getParentFile();
            if (logFileDir != null && !logFileDir.exists() && !logFileDir.mkdirs()) {
                DavGatewayLog.error(new BundleMessage("LOG_UNABLE_TO_CREATE_LOG_FILE_DIR"));
            } else {
                try {
                    synchronized (Logger.getRootLogger()) {
                        FileAppender fileAppender = (FileAppender) Logger.getRootLogger().getAppender("FileAppender");
                        if (fileAppender == null) {
                            String logFileSize = getProperty("davcal.logFileSize", "1MB");
                            // set log file size to 0 to use an external rotation mechanism, e.g. logrotate
                            if ("0".equals(logFileSize)) {
                                fileAppender = new FileAppender();
                            } else {
                                fileAppender = new RollingFileAppender();
                                ((RollingFileAppender) fileAppender).setMaxBackupIndex(2);
                                ((RollingFileAppender) fileAppender).setMaxFileSize(logFileSize);
                            }
                            fileAppender.setName("FileAppender");
                            fileAppender.setEncoding("UTF-8");
                            fileAppender.setLayout(new PatternLayout("%d{ISO8601} %-5p [%t] %c %x - %m%n"));
                        }
                        fileAppender.setFile(logFile.getPath(), true, false, 8192);
                        Logger.getRootLogger().addAppender(fileAppender);
                    }
                } catch (IOException e) {
                    DavGatewayLog.error(new BundleMessage("LOG_UNABLE_TO_SET_LOG_FILE_PATH"), e);
                }
            }
        }

        // update logging levels
        setLoggingLevel("rootLogger", getLoggingLevel("rootLogger"));
        setLoggingLevel("davcal", getLoggingLevel("davcal"));
    }

    /**
     * Get a property value as String.
     *
     * @param property property name
     * @return property value
     */
    public static synchronized String getProperty(String property) {
        String value = SETTINGS_PROPERTIES.getProperty(property);
        // return null on empty value
        if (value != null && value.isEmpty()) {
            value = null;
        }
        return value;
    }

    /**
     * Get property value or default.
     *
     * @param property     property name
     * @param defaultValue default property value
     * @return property value
     */
    public static synchronized String getProperty(String property, String defaultValue) {
        String value = getProperty(property);
        if (value == null) {
            value = defaultValue;
        }
        return value;
    }

    /**
     * Set a property value.
     *
     * @param property property name
     * @param value    property value
     */
    public static synchronized void setProperty(String property, String value) {
        if (value != null) {
            SETTINGS_PROPERTIES.setProperty(property, value);
        } else {
            SETTINGS_PROPERTIES.setProperty(property, "");
        }
    }

    /**
     * Get a property value as int, return default value if null.
     *
     * @param property     property name
     * @param defaultValue default property value
     * @return property value
     */
    public static synchronized int getIntProperty(String property, int defaultValue) {
        int value = defaultValue;
        try {
            String propertyValue = SETTINGS_PROPERTIES.getProperty(property);
            if (propertyValue != null && !propertyValue.isEmpty()) {
                value = Integer.parseInt(propertyValue.trim());
            }
        } catch (NumberFormatException e) {
            DavGatewayLog.warn(new BundleMessage("LOG_INVALID_SETTING_VALUE", property), e);
        }
        return value;
    }

    /**
     * Get a property value as boolean.
     *
     * @param property property name
     * @return property value
     */
    public static synchronized boolean getBooleanProperty(String property) {
        String propertyValue = SETTINGS_PROPERTIES.getProperty(property);
        return Boolean.parseBoolean(propertyValue);
    }

    private static String getLoggingPrefix(String category) {
        String prefix;
        if ("rootLogger".equals(category)) {
            prefix = "log4j.";
        } else {
            prefix = "log4j.logger.";
        }
        return prefix;
    }

    /**
     * Return Log4J logging level for the category.
     *
     * @param category logging category
     * @return logging level
     */
    public static synchronized Level getLoggingLevel(String category) {
        String prefix = getLoggingPrefix(category);
        String currentValue = SETTINGS_PROPERTIES.getProperty(prefix + category);

        if (currentValue != null && !currentValue.isEmpty()) {
            return Level.toLevel(currentValue);
        } else if ("rootLogger".equals(category)) {
            return Logger.getRootLogger().getLevel();
        } else {
            return Logger.getLogger(category).getLevel();
        }
    }

    /**
     * Set Log4J logging level for the category
     *
     * @param category logging category
     * @param level    logging level
     */
    public static synchronized void setLoggingLevel(String category, Level level) {
        if (level != null) {
            String prefix = getLoggingPrefix(category);
            SETTINGS_PROPERTIES.setProperty(prefix + category, level.toString());
            if ("rootLogger".equals(category)) {
                Logger.getRootLogger().setLevel(level);
            } else {
                Logger.getLogger(category).setLevel(level);
            }
        }
    }
}
