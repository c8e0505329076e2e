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

import davcal.exception.DavCalException;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import java.net.SocketException;


/**
 * Gateway log facade, all operational messages go through bundle keys.
 */
public final class DavGatewayLog {
    private static final Logger LOGGER = Logger.getLogger("davcal");

    private DavGatewayLog() {
    }

    /**
     * Log message according to log level.
     *
     * @param message text message
     * @param level   log level
     */
    private static void logMessage(BundleMessage message, Level level) {
        LOGGER.log(level, message.formatLog());
    }

    /**
     * Log message and exception according to log level.
     * Socket exceptions are expected on client disconnect, no stack trace.
     *
     * @param message text message
     * @param e       exception
     * @param level   log level
     */
    private static void logMessage(BundleMessage message, Exception e, Level level) {
        if (e instanceof SocketException || e instanceof DavCalException) {
            LOGGER.log(level, BundleMessage.getExceptionLogMessage(message, e));
        } else {
            LOGGER.log(level, BundleMessage.getExceptionLogMessage(message, e), e);
        }
    }

    /**
     * Log message with level debug.
     *
     * @param message text message
     */
    public static void debug(BundleMessage message) {
        logMessage(message, Level.DEBUG);
    }

    /**
     * Log message with level info.
     *
     * @param message text message
     */
    public static void info(BundleMessage message) {
        logMessage(message, Level.INFO);
    }

    /**
     * Log message with level warn.
     *
     * @param message text message
     */
    public static void warn(BundleMessage message) {
        logMessage(message, Level.WARN);
    }

    /**
     * Log exception with level warn.
     *
     * @param e exception
     */
    public static void warn(Exception e) {
        logMessage(null, e, Level.WARN);
    }

    /**
     * Log message with level error.
     *
     * @param message text message
     */
    public static void error(BundleMessage message) {
        logMessage(message, Level.ERROR);
    }

    /**
     * Log exception with level error.
     *
     * @param e exception
     */
    public static void error(Exception e) {
        logMessage(null, e, Level.ERROR);
    }

    /**
     * Log message and exception with level debug.
     *
     * @param message text message
     * @param e       exception
     */
    public static void debug(BundleMessage message, Exception e) {
        logMessage(message, e, Level.DEBUG);
    }

    /**
     * Log message and exception with level warn.
     *
     * @param message text message
     * @param e       exception
     */
    public static void warn(BundleMessage message, Exception e) {
        logMessage(message, e, Level.WARN);
    }

    /**
     * Log message and exception with level error.
     *
     * @param message text message
     * @param e       exception
     */
    public static void error(BundleMessage message, Exception e) {
        logMessage(message, e, Level.ERROR);
    }

    /**
     * Check debug level before building expensive messages.
     *
     * @return true if debug enabled
     */
    public static boolean isDebugEnabled() {
        return LOGGER.isDebugEnabled();
    }
}
