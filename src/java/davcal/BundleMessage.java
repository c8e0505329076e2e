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

import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Locale;
import java.util.ResourceBundle;

/**
 * Message key and values from the davcalmessages bundle, formatted lazily.
 * Log and error texts stay in english, the root bundle is always used.
 */
public class BundleMessage {
    protected static final String MESSAGE_BUNDLE_NAME = "davcalmessages";
    protected final String key;
    private final Object[] arguments;

    /**
     * @param key       message key in resource bundle
     * @param arguments message values, nested messages and exceptions are formatted too
     */
    public BundleMessage(String key, Object... arguments) {
        this.key = key;
        this.arguments = arguments;
    }

    public String formatLog() {
        return format(key, arguments);
    }

    @Override
    public String toString() {
        return formatLog();
    }

    protected static String format(String key, Object... arguments) {
        Object[] formattedArguments = null;
        if (arguments != null) {
            formattedArguments = new Object[arguments.length];
            for (int i = 0; i < arguments.length; i++) {
                formattedArguments[i] = formatArgument(arguments[i]);
            }
        }
        return MessageFormat.format(ResourceBundle.getBundle(MESSAGE_BUNDLE_NAME, Locale.ROOT).getString(key), formattedArguments);
    }

    private static Object formatArgument(Object argument) {
        if (argument instanceof BundleMessage) {
            return ((BundleMessage) argument).formatLog();
        } else if (argument instanceof BundleMessageList) {
            StringBuilder buffer = new StringBuilder();
            for (BundleMessage bundleMessage : (BundleMessageList) argument) {
                if (buffer.length() > 0) {
                    buffer.append(' ');
                }
                buffer.append(bundleMessage.formatLog());
            }
            return buffer.toString();
        } else if (argument instanceof Throwable) {
            String message = ((Throwable) argument).getMessage();
            return message == null ? argument.toString() : message;
        }
        return argument;
    }

    /**
     * Log text for a message followed by the exception message.
     *
     * @param message bundle message, may be null
     * @param e       exception
     * @return formatted message
     */
    public static String getExceptionLogMessage(BundleMessage message, Exception e) {
        StringBuilder buffer = new StringBuilder();
        if (message != null) {
            buffer.append(message.formatLog()).append(' ');
        }
        if (e.getMessage() != null) {
            buffer.append(e.getMessage());
        } else {
            buffer.append(e.toString());
        }
        return buffer.toString();
    }

    /**
     * Messages joined with a space when used as an argument.
     */
    public static class BundleMessageList extends ArrayList<BundleMessage> {
    }
}
