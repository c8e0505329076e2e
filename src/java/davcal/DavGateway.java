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

import davcal.caldav.CaldavHandler;
import davcal.caldav.CaldavServer;
import davcal.exception.DavCalException;
import davcal.resource.DefaultPathCodec;
import davcal.storage.memory.MemoryStorage;
import org.apache.log4j.Logger;

import java.util.ArrayList;

/**
 * DavGateway main class
 */
public final class DavGateway {
    private static final Logger LOGGER = Logger.getLogger(DavGateway.class);

    private static final Object LOCK = new Object();
    private static boolean shutdown = false;

    private DavGateway() {
    }

    private static final ArrayList<AbstractServer> SERVER_LIST = new ArrayList<>();
    private static MemoryStorage storage;

    /**
     * Start the gateway, listen on the caldav port.
     *
     * @param args command line parameter config file path
     */
    public static void main(String[] args) {
        for (String arg : args) {
            if (!arg.startsWith("-")) {
                Settings.setConfigFilePath(arg);
            }
        }
        Settings.load();

        start();

        // all threads are daemon threads, do not let main stop
        Runtime.getRuntime().addShutdownHook(new Thread("Shutdown") {
            @Override
            public void run() {
                shutdown = true;
                DavGatewayLog.debug(new BundleMessage("LOG_GATEWAY_INTERRUPTED"));
                DavGateway.stop();
                synchronized (LOCK) {
                    LOCK.notifyAll();
                }
            }
        });

        synchronized (LOCK) {
            try {
                while (!shutdown) {
                    LOCK.wait();
                }
            } catch (InterruptedException e) {
                DavGatewayLog.debug(new BundleMessage("LOG_GATEWAY_INTERRUPTED"));
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Start DavCal listeners.
     */
    public static void start() {
        SERVER_LIST.clear();

        DefaultPathCodec pathCodec = new DefaultPathCodec(Settings.getProperty("davcal.pathPrefix"));
        storage = new MemoryStorage(pathCodec);
        registerUsers(storage, Settings.getProperty("davcal.users"));

        int caldavPort = Settings.getIntProperty("davcal.caldavPort", CaldavServer.DEFAULT_PORT);
        if (caldavPort != 0) {
            SERVER_LIST.add(new CaldavServer(caldavPort, new CaldavHandler(storage, pathCodec)));
        }

        BundleMessage.BundleMessageList messages = new BundleMessage.BundleMessageList();
        BundleMessage.BundleMessageList errorMessages = new BundleMessage.BundleMessageList();
        for (AbstractServer server : SERVER_LIST) {
            try {
                server.bind();
                server.start();
                messages.add(new BundleMessage("LOG_PROTOCOL_PORT", server.getProtocolName(), server.getPort()));
            } catch (DavCalException e) {
                errorMessages.add(e.getBundleMessage());
            }
        }

        if (!messages.isEmpty()) {
            DavGatewayLog.info(new BundleMessage("LOG_DAVCAL_GATEWAY_LISTENING", messages));
        }
        if (!errorMessages.isEmpty()) {
            DavGatewayLog.error(new BundleMessage("LOG_MESSAGE", errorMessages));
        }
    }

    /**
     * Register users from a comma separated list of user:password:Display Name entries.
     *
     * @param memoryStorage target storage
     * @param users         user list, may be null
     */
    static void registerUsers(MemoryStorage memoryStorage, String users) {
        if (users == null || users.trim().length() == 0) {
            LOGGER.debug("No users configured");
            return;
        }
        for (String entry : users.split(",")) {
            String[] values = entry.trim().split(":", 3);
            if (values.length == 0 || values[0].length() == 0) {
                continue;
            }
            String password = values.length > 1 && values[1].length() > 0 ? values[1] : null;
            String displayName = values.length > 2 ? values[2] : null;
            try {
                memoryStorage.registerUser(values[0], displayName, password);
            } catch (DavCalException e) {
                DavGatewayLog.warn(new BundleMessage("LOG_INVALID_USER_ENTRY", values[0]), e);
            }
        }
    }

    /**
     * Current storage, null before start.
     *
     * @return storage
     */
    public static MemoryStorage getStorage() {
        return storage;
    }

    /**
     * Stop all listeners.
     */
    public static void stop() {
        for (AbstractServer server : SERVER_LIST) {
            server.close();
            try {
                server.join();
            } catch (InterruptedException e) {
                DavGatewayLog.warn(new BundleMessage("LOG_EXCEPTION_WAITING_SERVER_THREAD_DIE"), e);
                Thread.currentThread().interrupt();
            }
        }
        DavGatewayLog.info(new BundleMessage("LOG_GATEWAY_STOP"));
    }
}
