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
package davcal.caldav;

import davcal.AbstractConnection;
import davcal.BundleMessage;
import davcal.DavGatewayLog;
import davcal.exception.DavCalException;
import davcal.util.DateUtil;
import org.apache.commons.httpclient.HttpStatus;
import org.apache.commons.httpclient.util.URIUtil;
import org.apache.log4j.Logger;

import java.io.IOException;
import java.net.Socket;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.StringTokenizer;

/**
 * Handle a caldav connection: read HTTP requests, pass them to the handler and write responses.
 */
public class CaldavConnection extends AbstractConnection {
    /**
     * Maximum keep alive time in seconds
     */
    protected static final int MAX_KEEP_ALIVE_TIME = 300;
    protected final Logger wireLogger = Logger.getLogger(this.getClass());

    protected final CaldavHandler handler;
    protected boolean closed;

    /**
     * Initialize the streams and start the thread.
     *
     * @param clientSocket caldav client socket
     * @param handler      request handler
     */
    public CaldavConnection(Socket clientSocket, CaldavHandler handler) {
        super(CaldavConnection.class.getSimpleName(), clientSocket, "UTF-8");
        this.handler = handler;
        // set caldav logging to davcal logging level
        wireLogger.setLevel(DavGatewayLog.isDebugEnabled() ? org.apache.log4j.Level.DEBUG : org.apache.log4j.Level.INFO);
    }

    protected Map<String, String> parseHeaders() throws IOException {
        HashMap<String, String> headers = new HashMap<>();
        String line;
        while ((line = readClient()) != null && line.length() > 0) {
            int index = line.indexOf(':');
            if (index <= 0) {
                throw new DavCalException("EXCEPTION_INVALID_HEADER", line);
            }
            headers.put(line.substring(0, index).toLowerCase(Locale.ROOT), line.substring(index + 1).trim());
        }
        return headers;
    }

    protected String getContent(String contentLength) throws IOException {
        if (contentLength == null || contentLength.length() == 0) {
            return null;
        } else {
            int size;
            try {
                size = Integer.parseInt(contentLength);
            } catch (NumberFormatException e) {
                throw new DavCalException("EXCEPTION_INVALID_CONTENT_LENGTH", contentLength);
            }
            String content = in.readContentAsString(size);
            if (wireLogger.isDebugEnabled()) {
                wireLogger.debug("< " + content);
            }
            return content;
        }
    }

    protected void setSocketTimeout(String keepAliveValue) throws IOException {
        if (keepAliveValue != null && keepAliveValue.length() > 0) {
            int keepAlive;
            try {
                keepAlive = Integer.parseInt(keepAliveValue);
            } catch (NumberFormatException e) {
                throw new DavCalException("EXCEPTION_INVALID_KEEPALIVE", keepAliveValue);
            }
            if (keepAlive > MAX_KEEP_ALIVE_TIME) {
                keepAlive = MAX_KEEP_ALIVE_TIME;
            }
            client.setSoTimeout(keepAlive * 1000);
            DavGatewayLog.debug(new BundleMessage("LOG_SET_SOCKET_TIMEOUT", keepAlive));
        }
    }

    @Override
    public void run() {
        String line;
        StringTokenizer tokens;

        try {
            while (!closed) {
                line = readClient();
                // unable to read line, connection closed ?
                if (line == null) {
                    break;
                }
                tokens = new StringTokenizer(line);
                String command = tokens.nextToken();
                Map<String, String> headers = parseHeaders();
                String encodedPath = tokens.nextToken();
                // strip query string
                int queryIndex = encodedPath.indexOf('?');
                if (queryIndex >= 0) {
                    encodedPath = encodedPath.substring(0, queryIndex);
                }
                String path = URIUtil.decode(encodedPath);
                String content = getContent(headers.get("content-length"));
                setSocketTimeout(headers.get("keep-alive"));
                // client requested connection close
                closed = "close".equals(headers.get("connection"));

                CaldavRequest request = new CaldavRequest(command, path, headers, content);
                DavGatewayLog.debug(new BundleMessage("LOG_HANDLE_REQUEST", request));
                sendHttpResponse(handler.handle(request));
                os.flush();
                DavGatewayLog.debug(new BundleMessage("LOG_REQUEST_DONE", command, path));
            }
        } catch (SocketTimeoutException e) {
            DavGatewayLog.debug(new BundleMessage("LOG_CLOSE_CONNECTION_ON_TIMEOUT"));
        } catch (SocketException e) {
            DavGatewayLog.debug(new BundleMessage("LOG_CONNECTION_CLOSED"));
        } catch (Exception e) {
            DavGatewayLog.error(new BundleMessage("LOG_CONNECTION_ERROR"), e);
            try {
                sendErr(e);
            } catch (IOException e2) {
                DavGatewayLog.debug(new BundleMessage("LOG_EXCEPTION_SENDING_ERROR_TO_CLIENT"), e2);
            }
        } finally {
            close();
        }
    }

    /**
     * Send an error response for a failure outside of the request handler.
     *
     * @param e exception
     * @throws IOException on error
     */
    public void sendErr(Exception e) throws IOException {
        int status = HttpStatus.SC_BAD_REQUEST;
        if (!(e instanceof DavCalException)) {
            status = HttpStatus.SC_INTERNAL_SERVER_ERROR;
        }
        String message = e.getMessage();
        if (message == null) {
            message = e.toString();
        }
        closed = true;
        sendHttpResponse(new CaldavResponse(status, CaldavHandler.TEXT_CONTENT_TYPE, message));
    }

    /**
     * Send Http response with the handler outcome.
     *
     * @param response response
     * @throws IOException on error
     */
    public void sendHttpResponse(CaldavResponse response) throws IOException {
        sendClient("HTTP/1.1 " + response.getStatus() + ' ' + HttpStatus.getStatusText(response.getStatus()));
        sendClient("Server: DavCal Gateway");
        sendClient("DAV: " + CaldavHandler.DAV_HEADER);
        sendClient("Date: " + DateUtil.formatHttpDate(Instant.now()));
        for (Map.Entry<String, String> header : response.getHeaders().entrySet()) {
            if (!"DAV".equals(header.getKey())) {
                sendClient(header.getKey() + ": " + header.getValue());
            }
        }
        if (response.getContentType() != null) {
            sendClient("Content-Type: " + response.getContentType());
        }
        sendClient("Connection: " + (closed ? "close" : "keep-alive"));
        byte[] content = response.getContent();
        sendClient("Content-Length: " + (content == null ? 0 : content.length));
        sendClient("");
        if (content != null && content.length > 0 && response.isSendContent()) {
            if (wireLogger.isDebugEnabled()) {
                wireLogger.debug("> " + new String(content, StandardCharsets.UTF_8));
            }
            sendClient(content);
        }
    }
}
