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
import org.apache.commons.codec.binary.Base64;

import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PushbackInputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

/**
 * Generic client connection thread: line oriented reads, raw writes.
 */
public class AbstractConnection extends Thread {

    protected static class LineReaderInputStream extends PushbackInputStream {
        final String encoding;

        protected LineReaderInputStream(InputStream in, String encoding) {
            super(in);
            if (encoding == null) {
                this.encoding = "ASCII";
            } else {
                this.encoding = encoding;
            }
        }

        /**
         * Read a CRLF or LF terminated line.
         *
         * @return line, null at end of stream
         * @throws IOException on error
         */
        public String readLine() throws IOException {
            ByteArrayOutputStream baos = new ByteArrayOutputStream();
            int b = read();
            if (b < 0) {
                return null;
            }
            while (b > -1) {
                if (b == '\r') {
                    int next = read();
                    if (next != '\n' && next > -1) {
                        unread(next);
                    }
                    break;
                } else if (b == '\n') {
                    break;
                }
                baos.write(b);
                b = read();
            }
            return new String(baos.toByteArray(), encoding);
        }

        /**
         * Read byteSize bytes from inputStream, return content as String.
         *
         * @param byteSize content size
         * @return content
         * @throws IOException on error
         */
        public String readContentAsString(int byteSize) throws IOException {
            return new String(readContent(byteSize), encoding);
        }

        /**
         * Read byteSize bytes from inputStream.
         *
         * @param byteSize content size
         * @return content
         * @throws IOException on error
         */
        public byte[] readContent(int byteSize) throws IOException {
            byte[] buffer = new byte[byteSize];
            int startIndex = 0;
            int count = 0;
            while (count >= 0 && startIndex < byteSize) {
                count = read(buffer, startIndex, byteSize - startIndex);
                if (count > 0) {
                    startIndex += count;
                }
            }
            if (startIndex < byteSize) {
                throw new DavCalException("EXCEPTION_END_OF_STREAM");
            }
            return buffer;
        }
    }

    protected final Socket client;

    protected LineReaderInputStream in;
    protected OutputStream os;

    /**
     * Initialize the streams and set thread name.
     *
     * @param name         thread type name
     * @param clientSocket client socket
     * @param encoding     socket stream encoding
     */
    public AbstractConnection(String name, Socket clientSocket, String encoding) {
        super(name + '-' + clientSocket.getPort());
        this.client = clientSocket;
        setDaemon(true);
        try {
            in = new LineReaderInputStream(client.getInputStream(), encoding);
            os = new BufferedOutputStream(client.getOutputStream());
        } catch (IOException e) {
            close();
            DavGatewayLog.error(new BundleMessage("LOG_EXCEPTION_GETTING_SOCKET_STREAMS"), e);
        }
    }

    /**
     * Send message to client followed by CRLF.
     *
     * @param message message
     * @throws IOException on error
     */
    public void sendClient(String message) throws IOException {
        DavGatewayLog.debug(new BundleMessage("LOG_SEND_CLIENT_MESSAGE", message));
        os.write(message.getBytes(StandardCharsets.UTF_8));
        os.write((char) 13);
        os.write((char) 10);
    }

    /**
     * Send only bytes to client.
     *
     * @param messageBytes content
     * @throws IOException on error
     */
    public void sendClient(byte[] messageBytes) throws IOException {
        os.write(messageBytes, 0, messageBytes.length);
        os.flush();
    }

    /**
     * Read a line from the client connection, credentials are not logged.
     *
     * @return line or null
     * @throws IOException when unable to read line
     */
    public String readClient() throws IOException {
        String line = in.readLine();
        if (line != null) {
            if (line.regionMatches(true, 0, "Authorization:", 0, "Authorization:".length())) {
                DavGatewayLog.debug(new BundleMessage("LOG_READ_CLIENT_AUTHORIZATION"));
            } else {
                DavGatewayLog.debug(new BundleMessage("LOG_READ_CLIENT_LINE", line));
            }
        }
        return line;
    }

    /**
     * Close client connection and streams.
     */
    public void close() {
        if (in != null) {
            try {
                in.close();
            } catch (IOException e2) {
                DavGatewayLog.warn(new BundleMessage("LOG_EXCEPTION_CLOSING_CLIENT_INPUT_STREAM"), e2);
            }
        }
        if (os != null) {
            try {
                os.close();
            } catch (IOException e2) {
                DavGatewayLog.warn(new BundleMessage("LOG_EXCEPTION_CLOSING_CLIENT_OUTPUT_STREAM"), e2);
            }
        }
        try {
            client.close();
        } catch (IOException e2) {
            DavGatewayLog.warn(new BundleMessage("LOG_EXCEPTION_CLOSING_CLIENT_SOCKET"), e2);
        }
    }

    protected static String base64Decode(String value) {
        return new String(Base64.decodeBase64(value.getBytes(StandardCharsets.US_ASCII)), StandardCharsets.UTF_8);
    }
}
