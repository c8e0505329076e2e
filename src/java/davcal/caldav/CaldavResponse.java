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

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP response produced by the request handler, written by the connection.
 */
public class CaldavResponse {
    private final int status;
    private final Map<String, String> headers = new LinkedHashMap<>();
    private String contentType;
    private byte[] content;
    private boolean sendContent = true;

    public CaldavResponse(int status) {
        this.status = status;
    }

    /**
     * Response with a text body.
     *
     * @param status      HTTP status
     * @param contentType content type
     * @param body        body text, UTF-8 encoded
     */
    public CaldavResponse(int status, String contentType, String body) {
        this(status);
        this.contentType = contentType;
        if (body != null) {
            this.content = body.getBytes(StandardCharsets.UTF_8);
        }
    }

    public int getStatus() {
        return status;
    }

    public CaldavResponse setHeader(String name, String value) {
        headers.put(name, value);
        return this;
    }

    public String getHeader(String name) {
        return headers.get(name);
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public String getContentType() {
        return contentType;
    }

    public byte[] getContent() {
        return content;
    }

    /**
     * Body as text.
     *
     * @return body, null without content
     */
    public String getBody() {
        if (content == null) {
            return null;
        }
        return new String(content, StandardCharsets.UTF_8);
    }

    /**
     * HEAD responses keep Content-Length but omit the body.
     *
     * @return false for HEAD
     */
    public boolean isSendContent() {
        return sendContent;
    }

    public void setSendContent(boolean sendContent) {
        this.sendContent = sendContent;
    }
}
