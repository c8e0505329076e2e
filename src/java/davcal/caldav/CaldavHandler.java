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

import davcal.BundleMessage;
import davcal.DavGatewayLog;
import davcal.Settings;
import davcal.exception.DavCalAuthenticationException;
import davcal.exception.DavCalException;
import davcal.exception.FilterParseException;
import davcal.exception.HttpBadRequestException;
import davcal.exception.HttpForbiddenException;
import davcal.exception.HttpMethodNotAllowedException;
import davcal.exception.HttpNotFoundException;
import davcal.exception.HttpPreconditionFailedException;
import davcal.exception.HttpStatusException;
import davcal.exception.HttpUnsupportedMediaTypeException;
import davcal.exception.PathException;
import davcal.filter.Filter;
import davcal.filter.FilterParser;
import davcal.ical.VCalendar;
import davcal.ical.VObject;
import davcal.multistatus.MultistatusBuilder;
import davcal.multistatus.MultistatusMerger;
import davcal.property.PropertyEnvironment;
import davcal.property.PropertyRequest;
import davcal.property.ResolverTables;
import davcal.resource.PathCodec;
import davcal.resource.Resource;
import davcal.resource.ResourceType;
import davcal.resource.ResourceWalker;
import davcal.storage.Calendar;
import davcal.storage.CalendarObject;
import davcal.storage.Storage;
import davcal.storage.StorageException;
import davcal.util.DateUtil;
import davcal.util.XmlUtil;
import org.apache.commons.codec.binary.Base64;
import org.apache.commons.httpclient.HttpStatus;
import org.apache.commons.httpclient.URIException;
import org.apache.commons.httpclient.util.URIUtil;
import org.apache.log4j.Logger;
import org.jdom.Document;
import org.jdom.Element;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * CalDAV method semantics over a storage backend and a path codec.
 * Every failure is turned into an HTTP status here, the connection only writes responses.
 */
public class CaldavHandler {
    private static final Logger LOGGER = Logger.getLogger(CaldavHandler.class);

    static final String XML_CONTENT_TYPE = "application/xml; charset=utf-8";
    static final String CALENDAR_CONTENT_TYPE = "text/calendar; charset=utf-8";
    static final String TEXT_CONTENT_TYPE = "text/plain; charset=utf-8";
    static final String WELL_KNOWN_PATH = "/.well-known/caldav";
    static final String DAV_HEADER = "1, calendar-access";
    static final String ALLOWED_METHODS = "OPTIONS, PROPFIND, REPORT, GET, PUT, DELETE, MKCOL, MKCALENDAR";

    protected final Storage storage;
    protected final PathCodec pathCodec;
    protected final ResourceWalker resourceWalker;

    public CaldavHandler(Storage storage, PathCodec pathCodec) {
        this.storage = storage;
        this.pathCodec = pathCodec;
        this.resourceWalker = new ResourceWalker(storage, pathCodec);
    }

    /**
     * Handle a request, never throws: failures are answered with an error status.
     *
     * @param request decoded request
     * @return response
     */
    public CaldavResponse handle(CaldavRequest request) {
        try {
            if ("OPTIONS".equals(request.getCommand())) {
                return handleOptions();
            }
            if (isWellKnown(request.getPath())) {
                return handleWellKnown();
            }
            authenticate(request);
            return dispatch(request);
        } catch (DavCalException e) {
            return buildErrorResponse(request, e);
        } catch (RuntimeException e) {
            DavGatewayLog.error(new BundleMessage("LOG_UNEXPECTED_HANDLER_ERROR", request.getCommand(), request.getPath()), e);
            return buildErrorResponse(HttpStatus.SC_INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }

    protected CaldavResponse dispatch(CaldavRequest request) throws DavCalException {
        String command = request.getCommand();
        if ("PROPFIND".equals(command)) {
            return handlePropfind(request);
        } else if ("REPORT".equals(command)) {
            return handleReport(request);
        } else if ("GET".equals(command)) {
            return handleGet(request, true);
        } else if ("HEAD".equals(command)) {
            return handleGet(request, false);
        } else if ("PUT".equals(command)) {
            return handlePut(request);
        } else if ("DELETE".equals(command)) {
            return handleDelete(request);
        } else if ("MKCALENDAR".equals(command) || "MKCOL".equals(command)) {
            return handleMkCalendar(request);
        } else {
            throw new HttpMethodNotAllowedException("EXCEPTION_UNSUPPORTED_METHOD", command, request.getPath());
        }
    }

    /**
     * Check Basic credentials against storage and keep the user id on the request.
     *
     * @param request request
     * @throws DavCalException 401 without or with invalid credentials, 400 on malformed header
     */
    protected void authenticate(CaldavRequest request) throws DavCalException {
        String authorization = request.getHeader("authorization");
        if (authorization == null) {
            throw new DavCalAuthenticationException("EXCEPTION_AUTHENTICATION_REQUIRED");
        }
        int spaceIndex = authorization.indexOf(' ');
        if (spaceIndex < 0 || !"basic".equalsIgnoreCase(authorization.substring(0, spaceIndex))) {
            throw new HttpBadRequestException("EXCEPTION_UNSUPPORTED_AUTHORIZATION_MODE");
        }
        String encoded = authorization.substring(spaceIndex + 1).trim();
        if (!Base64.isBase64(encoded)) {
            throw new HttpBadRequestException("EXCEPTION_INVALID_CREDENTIALS");
        }
        String decoded = new String(Base64.decodeBase64(encoded.getBytes(StandardCharsets.US_ASCII)), StandardCharsets.UTF_8);
        int colonIndex = decoded.indexOf(':');
        if (colonIndex < 0) {
            throw new HttpBadRequestException("EXCEPTION_INVALID_CREDENTIALS");
        }
        String userName = decoded.substring(0, colonIndex);
        String password = decoded.substring(colonIndex + 1);
        try {
            request.setUserId(storage.authUser(userName, password));
        } catch (StorageException e) {
            DavGatewayLog.warn(new BundleMessage("LOG_USER_AUTHENTICATION_FAILED", userName), e);
            throw new DavCalAuthenticationException("EXCEPTION_AUTHENTICATION_FAILED");
        }
        DavGatewayLog.debug(new BundleMessage("LOG_USER_AUTHENTICATED", request.getUserId()));
    }

    protected CaldavResponse handleOptions() {
        CaldavResponse response = new CaldavResponse(HttpStatus.SC_OK);
        response.setHeader("DAV", DAV_HEADER);
        response.setHeader("Allow", ALLOWED_METHODS);
        return response;
    }

    protected boolean isWellKnown(String path) {
        return WELL_KNOWN_PATH.equals(path) || (WELL_KNOWN_PATH + '/').equals(path);
    }

    /**
     * Service discovery: redirect to the service root.
     */
    protected CaldavResponse handleWellKnown() throws PathException {
        CaldavResponse response = new CaldavResponse(HttpStatus.SC_MOVED_PERMANENTLY);
        response.setHeader("Location", pathCodec.encodePath(Resource.serviceRoot()));
        return response;
    }

    /**
     * Parse the request path, only the owner may address a user resource.
     *
     * @param request request with authenticated user
     * @return target resource
     * @throws DavCalException on invalid path or resource of another user
     */
    protected Resource getTargetResource(CaldavRequest request) throws DavCalException {
        Resource target = pathCodec.parsePath(request.getPath()).withUri(request.getPath());
        if (!isOwner(request, target)) {
            throw new HttpForbiddenException("EXCEPTION_ACCESS_FORBIDDEN", request.getUserId(), request.getPath());
        }
        return target;
    }

    protected boolean isOwner(CaldavRequest request, Resource resource) {
        return resource.getUserId() == null || resource.getUserId().equals(request.getUserId());
    }


    /**
     * PROPFIND: target and descendants up to Depth, one response element each.
     */
    protected CaldavResponse handlePropfind(CaldavRequest request) throws DavCalException {
        Resource target = getTargetResource(request);
        PropertyRequest propertyRequest = PropertyRequest.fromElement(parseOptionalBody(request));
        LOGGER.debug("PROPFIND " + target + " " + propertyRequest);

        List<Resource> resources = new ArrayList<>();
        resources.add(target);
        resources.addAll(resourceWalker.fetchChildren(request.getDepth(), target));

        List<Document> documents = new ArrayList<>();
        for (Resource resource : resources) {
            ResourceWalker.checkCancelled();
            Document document = buildResourceResponse(request, resource, propertyRequest, null);
            if (document != null) {
                documents.add(document);
            }
        }
        return buildMultistatusResponse(documents);
    }

    /**
     * Resolve the requested properties of a resource.
     *
     * @return response document, null when the resource href cannot be encoded
     */
    protected Document buildResourceResponse(CaldavRequest request, Resource resource, PropertyRequest propertyRequest,
                                             CalendarObject preload) {
        PropertyEnvironment environment = new PropertyEnvironment(storage, pathCodec, resource, request.getUserId(), preload);
        String href;
        try {
            href = environment.getResourceHref();
        } catch (PathException e) {
            DavGatewayLog.warn(new BundleMessage("LOG_SKIPPING_RESOURCE", resource), e);
            return null;
        }
        if (propertyRequest.isPropName()) {
            return MultistatusBuilder.buildPropNames(href, ResolverTables.getPropertyNames(resource.getType()));
        }
        return MultistatusBuilder.build(href, ResolverTables.resolve(environment, propertyRequest.getNames()));
    }

    protected CaldavResponse buildMultistatusResponse(List<Document> documents) throws DavCalException {
        Document merged;
        if (documents.isEmpty()) {
            merged = new Document(MultistatusBuilder.createRoot());
        } else {
            merged = MultistatusMerger.merge(documents);
        }
        return new CaldavResponse(HttpStatus.SC_MULTI_STATUS, XML_CONTENT_TYPE, XmlUtil.toString(merged));
    }

    /**
     * REPORT: route on the report root element.
     */
    protected CaldavResponse handleReport(CaldavRequest request) throws DavCalException {
        Resource target = getTargetResource(request);
        if (!request.hasBody()) {
            throw new HttpBadRequestException("EXCEPTION_MISSING_REPORT_BODY");
        }
        Element root;
        try {
            root = XmlUtil.parse(request.getBody()).getRootElement();
        } catch (DavCalException e) {
            throw new HttpBadRequestException("EXCEPTION_INVALID_REQUEST_BODY", e.getMessage());
        }
        String reportType = root.getName();
        if ("calendar-multiget".equals(reportType)) {
            return handleMultiget(request, root);
        } else if ("calendar-query".equals(reportType)) {
            return handleCalendarQuery(request, target, root);
        } else {
            throw new HttpBadRequestException("EXCEPTION_UNSUPPORTED_REPORT_TYPE", reportType);
        }
    }

    protected CaldavResponse handleMultiget(CaldavRequest request, Element root) throws DavCalException {
        PropertyRequest propertyRequest = PropertyRequest.fromElement(root);
        List<Document> documents = new ArrayList<>();
        for (Element hrefElement : XmlUtil.getChildren(root, "href")) {
            ResourceWalker.checkCancelled();
            String href = hrefElement.getTextTrim();
            Resource resource;
            try {
                String path = URIUtil.decode(href, "UTF-8");
                resource = pathCodec.parsePath(path).withUri(path);
            } catch (URIException | PathException e) {
                throw new HttpStatusException(HttpStatus.SC_INTERNAL_SERVER_ERROR, "EXCEPTION_INVALID_MULTIGET_HREF", href, e.getMessage());
            }
            if (!isOwner(request, resource)) {
                DavGatewayLog.debug(new BundleMessage("LOG_SKIPPING_FORBIDDEN_HREF", href, request.getUserId()));
                documents.add(MultistatusBuilder.buildStatus(href, HttpStatus.SC_FORBIDDEN));
                continue;
            }

            CalendarObject preload = null;
            if (resource.getType() == ResourceType.OBJECT) {
                try {
                    preload = storage.getObject(resource.getUserId(), resource.getCalendarId(), resource.getObjectId());
                } catch (StorageException e) {
                    if (!e.isNotFound()) {
                        throw e;
                    }
                    documents.add(MultistatusBuilder.buildStatus(href, HttpStatus.SC_NOT_FOUND));
                    continue;
                }
            }
            Document document = buildResourceResponse(request, resource, propertyRequest, preload);
            if (document != null) {
                documents.add(document);
            }
        }
        return buildMultistatusResponse(documents);
    }

    protected CaldavResponse handleCalendarQuery(CaldavRequest request, Resource target, Element root) throws DavCalException {
        if (target.getType() != ResourceType.COLLECTION) {
            throw new HttpBadRequestException("EXCEPTION_QUERY_TARGET_NOT_COLLECTION", request.getPath());
        }
        PropertyRequest propertyRequest = PropertyRequest.fromElement(root);
        Filter filter = FilterParser.parseFilterElement(XmlUtil.getChild(root, "filter"));
        LOGGER.debug("calendar-query on " + target + " filter " + filter);

        List<Document> documents = new ArrayList<>();
        for (CalendarObject object : storage.getObjectByFilter(target.getUserId(), target.getCalendarId(), filter)) {
            ResourceWalker.checkCancelled();
            Resource resource;
            try {
                resource = pathCodec.parsePath(object.getPath()).withUri(object.getPath());
            } catch (PathException e) {
                DavGatewayLog.warn(new BundleMessage("LOG_SKIPPING_OBJECT", object.getPath()), e);
                continue;
            }
            Document document = buildResourceResponse(request, resource, propertyRequest, object);
            if (document != null) {
                documents.add(document);
            }
        }
        return buildMultistatusResponse(documents);
    }

    /**
     * GET and HEAD on a calendar object.
     */
    protected CaldavResponse handleGet(CaldavRequest request, boolean sendContent) throws DavCalException {
        Resource target = getObjectResource(request);
        CalendarObject object = storage.getObject(target.getUserId(), target.getCalendarId(), target.getObjectId());

        String ifNoneMatch = request.getHeader("if-none-match");
        if (ifNoneMatch != null && ifNoneMatch.equals(object.getEtag())) {
            CaldavResponse response = new CaldavResponse(HttpStatus.SC_NOT_MODIFIED);
            response.setHeader("ETag", object.getEtag());
            return response;
        }

        Calendar calendar = storage.getCalendar(target.getUserId(), target.getCalendarId());
        VCalendar vCalendar = VCalendar.wrap(Settings.getProperty("davcal.productId", Settings.DEFAULT_PRODUCT_ID),
                object.getComponents(), calendar.getCalendarData());
        CaldavResponse response = new CaldavResponse(HttpStatus.SC_OK, CALENDAR_CONTENT_TYPE, vCalendar.toString());
        response.setHeader("ETag", object.getEtag());
        if (object.getLastModified() != null) {
            response.setHeader("Last-Modified", DateUtil.formatHttpDate(object.getLastModified()));
        }
        response.setSendContent(sendContent);
        return response;
    }

    protected Resource getObjectResource(CaldavRequest request) throws DavCalException {
        Resource target = getTargetResource(request);
        if (target.getType() != ResourceType.OBJECT) {
            throw new HttpMethodNotAllowedException("EXCEPTION_METHOD_NOT_ALLOWED_ON_RESOURCE", request.getCommand(), target.getType());
        }
        return target;
    }

    /**
     * Current object or null when it does not exist.
     */
    protected CalendarObject findObject(Resource target) throws StorageException {
        try {
            return storage.getObject(target.getUserId(), target.getCalendarId(), target.getObjectId());
        } catch (StorageException e) {
            if (e.isNotFound()) {
                return null;
            }
            throw e;
        }
    }

    /**
     * PUT: create or replace a calendar object holding a single component.
     */
    protected CaldavResponse handlePut(CaldavRequest request) throws DavCalException {
        Resource target = getObjectResource(request);
        CalendarObject existing = findObject(target);

        String ifMatch = request.getHeader("if-match");
        String ifNoneMatch = request.getHeader("if-none-match");
        if (existing != null) {
            if (ifMatch != null && !"*".equals(ifMatch) && !ifMatch.equals(existing.getEtag())) {
                throw new HttpPreconditionFailedException("EXCEPTION_ETAG_MISMATCH", ifMatch, existing.getEtag());
            }
            if ("*".equals(ifNoneMatch)) {
                throw new HttpPreconditionFailedException("EXCEPTION_OBJECT_EXISTS", request.getPath());
            }
        } else if (ifMatch != null) {
            throw new HttpPreconditionFailedException("EXCEPTION_OBJECT_NOT_EXISTS", request.getPath());
        }

        String contentType = request.getHeader("content-type");
        if (contentType == null || !contentType.toLowerCase(Locale.ROOT).startsWith("text/calendar")) {
            throw new HttpUnsupportedMediaTypeException("EXCEPTION_UNSUPPORTED_CONTENT_TYPE", contentType);
        }

        VObject component;
        try {
            component = new VCalendar(request.getBody() == null ? "" : request.getBody()).getSingleComponent();
        } catch (IOException e) {
            throw new HttpBadRequestException("EXCEPTION_INVALID_CALENDAR_BODY", e.getMessage());
        }

        Calendar calendar = storage.getCalendar(target.getUserId(), target.getCalendarId());
        if (!isSupportedComponent(calendar, component.getType())) {
            throw new HttpForbiddenException("EXCEPTION_UNSUPPORTED_COMPONENT", component.getType(), target.getCalendarId());
        }

        CalendarObject object = new CalendarObject();
        object.setPath(pathCodec.encodePath(target));
        object.getComponents().add(component);
        String etag = storage.updateObject(target.getUserId(), target.getCalendarId(), object);
        DavGatewayLog.debug(new BundleMessage("LOG_OBJECT_STORED", object.getPath(), etag));

        CaldavResponse response;
        if (existing == null) {
            response = new CaldavResponse(HttpStatus.SC_CREATED);
            response.setHeader("Location", PropertyEnvironment.encodeHref(object.getPath()));
        } else {
            response = new CaldavResponse(HttpStatus.SC_NO_CONTENT);
        }
        response.setHeader("ETag", etag);
        return response;
    }

    protected boolean isSupportedComponent(Calendar calendar, String componentType) {
        for (String supported : calendar.getSupportedComponents()) {
            if (supported.equalsIgnoreCase(componentType)) {
                return true;
            }
        }
        return false;
    }

    protected CaldavResponse handleDelete(CaldavRequest request) throws DavCalException {
        Resource target = getObjectResource(request);
        CalendarObject existing = storage.getObject(target.getUserId(), target.getCalendarId(), target.getObjectId());
        String ifMatch = request.getHeader("if-match");
        if (ifMatch != null && !"*".equals(ifMatch) && !ifMatch.equals(existing.getEtag())) {
            throw new HttpPreconditionFailedException("EXCEPTION_ETAG_MISMATCH", ifMatch, existing.getEtag());
        }
        storage.deleteObject(target.getUserId(), target.getCalendarId(), target.getObjectId());
        DavGatewayLog.debug(new BundleMessage("LOG_OBJECT_DELETED", request.getPath()));
        return new CaldavResponse(HttpStatus.SC_NO_CONTENT);
    }

    /**
     * MKCALENDAR and MKCOL: create a calendar collection from the set/prop values.
     */
    protected CaldavResponse handleMkCalendar(CaldavRequest request) throws DavCalException {
        Resource target = getTargetResource(request);
        if (target.getType() != ResourceType.COLLECTION) {
            throw new HttpMethodNotAllowedException("EXCEPTION_METHOD_NOT_ALLOWED_ON_RESOURCE", request.getCommand(), target.getType());
        }
        Calendar calendar = new Calendar();
        calendar.setPath(pathCodec.encodePath(target));
        VCalendar calendarData = new VCalendar(Settings.getProperty("davcal.productId", Settings.DEFAULT_PRODUCT_ID), true);
        calendar.setCalendarData(calendarData);

        Element root = parseOptionalBody(request);
        Element prop = XmlUtil.getChild(XmlUtil.getChild(root, "set"), "prop");
        if (prop != null) {
            for (Element property : XmlUtil.getChildren(prop)) {
                applyCalendarProperty(calendar, calendarData, property);
            }
        }
        if (calendar.getSupportedComponents().isEmpty()) {
            calendar.getSupportedComponents().add("VEVENT");
        }

        try {
            storage.createCalendar(target.getUserId(), calendar);
        } catch (StorageException e) {
            if (e.getReason() == StorageException.Reason.CONFLICT) {
                throw new HttpMethodNotAllowedException("EXCEPTION_CALENDAR_EXISTS", target.getCalendarId());
            }
            throw e;
        }
        CaldavResponse response = new CaldavResponse(HttpStatus.SC_CREATED);
        response.setHeader("Location", PropertyEnvironment.encodeHref(calendar.getPath()));
        response.setHeader("ETag", calendar.getEtag());
        return response;
    }

    protected void applyCalendarProperty(Calendar calendar, VCalendar calendarData, Element property) throws DavCalException {
        String name = property.getName();
        String value = property.getTextTrim();
        if ("displayname".equals(name)) {
            setIfPresent(calendarData, "NAME", value);
        } else if ("calendar-description".equals(name)) {
            setIfPresent(calendarData, "DESCRIPTION", value);
        } else if ("calendar-timezone".equals(name)) {
            addTimezone(calendarData, property.getText());
        } else if ("supported-calendar-component-set".equals(name)) {
            for (Element comp : XmlUtil.getChildren(property, "comp")) {
                String componentName = comp.getAttributeValue("name");
                if (componentName != null && componentName.length() > 0) {
                    calendar.getSupportedComponents().add(componentName.toUpperCase(Locale.ROOT));
                }
            }
        } else if ("calendar-color".equals(name) || "color".equals(name)) {
            setIfPresent(calendarData, "COLOR", value);
        } else if ("timezone".equals(name)) {
            setIfPresent(calendarData, "X-TIMEZONE", value);
        } else {
            LOGGER.debug("Ignoring calendar property " + name);
        }
    }

    private static void setIfPresent(VObject vObject, String name, String value) {
        if (value != null && value.length() > 0) {
            vObject.setPropertyValue(name, value);
        }
    }

    /**
     * calendar-timezone holds either an iCalendar text with VTIMEZONE definitions or a bare TZID.
     */
    protected void addTimezone(VCalendar calendarData, String value) throws DavCalException {
        if (value == null || value.trim().length() == 0) {
            return;
        }
        if (value.contains("BEGIN:VTIMEZONE")) {
            try {
                for (VObject vTimezone : new VCalendar(value.trim()).getVObjects("VTIMEZONE")) {
                    calendarData.addVObject(vTimezone);
                }
            } catch (IOException e) {
                throw new HttpBadRequestException("EXCEPTION_INVALID_CALENDAR_TIMEZONE", e.getMessage());
            }
        } else {
            VObject vTimezone = VObject.create("VTIMEZONE");
            vTimezone.setPropertyValue("TZID", value.trim());
            calendarData.addVObject(vTimezone);
        }
    }

    /**
     * Parse an optional xml request body.
     *
     * @return root element, null for an empty body
     * @throws HttpBadRequestException on malformed xml
     */
    protected Element parseOptionalBody(CaldavRequest request) throws HttpBadRequestException {
        if (!request.hasBody()) {
            return null;
        }
        try {
            return XmlUtil.parse(request.getBody()).getRootElement();
        } catch (DavCalException e) {
            throw new HttpBadRequestException("EXCEPTION_INVALID_REQUEST_BODY", e.getMessage());
        }
    }

    /**
     * Map an exception to its HTTP status.
     *
     * @param e exception
     * @return HTTP status code
     */
    public static int getStatusCode(Exception e) {
        if (e instanceof HttpStatusException) {
            return ((HttpStatusException) e).getStatusCode();
        } else if (e instanceof StorageException) {
            switch (((StorageException) e).getReason()) {
                case NOT_FOUND:
                    return HttpStatus.SC_NOT_FOUND;
                case PERMISSION_DENIED:
                    return HttpStatus.SC_FORBIDDEN;
                case CONFLICT:
                    return HttpStatus.SC_CONFLICT;
                case INVALID_INPUT:
                    return HttpStatus.SC_BAD_REQUEST;
                default:
                    return HttpStatus.SC_INTERNAL_SERVER_ERROR;
            }
        } else if (e instanceof PathException) {
            return HttpStatus.SC_NOT_FOUND;
        } else if (e instanceof FilterParseException) {
            return HttpStatus.SC_BAD_REQUEST;
        }
        return HttpStatus.SC_INTERNAL_SERVER_ERROR;
    }

    protected CaldavResponse buildErrorResponse(CaldavRequest request, DavCalException e) {
        int status = getStatusCode(e);
        if (status >= HttpStatus.SC_INTERNAL_SERVER_ERROR) {
            DavGatewayLog.error(new BundleMessage("LOG_REQUEST_FAILED", request.getCommand(), request.getPath(), status), e);
        } else {
            DavGatewayLog.debug(new BundleMessage("LOG_REQUEST_FAILED", request.getCommand(), request.getPath(), status), e);
        }
        CaldavResponse response = buildErrorResponse(status, e.getMessage());
        if (status == HttpStatus.SC_UNAUTHORIZED) {
            response.setHeader("WWW-Authenticate", "Basic realm=\"" + Settings.getProperty("davcal.realm", "DavCal") + '\"');
        } else if (status == HttpStatus.SC_METHOD_NOT_ALLOWED) {
            response.setHeader("Allow", ALLOWED_METHODS);
        }
        return response;
    }

    protected CaldavResponse buildErrorResponse(int status, String message) {
        String body = HttpStatus.getStatusText(status);
        if (message != null) {
            body = body + ": " + message;
        }
        return new CaldavResponse(status, TEXT_CONTENT_TYPE, body);
    }
}
