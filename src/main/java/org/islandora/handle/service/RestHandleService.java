package org.islandora.handle.service;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Properties;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.islandora.handle.exceptions.HandleServiceException;
import org.islandora.handle.filerepository.FileRepositoryUtility;

/**
 * RestHandleService talks to a Handle administration web service over HTTP. Each Handle is a
 * resource at `{handleServiceUrl}/{prefix}/{pid}`:
 *
 * <ul>
 *   <li>`GET` answers `200` when the Handle exists and `404` when it does not.</li>
 *   <li>`PUT` with a form encoded `target` mints the Handle, pointing it at the target URL.</li>
 *   <li>`DELETE` removes the Handle.</li>
 * </ul>
 *
 * Requests are authenticated with HTTP Basic credentials of the prefix administrator. The target
 * URL is built from `targetUrlTemplate`, which supports the placeholders `[[PID]]` (the URL
 * encoded pid) and `[[HANDLE]]` (`prefix/pid`).
 */
public class RestHandleService implements HandleService {
    private static final Log logHandleService = LogFactory.getLog(RestHandleService.class);
    private final String HANDLE_SERVICE_URL;
    private final String HANDLE_PREFIX;
    private final String TARGET_URL_TEMPLATE;
    private final String AUTHORIZATION;
    private final Duration REQUEST_TIMEOUT;
    private final HttpClient client;

    public static final String PID_PLACEHOLDER = "[[PID]]";
    public static final String HANDLE_PLACEHOLDER = "[[HANDLE]]";
    public static final int DEFAULT_TIMEOUT_SECONDS = 30;

    public enum HandleServiceProperties {
        handleServiceUrl, handlePrefix, handleUsername, handlePassword, targetUrlTemplate,
        handleServiceTimeout
    }

    /**
     * Constructor to initialize RestHandleService, properties are required.
     *
     * @param serviceProperties Properties object with the following keys: handleServiceUrl,
     *                          handlePrefix, handleUsername, handlePassword, targetUrlTemplate
     *                          and optionally handleServiceTimeout (seconds)
     * @throws IllegalArgumentException When a required property is missing or invalid
     */
    public RestHandleService(Properties serviceProperties) throws IllegalArgumentException {
        FileRepositoryUtility.ensureNotNull(
            serviceProperties, "serviceProperties", "RestHandleService - constructor");
        String serviceUrl = requireProperty(
            serviceProperties, HandleServiceProperties.handleServiceUrl);
        String prefix = requireProperty(serviceProperties, HandleServiceProperties.handlePrefix);
        String username = requireProperty(
            serviceProperties, HandleServiceProperties.handleUsername);
        String password = requireProperty(
            serviceProperties, HandleServiceProperties.handlePassword);
        String targetUrlTemplate = requireProperty(
            serviceProperties, HandleServiceProperties.targetUrlTemplate);
        int timeout = Integer.parseInt(serviceProperties.getProperty(
            HandleServiceProperties.handleServiceTimeout.name(),
            String.valueOf(DEFAULT_TIMEOUT_SECONDS)));
        if (timeout <= 0) {
            String errMsg = "handleServiceTimeout must be > than 0. Timeout: " + timeout;
            logHandleService.fatal(errMsg);
            throw new IllegalArgumentException(errMsg);
        }
        if (!serviceUrl.startsWith("http://") && !serviceUrl.startsWith("https://")) {
            String errMsg = "handleServiceUrl must be an http(s) URL: " + serviceUrl;
            logHandleService.fatal(errMsg);
            throw new IllegalArgumentException(errMsg);
        }

        HANDLE_SERVICE_URL = serviceUrl.endsWith("/")
            ? serviceUrl.substring(0, serviceUrl.length() - 1) : serviceUrl;
        HANDLE_PREFIX = prefix;
        TARGET_URL_TEMPLATE = targetUrlTemplate;
        AUTHORIZATION = "Basic " + Base64.getEncoder().encodeToString(
            (username + ":" + password).getBytes(StandardCharsets.UTF_8));
        REQUEST_TIMEOUT = Duration.ofSeconds(timeout);
        client = HttpClient.newBuilder().connectTimeout(REQUEST_TIMEOUT).build();
        logHandleService.debug(
            "RestHandleService initialized. Service: " + HANDLE_SERVICE_URL + ". Prefix: "
                + HANDLE_PREFIX);
    }

    @Override
    public boolean exists(String pid) throws IOException {
        FileRepositoryUtility.checkForEmptyAndValidString(pid, "pid", "exists");
        HttpRequest request = newRequest(pid).GET().build();
        HttpResponse<String> response = send(request, pid);
        int code = response.statusCode();
        if (code == 200) {
            return true;
        } else if (code == 404) {
            return false;
        }
        String errMsg = "Unexpected response code " + code + " when looking up Handle for pid: "
            + pid + ". Response: " + response.body();
        logHandleService.error(errMsg);
        throw new HandleServiceException(errMsg, code);
    }

    @Override
    public HandleServiceResponse create(String pid) throws IOException {
        FileRepositoryUtility.checkForEmptyAndValidString(pid, "pid", "create");
        String target = buildTargetUrl(pid);
        String form = "target=" + URLEncoder.encode(target, StandardCharsets.UTF_8);
        HttpRequest request = newRequest(pid)
            .header("Content-Type", "application/x-www-form-urlencoded")
            .PUT(HttpRequest.BodyPublishers.ofString(form, StandardCharsets.UTF_8))
            .build();
        HttpResponse<String> response = send(request, pid);
        logHandleService.debug(
            "Create Handle for pid: " + pid + " with target: " + target + " answered: "
                + response.statusCode());
        return toServiceResponse(response, CREATED);
    }

    @Override
    public HandleServiceResponse delete(String pid) throws IOException {
        FileRepositoryUtility.checkForEmptyAndValidString(pid, "pid", "delete");
        HttpRequest request = newRequest(pid).DELETE().build();
        HttpResponse<String> response = send(request, pid);
        logHandleService.debug(
            "Delete Handle for pid: " + pid + " answered: " + response.statusCode());
        return toServiceResponse(response, DELETED);
    }

    @Override
    public String canonicalUrl(String pid) {
        FileRepositoryUtility.checkForEmptyAndValidString(pid, "pid", "canonicalUrl");
        return HANDLE_RESOLVER_URL + "/" + HANDLE_PREFIX + "/" + pid;
    }

    /**
     * Fill the target URL template for a pid
     *
     * @param pid Persistent identifier
     * @return URL the Handle should resolve to
     */
    protected String buildTargetUrl(String pid) {
        return TARGET_URL_TEMPLATE
            .replace(PID_PLACEHOLDER, encodeSegment(pid))
            .replace(HANDLE_PLACEHOLDER, HANDLE_PREFIX + "/" + pid);
    }

    /**
     * @param pid Persistent identifier
     * @return URI of the pid's Handle resource on the service
     */
    protected URI getHandleUri(String pid) {
        return URI.create(
            HANDLE_SERVICE_URL + "/" + encodeSegment(HANDLE_PREFIX) + "/" + encodeSegment(pid));
    }

    private HttpRequest.Builder newRequest(String pid) {
        return HttpRequest.newBuilder()
            .uri(getHandleUri(pid))
            .timeout(REQUEST_TIMEOUT)
            .header("Authorization", AUTHORIZATION);
    }

    private HttpResponse<String> send(HttpRequest request, String pid)
        throws HandleServiceException {
        try {
            return client.send(request, HttpResponse.BodyHandlers.ofString());

        } catch (IOException ioe) {
            String errMsg = "Unable to reach Handle service at: " + request.uri() + " for pid: "
                + pid + ". IOException: " + ioe.getMessage();
            logHandleService.error(errMsg);
            throw new HandleServiceException(errMsg, ioe);

        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            String errMsg = "Interrupted while waiting for the Handle service for pid: " + pid;
            logHandleService.warn(errMsg);
            throw new HandleServiceException(errMsg, ie);
        }
    }

    private static HandleServiceResponse toServiceResponse(
        HttpResponse<String> response, int expectedCode) {
        int code = response.statusCode();
        String body = response.body();
        if (code == expectedCode || body == null || body.trim().isEmpty()) {
            return new HandleServiceResponse(code, null);
        }
        return new HandleServiceResponse(code, body.trim());
    }

    private static String encodeSegment(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String requireProperty(
        Properties serviceProperties, HandleServiceProperties property) {
        String value = serviceProperties.getProperty(property.name());
        if (value == null || value.trim().isEmpty()) {
            String errMsg = "RestHandleService - " + property.name() + " cannot be null or empty.";
            logHandleService.fatal(errMsg);
            throw new IllegalArgumentException(errMsg);
        }
        return value.trim();
    }
}
