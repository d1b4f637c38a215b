package com.example.cloudbeatsbackup.infrastructure.dropbox;

import com.example.cloudbeatsbackup.common.config.AppDropboxProperties;
import com.example.cloudbeatsbackup.common.exception.DropboxApiException;
import com.example.cloudbeatsbackup.common.exception.DropboxAuthException;
import com.example.cloudbeatsbackup.common.exception.RunCancelledException;
import com.example.cloudbeatsbackup.common.util.RunCancellation;
import com.example.cloudbeatsbackup.domain.model.RemoteEntry;
import com.example.cloudbeatsbackup.domain.model.RemoteEntryKind;
import com.example.cloudbeatsbackup.infrastructure.dropbox.dto.AccountResponse;
import com.example.cloudbeatsbackup.infrastructure.dropbox.dto.DropboxEntry;
import com.example.cloudbeatsbackup.infrastructure.dropbox.dto.ListFolderResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.http.Header;
import org.apache.http.HttpEntity;
import org.apache.http.HttpHeaders;
import org.apache.http.HttpResponse;
import org.apache.http.HttpStatus;
import org.apache.http.client.HttpClient;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.entity.StringEntity;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Dropbox API v2 client bound to one bearer token.
 *
 * <p>Every call is retried on 429 (Retry-After when the server sends one, otherwise exponential backoff
 * up to the configured ceiling) until it succeeds, the run is cancelled, or another status comes back.
 * A 401 fails at once with {@link DropboxAuthException}; other statuses raise {@link DropboxApiException}.
 */
public class HttpDropboxClient implements DropboxClient {

    private static final Logger log = LoggerFactory.getLogger(HttpDropboxClient.class);

    static final String ACCOUNT_ENDPOINT = "/users/get_current_account";
    static final String LIST_FOLDER_ENDPOINT = "/files/list_folder";
    static final String LIST_FOLDER_CONTINUE_ENDPOINT = "/files/list_folder/continue";

    private static final int SC_TOO_MANY_REQUESTS = 429;
    private static final String RETRY_AFTER_HEADER = "Retry-After";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String accessToken;
    private final String apiBaseUrl;
    private final long initialBackoffMs;
    private final long maxBackoffMs;
    private final RunCancellation cancellation;
    private final BackoffSleeper sleeper;

    public HttpDropboxClient(HttpClient httpClient,
                             ObjectMapper objectMapper,
                             AppDropboxProperties properties,
                             String accessToken,
                             RunCancellation cancellation) {
        this(httpClient, objectMapper, properties, accessToken, cancellation, cancellation::sleep);
    }

    HttpDropboxClient(HttpClient httpClient,
                      ObjectMapper objectMapper,
                      AppDropboxProperties properties,
                      String accessToken,
                      RunCancellation cancellation,
                      BackoffSleeper sleeper) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.accessToken = accessToken;
        this.apiBaseUrl = trimTrailingSlash(properties.getApiBaseUrl());
        this.maxBackoffMs = Math.max(1L, properties.getMaxBackoffMs());
        this.initialBackoffMs = Math.min(Math.max(1L, properties.getInitialBackoffMs()), this.maxBackoffMs);
        this.cancellation = cancellation;
        this.sleeper = sleeper;
    }

    @Override
    public String getAccountId() {
        String body = post(ACCOUNT_ENDPOINT, "null");
        AccountResponse account = decode(ACCOUNT_ENDPOINT, body, AccountResponse.class);
        if (!StringUtils.hasText(account.getAccountId())) {
            throw new DropboxApiException(ACCOUNT_ENDPOINT, HttpStatus.SC_OK, body,
                    "empty account_id in response", null);
        }
        return account.getAccountId();
    }

    @Override
    public List<RemoteEntry> listFolder(String remotePath) {
        String path = remotePath == null ? "" : remotePath;
        log.debug("DROPBOX_LIST_START remotePath={}", path);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("path", path);
        payload.put("recursive", true);
        ListFolderResponse page = decode(LIST_FOLDER_ENDPOINT,
                post(LIST_FOLDER_ENDPOINT, toJson(payload)), ListFolderResponse.class);

        List<RemoteEntry> files = new ArrayList<>();
        int pageCount = 1;
        int added = collectFiles(page, files);
        log.debug("DROPBOX_LIST_PAGE page={} files={} hasMore={}", pageCount, added, page.isHasMore());

        while (page.isHasMore()) {
            if (!StringUtils.hasText(page.getCursor())) {
                throw new DropboxApiException(LIST_FOLDER_CONTINUE_ENDPOINT, HttpStatus.SC_OK, null,
                        "list_folder reported more pages without a cursor", null);
            }
            String body = post(LIST_FOLDER_CONTINUE_ENDPOINT,
                    toJson(Collections.singletonMap("cursor", page.getCursor())));
            page = decode(LIST_FOLDER_CONTINUE_ENDPOINT, body, ListFolderResponse.class);
            pageCount++;
            added = collectFiles(page, files);
            log.debug("DROPBOX_LIST_PAGE page={} files={} hasMore={}", pageCount, added, page.isHasMore());
        }

        log.info("DROPBOX_LIST_FINISH remotePath={} files={} pages={}", path, files.size(), pageCount);
        return files;
    }

    private int collectFiles(ListFolderResponse page, List<RemoteEntry> sink) {
        if (page.getEntries() == null) {
            return 0;
        }
        int added = 0;
        for (DropboxEntry entry : page.getEntries()) {
            if (RemoteEntryKind.fromTag(entry.getTag()) != RemoteEntryKind.FILE) {
                continue;
            }
            sink.add(new RemoteEntry(RemoteEntryKind.FILE, entry.getId(), entry.getName(),
                    entry.getPathLower(), entry.getPathDisplay()));
            added++;
        }
        return added;
    }

    private String post(String endpoint, String jsonBody) {
        long backoffMs = initialBackoffMs;
        while (true) {
            if (cancellation.isCancelled()) {
                throw new RunCancelledException("Dropbox call " + endpoint + " cancelled");
            }

            HttpPost request = new HttpPost(apiBaseUrl + endpoint);
            request.setHeader(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken);
            StringEntity entity = new StringEntity(jsonBody, StandardCharsets.UTF_8);
            entity.setContentType("application/json");
            request.setEntity(entity);

            int status;
            String responseBody;
            Header retryAfter;
            try (RunCancellation.Registration ignored = cancellation.onCancel(request::abort)) {
                HttpResponse response = httpClient.execute(request);
                status = response.getStatusLine().getStatusCode();
                retryAfter = response.getFirstHeader(RETRY_AFTER_HEADER);
                responseBody = readBody(response);
            } catch (IOException e) {
                if (cancellation.isCancelled()) {
                    throw new RunCancelledException("Dropbox call " + endpoint + " cancelled");
                }
                throw new DropboxApiException(endpoint, 0, null,
                        "request to " + endpoint + " failed: " + e.getMessage(), e);
            }

            if (status == HttpStatus.SC_OK) {
                return responseBody;
            }
            if (status == HttpStatus.SC_UNAUTHORIZED) {
                throw new DropboxAuthException("Dropbox authentication failed (401). "
                        + "Your token may be invalid or expired.");
            }
            if (status == SC_TOO_MANY_REQUESTS) {
                long waitMs = resolveWaitMs(retryAfter, backoffMs);
                log.warn("DROPBOX_RATE_LIMITED endpoint={} waitMs={}", endpoint, waitMs);
                if (!sleeper.sleep(Duration.ofMillis(waitMs))) {
                    throw new RunCancelledException("Dropbox call " + endpoint + " cancelled while rate limited");
                }
                backoffMs = Math.min(backoffMs * 2, maxBackoffMs);
                continue;
            }
            throw new DropboxApiException(endpoint, status, responseBody);
        }
    }

    long resolveWaitMs(Header retryAfter, long backoffMs) {
        if (retryAfter != null && StringUtils.hasText(retryAfter.getValue())) {
            try {
                long seconds = Long.parseLong(retryAfter.getValue().trim());
                if (seconds >= 0) {
                    return Math.min(seconds * 1000L, maxBackoffMs);
                }
            } catch (NumberFormatException e) {
                log.debug("Ignoring non-numeric Retry-After header: {}", retryAfter.getValue());
            }
        }
        return Math.min(backoffMs, maxBackoffMs);
    }

    private String readBody(HttpResponse response) throws IOException {
        HttpEntity entity = response.getEntity();
        return entity == null ? "" : EntityUtils.toString(entity, StandardCharsets.UTF_8);
    }

    private <T> T decode(String endpoint, String body, Class<T> type) {
        try {
            return objectMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new DropboxApiException(endpoint, HttpStatus.SC_OK, body,
                    "failed to decode " + endpoint + " response", e);
        }
    }

    private String toJson(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("encoding Dropbox request failed", e);
        }
    }

    private static String trimTrailingSlash(String url) {
        String trimmed = url == null ? "" : url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    /**
     * Waits between two attempts. Returns false when the run was cancelled during the wait.
     */
    @FunctionalInterface
    public interface BackoffSleeper {

        boolean sleep(Duration wait);
    }
}
