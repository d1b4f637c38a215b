package com.example.cloudbeatsbackup.infrastructure.dropbox;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.cloudbeatsbackup.common.config.AppDropboxProperties;
import com.example.cloudbeatsbackup.common.exception.DropboxApiException;
import com.example.cloudbeatsbackup.common.exception.DropboxAuthException;
import com.example.cloudbeatsbackup.common.exception.RunCancelledException;
import com.example.cloudbeatsbackup.common.util.RunCancellation;
import com.example.cloudbeatsbackup.domain.model.RemoteEntry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.apache.http.HttpResponse;
import org.apache.http.HttpVersion;
import org.apache.http.client.HttpClient;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.entity.StringEntity;
import org.apache.http.message.BasicHttpResponse;
import org.apache.http.message.BasicStatusLine;
import org.apache.http.util.EntityUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class HttpDropboxClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private HttpClient httpClient;
    private AppDropboxProperties properties;
    private RunCancellation cancellation;
    private List<Duration> sleeps;
    private HttpDropboxClient client;

    @BeforeEach
    void setUp() {
        httpClient = mock(HttpClient.class);
        properties = new AppDropboxProperties();
        properties.setApiBaseUrl("https://api.test/2/");
        cancellation = new RunCancellation();
        sleeps = new ArrayList<>();
        client = new HttpDropboxClient(httpClient, objectMapper, properties, "tok-123", cancellation, wait -> {
            sleeps.add(wait);
            return true;
        });
    }

    @Test
    void listFolderShouldFollowCursorAndKeepOnlyFiles() throws Exception {
        when(httpClient.execute(any(HttpUriRequest.class))).thenReturn(
                response(200, "{\"entries\":["
                        + "{\".tag\":\"folder\",\"id\":\"id:f\",\"name\":\"Jazz\",\"path_lower\":\"/music/jazz\","
                        + "\"path_display\":\"/Music/Jazz\"},"
                        + "{\".tag\":\"file\",\"id\":\"id:1\",\"name\":\"a.mp3\",\"path_lower\":\"/music/jazz/a.mp3\","
                        + "\"path_display\":\"/Music/Jazz/a.mp3\"}],"
                        + "\"cursor\":\"c1\",\"has_more\":true}"),
                response(200, "{\"entries\":["
                        + "{\".tag\":\"deleted\",\"name\":\"old.mp3\",\"path_lower\":\"/music/old.mp3\"},"
                        + "{\".tag\":\"file\",\"id\":\"id:2\",\"name\":\"b.flac\",\"path_lower\":\"/music/b.flac\","
                        + "\"path_display\":\"/Music/b.flac\",\"size\":42}],"
                        + "\"cursor\":\"c2\",\"has_more\":false}"));

        List<RemoteEntry> files = client.listFolder("/Music");

        assertEquals(2, files.size());
        assertEquals("id:1", files.get(0).getId());
        assertEquals("/music/jazz/a.mp3", files.get(0).getLowercasePath());
        assertEquals("/Music/b.flac", files.get(1).getDisplayPath());

        ArgumentCaptor<HttpUriRequest> captor = ArgumentCaptor.forClass(HttpUriRequest.class);
        verify(httpClient, times(2)).execute(captor.capture());
        HttpUriRequest first = captor.getAllValues().get(0);
        HttpUriRequest second = captor.getAllValues().get(1);
        assertEquals("https://api.test/2/files/list_folder", first.getURI().toString());
        assertEquals("Bearer tok-123", first.getFirstHeader("Authorization").getValue());
        JsonNode firstBody = objectMapper.readTree(body(first));
        assertEquals("/Music", firstBody.get("path").asText());
        assertTrue(firstBody.get("recursive").asBoolean());
        assertEquals("https://api.test/2/files/list_folder/continue", second.getURI().toString());
        assertEquals("c1", objectMapper.readTree(body(second)).get("cursor").asText());
    }

    @Test
    void listFolderShouldSendEmptyPathForDropboxRoot() throws Exception {
        when(httpClient.execute(any(HttpUriRequest.class)))
                .thenReturn(response(200, "{\"entries\":[],\"cursor\":\"c\",\"has_more\":false}"));

        client.listFolder("");

        ArgumentCaptor<HttpUriRequest> captor = ArgumentCaptor.forClass(HttpUriRequest.class);
        verify(httpClient).execute(captor.capture());
        assertEquals("", objectMapper.readTree(body(captor.getValue())).get("path").asText());
    }

    @Test
    void shouldBackOffExponentiallyOnRateLimitThenSucceed() throws Exception {
        when(httpClient.execute(any(HttpUriRequest.class))).thenReturn(
                response(429, "{\"error\":\"too_many_requests\"}"),
                response(429, "{\"error\":\"too_many_requests\"}"),
                response(429, "{\"error\":\"too_many_requests\"}"),
                response(200, "{\"account_id\":\"dbid:abc\"}"));

        assertEquals("dbid:abc", client.getAccountId());

        verify(httpClient, times(4)).execute(any(HttpUriRequest.class));
        assertEquals(3, sleeps.size());
        assertEquals(Duration.ofSeconds(1), sleeps.get(0));
        assertEquals(Duration.ofSeconds(2), sleeps.get(1));
        assertEquals(Duration.ofSeconds(4), sleeps.get(2));
        for (Duration sleep : sleeps) {
            assertTrue(sleep.compareTo(Duration.ofSeconds(60)) <= 0);
        }
    }

    @Test
    void shouldCapBackoffAtConfiguredCeiling() throws Exception {
        properties.setInitialBackoffMs(40_000L);
        properties.setMaxBackoffMs(60_000L);
        client = new HttpDropboxClient(httpClient, objectMapper, properties, "tok", cancellation, wait -> {
            sleeps.add(wait);
            return true;
        });
        when(httpClient.execute(any(HttpUriRequest.class))).thenReturn(
                response(429, ""),
                response(429, ""),
                response(429, ""),
                response(200, "{\"account_id\":\"dbid:abc\"}"));

        client.getAccountId();

        assertEquals(Duration.ofSeconds(40), sleeps.get(0));
        assertEquals(Duration.ofSeconds(60), sleeps.get(1));
        assertEquals(Duration.ofSeconds(60), sleeps.get(2));
    }

    @Test
    void shouldHonorRetryAfterHeader() throws Exception {
        HttpResponse limited = response(429, "");
        limited.setHeader("Retry-After", "7");
        when(httpClient.execute(any(HttpUriRequest.class))).thenReturn(
                limited,
                response(200, "{\"account_id\":\"dbid:abc\"}"));

        client.getAccountId();

        assertEquals(1, sleeps.size());
        assertEquals(Duration.ofSeconds(7), sleeps.get(0));
    }

    @Test
    void shouldClampRetryAfterToCeiling() throws Exception {
        HttpResponse limited = response(429, "");
        limited.setHeader("Retry-After", "3600");
        when(httpClient.execute(any(HttpUriRequest.class))).thenReturn(
                limited,
                response(200, "{\"account_id\":\"dbid:abc\"}"));

        client.getAccountId();

        assertEquals(Duration.ofSeconds(60), sleeps.get(0));
    }

    @Test
    void shouldFailImmediatelyOnUnauthorized() throws Exception {
        when(httpClient.execute(any(HttpUriRequest.class))).thenReturn(response(401, "{\"error\":\"expired\"}"));

        assertThrows(DropboxAuthException.class, () -> client.getAccountId());

        verify(httpClient, times(1)).execute(any(HttpUriRequest.class));
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void shouldReportStatusAndBodyForOtherErrors() throws Exception {
        when(httpClient.execute(any(HttpUriRequest.class)))
                .thenReturn(response(409, "{\"error_summary\":\"path/not_found/\"}"));

        DropboxApiException error = assertThrows(DropboxApiException.class, () -> client.listFolder("/missing"));

        assertEquals(409, error.getStatusCode());
        assertEquals("/files/list_folder", error.getEndpoint());
        assertTrue(error.getResponseBody().contains("path/not_found"));
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void shouldWrapTransportFailures() throws Exception {
        when(httpClient.execute(any(HttpUriRequest.class))).thenThrow(new SocketException("connection reset"));

        DropboxApiException error = assertThrows(DropboxApiException.class, () -> client.getAccountId());

        assertEquals(0, error.getStatusCode());
    }

    @Test
    void shouldRejectEmptyAccountId() throws Exception {
        when(httpClient.execute(any(HttpUriRequest.class))).thenReturn(response(200, "{\"account_id\":\"\"}"));

        assertThrows(DropboxApiException.class, () -> client.getAccountId());
    }

    @Test
    void shouldStopWhenCancelledDuringBackoff() throws Exception {
        client = new HttpDropboxClient(httpClient, objectMapper, properties, "tok", cancellation, wait -> false);
        when(httpClient.execute(any(HttpUriRequest.class))).thenReturn(response(429, ""));

        assertThrows(RunCancelledException.class, () -> client.getAccountId());

        verify(httpClient, times(1)).execute(any(HttpUriRequest.class));
    }

    @Test
    void shouldNotCallRemoteAfterCancellation() throws Exception {
        cancellation.cancel();

        assertThrows(RunCancelledException.class, () -> client.listFolder(""));

        verify(httpClient, never()).execute(any(HttpUriRequest.class));
    }

    private static HttpResponse response(int status, String body) {
        BasicHttpResponse response = new BasicHttpResponse(new BasicStatusLine(HttpVersion.HTTP_1_1, status, "test"));
        response.setEntity(new StringEntity(body, StandardCharsets.UTF_8));
        return response;
    }

    private static String body(HttpUriRequest request) throws Exception {
        return EntityUtils.toString(((HttpPost) request).getEntity(), StandardCharsets.UTF_8);
    }
}
