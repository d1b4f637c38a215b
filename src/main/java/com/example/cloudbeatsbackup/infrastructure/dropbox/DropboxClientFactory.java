package com.example.cloudbeatsbackup.infrastructure.dropbox;

import com.example.cloudbeatsbackup.common.config.AppDropboxProperties;
import com.example.cloudbeatsbackup.common.util.RunCancellation;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.http.client.HttpClient;
import org.springframework.stereotype.Component;

@Component
public class DropboxClientFactory {

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final AppDropboxProperties properties;
    private final RunCancellation cancellation;

    public DropboxClientFactory(HttpClient httpClient,
                                ObjectMapper objectMapper,
                                AppDropboxProperties properties,
                                RunCancellation cancellation) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.cancellation = cancellation;
    }

    public DropboxClient create(String accessToken) {
        return new HttpDropboxClient(httpClient, objectMapper, properties, accessToken, cancellation);
    }
}
