package com.example.cloudbeatsbackup.infrastructure.dropbox;

import com.example.cloudbeatsbackup.common.config.AppDropboxProperties;
import com.example.cloudbeatsbackup.common.exception.ConfigurationException;
import com.example.cloudbeatsbackup.common.exception.DropboxAuthException;
import com.example.cloudbeatsbackup.domain.model.AuthorizationGrant;
import com.example.cloudbeatsbackup.infrastructure.dropbox.dto.TokenResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import org.apache.http.HttpEntity;
import org.apache.http.HttpResponse;
import org.apache.http.HttpStatus;
import org.apache.http.NameValuePair;
import org.apache.http.client.HttpClient;
import org.apache.http.client.entity.UrlEncodedFormEntity;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.utils.URIBuilder;
import org.apache.http.message.BasicNameValuePair;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * OAuth2 token lifecycle against the Dropbox token endpoint. Calls are one-shot: no retry, no backoff.
 */
@Component
public class DropboxOAuthClient {

    private static final Logger log = LoggerFactory.getLogger(DropboxOAuthClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final AppDropboxProperties properties;

    public DropboxOAuthClient(HttpClient httpClient, ObjectMapper objectMapper, AppDropboxProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * URL the user opens to authorize the app and obtain a one-time authorization code.
     */
    public String authorizationUrl(String appKey) {
        try {
            return new URIBuilder(properties.getAuthorizeUrl())
                    .addParameter("client_id", appKey)
                    .addParameter("response_type", "code")
                    .addParameter("token_access_type", "offline")
                    .build()
                    .toString();
        } catch (URISyntaxException e) {
            throw new ConfigurationException("invalid app.dropbox.authorize-url: " + properties.getAuthorizeUrl(),
                    "Fix app.dropbox.authorize-url", e);
        }
    }

    /**
     * Exchanges a refresh token for a new short-lived access token.
     */
    public String refreshAccessToken(String appKey, String appSecret, String refreshToken) {
        List<NameValuePair> form = Arrays.asList(
                new BasicNameValuePair("grant_type", "refresh_token"),
                new BasicNameValuePair("refresh_token", refreshToken),
                new BasicNameValuePair("client_id", appKey),
                new BasicNameValuePair("client_secret", appSecret));

        TokenResponse token = postForm("token refresh", form);
        if (!StringUtils.hasText(token.getAccessToken())) {
            throw new DropboxAuthException("empty access token in refresh response");
        }
        log.debug("DROPBOX_TOKEN_REFRESHED expiresIn={}", token.getExpiresIn());
        return token.getAccessToken();
    }

    /**
     * One-time exchange of an authorization code for a refresh token and an access token.
     */
    public AuthorizationGrant exchangeAuthorizationCode(String appKey, String appSecret, String code) {
        List<NameValuePair> form = Arrays.asList(
                new BasicNameValuePair("grant_type", "authorization_code"),
                new BasicNameValuePair("code", code),
                new BasicNameValuePair("client_id", appKey),
                new BasicNameValuePair("client_secret", appSecret));

        TokenResponse token = postForm("code exchange", form);
        if (!StringUtils.hasText(token.getRefreshToken())) {
            throw new DropboxAuthException("empty refresh token in code exchange response");
        }
        if (!StringUtils.hasText(token.getAccessToken())) {
            throw new DropboxAuthException("empty access token in code exchange response");
        }
        return new AuthorizationGrant(token.getRefreshToken(), token.getAccessToken(), token.getAccountId());
    }

    private TokenResponse postForm(String operation, List<NameValuePair> form) {
        HttpPost request = new HttpPost(properties.getTokenUrl());
        request.setEntity(new UrlEncodedFormEntity(form, StandardCharsets.UTF_8));

        int status;
        String body;
        try {
            HttpResponse response = httpClient.execute(request);
            status = response.getStatusLine().getStatusCode();
            HttpEntity entity = response.getEntity();
            body = entity == null ? "" : EntityUtils.toString(entity, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new DropboxAuthException("requesting " + operation + " failed: " + e.getMessage(), e);
        }

        if (status != HttpStatus.SC_OK) {
            throw new DropboxAuthException(operation + " failed (HTTP " + status + "): " + body);
        }
        try {
            return objectMapper.readValue(body, TokenResponse.class);
        } catch (JsonProcessingException e) {
            throw new DropboxAuthException("decoding " + operation + " response failed", e);
        }
    }
}
