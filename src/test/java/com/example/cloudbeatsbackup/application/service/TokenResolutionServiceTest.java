package com.example.cloudbeatsbackup.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.cloudbeatsbackup.common.config.AppRunProperties;
import com.example.cloudbeatsbackup.common.exception.ConfigurationException;
import com.example.cloudbeatsbackup.domain.model.Credentials;
import com.example.cloudbeatsbackup.infrastructure.credentials.CredentialStore;
import com.example.cloudbeatsbackup.infrastructure.dropbox.DropboxOAuthClient;
import java.io.IOException;
import java.nio.file.Paths;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TokenResolutionServiceTest {

    private DropboxOAuthClient oauthClient;
    private CredentialStore credentialStore;
    private TokenResolutionService tokenResolutionService;
    private AppRunProperties options;

    @BeforeEach
    void setUp() throws Exception {
        oauthClient = mock(DropboxOAuthClient.class);
        credentialStore = mock(CredentialStore.class);
        when(credentialStore.load()).thenReturn(Optional.empty());
        when(credentialStore.getFile()).thenReturn(Paths.get("/cfg/credentials.json"));
        tokenResolutionService = new TokenResolutionService(oauthClient, credentialStore);
        options = new AppRunProperties();
    }

    @Test
    void explicitTripleShouldWinOverEverythingElse() throws Exception {
        options.setAppKey("k");
        options.setAppSecret("s");
        options.setRefreshToken("r");
        options.setToken("direct");
        when(credentialStore.load()).thenReturn(Optional.of(new Credentials("k2", "s2", "r2")));
        when(oauthClient.refreshAccessToken("k", "s", "r")).thenReturn("fresh");

        assertEquals("fresh", tokenResolutionService.resolve(options));
        verify(credentialStore, never()).load();
    }

    @Test
    void storedCredentialsShouldBeUsedBeforeDirectToken() throws Exception {
        options.setToken("direct");
        when(credentialStore.load()).thenReturn(Optional.of(new Credentials("k2", "s2", "r2")));
        when(oauthClient.refreshAccessToken("k2", "s2", "r2")).thenReturn("from-store");

        assertEquals("from-store", tokenResolutionService.resolve(options));
    }

    @Test
    void partialTripleShouldFallThroughToDirectToken() {
        options.setAppKey("k");
        options.setToken(" direct ");

        assertEquals("direct", tokenResolutionService.resolve(options));
        verify(oauthClient, never()).refreshAccessToken(anyString(), anyString(), anyString());
    }

    @Test
    void unreadableStoreShouldBeSkipped() throws Exception {
        when(credentialStore.load()).thenThrow(new IOException("permission denied"));
        options.setToken("direct");

        assertEquals("direct", tokenResolutionService.resolve(options));
    }

    @Test
    void shouldExplainOptionsWhenNothingAvailable() {
        ConfigurationException error = assertThrows(ConfigurationException.class,
                () -> tokenResolutionService.resolve(options));

        assertTrue(error.getUserAction().contains("--refresh-token"));
        assertTrue(error.getUserAction().contains("--token"));
        assertTrue(error.getUserAction().contains("credentials.json"));
        assertFalse(tokenResolutionService.hasCredentials(options));
    }
}
