package com.example.cloudbeatsbackup.application.service;

import com.example.cloudbeatsbackup.common.config.AppRunProperties;
import com.example.cloudbeatsbackup.common.exception.ConfigurationException;
import com.example.cloudbeatsbackup.domain.model.Credentials;
import com.example.cloudbeatsbackup.infrastructure.credentials.CredentialStore;
import com.example.cloudbeatsbackup.infrastructure.dropbox.DropboxOAuthClient;
import java.io.IOException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Picks the bearer token for a run.
 *
 * <p>Order: an explicit app key, app secret and refresh token; then the stored credentials; then a
 * direct access token. The first two are exchanged for a fresh access token.
 */
@Service
public class TokenResolutionService {

    private static final Logger log = LoggerFactory.getLogger(TokenResolutionService.class);

    private final DropboxOAuthClient oauthClient;
    private final CredentialStore credentialStore;

    public TokenResolutionService(DropboxOAuthClient oauthClient, CredentialStore credentialStore) {
        this.oauthClient = oauthClient;
        this.credentialStore = credentialStore;
    }

    public String resolve(AppRunProperties options) {
        Credentials explicit = explicitCredentials(options);
        if (explicit.isComplete()) {
            log.info("DROPBOX_AUTH source=refresh-token");
            return refresh(explicit);
        }

        Optional<Credentials> stored = loadStored();
        if (stored.isPresent()) {
            log.info("DROPBOX_AUTH source=stored-credentials file={}", credentialStore.getFile());
            return refresh(stored.get());
        }

        if (StringUtils.hasText(options.getToken())) {
            log.info("DROPBOX_AUTH source=access-token");
            return options.getToken().trim();
        }

        throw new ConfigurationException("no Dropbox credentials available",
                "Provide --app-key, --app-secret and --refresh-token (or DROPBOX_APP_KEY, DROPBOX_APP_SECRET and "
                        + "DROPBOX_REFRESH_TOKEN); or run once in a terminal to store credentials in "
                        + credentialStore.getFile() + "; or pass a short-lived access token with --token "
                        + "(or DROPBOX_TOKEN)");
    }

    /**
     * True if {@link #resolve} has something to work with without asking the user.
     */
    public boolean hasCredentials(AppRunProperties options) {
        return explicitCredentials(options).isComplete()
                || loadStored().isPresent()
                || StringUtils.hasText(options.getToken());
    }

    private String refresh(Credentials credentials) {
        return oauthClient.refreshAccessToken(
                credentials.getAppKey().trim(), credentials.getAppSecret().trim(), credentials.getRefreshToken().trim());
    }

    private Optional<Credentials> loadStored() {
        try {
            return credentialStore.load().filter(Credentials::isComplete);
        } catch (IOException e) {
            log.warn("CREDENTIALS_UNREADABLE file={} reason={}", credentialStore.getFile(), e.getMessage());
            return Optional.empty();
        }
    }

    private static Credentials explicitCredentials(AppRunProperties options) {
        return new Credentials(options.getAppKey(), options.getAppSecret(), options.getRefreshToken());
    }
}
