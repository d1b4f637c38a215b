package com.example.cloudbeatsbackup.application.service;

import com.example.cloudbeatsbackup.common.config.AppRunProperties;
import com.example.cloudbeatsbackup.common.exception.ConfigurationException;
import com.example.cloudbeatsbackup.domain.model.AuthorizationGrant;
import com.example.cloudbeatsbackup.domain.model.Credentials;
import com.example.cloudbeatsbackup.infrastructure.credentials.CredentialStore;
import com.example.cloudbeatsbackup.infrastructure.dropbox.DropboxOAuthClient;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * First-run authorization in a terminal: asks for the app key and secret, has the user approve the app in a
 * browser, exchanges the pasted code and stores the resulting refresh credentials.
 */
@Service
public class InteractiveSetupService {

    private static final Logger log = LoggerFactory.getLogger(InteractiveSetupService.class);

    private final DropboxOAuthClient oauthClient;
    private final CredentialStore credentialStore;
    private final BufferedReader in;
    private final PrintStream out;
    private final BooleanSupplier consoleAttached;
    private final Consumer<String> browserLauncher;

    @Autowired
    public InteractiveSetupService(DropboxOAuthClient oauthClient, CredentialStore credentialStore) {
        this(oauthClient, credentialStore,
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                System.out,
                () -> System.console() != null,
                InteractiveSetupService::openBrowser);
    }

    InteractiveSetupService(DropboxOAuthClient oauthClient, CredentialStore credentialStore,
                            BufferedReader in, PrintStream out,
                            BooleanSupplier consoleAttached, Consumer<String> browserLauncher) {
        this.oauthClient = oauthClient;
        this.credentialStore = credentialStore;
        this.in = in;
        this.out = out;
        this.consoleAttached = consoleAttached;
        this.browserLauncher = browserLauncher;
    }

    public boolean isAvailable() {
        return consoleAttached.getAsBoolean();
    }

    public AuthorizationGrant run(AppRunProperties options) {
        out.println("No Dropbox credentials found. Starting one-time setup.");
        out.println("Create an app at https://www.dropbox.com/developers/apps with files.metadata.read access.");

        String appKey = StringUtils.hasText(options.getAppKey()) ? options.getAppKey().trim() : prompt("App key: ");
        String appSecret = StringUtils.hasText(options.getAppSecret())
                ? options.getAppSecret().trim() : prompt("App secret: ");

        String url = oauthClient.authorizationUrl(appKey);
        out.println();
        out.println("Open this URL, allow access and paste the authorization code below:");
        out.println("  " + url);
        browserLauncher.accept(url);

        String code = prompt("Authorization code: ");
        AuthorizationGrant grant = oauthClient.exchangeAuthorizationCode(appKey, appSecret, code);

        try {
            credentialStore.save(new Credentials(appKey, appSecret, grant.getRefreshToken()));
        } catch (IOException e) {
            throw new ConfigurationException("saving credentials to " + credentialStore.getFile() + " failed: "
                    + e.getMessage(), "Check that the config directory is writable", e);
        }
        out.println("Credentials saved to " + credentialStore.getFile());
        return grant;
    }

    private String prompt(String label) {
        out.print(label);
        out.flush();
        String line;
        try {
            line = in.readLine();
        } catch (IOException e) {
            throw new ConfigurationException("reading from the terminal failed: " + e.getMessage(), null, e);
        }
        if (!StringUtils.hasText(line)) {
            throw new ConfigurationException("setup aborted: no value entered for " + label.replace(":", "").trim());
        }
        return line.trim();
    }

    static void openBrowser(String url) {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        ProcessBuilder command;
        if (os.contains("mac")) {
            command = new ProcessBuilder("open", url);
        } else if (os.contains("win")) {
            command = new ProcessBuilder("rundll32", "url.dll,FileProtocolHandler", url);
        } else {
            command = new ProcessBuilder("xdg-open", url);
        }
        try {
            command.redirectErrorStream(true).redirectOutput(ProcessBuilder.Redirect.DISCARD).start();
        } catch (IOException e) {
            log.debug("Could not open a browser: {}", e.getMessage());
        }
    }
}
