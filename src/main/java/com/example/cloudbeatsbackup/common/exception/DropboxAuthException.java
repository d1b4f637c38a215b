package com.example.cloudbeatsbackup.common.exception;

/**
 * Invalid or expired bearer token, rejected refresh credentials or a failed code exchange.
 * Never retried: the operator has to re-authenticate.
 */
public class DropboxAuthException extends BackupException {

    public static final String CODE = "DROPBOX_AUTH_FAILED";

    public DropboxAuthException(String message) {
        this(message, null);
    }

    public DropboxAuthException(String message, Throwable cause) {
        super(CODE, message,
                "Check the app key, app secret and refresh token, or generate a new token at "
                        + "https://www.dropbox.com/developers/apps",
                cause);
    }
}
