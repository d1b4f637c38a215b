package com.example.cloudbeatsbackup.common.exception;

public class DropboxApiException extends BackupException {

    public static final String CODE = "DROPBOX_API_ERROR";

    private final String endpoint;
    private final int statusCode;
    private final String responseBody;

    public DropboxApiException(String endpoint, int statusCode, String responseBody) {
        this(endpoint, statusCode, responseBody,
                "Dropbox API error " + statusCode + " on " + endpoint + ": " + responseBody, null);
    }

    public DropboxApiException(String endpoint, int statusCode, String responseBody, String message, Throwable cause) {
        super(CODE, message, null, cause);
        this.endpoint = endpoint;
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public String getEndpoint() {
        return endpoint;
    }

    /**
     * HTTP status of the failed call, or 0 when the request never got a response.
     */
    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
