package com.druidio.client;

/**
 * Failure of a single query. The client stays usable after it.
 *
 * For {@link ErrorKind#SERVER} and {@link ErrorKind#RESPONSE_PARSING} the
 * broker's response body is kept, cut to {@link #MAX_BODY_LENGTH} characters.
 */
public class DruidClientException extends RuntimeException {

    static final int MAX_BODY_LENGTH = 16 * 1024;

    private final ErrorKind kind;
    private final String responseBody;

    public DruidClientException(ErrorKind kind, String message) {
        this(kind, message, null, null);
    }

    public DruidClientException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, null, cause);
    }

    public DruidClientException(ErrorKind kind, String message, String responseBody, Throwable cause) {
        super(message, cause);
        this.kind = kind == null ? ErrorKind.UNKNOWN : kind;
        this.responseBody = excerpt(responseBody);
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * @return the (possibly truncated) response body, or {@code null} when none was received
     */
    public String getResponseBody() {
        return responseBody;
    }

    @Override
    public String getMessage() {
        return super.getMessage() + " [Kind: " + kind + "]";
    }

    static String excerpt(String body) {
        if (body == null || body.length() <= MAX_BODY_LENGTH) {
            return body;
        }
        return body.substring(0, MAX_BODY_LENGTH) + "... [truncated " + (body.length() - MAX_BODY_LENGTH) + " chars]";
    }
}
