package com.kickoff.tipping.service.source;

public class SourceFetchException extends RuntimeException {

    static final int BODY_LIMIT = 300;

    // -1 when the request never got a response
    private final int statusCode;
    private final String body;

    public SourceFetchException(String sourceName, int statusCode, String body) {
        super(sourceName + " HTTP " + statusCode + ": " + truncate(body));
        this.statusCode = statusCode;
        this.body = truncate(body);
    }

    public SourceFetchException(String sourceName, String reason, Throwable cause) {
        super(sourceName + " connection error: " + reason, cause);
        this.statusCode = -1;
        this.body = "";
    }

    public int getStatusCode() { return statusCode; }

    public String getBody() { return body; }

    static String truncate(String body) {
        if (body == null) return "";
        return body.length() <= BODY_LIMIT ? body : body.substring(0, BODY_LIMIT);
    }
}
