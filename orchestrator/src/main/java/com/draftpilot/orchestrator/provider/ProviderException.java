package com.draftpilot.orchestrator.provider;

/**
 * A provider call failed. {@link #kind()} decides how the failure is handled:
 * transient kinds are retried, fatal kinds fail the job.
 */
public class ProviderException extends RuntimeException {

    public enum Kind {
        RATE_LIMITED(true),
        TIMEOUT(true),
        CONNECTION(true),
        SERVER_ERROR(true),
        MALFORMED_RESPONSE(true),
        AUTH(false),
        BAD_REQUEST(false);

        private final boolean retryable;

        Kind(boolean retryable) {
            this.retryable = retryable;
        }

        public boolean retryable() { return retryable; }
    }

    private final Kind   kind;
    private final Vendor vendor;
    private final int    statusCode;

    public ProviderException(Kind kind, Vendor vendor, String message) {
        this(kind, vendor, -1, message, null);
    }

    public ProviderException(Kind kind, Vendor vendor, String message, Throwable cause) {
        this(kind, vendor, -1, message, cause);
    }

    public ProviderException(Kind kind, Vendor vendor, int statusCode, String message, Throwable cause) {
        super("[" + vendor + " " + kind + "] " + message, cause);
        this.kind       = kind;
        this.vendor     = vendor;
        this.statusCode = statusCode;
    }

    /** Maps an unsuccessful HTTP status to a failure kind. */
    public static ProviderException fromStatus(Vendor vendor, int statusCode, String body) {
        Kind kind;
        if (statusCode == 429) {
            kind = Kind.RATE_LIMITED;
        } else if (statusCode == 408) {
            kind = Kind.TIMEOUT;
        } else if (statusCode == 401 || statusCode == 403) {
            kind = Kind.AUTH;
        } else if (statusCode >= 500) {
            kind = Kind.SERVER_ERROR;   // includes Anthropic's 529 "overloaded"
        } else {
            kind = Kind.BAD_REQUEST;
        }
        return new ProviderException(kind, vendor, statusCode,
                "HTTP %d: %s".formatted(statusCode, abbreviate(body)), null);
    }

    public boolean isRetryable() { return kind.retryable(); }
    public Kind    kind()        { return kind; }
    public Vendor  vendor()      { return vendor; }
    public int     statusCode()  { return statusCode; }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= 500 ? body : body.substring(0, 500) + "...";
    }
}
