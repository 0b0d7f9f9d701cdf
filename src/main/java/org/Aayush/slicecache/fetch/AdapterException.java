package org.Aayush.slicecache.fetch;

/**
 * Failure reported by a {@link FetchAdapter}, classified as retryable or terminal.
 *
 * <p>The dispatcher only reports the classification; retry and backoff belong to the caller.</p>
 */
public class AdapterException extends Exception {
    private final boolean retryable;

    public AdapterException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public AdapterException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
