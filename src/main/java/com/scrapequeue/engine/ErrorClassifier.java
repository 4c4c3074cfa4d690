package com.scrapequeue.engine;

import java.io.IOException;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import com.scrapequeue.core.QueueOverloadException;
import com.scrapequeue.core.RateLimitedException;
import com.scrapequeue.core.SchedulerClosedException;
import com.scrapequeue.core.TaskCancelledException;
import com.scrapequeue.core.TerminalValidationException;
import com.scrapequeue.core.TransientNetworkException;

/**
 * Decides whether a failed attempt deserves another one.
 *
 * <p>Retryable: {@link TransientNetworkException} (and its rate-limit subtype),
 * timeouts, I/O errors such as connection resets, and any other runtime failure
 * nobody classified. Terminal: {@link TerminalValidationException},
 * {@link IllegalArgumentException}, cancellation, a closed scheduler and thread
 * interruption.</p>
 */
public final class ErrorClassifier {

    private ErrorClassifier() {
    }

    /**
     * Strip the wrappers futures put around the real failure.
     *
     * @param error the caught throwable
     * @return the innermost meaningful cause
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    public static boolean isRetryable(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof TerminalValidationException
                || cause instanceof IllegalArgumentException
                || cause instanceof TaskCancelledException
                || cause instanceof SchedulerClosedException
                || cause instanceof QueueOverloadException
                || cause instanceof CancellationException
                || cause instanceof InterruptedException) {
            return false;
        }
        if (cause instanceof TransientNetworkException
                || cause instanceof TimeoutException
                || cause instanceof IOException) {
            return true;
        }
        return cause instanceof Exception;
    }

    /**
     * Whether the failure says the remote site is rate limiting us, either
     * typed or by the wording of the message.
     */
    public static boolean isRateLimited(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof RateLimitedException) {
            return true;
        }
        String message = cause.getMessage();
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        return lower.contains("rate limit")
                || lower.contains("too many requests")
                || lower.contains("temporarily blocked");
    }
}
