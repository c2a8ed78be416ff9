package ch.so.arp.nexa.error;

import java.util.concurrent.TimeoutException;

import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Classifies failures of remote backend calls. Timeouts, transport errors,
 * server errors and rate limiting are worth one more attempt; client errors
 * such as a rejected API key are not.
 */
public final class TransientFailures {

    private TransientFailures() {
    }

    public static boolean isTransient(Throwable failure) {
        if (failure instanceof TimeoutException || failure instanceof WebClientRequestException) {
            return true;
        }
        if (failure instanceof WebClientResponseException response) {
            return response.getStatusCode().is5xxServerError() || response.getStatusCode().value() == 429;
        }
        return false;
    }
}
