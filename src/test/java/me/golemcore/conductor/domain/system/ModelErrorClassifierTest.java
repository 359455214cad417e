package me.golemcore.conductor.domain.system;

import me.golemcore.conductor.domain.model.ModelApiException;
import org.junit.jupiter.api.Test;

import java.net.SocketTimeoutException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ModelErrorClassifierTest {

    @Test
    void shouldClassifyHttpStatuses() {
        assertEquals(ModelErrorClassifier.NETWORK, ModelErrorClassifier.classifyStatus(0));
        assertEquals(ModelErrorClassifier.RATE_LIMIT, ModelErrorClassifier.classifyStatus(429));
        assertEquals(ModelErrorClassifier.AUTHENTICATION, ModelErrorClassifier.classifyStatus(401));
        assertEquals(ModelErrorClassifier.AUTHENTICATION, ModelErrorClassifier.classifyStatus(403));
        assertEquals(ModelErrorClassifier.REQUEST_TIMEOUT, ModelErrorClassifier.classifyStatus(408));
        assertEquals(ModelErrorClassifier.SERVER_BUSY, ModelErrorClassifier.classifyStatus(529));
        assertEquals(ModelErrorClassifier.INVALID_REQUEST, ModelErrorClassifier.classifyStatus(400));
        assertEquals(ModelErrorClassifier.UNKNOWN, ModelErrorClassifier.classifyStatus(302));
    }

    @Test
    void shouldFindApiExceptionInCauseChain() {
        Throwable wrapped = new CompletionException(new ModelApiException("slow down", 429));

        assertEquals(ModelErrorClassifier.RATE_LIMIT, ModelErrorClassifier.classifyFromThrowable(wrapped));
    }

    @Test
    void shouldRecognizeTimeoutsAndCancellation() {
        assertEquals(ModelErrorClassifier.REQUEST_TIMEOUT,
                ModelErrorClassifier.classifyFromThrowable(new RuntimeException(new SocketTimeoutException())));
        assertEquals(ModelErrorClassifier.REQUEST_ABORTED,
                ModelErrorClassifier.classifyFromThrowable(new CancellationException()));
        assertEquals(ModelErrorClassifier.UNKNOWN,
                ModelErrorClassifier.classifyFromThrowable(new IllegalStateException("odd")));
    }

    @Test
    void shouldProduceUserFacingMessages() {
        assertEquals("Too many requests. Please wait 60 seconds.",
                ModelErrorClassifier.userMessage(new ModelApiException("rate", 429)));
        assertEquals("Invalid API key. Please check your configuration in Settings.",
                ModelErrorClassifier.userMessage(new ModelApiException("bad key", 401)));
        assertEquals("AI service is busy. Retrying automatically...",
                ModelErrorClassifier.userMessage(new ModelApiException("overloaded", 503)));
        assertEquals("Operation timed out after 120s. The file may be too large.",
                ModelErrorClassifier.userMessage(new ModelApiException("timeout", 408)));
    }

    @Test
    void shouldFallBackToRootMessage() {
        assertEquals("Sorry, I encountered an error: prompt is too long",
                ModelErrorClassifier.userMessage(
                        new CompletionException(new ModelApiException("prompt is too long", 400))));
        assertEquals("Sorry, I encountered an error: disk full",
                ModelErrorClassifier.userMessage(new RuntimeException("wrapper", new IllegalStateException("disk full"))));
    }
}
