package com.llmbridge.providers;

import com.llmbridge.errors.BackendErrorKind;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.http.HttpHeaders;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HttpErrorsTest {

    @Test
    void classifiesStatusCodes() {
        assertEquals(BackendErrorKind.AUTH, HttpErrors.classify(401));
        assertEquals(BackendErrorKind.AUTH, HttpErrors.classify(403));
        assertEquals(BackendErrorKind.QUOTA, HttpErrors.classify(429));
        assertEquals(BackendErrorKind.TIMEOUT, HttpErrors.classify(408));
        assertEquals(BackendErrorKind.TIMEOUT, HttpErrors.classify(504));
        assertEquals(BackendErrorKind.INVALID_REQUEST, HttpErrors.classify(400));
        assertEquals(BackendErrorKind.INVALID_REQUEST, HttpErrors.classify(404));
        assertEquals(BackendErrorKind.SERVER, HttpErrors.classify(500));
        assertEquals(BackendErrorKind.SERVER, HttpErrors.classify(529));
        assertEquals(BackendErrorKind.UNKNOWN, HttpErrors.classify(302));
    }

    @Test
    void retryAfterFromBodyWhenHeaderMissing() {
        var ex = HttpErrors.fromResponse("openai", 429, null,
                "{\"error\": {\"message\": \"Please retry after 1.5 seconds\", \"retry_after\": 1.5}}");

        assertEquals(Duration.ofMillis(1500), ex.retryAfter());
        assertTrue(ex.retryable());
    }

    @Test
    void headerWinsOverBody() {
        var headers = HttpHeaders.of(Map.of("Retry-After", List.of("4")), (a, b) -> true);

        var ex = HttpErrors.fromResponse("openai", 429, headers, "{\"retry_after\": 9}");

        assertEquals(Duration.ofSeconds(4), ex.retryAfter());
    }

    @Test
    void quotaWithoutHintIsPermanent() {
        var ex = HttpErrors.fromResponse("openai", 429, null, "{\"error\": \"insufficient_quota\"}");

        assertNull(ex.retryAfter());
        assertFalse(ex.retryable());
    }

    @Test
    void retryAfterIsCapped() {
        assertEquals(Duration.ofSeconds(30), HttpErrors.parseSeconds("3600"));
        assertNull(HttpErrors.parseSeconds("Wed, 21 Oct 2015 07:28:00 GMT"));
        assertNull(HttpErrors.parseSeconds("-1"));
        assertNull(HttpErrors.parseRetryAfter("no hint here"));
    }

    @Test
    void longBodiesAreTruncated() {
        var ex = HttpErrors.fromResponse("deepseek", 500, null, "x".repeat(2_000));

        assertTrue(ex.getMessage().length() < 600);
        assertTrue(ex.getMessage().endsWith("..."));
        assertEquals(500, ex.statusCode());
        assertEquals("deepseek", ex.backend());
    }

    @Test
    void ioFailures() {
        assertEquals(BackendErrorKind.TIMEOUT, HttpErrors.fromIo("x", new HttpTimeoutException("slow")).backendKind());
        assertEquals(BackendErrorKind.SERVER, HttpErrors.fromIo("x", new IOException("refused")).backendKind());
    }

    @Test
    void interruptRestoresFlag() {
        var ex = HttpErrors.interrupted("x", new InterruptedException());

        assertTrue(Thread.interrupted());
        assertEquals(BackendErrorKind.TIMEOUT, ex.backendKind());
    }
}
