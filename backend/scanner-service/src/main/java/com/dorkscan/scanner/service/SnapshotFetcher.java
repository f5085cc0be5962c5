package com.dorkscan.scanner.service;

import com.dorkscan.scanner.config.ScanProperties;
import com.dorkscan.scanner.config.WebClientConfig;
import com.dorkscan.scanner.model.PageSnapshot;
import io.netty.handler.codec.http.HttpHeaderNames;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.netty.ByteBufFlux;
import reactor.netty.http.client.HttpClient;
import reactor.netty.http.client.HttpClientResponse;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Fetches a result URL and keeps only what the sensitive-content check needs: the final URL,
 * status, page title and a bounded excerpt of the body. Only the first bytes of the body are
 * read, so the title is taken from that prefix. Failures come back as error snapshots, never
 * as errors.
 */
@Component
public class SnapshotFetcher {

    private static final Logger log = LoggerFactory.getLogger(SnapshotFetcher.class);

    private final HttpClient client;
    private final Duration timeout;
    private final int excerptLength;
    private final int byteBudget;

    public SnapshotFetcher(HttpClient scannerHttpClient, ScanProperties scan) {
        this.timeout = scan.snapshotTimeout();
        this.excerptLength = scan.excerptLength();
        // a UTF-8 char takes at most 4 bytes
        this.byteBudget = Math.multiplyExact(excerptLength, 4);
        this.client = scannerHttpClient
                .followRedirect(true)
                .responseTimeout(timeout)
                .headers(h -> h.set(HttpHeaderNames.USER_AGENT, WebClientConfig.USER_AGENT));
    }

    public Mono<PageSnapshot> fetch(String url) {
        return client.get()
                .uri(url)
                .response((response, content) -> toSnapshot(url, response, content))
                .next()
                .timeout(timeout)
                .onErrorResume(e -> {
                    String message = Failures.describe(e, timeout);
                    log.warn("Snapshot of {} failed: {}", url, message);
                    return Mono.just(PageSnapshot.failed(url, message));
                });
    }

    // stops reading once enough bytes for the excerpt arrived; the rest of the body is never pulled
    private Mono<byte[]> readPrefix(ByteBufFlux content) {
        return Mono.defer(() -> {
            ByteArrayOutputStream prefix = new ByteArrayOutputStream();
            return content.asByteArray()
                    .doOnNext(chunk -> prefix.write(chunk, 0, Math.min(chunk.length, byteBudget - prefix.size())))
                    .takeUntil(chunk -> prefix.size() >= byteBudget)
                    .then(Mono.fromCallable(prefix::toByteArray));
        });
    }

    private Mono<PageSnapshot> toSnapshot(String requested, HttpClientResponse response, ByteBufFlux content) {
        String resolved = resolvedUrl(requested, response);
        int status = response.status().code();
        if (status < 200 || status >= 300) {
            return Mono.just(PageSnapshot.failed(resolved, status + ", message='" + response.status().reasonPhrase() + "'"));
        }
        return readPrefix(content).map(bytes -> {
            String text = new String(bytes, StandardCharsets.UTF_8);
            return PageSnapshot.ok(resolved, status, extractTitle(text), excerpt(text));
        });
    }

    private static String resolvedUrl(String requested, HttpClientResponse response) {
        return response.resourceUrl() != null ? response.resourceUrl() : requested;
    }

    String excerpt(String text) {
        return text.length() > excerptLength ? text.substring(0, excerptLength) : text;
    }

    // absence of a title is not an error
    static String extractTitle(String html) {
        try {
            String title = Jsoup.parse(html).title().trim();
            return title.isEmpty() ? null : title;
        } catch (RuntimeException e) {
            return null;
        }
    }
}
