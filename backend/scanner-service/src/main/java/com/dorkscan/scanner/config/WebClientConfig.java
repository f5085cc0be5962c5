package com.dorkscan.scanner.config;

import com.dorkscan.scanner.infra.Dialer;
import com.dorkscan.scanner.infra.DirectDialer;
import com.dorkscan.scanner.infra.SocksProxyDialer;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.Http11SslContextSpec;
import reactor.netty.http.client.HttpClient;

@Configuration
public class WebClientConfig {

    private static final Logger log = LoggerFactory.getLogger(WebClientConfig.class);

    public static final String USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/91.0.4472.124 Safari/537.36";

    private static final int MAX_IN_MEMORY_BYTES = 2 * 1024 * 1024;

    @Bean
    Dialer dialer(ProxyProperties proxy) {
        Dialer dialer = proxy.enabled()
                ? new SocksProxyDialer(proxy.host(), proxy.port())
                : new DirectDialer();
        log.info("Outbound route: {}", dialer.describe());
        return dialer;
    }

    @Bean
    HttpClient scannerHttpClient(Dialer dialer, ScanProperties scan) {
        HttpClient client = HttpClient.create();
        if (scan.ignoreSsl()) {
            log.warn("TLS certificate verification is disabled");
            client = client.secure(spec -> spec.sslContext(Http11SslContextSpec.forClient()
                    .configure(builder -> builder.trustManager(InsecureTrustManagerFactory.INSTANCE))));
        }
        return dialer.configure(client);
    }

    @Bean
    WebClient googleCseWebClient(HttpClient scannerHttpClient, GoogleCseProperties cse, ScanProperties scan) {
        return WebClient.builder()
                .baseUrl(cse.baseUrl())
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
                .clientConnector(new ReactorClientHttpConnector(scannerHttpClient.responseTimeout(scan.searchTimeout())))
                .build();
    }

    @Bean
    WebClient duckDuckGoWebClient(HttpClient scannerHttpClient, DuckDuckGoProperties ddg, ScanProperties scan) {
        return WebClient.builder()
                .baseUrl(ddg.baseUrl())
                .defaultHeader(HttpHeaders.USER_AGENT, USER_AGENT)
                .defaultHeader(HttpHeaders.ACCEPT, "text/html,application/xhtml+xml,application/xml;q=0.9,"
                        + "image/avif,image/webp,*/*;q=0.8")
                .defaultHeader(HttpHeaders.ACCEPT_LANGUAGE, "en-US,en;q=0.9")
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
                .clientConnector(new ReactorClientHttpConnector(scannerHttpClient.responseTimeout(scan.searchTimeout())))
                .build();
    }
}
