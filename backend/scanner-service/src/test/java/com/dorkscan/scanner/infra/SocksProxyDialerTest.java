package com.dorkscan.scanner.infra;

import org.junit.jupiter.api.Test;
import reactor.netty.http.client.HttpClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SocksProxyDialerTest {

    @Test
    void describesProxyRoute() {
        assertThat(new SocksProxyDialer("127.0.0.1", 9050).describe()).isEqualTo("socks5://127.0.0.1:9050");
    }

    @Test
    void configuresProxyOnClient() {
        HttpClient base = HttpClient.create();

        HttpClient proxied = new SocksProxyDialer("127.0.0.1", 9050).configure(base);

        assertThat(proxied).isNotSameAs(base);
        assertThat(proxied.configuration().hasProxy()).isTrue();
    }

    @Test
    void rejectsBlankHostAndBadPort() {
        assertThatThrownBy(() -> new SocksProxyDialer(" ", 9050))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SocksProxyDialer("localhost", 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("out of range");
        assertThatThrownBy(() -> new SocksProxyDialer("localhost", 70000))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void directDialerLeavesClientUntouched() {
        HttpClient base = HttpClient.create();
        DirectDialer dialer = new DirectDialer();

        assertThat(dialer.configure(base)).isSameAs(base);
        assertThat(dialer.describe()).isEqualTo("direct");
    }
}
