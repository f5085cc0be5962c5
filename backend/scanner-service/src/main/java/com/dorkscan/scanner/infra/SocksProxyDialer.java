package com.dorkscan.scanner.infra;

import reactor.netty.http.client.HttpClient;
import reactor.netty.transport.ProxyProvider;

/**
 * Routes every connection through a SOCKS5 proxy at {@code host:port}.
 */
public class SocksProxyDialer implements Dialer {

    private final String host;
    private final int port;

    public SocksProxyDialer(String host, int port) {
        if (host == null || host.isBlank()) throw new IllegalArgumentException("proxy host is required");
        if (port < 1 || port > 65535) throw new IllegalArgumentException("proxy port out of range: " + port);
        this.host = host;
        this.port = port;
    }

    @Override
    public HttpClient configure(HttpClient client) {
        return client.proxy(spec -> spec.type(ProxyProvider.Proxy.SOCKS5)
                .host(host)
                .port(port));
    }

    @Override
    public String describe() {
        return "socks5://" + host + ":" + port;
    }
}
