package com.dorkscan.scanner.infra;

import reactor.netty.http.client.HttpClient;

public class DirectDialer implements Dialer {

    @Override
    public HttpClient configure(HttpClient client) {
        return client;
    }

    @Override
    public String describe() {
        return "direct";
    }
}
