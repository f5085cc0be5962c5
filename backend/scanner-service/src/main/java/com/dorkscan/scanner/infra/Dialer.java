package com.dorkscan.scanner.infra;

import reactor.netty.http.client.HttpClient;

/**
 * Decides how outbound connections are opened. Applied once to the shared {@link HttpClient}
 * when it is built, so every search and snapshot request goes through the same route.
 */
public interface Dialer {

    HttpClient configure(HttpClient client);

    String describe();
}
