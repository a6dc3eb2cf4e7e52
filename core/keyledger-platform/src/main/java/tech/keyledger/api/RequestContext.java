package tech.keyledger.api;

import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.net.SocketAddress;
import jakarta.ws.rs.core.HttpHeaders;

/**
 * Client address and user agent of the current request.
 */
record RequestContext(String clientIp, String userAgent) {

    static RequestContext of(HttpHeaders headers, HttpServerRequest request) {
        SocketAddress remote = request != null ? request.remoteAddress() : null;
        String ip = ClientIpResolver.resolve(
            headers.getHeaderString("X-Forwarded-For"),
            headers.getHeaderString("X-Real-IP"),
            remote != null ? remote.hostAddress() : null
        );
        return new RequestContext(ip, headers.getHeaderString(HttpHeaders.USER_AGENT));
    }
}
