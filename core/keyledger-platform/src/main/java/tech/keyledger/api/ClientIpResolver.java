package tech.keyledger.api;

import io.netty.util.NetUtil;

/**
 * Picks the client address for rate limiting and activation records.
 *
 * <p>Order: first entry of {@code X-Forwarded-For}, then {@code X-Real-IP}, then the
 * socket peer. A header value is only used when it is an IPv4 or IPv6 literal, otherwise
 * the next source is tried. Valid header values are trusted as given, so the service must
 * sit behind a proxy that overwrites them.
 */
public final class ClientIpResolver {

    static final String UNKNOWN = "unknown";

    private ClientIpResolver() {
    }

    public static String resolve(String forwardedFor, String realIp, String remoteAddress) {
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            String first = forwardedFor.split(",", 2)[0].trim();
            if (isIpLiteral(first)) {
                return first;
            }
        }
        if (realIp != null && isIpLiteral(realIp.trim())) {
            return realIp.trim();
        }
        if (remoteAddress != null && !remoteAddress.isBlank()) {
            return remoteAddress.trim();
        }
        return UNKNOWN;
    }

    static boolean isIpLiteral(String value) {
        return !value.isEmpty() && (NetUtil.isValidIpV4Address(value) || NetUtil.isValidIpV6Address(value));
    }
}
