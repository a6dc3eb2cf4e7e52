package tech.keyledger.api;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ClientIpResolverTest {

    @Test
    void resolve_prefersFirstForwardedFor() {
        assertEquals("203.0.113.9", ClientIpResolver.resolve(" 203.0.113.9 , 10.0.0.1", "10.0.0.2", "10.0.0.3"));
    }

    @Test
    void resolve_fallsBackToRealIp() {
        assertEquals("198.51.100.4", ClientIpResolver.resolve(" ", "198.51.100.4", "10.0.0.3"));
        assertEquals("198.51.100.4", ClientIpResolver.resolve(",10.0.0.1", "198.51.100.4", "10.0.0.3"));
    }

    @Test
    void resolve_skipsHeaderValues_thatAreNotIpLiterals() {
        assertEquals("198.51.100.4", ClientIpResolver.resolve("attacker-chosen-id, 10.0.0.1", "198.51.100.4", "10.0.0.3"));
        assertEquals("10.0.0.3", ClientIpResolver.resolve("unknown", "999.1.1.1", "10.0.0.3"));
        assertEquals("10.0.0.3", ClientIpResolver.resolve(null, "localhost", "10.0.0.3"));
    }

    @Test
    void resolve_acceptsIpv6Literals() {
        assertEquals("2001:db8::1", ClientIpResolver.resolve("2001:db8::1", null, "10.0.0.3"));
        assertEquals("::ffff:10.0.0.9", ClientIpResolver.resolve(null, "::ffff:10.0.0.9", "10.0.0.3"));
    }

    @Test
    void resolve_fallsBackToRemoteAddress() {
        assertEquals("10.0.0.3", ClientIpResolver.resolve(null, null, "10.0.0.3"));
    }

    @Test
    void resolve_returnsUnknown_whenNothingAvailable() {
        assertEquals(ClientIpResolver.UNKNOWN, ClientIpResolver.resolve(null, "", null));
    }
}
