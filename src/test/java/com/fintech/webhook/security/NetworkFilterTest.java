package com.fintech.webhook.security;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NetworkFilterTest {

    @Test
    void admit_matchesSingleHostsAndPrefixes() {
        NetworkFilter filter = new NetworkFilter(List.of("127.0.0.1", "10.0.0.0/8", "2001:db8::/32"));

        assertTrue(filter.admit("127.0.0.1"));
        assertTrue(filter.admit("10.200.3.4"));
        assertTrue(filter.admit("2001:db8:0:1::5"));

        assertFalse(filter.admit("127.0.0.2"));
        assertFalse(filter.admit("11.0.0.1"));
        assertFalse(filter.admit("2001:db9::1"));
    }

    @Test
    void admit_rejectsUnparseableCallers() {
        NetworkFilter filter = new NetworkFilter(List.of("0.0.0.0/0"));

        assertFalse(filter.admit("localhost"));
        assertFalse(filter.admit("256.1.1.1"));
        assertFalse(filter.admit(""));
        assertFalse(filter.admit(null));
    }

    @Test
    void malformedEntries_areSkipped() {
        NetworkFilter filter = new NetworkFilter(List.of("not-a-network", "10.0.0.0/33", "192.168.1.0/24"));

        assertEquals(1, filter.getTrustedNetworks().size());
        assertTrue(filter.admit("192.168.1.200"));
    }

    @Test
    void emptyNetworkSet_rejectsEveryone() {
        NetworkFilter filter = new NetworkFilter(List.of());

        assertFalse(filter.admit("127.0.0.1"));
    }

    @Test
    void parse_masksHostBits() {
        IpNetwork network = IpNetwork.parse("192.168.1.77/24");

        assertEquals("192.168.1.0/24", network.toString());
        assertTrue(network.contains("192.168.1.1"));
        assertFalse(network.contains("192.168.2.1"));
    }

    @Test
    void parse_bareAddressIsSingleHost() {
        assertEquals(32, IpNetwork.parse("203.0.113.5").getPrefixLength());
        assertEquals(128, IpNetwork.parse("::1").getPrefixLength());
    }

    @Test
    void ipv4Network_doesNotMatchIpv6Caller() {
        IpNetwork network = IpNetwork.parse("0.0.0.0/0");

        assertFalse(network.contains("::1"));
    }

    @Test
    void parse_rejectsInvalidEntries() {
        assertThrows(IllegalArgumentException.class, () -> IpNetwork.parse("10.0.0.0/abc"));
        assertThrows(IllegalArgumentException.class, () -> IpNetwork.parse("1.2.3"));
        assertThrows(IllegalArgumentException.class, () -> IpNetwork.parse("example.com"));
        assertThrows(IllegalArgumentException.class, () -> IpNetwork.parse(" "));
    }
}
