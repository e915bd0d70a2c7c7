package io.controlplane.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for IpUtils.
 */
class IpUtilsTest {

    @Test
    void testIsIpAddress() {
        assertThat(IpUtils.isIpAddress("192.168.1.10")).isTrue();
        assertThat(IpUtils.isIpAddress("::1")).isTrue();
        assertThat(IpUtils.isIpAddress("256.1.1.1")).isFalse();
        assertThat(IpUtils.isIpAddress("example.com")).isFalse();
        assertThat(IpUtils.isIpAddress(null)).isFalse();
    }

    @Test
    void testNthAddress() {
        assertThat(IpUtils.nthAddress("10.96.0.0/12", 10)).isEqualTo("10.96.0.10");
        assertThat(IpUtils.nthAddress("10.96.0.0/12", 1)).isEqualTo("10.96.0.1");
    }

    @Test
    void testNthAddressOutsideRange() {
        assertThatThrownBy(() -> IpUtils.nthAddress("10.0.0.0/30", 10))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testIsCidr() {
        assertThat(IpUtils.isCidr("10.244.0.0/16")).isTrue();
        assertThat(IpUtils.isCidr("10.244.0.0/33")).isFalse();
        assertThat(IpUtils.isCidr("10.244.0.0")).isFalse();
    }
}
