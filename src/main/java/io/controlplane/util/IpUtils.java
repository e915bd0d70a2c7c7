package io.controlplane.util;

import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.util.Collections;
import java.util.regex.Pattern;

/**
 * Address arithmetic for the network settings of the cluster configuration.
 */
@Slf4j
public final class IpUtils {

    private static final Pattern IPV4 = Pattern.compile("^(\\d{1,3})(\\.\\d{1,3}){3}$");
    private static final Pattern IPV6 = Pattern.compile("^[0-9a-fA-F:.]+$");

    private IpUtils() {
        // Utility class
    }

    /**
     * True if the value is an IPv4 or IPv6 literal. Host names are never resolved.
     */
    public static boolean isIpAddress(String value) {
        if (value == null || value.isBlank()) {
            return false;
        }
        if (IPV4.matcher(value).matches()) {
            for (String octet : value.split("\\.")) {
                if (Integer.parseInt(octet) > 255) {
                    return false;
                }
            }
        } else if (!(value.contains(":") && IPV6.matcher(value).matches())) {
            return false;
        }
        try {
            InetAddress.getByName(value);
            return true;
        } catch (UnknownHostException e) {
            return false;
        }
    }

    /**
     * Return the n-th address of a CIDR block, counting the network address as 0.
     *
     * @throws IllegalArgumentException if the CIDR is malformed or too small
     */
    public static String nthAddress(String cidr, int n) {
        if (cidr == null || !cidr.contains("/")) {
            throw new IllegalArgumentException("invalid CIDR: " + cidr);
        }
        String[] parts = cidr.split("/", 2);
        if (!isIpAddress(parts[0])) {
            throw new IllegalArgumentException("invalid CIDR address: " + cidr);
        }
        int prefix;
        try {
            prefix = Integer.parseInt(parts[1]);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid CIDR prefix: " + cidr, e);
        }
        try {
            byte[] raw = InetAddress.getByName(parts[0]).getAddress();
            int bits = raw.length * 8;
            if (prefix < 0 || prefix > bits) {
                throw new IllegalArgumentException("invalid CIDR prefix: " + cidr);
            }
            BigInteger size = BigInteger.ONE.shiftLeft(bits - prefix);
            if (BigInteger.valueOf(n).compareTo(size) >= 0) {
                throw new IllegalArgumentException("CIDR " + cidr + " has no address #" + n);
            }
            BigInteger mask = BigInteger.ONE.shiftLeft(bits).subtract(size);
            BigInteger network = new BigInteger(1, raw).and(mask);
            return toAddress(network.add(BigInteger.valueOf(n)), raw.length).getHostAddress();
        } catch (UnknownHostException e) {
            throw new IllegalArgumentException("invalid CIDR address: " + cidr, e);
        }
    }

    public static boolean isCidr(String cidr) {
        try {
            nthAddress(cidr, 0);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * First non-loopback IPv4 address of this host, or 127.0.0.1 if there is none.
     */
    public static String firstPublicAddress() {
        try {
            for (NetworkInterface nic : Collections.list(NetworkInterface.getNetworkInterfaces())) {
                if (!nic.isUp() || nic.isLoopback()) {
                    continue;
                }
                for (InetAddress address : Collections.list(nic.getInetAddresses())) {
                    if (address instanceof Inet4Address && !address.isLoopbackAddress()) {
                        return address.getHostAddress();
                    }
                }
            }
        } catch (SocketException e) {
            log.warn("Failed to list network interfaces, using loopback: {}", e.getMessage());
        }
        return "127.0.0.1";
    }

    private static InetAddress toAddress(BigInteger value, int length) throws UnknownHostException {
        byte[] raw = value.toByteArray();
        byte[] out = new byte[length];
        int copy = Math.min(raw.length, length);
        System.arraycopy(raw, raw.length - copy, out, length - copy, copy);
        return InetAddress.getByAddress(out);
    }
}
