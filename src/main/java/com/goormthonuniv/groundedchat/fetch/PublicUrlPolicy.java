package com.goormthonuniv.groundedchat.fetch;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.URI;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 수집 전 URL 허용 판정.
 * http/https + 호스트 존재 + localhost 아님 + (IP 리터럴이면) 사설/루프백/링크로컬 아님.
 * 호스트명은 DNS 조회 없이 통과시킨다 (공개 호스트명이 사설 IP 로 풀리는 경우는 잡지 못함).
 */
public final class PublicUrlPolicy {

    private static final Pattern IPV4 = Pattern.compile("^(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})$");

    private PublicUrlPolicy() {}

    public static boolean isPublicHttpUrl(String url) {
        if (url == null || url.isBlank()) return false;
        URI uri;
        try {
            uri = URI.create(url.strip());
        } catch (IllegalArgumentException e) {
            return false;
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) return false;

        String host = uri.getHost();
        if (host == null || host.isBlank()) return false;
        host = host.strip().toLowerCase(Locale.ROOT);
        if (host.equals("localhost")) return false;

        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        if (!isIpLiteral(host)) return true;
        return !isNonPublic(host);
    }

    static boolean isIpLiteral(String host) {
        return IPV4.matcher(host).matches() || host.contains(":");
    }

    // 이름 해석을 거치지 않도록 v4 는 직접 바이트로, v6 는 대괄호 리터럴로만 넘긴다
    static boolean isNonPublic(String literal) {
        try {
            InetAddress ip;
            Matcher v4 = IPV4.matcher(literal);
            if (v4.matches()) {
                byte[] octets = new byte[4];
                for (int i = 0; i < 4; i++) {
                    int octet = Integer.parseInt(v4.group(i + 1));
                    if (octet > 255) return true;
                    octets[i] = (byte) octet;
                }
                ip = InetAddress.getByAddress(octets);
            } else {
                ip = InetAddress.getByName("[" + literal + "]");
            }
            if (ip.isLoopbackAddress() || ip.isSiteLocalAddress()
                    || ip.isLinkLocalAddress() || ip.isAnyLocalAddress()) {
                return true;
            }
            if (ip instanceof Inet6Address) {
                byte first = ip.getAddress()[0];
                return (first & 0xfe) == 0xfc; // fc00::/7 unique-local
            }
            return false;
        } catch (Exception e) {
            return true;
        }
    }
}
