package com.goormthonuniv.groundedchat.fetch;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class PublicUrlPolicyTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "https://www.cwa.gov.tw/V8/C/W/County/index.html",
            "http://news.example.com/a?b=c",
            "https://8.8.8.8/dns",
            "https://[2001:4860:4860::8888]/"
    })
    void publicUrlsShouldBeAccepted(String url) {
        assertThat(PublicUrlPolicy.isPublicHttpUrl(url)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "ftp://example.com/file",
            "file:///etc/passwd",
            "https:///no-host",
            "http://localhost:8080/admin",
            "http://127.0.0.1/",
            "http://10.0.0.5/",
            "http://192.168.1.1/router",
            "http://172.16.3.4/",
            "http://169.254.169.254/latest/meta-data",
            "http://0.0.0.0/",
            "http://[::1]/",
            "http://[fd12:3456::1]/",
            "not a url",
            ""
    })
    void nonPublicUrlsShouldBeRejected(String url) {
        assertThat(PublicUrlPolicy.isPublicHttpUrl(url)).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"999.1.1.1", "256.0.0.1", "1.2.3.300", "zz::1"})
    void malformedLiteralsShouldBeRejectedWithoutLookup(String literal) {
        assertThat(PublicUrlPolicy.isNonPublic(literal)).isTrue();
    }

    @Test
    void validLiteralsShouldBeClassified() {
        assertThat(PublicUrlPolicy.isNonPublic("8.8.8.8")).isFalse();
        assertThat(PublicUrlPolicy.isNonPublic("255.255.255.255")).isFalse();
        assertThat(PublicUrlPolicy.isNonPublic("10.1.2.3")).isTrue();
        assertThat(PublicUrlPolicy.isNonPublic("2001:4860:4860::8888")).isFalse();
    }
}
