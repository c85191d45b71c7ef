package com.delta.siteaudit.crawl.http;

import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SsrfGuardTest {

    @Test
    void allowsPublicAddress() {
        SsrfGuard guard = new SsrfGuard(TestHostResolvers.fixed("example.com", "93.184.216.34"), AddressPolicy.publicOnly());

        GuardDecision decision = guard.inspect(URI.create("https://example.com/about"));

        assertThat(decision.allowed()).isTrue();
    }

    @Test
    void rejectsLoopbackLiteral() {
        SsrfGuard guard = TestHostResolvers.localGuard();

        GuardDecision decision = guard.inspect(URI.create("http://127.0.0.1:8080/admin"));

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.errorCode()).isEqualTo(SsrfGuard.SSRF_BLOCKED);
    }

    @Test
    void rejectsWhenAnyResolvedAddressIsPrivate() {
        SsrfGuard guard = new SsrfGuard(TestHostResolvers.fixed("mixed.example", "93.184.216.34", "10.0.0.5"), AddressPolicy.publicOnly());

        GuardDecision decision = guard.inspect(URI.create("https://mixed.example/"));

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.errorCode()).isEqualTo(SsrfGuard.SSRF_BLOCKED);
    }

    @Test
    void rejectsNonHttpSchemes() {
        SsrfGuard guard = new SsrfGuard(TestHostResolvers.fixed("example.com", "93.184.216.34"), AddressPolicy.publicOnly());

        assertThat(guard.inspect(URI.create("file:///etc/passwd")).allowed()).isFalse();
        assertThat(guard.inspect(URI.create("ftp://example.com/file")).errorCode()).isEqualTo(SsrfGuard.SSRF_BLOCKED);
    }

    @Test
    void unresolvableHostIsDnsError() {
        SsrfGuard guard = new SsrfGuard(TestHostResolvers.fixed("example.com", "93.184.216.34"), AddressPolicy.publicOnly());

        GuardDecision decision = guard.inspect(URI.create("https://nowhere.invalid/"));

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.errorCode()).isEqualTo(SsrfGuard.DNS_ERROR);
    }

    @Test
    void resolvePermittedRejectsPrivateAnswer() {
        SsrfGuard guard = new SsrfGuard(TestHostResolvers.fixed("intranet.example", "192.168.0.7"), AddressPolicy.publicOnly());

        assertThatThrownBy(() -> guard.resolvePermitted("intranet.example"))
            .isInstanceOf(BlockedAddressException.class)
            .hasMessageContaining("192.168.0.7");
    }

    @Test
    void classifiesReservedRanges() throws Exception {
        assertThat(SsrfGuard.isDisallowed(InetAddress.getByName("127.0.0.1"))).isTrue();
        assertThat(SsrfGuard.isDisallowed(InetAddress.getByName("192.168.1.10"))).isTrue();
        assertThat(SsrfGuard.isDisallowed(InetAddress.getByName("172.16.0.1"))).isTrue();
        assertThat(SsrfGuard.isDisallowed(InetAddress.getByName("169.254.169.254"))).isTrue();
        assertThat(SsrfGuard.isDisallowed(InetAddress.getByName("100.64.0.1"))).isTrue();
        assertThat(SsrfGuard.isDisallowed(InetAddress.getByName("0.0.0.0"))).isTrue();
        assertThat(SsrfGuard.isDisallowed(InetAddress.getByName("::1"))).isTrue();
        assertThat(SsrfGuard.isDisallowed(InetAddress.getByName("fd00::1"))).isTrue();
        assertThat(SsrfGuard.isDisallowed(InetAddress.getByName("fe80::1"))).isTrue();
        assertThat(SsrfGuard.isDisallowed(InetAddress.getByName("8.8.8.8"))).isFalse();
        assertThat(SsrfGuard.isDisallowed(InetAddress.getByName("2606:4700::1111"))).isFalse();
    }
}
