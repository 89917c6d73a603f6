package cz.vut.fit.whoisradar.client;

import cz.vut.fit.whoisradar.client.transport.TransportChannel;
import cz.vut.fit.whoisradar.client.transport.TransportException;
import cz.vut.fit.whoisradar.client.transport.TransportRequest;
import cz.vut.fit.whoisradar.models.AddressRange;
import io.vertx.core.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class RecursiveResolverTest {

    private static final String ROOT = "whois.example.org";

    private TransportChannel channel;
    private RecursiveResolver resolver;
    private WhoisOptions options;

    @BeforeEach
    void setUp() {
        channel = mock(TransportChannel.class);
        resolver = new RecursiveResolver(channel);
        options = WhoisOptions.defaults().withServer(ROOT).withMaxRetries(3).withTimeoutSeconds(5);
    }

    private static Future<String> ok(String response) {
        return Future.succeededFuture(response);
    }

    private static Future<String> refused(String host) {
        return Future.failedFuture(new TransportException(host, 43, "Connection refused"));
    }

    private List<TransportRequest> sentRequests(int times) {
        var captor = ArgumentCaptor.forClass(TransportRequest.class);
        verify(channel, times(times)).send(captor.capture(), any());
        return captor.getAllValues();
    }

    @Test
    void resolve_singleHop_extractsFields() throws Exception {
        when(channel.send(any(), any()))
                .thenReturn(ok("OrgName:        Example Org\nNetRange:       192.0.2.0 - 192.0.2.255\n"));

        var result = resolver.resolve("192.0.2.1", options);

        assertEquals(List.of(ROOT), result.respondedServers());
        assertEquals("Example Org", result.organizationName());
        assertEquals(AddressRange.parse("192.0.2.0/24"), result.addressRange());

        var request = sentRequests(1).get(0);
        assertEquals(ROOT, request.host());
        assertEquals(43, request.port());
        assertEquals("192.0.2.1", request.queryLine());
        assertEquals(5, request.timeoutSeconds());
    }

    @Test
    void resolve_followsReferral() throws Exception {
        when(channel.send(any(), any()))
                .thenReturn(ok("   Registrar WHOIS Server: whois.example.net\n"))
                .thenReturn(ok("Registrant Organization: Example Registrant\n"));

        var result = resolver.resolve("example.com", options);

        assertEquals(List.of(ROOT, "whois.example.net"), result.respondedServers());
        assertEquals("Example Registrant", result.organizationName());
        assertNull(result.addressRange());

        var second = sentRequests(2).get(1);
        assertEquals("whois.example.net", second.host());
        assertEquals(43, second.port());
    }

    @Test
    void resolve_usesReferralPort() throws Exception {
        when(channel.send(any(), any()))
                .thenReturn(ok("ReferralServer:  whois://rwhois.example.net:4321\n"))
                .thenReturn(ok("descr: Example\n"));

        resolver.resolve("192.0.2.1", options);

        var second = sentRequests(2).get(1);
        assertEquals("rwhois.example.net", second.host());
        assertEquals(4321, second.port());
    }

    @Test
    void resolve_selfReferral_endsLookup() throws Exception {
        when(channel.send(any(), any())).thenReturn(ok("whois: WHOIS.EXAMPLE.ORG\nowner: Self\n"));

        var result = resolver.resolve("example.org", options);

        assertEquals(List.of(ROOT), result.respondedServers());
        assertEquals("Self", result.organizationName());
        sentRequests(1);
    }

    @Test
    void resolve_rewritesQueryPerServer() throws Exception {
        when(channel.send(any(), any()))
                .thenReturn(ok("refer: whois.verisign-grs.com\n"))
                .thenReturn(ok("   Registrar WHOIS Server: whois.arin.net\n"))
                .thenReturn(ok("OrgName: ARIN Example\n"));

        var result = resolver.resolve("example.com", options);

        var requests = sentRequests(3);
        assertEquals("example.com", requests.get(0).queryLine());
        assertEquals("domain example.com", requests.get(1).queryLine());
        assertEquals("n + example.com", requests.get(2).queryLine());
        assertEquals(List.of(ROOT, "whois.verisign-grs.com", "whois.arin.net"), result.respondedServers());
    }

    @Test
    void resolve_retriesBlankResponses() throws Exception {
        when(channel.send(any(), any()))
                .thenReturn(ok(""))
                .thenReturn(ok(" \r\n\t"))
                .thenReturn(ok("org-name: Third Time\n"));

        var result = resolver.resolve("example.com", options);

        assertEquals("Third Time", result.organizationName());
        sentRequests(3);
    }

    @Test
    void resolve_retriesFailedAttempts() throws Exception {
        when(channel.send(any(), any()))
                .thenReturn(refused(ROOT))
                .thenReturn(ok("Organization: Recovered\n"));

        var result = resolver.resolve("example.com", options.withRethrowTransportErrors(true));

        assertEquals("Recovered", result.organizationName());
        sentRequests(2);
    }

    @Test
    void resolve_allAttemptsFail_degradesToEmptyResponse() throws Exception {
        when(channel.send(any(), any())).thenReturn(refused(ROOT));

        var result = resolver.resolve("example.com", options.withMaxRetries(4));

        assertEquals(List.of(ROOT), result.respondedServers());
        assertEquals("", result.raw());
        assertEquals("", result.organizationName());
        assertNull(result.addressRange());
        sentRequests(4);
    }

    @Test
    void resolve_allAttemptsFail_rethrowsLastError() {
        when(channel.send(any(), any())).thenReturn(refused(ROOT));

        var e = assertThrows(TransportException.class,
                () -> resolver.resolve("example.com", options.withRethrowTransportErrors(true)));

        assertEquals(ROOT, e.getHost());
        sentRequests(3);
    }

    @Test
    void resolve_alwaysBlank_stopsAfterMaxRetries() throws Exception {
        when(channel.send(any(), any())).thenReturn(ok("   "));

        var result = resolver.resolve("example.com", options.withMaxRetries(5));

        assertEquals(List.of(ROOT), result.respondedServers());
        assertEquals("   ", result.raw());
        sentRequests(5);
    }

    @Test
    void resolve_noAttemptsAllowed_returnsEmptyResult() throws Exception {
        var result = resolver.resolve("example.com", options.withMaxRetries(0));

        assertEquals(List.of(ROOT), result.respondedServers());
        assertEquals("", result.raw());
        verifyNoInteractions(channel);
    }

    @Test
    void resolve_arinSummaryOverridesFields() throws Exception {
        var response = """
                NetRange:       192.0.0.0 - 192.0.255.255
                OrgName:        Parent Org

                Child Org NET-192-0-2-0-1 (NET-192-0-2-0-1) 192.0.2.0 - 192.0.2.255
                """;
        when(channel.send(any(), any())).thenReturn(ok(response));

        var result = resolver.resolve("192.0.2.1", options.withServer("whois.arin.net"));

        assertEquals("n + 192.0.2.1", sentRequests(1).get(0).queryLine());
        assertEquals("Child Org NET-192-0-2-0-1 (NET-192-0-2-0-1)", result.organizationName());
        assertEquals(AddressRange.parse("192.0.2.0/24"), result.addressRange());
    }

    @Test
    void resolveAsync_cancelledSignal_sendsNothing() {
        var signal = new CancellationSignal();
        signal.cancel();

        var future = resolver.resolveAsync("example.com", options, signal);

        assertTrue(future.failed());
        assertInstanceOf(CancellationException.class, future.cause());
        verifyNoInteractions(channel);
    }

    @Test
    void resolveAsync_cancellationIsNotRetried() {
        when(channel.send(any(), any())).thenReturn(Future.failedFuture(new CancellationException("cancelled")));

        var future = resolver.resolveAsync("example.com", options.withMaxRetries(5), CancellationSignal.none());

        assertTrue(future.failed());
        assertInstanceOf(CancellationException.class, future.cause());
        sentRequests(1);
    }

    @Test
    void resolveAsync_cancelBetweenHops_stopsLookup() {
        var signal = new CancellationSignal();
        when(channel.send(any(), any())).thenAnswer(invocation -> {
            signal.cancel();
            return ok("refer: whois.example.net\n");
        });

        var future = resolver.resolveAsync("example.com", options, signal);

        assertTrue(future.failed());
        assertInstanceOf(CancellationException.class, future.cause());
        sentRequests(1);
    }

    @Test
    void resolve_blockingCall_propagatesCancellation() {
        when(channel.send(any(), any())).thenReturn(Future.failedFuture(new CancellationException("cancelled")));

        assertThrows(CancellationException.class, () -> resolver.resolve("example.com", options));
    }
}
