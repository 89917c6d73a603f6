package cz.vut.fit.whoisradar.client.transport;

import cz.vut.fit.whoisradar.client.CancellationSignal;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

class SocketTransportChannelTest {

    private final SocketTransportChannel channel = new SocketTransportChannel(0, 0);

    private static TransportRequest request(String host, int port, String query, boolean rethrow) {
        return new TransportRequest(host, port, query, StandardCharsets.UTF_8, 2, rethrow);
    }

    @Test
    void exchange_sendsQueryWithCrlf_andReadsUntilClosed() throws Exception {
        try (var server = FakeWhoisServer.replying("OrgName: Example\r\nNetRange: 192.0.2.0 - 192.0.2.255\r\n")) {
            var response = channel.exchange(request(server.host(), server.port(), "n + 192.0.2.1", false));

            assertEquals("OrgName: Example\r\nNetRange: 192.0.2.0 - 192.0.2.255\r\n", response);
            assertEquals(List.of("n + 192.0.2.1\r\n"), server.received());
        }
    }

    @Test
    void exchange_decodesMultibyteTextSplitAcrossChunks() throws Exception {
        var text = "[組織名]                    テスト株式会社\n";
        try (var server = new FakeWhoisServer(q -> text.getBytes(StandardCharsets.UTF_8), 5, 0)) {
            var paced = new SocketTransportChannel(0, 10);
            var response = paced.exchange(request(server.host(), server.port(), "192.0.2.1", false));

            assertEquals(text, response);
        }
    }

    @Test
    void exchange_refusedConnection_returnsEmpty() throws Exception {
        var response = channel.exchange(request("127.0.0.1", FakeWhoisServer.closedPort(), "example.com", false));
        assertEquals("", response);
    }

    @Test
    void exchange_refusedConnection_throwsWhenRethrowing() throws Exception {
        final int port = FakeWhoisServer.closedPort();
        var e = assertThrows(TransportException.class,
                () -> channel.exchange(request("127.0.0.1", port, "example.com", true)));

        assertEquals("127.0.0.1", e.getHost());
        assertEquals(port, e.getPort());
        assertNotNull(e.getCause());
    }

    @Test
    void exchange_keepsPartialData_onReadTimeout() throws Exception {
        try (var server = new FakeWhoisServer(q -> "partial".getBytes(StandardCharsets.UTF_8), 0, 5_000)) {
            var request = new TransportRequest(server.host(), server.port(), "example.com",
                    StandardCharsets.US_ASCII, 1, true);

            assertEquals("partial", channel.exchange(request));
        }
    }

    @Test
    void exchange_responseArrivingLongerThanTimeout_isReadInFull() throws Exception {
        var text = "x".repeat(150);
        try (var server = new FakeWhoisServer(q -> text.getBytes(StandardCharsets.UTF_8), 1, 0)) {
            var request = new TransportRequest(server.host(), server.port(), "example.com",
                    StandardCharsets.US_ASCII, 1, true);

            assertEquals(text, channel.exchange(request));
        }
    }

    @Test
    void exchange_socketCreationFailure_isTransportFailure() {
        var failing = new SocketTransportChannel(0, 0) {
            @Override
            protected Socket buildSocket() throws IOException {
                throw new IOException("No sockets left");
            }
        };

        assertEquals("", assertDoesNotThrow(() -> failing.exchange(request("127.0.0.1", 43, "x", false))));

        var e = assertThrows(TransportException.class,
                () -> failing.exchange(request("127.0.0.1", 43, "x", true)));
        assertInstanceOf(IOException.class, e.getCause());
        assertEquals("No sockets left", e.getCause().getMessage());
    }

    @Test
    void exchange_waitsForCooldownAfterFailure() throws Exception {
        var slow = new SocketTransportChannel(300, 0);
        final int port = FakeWhoisServer.closedPort();

        long start = System.nanoTime();
        slow.exchange(request("127.0.0.1", port, "example.com", false));
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertTrue(elapsedMs >= 300, "Took only " + elapsedMs + " ms");
    }

    @Test
    void send_wrapsExchangeInCompletedFuture() throws Exception {
        try (var server = FakeWhoisServer.replying("refer: whois.example.net\n")) {
            var future = channel.send(request(server.host(), server.port(), "example.net", false),
                    CancellationSignal.none());

            assertTrue(future.succeeded());
            assertEquals("refer: whois.example.net\n", future.result());
        }
    }

    @Test
    void send_reportsTransportFailureAsFailedFuture() throws Exception {
        var future = channel.send(request("127.0.0.1", FakeWhoisServer.closedPort(), "example.com", true),
                CancellationSignal.none());

        assertTrue(future.failed());
        assertInstanceOf(TransportException.class, future.cause());
    }

    @Test
    void send_cancelledSignal_doesNotConnect() throws Exception {
        try (var server = FakeWhoisServer.replying("data")) {
            var signal = new CancellationSignal();
            signal.cancel();

            var future = channel.send(request(server.host(), server.port(), "example.com", false), signal);

            assertTrue(future.failed());
            assertInstanceOf(CancellationException.class, future.cause());
            assertFalse(server.awaitQuery(200));
        }
    }

    @Test
    void constructor_rejectsNegativeDelays() {
        assertThrows(IllegalArgumentException.class, () -> new SocketTransportChannel(-1, 0));
        assertThrows(IllegalArgumentException.class, () -> new SocketTransportChannel(0, -1));
    }
}
