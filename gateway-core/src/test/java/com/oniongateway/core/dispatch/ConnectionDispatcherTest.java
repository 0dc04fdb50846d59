package com.oniongateway.core.dispatch;

import com.oniongateway.core.config.DispatcherConfig;
import com.oniongateway.core.config.HttpConfig;
import com.oniongateway.core.gate.PortGate;
import com.oniongateway.core.http.HttpBridge;
import com.oniongateway.core.http.HttpResponses;
import com.oniongateway.core.support.Await;
import com.oniongateway.core.support.QueueRequestSource;
import com.oniongateway.core.support.RecordingStreamRequest;
import com.oniongateway.core.tls.TlsTerminator;
import com.oniongateway.core.transport.StreamKind;
import com.oniongateway.core.transport.TransportException;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.ssl.ApplicationProtocolNames;
import io.netty.handler.ssl.util.SelfSignedCertificate;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
public class ConnectionDispatcherTest {

    private HttpBridge bridge;

    @BeforeEach
    void setUp() {
        bridge = new HttpBridge(new HttpConfig());
    }

    @AfterEach
    void tearDown() {
        bridge.close();
    }

    private ConnectionDispatcher dispatcher(int maxConnections) {
        DispatcherConfig config = new DispatcherConfig();
        config.setMaxConnections(maxConnections);
        return ConnectionDispatcher.builder()
                .portGate(PortGate.httpAndHttps())
                .httpBridge(bridge)
                .requestHandler(request -> HttpResponses.text(HttpResponseStatus.OK, "ok"))
                .config(config)
                .build();
    }

    @Test
    void rejectsPortOutsideGate() throws Exception {
        ConnectionDispatcher dispatcher = dispatcher(16);
        RecordingStreamRequest request = RecordingStreamRequest.begin(8080);

        dispatcher.run(new QueueRequestSource().add(request).end());

        assertEquals(1, request.rejects());
        assertEquals(0, request.accepts());
        assertEquals(1, dispatcher.metrics().getRejected());
        assertEquals(0, dispatcher.metrics().getAccepted());
        assertFalse(request.channel().isOpen());
    }

    @Test
    void acceptsHttpAndHttpsPorts() throws Exception {
        ConnectionDispatcher dispatcher = dispatcher(16);
        RecordingStreamRequest http = RecordingStreamRequest.begin(80);
        RecordingStreamRequest https = RecordingStreamRequest.begin(443);

        dispatcher.run(new QueueRequestSource().add(http).add(https).end());

        assertEquals(1, http.accepts());
        assertEquals(1, https.accepts());
        assertEquals(0, http.rejects() + https.rejects());
        assertEquals(2, dispatcher.inFlightConnections());

        http.channel().close();
        https.channel().close();
        Await.until(() -> dispatcher.inFlightConnections() == 0, "both connections ended");
        assertEquals(2, dispatcher.metrics().getCompleted());
    }

    @Test
    void rejectsStreamKindsOtherThanBegin() throws Exception {
        ConnectionDispatcher dispatcher = dispatcher(16);
        List<RecordingStreamRequest> requests = List.of(
                RecordingStreamRequest.of(StreamKind.BEGIN_DIR, 80),
                RecordingStreamRequest.of(StreamKind.RESOLVE, 443),
                RecordingStreamRequest.of(StreamKind.OTHER, 80));
        QueueRequestSource source = new QueueRequestSource();
        requests.forEach(source::add);

        dispatcher.run(source.end());

        for (RecordingStreamRequest request : requests) {
            assertEquals(1, request.rejects());
            assertEquals(0, request.accepts());
        }
    }

    @Test
    void answersEveryRequestExactlyOnceInArrivalOrder() throws Exception {
        ConnectionDispatcher dispatcher = dispatcher(16);
        List<RecordingStreamRequest> requests = List.of(
                RecordingStreamRequest.begin(22),
                RecordingStreamRequest.begin(80),
                RecordingStreamRequest.begin(8443),
                RecordingStreamRequest.begin(443),
                RecordingStreamRequest.begin(0));
        QueueRequestSource source = new QueueRequestSource();
        requests.forEach(source::add);

        dispatcher.run(source.end());

        for (RecordingStreamRequest request : requests) {
            assertEquals(1, request.answers(), "answers for " + request.descriptor());
        }
        assertEquals(5, dispatcher.metrics().getReceived());
        assertEquals(3, dispatcher.metrics().getRejected());
        assertEquals(2, dispatcher.metrics().getAccepted());
        assertEquals(6, source.pulls());
    }

    @Test
    void acceptFailureDoesNotStopTheLoop() throws Exception {
        ConnectionDispatcher dispatcher = dispatcher(16);
        RecordingStreamRequest broken = RecordingStreamRequest.begin(443)
                .failingAccept(new IOException("stream vanished"));
        RecordingStreamRequest next = RecordingStreamRequest.begin(80);

        dispatcher.run(new QueueRequestSource().add(broken).add(next).end());

        assertEquals(1, broken.accepts());
        assertEquals(1, next.accepts());
        assertEquals(1, dispatcher.metrics().getAcceptFailures());
        assertEquals(1, dispatcher.inFlightConnections());
        next.channel().close();
    }

    @Test
    void rejectFailureDoesNotStopTheLoop() throws Exception {
        ConnectionDispatcher dispatcher = dispatcher(16);
        RecordingStreamRequest broken = RecordingStreamRequest.begin(25)
                .failingReject(new IOException("circuit gone"));
        RecordingStreamRequest next = RecordingStreamRequest.begin(26);

        dispatcher.run(new QueueRequestSource().add(broken).add(next).end());

        assertEquals(1, broken.rejects());
        assertEquals(1, next.rejects());
        assertEquals(1, dispatcher.metrics().getRejectFailures());
    }

    @Test
    void endOfSequenceEndsTheLoop() throws Exception {
        ConnectionDispatcher dispatcher = dispatcher(16);
        RecordingStreamRequest late = RecordingStreamRequest.begin(80);
        QueueRequestSource source = new QueueRequestSource().end().add(late);

        dispatcher.run(source);

        assertEquals(1, source.pulls());
        assertEquals(0, late.answers());
        assertFalse(dispatcher.isRunning());
    }

    @Test
    void transportFailurePropagates() {
        ConnectionDispatcher dispatcher = dispatcher(16);
        RecordingStreamRequest first = RecordingStreamRequest.begin(443);
        RecordingStreamRequest afterFailure = RecordingStreamRequest.begin(443);
        TransportException failure = new TransportException("overlay lost");
        QueueRequestSource source = new QueueRequestSource().add(first).fail(failure).add(afterFailure);

        TransportException thrown = assertThrows(TransportException.class, () -> dispatcher.run(source));

        assertSame(failure, thrown);
        assertEquals(1, first.accepts());
        assertEquals(0, afterFailure.answers());
        assertFalse(dispatcher.isRunning());
        first.channel().close();
    }

    @Test
    void stopInterruptsWaitingLoop() throws Exception {
        ConnectionDispatcher dispatcher = dispatcher(16);
        AtomicReference<Throwable> error = new AtomicReference<>();
        Thread loop = new Thread(() -> {
            try {
                dispatcher.run(new QueueRequestSource());
            } catch (Throwable t) {
                error.set(t);
            }
        }, "dispatcher-loop");
        loop.start();
        Await.until(dispatcher::isRunning, "loop is running");

        dispatcher.stop();
        loop.join(5000);

        assertFalse(loop.isAlive());
        assertNull(error.get());
        assertFalse(dispatcher.isRunning());
    }

    @Test
    void interruptOtherThanStopPropagates() throws Exception {
        ConnectionDispatcher dispatcher = dispatcher(16);
        AtomicReference<Throwable> error = new AtomicReference<>();
        Thread loop = new Thread(() -> {
            try {
                dispatcher.run(new QueueRequestSource());
            } catch (Throwable t) {
                error.set(t);
            }
        }, "dispatcher-loop");
        loop.start();
        Await.until(dispatcher::isRunning, "loop is running");

        loop.interrupt();
        loop.join(5000);

        assertTrue(error.get() instanceof InterruptedException);
    }

    @Test
    void rejectsAdmittedRequestsOverTheConnectionLimit() throws Exception {
        ConnectionDispatcher dispatcher = dispatcher(1);
        RecordingStreamRequest first = RecordingStreamRequest.begin(443);
        RecordingStreamRequest second = RecordingStreamRequest.begin(443);

        dispatcher.run(new QueueRequestSource().add(first).add(second).end());

        assertEquals(1, first.accepts());
        assertEquals(1, second.rejects());
        assertEquals(1, dispatcher.metrics().getLimitRejections());

        first.channel().close();
        Await.until(() -> dispatcher.inFlightConnections() == 0, "first connection ended");
        RecordingStreamRequest third = RecordingStreamRequest.begin(80);
        dispatcher.run(new QueueRequestSource().add(third).end());
        assertEquals(1, third.accepts());
        third.channel().close();
    }

    @Test
    void secondConcurrentRunIsRefused() throws Exception {
        ConnectionDispatcher dispatcher = dispatcher(16);
        Thread loop = new Thread(() -> {
            try {
                dispatcher.run(new QueueRequestSource());
            } catch (Exception e) {
                log.debug("loop ended", e);
            }
        }, "dispatcher-loop");
        loop.start();
        Await.until(dispatcher::isRunning, "loop is running");

        assertThrows(IllegalStateException.class, () -> dispatcher.run(new QueueRequestSource().end()));

        dispatcher.stop();
        loop.join(5000);
    }

    @Test
    void peerClosingDuringAcceptEndsTheConnectionAsTlsFailure() throws Exception {
        SelfSignedCertificate certificate = new SelfSignedCertificate("example.onion");
        try {
            TlsTerminator tls = TlsTerminator.fromKeyMaterial(certificate.key(),
                    List.of(ApplicationProtocolNames.HTTP_1_1), 1000, certificate.cert());
            ConnectionDispatcher dispatcher = ConnectionDispatcher.builder()
                    .portGate(PortGate.httpAndHttps())
                    .tlsTerminator(tls)
                    .httpBridge(bridge)
                    .requestHandler(request -> HttpResponses.text(HttpResponseStatus.OK, "ok"))
                    .build();
            RecordingStreamRequest request = RecordingStreamRequest.begin(443).closingOnAccept();

            dispatcher.run(new QueueRequestSource().add(request).end());

            assertEquals(1, request.accepts());
            assertTrue(dispatcher.awaitConnections(Duration.ofSeconds(3)));
            assertEquals(0, dispatcher.inFlightConnections());
            assertEquals(1, dispatcher.metrics().getTlsFailures());
            assertEquals(0, dispatcher.metrics().getCompleted());
        } finally {
            certificate.delete();
        }
    }

    @Test
    void plaintextConnectionClosedDuringAcceptIsNotLeaked() throws Exception {
        ConnectionDispatcher dispatcher = dispatcher(16);
        RecordingStreamRequest request = RecordingStreamRequest.begin(80).closingOnAccept();

        dispatcher.run(new QueueRequestSource().add(request).end());

        assertTrue(dispatcher.awaitConnections(Duration.ofSeconds(3)));
        assertEquals(0, dispatcher.inFlightConnections());
        assertEquals(1, dispatcher.metrics().getServeFailures());
    }

    @Test
    void stopAfterTheLoopReturnedLeavesCallerUninterrupted() throws Exception {
        ConnectionDispatcher dispatcher = dispatcher(16);
        dispatcher.run(new QueueRequestSource().end());

        dispatcher.stop();

        assertFalse(Thread.currentThread().isInterrupted());
        assertTrue(dispatcher.awaitConnections(Duration.ofMillis(100)));
    }

    @Test
    void stopRacingTheEndOfSequenceNeverLeaksAnInterrupt() throws Exception {
        for (int i = 0; i < 200; i++) {
            ConnectionDispatcher dispatcher = dispatcher(16);
            Thread stopper = new Thread(dispatcher::stop, "dispatcher-stopper");
            stopper.start();

            dispatcher.run(new QueueRequestSource().end());
            stopper.join(5000);

            // clears the flag too, so the next round starts clean
            assertFalse(Thread.interrupted(), "interrupt leaked in round " + i);
        }
    }

    @Test
    void metricsSummaryNamesEveryCounter() throws Exception {
        ConnectionDispatcher dispatcher = dispatcher(1);
        RecordingStreamRequest admitted = RecordingStreamRequest.begin(80);
        RecordingStreamRequest overLimit = RecordingStreamRequest.begin(443)
                .failingReject(new IOException("stream already reset"));

        dispatcher.run(new QueueRequestSource().add(admitted).add(overLimit).end());

        String summary = dispatcher.metrics().toString();
        assertTrue(summary.contains("limitRejections=1"), summary);
        assertTrue(summary.contains("rejectFailures=1"), summary);
        admitted.channel().close();
    }
}
