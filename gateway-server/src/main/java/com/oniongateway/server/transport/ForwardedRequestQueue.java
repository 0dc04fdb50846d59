package com.oniongateway.server.transport;

import com.oniongateway.core.transport.RequestDescriptor;
import com.oniongateway.core.transport.StreamRequest;
import com.oniongateway.core.transport.StreamRequestSource;
import io.netty.channel.Channel;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Stream request sequence fed by the local listeners. Once {@link #end()} is
 * called the requests already queued are still handed out, then the sequence
 * reports its end on every further pull.
 */
@Slf4j
final class ForwardedRequestQueue implements StreamRequestSource {

    private static final StreamRequest END = new EndOfSequence();

    private final BlockingQueue<StreamRequest> queue = new LinkedBlockingQueue<>();
    // offer, end and discardPending hold the lock so nothing lands behind END
    private final Object lock = new Object();
    private volatile boolean ended;

    void offer(ForwardedStreamRequest request) {
        synchronized (lock) {
            if (!ended) {
                queue.add(request);
                return;
            }
        }
        log.debug("Sequence already ended, dropping forwarded connection");
        request.channel().close();
    }

    void end() {
        synchronized (lock) {
            if (!ended) {
                ended = true;
                queue.add(END);
            }
        }
    }

    /** Closes connections nobody pulled before the sequence ended. */
    int discardPending() {
        synchronized (lock) {
            int discarded = 0;
            StreamRequest request;
            while ((request = queue.poll()) != null) {
                if (request instanceof ForwardedStreamRequest) {
                    ((ForwardedStreamRequest) request).channel().close();
                    discarded++;
                }
            }
            if (ended) {
                queue.add(END);
            }
            return discarded;
        }
    }

    boolean isEnded() {
        return ended;
    }

    @Override
    public Optional<StreamRequest> next() throws InterruptedException {
        StreamRequest request = queue.take();
        if (request == END) {
            queue.add(END);
            return Optional.empty();
        }
        return Optional.of(request);
    }

    private static final class EndOfSequence implements StreamRequest {

        @Override
        public RequestDescriptor descriptor() {
            throw new UnsupportedOperationException();
        }

        @Override
        public Channel accept() {
            throw new UnsupportedOperationException();
        }

        @Override
        public void reject() {
            throw new UnsupportedOperationException();
        }
    }
}
