package org.iconoglott.transport;

import org.iconoglott.compiler.api.ICompiler;
import org.iconoglott.compiler.api.RenderResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * The render state of one connection.
 * <p>
 * At most one render runs at a time. A source arriving while a render is in flight becomes
 * the pending source, replacing any source that was pending before; a replaced source is
 * never rendered. When the running render finishes, the pending source, if any, starts next.
 * Pings and malformed messages are answered immediately on the calling thread.
 * <p>
 * If the executor refuses a render, the session returns to idle, drops the pending source
 * and answers with an error message, so a later source starts a fresh render.
 * <p>
 * This class is thread-safe.
 */
public class RenderSession {

    private static final Logger LOG = LoggerFactory.getLogger(RenderSession.class);

    private final ICompiler compiler;
    private final MessageCodec codec;
    private final MessageSink sink;
    private final ExecutorService executor;

    private final Object lock = new Object();
    private boolean inFlight;
    private String pending;

    public RenderSession(ICompiler compiler, MessageCodec codec, MessageSink sink, ExecutorService executor) {
        this.compiler = compiler;
        this.codec = codec;
        this.sink = sink;
        this.executor = executor;
    }

    /**
     * Handles one inbound message.
     * @param text The raw text received from the peer.
     */
    public void onMessage(String text) {
        TransportMessage message = codec.decode(text);
        if (message instanceof TransportMessage.Source source) {
            submit(source.payload());
        } else if (message instanceof TransportMessage.Ping) {
            sink.send(codec.encodePong());
        } else if (message instanceof TransportMessage.Invalid invalid) {
            LOG.debug("Rejecting message: {}", invalid.reason());
            sink.send(codec.encodeInvalid(invalid));
        }
    }

    /**
     * Requests a render of the given source.
     * @param source The DSL source text.
     */
    public void submit(String source) {
        synchronized (lock) {
            if (inFlight) {
                if (pending != null) {
                    LOG.debug("Superseding pending render of {} characters.", pending.length());
                }
                pending = source;
                return;
            }
            inFlight = true;
        }
        dispatch(source);
    }

    /**
     * @return {@code true} while a render is running or queued on the executor.
     */
    public boolean isBusy() {
        synchronized (lock) {
            return inFlight;
        }
    }

    private void run(String source) {
        try {
            RenderResult result = compiler.compile(source);
            sink.send(codec.encodeRender(result));
        } catch (RuntimeException e) {
            LOG.error("Render request failed: {}", e.getMessage(), e);
            sendError(e);
        }

        String next;
        synchronized (lock) {
            next = pending;
            pending = null;
            if (next == null) {
                inFlight = false;
                return;
            }
        }
        dispatch(next);
    }

    private void dispatch(String source) {
        try {
            executor.execute(() -> run(source));
        } catch (RejectedExecutionException e) {
            synchronized (lock) {
                inFlight = false;
                pending = null;
            }
            LOG.warn("Render executor rejected a request: {}", e.getMessage());
            sendError(new IllegalStateException("Render service is not accepting requests.", e));
        }
    }

    private void sendError(RuntimeException failure) {
        try {
            sink.send(codec.encodeError(String.valueOf(failure.getMessage()), List.of()));
        } catch (RuntimeException e) {
            LOG.error("Failed to report render failure to peer: {}", e.getMessage(), e);
        }
    }
}
