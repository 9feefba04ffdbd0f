package org.iconoglott.transport;

import com.typesafe.config.Config;
import org.iconoglott.compiler.api.ICompiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Owns the render thread pool shared by all connections and opens a {@link RenderSession}
 * per connection. The network server itself is not part of this project; a server hands
 * each connection's outbound channel to {@link #openSession(MessageSink)}.
 */
public class RenderTransport implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(RenderTransport.class);
    private static final String THREADS_PATH = "iconoglott.transport.render-threads";

    private final ICompiler compiler;
    private final MessageCodec codec = new MessageCodec();
    private final ExecutorService executor;

    /**
     * @param compiler The compiler used by all sessions.
     * @param config A resolved configuration containing <code>iconoglott.transport</code>.
     */
    public RenderTransport(ICompiler compiler, Config config) {
        this(compiler, Executors.newFixedThreadPool(Math.max(1, config.getInt(THREADS_PATH))));
    }

    RenderTransport(ICompiler compiler, ExecutorService executor) {
        this.compiler = compiler;
        this.executor = executor;
    }

    /**
     * @param sink The outbound channel of a new connection.
     * @return The session handling that connection.
     */
    public RenderSession openSession(MessageSink sink) {
        return new RenderSession(compiler, codec, sink, executor);
    }

    /**
     * Stops accepting renders and waits briefly for running ones to finish.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("Render threads did not finish in time, interrupting.");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
