package com.memkv.server;

import com.memkv.config.Config;
import com.memkv.storage.StorageEngine;
import com.memkv.util.Logger;
import com.memkv.util.NamedThreadFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Listens for clients and runs one {@link ConnectionHandler} thread per
 * accepted connection, all sharing one {@link StorageEngine}.
 *
 * <p>With {@code maxConnections > 0} the accept loop waits for a free slot
 * before accepting the next client; otherwise connections are unbounded.
 */
public class KvServer {
    private static final long SLOT_POLL_MS = 100;

    private final Config config;
    private final Logger logger;
    private final StorageEngine engine;
    private final Semaphore slots;
    private final Set<Socket> connections = ConcurrentHashMap.newKeySet();
    private final ExecutorService workers = Executors.newCachedThreadPool(new NamedThreadFactory("kv-connection", true));

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile ServerSocket serverSocket;

    public KvServer(Config config) {
        this.config = config;
        this.logger = new Logger(KvServer.class, config.getAddress());
        this.engine = new StorageEngine(config);
        this.slots = config.getMaxConnections() > 0 ? new Semaphore(config.getMaxConnections()) : null;
    }

    public void start() throws IOException {
        ServerSocket socket = new ServerSocket();
        try {
            socket.bind(new InetSocketAddress(config.getHost(), config.getPort()));
        } catch (IOException e) {
            socket.close();
            throw e;
        }
        serverSocket = socket;
        engine.start();
        running.set(true);
        logger.info("Listening on port {}", socket.getLocalPort());
    }

    /**
     * Accepts connections until {@link #stop()} is called.
     *
     * @throws IOException if accepting fails while the server is running; the
     *         listener cannot continue after that
     */
    public void serve() throws IOException {
        if (serverSocket == null) {
            throw new IllegalStateException("Server not started");
        }
        while (running.get()) {
            if (!acquireSlot()) {
                return;
            }
            Socket socket;
            try {
                socket = serverSocket.accept();
            } catch (IOException e) {
                releaseSlot();
                if (!running.get()) {
                    return;
                }
                throw e;
            }
            connections.add(socket);
            try {
                workers.execute(new ConnectionHandler(socket, engine, config.getMaxValueLength(), () -> {
                    connections.remove(socket);
                    releaseSlot();
                }));
            } catch (RejectedExecutionException e) {
                connections.remove(socket);
                releaseSlot();
                closeQuietly(socket);
            }
        }
    }

    // open connections are closed too so no handler stays blocked on the engine
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        logger.info("Shutting down...");
        closeQuietly(serverSocket);
        engine.shutdown();
        List<Socket> open = new ArrayList<>(connections);
        for (Socket socket : open) {
            closeQuietly(socket);
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
        logger.info("Stopped, closed {} open connections", open.size());
    }

    public boolean isRunning() {
        return running.get();
    }

    public int getLocalPort() {
        return serverSocket == null ? -1 : serverSocket.getLocalPort();
    }

    private boolean acquireSlot() {
        if (slots == null) {
            return true;
        }
        try {
            while (running.get()) {
                if (slots.tryAcquire(SLOT_POLL_MS, TimeUnit.MILLISECONDS)) {
                    return true;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return false;
    }

    private void releaseSlot() {
        if (slots != null) {
            slots.release();
        }
    }

    private void closeQuietly(Closeable closeable) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (IOException e) {
            logger.debug("Ignoring close failure: {}", e.getMessage());
        }
    }
}
