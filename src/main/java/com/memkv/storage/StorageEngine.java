package com.memkv.storage;

import com.memkv.config.Config;
import com.memkv.util.Logger;
import com.memkv.util.NamedThreadFactory;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Sole owner of the key-value map.
 *
 * <p>A single loop thread takes one {@link StorageCommand} at a time from a
 * {@link SynchronousQueue} and applies it fully before taking the next. Callers
 * never see the map; they hand commands over and, for {@link #get}, wait on a
 * reply created for that request alone.
 *
 * <p>The handoff is a rendezvous: {@link #set} and {@link #delete} return only
 * after the loop has taken the command, and the loop applies it before it can
 * take another. Anything a caller sends afterwards therefore observes the
 * change. Commands from different callers are applied in whatever order the
 * loop receives them.
 *
 * <p>After {@link #shutdown()} the loop exits and the map is dropped. Callers
 * waiting to hand over a command, and later callers, get a
 * {@link StorageUnavailableException}. A command the loop has already taken is
 * always answered.
 */
public class StorageEngine {
    static final long POLL_INTERVAL_MS = 50;
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final int compactionThreshold;
    private final Logger logger;
    private final SynchronousQueue<StorageCommand> inbox = new SynchronousQueue<>();
    private final ExecutorService loop = Executors.newSingleThreadExecutor(new NamedThreadFactory("storage-engine", true));
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicLong compactions = new AtomicLong();
    private volatile boolean running = false;

    public StorageEngine(Config config) {
        this(config.getCompactionThreshold(), config.getAddress());
    }

    public StorageEngine(int compactionThreshold, String tag) {
        if (compactionThreshold <= 0) {
            throw new IllegalArgumentException("compactionThreshold must be positive: " + compactionThreshold);
        }
        this.compactionThreshold = compactionThreshold;
        this.logger = new Logger(StorageEngine.class, tag);
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Storage engine already started");
        }
        running = true;
        loop.execute(this::run);
        logger.info("Storage engine started, compaction every {} deletions", compactionThreshold);
    }

    public void shutdown() {
        if (!running) {
            loop.shutdownNow();
            return;
        }
        running = false;
        loop.shutdown();
        try {
            if (!loop.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("Storage engine loop did not stop within {}s", SHUTDOWN_TIMEOUT_SECONDS);
                loop.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            loop.shutdownNow();
        }
    }

    public boolean isRunning() {
        return running;
    }

    public long compactionCount() {
        return compactions.get();
    }

    /**
     * Stores {@code value} under {@code key}. Returns once the loop has taken the
     * command, which it applies before taking any other.
     */
    public void set(String key, String value) throws InterruptedException {
        handOff(StorageCommand.set(key, value));
    }

    /**
     * Looks up {@code key}, blocking until the loop answers. There is no timeout.
     */
    public LookupResult get(String key) throws InterruptedException {
        StorageCommand command = StorageCommand.get(key);
        handOff(command);
        try {
            return command.getReply().get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Lookup of '" + key + "' failed", e.getCause());
        }
    }

    public void delete(String key) throws InterruptedException {
        handOff(StorageCommand.delete(key));
    }

    private void handOff(StorageCommand command) throws InterruptedException {
        while (running) {
            if (inbox.offer(command, POLL_INTERVAL_MS, TimeUnit.MILLISECONDS)) {
                return;
            }
        }
        throw new StorageUnavailableException("Storage engine is not running");
    }

    private void run() {
        KVStore store = new KVStore();
        try {
            while (running) {
                StorageCommand command = inbox.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (command != null) {
                    apply(store, command);
                }
            }
        } catch (InterruptedException e) {
            running = false;
            Thread.currentThread().interrupt();
        }
        logger.info("Storage engine stopped with {} keys", store.size());
    }

    private void apply(KVStore store, StorageCommand command) {
        switch (command.getOperation()) {
            case SET:
                store.set(command.getKey(), command.getValue());
                break;
            case GET:
                String value = store.get(command.getKey());
                command.getReply().complete(value != null ? LookupResult.found(value) : LookupResult.missing());
                break;
            case DELETE:
                store.delete(command.getKey());
                if (store.getDeletionsSinceCompaction() >= compactionThreshold) {
                    store.compact();
                    compactions.incrementAndGet();
                    logger.debug("Compacted storage, {} live keys", store.size());
                }
                break;
            default:
                throw new IllegalStateException("Unknown operation " + command.getOperation());
        }
    }
}
