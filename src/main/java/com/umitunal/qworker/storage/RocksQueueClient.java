package com.umitunal.qworker.storage;

import com.umitunal.qworker.config.StorageConfig;
import com.umitunal.qworker.core.Job;
import com.umitunal.qworker.core.QueueClient;
import com.umitunal.qworker.core.QueueClientException;
import com.umitunal.qworker.model.WorkUnitSerializer;
import org.rocksdb.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Durable single-process queue client backed by RocksDB.
 *
 * Key layout: [queue name (UTF-8)][0x00][sequence (8 bytes, big-endian)], so each
 * queue is a contiguous FIFO range. A consumed job is deleted only after its
 * callback returns, which gives at-least-once delivery across restarts.
 */
public class RocksQueueClient implements QueueClient {
    private static final Logger log = LoggerFactory.getLogger(RocksQueueClient.class);
    private static final byte SEPARATOR = 0;

    private final RocksDB database;
    private final Options dbOptions;
    private final WriteOptions writeOpts;
    private final ReadOptions scanReadOpts;
    private final Cache blockCache;
    private final Filter bloomFilter;
    private final WorkUnitSerializer serializer;
    private final Duration pollInterval;
    private final AtomicLong sequence;
    private final Map<String, Consumer<Job>> consumers = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    public RocksQueueClient(StorageConfig config) throws RocksDBException {
        this.serializer = new WorkUnitSerializer(config.getPayloadFormat().codec());
        this.pollInterval = config.getPollInterval();

        RocksDB.loadLibrary();

        this.blockCache = new LRUCache(32L * 1024 * 1024);
        this.bloomFilter = new BloomFilter(10);

        BlockBasedTableConfig tableConfig = new BlockBasedTableConfig()
                .setBlockCache(blockCache)
                .setFilterPolicy(bloomFilter)
                .setCacheIndexAndFilterBlocks(true);

        this.dbOptions = new Options()
                .setCreateIfMissing(true)
                .setCompressionType(CompressionType.LZ4_COMPRESSION)
                .setWriteBufferSize((long) config.getMemoryBufferSizeMB() * 1024 * 1024)
                .setMaxBackgroundJobs(config.getBackgroundThreads())
                .setTableFormatConfig(tableConfig);

        this.database = RocksDB.open(dbOptions, config.getDataDirectory());

        this.writeOpts = new WriteOptions()
                .setSync(config.isDurableWrites())
                .setDisableWAL(!config.isDurableWrites());

        // Scans are one-shot, keep them out of the block cache
        this.scanReadOpts = new ReadOptions()
                .setFillCache(false);

        this.sequence = new AtomicLong(recoverSequence());
        log.info("Opened queue store at {} (next sequence {})", config.getDataDirectory(), sequence.get() + 1);
    }

    /**
     * Open a client, wrapping storage failures so it can be used from a
     * {@link com.umitunal.qworker.core.QueueClientFactory}.
     */
    public static RocksQueueClient open(StorageConfig config) {
        try {
            return new RocksQueueClient(config);
        } catch (RocksDBException e) {
            throw new QueueClientException("Failed to open queue store at " + config.getDataDirectory(), e);
        }
    }

    @Override
    public void register(String queueName, Consumer<Job> callback) {
        queuePrefix(queueName);
        consumers.put(queueName, callback);
    }

    @Override
    public void startConsuming() {
        running.set(true);
        try {
            while (running.get()) {
                boolean delivered = false;
                for (Map.Entry<String, Consumer<Job>> consumer : consumers.entrySet()) {
                    StoredJob head = head(consumer.getKey());
                    if (head != null) {
                        consumer.getValue().accept(head.job);
                        delete(head.key);
                        delivered = true;
                    }
                }
                if (!delivered) {
                    Thread.sleep(pollInterval.toMillis());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            running.set(false);
        }
    }

    @Override
    public void stopConsuming() {
        running.set(false);
    }

    public boolean isConsuming() {
        return running.get();
    }

    @Override
    public synchronized List<Job> drain(String queueName, int maxJobs) {
        byte[] prefix = queuePrefix(queueName);
        List<Job> drained = new ArrayList<>();

        try (final RocksIterator iter = database.newIterator(scanReadOpts);
             final WriteBatch batch = new WriteBatch()) {

            iter.seek(prefix);
            while (iter.isValid() && startsWith(iter.key(), prefix) && drained.size() < maxJobs) {
                drained.add(serializer.deserialize(iter.value()));
                batch.delete(iter.key());
                iter.next();
            }

            if (batch.count() > 0) {
                database.write(writeOpts, batch);
            }
        } catch (RocksDBException e) {
            throw new QueueClientException("Failed to drain queue " + queueName, e);
        }
        return drained;
    }

    @Override
    public void publish(String queueName, Job job) {
        byte[] key = storageKey(queuePrefix(queueName), sequence.incrementAndGet());
        try {
            database.put(writeOpts, key, serializer.serialize(job));
        } catch (RocksDBException e) {
            throw new QueueClientException("Failed to publish to queue " + queueName, e);
        }
    }

    /**
     * Number of jobs stored for a queue. Linear in the backlog.
     */
    public synchronized long backlogSize(String queueName) {
        byte[] prefix = queuePrefix(queueName);
        long size = 0;
        try (final RocksIterator iter = database.newIterator(scanReadOpts)) {
            iter.seek(prefix);
            while (iter.isValid() && startsWith(iter.key(), prefix)) {
                size++;
                iter.next();
            }
        }
        return size;
    }

    @Override
    public void close() {
        stopConsuming();
        if (scanReadOpts != null) scanReadOpts.close();
        if (writeOpts != null) writeOpts.close();
        if (database != null) database.close();
        if (dbOptions != null) dbOptions.close();
        if (blockCache != null) blockCache.close();
        if (bloomFilter != null) bloomFilter.close();
    }

    private synchronized StoredJob head(String queueName) {
        byte[] prefix = queuePrefix(queueName);
        try (final RocksIterator iter = database.newIterator(scanReadOpts)) {
            iter.seek(prefix);
            if (iter.isValid() && startsWith(iter.key(), prefix)) {
                return new StoredJob(iter.key(), serializer.deserialize(iter.value()));
            }
        }
        return null;
    }

    private synchronized void delete(byte[] key) {
        try {
            database.delete(writeOpts, key);
        } catch (RocksDBException e) {
            throw new QueueClientException("Failed to acknowledge delivered job", e);
        }
    }

    /**
     * Highest sequence already stored, so new keys sort after surviving jobs.
     */
    private long recoverSequence() {
        long max = 0;
        try (final RocksIterator iter = database.newIterator(scanReadOpts)) {
            iter.seekToFirst();
            while (iter.isValid()) {
                byte[] key = iter.key();
                if (key.length >= 9) {
                    max = Math.max(max, ByteBuffer.wrap(key, key.length - 8, 8).getLong());
                }
                iter.next();
            }
        }
        return max;
    }

    private static byte[] queuePrefix(String queueName) {
        byte[] name = queueName.getBytes(UTF_8);
        for (byte b : name) {
            if (b == SEPARATOR) {
                throw new IllegalArgumentException("Queue name must not contain NUL: " + queueName);
            }
        }
        byte[] prefix = new byte[name.length + 1];
        System.arraycopy(name, 0, prefix, 0, name.length);
        prefix[name.length] = SEPARATOR;
        return prefix;
    }

    private static byte[] storageKey(byte[] prefix, long seq) {
        ByteBuffer buffer = ByteBuffer.allocate(prefix.length + 8);
        buffer.put(prefix);
        buffer.putLong(seq);
        return buffer.array();
    }

    private static boolean startsWith(byte[] key, byte[] prefix) {
        if (key.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (key[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    private static final class StoredJob {
        private final byte[] key;
        private final Job job;

        private StoredJob(byte[] key, Job job) {
            this.key = key;
            this.job = job;
        }
    }
}
