package com.umitunal.qworker.quarantine;

import com.umitunal.qworker.core.Job;
import com.umitunal.qworker.serialization.JobJson;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Append-only per-queue log of jobs that could not be processed.
 *
 * Each queue gets {@code <directory>/<queue>.errors}; each record is one line
 * {@code <ISO-8601 instant>\t<JSON array of jobs>}. A single job is written as a
 * one-element array. Files are never truncated.
 */
public class ErrorQuarantine {
    public static final String FILE_SUFFIX = ".errors";

    // One lock per file for every instance in the process
    private static final ConcurrentMap<Path, Object> FILE_LOCKS = new ConcurrentHashMap<>();

    private final Path directory;
    private final Clock clock;

    public ErrorQuarantine(Path directory) {
        this(directory, Clock.systemUTC());
    }

    public ErrorQuarantine(Path directory, Clock clock) {
        this.directory = directory;
        this.clock = clock;
    }

    public Path getDirectory() {
        return directory;
    }

    public Path errorFile(String queueName) {
        if (queueName == null || queueName.isEmpty() || queueName.contains("/")
                || queueName.contains("\\") || queueName.startsWith(".")) {
            throw new IllegalArgumentException("Queue name cannot be used as a file name: " + queueName);
        }
        return directory.resolve(queueName + FILE_SUFFIX);
    }

    public void record(String queueName, Job job) {
        record(queueName, List.of(job));
    }

    /**
     * Append one record holding all the given jobs.
     *
     * @throws UncheckedIOException if the record could not be written
     */
    public void record(String queueName, List<? extends Job> jobs) {
        Path file = errorFile(queueName);
        String line = clock.instant() + "\t" + JobJson.writeJobs(jobs) + "\n";
        byte[] bytes = line.getBytes(StandardCharsets.UTF_8);

        Object lock = FILE_LOCKS.computeIfAbsent(file.toAbsolutePath().normalize(), path -> new Object());
        synchronized (lock) {
            try {
                Files.createDirectories(directory);
                Files.write(file, bytes, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                        StandardOpenOption.APPEND);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to quarantine " + jobs.size() + " job(s) of queue " + queueName, e);
            }
        }
    }

    /**
     * Read back every record of a queue, oldest first. For offline inspection and replay.
     */
    public List<QuarantineRecord> read(String queueName) {
        Path file = errorFile(queueName);
        List<QuarantineRecord> records = new ArrayList<>();
        if (!Files.exists(file)) {
            return records;
        }

        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }

        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            int tab = line.indexOf('\t');
            if (tab < 0) {
                throw new IllegalStateException("Malformed quarantine line in " + file + ": " + line);
            }
            try {
                Instant timestamp = Instant.parse(line.substring(0, tab));
                records.add(new QuarantineRecord(timestamp, queueName, JobJson.readJobs(line.substring(tab + 1))));
            } catch (DateTimeParseException e) {
                throw new IllegalStateException("Malformed quarantine timestamp in " + file + ": " + line, e);
            }
        }
        return records;
    }
}
