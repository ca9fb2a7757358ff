package com.umitunal.qworker.workers;

import com.umitunal.qworker.core.Job;
import com.umitunal.qworker.worker.LoopQueueProcessingWorker;
import com.umitunal.qworker.worker.WorkerContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Reports slow request log lines to the errors stream, one message per batch.
 */
public class SlowQueryWorker extends LoopQueueProcessingWorker {
    private static final Logger log = LoggerFactory.getLogger(SlowQueryWorker.class);

    public static final String QUEUE_NAME = "slow_queries";
    static final Duration IDLE_INTERVAL = Duration.ofSeconds(60);

    private final ErrorStreamSender sender;

    public SlowQueryWorker(WorkerContext context, ErrorStreamSender sender) {
        super(context);
        this.sender = Objects.requireNonNull(sender, "sender");
    }

    @Override
    protected Duration getIdleInterval() {
        return IDLE_INTERVAL;
    }

    @Override
    protected void consumeBatch(List<Job> jobs) throws Exception {
        StringBuilder content = new StringBuilder();
        for (Job job : jobs) {
            String line = Payloads.requireString(job, "log_line");
            log.info("Slow query: {}", line);
            content.append("    ").append(line).append('\n');
        }
        if (content.length() == 0) {
            return;
        }
        sender.send(getContext().getConfig().getHostName() + ": slow queries", content.toString());
    }
}
