package com.umitunal.qworker.quarantine;

import com.umitunal.qworker.core.Job;
import com.umitunal.qworker.core.QueueClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Puts quarantined jobs back on their queue with a fresh retry budget.
 * The log itself is left untouched.
 */
public class QuarantineReplayer {
    private static final Logger log = LoggerFactory.getLogger(QuarantineReplayer.class);

    private final ErrorQuarantine quarantine;

    public QuarantineReplayer(ErrorQuarantine quarantine) {
        this.quarantine = quarantine;
    }

    /**
     * @return the number of jobs re-published
     */
    public int replay(String queueName, QueueClient client) {
        int replayed = 0;
        for (QuarantineRecord record : quarantine.read(queueName)) {
            for (Job job : record.getJobs()) {
                client.publish(queueName, job.withFailedTries(0));
                replayed++;
            }
        }
        log.info("Replayed {} quarantined job(s) onto queue {}", replayed, queueName);
        return replayed;
    }
}
