package com.umitunal.qworker.workers;

import com.umitunal.qworker.core.Job;
import com.umitunal.qworker.worker.ProcessingResult;
import com.umitunal.qworker.worker.QueueProcessingWorker;
import com.umitunal.qworker.worker.WorkerContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Adds newly signed up users to the mailing list.
 *
 * A 400 answer is retried, except "Member Exists" which is already the goal.
 * Any other 4xx is quarantined straight away; 5xx and transport failures are
 * retried.
 */
public class SignupWorker extends QueueProcessingWorker {
    private static final Logger log = LoggerFactory.getLogger(SignupWorker.class);

    public static final String QUEUE_NAME = "signups";
    static final String MEMBER_EXISTS = "Member Exists";

    private final MailingListClient mailingList;

    public SignupWorker(WorkerContext context, MailingListClient mailingList) {
        super(context);
        this.mailingList = Objects.requireNonNull(mailingList, "mailingList");
    }

    @Override
    protected ProcessingResult consume(Job job) throws IOException {
        long userId = Payloads.requireLong(job, "user_id");
        log.info("Processing signup for user {}", userId);
        if (!mailingList.isConfigured()) {
            log.debug("No mailing list credentials, skipping signup of user {}", userId);
            return ProcessingResult.success();
        }

        Map<String, Object> member = new LinkedHashMap<>(job.getPayload());
        member.remove("user_id");
        member.put("status", "subscribed");

        MailingListResponse response = mailingList.subscribe(member);
        int status = response.getStatusCode();
        if (response.isSuccessful()) {
            return ProcessingResult.success();
        }
        if (status == 400) {
            if (MEMBER_EXISTS.equals(response.errorTitle())) {
                log.warn("Attempted to sign up already existing email to list: {}", job.get("email_address"));
                return ProcessingResult.success();
            }
            return ProcessingResult.retry("Mailing list rejected signup of user " + userId + ": " + response);
        }
        if (status >= 400 && status < 500) {
            return ProcessingResult.fatal("Mailing list refused signup of user " + userId + ": " + response);
        }
        throw new IOException("Mailing list failed for user " + userId + ": " + response);
    }
}
