package com.umitunal.qworker.workers;

import com.umitunal.qworker.ratelimit.RateLimiter;
import com.umitunal.qworker.registry.WorkerRegistry;

import java.util.Objects;

/**
 * Binds the built-in workers to their queues.
 *
 * Only workers whose collaborators were supplied are registered.
 */
public final class StandardWorkers {
    static final String LOOP_QUEUE_TYPE = "loop";

    private EmailSender emailSender;
    private PushNotificationService pushNotificationService;
    private EmailMirror emailMirror;
    private RateLimiter mirrorRateLimiter;
    private MailingListClient mailingListClient;
    private InvitationService invitationService;
    private MissedMessageNotifier missedMessageNotifier;
    private UserActivityRecorder userActivityRecorder;
    private ErrorStreamSender errorStreamSender;

    private StandardWorkers() {
    }

    public static StandardWorkers newBuilder() {
        return new StandardWorkers();
    }

    public StandardWorkers withEmailSender(EmailSender sender) {
        this.emailSender = sender;
        return this;
    }

    public StandardWorkers withPushNotificationService(PushNotificationService service) {
        this.pushNotificationService = service;
        return this;
    }

    public StandardWorkers withEmailMirror(EmailMirror mirror, RateLimiter rateLimiter) {
        this.emailMirror = mirror;
        this.mirrorRateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        return this;
    }

    public StandardWorkers withMailingListClient(MailingListClient client) {
        this.mailingListClient = client;
        return this;
    }

    public StandardWorkers withInvitationService(InvitationService service) {
        this.invitationService = service;
        return this;
    }

    public StandardWorkers withMissedMessageNotifier(MissedMessageNotifier notifier) {
        this.missedMessageNotifier = notifier;
        return this;
    }

    public StandardWorkers withUserActivityRecorder(UserActivityRecorder recorder) {
        this.userActivityRecorder = recorder;
        return this;
    }

    public StandardWorkers withErrorStreamSender(ErrorStreamSender sender) {
        this.errorStreamSender = sender;
        return this;
    }

    public void registerInto(WorkerRegistry registry) {
        if (emailSender != null) {
            EmailSender sender = emailSender;
            registry.assignQueue(EmailSendingWorker.QUEUE_NAME, EmailSendingWorker.class,
                    context -> new EmailSendingWorker(context, sender));
        }
        if (pushNotificationService != null) {
            PushNotificationService service = pushNotificationService;
            registry.assignQueue(PushNotificationsWorker.QUEUE_NAME, PushNotificationsWorker.class,
                    context -> new PushNotificationsWorker(context, service));
        }
        if (emailMirror != null) {
            EmailMirror mirror = emailMirror;
            RateLimiter rateLimiter = mirrorRateLimiter;
            registry.assignQueue(MirrorWorker.QUEUE_NAME, MirrorWorker.class,
                    context -> new MirrorWorker(context, mirror, rateLimiter));
        }
        if (mailingListClient != null) {
            MailingListClient client = mailingListClient;
            registry.assignQueue(SignupWorker.QUEUE_NAME, SignupWorker.class,
                    context -> new SignupWorker(context, client));
        }
        if (invitationService != null) {
            InvitationService service = invitationService;
            registry.assignQueue(ConfirmationEmailWorker.QUEUE_NAME, ConfirmationEmailWorker.class,
                    context -> new ConfirmationEmailWorker(context, service));
        }
        if (missedMessageNotifier != null) {
            MissedMessageNotifier notifier = missedMessageNotifier;
            registry.assignQueue(MissedMessageWorker.QUEUE_NAME, MissedMessageWorker.class,
                    context -> new MissedMessageWorker(context, notifier));
        }
        if (userActivityRecorder != null) {
            UserActivityRecorder recorder = userActivityRecorder;
            registry.assignQueue(UserActivityWorker.QUEUE_NAME, LOOP_QUEUE_TYPE, true, UserActivityWorker.class,
                    context -> new UserActivityWorker(context, recorder));
        }
        if (errorStreamSender != null) {
            ErrorStreamSender sender = errorStreamSender;
            registry.assignQueue(SlowQueryWorker.QUEUE_NAME, LOOP_QUEUE_TYPE, true, SlowQueryWorker.class,
                    context -> new SlowQueryWorker(context, sender));
        }
    }
}
