package com.ableclub.monitor.events.notify;

import com.ableclub.monitor.config.MonitorProperties;
import com.ableclub.monitor.events.model.DeliveryResult;
import com.ableclub.monitor.events.model.NotificationChannel;
import com.ableclub.monitor.events.model.RenderedMessage;
import com.ableclub.monitor.events.scheduler.JobAlertListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/** Tells administrators about failing and paused jobs. */
@Component
public class JobAlertNotifier implements JobAlertListener {
    private static final Logger log = LoggerFactory.getLogger(JobAlertNotifier.class);

    private final NotificationDispatcher dispatcher;
    private final List<String> adminAddresses;
    private final Clock clock;

    public JobAlertNotifier(NotificationDispatcher dispatcher, MonitorProperties properties, Clock clock) {
        this.dispatcher = dispatcher;
        this.adminAddresses = properties.getNotify().getAdminAddresses();
        this.clock = clock;
    }

    @Override
    public void cycleFailed(String jobName, int attempts, String errorSummary) {
        log.warn("Job failure alert: job={} attempts={} error={}", jobName, attempts, errorSummary);
        send(new RenderedMessage(
            "[AbleClub Monitor] Job " + jobName + " failed",
            "Job " + jobName + " failed after " + attempts + " attempt(s).\n\n"
                + "Error: " + errorSummary + "\n"
                + "Time: " + clock.instant() + "\n\n"
                + "Check the job history and application logs for details."
        ));
    }

    @Override
    public void jobPaused(String jobName, int consecutiveFailures, Instant pausedUntil) {
        log.warn("Job pause alert: job={} consecutiveFailures={} pausedUntil={}", jobName, consecutiveFailures, pausedUntil);
        send(new RenderedMessage(
            "[AbleClub Monitor] Job " + jobName + " paused",
            "Job " + jobName + " failed " + consecutiveFailures + " consecutive cycles and is paused until "
                + pausedUntil + ". It resumes automatically after that."
        ));
    }

    @Override
    public void jobResumed(String jobName) {
        log.info("Job {} resumed after its pause elapsed", jobName);
    }

    private void send(RenderedMessage message) {
        for (String address : adminAddresses) {
            DeliveryResult result = dispatcher.deliver(address, NotificationChannel.EMAIL, message);
            if (!result.delivered()) {
                log.warn("Failed to deliver job alert to {}: {} {}", address, result.errorCode(), result.errorMessage());
            }
        }
    }
}
