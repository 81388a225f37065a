package com.ableclub.monitor.events.scheduler;

import com.ableclub.monitor.config.MonitorProperties;
import com.ableclub.monitor.events.service.EventNotificationPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/** Registers the notification pipeline and starts firing it once the context is up. */
@Component
public class JobSchedulerBootstrap implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(JobSchedulerBootstrap.class);

    private final JobScheduler scheduler;
    private final EventNotificationPipeline pipeline;
    private final MonitorProperties properties;

    public JobSchedulerBootstrap(JobScheduler scheduler, EventNotificationPipeline pipeline, MonitorProperties properties) {
        this.scheduler = scheduler;
        this.pipeline = pipeline;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        JobDefinition definition = toDefinition(properties.getJob());
        scheduler.registerJob(definition, pipeline);
        if (!properties.getScheduler().isEnabled()) {
            log.info("Job scheduler disabled; {} registered but will only run when triggered", definition.name());
            return;
        }
        scheduler.start();
    }

    static JobDefinition toDefinition(MonitorProperties.Job job) {
        return new JobDefinition(
            job.getName(),
            job.getInterval(),
            job.getMaxRetries(),
            job.getBackoffSchedule(),
            job.getPauseThreshold(),
            job.getPauseDuration()
        );
    }
}
