package com.ableclub.monitor.events.scheduler;

import com.ableclub.monitor.config.MonitorProperties;
import com.ableclub.monitor.events.service.EventNotificationPipeline;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class JobSchedulerBootstrapTest {

    @Test
    void registersPipelineAndStartsWhenEnabled() throws Exception {
        JobScheduler scheduler = Mockito.mock(JobScheduler.class);
        EventNotificationPipeline pipeline = Mockito.mock(EventNotificationPipeline.class);
        MonitorProperties properties = new MonitorProperties();

        new JobSchedulerBootstrap(scheduler, pipeline, properties).run(null);

        verify(scheduler).registerJob(JobSchedulerBootstrap.toDefinition(properties.getJob()), pipeline);
        verify(scheduler).start();
    }

    @Test
    void disabledSchedulerOnlyRegisters() throws Exception {
        JobScheduler scheduler = Mockito.mock(JobScheduler.class);
        MonitorProperties properties = new MonitorProperties();
        properties.getScheduler().setEnabled(false);

        new JobSchedulerBootstrap(scheduler, Mockito.mock(EventNotificationPipeline.class), properties).run(null);

        verify(scheduler).registerJob(any(), any());
        verify(scheduler, never()).start();
    }

    @Test
    void propertiesMapOntoDefinition() {
        MonitorProperties.Job job = new MonitorProperties.Job();
        job.setInterval(Duration.ofMinutes(30));
        job.setMaxRetries(2);
        job.setBackoffSchedule(List.of(Duration.ofSeconds(10)));

        JobDefinition definition = JobSchedulerBootstrap.toDefinition(job);

        assertEquals("event-notification-pipeline", definition.name());
        assertEquals(Duration.ofMinutes(30), definition.interval());
        assertEquals(Duration.ofSeconds(10), definition.backoffAfter(1));
    }

    @Test
    void invalidPropertiesFailStartup() {
        MonitorProperties properties = new MonitorProperties();
        properties.getJob().setMaxRetries(5);
        properties.getJob().setBackoffSchedule(List.of());

        assertThatThrownBy(() -> new JobSchedulerBootstrap(
            Mockito.mock(JobScheduler.class),
            Mockito.mock(EventNotificationPipeline.class),
            properties
        ).run(null)).isInstanceOf(JobConfigurationException.class);
    }
}
