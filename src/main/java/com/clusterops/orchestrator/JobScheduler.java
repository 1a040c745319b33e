package com.clusterops.orchestrator;

import org.apache.log4j.LogManager;
import org.apache.log4j.Logger;
import org.quartz.Job;
import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.Trigger;
import org.quartz.impl.StdSchedulerFactory;

import java.util.Date;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicInteger;

import static org.quartz.JobBuilder.newJob;
import static org.quartz.SimpleScheduleBuilder.simpleSchedule;
import static org.quartz.TriggerBuilder.newTrigger;

/**
 * Owns every periodic task of the orchestrator. A timer is identified by (kind, request id);
 * starting a timer replaces any existing one with the same identity, so there is never more than
 * one progress tick, reconciliation poll or deletion poll per request.
 *
 * <p>Jobs find the component they drive under {@link #COMPONENT} and their request id under
 * {@link #REQUEST_ID} in the job data map.
 */
public class JobScheduler {
    final static Logger LOG = LogManager.getLogger(JobScheduler.class);

    public static final String COMPONENT = "component";
    public static final String REQUEST_ID = "requestId";

    private static final AtomicInteger INSTANCES = new AtomicInteger();

    private final Scheduler sched;

    public JobScheduler(int threadCount) throws SchedulerException {
        Properties props = new Properties();
        // each orchestrator gets its own scheduler, StdSchedulerFactory caches them by name
        props.setProperty("org.quartz.scheduler.instanceName", "orchestrator-" + INSTANCES.incrementAndGet());
        props.setProperty("org.quartz.scheduler.skipUpdateCheck", "true");
        props.setProperty("org.quartz.threadPool.class", "org.quartz.simpl.SimpleThreadPool");
        props.setProperty("org.quartz.threadPool.threadCount", String.valueOf(threadCount));
        props.setProperty("org.quartz.jobStore.class", "org.quartz.simpl.RAMJobStore");
        props.setProperty("org.quartz.jobStore.misfireThreshold", "5000");
        this.sched = new StdSchedulerFactory(props).getScheduler();
    }

    public void start() throws SchedulerException {
        sched.start();
        LOG.info("------- Started Scheduler " + sched.getSchedulerName() + " -----------------");
    }

    /**
     * Schedule {@code jobClass} to fire after {@code delayMillis} and then every
     * {@code intervalMillis}, replacing an existing timer with the same identity.
     */
    public void start(TimerKind kind, String id, long delayMillis, long intervalMillis,
                      Class<? extends Job> jobClass, Object component) {
        JobKey key = JobKey.jobKey(id, kind.group());
        JobDataMap data = new JobDataMap();
        data.put(COMPONENT, component);
        data.put(REQUEST_ID, id);
        JobDetail job = newJob(jobClass).withIdentity(key).usingJobData(data).build();
        Trigger trigger = newTrigger()
                .withIdentity(id, kind.group())
                .startAt(new Date(System.currentTimeMillis() + delayMillis))
                .withSchedule(simpleSchedule()
                        .withIntervalInMilliseconds(intervalMillis)
                        .repeatForever()
                        .withMisfireHandlingInstructionNextWithRemainingCount())
                .build();
        try {
            if (sched.checkExists(key)) {
                sched.deleteJob(key);
            }
            sched.scheduleJob(job, trigger);
            LOG.debug("Started " + kind + " timer for " + id + " (delay " + delayMillis + "ms, every " + intervalMillis + "ms)");
        } catch (SchedulerException e) {
            throw new IllegalStateException("Could not schedule " + kind + " timer for " + id, e);
        }
    }

    // stop one timer; a tick that is already running finishes but does not fire again
    public boolean stop(TimerKind kind, String id) {
        try {
            boolean deleted = sched.deleteJob(JobKey.jobKey(id, kind.group()));
            if (deleted) {
                LOG.debug("Stopped " + kind + " timer for " + id);
            }
            return deleted;
        } catch (SchedulerException e) {
            LOG.error("Could not stop " + kind + " timer for " + id, e);
            return false;
        }
    }

    public void stopAll(String id) {
        for (TimerKind kind : TimerKind.values()) {
            stop(kind, id);
        }
    }

    public boolean isActive(TimerKind kind, String id) {
        try {
            return sched.checkExists(JobKey.jobKey(id, kind.group()));
        } catch (SchedulerException e) {
            LOG.error("Could not look up " + kind + " timer for " + id, e);
            return false;
        }
    }

    public void shutdown() {
        try {
            if (!sched.isShutdown()) {
                sched.shutdown(true);
                LOG.info("------- Shutdown Scheduler -----------------");
            }
        } catch (SchedulerException e) {
            LOG.error("Scheduler did not shut down cleanly", e);
        }
    }
}
