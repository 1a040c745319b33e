package com.clusterops.orchestrator;

import org.apache.log4j.LogManager;
import org.apache.log4j.Logger;
import org.quartz.DisallowConcurrentExecution;
import org.quartz.Job;
import org.quartz.JobDataMap;
import org.quartz.JobExecutionContext;
import org.quartz.JobExecutionException;

@DisallowConcurrentExecution
public class DeletionPollJob implements Job {
    final static Logger LOG = LogManager.getLogger(DeletionPollJob.class);

    public void execute(JobExecutionContext context) throws JobExecutionException {
        JobDataMap data = context.getMergedJobDataMap();
        CancellationCoordinator coordinator = (CancellationCoordinator) data.get(JobScheduler.COMPONENT);
        String id = data.getString(JobScheduler.REQUEST_ID);
        try {
            coordinator.pollDeletion(id);
        } catch (RuntimeException e) {
            LOG.error("Deletion check for " + id + " failed unexpectedly", e);
            throw new JobExecutionException(e, false);
        }
    }
}
