package com.clusterops.orchestrator;

import org.apache.log4j.LogManager;
import org.apache.log4j.Logger;
import org.quartz.DisallowConcurrentExecution;
import org.quartz.Job;
import org.quartz.JobDataMap;
import org.quartz.JobExecutionContext;
import org.quartz.JobExecutionException;

// one status check per tick; a tick never overlaps the previous one for the same request
@DisallowConcurrentExecution
public class ReconcilePollJob implements Job {
    final static Logger LOG = LogManager.getLogger(ReconcilePollJob.class);

    public void execute(JobExecutionContext context) throws JobExecutionException {
        JobDataMap data = context.getMergedJobDataMap();
        ReconciliationPoller poller = (ReconciliationPoller) data.get(JobScheduler.COMPONENT);
        String id = data.getString(JobScheduler.REQUEST_ID);
        try {
            poller.pollOnce(id);
        } catch (RuntimeException e) {
            LOG.error("Status check for " + id + " failed unexpectedly", e);
            throw new JobExecutionException(e, false);
        }
    }
}
