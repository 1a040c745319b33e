package com.clusterops.orchestrator;

import org.apache.log4j.LogManager;
import org.apache.log4j.Logger;
import org.quartz.DisallowConcurrentExecution;
import org.quartz.Job;
import org.quartz.JobExecutionContext;

import java.util.Date;

@DisallowConcurrentExecution
public class RetentionSweepJob implements Job {
    final static Logger LOG = LogManager.getLogger(RetentionSweepJob.class);

    public void execute(JobExecutionContext context) {
        ProvisioningService service = (ProvisioningService) context.getMergedJobDataMap().get(JobScheduler.COMPONENT);
        LOG.debug("Retention sweep - " + new Date());
        service.sweep();
    }
}
