package com.clusterops.orchestrator;

import org.quartz.DisallowConcurrentExecution;
import org.quartz.Job;
import org.quartz.JobDataMap;
import org.quartz.JobExecutionContext;

@DisallowConcurrentExecution
public class ProgressTickJob implements Job {
    public void execute(JobExecutionContext context) {
        JobDataMap data = context.getMergedJobDataMap();
        LifecycleController controller = (LifecycleController) data.get(JobScheduler.COMPONENT);
        controller.tickProgress(data.getString(JobScheduler.REQUEST_ID));
    }
}
