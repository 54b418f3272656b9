package com.jobkeeper.examples;

import org.quartz.Job;
import org.quartz.JobExecutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class HelloWorldJob implements Job {
    private static final Logger log = LoggerFactory.getLogger(HelloWorldJob.class);

    @Override
    public void execute(JobExecutionContext context) {
        Object who = context.getMergedJobDataMap().get("name");
        log.info("Hello {}!", who == null ? "world" : who);
        context.setResult("greeted " + (who == null ? "world" : who));
    }
}
