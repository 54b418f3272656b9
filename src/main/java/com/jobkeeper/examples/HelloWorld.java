package com.jobkeeper.examples;

import com.jobkeeper.core.JobClassRegistry;
import com.jobkeeper.core.JobKeeper;
import com.jobkeeper.core.JobKeeperConfig;
import com.jobkeeper.core.JobOrchestrator;
import com.jobkeeper.model.JobDefinition;

public class HelloWorld {
    public static void main(String[] args) throws Exception {
        JobKeeperConfig.load(JobKeeperConfig.defaultPath());
        JobClassRegistry registry = new JobClassRegistry().register(HelloWorldJob.class, HelloWorldJob::new);
        JobKeeper keeper = new JobKeeper(registry);
        keeper.start();

        JobOrchestrator jobs = keeper.getOrchestrator();
        JobDefinition hello = new JobDefinition();
        hello.setJobName("hello");
        hello.setTarget(HelloWorldJob.class.getName());
        hello.setCronExpression("0/2 * * * * ?");
        hello.setJobData("{\"name\":\"JobKeeper\"}");
        System.out.println(jobs.addJob(hello));
        System.out.println(jobs.triggerJob("hello", JobDefinition.DEFAULT_GROUP));
        // give the job some time to run
        Thread.sleep(5000);
        keeper.shutdown();
    }
}
