package com.jobkeeper.core;

import com.jobkeeper.jobs.ClassInvocationJob;
import com.jobkeeper.jobs.HttpCallJob;
import com.jobkeeper.model.JobDefinition;
import com.jobkeeper.model.JobKind;
import org.junit.jupiter.api.Test;
import org.quartz.CronTrigger;
import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.Trigger;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;

import static org.junit.jupiter.api.Assertions.*;

public class JobDetailFactoryTest {
    private final JobDetailFactory factory = new JobDetailFactory(ZoneId.of("Asia/Shanghai"));

    private JobDefinition def(JobKind kind) {
        JobDefinition d = new JobDefinition("sync", "crm");
        d.setTriggerName("sync_Trigger");
        d.setTriggerGroup("crm");
        d.setJobKind(kind);
        d.setCronExpression("0 0 2 * * ?");
        return d;
    }

    @Test
    public void testClassJobCarriesTargetAndUserData() {
        JobDefinition d = def(JobKind.CLASS);
        d.setTarget("com.example.Sync");
        d.setJobData("{\"batch\":500}");
        JobDetail detail = factory.buildJob(d);

        assertEquals(ClassInvocationJob.class, detail.getJobClass());
        assertTrue(detail.isDurable());
        JobDataMap data = detail.getJobDataMap();
        assertEquals("com.example.Sync", data.getString(JobDataKeys.TARGET));
        assertEquals("500", data.getString("batch"));
        assertFalse(data.containsKey(JobDataKeys.HTTP_URL));
    }

    @Test
    public void testHttpJobCarriesRequestSettings() {
        JobDefinition d = def(JobKind.HTTP);
        d.setTarget("https://example.com/hook");
        d.setHttpMethod("POST");
        d.setHttpBody("{}");
        d.setHttpTimeoutSeconds(0);
        JobDetail detail = factory.buildJob(d);

        assertEquals(HttpCallJob.class, detail.getJobClass());
        JobDataMap data = detail.getJobDataMap();
        assertEquals("https://example.com/hook", data.getString(JobDataKeys.HTTP_URL));
        assertEquals("POST", data.getString(JobDataKeys.HTTP_METHOD));
        assertEquals("60", data.getString(JobDataKeys.HTTP_TIMEOUT_SECONDS));
        assertEquals("{}", data.getString(JobDataKeys.HTTP_BODY));
    }

    @Test
    public void testTriggerUsesZoneAndWindow() {
        JobDefinition d = def(JobKind.CLASS);
        // cron triggers keep whole seconds only
        d.setStartTime(LocalDateTime.now(ZoneId.of("Asia/Shanghai")).plusDays(2).truncatedTo(ChronoUnit.SECONDS));
        d.setEndTime(d.getStartTime().plusDays(10));
        Trigger t = factory.buildTrigger(d, factory.buildJob(d));

        assertEquals(JobDetailFactory.triggerKey(d), t.getKey());
        assertEquals(factory.toDate(d.getStartTime()), t.getStartTime());
        assertEquals(factory.toDate(d.getEndTime()), t.getEndTime());
        CronTrigger cron = (CronTrigger) t;
        assertEquals("Asia/Shanghai", cron.getTimeZone().getID());
        assertEquals(2, factory.toLocal(t.getFireTimeAfter(t.getStartTime())).getHour());
    }

    @Test
    public void testPastStartTimeStartsNow() {
        JobDefinition d = def(JobKind.CLASS);
        d.setStartTime(LocalDateTime.of(2000, 1, 1, 0, 0));
        long before = System.currentTimeMillis() / 1000 * 1000;
        Trigger t = factory.buildTrigger(d, factory.buildJob(d));
        assertTrue(t.getStartTime().getTime() >= before);
    }
}
