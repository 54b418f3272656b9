package com.jobkeeper.notify;

import com.jobkeeper.core.JobOutcome;
import com.jobkeeper.model.NotificationQuery;
import com.jobkeeper.model.NotificationRecord;
import com.jobkeeper.model.NotificationStatus;
import com.jobkeeper.model.Setting;
import com.jobkeeper.store.InMemoryJobStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.quartz.SchedulerException;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class NotificationDispatcherTest {
    private InMemoryJobStore store;
    private RecordingChannel channel;
    private NotificationDispatcher dispatcher;

    static class RecordingChannel implements NotificationChannel {
        final List<String> titles = new ArrayList<>();
        final List<String> contents = new ArrayList<>();
        volatile Exception failWith;

        @Override
        public boolean send(String title, String content, String format) throws Exception {
            if (failWith != null) {
                throw failWith;
            }
            titles.add(title);
            contents.add(content);
            return true;
        }
    }

    @BeforeEach
    public void setUp() {
        store = new InMemoryJobStore();
        channel = new RecordingChannel();
        dispatcher = new NotificationDispatcher(store, channel, Runnable::run, ZoneId.systemDefault());
    }

    private List<NotificationRecord> records() {
        return store.getNotifications(new NotificationQuery()).getItems();
    }

    private void enable(boolean onSuccess, String format) {
        NotificationPolicy p = new NotificationPolicy();
        p.setEnabled(true);
        p.setNotifyOnSuccess(onSuccess);
        p.setFormat(format);
        assertTrue(dispatcher.savePolicy(p));
    }

    @Test
    public void testNothingIsSentWithoutPolicy() {
        dispatcher.notifyJobResult("a", "g", false, "Job failed", 10L, "boom");
        dispatcher.notifySchedulerError("engine down", null);
        assertTrue(channel.titles.isEmpty());
        assertTrue(records().isEmpty());
        assertFalse(dispatcher.getPolicy().isEnabled());
    }

    @Test
    public void testFailureIsSentAndRecorded() {
        enable(false, "markdown");
        dispatcher.jobFinished(new JobOutcome("nightly", "ops", false, false, 1200L, "disk full"));
        dispatcher.jobFinished(new JobOutcome("nightly", "ops", true, false, 900L, null));

        assertEquals(List.of("Job failed: ops.nightly"), channel.titles);
        assertTrue(channel.contents.get(0).contains("- **Error**: disk full"));
        assertTrue(channel.contents.get(0).contains("1200 ms"));

        List<NotificationRecord> recs = records();
        assertEquals(1, recs.size());
        NotificationRecord r = recs.get(0);
        assertEquals(NotificationStatus.SENT, r.getStatus());
        assertEquals(NotificationDispatcher.TRIGGER_JOB_FAILURE, r.getTriggeredBy());
        assertNotNull(r.getSendTime());
        assertNotNull(r.getDurationMillis());
    }

    @Test
    public void testSuccessIsSentWhenEnabled() {
        enable(true, "txt");
        dispatcher.notifyJobResult("a", "g", true, "Job completed", 5L, null);
        assertEquals(1, channel.titles.size());
        assertTrue(channel.contents.get(0).startsWith("Job succeeded: g.a\n"));
    }

    @Test
    public void testChannelErrorMarksRecordFailed() {
        enable(false, "txt");
        channel.failWith = new java.io.IOException("connection refused");
        dispatcher.notifyJobResult("a", "g", false, "Job failed", null, "x");

        NotificationRecord r = records().get(0);
        assertEquals(NotificationStatus.FAILED, r.getStatus());
        assertEquals("connection refused", r.getErrorMessage());
        assertEquals(1, records().size());
    }

    @Test
    public void testSchedulerErrorsFollowPolicy() {
        enable(false, "html");
        new SchedulerErrorListener(dispatcher).schedulerError("thread pool exhausted", new SchedulerException("no threads"));
        assertEquals(List.of("Scheduler error"), channel.titles);
        assertTrue(channel.contents.get(0).startsWith("<h3>Scheduler error</h3>"));

        NotificationPolicy p = dispatcher.getPolicy();
        p.setNotifyOnSchedulerError(false);
        dispatcher.savePolicy(p);
        dispatcher.notifySchedulerError("again", null);
        assertEquals(1, channel.titles.size());
    }

    @Test
    public void testTestNotificationIgnoresEventSwitches() {
        NotificationRecord r = dispatcher.sendTest();
        assertEquals(NotificationStatus.SENT, r.getStatus());
        assertEquals(NotificationDispatcher.TRIGGER_TEST, dispatcher.getNotification(r.getNotificationId()).getTriggeredBy());
        assertTrue(dispatcher.deleteNotification(r.getNotificationId()));
        assertNull(dispatcher.getNotification(r.getNotificationId()));
    }

    @Test
    public void testUnreadablePolicyFallsBackToDefault() {
        store.saveSetting(new Setting(NotificationPolicy.SETTING_KEY, "{broken"));
        NotificationPolicy p = dispatcher.getPolicy();
        assertFalse(p.isEnabled());
        assertTrue(p.isNotifyOnFailure());
        assertEquals("txt", p.getFormat());
    }

    @Test
    public void testPolicyRoundTripAndFormatNormalization() {
        NotificationPolicy p = new NotificationPolicy();
        p.setEnabled(true);
        p.setFormat("HTML");
        dispatcher.savePolicy(p);
        assertEquals("html", dispatcher.getPolicy().getFormat());

        p.setFormat("pdf");
        assertEquals("txt", p.getFormat());
    }

    @Test
    public void testHtmlIsEscaped() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("Error", "<script>alert(1)</script>");
        String html = NotificationDispatcher.render("html", "t & t", fields);
        assertTrue(html.contains("t &amp; t"));
        assertTrue(html.contains("&lt;script&gt;"));
        assertFalse(html.contains("<script>"));
    }

    @Test
    public void testRejectedDispatchIsRecordedAsFailed() {
        enable(false, "txt");
        NotificationDispatcher closed = new NotificationDispatcher(store, channel, r -> {
            throw new java.util.concurrent.RejectedExecutionException("closed");
        }, ZoneId.systemDefault());
        closed.notifyJobResult("a", "g", false, "Job failed", null, null);
        assertEquals(NotificationStatus.FAILED, records().get(0).getStatus());
        assertTrue(closed.clearNotifications(new NotificationQuery()));
        assertTrue(records().isEmpty());
    }
}
