package ai.disksched.scheduler.policy;

import ai.disksched.scheduler.queue.IoRequest;
import ai.disksched.scheduler.queue.RequestQueue;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

import static ai.disksched.scheduler.policy.PolicyTestUtils.drain;
import static ai.disksched.scheduler.policy.PolicyTestUtils.queueOf;

public class ScanPolicyTest {
    private final ScanPolicy policy = new ScanPolicy();

    @Test
    public void reversesAtTopEdge() {
        var cursor = new SchedulerCursor(14, SchedulerCursor.UP);
        RequestQueue queue = queueOf(0, 15);

        Assert.assertEquals(15, queue.selectAndRemove(policy, cursor, 16).block());
        Assert.assertEquals(SchedulerCursor.UP, cursor.direction());
        Assert.assertEquals(0, queue.selectAndRemove(policy, cursor, 16).block());
        Assert.assertEquals(SchedulerCursor.DOWN, cursor.direction());
        Assert.assertEquals(0, cursor.position());
    }

    @Test
    public void reversesAtBottomEdge() {
        var cursor = new SchedulerCursor(3, SchedulerCursor.DOWN);
        Assert.assertEquals(List.of(2, 1, 9), drain(queueOf(9, 2, 1), policy, cursor, 16));
        Assert.assertEquals(SchedulerCursor.UP, cursor.direction());
    }

    @Test
    public void sweepContinuesAcrossCalls() {
        var cursor = new SchedulerCursor();
        RequestQueue queue = queueOf(5);

        Assert.assertEquals(5, queue.selectAndRemove(policy, cursor, 16).block());
        Assert.assertEquals(5, cursor.position());

        queue.enqueue(IoRequest.read(3, new byte[0]));
        queue.enqueue(IoRequest.read(8, new byte[0]));
        Assert.assertEquals(List.of(8, 3), drain(queue, policy, cursor, 16));
    }

    @Test
    public void requestsAtCursorBlockAreServedWithoutMoving() {
        var cursor = new SchedulerCursor(4, SchedulerCursor.UP);
        Assert.assertEquals(List.of(4, 4, 6), drain(queueOf(6, 4, 4), policy, cursor, 16));
        Assert.assertEquals(2, cursor.headMovement());
    }

    @Test
    public void singleBlockDevice() {
        var cursor = new SchedulerCursor();
        Assert.assertEquals(List.of(0, 0), drain(queueOf(0, 0), policy, cursor, 1));
    }

    @Test
    public void outOfRangeRequestTerminates() {
        var cursor = new SchedulerCursor(2, SchedulerCursor.UP);
        Assert.assertEquals(List.of(7, 20), drain(queueOf(20, 7), policy, cursor, 8));
    }

    @Test
    public void sweepsHugeDevice() {
        var cursor = new SchedulerCursor(3, SchedulerCursor.UP);
        RequestQueue queue = queueOf(100, 5);

        Assert.assertEquals(5, queue.selectAndRemove(policy, cursor, 1 << 30).block());
        Assert.assertEquals(5, cursor.position());
        Assert.assertEquals(SchedulerCursor.UP, cursor.direction());
    }

    @Test
    public void invalidCursor() {
        Assert.assertThrows(IllegalArgumentException.class, () -> new SchedulerCursor(0, 0));
        Assert.assertThrows(IllegalArgumentException.class, () -> new SchedulerCursor(-1, SchedulerCursor.UP));
    }
}
