package ai.disksched.scheduler.policy;

import ai.disksched.scheduler.queue.RequestQueue;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

import static ai.disksched.scheduler.policy.PolicyTestUtils.drain;
import static ai.disksched.scheduler.policy.PolicyTestUtils.queueOf;

public class FifoPolicyTest {

    @Test
    public void arrivalOrder() {
        RequestQueue queue = queueOf(5, 2, 8);
        var cursor = new SchedulerCursor();

        Assert.assertEquals(List.of(5, 2, 8), drain(queue, new FifoPolicy(), cursor, 16));
        Assert.assertEquals(8, cursor.position());
        Assert.assertEquals(5 + 3 + 6, cursor.headMovement());
    }

    @Test
    public void outOfRangeBlockKeepsCursor() {
        RequestQueue queue = queueOf(3, 40);
        var cursor = new SchedulerCursor();

        Assert.assertEquals(List.of(3, 40), drain(queue, new FifoPolicy(), cursor, 16));
        Assert.assertEquals(3, cursor.position());
    }

    @Test
    public void modeCreatesPolicy() {
        Assert.assertTrue(SchedulingMode.FIFO.policy() instanceof FifoPolicy);
        Assert.assertTrue(SchedulingMode.SSTF.policy() instanceof SstfPolicy);
        Assert.assertTrue(SchedulingMode.SCAN.policy() instanceof ScanPolicy);
        Assert.assertEquals(SchedulingMode.SSTF, SchedulingMode.valueOf("SSTF"));
    }
}
