package ai.disksched.scheduler.mocks;

import ai.disksched.device.MemoryBlockDevice;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory device that records the order blocks were accessed in, the threads doing I/O and
 * whether two operations ever overlapped.
 */
public class RecordingBlockDevice extends MemoryBlockDevice {
    private final List<Integer> accessed = Collections.synchronizedList(new ArrayList<>());
    private final Set<String> ioThreads = ConcurrentHashMap.newKeySet();
    private final Set<Integer> failingBlocks = ConcurrentHashMap.newKeySet();
    private final Set<Integer> crashingBlocks = ConcurrentHashMap.newKeySet();
    private final AtomicInteger inFlight = new AtomicInteger(0);
    private final AtomicBoolean overlapped = new AtomicBoolean(false);

    private volatile long delayMillis = 0;

    public RecordingBlockDevice(String name, int blockCount) {
        super(name, blockCount, 64);
    }

    public RecordingBlockDevice withDelay(long millis) {
        this.delayMillis = millis;
        return this;
    }

    public RecordingBlockDevice failOn(int block) {
        failingBlocks.add(block);
        return this;
    }

    /**
     * Accessing {@code block} throws an {@link Error}, which the scheduler loop does not survive.
     */
    public RecordingBlockDevice crashOn(int block) {
        crashingBlocks.add(block);
        return this;
    }

    @Override
    public void read(int block, byte[] data) throws IOException {
        try {
            enter(block);
            super.read(block, data);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    @Override
    public void write(int block, byte[] data) throws IOException {
        try {
            enter(block);
            super.write(block, data);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    private void enter(int block) throws IOException {
        if (inFlight.incrementAndGet() > 1) {
            overlapped.set(true);
        }
        ioThreads.add(Thread.currentThread().getName());
        accessed.add(block);

        if (delayMillis > 0) {
            try {
                Thread.sleep(delayMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (crashingBlocks.contains(block)) {
            throw new AssertionError("Injected crash at block " + block);
        }
        if (failingBlocks.contains(block)) {
            throw new IOException("Injected failure at block " + block);
        }
    }

    public List<Integer> accessed() {
        synchronized (accessed) {
            return List.copyOf(accessed);
        }
    }

    public Set<String> ioThreads() {
        return Set.copyOf(ioThreads);
    }

    public boolean overlapped() {
        return overlapped.get();
    }
}
