package ai.disksched.device;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Heap-backed block device. Contents are lost on close.
 */
public class MemoryBlockDevice implements BlockDevice {
    private static final Logger LOG = LogManager.getLogger(MemoryBlockDevice.class);

    private final String name;
    private final byte[][] blocks;
    private final int blockSize;

    private final AtomicLong reads = new AtomicLong(0);
    private final AtomicLong writes = new AtomicLong(0);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public MemoryBlockDevice(String name, int blockCount) {
        this(name, blockCount, FileBlockDevice.DEFAULT_BLOCK_SIZE);
    }

    public MemoryBlockDevice(String name, int blockCount, int blockSize) {
        if (blockCount <= 0) {
            throw new IllegalArgumentException("Block count must be positive, got " + blockCount);
        }
        if (blockSize <= 0) {
            throw new IllegalArgumentException("Block size must be positive, got " + blockSize);
        }
        this.name = name;
        this.blocks = new byte[blockCount][];
        this.blockSize = blockSize;
    }

    @Override
    public int blockCount() {
        return blocks.length;
    }

    @Override
    public int blockSize() {
        return blockSize;
    }

    @Override
    public void read(int block, byte[] data) throws IOException {
        BlockDevice.checkAccess(this, block, data);
        ensureOpen();

        final byte[] stored = blocks[block];
        if (stored == null) {
            Arrays.fill(data, (byte) 0);
        } else {
            System.arraycopy(stored, 0, data, 0, blockSize);
        }
        reads.incrementAndGet();
    }

    @Override
    public void write(int block, byte[] data) throws IOException {
        BlockDevice.checkAccess(this, block, data);
        ensureOpen();

        blocks[block] = data.clone();
        writes.incrementAndGet();
    }

    @Override
    public DeviceStats stats() {
        return new DeviceStats(reads.get(), writes.get());
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            final DeviceStats stats = stats();
            LOG.info("Closing in-memory device {}: {} block reads, {} block writes",
                name, stats.reads(), stats.writes());
        }
    }

    @Override
    public String toString() {
        return "MemoryBlockDevice{" + name + "}";
    }

    private void ensureOpen() throws IOException {
        if (closed.get()) {
            throw new IOException("Device " + name + " is closed");
        }
    }
}
