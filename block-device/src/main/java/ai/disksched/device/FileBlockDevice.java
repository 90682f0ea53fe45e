package ai.disksched.device;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Block device stored in a regular file, {@code blockCount * blockSize} bytes long.
 */
public class FileBlockDevice implements BlockDevice {
    private static final Logger LOG = LogManager.getLogger(FileBlockDevice.class);

    public static final int DEFAULT_BLOCK_SIZE = 4096;

    private final Path path;
    private final FileChannel channel;
    private final int blockCount;
    private final int blockSize;

    private final AtomicLong reads = new AtomicLong(0);
    private final AtomicLong writes = new AtomicLong(0);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private FileBlockDevice(Path path, FileChannel channel, int blockCount, int blockSize) {
        this.path = path;
        this.channel = channel;
        this.blockCount = blockCount;
        this.blockSize = blockSize;
    }

    public static FileBlockDevice createOrOpen(Path path, int blockCount) throws IOException {
        return createOrOpen(path, blockCount, DEFAULT_BLOCK_SIZE);
    }

    public static FileBlockDevice createOrOpen(Path path, int blockCount, int blockSize) throws IOException {
        if (blockCount <= 0) {
            throw new IllegalArgumentException("Block count must be positive, got " + blockCount);
        }
        if (blockSize <= 0) {
            throw new IllegalArgumentException("Block size must be positive, got " + blockSize);
        }

        final FileChannel channel = FileChannel.open(path,
            StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
        try {
            final long size = (long) blockCount * blockSize;
            if (channel.size() > size) {
                channel.truncate(size);
            } else if (channel.size() < size) {
                // extend with a single byte at the end, the rest of the file reads as zeros
                channel.write(ByteBuffer.wrap(new byte[1]), size - 1);
            }
        } catch (IOException e) {
            channel.close();
            throw e;
        }

        LOG.info("Opened device {} with {} blocks of {} bytes", path, blockCount, blockSize);
        return new FileBlockDevice(path, channel, blockCount, blockSize);
    }

    @Override
    public int blockCount() {
        return blockCount;
    }

    @Override
    public int blockSize() {
        return blockSize;
    }

    @Override
    public void read(int block, byte[] data) throws IOException {
        BlockDevice.checkAccess(this, block, data);
        ensureOpen();

        final ByteBuffer buffer = ByteBuffer.wrap(data);
        long position = offset(block);
        while (buffer.hasRemaining()) {
            final int n = channel.read(buffer, position);
            if (n < 0) {
                throw new IOException("Unexpected end of " + path + " while reading block " + block);
            }
            position += n;
        }
        reads.incrementAndGet();
    }

    @Override
    public void write(int block, byte[] data) throws IOException {
        BlockDevice.checkAccess(this, block, data);
        ensureOpen();

        final ByteBuffer buffer = ByteBuffer.wrap(data);
        long position = offset(block);
        while (buffer.hasRemaining()) {
            position += channel.write(buffer, position);
        }
        writes.incrementAndGet();
    }

    @Override
    public DeviceStats stats() {
        return new DeviceStats(reads.get(), writes.get());
    }

    @Override
    public void close() throws IOException {
        if (closed.compareAndSet(false, true)) {
            final DeviceStats stats = stats();
            LOG.info("Closing device {}: {} block reads, {} block writes", path, stats.reads(), stats.writes());
            channel.close();
        }
    }

    @Override
    public String toString() {
        return "FileBlockDevice{" + path + "}";
    }

    private long offset(int block) {
        return (long) block * blockSize;
    }

    private void ensureOpen() throws IOException {
        if (closed.get()) {
            throw new IOException("Device " + path + " is closed");
        }
    }
}
