package ai.disksched.device;

import java.io.Closeable;
import java.io.IOException;

/**
 * Addressable array of fixed-size blocks.
 *
 * <p>Implementations are not required to be thread-safe: callers serialize access.
 */
public interface BlockDevice extends Closeable {

    int blockCount();

    int blockSize();

    /**
     * Fills {@code data} with the contents of {@code block}.
     *
     * @throws IllegalArgumentException if the block is out of range or {@code data} is not block-sized
     */
    void read(int block, byte[] data) throws IOException;

    /**
     * Stores {@code data} as the contents of {@code block}.
     *
     * @throws IllegalArgumentException if the block is out of range or {@code data} is not block-sized
     */
    void write(int block, byte[] data) throws IOException;

    DeviceStats stats();

    static void checkAccess(BlockDevice device, int block, byte[] data) {
        if (block < 0 || block >= device.blockCount()) {
            throw new IllegalArgumentException("Block " + block + " is out of range [0, "
                + device.blockCount() + ") of " + device);
        }
        if (data.length != device.blockSize()) {
            throw new IllegalArgumentException("Buffer of " + data.length + " bytes does not match block size "
                + device.blockSize() + " of " + device);
        }
    }
}
