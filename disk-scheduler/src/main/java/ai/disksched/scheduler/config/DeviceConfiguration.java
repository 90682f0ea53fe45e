package ai.disksched.scheduler.config;

import ai.disksched.device.FileBlockDevice;

public final class DeviceConfiguration {
    private String path;
    private int blockCount = 1000;
    private int blockSize = FileBlockDevice.DEFAULT_BLOCK_SIZE;

    public String getPath() {
        return path;
    }

    public int getBlockCount() {
        return blockCount;
    }

    public int getBlockSize() {
        return blockSize;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public void setBlockCount(int blockCount) {
        this.blockCount = blockCount;
    }

    public void setBlockSize(int blockSize) {
        this.blockSize = blockSize;
    }

    @Override
    public String toString() {
        return "DeviceConfiguration{" +
               "path='" + path + '\'' +
               ", blockCount=" + blockCount +
               ", blockSize=" + blockSize +
               '}';
    }
}
