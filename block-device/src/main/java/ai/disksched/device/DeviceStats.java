package ai.disksched.device;

public record DeviceStats(long reads, long writes) {

    public long operations() {
        return reads + writes;
    }
}
