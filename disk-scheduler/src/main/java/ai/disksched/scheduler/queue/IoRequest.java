package ai.disksched.scheduler.queue;

import jakarta.annotation.Nullable;

import java.util.Objects;
import java.util.concurrent.locks.Condition;

/**
 * Pending read or write of one block.
 *
 * <p>The request references the caller's own buffer: a read fills it in place, a write reads from it.
 * Completion state is guarded by the lock of the {@link RequestMonitor} the request was submitted to.
 */
public final class IoRequest {

    public enum Kind {
        READ,
        WRITE
    }

    private final Kind kind;
    private final int block;
    private final byte[] data;

    private long id = -1;
    private Condition completion;
    private boolean done = false;
    @Nullable
    private Throwable failure;

    private IoRequest(Kind kind, int block, byte[] data) {
        this.kind = kind;
        this.block = block;
        this.data = Objects.requireNonNull(data, "data");
    }

    public static IoRequest read(int block, byte[] into) {
        return new IoRequest(Kind.READ, block, into);
    }

    public static IoRequest write(int block, byte[] from) {
        return new IoRequest(Kind.WRITE, block, from);
    }

    public Kind kind() {
        return kind;
    }

    public int block() {
        return block;
    }

    public byte[] data() {
        return data;
    }

    /**
     * Arrival sequence number within its scheduler, {@code -1} until enqueued.
     */
    public long id() {
        return id;
    }

    public boolean isDone() {
        return done;
    }

    @Nullable
    public Throwable failure() {
        return failure;
    }

    void enqueued(long id, Condition completion) {
        if (this.completion != null) {
            throw new IllegalStateException("Request " + this + " is already submitted");
        }
        this.id = id;
        this.completion = completion;
    }

    void awaitCompletion() {
        while (!done) {
            completion.awaitUninterruptibly();
        }
    }

    void complete(@Nullable Throwable failure) {
        this.failure = failure;
        this.done = true;
        completion.signal();
    }

    @Override
    public String toString() {
        return "IoRequest{" + kind + " #" + id + ", block=" + block + "}";
    }
}
