package ai.disksched.scheduler.policy;

/**
 * Head position and sweep direction remembered between selections. One cursor per scheduler.
 */
public class SchedulerCursor {
    public static final int UP = 1;
    public static final int DOWN = -1;

    private int position;
    private int direction;
    private long headMovement = 0;

    public SchedulerCursor() {
        this(0, UP);
    }

    public SchedulerCursor(int position, int direction) {
        if (position < 0) {
            throw new IllegalArgumentException("Position must be non-negative, got " + position);
        }
        this.position = position;
        setDirection(direction);
    }

    public int position() {
        return position;
    }

    public int direction() {
        return direction;
    }

    /**
     * Total distance the head travelled since creation.
     */
    public long headMovement() {
        return headMovement;
    }

    public void moveTo(int block) {
        headMovement += Math.abs((long) block - position);
        position = block;
    }

    public void setDirection(int direction) {
        if (direction != UP && direction != DOWN) {
            throw new IllegalArgumentException("Direction must be +1 or -1, got " + direction);
        }
        this.direction = direction;
    }

    @Override
    public String toString() {
        return "{position=" + position + ", direction=" + (direction == UP ? "+1" : "-1") + "}";
    }
}
