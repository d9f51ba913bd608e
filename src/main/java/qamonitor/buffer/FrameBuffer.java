package qamonitor.buffer;

import qamonitor.model.Analysis;
import qamonitor.model.Frame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Bounded, ordered window of analyzed frames with a read cursor.
 *
 * <p>Frames are kept strictly ascending by frame number. When an append pushes the
 * size past {@code maxFrames} the oldest frames are evicted first. The cursor is
 * either in <em>live-follow</em> mode (it sits on the tail and the user has not
 * pinned a frame) and jumps to the new tail on every append, or it is clamped into
 * the valid index range.
 *
 * <p>Not thread-safe. Callers serialize access through
 * {@code qamonitor.monitor.MonitoringState}.
 */
public class FrameBuffer {

    private static final Logger log = LoggerFactory.getLogger(FrameBuffer.class);

    /** About three minutes of history at one frame per second. */
    public static final int DEFAULT_MAX_FRAMES = 180;

    private final int maxFrames;
    private final List<Frame> frames = new ArrayList<>();
    private int cursor = 0;
    private boolean pinned = false;

    public FrameBuffer() {
        this(DEFAULT_MAX_FRAMES);
    }

    /**
     * @param maxFrames capacity of the window; must be positive
     */
    public FrameBuffer(int maxFrames) {
        if (maxFrames < 1) {
            throw new IllegalArgumentException("maxFrames must be positive, got " + maxFrames);
        }
        this.maxFrames = maxFrames;
    }

    // ── Mutation ──────────────────────────────────────────────────────────

    /**
     * Appends a batch at the tail and evicts from the head until the window fits.
     *
     * @param batch frames sorted strictly ascending, all newer than the current tail
     * @return number of frames evicted
     * @throws IllegalArgumentException if the batch is out of order, contains
     *         duplicates, or overlaps the frames already buffered; the buffer is
     *         left untouched in that case
     */
    public int append(List<Frame> batch) {
        if (batch == null || batch.isEmpty()) return 0;

        long previous = frames.isEmpty() ? Long.MIN_VALUE : tail().frameNumber();
        for (Frame f : batch) {
            if (f.frameNumber() <= previous) {
                throw new IllegalArgumentException(String.format(
                        "Frame #%d is not newer than #%d; batches must be strictly ascending",
                        f.frameNumber(), previous));
            }
            previous = f.frameNumber();
        }

        boolean follow = isLiveFollow();
        frames.addAll(batch);

        int evicted = Math.max(0, frames.size() - maxFrames);
        if (evicted > 0) {
            frames.subList(0, evicted).clear();
            log.debug("Evicted {} frame(s); window now starts at #{}", evicted, frames.get(0).frameNumber());
        }

        cursor = follow ? frames.size() - 1 : clamp(cursor);
        return evicted;
    }

    /**
     * Replaces the analysis of one buffered frame and sets its overlay marker.
     * Position, {@code processed} and every other frame are left as they are.
     *
     * @return {@code false} if no buffered frame has that number
     */
    public boolean overwriteAnalysis(long frameNumber, Analysis analysis) {
        int idx = indexOf(frameNumber);
        if (idx < 0) {
            log.debug("overwriteAnalysis: frame #{} not in buffer", frameNumber);
            return false;
        }
        frames.set(idx, frames.get(idx).withOverlay(analysis));
        return true;
    }

    /** Removes every frame and resets the cursor to live-follow at index 0. */
    public void clear() {
        frames.clear();
        cursor = 0;
        pinned = false;
    }

    // ── Cursor ────────────────────────────────────────────────────────────

    /**
     * Moves the cursor, clamping into {@code [0, size-1]} (0 when empty).
     *
     * @return the index actually selected
     */
    public int moveTo(int index) {
        cursor = clamp(index);
        return cursor;
    }

    /** Disables live-follow: the cursor stays put (modulo clamping) on append. */
    public void pin() {
        pinned = true;
    }

    /** Re-enables live-follow; it takes effect when the cursor is on the tail. */
    public void unpin() {
        pinned = false;
    }

    public boolean isPinned() {
        return pinned;
    }

    public boolean isLiveFollow() {
        return !pinned && isAtTail();
    }

    public boolean isAtTail() {
        return frames.isEmpty() || cursor == frames.size() - 1;
    }

    public int cursor() {
        return cursor;
    }

    // ── Accessors ─────────────────────────────────────────────────────────

    /** Frame under the cursor, or {@code null} if the buffer is empty. */
    public Frame current() {
        return frames.isEmpty() ? null : frames.get(cursor);
    }

    public Frame get(int index) {
        return frames.get(index);
    }

    /** Binary search by frame number; negative if absent. */
    public int indexOf(long frameNumber) {
        int lo = 0;
        int hi = frames.size() - 1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            long n = frames.get(mid).frameNumber();
            if (n < frameNumber)      lo = mid + 1;
            else if (n > frameNumber) hi = mid - 1;
            else return mid;
        }
        return -1;
    }

    /** Immutable copy of the buffered frames, oldest first. */
    public List<Frame> frames() {
        return List.copyOf(frames);
    }

    public int size() {
        return frames.size();
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }

    public int maxFrames() {
        return maxFrames;
    }

    private Frame tail() {
        return frames.get(frames.size() - 1);
    }

    private int clamp(int index) {
        if (frames.isEmpty()) return 0;
        return Math.max(0, Math.min(index, frames.size() - 1));
    }
}
