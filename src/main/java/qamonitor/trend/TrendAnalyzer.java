package qamonitor.trend;

import qamonitor.model.Analysis;
import qamonitor.model.Frame;

import java.util.List;

/**
 * Derives operator-facing alert levels from the most recent frames of the window.
 */
public final class TrendAnalyzer {

    /** How many of the newest frames the error trend looks at. */
    public static final int ERROR_WINDOW = 10;
    /** Run length at which a warning turns into an error. */
    public static final int ERROR_RUN_THRESHOLD = 3;
    /** Frames without subtitles needed before the red indicator shows. */
    public static final int SUBTITLE_WINDOW = 3;

    private TrendAnalyzer() {}

    /**
     * Counts, from the newest frame backwards, how many consecutive frames show a
     * blackscreen and how many show a freeze. Counting stops at the first frame
     * where neither is detected, or where a run that had started is broken.
     *
     * @return {@code null} when {@code frames} is empty
     */
    public static ErrorTrend errorTrend(List<Frame> frames) {
        if (frames == null || frames.isEmpty()) return null;

        List<Frame> recent = frames.subList(Math.max(0, frames.size() - ERROR_WINDOW), frames.size());
        int blackscreen = 0;
        int freeze = 0;

        for (int i = recent.size() - 1; i >= 0; i--) {
            Analysis a = recent.get(i).analysis();
            boolean black = a.blackscreen().detected();
            boolean frozen = a.freeze().detected();

            if (black) {
                blackscreen++;
            } else if (blackscreen > 0) {
                break;
            }
            if (frozen) {
                freeze++;
            } else if (freeze > 0) {
                break;
            }
            if (!black && !frozen) break;
        }

        int longest = Math.max(blackscreen, freeze);
        return new ErrorTrend(blackscreen, freeze,
                longest >= 1 && longest < ERROR_RUN_THRESHOLD,
                longest >= ERROR_RUN_THRESHOLD);
    }

    /**
     * Looks at the newest {@value #SUBTITLE_WINDOW} frames (fewer if the window is
     * shorter) and flags a full window without any subtitles.
     *
     * @return {@code null} when {@code frames} is empty
     */
    public static SubtitleTrend subtitleTrend(List<Frame> frames) {
        if (frames == null || frames.isEmpty()) return null;

        int target = Math.min(SUBTITLE_WINDOW, frames.size());
        List<Frame> recent = frames.subList(frames.size() - target, frames.size());

        int without = 0;
        for (Frame f : recent) {
            if (!f.analysis().subtitles().detected()) without++;
        }
        boolean current = recent.get(recent.size() - 1).analysis().subtitles().detected();
        boolean red = without == recent.size() && recent.size() >= SUBTITLE_WINDOW;
        return new SubtitleTrend(red, current, recent.size(), without);
    }
}
