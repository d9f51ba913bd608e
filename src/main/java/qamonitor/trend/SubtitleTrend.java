package qamonitor.trend;

/**
 * Subtitle presence over the newest frames.
 *
 * @param showRedIndicator    every frame of a full window lacked subtitles
 * @param currentHasSubtitles the newest frame has subtitles
 * @param framesAnalyzed      frames inspected
 * @param noSubtitlesStreak   inspected frames without subtitles
 */
public record SubtitleTrend(boolean showRedIndicator, boolean currentHasSubtitles,
                            int framesAnalyzed, int noSubtitlesStreak) {
}
