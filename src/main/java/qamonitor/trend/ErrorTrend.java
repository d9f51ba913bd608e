package qamonitor.trend;

/**
 * Consecutive blackscreen / freeze runs at the newest end of the frame window.
 *
 * @param blackscreenConsecutive frames in the trailing blackscreen run
 * @param freezeConsecutive      frames in the trailing freeze run
 * @param hasWarning             longest run is 1 or 2 frames
 * @param hasError               longest run is 3 frames or more
 */
public record ErrorTrend(int blackscreenConsecutive, int freezeConsecutive,
                         boolean hasWarning, boolean hasError) {
}
