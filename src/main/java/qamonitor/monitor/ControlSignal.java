package qamonitor.monitor;

/**
 * Externally owned "an operator holds exclusive control of the device" flag.
 * Monitoring may only run while it is asserted.
 */
public interface ControlSignal {

    boolean isActive();

    void addListener(Listener listener);

    void removeListener(Listener listener);

    /** Notified synchronously on the thread that changes the signal. */
    @FunctionalInterface
    interface Listener {
        void onControlChanged(boolean active);
    }
}
