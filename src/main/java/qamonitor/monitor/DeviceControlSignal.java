package qamonitor.monitor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process {@link ControlSignal} updated by whatever component manages device
 * control (take-control / release-control).
 */
public class DeviceControlSignal implements ControlSignal {

    private static final Logger log = LoggerFactory.getLogger(DeviceControlSignal.class);

    private final List<Listener> listeners = new CopyOnWriteArrayList<>();
    private volatile boolean active;

    public DeviceControlSignal() {
        this(false);
    }

    public DeviceControlSignal(boolean initiallyActive) {
        this.active = initiallyActive;
    }

    @Override
    public boolean isActive() {
        return active;
    }

    /** Changes the signal and notifies listeners if the value actually changed. */
    public void set(boolean nowActive) {
        boolean previous;
        synchronized (this) {
            previous = active;
            active = nowActive;
        }
        if (previous == nowActive) return;

        log.info("Device control {}", nowActive ? "acquired" : "released");
        for (Listener l : listeners) {
            try {
                l.onControlChanged(nowActive);
            } catch (RuntimeException e) {
                log.error("Control listener failed", e);
            }
        }
    }

    @Override
    public void addListener(Listener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeListener(Listener listener) {
        listeners.remove(listener);
    }
}
