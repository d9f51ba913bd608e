package qamonitor.monitor;

/**
 * Unchecked exception for configuration and wiring failures of the monitoring
 * pipeline. Runtime failures of a running session never surface as exceptions;
 * they are recorded in the monitoring state instead.
 */
public class MonitoringException extends RuntimeException {

    public MonitoringException(String msg) {
        super(msg);
    }

    public MonitoringException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
