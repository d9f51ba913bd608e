package qamonitor.backend;

import java.io.IOException;

/**
 * The backend answered, but the payload does not match the expected analysis shape.
 */
public class MalformedPayloadException extends IOException {

    public MalformedPayloadException(String msg) {
        super(msg);
    }

    public MalformedPayloadException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
