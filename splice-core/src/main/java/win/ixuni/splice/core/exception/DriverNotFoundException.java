package win.ixuni.splice.core.exception;

/**
 * No driver factory is available for the configured driver type
 */
public class DriverNotFoundException extends SpliceException {

    public DriverNotFoundException(String driverType) {
        super("DriverNotFound", "No driver factory registered for type: " + driverType);
    }
}
