package ch.so.arp.nexa.error;

/**
 * Invalid parameters or configuration. Fatal to the call that raised it.
 */
public class ConfigurationException extends RagException {

    public ConfigurationException(String message) {
        super(ErrorCode.CONFIGURATION_INVALID, message, null);
    }
}
