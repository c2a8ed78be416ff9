package ch.so.arp.nexa.error;

/**
 * JSON body of every failed API call.
 */
public record ErrorResponse(String code, String message) {
}
