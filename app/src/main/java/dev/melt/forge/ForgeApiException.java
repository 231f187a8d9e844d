package dev.melt.forge;

/** A forge API call failed in a way that the local mirror fallback can answer instead. */
final class ForgeApiException extends Exception {
    ForgeApiException(String message) {
        super(message);
    }

    ForgeApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
