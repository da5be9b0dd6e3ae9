package org.onionscout.util;

import org.jetbrains.annotations.Nullable;

/**
 * Thrown when a string cannot be normalized into an {@link Address}.
 */
public class InvalidAddressException extends Exception {
    private final @Nullable String input;

    public InvalidAddressException(@Nullable String input, String reason) {
        super(input == null ? "Invalid address: " + reason : "Invalid address '" + input + "': " + reason);
        this.input = input;
    }

    public @Nullable String input() {
        return input;
    }
}
