package org.gamboni.sideshelf.data;

import java.util.Optional;

/**
 * @param code native error code, when the native layer provides one
 * @param message human-readable description
 */
public record PlayerError(Optional<String> code, String message) {

    public PlayerError {
        code = (code == null) ? Optional.empty() : code;
    }

    public static PlayerError of(String message) {
        return new PlayerError(Optional.empty(), message);
    }

    public static PlayerError of(String code, String message) {
        return new PlayerError(Optional.of(code), message);
    }

    @Override
    public String toString() {
        return code.map(c -> c + ": " + message).orElse(message);
    }
}
