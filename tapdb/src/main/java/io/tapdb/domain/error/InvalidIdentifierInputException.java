package io.tapdb.domain.error;

/**
 * Thrown for identifier input the codec cannot encode, checksum or decode.
 */
public class InvalidIdentifierInputException extends TapdbException {

    private final String input;

    public InvalidIdentifierInputException(String input, String message) {
        super(String.format("[%s] %s", input, message));
        this.input = input;
    }

    public String getInput() {
        return input;
    }
}
