package dev.flowbridge.model;

/**
 * Something a person should look at before the generated process is deployed.
 */
public record ReviewNote(String stepPath, String message) {

    @Override
    public String toString() {
        return stepPath + ": " + message;
    }
}
