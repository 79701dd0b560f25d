package io.tapdb.config;

/**
 * One problem found in a template configuration document.
 *
 * @param templateCode code of the offending template, or null for document-level issues
 */
public record ConfigIssue(Level level, String sourceFile, String templateCode, String message) {

    public enum Level {
        ERROR,
        WARNING
    }

    public static ConfigIssue error(String sourceFile, String templateCode, String message) {
        return new ConfigIssue(Level.ERROR, sourceFile, templateCode, message);
    }

    public static ConfigIssue warning(String sourceFile, String templateCode, String message) {
        return new ConfigIssue(Level.WARNING, sourceFile, templateCode, message);
    }

    public boolean isError() {
        return level == Level.ERROR;
    }

    @Override
    public String toString() {
        return String.format("%s %s%s: %s", level, sourceFile,
            templateCode == null ? "" : " [" + templateCode + "]", message);
    }
}
