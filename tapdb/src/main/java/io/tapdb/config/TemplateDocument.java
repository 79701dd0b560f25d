package io.tapdb.config;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A loaded configuration file.
 *
 * @param root       parsed JSON, or null when the file did not parse
 * @param parseError parser message when the file did not parse
 */
public record TemplateDocument(String sourceFile, JsonNode root, String parseError) {

    public static TemplateDocument parsed(String sourceFile, JsonNode root) {
        return new TemplateDocument(sourceFile, root, null);
    }

    public static TemplateDocument unparseable(String sourceFile, String parseError) {
        return new TemplateDocument(sourceFile, null, parseError);
    }
}
