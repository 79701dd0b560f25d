package io.tapdb.domain.model;

/**
 * One child entry of an instantiation layout.
 *
 * @param namePattern overrides the layout's pattern when not null
 */
public record ChildTemplateRef(TemplateCode templateCode, int count, String namePattern) {}
