package io.tapdb.domain.euid;

/**
 * Deployment environment an identifier belongs to. Sandbox identifiers carry a
 * single-letter namespace in front of the prefix.
 */
public enum EuidEnvironment {
    PRODUCTION,
    SANDBOX
}
