package io.tapdb.config;

import java.util.List;

/**
 * Counts of a seeding run plus the validation warnings it carried.
 */
public record SeedResult(int inserted, int updated, int skipped, List<ConfigIssue> warnings) {

    public SeedResult {
        warnings = List.copyOf(warnings);
    }

    public int total() {
        return inserted + updated + skipped;
    }
}
