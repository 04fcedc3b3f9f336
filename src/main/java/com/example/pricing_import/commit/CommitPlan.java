package com.example.pricing_import.commit;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import com.example.pricing_import.imports.RowOutcome;

/**
 * Planned terminal outcome for every record handed to the committer, by row position.
 */
public record CommitPlan(Map<Integer, RowOutcome> outcomes) {

    public CommitPlan {
        outcomes = Collections.unmodifiableMap(new TreeMap<>(outcomes));
    }
}
