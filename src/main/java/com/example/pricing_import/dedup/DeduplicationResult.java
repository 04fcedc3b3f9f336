package com.example.pricing_import.dedup;

import java.util.List;
import java.util.Map;

import com.example.pricing_import.classify.ClassifiedRecord;

/**
 * @param groups          one group per distinct product, ordered by primary row position
 * @param existingMatches non-primary rows that themselves match a committed record, by row position
 */
public record DeduplicationResult(List<DuplicateGroup> groups, Map<Integer, ExistingPricing> existingMatches) {

    public List<ClassifiedRecord> primaries() {
        return groups.stream().map(DuplicateGroup::primary).toList();
    }
}
