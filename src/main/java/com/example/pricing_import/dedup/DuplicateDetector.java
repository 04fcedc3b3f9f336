package com.example.pricing_import.dedup;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import org.springframework.stereotype.Component;

import com.example.pricing_import.classify.ClassifiedRecord;
import com.example.pricing_import.imports.PricingImportProperties;
import com.example.pricing_import.standardize.StandardizedRecord;

/**
 * Groups same-product rows within a batch and matches them against committed records.
 *
 * <p>Two rows are candidates when supplier key and unit are equal and the normalized names are equal or
 * similar at or above the configured threshold. Grouping is transitive.
 */
@Component
public class DuplicateDetector {

    private static final Comparator<ClassifiedRecord> PRIMARY_ORDER = Comparator
            .comparingDouble((ClassifiedRecord r) -> r.record().confidence()).reversed()
            .thenComparingInt(ClassifiedRecord::position);

    private final PricingImportProperties properties;

    public DuplicateDetector(PricingImportProperties properties) {
        this.properties = properties;
    }

    public DeduplicationResult detect(List<ClassifiedRecord> records, Collection<ExistingPricing> existing) {
        double threshold = properties.getSimilarityThreshold();

        // candidates never cross supplier/unit, so compare within buckets only
        Map<String, List<Integer>> buckets = new LinkedHashMap<>();
        for (int i = 0; i < records.size(); i++) {
            buckets.computeIfAbsent(bucketKey(records.get(i).record()), k -> new ArrayList<>()).add(i);
        }

        UnionFind uf = new UnionFind(records.size());
        for (List<Integer> bucket : buckets.values()) {
            for (int a = 0; a < bucket.size(); a++) {
                for (int b = a + 1; b < bucket.size(); b++) {
                    int i = bucket.get(a);
                    int j = bucket.get(b);
                    if (sameProduct(records.get(i).record().normalizedName(),
                            records.get(j).record().normalizedName(), threshold)) {
                        uf.union(i, j);
                    }
                }
            }
        }

        Map<String, List<ExistingPricing>> existingByBucket = new HashMap<>();
        for (ExistingPricing e : existing) {
            existingByBucket.computeIfAbsent(bucketKey(e.supplierKey(), e.unit()), k -> new ArrayList<>()).add(e);
        }

        Map<Integer, List<ClassifiedRecord>> members = new TreeMap<>();
        for (int i = 0; i < records.size(); i++) {
            members.computeIfAbsent(uf.find(i), k -> new ArrayList<>()).add(records.get(i));
        }

        List<DuplicateGroup> groups = new ArrayList<>();
        Map<Integer, ExistingPricing> existingMatches = new HashMap<>();
        for (List<ClassifiedRecord> group : members.values()) {
            group.sort(PRIMARY_ORDER);
            ClassifiedRecord primary = group.get(0);
            List<ClassifiedRecord> others = new ArrayList<>(group.subList(1, group.size()));
            others.sort(Comparator.comparingInt(ClassifiedRecord::position));

            groups.add(new DuplicateGroup(primary, others, findExisting(primary.record(), existingByBucket,
                    threshold)));
            for (ClassifiedRecord other : others) {
                ExistingPricing match = findExisting(other.record(), existingByBucket, threshold);
                if (match != null) {
                    existingMatches.put(other.position(), match);
                }
            }
        }
        groups.sort(Comparator.comparingInt(g -> g.primary().position()));
        return new DeduplicationResult(groups, existingMatches);
    }

    private ExistingPricing findExisting(StandardizedRecord record, Map<String, List<ExistingPricing>> byBucket,
            double threshold) {
        List<ExistingPricing> candidates = byBucket.getOrDefault(bucketKey(record), List.of());
        ExistingPricing best = null;
        double bestScore = -1;
        for (ExistingPricing e : candidates) {
            if (Objects.equals(e.normalizedName(), record.normalizedName())) {
                return e;
            }
            double score = NameSimilarity.ratio(e.normalizedName(), record.normalizedName());
            if (score >= threshold && score > bestScore) {
                best = e;
                bestScore = score;
            }
        }
        return best;
    }

    private static boolean sameProduct(String a, String b, double threshold) {
        return Objects.equals(a, b) || NameSimilarity.ratio(a, b) >= threshold;
    }

    private static String bucketKey(StandardizedRecord r) {
        return bucketKey(r.supplierKey(), r.unit());
    }

    private static String bucketKey(String supplierKey, String unit) {
        return supplierKey + "\u0000" + unit;
    }

    private static final class UnionFind {
        private final int[] parent;

        UnionFind(int n) {
            parent = new int[n];
            for (int i = 0; i < n; i++) {
                parent[i] = i;
            }
        }

        int find(int x) {
            while (parent[x] != x) {
                parent[x] = parent[parent[x]];
                x = parent[x];
            }
            return x;
        }

        void union(int a, int b) {
            int ra = find(a);
            int rb = find(b);
            if (ra != rb) {
                // smaller index as root keeps group order stable
                parent[Math.max(ra, rb)] = Math.min(ra, rb);
            }
        }
    }
}
