package com.example.pricing_import.classify;

import java.util.List;
import java.util.Locale;

import org.springframework.stereotype.Component;

import com.example.pricing_import.dedup.NameSimilarity;
import com.example.pricing_import.imports.PricingImportProperties;
import com.example.pricing_import.standardize.ProductStandardizer;
import com.example.pricing_import.standardize.StandardizedRecord;

/**
 * Assigns exactly one taxonomy member to every record.
 * Order: trusted AI hint, first matching keyword rule, UNCLASSIFIED.
 */
@Component
public class CategoryClassifier {

    private static final double HINT_SIMILARITY = 0.85;

    /**
     * Evaluated top to bottom; the first match wins. Narrow rules sit above the broad ones they overlap
     * ("cable tie" is a consumable, not cabling).
     */
    static final List<KeywordRule> RULES = List.of(
            KeywordRule.of(Category.SERVICES, "installation", "install", "labour", "labor", "commissioning",
                    "survey", "maintenance", "callout", "call out", "engineer", "termination service",
                    "testing service", "support contract", "site visit"),
            KeywordRule.of(Category.CONSUMABLES, "cable tie", "cable ties", "zip tie", "velcro", "tape",
                    "label", "labels", "heatshrink", "heat shrink", "grommet", "lacing", "trunking", "conduit",
                    "cable tray", "tray", "sleeving"),
            KeywordRule.of(Category.FASTENERS, "screw", "screws", "bolt", "bolts", "nut", "nuts", "washer",
                    "washers", "cage nut", "cage nuts", "anchor", "rawlplug", "fixing", "fixings", "rivet"),
            KeywordRule.of(Category.ENCLOSURES, "rack", "cabinet", "enclosure", "comms cabinet", "wall box",
                    "42u", "24u", "12u", "9u", "6u", "shelf", "blanking panel"),
            KeywordRule.of(Category.NETWORKING, "switch", "router", "firewall", "access point", "wap", "sfp",
                    "transceiver", "patch panel", "media converter", "poe injector", "gateway", "modem"),
            KeywordRule.of(Category.CABLING, "cat5e", "cat6", "cat6a", "cat7", "utp", "ftp", "stp", "fibre",
                    "fiber", "om3", "om4", "os2", "cable", "patch lead", "patch cord", "pigtail", "coax",
                    "rj45", "keystone", "faceplate", "connector"),
            KeywordRule.of(Category.SECURITY, "cctv", "camera", "dvr", "nvr", "access control", "card reader",
                    "door entry", "intercom", "alarm", "pir", "maglock"),
            KeywordRule.of(Category.LIGHTING, "led", "lamp", "luminaire", "downlight", "floodlight",
                    "batten", "bulb", "emergency light"),
            KeywordRule.of(Category.ELECTRICAL, "pdu", "ups", "socket", "plug", "fuse", "breaker", "mcb", "rcd",
                    "isolator", "power supply", "psu", "extension lead", "spur", "surge"),
            KeywordRule.of(Category.TOOLS, "crimp", "crimper", "tester", "punch down", "punchdown", "stripper",
                    "drill", "screwdriver", "pliers", "toolkit", "tool", "multimeter", "fusion splicer"));

    private final PricingImportProperties properties;

    public CategoryClassifier(PricingImportProperties properties) {
        this.properties = properties;
    }

    public ClassifiedRecord classify(StandardizedRecord record) {
        if (record.categoryHint() != null && record.confidence() >= properties.getHintConfidenceFloor()) {
            Category hinted = matchHint(record.categoryHint());
            if (hinted != null) {
                return new ClassifiedRecord(record, hinted, ClassificationSource.AI_HINT);
            }
        }

        String name = record.normalizedName();
        if (name != null) {
            for (KeywordRule rule : RULES) {
                if (rule.matches(name)) {
                    return new ClassifiedRecord(record, rule.category(), ClassificationSource.KEYWORD_RULE);
                }
            }
        }
        return new ClassifiedRecord(record, Category.UNCLASSIFIED, ClassificationSource.UNCLASSIFIED);
    }

    /**
     * Exact (display name, code, alias) or near-exact match of a hint; null when nothing is close enough.
     */
    static Category matchHint(String hint) {
        String h = ProductStandardizer.normalizedName(hint);
        if (h.isEmpty()) {
            return null;
        }
        for (Category c : Category.values()) {
            if (c == Category.UNCLASSIFIED) {
                continue;
            }
            if (h.equals(key(c.getDisplayName())) || h.equals(key(c.name()))
                    || c.getAliases().stream().anyMatch(a -> h.equals(key(a)))) {
                return c;
            }
        }

        Category best = null;
        double bestScore = 0;
        for (Category c : Category.values()) {
            if (c == Category.UNCLASSIFIED) {
                continue;
            }
            String display = key(c.getDisplayName());
            double score = singular(h).equals(singular(display)) ? 1.0 : NameSimilarity.ratio(h, display);
            for (String alias : c.getAliases()) {
                String a = key(alias);
                score = Math.max(score, singular(h).equals(singular(a)) ? 1.0 : NameSimilarity.ratio(h, a));
            }
            if (score > bestScore) {
                bestScore = score;
                best = c;
            }
        }
        return bestScore >= HINT_SIMILARITY ? best : null;
    }

    private static String key(String s) {
        return ProductStandardizer.normalizedName(s.replace('_', ' ')).toLowerCase(Locale.ROOT);
    }

    private static String singular(String s) {
        if (s.endsWith("ies") && s.length() > 4) {
            return s.substring(0, s.length() - 3) + "y";
        }
        if (s.endsWith("s") && !s.endsWith("ss") && s.length() > 3) {
            return s.substring(0, s.length() - 1);
        }
        return s;
    }
}
