package com.example.pricing_import.classify;

import java.util.List;

import lombok.Getter;

/**
 * Fixed product taxonomy. UNCLASSIFIED is the fallback and never offered as a hint target.
 */
@Getter
public enum Category {
    SERVICES("Services", List.of("service", "labour", "labor", "installation", "support", "professional services")),
    CABLING("Cabling", List.of("cable", "cables", "structured cabling", "fibre", "fiber", "copper cabling")),
    NETWORKING("Networking", List.of("network", "network equipment", "active equipment", "wireless", "wifi")),
    ENCLOSURES("Enclosures", List.of("racks", "cabinets", "rack", "cabinet", "data cabinets")),
    FASTENERS("Fasteners", List.of("fixings", "screws", "bolts", "hardware")),
    ELECTRICAL("Electrical", List.of("power", "electrical accessories", "power distribution")),
    LIGHTING("Lighting", List.of("lights", "luminaires", "lamps")),
    SECURITY("Security", List.of("cctv", "access control", "surveillance", "alarms")),
    TOOLS("Tools", List.of("tooling", "test equipment", "hand tools")),
    CONSUMABLES("Consumables", List.of("sundries", "consumable", "accessories", "containment")),
    UNCLASSIFIED("Unclassified", List.of());

    private final String displayName;
    private final List<String> aliases;

    Category(String displayName, List<String> aliases) {
        this.displayName = displayName;
        this.aliases = aliases;
    }
}
