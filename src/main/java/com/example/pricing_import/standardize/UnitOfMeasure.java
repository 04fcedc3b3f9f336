package com.example.pricing_import.standardize;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import lombok.Getter;

/**
 * Canonical unit vocabulary with the synonyms seen on supplier price lists.
 */
@Getter
public enum UnitOfMeasure {
    EACH("each", List.of("ea", "pc", "pcs", "piece", "pieces", "unit", "units", "item", "items", "no", "nr", "x")),
    PAIR("pair", List.of("pr", "pairs")),
    SET("set", List.of("sets", "kit", "kits")),
    PACK("pack", List.of("pk", "pkt", "packs", "packet", "packets")),
    BOX("box", List.of("bx", "boxes", "carton", "ctn")),
    ROLL("roll", List.of("rl", "rolls", "reel", "reels", "drum")),
    METRE("m", List.of("metre", "metres", "meter", "meters", "mtr", "mtrs", "lm", "linearmetre", "lin.m")),
    SQUARE_METRE("m2", List.of("sqm", "sq.m", "sqmetre", "squaremetre", "squaremeter", "squaremetres")),
    CUBIC_METRE("m3", List.of("cum", "cu.m", "cubicmetre", "cubicmeter")),
    MILLIMETRE("mm", List.of("millimetre", "millimeter", "millimetres")),
    CENTIMETRE("cm", List.of("centimetre", "centimeter", "centimetres")),
    KILOMETRE("km", List.of("kilometre", "kilometer", "kilometres")),
    KILOGRAM("kg", List.of("kgs", "kilo", "kilos", "kilogram", "kilograms")),
    GRAM("g", List.of("gr", "gram", "grams")),
    TONNE("t", List.of("tonne", "tonnes", "ton", "tons")),
    LITRE("l", List.of("ltr", "litre", "litres", "liter", "liters")),
    MILLILITRE("ml", List.of("millilitre", "milliliter")),
    HOUR("hour", List.of("hr", "hrs", "hours", "h", "perhour")),
    DAY("day", List.of("days", "d", "perday")),
    WEEK("week", List.of("wk", "weeks")),
    MONTH("month", List.of("mo", "mth", "months", "monthly", "permonth")),
    YEAR("year", List.of("yr", "yrs", "years", "annual", "annually", "peryear")),
    LOT("lot", List.of("lots", "ls", "lumpsum", "job"));

    private final String code;
    private final List<String> synonyms;

    private static final Map<String, UnitOfMeasure> LOOKUP = new HashMap<>();

    static {
        for (UnitOfMeasure u : values()) {
            LOOKUP.put(key(u.code), u);
            LOOKUP.put(key(u.name()), u);
            for (String s : u.synonyms) {
                LOOKUP.put(key(s), u);
            }
        }
    }

    UnitOfMeasure(String code, List<String> synonyms) {
        this.code = code;
        this.synonyms = synonyms;
    }

    /**
     * Case-insensitive lookup by code or synonym; dots, spaces, underscores and a leading "per" are ignored.
     */
    public static Optional<UnitOfMeasure> lookup(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String k = key(raw);
        UnitOfMeasure found = LOOKUP.get(k);
        if (found == null && k.startsWith("per") && k.length() > 3) {
            found = LOOKUP.get(k.substring(3));
        }
        if (found == null && k.startsWith("/") && k.length() > 1) {
            found = LOOKUP.get(k.substring(1));
        }
        return Optional.ofNullable(found);
    }

    static String key(String raw) {
        return raw.toLowerCase(Locale.ROOT)
                .replace('²', '2')
                .replace('³', '3')
                .replaceAll("[.\\s_-]", "");
    }
}
