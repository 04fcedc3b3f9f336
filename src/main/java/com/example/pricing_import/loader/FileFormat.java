package com.example.pricing_import.loader;

import java.util.Locale;
import java.util.Map;

public enum FileFormat {
    XLSX,
    XLS,
    DELIMITED_TEXT;

    private static final Map<String, FileFormat> BY_EXTENSION = Map.of(
            "xlsx", XLSX,
            "xlsm", XLSX,
            "xls", XLS,
            "csv", DELIMITED_TEXT,
            "tsv", DELIMITED_TEXT,
            "txt", DELIMITED_TEXT);

    public static boolean isSupportedExtension(String extension) {
        return extension != null && BY_EXTENSION.containsKey(extension.toLowerCase(Locale.ROOT));
    }

    public static String extensionOf(String fileName) {
        if (fileName == null) {
            return "";
        }
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    /**
     * Declared format from the extension, otherwise sniffed from the leading bytes.
     */
    public static FileFormat detect(String fileName, byte[] content) {
        FileFormat declared = BY_EXTENSION.get(extensionOf(fileName));
        if (declared != null) {
            return declared;
        }
        if (content.length >= 4 && content[0] == 'P' && content[1] == 'K' && content[2] == 3 && content[3] == 4) {
            return XLSX;
        }
        if (content.length >= 4 && (content[0] & 0xFF) == 0xD0 && (content[1] & 0xFF) == 0xCF
                && (content[2] & 0xFF) == 0x11 && (content[3] & 0xFF) == 0xE0) {
            return XLS;
        }
        return DELIMITED_TEXT;
    }
}
