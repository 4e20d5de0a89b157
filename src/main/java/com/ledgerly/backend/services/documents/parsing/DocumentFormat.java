package com.ledgerly.backend.services.documents.parsing;

import java.util.Locale;
import java.util.Set;

public enum DocumentFormat {
    PDF(Set.of("application/pdf"), Set.of("pdf")),
    DELIMITED(Set.of("text/csv", "application/csv", "text/tab-separated-values"), Set.of("csv", "tsv", "txt")),
    SPREADSHEET(Set.of(
            "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet",
            "application/vnd.ms-excel"), Set.of("xlsx", "xls"));

    private final Set<String> mediaTypes;
    private final Set<String> extensions;

    DocumentFormat(Set<String> mediaTypes, Set<String> extensions) {
        this.mediaTypes = mediaTypes;
        this.extensions = extensions;
    }

    /**
     * Resolve pelo media type; se ele for genérico ou ausente, usa a extensão do arquivo.
     * Retorna null quando nenhum dos dois é reconhecido.
     */
    public static DocumentFormat resolve(String mediaType, String fileName) {
        String type = mediaType == null ? "" : mediaType.toLowerCase(Locale.ROOT).trim();
        int paramIdx = type.indexOf(';');
        if (paramIdx >= 0) type = type.substring(0, paramIdx).trim();

        for (DocumentFormat format : values()) {
            if (format.mediaTypes.contains(type)) return format;
        }

        String ext = extensionOf(fileName);
        if (ext.isEmpty()) return null;
        for (DocumentFormat format : values()) {
            if (format.extensions.contains(ext)) return format;
        }
        return null;
    }

    private static String extensionOf(String fileName) {
        if (fileName == null) return "";
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) return "";
        return fileName.substring(dot + 1).toLowerCase(Locale.ROOT).trim();
    }
}
