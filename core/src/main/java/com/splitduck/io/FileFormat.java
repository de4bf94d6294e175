package com.splitduck.io;

import com.splitduck.exception.UnsupportedFormatException;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * File formats understood by the reader and the writer.
 */
public enum FileFormat {

    /** Apache Parquet, written with Snappy compression */
    PARQUET("parquet"),

    /** Comma-separated values with a header row */
    CSV("csv"),

    /** Newline-delimited JSON, one object per row */
    JSON("json"),

    /** Excel workbook, through DuckDB's excel extension */
    EXCEL("xlsx");

    private final String extension;

    FileFormat(String extension) {
        this.extension = extension;
    }

    /**
     * Returns the default file extension, without the dot.
     *
     * @return the extension
     */
    public String extension() {
        return extension;
    }

    /**
     * Detects the format of a file from its extension.
     *
     * @param path the file path
     * @return the detected format
     * @throws UnsupportedFormatException if the extension is missing or unknown
     */
    public static FileFormat fromPath(Path path) {
        return detect(path).orElseThrow(() -> new UnsupportedFormatException(
            "Cannot determine file format of '" + path + "'. " +
            "Supported extensions: .parquet, .csv, .json, .jsonl, .ndjson, .xlsx, .xls"));
    }

    /**
     * Detects the format of a file from its extension, if known.
     *
     * @param path the file path
     * @return the format, or empty when the extension is missing or unknown
     */
    public static Optional<FileFormat> detect(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return Optional.empty();
        }
        switch (name.substring(dot + 1).toLowerCase(Locale.ROOT)) {
            case "parquet":
                return Optional.of(PARQUET);
            case "csv":
                return Optional.of(CSV);
            case "json":
            case "jsonl":
            case "ndjson":
                return Optional.of(JSON);
            case "xlsx":
            case "xls":
                return Optional.of(EXCEL);
            default:
                return Optional.empty();
        }
    }

    /**
     * Parses a format name as given on the command line.
     *
     * @param name the format name (parquet, csv, json, xlsx or excel)
     * @return the format
     * @throws UnsupportedFormatException if the name is unknown
     */
    public static FileFormat fromName(String name) {
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "parquet":
                return PARQUET;
            case "csv":
                return CSV;
            case "json":
            case "jsonl":
            case "ndjson":
                return JSON;
            case "xlsx":
            case "excel":
                return EXCEL;
            default:
                throw new UnsupportedFormatException(
                    "Unknown output format '" + name + "'. Supported formats: parquet, csv, json, xlsx");
        }
    }
}
