package com.spiderstream.crawl.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Category of a discovered artifact. The wire value is what consumers see in serialized records.
 */
public enum ReportType {
    /** Raw href found on a page. */
    REF("ref"),
    /** Script, stylesheet, image or data asset referenced through a src attribute. */
    SRC("src"),
    UPLOAD_FORM("upload-form"),
    FORM("form"),
    /** A page that was actually fetched. */
    URL("url"),
    AWS_S3("aws-s3"),
    DOMAIN("domain");

    private final String value;

    ReportType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Whether records of this type carry a URL that resolves against the page it was found on.
     */
    public boolean isUrlBearing() {
        return switch (this) {
            case REF, SRC, UPLOAD_FORM, FORM, URL -> true;
            case AWS_S3, DOMAIN -> false;
        };
    }

    @JsonCreator
    public static ReportType fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("report type is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ReportType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("unknown report type: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
