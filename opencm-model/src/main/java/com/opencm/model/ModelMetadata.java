package com.opencm.model;

import java.util.List;
import java.util.Objects;

/**
 * Provenance of a model. Timestamps are kept as the text the document carried.
 */
public final class ModelMetadata {

    public static final String DEFAULT_LICENSE = "CC0-1.0-Universal";

    private final String author;
    private final String citation;
    private final String license;
    private final List<String> tags;
    private final String createdAt;
    private final String updatedAt;
    private final String sourceUrl;
    private final String adaptationNotes;

    public ModelMetadata(
            String author,
            String citation,
            String license,
            List<String> tags,
            String createdAt,
            String updatedAt,
            String sourceUrl,
            String adaptationNotes) {
        this.author = nullToEmpty(author);
        this.citation = nullToEmpty(citation);
        this.license = license != null ? license : DEFAULT_LICENSE;
        this.tags = tags != null ? List.copyOf(tags) : List.of();
        this.createdAt = nullToEmpty(createdAt);
        this.updatedAt = nullToEmpty(updatedAt);
        this.sourceUrl = nullToEmpty(sourceUrl);
        this.adaptationNotes = nullToEmpty(adaptationNotes);
    }

    /** Metadata with only an author; everything else defaulted. */
    public static ModelMetadata byAuthor(String author) {
        return new ModelMetadata(author, null, null, null, null, null, null, null);
    }

    public String getAuthor() {
        return author;
    }

    public String getCitation() {
        return citation;
    }

    public String getLicense() {
        return license;
    }

    public List<String> getTags() {
        return tags;
    }

    public String getCreatedAt() {
        return createdAt;
    }

    public String getUpdatedAt() {
        return updatedAt;
    }

    /** Where the original model came from. */
    public String getSourceUrl() {
        return sourceUrl;
    }

    /** How the model was adapted from its source. */
    public String getAdaptationNotes() {
        return adaptationNotes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ModelMetadata that = (ModelMetadata) o;
        return author.equals(that.author)
                && citation.equals(that.citation)
                && license.equals(that.license)
                && tags.equals(that.tags)
                && createdAt.equals(that.createdAt)
                && updatedAt.equals(that.updatedAt)
                && sourceUrl.equals(that.sourceUrl)
                && adaptationNotes.equals(that.adaptationNotes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(author, citation, license, tags, createdAt, updatedAt, sourceUrl, adaptationNotes);
    }

    private static String nullToEmpty(String s) {
        return s != null ? s : "";
    }
}
