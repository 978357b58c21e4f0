package com.opencm.format.catalog;

import java.nio.file.Path;

/**
 * Listing entry for one model file: id taken from the file name, display fields from the model section.
 */
public record ModelSummary(String id, String name, String domain, String description, Path path) {
}
