package com.citygml.resolver.codelist.registry;

import java.nio.file.Path;
import java.util.Optional;

import com.citygml.resolver.core.AttributeKey;

import lombok.experimental.UtilityClass;

/**
 * Naming convention of codelist files: {@code {Feature}_{Attribute}.xml}.
 */
@UtilityClass
public class CodelistFileNames {

    /**
     * Derive the registration key from a codelist file name.
     * The stem ends at the first dot; tokens after the second {@code _} are ignored.
     * Example: "LandSlideRiskAttribute_areaType.xml" -> (LandSlideRiskAttribute, areaType)
     */
    public static Optional<AttributeKey> parseKey(Path file) {
        return parseKey(file.getFileName().toString());
    }

    public static Optional<AttributeKey> parseKey(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            return Optional.empty();
        }
        int dot = fileName.indexOf('.');
        String stem = dot >= 0 ? fileName.substring(0, dot) : fileName;

        String[] tokens = stem.split("_");
        if (tokens.length < 2 || tokens[0].isEmpty() || tokens[1].isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(AttributeKey.of(tokens[0], tokens[1]));
    }
}
