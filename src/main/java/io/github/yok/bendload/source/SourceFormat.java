package io.github.yok.bendload.source;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * Enumeration of supported input formats.
 *
 * <p>
 * Each format defines the names accepted by {@code --format} and the file extensions that are
 * recognized as belonging to it. Only comma-delimited text is supported; one line is one record.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum SourceFormat {

    // Comma-Separated Values format (CSV).
    CSV("csv");

    // Set of valid names/extensions for this format (all lowercase).
    private final Set<String> extensions;

    SourceFormat(String... exts) {
        this.extensions = Arrays.stream(exts).map(e -> e.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }

    /**
     * Determines whether the given name or file extension belongs to this format.
     *
     * @param ext format name or extension (case-insensitive, without dot)
     * @return {@code true} if it matches this format, {@code false} otherwise
     */
    public boolean matches(String ext) {
        return ext != null && extensions.contains(ext.toLowerCase(Locale.ROOT));
    }

    /**
     * Resolves the format given on the command line.
     *
     * @param name value of {@code --format}
     * @return matching format
     * @throws IllegalArgumentException if no format matches
     */
    public static SourceFormat fromName(String name) {
        return Arrays.stream(values()).filter(f -> f.matches(name)).findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unsupported format: " + name + " (supported: csv)"));
    }
}
