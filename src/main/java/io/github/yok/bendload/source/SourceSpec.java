package io.github.yok.bendload.source;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;

/**
 * Describes where the records of a load come from.
 *
 * <p>
 * A spec is resolved once from the command line and opened once by {@link SourceReader}; it is
 * never re-resolved during a load.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class SourceSpec {

    /**
     * Origin of the byte stream.
     */
    public enum Kind {
        // File on the local filesystem
        LOCAL_PATH,
        // http:// or https:// resource fetched in one request
        REMOTE_URL,
        // Standard input of the process
        STDIN
    }

    private final Kind kind;

    // Path or URL; null for STDIN
    private final String location;

    /**
     * Resolves a command-line value into a spec.
     *
     * <p>
     * {@code null}, a blank value or {@code -} select standard input. Values starting with
     * {@code http://} or {@code https://} select a remote URL. Anything else is a local path.
     * </p>
     *
     * @param value raw value of {@code --load}
     * @return resolved spec
     */
    public static SourceSpec of(String value) {
        if (StringUtils.isBlank(value) || "-".equals(value.trim())) {
            return stdin();
        }
        String trimmed = value.trim();
        if (StringUtils.startsWithAny(trimmed, "http://", "https://")) {
            return remoteUrl(trimmed);
        }
        return localPath(trimmed);
    }

    public static SourceSpec localPath(String path) {
        return new SourceSpec(Kind.LOCAL_PATH, path);
    }

    public static SourceSpec remoteUrl(String url) {
        return new SourceSpec(Kind.REMOTE_URL, url);
    }

    public static SourceSpec stdin() {
        return new SourceSpec(Kind.STDIN, null);
    }

    @Override
    public String toString() {
        return kind == Kind.STDIN ? "<stdin>" : location;
    }
}
