package ai.subtitle.translator.pipeline;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Derives sibling output paths from an input caption path by suffix convention.
 */
public final class OutputPaths {

    static final String FIXED_SUFFIX = "_fix";
    static final String MERGED_SUFFIX = "_merged";
    static final String TRANSLATED_SUFFIX = "_zh";
    static final String BILINGUAL_SUFFIX = "_bilingual";

    private OutputPaths() {
    }

    public static Path fixed(Path input) {
        return sibling(input, FIXED_SUFFIX, ".srt");
    }

    public static Path merged(Path input) {
        return sibling(input, MERGED_SUFFIX, ".srt");
    }

    public static Path translated(Path input) {
        return sibling(input, TRANSLATED_SUFFIX, ".srt");
    }

    public static Path bilingual(Path input) {
        return sibling(input, BILINGUAL_SUFFIX, ".srt");
    }

    public static Path script(Path input) {
        return sibling(input, "", ".ass");
    }

    static String stem(Path input) {
        String fileName = Objects.requireNonNull(input.getFileName(), "input must name a file").toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private static Path sibling(Path input, String suffix, String extension) {
        Objects.requireNonNull(input, "input");
        String name = stem(input) + suffix + extension;
        Path parent = input.getParent();
        return parent == null ? Path.of(name) : parent.resolve(name);
    }
}
