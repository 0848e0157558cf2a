package io.github.pyanchor.analyzer;

import com.google.common.base.Splitter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;

/**
 * One Python source file queued for indexing.
 *
 * @param path path of the file relative to the source root, with forward slashes
 * @param modulePath dotted module path that prefixes every FQN minted in the file
 * @param content raw file bytes; offsets in the output refer to these bytes
 */
public record SourceFile(String path, String modulePath, byte[] content) {
    private static final String PY_SUFFIX = ".py";
    private static final String PACKAGE_INIT = "__init__";

    public SourceFile {
        if (modulePath.isEmpty()) {
            throw new IllegalArgumentException("Module path must not be empty for " + path);
        }
        content = content.clone();
    }

    @Override
    public byte[] content() {
        return content.clone();
    }

    /** Reads {@code file} and derives its module path from its location under {@code root}. */
    public static SourceFile read(Path root, Path file) throws IOException {
        var relative = root.relativize(file);
        return new SourceFile(toUnix(relative), modulePathFor(root, file), Files.readAllBytes(file));
    }

    /**
     * Maps a file under a source root to its dotted module path: {@code pkg/mod.py} becomes {@code pkg.mod} and
     * {@code pkg/__init__.py} becomes {@code pkg}.
     *
     * @throws IllegalArgumentException if the file is not a {@code .py} file under {@code root} or a path segment is
     *     not a valid Python identifier
     */
    public static String modulePathFor(Path root, Path file) {
        var relative = toUnix(root.toAbsolutePath().normalize().relativize(file.toAbsolutePath().normalize()));
        if (relative.isEmpty() || relative.startsWith("../") || !relative.endsWith(PY_SUFFIX)) {
            throw new IllegalArgumentException("Not a python file under " + root + ": " + file);
        }
        var withoutSuffix = relative.substring(0, relative.length() - PY_SUFFIX.length());
        var segments = new ArrayList<>(Splitter.on('/').splitToList(withoutSuffix));
        if (segments.size() > 1 && segments.get(segments.size() - 1).equals(PACKAGE_INIT)) {
            segments.remove(segments.size() - 1);
        }
        for (var segment : segments) {
            if (!isIdentifier(segment)) {
                throw new IllegalArgumentException("'" + segment + "' in " + relative + " is not a module name");
            }
        }
        return String.join(".", segments);
    }

    private static boolean isIdentifier(String segment) {
        if (segment.isEmpty()) {
            return false;
        }
        int first = segment.codePointAt(0);
        if (first != '_' && !Character.isUnicodeIdentifierStart(first)) {
            return false;
        }
        return segment.codePoints().allMatch(Character::isUnicodeIdentifierPart);
    }

    private static String toUnix(Path p) {
        return p.toString().replace('\\', '/');
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceFile that)) return false;
        return path.equals(that.path) && modulePath.equals(that.modulePath) && Arrays.equals(content, that.content);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * path.hashCode() + modulePath.hashCode()) + Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "SourceFile[" + path + " as " + modulePath + ", " + content.length + " bytes]";
    }
}
