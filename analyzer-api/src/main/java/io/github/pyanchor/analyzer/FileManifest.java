package io.github.pyanchor.analyzer;

import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

/**
 * Describes the source file an anchor stream belongs to.
 *
 * <p>Serializing the manifest is left to downstream writers; it only carries the data.
 */
public record FileManifest(String corpus, String root, String path, String language, String encoding, byte[] content) {
    public static final String PYTHON = "python";

    public FileManifest {
        content = content.clone();
    }

    public static FileManifest python(String corpus, String root, String path, byte[] content) {
        return new FileManifest(corpus, root, path, PYTHON, "utf-8", content);
    }

    @Override
    public byte[] content() {
        return content.clone();
    }

    public String contentBase64() {
        return Base64.getEncoder().encodeToString(content);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FileManifest that)) return false;
        return corpus.equals(that.corpus)
                && root.equals(that.root)
                && path.equals(that.path)
                && language.equals(that.language)
                && encoding.equals(that.encoding)
                && Arrays.equals(content, that.content);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(corpus, root, path, language, encoding);
        return 31 * result + Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "FileManifest[" + corpus + ":" + root + ":" + path + ", " + content.length + " bytes]";
    }
}
