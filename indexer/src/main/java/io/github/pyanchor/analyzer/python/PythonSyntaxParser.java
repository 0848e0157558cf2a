package io.github.pyanchor.analyzer.python;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterPython;

/** Parses Python source bytes with tree-sitter and freezes the result into {@link SyntaxNode}s. */
public final class PythonSyntaxParser {
    private static final Logger log = LogManager.getLogger(PythonSyntaxParser.class);

    // TSParser is not threadsafe, so we keep a parser per thread
    private static final ThreadLocal<TSParser> PARSER = ThreadLocal.withInitial(() -> {
        var parser = new TSParser();
        if (!parser.setLanguage(new TreeSitterPython())) {
            throw new IllegalStateException("Failed to set tree-sitter python language on parser");
        }
        return parser;
    });

    private PythonSyntaxParser() {}

    /**
     * Parses {@code source}. Offsets in the returned tree are UTF-8 byte offsets into {@code source} itself, including
     * any byte order mark the parser never sees.
     *
     * @throws IllegalArgumentException if {@code source} is not valid UTF-8
     */
    public static SyntaxNode parse(byte[] source) {
        int bom = hasUtf8Bom(source) ? 3 : 0;
        byte[] body = bom == 0 ? source : Arrays.copyOfRange(source, bom, source.length);
        if (bom > 0) {
            log.trace("Stripped UTF-8 BOM before parsing");
        }

        String src = decodeStrict(body, bom);

        TSTree tree = PARSER.get().parseString(null, src);
        var root = tree.getRootNode();
        if (root.isNull()) {
            throw new IllegalStateException("tree-sitter produced a null root node");
        }
        log.trace("Parsed {} bytes, root node type {}", body.length, root.getType());
        return SyntaxNode.snapshot(root, body, bom);
    }

    public static SyntaxNode parse(String source) {
        return parse(source.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Decodes {@code body} as UTF-8, refusing malformed input: with replacement characters the parser's offsets would no
     * longer match the file's bytes.
     *
     * @throws IllegalArgumentException if {@code body} is not valid UTF-8
     */
    private static String decodeStrict(byte[] body, int bom) {
        var decoder = StandardCharsets.UTF_8
                .newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        var buffer = ByteBuffer.wrap(body);
        try {
            return decoder.decode(buffer).toString();
        } catch (CharacterCodingException e) {
            throw new IllegalArgumentException(
                    "Source is not valid UTF-8 near byte " + (buffer.position() + bom), e);
        }
    }

    private static boolean hasUtf8Bom(byte[] bytes) {
        return bytes.length >= 3
                && (bytes[0] & 0xFF) == 0xEF
                && (bytes[1] & 0xFF) == 0xBB
                && (bytes[2] & 0xFF) == 0xBF;
    }
}
