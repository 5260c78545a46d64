package org.pragmatica.latex.incremental;

import org.pragmatica.latex.error.ParseException;
import org.pragmatica.latex.parser.LatexParser;
import org.pragmatica.latex.parser.ParserConfig;
import org.pragmatica.latex.serializer.LatexSerializer;
import org.pragmatica.latex.tree.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps a document's text and tree in step.
 *
 * <p>Every update re-parses the whole buffer; there is no partial re-parse. A failed parse throws
 * {@link ParseException} and the caller keeps its previous {@link DocumentState}.
 */
public final class IncrementalParser {
    private static final Logger log = LoggerFactory.getLogger(IncrementalParser.class);

    private final ParserConfig config;

    public IncrementalParser() {
        this(ParserConfig.DEFAULT);
    }

    public IncrementalParser(ParserConfig config) {
        this.config = config;
    }

    public ParserConfig config() {
        return config;
    }

    public DocumentState parseFromScratch(String text) {
        var source = SourceBuffer.of(text);
        return new DocumentState(source, LatexParser.parse(source.text(), config));
    }

    /**
     * Replace {@code [start, end)} of the buffer with {@code inserted} and re-parse.
     *
     * @throws IndexOutOfBoundsException if the range is outside the buffer
     * @throws ParseException            if the edited text does not parse
     */
    public DocumentState applyTextEdit(DocumentState state, int start, int end, String inserted) {
        var edited = state.source().replace(start, end, inserted);
        log.debug("Edit [{}, {}) with {} characters, re-parsing {} characters", start, end, inserted.length(), edited.length());
        return reparse(edited);
    }

    /**
     * Adopt a structurally edited tree: serialize it and re-parse the result as the new buffer.
     */
    public DocumentState resync(DocumentState state, Node editedAst) {
        var text = LatexSerializer.toLatex(editedAst);
        log.debug("Resync from edited tree, {} -> {} characters", state.source().length(), text.length());
        return reparse(SourceBuffer.of(text));
    }

    private DocumentState reparse(SourceBuffer source) {
        try {
            return new DocumentState(source, LatexParser.parse(source.text(), config));
        } catch (ParseException e) {
            log.warn("Edited document no longer parses: {}", e.getMessage());
            throw e;
        }
    }
}
