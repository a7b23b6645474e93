package com.ai.codesearch.service;

import com.ai.codesearch.config.CodeSearchProperties;
import com.ai.codesearch.exception.ConfigurationException;
import com.ai.codesearch.model.Chunk;
import com.ai.codesearch.model.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Splits source files into overlapping chunks. Files with a known language are
 * split recursively on that language's separators; everything else goes
 * through a fixed sliding window.
 */
@Service
public class CodeChunker {

    private static final Logger log = LoggerFactory.getLogger(CodeChunker.class);

    private final int chunkSize;
    private final int chunkOverlap;

    @Autowired
    public CodeChunker(CodeSearchProperties properties) {
        this(properties.getIndexing().getChunkSize(), properties.getIndexing().getChunkOverlap());
    }

    CodeChunker(int chunkSize, int chunkOverlap) {
        if (chunkSize <= 0) {
            throw new ConfigurationException("codesearch.indexing.chunk-size must be positive, got " + chunkSize);
        }
        if (chunkOverlap < 0 || chunkOverlap >= chunkSize) {
            throw new ConfigurationException("codesearch.indexing.chunk-overlap must be in [0, chunk-size), got "
                    + chunkOverlap);
        }
        this.chunkSize = chunkSize;
        this.chunkOverlap = chunkOverlap;
    }

    /**
     * Chunk a file, deriving the language from its extension when no hint is given.
     *
     * @return non-blank chunks in file order, ids {@code <path>_<chunk>_<n>} numbered from 0
     */
    public List<Chunk> chunk(SourceFile file, Language languageHint) {
        String text = file.text();
        if (text == null || text.isBlank()) {
            return List.of();
        }

        Language language = languageHint != null ? languageHint : Language.fromPath(file.path());

        List<Span> spans;
        if (text.length() <= chunkSize) {
            spans = List.of(new Span(0, text.length()));
        } else if (language != null) {
            spans = splitRecursive(text, new Span(0, text.length()), language.separators());
        } else {
            spans = slidingWindow(text.length());
        }

        List<Chunk> chunks = new ArrayList<>();
        for (Span span : spans) {
            Span trimmed = language != null || spans.size() == 1 ? trim(text, span) : span;
            if (trimmed.isEmpty() || text.substring(trimmed.start, trimmed.end).isBlank()) {
                continue;
            }
            int index = chunks.size();
            chunks.add(new Chunk(
                    Chunk.chunkId(file.path(), index),
                    text.substring(trimmed.start, trimmed.end),
                    file.path(),
                    file.originalFileUrl(),
                    file.repoName(),
                    file.version(),
                    index,
                    trimmed.start,
                    trimmed.end));
        }

        log.debug("[CodeChunker] Split {} ({} chars, language={}) into {} chunks (size={}, overlap={})",
                file.path(), text.length(), language, chunks.size(), chunkSize, chunkOverlap);
        return chunks;
    }

    /**
     * Windows of {@code chunkSize} advancing by {@code chunkSize - chunkOverlap};
     * the last window ends at the end of the text.
     */
    List<Span> slidingWindow(int length) {
        List<Span> windows = new ArrayList<>();
        int step = chunkSize - chunkOverlap;
        int start = 0;
        while (true) {
            int end = start + chunkSize;
            if (end >= length) {
                windows.add(new Span(start, length));
                break;
            }
            windows.add(new Span(start, end));
            start += step;
        }
        return windows;
    }

    private List<Span> splitRecursive(String text, Span span, List<String> separators) {
        String separator = separators.get(separators.size() - 1);
        List<String> finer = List.of();
        for (int i = 0; i < separators.size(); i++) {
            String candidate = separators.get(i);
            if (candidate.isEmpty()) {
                separator = candidate;
                break;
            }
            int found = text.indexOf(candidate, span.start);
            if (found >= 0 && found + candidate.length() <= span.end) {
                separator = candidate;
                finer = separators.subList(i + 1, separators.size());
                break;
            }
        }

        List<Span> result = new ArrayList<>();
        List<Span> fitting = new ArrayList<>();
        for (Span piece : splitKeepingSeparator(text, span, separator)) {
            if (piece.length() < chunkSize) {
                fitting.add(piece);
                continue;
            }
            if (!fitting.isEmpty()) {
                result.addAll(merge(text, fitting));
                fitting = new ArrayList<>();
            }
            if (finer.isEmpty()) {
                result.add(piece);
            } else {
                result.addAll(splitRecursive(text, piece, finer));
            }
        }
        if (!fitting.isEmpty()) {
            result.addAll(merge(text, fitting));
        }
        return result;
    }

    /**
     * Cuts before every occurrence of the separator, so each separator starts
     * the piece that follows it. An empty separator cuts between characters.
     */
    private static List<Span> splitKeepingSeparator(String text, Span span, String separator) {
        List<Span> pieces = new ArrayList<>();
        if (separator.isEmpty()) {
            for (int i = span.start; i < span.end; i++) {
                pieces.add(new Span(i, i + 1));
            }
            return pieces;
        }
        int pieceStart = span.start;
        int searchFrom = span.start + 1;
        while (true) {
            int found = text.indexOf(separator, searchFrom);
            if (found < 0 || found + separator.length() > span.end) {
                break;
            }
            if (found > pieceStart) {
                pieces.add(new Span(pieceStart, found));
            }
            pieceStart = found;
            searchFrom = found + separator.length();
        }
        if (span.end > pieceStart) {
            pieces.add(new Span(pieceStart, span.end));
        }
        return pieces;
    }

    /**
     * Greedily joins adjacent pieces up to {@code chunkSize}, starting each new
     * chunk with up to {@code chunkOverlap} characters of trailing pieces.
     */
    private List<Span> merge(String text, List<Span> pieces) {
        List<Span> merged = new ArrayList<>();
        Deque<Span> current = new ArrayDeque<>();
        int total = 0;
        for (Span piece : pieces) {
            if (total + piece.length() > chunkSize && !current.isEmpty()) {
                addIfNotBlank(text, merged, current);
                while (total > chunkOverlap || (total + piece.length() > chunkSize && total > 0)) {
                    total -= current.pollFirst().length();
                }
            }
            current.add(piece);
            total += piece.length();
        }
        if (!current.isEmpty()) {
            addIfNotBlank(text, merged, current);
        }
        return merged;
    }

    private static void addIfNotBlank(String text, List<Span> merged, Deque<Span> current) {
        Span joined = new Span(current.peekFirst().start, current.peekLast().end);
        if (!text.substring(joined.start, joined.end).isBlank()) {
            merged.add(joined);
        }
    }

    private static Span trim(String text, Span span) {
        int start = span.start;
        int end = span.end;
        while (start < end && Character.isWhitespace(text.charAt(start))) {
            start++;
        }
        while (end > start && Character.isWhitespace(text.charAt(end - 1))) {
            end--;
        }
        return new Span(start, end);
    }

    record Span(int start, int end) {

        int length() {
            return end - start;
        }

        boolean isEmpty() {
            return end <= start;
        }
    }
}
