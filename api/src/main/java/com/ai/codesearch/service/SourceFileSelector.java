package com.ai.codesearch.service;

import com.ai.codesearch.config.CodeSearchProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides which archive entries are source files worth indexing, and decodes them.
 */
@Service
public class SourceFileSelector {

    private final Set<String> extensions;
    private final List<String> skipPatterns;

    @Autowired
    public SourceFileSelector(CodeSearchProperties properties) {
        this(properties.getIndexing().getExtensions(), properties.getIndexing().getSkipPatterns());
    }

    SourceFileSelector(List<String> extensions, List<String> skipPatterns) {
        this.extensions = extensions.stream()
                .map(ext -> ext.toLowerCase(Locale.ROOT))
                .map(ext -> ext.startsWith(".") ? ext.substring(1) : ext)
                .collect(Collectors.toUnmodifiableSet());
        this.skipPatterns = skipPatterns.stream()
                .map(pattern -> pattern.toLowerCase(Locale.ROOT))
                .toList();
    }

    /**
     * True when the extension is allow-listed and no path segment contains a
     * skip pattern.
     */
    public boolean isEligible(String path) {
        if (path == null || path.isBlank()) {
            return false;
        }
        String lower = path.toLowerCase(Locale.ROOT);
        for (String segment : lower.split("/")) {
            for (String pattern : skipPatterns) {
                if (segment.contains(pattern)) {
                    return false;
                }
            }
        }
        String name = lower.substring(lower.lastIndexOf('/') + 1);
        int lastDot = name.lastIndexOf('.');
        if (lastDot < 0) {
            return false;
        }
        return extensions.contains(name.substring(lastDot + 1));
    }

    /**
     * Strict UTF-8 decode.
     *
     * @return empty for malformed input or content with NUL bytes
     */
    public Optional<String> decode(byte[] content) {
        for (byte b : content) {
            if (b == 0) {
                return Optional.empty();
            }
        }
        try {
            String text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(content))
                    .toString();
            return Optional.of(text);
        } catch (CharacterCodingException e) {
            return Optional.empty();
        }
    }
}
