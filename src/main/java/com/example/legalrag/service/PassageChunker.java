package com.example.legalrag.service;

import com.example.legalrag.config.RagProperties;
import com.example.legalrag.dto.ContentToken;
import com.example.legalrag.dto.Passage;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Packs heading and body tokens into citable passages.
 * <p>
 * Rules, applied token by token:
 * <ul>
 *   <li>a heading closes the pending passage and opens a new one;</li>
 *   <li>body text is split into sentences, joined with single spaces while the passage stays within
 *       {@code maxSize};</li>
 *   <li>a sentence that does not fit closes the passage, even one still under {@code minSize};</li>
 *   <li>a sentence of {@code maxSize} or more is cut into slices. The first slice tops up an undersized passage,
 *       the last partial slice stays open and merges with what follows.</li>
 * </ul>
 * No passage is empty and none is longer than {@code maxSize}.
 */
@Component
@RequiredArgsConstructor
public class PassageChunker {

    private final RagProperties ragProperties;

    public List<Passage> chunkDocument(String documentId, List<ContentToken> tokens) {
        RagProperties.Chunking sizes = ragProperties.getChunking();
        List<String> texts = chunk(tokens, sizes.getMinSize(), sizes.getMaxSize());
        return IntStream.range(0, texts.size())
            .mapToObj(i -> new Passage(documentId, i, texts.get(i)))
            .toList();
    }

    public static List<String> chunk(List<ContentToken> tokens, int minSize, int maxSize) {
        if (maxSize <= 0) throw new IllegalArgumentException("maxSize must be positive");
        if (minSize < 0 || minSize > maxSize) {
            throw new IllegalArgumentException("minSize must be within [0, maxSize], was " + minSize);
        }

        PassageBuffer buffer = new PassageBuffer(minSize, maxSize);
        for (ContentToken token : tokens) {
            if (token.isHeading()) {
                buffer.flush();
                buffer.startWith(token.text().trim());
                continue;
            }
            for (String sentence : SentenceSplitter.split(token.text())) {
                buffer.place(sentence);
            }
        }
        buffer.flush();
        return buffer.passages();
    }

    /** Per-call accumulator; never shared across documents. */
    private static final class PassageBuffer {

        private final int minSize;
        private final int maxSize;
        private final StringBuilder current = new StringBuilder();
        private final List<String> passages = new ArrayList<>();

        PassageBuffer(int minSize, int maxSize) {
            this.minSize = minSize;
            this.maxSize = maxSize;
        }

        void place(String sentence) {
            if (lengthWith(sentence) <= maxSize) {
                append(sentence);
            } else if (current.length() >= minSize) {
                flush();
                startWith(sentence);
            } else if (sentence.length() >= maxSize) {
                hardSplit(sentence);
            } else {
                flush();
                append(sentence);
            }
        }

        /** Expects an empty buffer. */
        void startWith(String text) {
            if (text.length() <= maxSize) {
                append(text);
            } else {
                hardSplit(text);
            }
        }

        void hardSplit(String sentence) {
            int start = 0;
            while (start < sentence.length()) {
                int remaining = sentence.length() - start;
                if (!isEmpty() && lengthWith(Math.min(remaining, maxSize)) > maxSize && current.length() >= minSize) {
                    flush();
                }
                int room = isEmpty() ? maxSize : maxSize - current.length() - 1;
                if (room <= 0) {
                    flush();
                    room = maxSize;
                }
                int end = Math.min(start + room, sentence.length());
                append(sentence.substring(start, end));
                start = end;
            }
        }

        void append(String text) {
            if (!isEmpty()) current.append(' ');
            current.append(text);
        }

        void flush() {
            String passage = current.toString().trim();
            if (!passage.isEmpty()) passages.add(passage);
            current.setLength(0);
        }

        boolean isEmpty() {
            return current.length() == 0;
        }

        int lengthWith(String text) {
            return lengthWith(text.length());
        }

        int lengthWith(int extra) {
            return isEmpty() ? extra : current.length() + 1 + extra;
        }

        List<String> passages() {
            return passages;
        }
    }
}
