package io.github.drompincen.codeforge.runtime.content;

import io.github.drompincen.codeforge.protocol.content.ContentBlock;

import java.util.ArrayList;
import java.util.List;

/**
 * Stateful front end to {@link ContentSegmenter} for a growing transcript. Segments that are
 * followed by a tool marker can no longer change, so their blocks are kept and only the trailing
 * segment is parsed again on each update. Input that is not an extension of the previous text
 * starts over from scratch. Results equal {@link ContentSegmenter#parse}.
 */
public class IncrementalContentSegmenter {

    private final ContentSegmenter segmenter;
    private final List<ContentBlock> settled = new ArrayList<>();
    private String text = "";
    private int openSegmentStart;

    public IncrementalContentSegmenter(ContentSegmenter segmenter) {
        this.segmenter = segmenter;
    }

    public synchronized List<ContentBlock> update(String fullText, boolean streaming) {
        if (fullText == null || fullText.isBlank()) {
            reset();
            return List.of();
        }
        if (!fullText.startsWith(text)) {
            reset();
        }
        text = fullText;

        int boundary;
        while ((boundary = fullText.indexOf(ContentSegmenter.BOUNDARY, openSegmentStart)) >= 0) {
            settled.addAll(segmenter.parseSegment(fullText.substring(openSegmentStart, boundary), false));
            openSegmentStart = boundary + 2;
        }
        List<ContentBlock> blocks = new ArrayList<>(settled);
        blocks.addAll(segmenter.parseSegment(fullText.substring(openSegmentStart), streaming));
        return ContentSegmenter.complete(blocks, fullText);
    }

    public synchronized void reset() {
        settled.clear();
        text = "";
        openSegmentStart = 0;
    }
}
