package com.tomeqa.index.chunk;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Length-bounded recursive splitter that keeps track of where every chunk starts in the input.
 * <p>
 * The text is cut on the first separator that occurs in it (paragraph break, line break,
 * sentence end, space, then single characters). Pieces that still exceed the chunk size are
 * split again with the next separator. Neighbouring pieces are merged back into chunks of at
 * most {@code chunkSize} characters, carrying up to {@code chunkOverlap} trailing characters of
 * the previous chunk. Separators stay attached to the start of the piece that follows them.
 */
public class RecursiveTextSplitter {

    public static final int DEFAULT_CHUNK_SIZE = 800;
    public static final int DEFAULT_CHUNK_OVERLAP = 150;
    public static final List<String> DEFAULT_SEPARATORS = List.of("\n\n", "\n", ". ", " ", "");

    private final int chunkSize;
    private final int chunkOverlap;
    private final List<String> separators;

    /**
     * A chunk and its half-open {@code [start, end)} range in the split text.
     */
    public record TextSpan(int start, int end, String text) {}

    public RecursiveTextSplitter() {
        this(DEFAULT_CHUNK_SIZE, DEFAULT_CHUNK_OVERLAP, DEFAULT_SEPARATORS);
    }

    public RecursiveTextSplitter(int chunkSize, int chunkOverlap) {
        this(chunkSize, chunkOverlap, DEFAULT_SEPARATORS);
    }

    public RecursiveTextSplitter(int chunkSize, int chunkOverlap, List<String> separators) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be > 0");
        }
        if (chunkOverlap < 0 || chunkOverlap >= chunkSize) {
            throw new IllegalArgumentException("chunkOverlap must be in [0, chunkSize)");
        }
        if (separators == null || separators.isEmpty()) {
            throw new IllegalArgumentException("at least one separator is required");
        }
        this.chunkSize = chunkSize;
        this.chunkOverlap = chunkOverlap;
        this.separators = List.copyOf(separators);
    }

    public List<TextSpan> split(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<TextSpan> out = new ArrayList<>();
        splitRange(text, 0, text.length(), 0, out);
        return out;
    }

    private void splitRange(String text, int from, int to, int separatorIndex, List<TextSpan> out) {
        int chosen = separators.size() - 1;
        for (int i = separatorIndex; i < separators.size(); i++) {
            String candidate = separators.get(i);
            if (candidate.isEmpty() || indexOf(text, candidate, from, to) >= 0) {
                chosen = i;
                break;
            }
        }
        String separator = separators.get(chosen);

        List<int[]> good = new ArrayList<>();
        for (int[] piece : pieces(text, from, to, separator)) {
            if (piece[1] - piece[0] <= chunkSize) {
                good.add(piece);
                continue;
            }
            merge(text, good, out);
            good.clear();
            if (chosen + 1 < separators.size()) {
                splitRange(text, piece[0], piece[1], chosen + 1, out);
            } else {
                hardCut(text, piece[0], piece[1], out);
            }
        }
        merge(text, good, out);
    }

    private static List<int[]> pieces(String text, int from, int to, String separator) {
        List<int[]> pieces = new ArrayList<>();
        if (separator.isEmpty()) {
            for (int i = from; i < to; i++) {
                pieces.add(new int[]{i, i + 1});
            }
            return pieces;
        }
        int pieceStart = from;
        int search = from + 1;
        while (true) {
            int hit = indexOf(text, separator, search, to);
            if (hit < 0) break;
            if (hit > pieceStart) {
                pieces.add(new int[]{pieceStart, hit});
                pieceStart = hit;
            }
            search = hit + separator.length();
        }
        if (pieceStart < to) {
            pieces.add(new int[]{pieceStart, to});
        }
        return pieces;
    }

    private void merge(String text, List<int[]> pieces, List<TextSpan> out) {
        Deque<int[]> current = new ArrayDeque<>();
        int total = 0;
        for (int[] piece : pieces) {
            int length = piece[1] - piece[0];
            if (total + length > chunkSize && !current.isEmpty()) {
                emit(text, current.peekFirst()[0], current.peekLast()[1], out);
                while (total > chunkOverlap || (total + length > chunkSize && total > 0)) {
                    int[] dropped = current.pollFirst();
                    total -= dropped[1] - dropped[0];
                }
            }
            current.addLast(piece);
            total += length;
        }
        if (!current.isEmpty()) {
            emit(text, current.peekFirst()[0], current.peekLast()[1], out);
        }
    }

    private void hardCut(String text, int from, int to, List<TextSpan> out) {
        int step = chunkSize - chunkOverlap;
        for (int start = from; start < to; start += step) {
            int end = Math.min(to, start + chunkSize);
            emit(text, start, end, out);
            if (end == to) break;
        }
    }

    private static void emit(String text, int start, int end, List<TextSpan> out) {
        while (start < end && Character.isWhitespace(text.charAt(start))) start++;
        while (end > start && Character.isWhitespace(text.charAt(end - 1))) end--;
        if (start < end) {
            out.add(new TextSpan(start, end, text.substring(start, end)));
        }
    }

    private static int indexOf(String text, String needle, int from, int to) {
        int hit = text.indexOf(needle, from);
        return hit >= 0 && hit + needle.length() <= to ? hit : -1;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public int getChunkOverlap() {
        return chunkOverlap;
    }
}
