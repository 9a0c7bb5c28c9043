package com.tomeqa.index.structure;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Picks the pages the structure pass looks at: every page of short documents, otherwise the
 * opening pages, an evenly stepped middle and the closing pages.
 */
public final class PageSampler {

    public static final int DEFAULT_SAMPLE_SIZE = 40;

    private PageSampler() {}

    /**
     * @return zero-based page indexes, ascending
     */
    public static List<Integer> samplePages(int totalPages, int sampleSize) {
        if (totalPages <= 0) {
            return List.of();
        }
        int size = Math.min(sampleSize, totalPages);
        List<Integer> all = new ArrayList<>();
        if (totalPages <= size) {
            for (int i = 0; i < totalPages; i++) all.add(i);
            return all;
        }

        TreeSet<Integer> picked = new TreeSet<>();
        int head = Math.min(5, totalPages / 4);
        for (int i = 0; i < head; i++) picked.add(i);

        int step = Math.max(1, (totalPages - 10) / Math.max(1, size - 10));
        int middleLimit = size - 10;
        int taken = 0;
        for (int i = 5; i < totalPages - 5 && taken < middleLimit; i += step) {
            picked.add(i);
            taken++;
        }

        for (int i = Math.max(0, totalPages - 5); i < totalPages; i++) picked.add(i);
        return new ArrayList<>(picked);
    }
}
