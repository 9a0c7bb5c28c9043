package com.tomeqa.index.structure;

import com.tomeqa.index.model.FontSpan;
import com.tomeqa.index.model.HeadingContext;
import com.tomeqa.index.model.Page;
import com.tomeqa.index.model.TextBlock;
import com.tomeqa.index.model.TextLine;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Infers a document's heading hierarchy from font statistics and tracks the heading path
 * while pages are scanned in order.
 * <p>
 * Usage per document:
 * <ol>
 *   <li>{@link #resetForDocument(String)}</li>
 *   <li>{@link #analyzePage(Page)} for the sampled pages</li>
 *   <li>{@link #determineHeadingLevels(int)}</li>
 *   <li>{@link #processPageHeadings(Page)} then {@link #currentContext()} for every page, in page order</li>
 * </ol>
 * Not thread-safe; one instance per ingest run.
 */
@Slf4j
public class StructureAnalyzer {

    public static final int DEFAULT_MIN_PAGES_SEEN = 2;
    static final int MAX_LEVELS = 6;
    static final double CLUSTER_GAP = 1.0;
    static final int SHORT_HEADING_CHARS = 100;
    private static final int MAX_EXAMPLES = 3;

    private final Map<StyleKey, StyleStats> styles = new LinkedHashMap<>();
    private final Map<Double, Integer> sizeToLevel = new HashMap<>();
    private final List<Double> headingSizes = new ArrayList<>();
    private final List<Heading> tableOfContents = new ArrayList<>();
    private final List<Heading> currentPath = new ArrayList<>();

    private String currentDocument = "";
    private int pagesSeen;

    record StyleKey(String font, double size, int flags) {}

    static final class StyleStats {
        final StyleKey key;
        int count;
        final Set<Integer> pages = new LinkedHashSet<>();
        final List<String> examples = new ArrayList<>();

        StyleStats(StyleKey key) {
            this.key = key;
        }
    }

    public void resetForDocument(String documentId) {
        currentDocument = documentId;
        currentPath.clear();
        tableOfContents.clear();
        styles.clear();
        pagesSeen = 0;
    }

    /**
     * Records one span. Blank text is ignored.
     */
    public void analyzeSpan(String font, double size, int flags, String text, int page) {
        if (text == null || text.isBlank()) {
            return;
        }
        StyleKey key = new StyleKey(font == null ? "unknown" : font, size, flags);
        StyleStats stats = styles.computeIfAbsent(key, StyleStats::new);
        stats.count++;
        stats.pages.add(page);

        String display = text.strip();
        if (display.length() > 50) display = display.substring(0, 50) + "...";
        if (stats.examples.size() < MAX_EXAMPLES && !stats.examples.contains(display)) {
            stats.examples.add(display);
        }
    }

    public void analyzePage(Page page) {
        if (page == null || page.blocks().isEmpty()) {
            return;
        }
        pagesSeen++;
        for (TextBlock block : page.blocks()) {
            for (TextLine line : block.lines()) {
                for (FontSpan span : line.spans()) {
                    analyzeSpan(span.font(), span.size(), span.flags(), span.text(), page.pageNumber());
                }
            }
        }
    }

    /**
     * Clusters the sizes of styles seen on at least {@code minPagesSeen} pages into up to six heading levels,
     * largest first. A new cluster starts whenever the gap to the previous size exceeds one point.
     */
    public void determineHeadingLevels(int minPagesSeen) {
        List<Double> candidateSizes = styles.values().stream()
                .filter(s -> s.pages.size() >= minPagesSeen)
                .map(s -> s.key.size())
                .sorted(Comparator.reverseOrder())
                .toList();

        List<List<Double>> clusters = new ArrayList<>();
        Double previous = null;
        for (Double size : candidateSizes) {
            if (previous == null || (previous - size) > CLUSTER_GAP) {
                clusters.add(new ArrayList<>());
            }
            clusters.get(clusters.size() - 1).add(size);
            previous = size;
        }

        sizeToLevel.clear();
        headingSizes.clear();
        for (int i = 0; i < Math.min(MAX_LEVELS, clusters.size()); i++) {
            List<Double> cluster = clusters.get(i);
            headingSizes.add(cluster.get(0));
            for (Double size : cluster) {
                sizeToLevel.put(size, i + 1);
            }
        }

        log.debug("[STRUCTURE] {}: {} candidate styles, heading sizes {}", currentDocument, candidateSizes.size(), headingSizes);
    }

    public HeadingClassification classify(String text, double fontSize, boolean bold) {
        Integer level = sizeToLevel.get(fontSize);
        if (level == null) {
            return HeadingClassification.NOT_A_HEADING;
        }
        if (level == 1) {
            return new HeadingClassification(true, level);
        }
        String value = text == null ? "" : text;
        if (bold || value.length() < SHORT_HEADING_CHARS || value.endsWith(":")) {
            return new HeadingClassification(true, level);
        }
        return HeadingClassification.NOT_A_HEADING;
    }

    /**
     * Classifies every block of the page and pushes the headings found onto the path.
     *
     * @return headings of this page, in block order
     */
    public List<Heading> processPageHeadings(Page page) {
        if (headingSizes.isEmpty() || page == null) {
            return List.of();
        }
        List<Heading> found = new ArrayList<>();
        for (TextBlock block : page.blocks()) {
            StringBuilder text = new StringBuilder();
            double maxSize = 0;
            boolean bold = false;
            for (TextLine line : block.lines()) {
                for (FontSpan span : line.spans()) {
                    maxSize = Math.max(maxSize, span.size());
                    bold |= span.isBold();
                    text.append(span.text().strip());
                }
                text.append(' ');
            }
            String blockText = text.toString().strip();
            if (blockText.isEmpty()) {
                continue;
            }
            HeadingClassification classification = classify(blockText, maxSize, bold);
            if (!classification.heading()) {
                continue;
            }
            Heading heading = new Heading(classification.level(), blockText, page.pageNumber(), maxSize, bold);
            found.add(heading);
            tableOfContents.add(heading);
            updateContext(heading);
        }
        return found;
    }

    public void updateContext(Heading heading) {
        int level = heading.level();
        if (level <= currentPath.size()) {
            currentPath.subList(level - 1, currentPath.size()).clear();
        }
        currentPath.add(heading);
    }

    public HeadingContext currentContext() {
        if (currentPath.isEmpty()) {
            return HeadingContext.EMPTY;
        }
        List<String> path = currentPath.stream().map(Heading::text).toList();
        Map<Integer, String> levels = new LinkedHashMap<>();
        for (Heading heading : currentPath) {
            levels.put(heading.level(), heading.text());
        }
        return new HeadingContext(
                path,
                path.get(0),
                path.size() > 1 ? path.get(1) : null,
                levels);
    }

    public List<Heading> tableOfContents() {
        return List.copyOf(tableOfContents);
    }

    public List<Double> headingSizes() {
        return List.copyOf(headingSizes);
    }

    public int pagesSeen() {
        return pagesSeen;
    }

    public String currentDocument() {
        return currentDocument;
    }
}
