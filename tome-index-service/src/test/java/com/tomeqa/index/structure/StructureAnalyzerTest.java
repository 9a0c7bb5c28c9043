package com.tomeqa.index.structure;

import com.tomeqa.index.model.FontSpan;
import com.tomeqa.index.model.HeadingContext;
import com.tomeqa.index.model.Page;
import com.tomeqa.index.model.TextBlock;
import com.tomeqa.index.model.TextLine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class StructureAnalyzerTest {

    private static final String BODY_120 = "Attack rolls are made with a d20 and the relevant modifiers "
            + "are added before the result is compared to the armor class";

    private StructureAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new StructureAnalyzer();
        analyzer.resetForDocument("phb");
    }

    private static TextBlock block(double size, int flags, String text) {
        return new TextBlock(List.of(new TextLine(List.of(new FontSpan("Serif", size, flags, text)))));
    }

    private static Page page(int number, TextBlock... blocks) {
        return new Page("phb", number, null, 5, List.of(blocks));
    }

    @Nested
    @DisplayName("Heading level inference")
    class LevelInference {

        @Test
        @DisplayName("Should map the largest recurring size to level 1 and keep long body text out")
        void shouldInferLevelsFromRecurringSizes() {
            for (int p : new int[]{1, 3, 5}) {
                analyzer.analyzeSpan("Serif-Bold", 24, 0, "Chapter", p);
            }
            for (int p = 1; p <= 5; p++) {
                analyzer.analyzeSpan("Serif", 12, 0, "body text", p);
            }

            analyzer.determineHeadingLevels(2);

            assertThat(BODY_120).hasSizeGreaterThanOrEqualTo(100);
            assertThat(analyzer.headingSizes()).containsExactly(24.0, 12.0);
            assertThat(analyzer.classify("Combat", 24, false)).isEqualTo(new HeadingClassification(true, 1));
            assertThat(analyzer.classify(BODY_120, 12, false)).isEqualTo(HeadingClassification.NOT_A_HEADING);
        }

        @Test
        @DisplayName("Should accept lower levels when bold, short or ending with a colon")
        void shouldAcceptLowerLevelsOnHeuristics() {
            analyzer.analyzeSpan("Serif", 24, 0, "Chapter", 1);
            analyzer.analyzeSpan("Serif", 24, 0, "Chapter", 2);
            analyzer.analyzeSpan("Serif", 12, 0, "body", 1);
            analyzer.analyzeSpan("Serif", 12, 0, "body", 2);
            analyzer.determineHeadingLevels(2);

            assertThat(analyzer.classify(BODY_120, 12, true).heading()).isTrue();
            assertThat(analyzer.classify(BODY_120 + ":", 12, false).level()).isEqualTo(2);
            assertThat(analyzer.classify("Short line", 12, false)).isEqualTo(new HeadingClassification(true, 2));
        }

        @Test
        @DisplayName("Should never classify an unseen size as a heading")
        void shouldRejectUnknownSizes() {
            analyzer.analyzeSpan("Serif", 24, 0, "Chapter", 1);
            analyzer.analyzeSpan("Serif", 24, 0, "Chapter", 2);
            analyzer.determineHeadingLevels(2);

            assertThat(analyzer.classify("Title", 30, true)).isEqualTo(HeadingClassification.NOT_A_HEADING);
        }

        @Test
        @DisplayName("Should ignore styles seen on too few pages")
        void shouldIgnoreRareStyles() {
            analyzer.analyzeSpan("Serif", 40, 0, "Cover", 1);
            analyzer.analyzeSpan("Serif", 18, 0, "Section", 1);
            analyzer.analyzeSpan("Serif", 18, 0, "Section", 2);
            analyzer.determineHeadingLevels(2);

            assertThat(analyzer.headingSizes()).containsExactly(18.0);
            assertThat(analyzer.classify("Cover", 40, false).heading()).isFalse();
        }

        @Test
        @DisplayName("Should cluster sizes within one point into the same level")
        void shouldClusterCloseSizes() {
            for (double size : new double[]{24, 23.5, 18, 12}) {
                analyzer.analyzeSpan("Serif", size, 0, "x", 1);
                analyzer.analyzeSpan("Serif", size, 0, "x", 2);
            }
            analyzer.determineHeadingLevels(2);

            assertThat(analyzer.headingSizes()).containsExactly(24.0, 18.0, 12.0);
            assertThat(analyzer.classify("Title", 23.5, false).level()).isEqualTo(1);
            assertThat(analyzer.classify("Title", 18, false).level()).isEqualTo(2);
        }

        @Test
        @DisplayName("Should keep at most six levels")
        void shouldCapLevels() {
            for (int i = 0; i < 9; i++) {
                double size = 40 - i * 3;
                analyzer.analyzeSpan("Serif", size, 0, "x", 1);
                analyzer.analyzeSpan("Serif", size, 0, "x", 2);
            }
            analyzer.determineHeadingLevels(2);

            assertThat(analyzer.headingSizes()).hasSize(StructureAnalyzer.MAX_LEVELS);
            assertThat(analyzer.classify("x", 40 - 8 * 3, true).heading()).isFalse();
        }

        @Test
        @DisplayName("Should ignore blank spans and count only pages with blocks")
        void shouldIgnoreBlankInput() {
            analyzer.analyzePage(page(1, block(24, 0, "   ")));
            analyzer.analyzePage(new Page("phb", 2, "plain text only", 5, List.of()));

            assertThat(analyzer.pagesSeen()).isEqualTo(1);
            analyzer.determineHeadingLevels(1);
            assertThat(analyzer.headingSizes()).isEmpty();
        }

        @Test
        @DisplayName("Should produce identical levels for identical input")
        void shouldBeDeterministic() {
            List<Page> pages = new ArrayList<>();
            for (int p = 1; p <= 4; p++) {
                pages.add(page(p, block(20, 16, "Heading " + p), block(11, 0, "Body " + p), block(14, 0, "Sub " + p)));
            }
            pages.forEach(analyzer::analyzePage);
            analyzer.determineHeadingLevels(2);
            List<Double> first = analyzer.headingSizes();

            StructureAnalyzer other = new StructureAnalyzer();
            other.resetForDocument("phb");
            pages.forEach(other::analyzePage);
            other.determineHeadingLevels(2);

            assertThat(other.headingSizes()).isEqualTo(first);
            for (double size : new double[]{20, 14, 11}) {
                assertThat(other.classify("t", size, false)).isEqualTo(analyzer.classify("t", size, false));
            }
        }
    }

    @Nested
    @DisplayName("Heading context tracking")
    class ContextTracking {

        @Test
        @DisplayName("Should truncate the path when a heading of the same or higher level arrives")
        void shouldTruncatePath() {
            analyzer.updateContext(new Heading(1, "Combat", 1, 24, true));
            analyzer.updateContext(new Heading(2, "Attack Rolls", 1, 18, true));
            analyzer.updateContext(new Heading(2, "Damage", 2, 18, true));

            HeadingContext context = analyzer.currentContext();
            assertThat(context.headingPath()).containsExactly("Combat", "Damage");
            assertThat(context.section()).isEqualTo("Combat");
            assertThat(context.subsection()).isEqualTo("Damage");

            analyzer.updateContext(new Heading(1, "Spells", 3, 24, true));
            assertThat(analyzer.currentContext().headingPath()).containsExactly("Spells");
            assertThat(analyzer.currentContext().level(2)).isEmpty();
        }

        @Test
        @DisplayName("Should return the empty context before any heading")
        void shouldStartEmpty() {
            assertThat(analyzer.currentContext()).isSameAs(HeadingContext.EMPTY);
        }

        @Test
        @DisplayName("Should find headings block by block and write them into metadata")
        void shouldProcessPageHeadings() {
            Page first = page(1, block(24, 16, "Spellcasting"), block(12, 0, BODY_120));
            Page second = page(2, block(18, 16, "Components:"), block(12, 0, BODY_120));
            analyzer.analyzePage(first);
            analyzer.analyzePage(second);
            analyzer.analyzePage(page(3, block(24, 16, "Magic Items"), block(18, 16, "Armor")));
            analyzer.determineHeadingLevels(2);

            assertThat(analyzer.processPageHeadings(first)).extracting(Heading::text).containsExactly("Spellcasting");
            assertThat(analyzer.processPageHeadings(second)).extracting(Heading::level).containsExactly(2);

            Map<String, Object> metadata = new HashMap<>();
            analyzer.currentContext().writeTo(metadata);
            assertThat(metadata)
                    .containsEntry("section", "Spellcasting")
                    .containsEntry("subsection", "Components:")
                    .containsEntry("h1", "Spellcasting")
                    .containsEntry("h2", "Components:")
                    .containsEntry("heading_path", "Spellcasting > Components:");
            assertThat(analyzer.tableOfContents()).hasSize(2);
        }

        @Test
        @DisplayName("Should clear the path when a new document starts")
        void shouldResetPerDocument() {
            analyzer.updateContext(new Heading(1, "Combat", 1, 24, true));
            analyzer.resetForDocument("dmg");

            assertThat(analyzer.currentContext().isEmpty()).isTrue();
            assertThat(analyzer.currentDocument()).isEqualTo("dmg");
            assertThat(analyzer.tableOfContents()).isEmpty();
        }
    }
}
