package com.tomeqa.index.structure;

public record HeadingClassification(boolean heading, int level) {

    public static final HeadingClassification NOT_A_HEADING = new HeadingClassification(false, 0);
}
