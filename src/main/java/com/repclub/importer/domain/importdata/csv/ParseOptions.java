package com.repclub.importer.domain.importdata.csv;

import lombok.Builder;
import lombok.Getter;

/**
 * Tokenizer settings. A null delimiter means "detect from the first lines".
 */
@Getter
@Builder(toBuilder = true)
public class ParseOptions {

    @Builder.Default
    private final boolean hasHeader = true;

    /**
     * Greedy: lines holding only whitespace count as empty too.
     */
    @Builder.Default
    private final boolean skipEmptyLines = true;

    @Builder.Default
    private final boolean trimFields = true;

    private final Character delimiter;

    public static ParseOptions defaults() {
        return ParseOptions.builder().build();
    }
}
