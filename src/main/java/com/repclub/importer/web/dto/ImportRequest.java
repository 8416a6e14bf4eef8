package com.repclub.importer.web.dto;

import com.repclub.importer.domain.common.enums.DuplicateResolution;
import com.repclub.importer.domain.importdata.csv.ParseOptions;
import jakarta.validation.constraints.NotBlank;

import java.util.Map;

/**
 * Body of the preview, validate and execute endpoints. The CSV travels as text.
 *
 * @param mapping     reviewed source column → field mapping (null values leave a column unmapped)
 * @param resolutions per source row index, used by execute only
 */
public record ImportRequest(
        @NotBlank String content,
        String delimiter,
        Boolean hasHeader,
        Map<String, String> mapping,
        Map<Integer, DuplicateResolution> resolutions
) {

    public ParseOptions toParseOptions() {
        ParseOptions.ParseOptionsBuilder builder = ParseOptions.builder();
        if (delimiter != null && !delimiter.isEmpty()) {
            builder.delimiter("\\t".equals(delimiter) ? '\t' : delimiter.charAt(0));
        }
        if (hasHeader != null) {
            builder.hasHeader(hasHeader);
        }
        return builder.build();
    }
}
