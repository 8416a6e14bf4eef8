package com.repclub.importer.domain.importdata.mapping;

import com.repclub.importer.domain.importdata.model.ImportFieldConfig;
import com.repclub.importer.domain.importdata.model.ImportModuleConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Proposes a source column → target field mapping from header names.
 *
 * <p>Every (column, field) pair is scored: 1.0 when the normalized column equals
 * the normalized field name or label, {@code shorter/longer × 0.8} when one
 * contains the other. Pairs below {@link #MIN_SCORE} are discarded; the rest are
 * accepted best-first so each field receives at most one column. Equal scores
 * go to the earlier column, then to the earlier declared field.
 */
@Slf4j
@Component
public class ColumnAutoMapper {

    static final double MIN_SCORE = 0.5;
    private static final double EXACT_SCORE = 1.0;
    private static final double CONTAINMENT_WEIGHT = 0.8;

    public Map<String, String> autoMap(List<String> sourceColumns, ImportModuleConfig config) {
        return autoMap(sourceColumns, config.getFields());
    }

    public Map<String, String> autoMap(List<String> sourceColumns, List<ImportFieldConfig> targetFields) {
        List<String> columns = new ArrayList<>(new LinkedHashSet<>(sourceColumns));

        List<Candidate> candidates = new ArrayList<>();
        for (int c = 0; c < columns.size(); c++) {
            for (int f = 0; f < targetFields.size(); f++) {
                double score = score(columns.get(c), targetFields.get(f));
                if (score >= MIN_SCORE) {
                    candidates.add(new Candidate(c, f, score));
                }
            }
        }
        candidates.sort(Comparator.comparingDouble(Candidate::score).reversed()
                .thenComparingInt(Candidate::column)
                .thenComparingInt(Candidate::field));

        Map<String, String> mapping = new LinkedHashMap<>();
        columns.forEach(column -> mapping.put(column, null));

        Set<Integer> assignedColumns = new HashSet<>();
        Set<Integer> assignedFields = new HashSet<>();
        for (Candidate candidate : candidates) {
            if (assignedColumns.contains(candidate.column()) || assignedFields.contains(candidate.field())) {
                continue;
            }
            assignedColumns.add(candidate.column());
            assignedFields.add(candidate.field());
            mapping.put(columns.get(candidate.column()), targetFields.get(candidate.field()).getName());
        }

        log.debug("Auto-mapped {} of {} columns", assignedColumns.size(), columns.size());
        return mapping;
    }

    /**
     * Best score of a column against a field's name and label.
     */
    public double score(String sourceColumn, ImportFieldConfig field) {
        String source = ColumnNormalizer.normalize(sourceColumn);
        if (source.isEmpty()) {
            return 0;
        }
        return Math.max(
                score(source, ColumnNormalizer.normalize(field.getName())),
                score(source, ColumnNormalizer.normalize(field.getLabel())));
    }

    private static double score(String source, String target) {
        if (target.isEmpty()) {
            return 0;
        }
        if (source.equals(target)) {
            return EXACT_SCORE;
        }
        if (source.contains(target) || target.contains(source)) {
            double ratio = (double) Math.min(source.length(), target.length())
                    / Math.max(source.length(), target.length());
            return ratio * CONTAINMENT_WEIGHT;
        }
        return 0;
    }

    private record Candidate(int column, int field, double score) {
    }
}
