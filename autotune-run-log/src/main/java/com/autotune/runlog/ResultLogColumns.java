package com.autotune.runlog;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Column layout of the CSV result log: variable names in tree order, {@code Score_1..Score_R},
 * {@code Overall}, {@code Status}.
 */
public final class ResultLogColumns {

    public static final String SCORE_PREFIX = "Score_";
    public static final String OVERALL = "Overall";
    public static final String STATUS = "Status";

    private ResultLogColumns() {
    }

    public static List<String> header(List<String> variables, int repeat) {
        List<String> header = new ArrayList<>(variables.size() + repeat + 2);
        header.addAll(variables);
        for (int i = 1; i <= repeat; i++) {
            header.add(SCORE_PREFIX + i);
        }
        header.add(OVERALL);
        header.add(STATUS);
        return header;
    }

    /** Score columns needed to hold {@code repeat} samples and every sample already present in {@code records}. */
    public static int scoreColumns(int repeat, Collection<TestRecord> records) {
        int columns = repeat;
        for (TestRecord record : records) {
            columns = Math.max(columns, record.getRawScores().size());
        }
        return columns;
    }

    public static boolean isScoreColumn(String name) {
        if (name == null || !name.startsWith(SCORE_PREFIX) || name.length() == SCORE_PREFIX.length()) return false;
        for (int i = SCORE_PREFIX.length(); i < name.length(); i++) {
            if (!Character.isDigit(name.charAt(i))) return false;
        }
        return true;
    }

    /** Plain decimal rendering used in every numeric cell. */
    public static String formatScore(double score) {
        return Double.toString(score);
    }
}
