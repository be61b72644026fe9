package com.codeabbrev.cli.store;

/**
 * One row of the run log.
 *
 * @param id             database id, 0 before the row is stored
 * @param parameters     JSON object of the options the run used
 * @param analysisType   {@code code_abbreviation} or {@code dependency_analysis}
 */
public record AnalysisRecord(long id, String filePath, long fileSize, String fileMd5, String modifiedDate,
                             String analysisDate, String analysisType, String parameters, String outputPath,
                             int charactersSaved, double percentSaved) {

    public static final String CODE_ABBREVIATION = "code_abbreviation";
    public static final String DEPENDENCY_ANALYSIS = "dependency_analysis";
}
