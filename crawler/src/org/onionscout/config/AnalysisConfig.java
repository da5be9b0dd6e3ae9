package org.onionscout.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.onionscout.util.ByteSizeDeserializer;

/**
 * @param maxAnalyzedBytes  only this much of each body is searched for findings
 * @param matchStepsPerChar character reads a matcher may make per analyzed byte before it is abandoned
 */
public record AnalysisConfig(
        @JsonDeserialize(using = ByteSizeDeserializer.class) Long maxAnalyzedBytes,
        Integer matchStepsPerChar) {

    public AnalysisConfig {
        if (maxAnalyzedBytes == null || maxAnalyzedBytes <= 0) maxAnalyzedBytes = 2L * 1024 * 1024;
        if (matchStepsPerChar == null || matchStepsPerChar <= 0) matchStepsPerChar = 1000;
    }
}
