package com.mediaanalytics.etl.pipeline;

import com.mediaanalytics.etl.model.ExtractionWarning;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of {@link EtlPipeline#run}: the terminal state, record counts and the cause of a failure.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineResult {
    private PipelineState state;
    private int recordsExtracted;
    private int inserted;
    private int skipped;

    @Builder.Default
    private List<ExtractionWarning> warnings = Collections.emptyList();

    // null unless state is FAILED
    private Exception failure;

    public boolean isSuccessful() {
        return state != null && state.isSuccessful();
    }
}
