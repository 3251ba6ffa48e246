package com.example.prr.inference;

import com.example.prr.model.OutputSchema;
import com.example.prr.model.PipelineStage;
import com.example.prr.model.UploadedArtifact;

/**
 * Everything a gateway needs for one stateless call.
 *
 * @param stage        Stage issuing the call
 * @param schema       Schema the output will be validated against
 * @param systemPrompt System instructions
 * @param userPrompt   Upstream context for this stage
 * @param attachment   Diagram to send as media, or {@code null}
 */
public record InferenceRequest(
        PipelineStage stage,
        OutputSchema schema,
        String systemPrompt,
        String userPrompt,
        UploadedArtifact attachment
) {

    /**
     * Returns a copy whose user prompt reports the errors of the previous answer,
     * asking the model to correct them.
     */
    public InferenceRequest withCorrection(String previousProblem) {
        String corrected = userPrompt + """


                CORRECTION REQUIRED:
                Your previous answer was rejected for the following reasons:
                %s
                Return the complete answer again, fixing every problem listed above.
                """.formatted(previousProblem);
        return new InferenceRequest(stage, schema, systemPrompt, corrected, attachment);
    }
}
