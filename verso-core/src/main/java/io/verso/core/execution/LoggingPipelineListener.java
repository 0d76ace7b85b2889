package io.verso.core.execution;

import io.verso.core.checkpoint.CheckpointPayload;
import io.verso.core.pipeline.ErrorRecord;
import io.verso.core.pipeline.ReportFields;
import io.verso.core.pipeline.Step;
import io.verso.core.state.WorkflowState;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Writes every pipeline event to `java.util.logging`.
public class LoggingPipelineListener implements PipelineListener {

    private static final Logger logger = Logger.getLogger(LoggingPipelineListener.class.getName());

    @Override
    public void onStepStart(String runId, Step step) {
        logger.fine("[" + runId + "] starting " + step + " (" + step.phase() + ")");
    }

    @Override
    public void onStepComplete(String runId, Step step, WorkflowState state) {
        logger.info(
                "["
                        + runId
                        + "] completed "
                        + step
                        + ", phase now "
                        + state.get(ReportFields.CURRENT_PHASE));
    }

    @Override
    public void onStepFailed(String runId, Step step, ErrorRecord error) {
        logger.warning("[" + runId + "] " + step + " failed: " + error.message());
    }

    @Override
    public void onSubStepFailed(String runId, String subStep, String message) {
        logger.warning("[" + runId + "] sub-step " + subStep + " failed: " + message);
    }

    @Override
    public void onSuspended(String runId, CheckpointPayload payload) {
        logger.info("[" + runId + "] awaiting " + payload.approvalType() + " at " + payload.phase());
    }

    @Override
    public void onRolledBack(String runId, String pointId, WorkflowState state) {
        logger.info("[" + runId + "] rolled back to " + pointId);
    }

    @Override
    public void onFinished(String runId, WorkflowState state) {
        if (logger.isLoggable(Level.INFO)) {
            logger.info("[" + runId + "] finished in phase " + state.get(ReportFields.CURRENT_PHASE));
        }
    }
}
