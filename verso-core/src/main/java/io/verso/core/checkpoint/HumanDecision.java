package io.verso.core.checkpoint;

import io.verso.core.pipeline.ApprovalType;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Reviewer answer to a suspended checkpoint.
///
/// Keys are state field names, plus `approved` and `feedback` for artifact reviews.
/// A `null` value clears the named field.
///
/// @param approvalType checkpoint being answered, not null
/// @param fields decision fields, not null
public record HumanDecision(ApprovalType approvalType, Map<String, Object> fields) {

    public static final String APPROVED = "approved";
    public static final String FEEDBACK = "feedback";

    public HumanDecision {
        Objects.requireNonNull(approvalType, "approvalType must not be null");
        fields =
                Collections.unmodifiableMap(
                        new LinkedHashMap<>(Objects.requireNonNullElse(fields, Map.of())));
    }

    public static HumanDecision of(ApprovalType approvalType, Map<String, Object> fields) {
        return new HumanDecision(approvalType, fields);
    }

    public static HumanDecision approve(ApprovalType approvalType) {
        return new HumanDecision(approvalType, Map.of(APPROVED, true));
    }

    public static HumanDecision reject(ApprovalType approvalType, String feedback) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(APPROVED, false);
        fields.put(FEEDBACK, feedback);
        return new HumanDecision(approvalType, fields);
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }
}
