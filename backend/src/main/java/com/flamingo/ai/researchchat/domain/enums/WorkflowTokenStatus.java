package com.flamingo.ai.researchchat.domain.enums;

/** Status of a workflow token issued for a generation run. */
public enum WorkflowTokenStatus {
  ACTIVE,
  COMPLETED,
  INVALIDATED
}
