package com.flamingo.ai.researchchat.domain.repository;

import com.flamingo.ai.researchchat.domain.entity.WorkflowToken;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for WorkflowToken entities. */
@Repository
public interface WorkflowTokenRepository extends JpaRepository<WorkflowToken, UUID> {

  Optional<WorkflowToken> findByWorkflowId(String workflowId);
}
