package com.deepansh.kitchen.observability;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface WorkflowTraceRepository extends MongoRepository<WorkflowTrace, String> {

    List<WorkflowTrace> findBySessionIdOrderByCreatedAtDesc(String sessionId);

    Optional<WorkflowTrace> findFirstByRequestId(String requestId);
}
