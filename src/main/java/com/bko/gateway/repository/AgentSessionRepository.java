package com.bko.gateway.repository;

import com.bko.gateway.entity.AgentSession;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Repository interface for managing {@link AgentSession} entities, keyed by the caller-supplied session id.
 */
public interface AgentSessionRepository extends JpaRepository<AgentSession, String> {
}
