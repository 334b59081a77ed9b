package com.bko.gateway.repository;

import com.bko.gateway.entity.SessionMessage;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * Repository interface for managing {@link SessionMessage} entities.
 */
public interface SessionMessageRepository extends JpaRepository<SessionMessage, UUID> {

    /**
     * @param sessionId the owning session id.
     * @return whether the session has stored at least one message.
     */
    boolean existsBySessionId(String sessionId);

    List<SessionMessage> findBySessionIdOrderByCreatedAtAsc(String sessionId);
}
