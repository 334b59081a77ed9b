package com.bko.gateway.session;

import com.bko.gateway.agent.AgentKind;
import com.bko.gateway.entity.AgentSession;
import com.bko.gateway.entity.SessionMessage;
import com.bko.gateway.repository.AgentSessionRepository;
import com.bko.gateway.repository.SessionMessageRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class SessionService {

    private static final int NAME_LENGTH = 60;

    private final AgentSessionRepository sessionRepository;
    private final SessionMessageRepository messageRepository;
    private final ObjectMapper objectMapper;

    @Transactional(readOnly = true)
    public Optional<AgentSession> find(String sessionId) {
        return sessionRepository.findById(sessionId);
    }

    /**
     * Returns the session, creating it on first use. An existing session picks up the working directory and model
     * of the latest request.
     */
    @Transactional
    public AgentSession getOrCreate(String sessionId, AgentKind agent, String cwd, String model, String prompt) {
        return sessionRepository.findById(sessionId)
                .map(existing -> {
                    existing.setCwd(cwd);
                    existing.setModel(model);
                    return sessionRepository.save(existing);
                })
                .orElseGet(() -> {
                    log.info("Creating session {} ({})", sessionId, agent.id());
                    return sessionRepository.save(AgentSession.builder()
                            .id(sessionId)
                            .name(nameFrom(prompt))
                            .agent(agent)
                            .cwd(cwd)
                            .model(model)
                            .build());
                });
    }

    @Transactional(readOnly = true)
    public boolean hasMessages(String sessionId) {
        return messageRepository.existsBySessionId(sessionId);
    }

    @Transactional
    public SessionMessage recordUserMessage(String sessionId, String prompt) {
        AgentSession session = sessionRepository.getReferenceById(sessionId);
        SessionMessage message = SessionMessage.builder()
                .session(session)
                .role("user")
                .contents(toJson(Map.of("role", "user", "content", prompt)))
                .build();
        return messageRepository.save(message);
    }

    @Transactional
    public void updateInternalSessionId(String sessionId, String internalSessionId) {
        sessionRepository.findById(sessionId).ifPresent(session -> {
            if (!internalSessionId.equals(session.getInternalSessionId())) {
                log.info("Session {} now resumes agent session {}", sessionId, internalSessionId);
                session.setInternalSessionId(internalSessionId);
                sessionRepository.save(session);
            }
        });
    }

    @Transactional
    public void touch(String sessionId) {
        sessionRepository.findById(sessionId).ifPresent(session -> {
            session.setLastUsedAt(OffsetDateTime.now());
            sessionRepository.save(session);
        });
    }

    static String nameFrom(String prompt) {
        String trimmed = prompt == null ? "" : prompt.strip().replaceAll("\\s+", " ");
        return trimmed.length() <= NAME_LENGTH ? trimmed : trimmed.substring(0, NAME_LENGTH) + "...";
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize session message", ex);
        }
    }
}
