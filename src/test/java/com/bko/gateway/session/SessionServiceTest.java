package com.bko.gateway.session;

import com.bko.gateway.agent.AgentKind;
import com.bko.gateway.entity.AgentSession;
import com.bko.gateway.entity.SessionMessage;
import com.bko.gateway.repository.AgentSessionRepository;
import com.bko.gateway.repository.SessionMessageRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SessionServiceTest {

    private static final String SESSION_ID = "5b0c8f7e-2d41-4c3a-9f1e-6a7b8c9d0e1f";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private AgentSessionRepository sessionRepository;
    private SessionMessageRepository messageRepository;
    private SessionService sessionService;

    @BeforeEach
    void setUp() {
        sessionRepository = mock(AgentSessionRepository.class);
        messageRepository = mock(SessionMessageRepository.class);
        when(sessionRepository.save(any(AgentSession.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(messageRepository.save(any(SessionMessage.class))).thenAnswer(invocation -> invocation.getArgument(0));
        sessionService = new SessionService(sessionRepository, messageRepository, objectMapper);
    }

    @Test
    void testGetOrCreateCreatesNamedSession() {
        when(sessionRepository.findById(SESSION_ID)).thenReturn(Optional.empty());

        AgentSession created = sessionService.getOrCreate(SESSION_ID, AgentKind.CLI, "/srv/repo", "gpt-5",
                "  fix the\n flaky upload test  ");

        assertEquals(SESSION_ID, created.getId());
        assertEquals("fix the flaky upload test", created.getName());
        assertEquals(AgentKind.CLI, created.getAgent());
        assertNull(created.getInternalSessionId());
    }

    @Test
    void testGetOrCreateKeepsExistingAgentAndResumeId() {
        AgentSession existing = AgentSession.builder()
                .id(SESSION_ID).agent(AgentKind.SDK).cwd("/old").model("gpt-4o").internalSessionId("agent-1")
                .build();
        when(sessionRepository.findById(SESSION_ID)).thenReturn(Optional.of(existing));

        AgentSession session = sessionService.getOrCreate(SESSION_ID, AgentKind.CLI, "/new", "gpt-5", "again");

        assertEquals(AgentKind.SDK, session.getAgent());
        assertEquals("/new", session.getCwd());
        assertEquals("gpt-5", session.getModel());
        assertEquals("agent-1", session.getInternalSessionId());
    }

    @Test
    void testRecordUserMessageStoresRoleAndContent() throws Exception {
        AgentSession session = AgentSession.builder().id(SESSION_ID).build();
        when(sessionRepository.getReferenceById(SESSION_ID)).thenReturn(session);

        SessionMessage message = sessionService.recordUserMessage(SESSION_ID, "say \"hi\"");

        assertSame(session, message.getSession());
        assertEquals("user", message.getRole());
        JsonNode contents = objectMapper.readTree(message.getContents());
        assertEquals("user", contents.get("role").asText());
        assertEquals("say \"hi\"", contents.get("content").asText());
    }

    @Test
    void testUpdateInternalSessionIdOnlySavesChanges() {
        AgentSession session = AgentSession.builder().id(SESSION_ID).internalSessionId("agent-1").build();
        when(sessionRepository.findById(SESSION_ID)).thenReturn(Optional.of(session));

        sessionService.updateInternalSessionId(SESSION_ID, "agent-1");
        verify(sessionRepository, never()).save(any());

        sessionService.updateInternalSessionId(SESSION_ID, "agent-2");
        ArgumentCaptor<AgentSession> saved = ArgumentCaptor.forClass(AgentSession.class);
        verify(sessionRepository).save(saved.capture());
        assertEquals("agent-2", saved.getValue().getInternalSessionId());
    }

    @Test
    void testTouchSetsLastUsed() {
        AgentSession session = AgentSession.builder().id(SESSION_ID).build();
        when(sessionRepository.findById(SESSION_ID)).thenReturn(Optional.of(session));

        sessionService.touch(SESSION_ID);

        assertNotNull(session.getLastUsedAt());
        verify(sessionRepository).save(session);
    }

    @Test
    void testNameIsTruncated() {
        String prompt = "x".repeat(80);

        assertEquals("x".repeat(60) + "...", SessionService.nameFrom(prompt));
        assertEquals("", SessionService.nameFrom(null));
    }
}
