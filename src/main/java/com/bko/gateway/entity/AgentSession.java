package com.bko.gateway.entity;

import com.bko.gateway.agent.AgentKind;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.OffsetDateTime;

@Entity
@Table(name = "agent_session")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AgentSession {

    @Id
    @Column(name = "id", length = 128)
    private String id;

    @Column(name = "name", length = 255)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "agent", length = 20, nullable = false)
    private AgentKind agent;

    @Column(name = "cwd", nullable = false, columnDefinition = "TEXT")
    private String cwd;

    @Column(name = "model", length = 100)
    private String model;

    @Column(name = "internal_session_id", length = 128)
    private String internalSessionId;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    @Column(name = "last_used_at")
    private OffsetDateTime lastUsedAt;
}
