package com.legal.consult.entity;

import com.legal.consult.conversation.ConversationPhase;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Versioned system prompt for one phase. Only the active row with the highest version is used.
 */
@Entity
@Table(name = "prompt_templates", uniqueConstraints = {
    @UniqueConstraint(columnNames = {"phase", "version"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PromptTemplateEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 40)
    private ConversationPhase phase;

    @Column(name = "template_content", columnDefinition = "TEXT", nullable = false)
    private String templateContent;

    @Column(columnDefinition = "TEXT")
    private String variables;

    @Column(nullable = false)
    private int version;

    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
