package com.voxnote.api.persistence.entity;

import com.voxnote.api.model.ChatMessage;
import com.voxnote.api.model.ChatMessageRole;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

import java.time.OffsetDateTime;

@Entity
@Table(name = "chat_messages",
        indexes = @Index(name = "idx_chat_messages_transcription_created", columnList = "transcription_id, created_at"))
public class ChatMessageEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "transcription_id", nullable = false, updatable = false)
    private Long transcriptionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, updatable = false, length = 16)
    private ChatMessageRole role;

    @Column(name = "content", nullable = false, updatable = false, columnDefinition = "text")
    private String content;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    protected ChatMessageEntity() {
    }

    public ChatMessageEntity(Long transcriptionId,
                             ChatMessageRole role,
                             String content,
                             OffsetDateTime createdAt) {
        this.transcriptionId = transcriptionId;
        this.role = role;
        this.content = content;
        this.createdAt = createdAt;
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now();
        }
    }

    public ChatMessage toModel() {
        return new ChatMessage(id, transcriptionId, role, content, createdAt);
    }

    public Long getId() {
        return id;
    }

    public Long getTranscriptionId() {
        return transcriptionId;
    }

    public ChatMessageRole getRole() {
        return role;
    }

    public String getContent() {
        return content;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
