package com.voxnote.api.persistence.repository;

import com.voxnote.api.persistence.entity.ChatMessageEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ChatMessageRepository extends JpaRepository<ChatMessageEntity, Long> {

    List<ChatMessageEntity> findByTranscriptionIdOrderByCreatedAtDescIdDesc(Long transcriptionId, Pageable pageable);

    List<ChatMessageEntity> findByTranscriptionIdOrderByCreatedAtAscIdAsc(Long transcriptionId);

    Optional<ChatMessageEntity> findFirstByTranscriptionIdOrderByCreatedAtDescIdDesc(Long transcriptionId);
}
