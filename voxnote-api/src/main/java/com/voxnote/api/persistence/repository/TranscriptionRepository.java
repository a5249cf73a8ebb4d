package com.voxnote.api.persistence.repository;

import com.voxnote.api.persistence.entity.TranscriptionEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface TranscriptionRepository extends JpaRepository<TranscriptionEntity, Long> {

    List<TranscriptionEntity> findAllByOrderByIdAsc();
}
