package com.openforge.recall.repository;

import com.openforge.recall.domain.KnowledgeGap;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface KnowledgeGapRepository extends JpaRepository<KnowledgeGap, Long> {

    List<KnowledgeGap> findByProfileIdOrderByIdDesc(String profileId);
}
