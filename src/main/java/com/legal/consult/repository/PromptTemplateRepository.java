package com.legal.consult.repository;

import com.legal.consult.conversation.ConversationPhase;
import com.legal.consult.entity.PromptTemplateEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface PromptTemplateRepository extends JpaRepository<PromptTemplateEntity, Long> {

    Optional<PromptTemplateEntity> findFirstByPhaseAndActiveTrueOrderByVersionDesc(ConversationPhase phase);
}
