package com.legal.consult.repository;

import com.legal.consult.conversation.ConversationPhase;
import com.legal.consult.entity.Conversation;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface ConversationRepository extends JpaRepository<Conversation, String> {

    @Query("SELECT c FROM Conversation c "
            + "WHERE (:status IS NULL OR c.status = :status) "
            + "AND (:phase IS NULL OR c.currentPhase = :phase)")
    Page<Conversation> search(@Param("status") Conversation.Status status,
                              @Param("phase") ConversationPhase phase,
                              Pageable pageable);
}
