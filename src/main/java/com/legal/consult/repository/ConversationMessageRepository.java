package com.legal.consult.repository;

import com.legal.consult.entity.ConversationMessage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ConversationMessageRepository extends JpaRepository<ConversationMessage, Long> {

    List<ConversationMessage> findByConversationIdOrderByCreatedAtAscIdAsc(String conversationId);

    /** Newest first; callers reverse to get chronological order. */
    List<ConversationMessage> findTop10ByConversationIdOrderByCreatedAtDescIdDesc(String conversationId);

    long countByConversationId(String conversationId);
}
