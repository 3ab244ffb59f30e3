package com.legal.consult.repository;

import com.legal.consult.entity.AiApiKey;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AiApiKeyRepository extends JpaRepository<AiApiKey, Long> {

    Optional<AiApiKey> findFirstByProviderAndActiveTrueOrderByCreatedAtDescIdDesc(String provider);

    boolean existsByProviderAndActiveTrue(String provider);

    List<AiApiKey> findAllByOrderByCreatedAtDesc();
}
