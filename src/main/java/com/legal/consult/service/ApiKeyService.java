package com.legal.consult.service;

import com.legal.consult.conversation.AiProvider;
import com.legal.consult.dto.ApiKeyDto;
import com.legal.consult.dto.CreateApiKeyRequest;
import com.legal.consult.entity.AiApiKey;
import com.legal.consult.exception.CredentialException;
import com.legal.consult.exception.InvalidRequestException;
import com.legal.consult.exception.NotFoundException;
import com.legal.consult.repository.AiApiKeyRepository;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Provider API keys. The newest active key for a provider is the one in use.
 */
@Service
@RequiredArgsConstructor
public class ApiKeyService {

    private static final Logger log = LoggerFactory.getLogger(ApiKeyService.class);

    private final AiApiKeyRepository repository;

    @Transactional(readOnly = true)
    public String getActiveKey(AiProvider provider) {
        return repository.findFirstByProviderAndActiveTrueOrderByCreatedAtDescIdDesc(provider.key())
                .map(AiApiKey::getApiKey)
                .filter(StringUtils::isNotBlank)
                .orElseThrow(() -> new CredentialException(provider));
    }

    @Transactional(readOnly = true)
    public boolean hasActiveKey(AiProvider provider) {
        return repository.existsByProviderAndActiveTrue(provider.key());
    }

    @Transactional(readOnly = true)
    public List<ApiKeyDto> list() {
        return repository.findAllByOrderByCreatedAtDesc().stream()
                .map(ApiKeyService::toDto)
                .collect(Collectors.toList());
    }

    @Transactional
    public ApiKeyDto add(CreateApiKeyRequest request) {
        AiProvider provider = AiProvider.fromKey(request.getProvider())
                .orElseThrow(() -> new InvalidRequestException("Unknown provider: " + request.getProvider()));
        AiApiKey saved = repository.save(AiApiKey.builder()
                .provider(provider.key())
                .apiKey(request.getValue().trim())
                .label(request.getLabel())
                .active(true)
                .build());
        log.info("Stored new {} API key id={}", provider.key(), saved.getId());
        return toDto(saved);
    }

    @Transactional
    public ApiKeyDto deactivate(Long id) {
        AiApiKey key = repository.findById(id)
                .orElseThrow(() -> new NotFoundException("API key not found: " + id));
        key.setActive(false);
        log.info("Deactivated {} API key id={}", key.getProvider(), id);
        return toDto(repository.save(key));
    }

    @Transactional
    public void delete(Long id) {
        if (!repository.existsById(id)) {
            throw new NotFoundException("API key not found: " + id);
        }
        repository.deleteById(id);
        log.info("Deleted API key id={}", id);
    }

    static String mask(String value) {
        if (value == null || value.length() <= 4) return "****";
        return "****" + value.substring(value.length() - 4);
    }

    private static ApiKeyDto toDto(AiApiKey key) {
        return ApiKeyDto.builder()
                .id(key.getId())
                .provider(key.getProvider())
                .label(key.getLabel())
                .maskedKey(mask(key.getApiKey()))
                .active(key.isActive())
                .createdAt(key.getCreatedAt())
                .build();
    }
}
