package com.legal.consult.controller;

import com.legal.consult.dto.ApiKeyDto;
import com.legal.consult.dto.CreateApiKeyRequest;
import com.legal.consult.service.ApiKeyService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Admin endpoints for provider API keys. Key values are write-only.
 */
@RestController
@RequestMapping("/api/api-keys")
@RequiredArgsConstructor
public class ApiKeyController {

    private final ApiKeyService apiKeyService;

    @GetMapping
    public Map<String, Object> list() {
        return Map.of("success", true, "keys", apiKeyService.list());
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> add(@Valid @RequestBody CreateApiKeyRequest request) {
        ApiKeyDto key = apiKeyService.add(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("success", true, "key", key));
    }

    @PatchMapping("/{id}/deactivate")
    public Map<String, Object> deactivate(@PathVariable Long id) {
        return Map.of("success", true, "key", apiKeyService.deactivate(id));
    }

    @DeleteMapping("/{id}")
    public Map<String, Object> delete(@PathVariable Long id) {
        apiKeyService.delete(id);
        return Map.of("success", true);
    }
}
