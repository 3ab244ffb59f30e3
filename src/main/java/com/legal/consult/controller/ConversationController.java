package com.legal.consult.controller;

import com.legal.consult.conversation.AiProvider;
import com.legal.consult.conversation.ConversationPhase;
import com.legal.consult.dto.ConversationDto;
import com.legal.consult.dto.CreateConversationRequest;
import com.legal.consult.dto.PageResponse;
import com.legal.consult.dto.SendMessageRequest;
import com.legal.consult.dto.TurnResult;
import com.legal.consult.dto.UpdateStatusRequest;
import com.legal.consult.service.ConversationService;
import com.legal.consult.service.ConversationTurnService;
import com.legal.consult.service.ProviderRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/conversations")
@RequiredArgsConstructor
public class ConversationController {

    private final ConversationService conversationService;
    private final ConversationTurnService turnService;
    private final ProviderRegistry providerRegistry;

    @GetMapping
    public Map<String, Object> list(@RequestParam(defaultValue = "1") int page,
                                    @RequestParam(defaultValue = "20") int limit,
                                    @RequestParam(required = false) String status,
                                    @RequestParam(required = false) String phase) {
        PageResponse<ConversationDto> result = conversationService.list(page, limit, status, phase);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("conversations", result.getItems());
        body.put("pagination", result.getPagination());
        return body;
    }

    @GetMapping("/{id}")
    public Map<String, Object> get(@PathVariable String id,
                                   @RequestParam(defaultValue = "true") boolean includeMessages) {
        return Map.of("success", true, "conversation", conversationService.get(id, includeMessages));
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> create(@Valid @RequestBody CreateConversationRequest request) {
        ConversationDto created = conversationService.create(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("success", true, "conversation", created));
    }

    @PostMapping("/{id}/messages")
    public Map<String, Object> sendMessage(@PathVariable String id, @Valid @RequestBody SendMessageRequest request) {
        ConversationPhase phase = StringUtils.isBlank(request.getPhase())
                ? null
                : ConversationService.parsePhase(request.getPhase());
        AiProvider provider = providerRegistry.resolve(request.getProvider());

        TurnResult result = turnService.processTurn(id, request.getMessage(), phase, provider, request.getMetadata());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("userMessage", result.getUserTurn());
        body.put("aiMessage", result.getAssistantTurn());
        body.put("nextPhase", result.getNextPhase());
        body.put("transitioned", result.isTransitioned());
        body.put("provider", result.getProvider().key());
        return body;
    }

    @PatchMapping("/{id}/status")
    public Map<String, Object> updateStatus(@PathVariable String id, @RequestBody UpdateStatusRequest request) {
        return Map.of("success", true, "conversation", conversationService.updateStatus(id, request.getStatus()));
    }
}
