package com.legal.consult.controller;

import com.legal.consult.conversation.ConversationPhase;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/workflows")
public class WorkflowController {

    /** The closed phase set, in nominal flow order. */
    @GetMapping("/phases")
    public Map<String, Object> phases() {
        List<Map<String, String>> phases = Arrays.stream(ConversationPhase.values())
                .map(p -> {
                    Map<String, String> entry = new LinkedHashMap<>();
                    entry.put("name", p.name());
                    entry.put("displayName", p.displayName());
                    return entry;
                })
                .collect(Collectors.toList());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("phases", phases);
        return body;
    }
}
