package com.legal.consult.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SendMessageRequest {

    @NotBlank
    private String message;

    /** Optional phase override, e.g. CASE_ANALYSIS. */
    private String phase;

    /** Optional provider override (openai, deepseek). */
    private String provider;

    private Map<String, Object> metadata;
}
