package com.legal.consult.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiKeyDto {
    private Long id;
    private String provider;
    private String label;
    /** Only the last four characters are exposed. */
    private String maskedKey;
    private boolean active;
    private Instant createdAt;
}
