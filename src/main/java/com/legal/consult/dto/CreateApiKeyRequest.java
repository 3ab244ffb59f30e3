package com.legal.consult.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateApiKeyRequest {

    @NotBlank
    private String provider;

    @NotBlank
    @Size(max = 500)
    private String value;

    @Size(max = 100)
    private String label;
}
