package com.shoplens.backend.model.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for analysis submission requests
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnalyzeRequestDTO {

    @NotBlank(message = "sourceRef must not be blank")
    @Size(max = 2048, message = "sourceRef must be at most 2048 characters")
    @JsonAlias("url")
    private String sourceRef;
}
