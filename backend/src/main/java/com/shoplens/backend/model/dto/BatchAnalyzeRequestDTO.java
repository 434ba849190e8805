package com.shoplens.backend.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for batch submission requests
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchAnalyzeRequestDTO {

    @NotEmpty(message = "urls must contain at least one URL")
    private List<@NotBlank(message = "urls must not contain blank entries") String> urls;

    @Size(max = 200, message = "name must be at most 200 characters")
    private String name;
}
