package com.shoplens.backend.model.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorReportStatusUpdateDTO {

    @NotBlank(message = "status must not be blank")
    private String status; // PENDING, REVIEWED, RESOLVED
}
