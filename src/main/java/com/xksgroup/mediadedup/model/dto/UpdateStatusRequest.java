package com.xksgroup.mediadedup.model.dto;

import com.xksgroup.mediadedup.model.ReviewStatus;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateStatusRequest {
    @NotNull(message = "status is required")
    private ReviewStatus status;
}
