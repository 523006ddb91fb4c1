package com.xksgroup.mediadedup.model.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SelectPrimaryRequest {
    @NotBlank(message = "itemId is required")
    private String itemId;
}
