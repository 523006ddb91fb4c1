package com.xksgroup.mediadedup.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional body of a manual scan request. Without a collection id every collection is scanned.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StartScanRequest {
    private String collectionId;
}
