package com.xksgroup.mediadedup.model.dto;

import lombok.Builder;
import lombok.Data;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@Data
@Builder
public class ScanSubscriber {
    private SseEmitter sseEmitter;
    private String jobId; // blank means every scan job
}
