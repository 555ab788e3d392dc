package com.jz.honeypot.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** 仅作记录，流水线不读取 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EventMetadata {
    private String channel = "SMS";
    private String language = "English";
    private String locale = "IN";
}
