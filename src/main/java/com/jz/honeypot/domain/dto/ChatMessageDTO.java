package com.jz.honeypot.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessageDTO {
    private String sender;   // "scammer" / "user"
    private String text;
    private long timestamp;  // 毫秒时间戳
}
