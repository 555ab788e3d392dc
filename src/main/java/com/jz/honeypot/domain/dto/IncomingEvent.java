package com.jz.honeypot.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class IncomingEvent {
    private String sessionId;
    private ChatMessageDTO message;
    private List<ChatMessageDTO> conversationHistory = new ArrayList<>();
    private EventMetadata metadata = new EventMetadata();
}
