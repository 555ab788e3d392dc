package com.jz.honeypot.controller;

import com.jz.honeypot.common.InvalidEventException;
import com.jz.honeypot.domain.dto.HoneypotReplyDTO;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 最外层兜底：调用方只拿到 status/reply，不暴露堆栈
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String INVALID_REPLY = "Invalid request.";
    static final String GENERIC_REPLY = "Something went wrong. Please try again.";

    @ExceptionHandler({InvalidEventException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<HoneypotReplyDTO> invalid(Exception e) {
        log.info("Rejected malformed event: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(HoneypotReplyDTO.error(INVALID_REPLY));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<HoneypotReplyDTO> unhandled(Exception e) {
        log.error("Unhandled failure while processing event", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(HoneypotReplyDTO.error(GENERIC_REPLY));
    }
}
