package com.jz.honeypot.chat.reply;

import com.jz.honeypot.chat.prompt.DecoyPrompts;
import com.jz.honeypot.config.GenerationProperties;
import com.jz.honeypot.domain.dto.ChatMessageDTO;
import com.jz.honeypot.domain.entity.Evidence;
import com.jz.honeypot.pipeline.PipelineState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReplyStrategistTest {

    @Mock
    private ReplyGenerator generator;

    private SimpleMeterRegistry registry;
    private ReplyStrategist strategist;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        strategist = new ReplyStrategist(generator, new GenerationProperties(), registry);
    }

    @Test
    void nonScamGetsClarificationWithoutGeneration() {
        assertThat(strategist.buildReply(state("Hi, are we meeting at 6pm?", false)))
                .isEqualTo(DecoyReplies.CLARIFICATION);
        verifyNoInteractions(generator);
    }

    @Test
    void scamReplyIsFirstLineOfGeneration() throws Exception {
        when(generator.generate(anyList(), anyInt())).thenReturn("  Which bank is this from?  \nSecond line");

        assertThat(strategist.buildReply(state("verify your kyc", true))).isEqualTo("Which bank is this from?");
    }

    @Test
    void requestCarriesPersonaHintAndTokenBudget() throws Exception {
        when(generator.generate(anyList(), anyInt())).thenReturn("ok");
        PipelineState s = state("Tell me the OTP", true);

        strategist.buildReply(s);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<ChatTurn>> turns = ArgumentCaptor.forClass(List.class);
        verify(generator).generate(turns.capture(), eq(1000));
        assertThat(turns.getValue()).hasSize(2);
        assertThat(turns.getValue().get(0)).isEqualTo(ChatTurn.system(DecoyPrompts.PERSONA));
        assertThat(turns.getValue().get(1).role()).isEqualTo(ChatTurn.Role.USER);
        assertThat(turns.getValue().get(1).content())
                .startsWith("Latest scammer message: Tell me the OTP")
                .contains("Say OTP not received");
    }

    @Test
    void longReplyIsTruncated() throws Exception {
        when(generator.generate(anyList(), anyInt())).thenReturn("a".repeat(800));

        assertThat(strategist.buildReply(state("otp now", true))).hasSize(500);
    }

    @Test
    void timeoutFallsBack() throws Exception {
        when(generator.generate(anyList(), anyInt()))
                .thenThrow(new GenerationException(GenerationException.Reason.TIMEOUT, "slow"));

        assertThat(strategist.buildReply(state("otp now", true))).isEqualTo(DecoyReplies.FALLBACK);
        assertThat(registry.counter("honeypot.reply.fallback.count").count()).isEqualTo(1.0);
    }

    @Test
    void unexpectedRuntimeFailureFallsBack() throws Exception {
        when(generator.generate(anyList(), anyInt())).thenThrow(new IllegalStateException("boom"));

        assertThat(strategist.buildReply(state("otp now", true))).isEqualTo(DecoyReplies.FALLBACK);
    }

    @Test
    void blankGenerationFallsBack() throws Exception {
        when(generator.generate(anyList(), anyInt())).thenReturn("   ");

        assertThat(strategist.buildReply(state("otp now", true))).isEqualTo(DecoyReplies.FALLBACK);
    }

    @Test
    void truncationKeepsSurrogatePairsWhole() {
        String raw = "a".repeat(499) + "\uD83D\uDE00 more";

        String reply = ReplyStrategist.firstLine(raw, 500);

        assertThat(reply.codePointCount(0, reply.length())).isEqualTo(500);
        assertThat(reply).endsWith("\uD83D\uDE00");
        assertThat(Character.isHighSurrogate(reply.charAt(reply.length() - 1))).isFalse();
    }

    @Test
    void emojiCountsAsOneCharacterTowardsTheLimit() {
        assertThat(ReplyStrategist.firstLine("\uD83D\uDE00\uD83D\uDE00\uD83D\uDE00", 2))
                .isEqualTo("\uD83D\uDE00\uD83D\uDE00");
        assertThat(ReplyStrategist.firstLine("short", 500)).isEqualTo("short");
    }

    private static PipelineState state(String text, boolean scam) {
        PipelineState s = PipelineState.seed("s1", new ChatMessageDTO("scammer", text, 0L), List.of(), new Evidence());
        s.setScamDetected(scam);
        return s;
    }
}
