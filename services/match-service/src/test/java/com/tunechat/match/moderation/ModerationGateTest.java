package com.tunechat.match.moderation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.tunechat.match.match.MatchOrchestrator;
import com.tunechat.match.match.MatchResult;
import com.tunechat.match.match.RecentHistory;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

@ExtendWith(MockitoExtension.class)
class ModerationGateTest {

    private static final RecentHistory HISTORY = RecentHistory.of("s1");

    @Mock
    private ModerationClient moderationClient;

    @Mock
    private MatchOrchestrator orchestrator;

    private ModerationProperties properties;
    private MatchResult result;

    @BeforeEach
    void setUp() {
        properties = new ModerationProperties();
        result = new MatchResult(null, List.of(), 0.9, "phrase", null);
    }

    @Test
    void allowedTextIsMatchedAsIs() {
        when(moderationClient.moderate(eq("hey jude"), any())).thenReturn(ModerationResult.clean());
        when(orchestrator.matchSongs(eq("hey jude"), eq(true), eq("u1"), eq(HISTORY), any())).thenReturn(result);

        ChatMatchOutcome outcome = gate().process("hey jude", true, "u1", HISTORY);

        assertThat(outcome.isBlocked()).isFalse();
        assertThat(outcome.match()).isSameAs(result);
        ArgumentCaptor<ModerationAnnotation> annotation = ArgumentCaptor.forClass(ModerationAnnotation.class);
        verify(orchestrator).matchSongs(eq("hey jude"), eq(true), eq("u1"), eq(HISTORY), annotation.capture());
        assertThat(annotation.getValue()).isEqualTo(ModerationAnnotation.clean("hey jude"));
    }

    @Test
    void filteredTextIsMatchedThroughReplacement() {
        ModerationResult verdict = new ModerationResult(false, ModerationCategory.NSFW, 0.8, "nsfw_term", "love song");
        when(moderationClient.moderate(eq("raw text"), any())).thenReturn(verdict);
        when(orchestrator.matchSongs(eq("love song"), anyBoolean(), eq("u1"), eq(HISTORY), any())).thenReturn(result);

        ChatMatchOutcome outcome = gate().process("raw text", false, "u1", HISTORY);

        assertThat(outcome.match()).isSameAs(result);
        ArgumentCaptor<ModerationAnnotation> annotation = ArgumentCaptor.forClass(ModerationAnnotation.class);
        verify(orchestrator).matchSongs(eq("love song"), eq(false), eq("u1"), eq(HISTORY), annotation.capture());
        assertThat(annotation.getValue().category()).isEqualTo(ModerationCategory.NSFW);
        assertThat(annotation.getValue().wasFiltered()).isTrue();
        assertThat(annotation.getValue().originalText()).isEqualTo("raw text");
    }

    @Test
    void hardBlockNeverReachesOrchestrator() {
        ModerationResult verdict = new ModerationResult(false, ModerationCategory.SLUR, 0.99, "slur_detected", null);
        when(moderationClient.moderate(eq("bad"), any())).thenReturn(verdict);

        ChatMatchOutcome outcome = gate().process("bad", false, "u1", HISTORY);

        assertThat(outcome.isBlocked()).isTrue();
        assertThat(outcome.match()).isNull();
        assertThat(outcome.policy().category()).isEqualTo(ModerationCategory.SLUR);
        assertThat(outcome.policy().reason()).isEqualTo("slur_detected");
        assertThat(outcome.policy().message()).isEqualTo("Message contains inappropriate language and cannot be processed.");
        verifyNoInteractions(orchestrator);
    }

    @Test
    void blankReplacementCountsAsHardBlock() {
        ModerationResult verdict = new ModerationResult(false, ModerationCategory.SPAM, 0.7, "spam", " ");
        when(moderationClient.moderate(eq("buy buy buy"), any())).thenReturn(verdict);

        ChatMatchOutcome outcome = gate().process("buy buy buy", false, null, HISTORY);

        assertThat(outcome.policy().message()).isEqualTo("Message appears to be spam. Please try a simpler query.");
        verifyNoInteractions(orchestrator);
    }

    @Test
    void unavailableModerationFailsOpenByDefault() {
        when(moderationClient.moderate(eq("hey jude"), any()))
            .thenThrow(new ModerationUnavailableException("moderation_timeout"));
        when(orchestrator.matchSongs(eq("hey jude"), eq(false), eq("u1"), eq(HISTORY), any())).thenReturn(result);

        ChatMatchOutcome outcome = gate().process("hey jude", false, "u1", HISTORY);

        assertThat(outcome.match()).isSameAs(result);
    }

    @Test
    void unreadableModerationReplyFailsOpen() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        server.expect(requestTo("http://localhost:8020/v1/moderate"))
            .andRespond(withSuccess("<html>bad gateway</html>", MediaType.APPLICATION_JSON));
        when(orchestrator.matchSongs(eq("hey jude"), eq(false), eq("u1"), eq(HISTORY), any())).thenReturn(result);
        ModerationGate gate = new ModerationGate(
            new HttpModerationClient(restTemplate, "http://localhost:8020"),
            orchestrator,
            properties
        );

        ChatMatchOutcome outcome = gate.process("hey jude", false, "u1", HISTORY);

        assertThat(outcome.isBlocked()).isFalse();
        assertThat(outcome.match()).isSameAs(result);
        server.verify();
    }

    @Test
    void unavailableModerationFailsClosedWhenConfigured() {
        properties.setFailOpen(false);
        when(moderationClient.moderate(eq("hey jude"), any()))
            .thenThrow(new ModerationUnavailableException("moderation_timeout"));

        ChatMatchOutcome outcome = gate().process("hey jude", false, "u1", HISTORY);

        assertThat(outcome.isBlocked()).isTrue();
        assertThat(outcome.policy().category()).isNull();
        assertThat(outcome.policy().reason()).isEqualTo("moderation_timeout");
        assertThat(outcome.policy().message()).isEqualTo(PolicyDecision.DEFAULT_MESSAGE);
        verifyNoInteractions(orchestrator);
    }

    @Test
    void roomSettingsArePassedToTheClient() {
        properties.setStrictMode(true);
        properties.setAllowNsfw(true);
        when(moderationClient.moderate(eq("hey"), any())).thenReturn(ModerationResult.clean());
        when(orchestrator.matchSongs(eq("hey"), eq(false), eq("u1"), eq(HISTORY), any())).thenReturn(result);

        gate().process("hey", false, "u1", HISTORY);

        verify(moderationClient).moderate("hey", new ModerationConfig(true, true));
    }

    private ModerationGate gate() {
        return new ModerationGate(moderationClient, orchestrator, properties);
    }
}
