package com.coachportal.nudge.application.service;

import com.coachportal.nudge.application.port.output.ChatMessenger;
import com.coachportal.nudge.application.port.output.NudgeLedgerRepository;
import com.coachportal.nudge.application.port.output.WorkspaceCredentialRepository;
import com.coachportal.nudge.domain.model.MessageRef;
import com.coachportal.nudge.domain.model.NudgeCandidate;
import com.coachportal.nudge.domain.model.NudgeCategory;
import com.coachportal.nudge.domain.model.NudgeFrequency;
import com.coachportal.nudge.domain.model.NudgeLedgerEntry;
import com.coachportal.nudge.domain.model.RecipientPreference;
import com.coachportal.nudge.infrastructure.slack.SlackApiException;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("NudgeDispatcher")
class NudgeDispatcherTest {

    private static final Instant NOW = Instant.parse("2026-10-14T14:00:00Z");

    @Mock
    private WorkspaceCredentialRepository credentialRepo;
    @Mock
    private ChatMessenger messenger;
    @Mock
    private NudgeLedgerRepository ledgerRepo;

    private NudgeDispatcher dispatcher;
    private ArrayNode blocks;

    @BeforeEach
    void setUp() {
        dispatcher = new NudgeDispatcher(credentialRepo, messenger, ledgerRepo);
        blocks = JsonNodeFactory.instance.arrayNode();
    }

    private static NudgeCandidate candidate(String channel) {
        RecipientPreference pref = new RecipientPreference(
                "ann@example.com", true, NudgeFrequency.DAILY, "09:00", "UTC", "T1", "U-ann", channel);
        return new NudgeCandidate(NudgeCategory.DAILY_DIGEST, pref, null, "2026-10-14", null);
    }

    @Test
    @DisplayName("Records the returned message identity after a confirmed post")
    void recordsAfterPost() {
        MessageRef ref = new MessageRef("D-ann", "1760450000.000100");
        when(credentialRepo.findBotToken("T1")).thenReturn(Optional.of("xoxb-1"));
        when(messenger.postMessage("xoxb-1", "D-ann", blocks, "text")).thenReturn(ref);
        when(ledgerRepo.insert(any())).thenReturn(true);

        assertTrue(dispatcher.dispatch(candidate("D-ann"), blocks, "text", NOW));

        ArgumentCaptor<NudgeLedgerEntry> entry = ArgumentCaptor.forClass(NudgeLedgerEntry.class);
        verify(ledgerRepo).insert(entry.capture());
        assertEquals(ref, entry.getValue().message());
        assertEquals("action_items", entry.getValue().referenceKind());
        assertEquals(NOW, entry.getValue().sentAt());
    }

    @Test
    @DisplayName("Falls back to the user id when no DM channel is stored")
    void userIdFallback() {
        when(credentialRepo.findBotToken("T1")).thenReturn(Optional.of("xoxb-1"));
        when(messenger.postMessage("xoxb-1", "U-ann", blocks, "text")).thenReturn(new MessageRef("D-new", "1.2"));
        when(ledgerRepo.insert(any())).thenReturn(true);

        assertTrue(dispatcher.dispatch(candidate(null), blocks, "text", NOW));
    }

    @Test
    @DisplayName("A failed post writes nothing to the ledger")
    void failedPostNotRecorded() {
        when(credentialRepo.findBotToken("T1")).thenReturn(Optional.of("xoxb-1"));
        when(messenger.postMessage("xoxb-1", "D-ann", blocks, "text"))
                .thenThrow(new SlackApiException("chat.postMessage", "channel_not_found", "Slack rejected the call"));

        assertThrows(SlackApiException.class, () -> dispatcher.dispatch(candidate("D-ann"), blocks, "text", NOW));
        verifyNoInteractions(ledgerRepo);
    }

    @Test
    @DisplayName("Missing workspace credential fails before posting")
    void missingCredential() {
        when(credentialRepo.findBotToken("T1")).thenReturn(Optional.empty());

        assertThrows(IllegalStateException.class, () -> dispatcher.dispatch(candidate("D-ann"), blocks, "text", NOW));
        verifyNoInteractions(messenger, ledgerRepo);
    }

    @Test
    @DisplayName("A lost insert race is reported, not thrown")
    void conflictReported() {
        when(credentialRepo.findBotToken("T1")).thenReturn(Optional.of("xoxb-1"));
        when(messenger.postMessage("xoxb-1", "D-ann", blocks, "text")).thenReturn(new MessageRef("D-ann", "1.2"));
        when(ledgerRepo.insert(any())).thenReturn(false);

        assertFalse(dispatcher.dispatch(candidate("D-ann"), blocks, "text", NOW));
    }
}
