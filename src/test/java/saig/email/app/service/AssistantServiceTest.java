package saig.email.app.service;

import saig.email.app.ai.IntentResolver;
import saig.email.app.command.CommandInterpreterService;
import saig.email.app.command.CommandResult;
import saig.email.app.command.Intent;
import saig.email.app.command.IntentType;
import saig.email.app.entity.MailAccount;
import saig.email.app.exception.IncompleteIntentException;
import saig.email.app.exception.UnsupportedIntentException;
import saig.email.app.repository.MailAccountRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AssistantServiceTest {

    @Mock
    private IntentResolver intentResolver;

    @Mock
    private CommandInterpreterService commandInterpreterService;

    @Mock
    private MailAccountRepository mailAccountRepository;

    @InjectMocks
    private AssistantService assistantService;

    private MailAccount account;

    @BeforeEach
    void setUp() {
        account = new MailAccount();
        account.setId("acc-1");
        account.setEmailAddress("me@example.com");
    }

    @Test
    void handleMessage_ResolvedIntent_ShouldReplyWithCommandResult() {
        // Given
        Intent intent = Intent.of(IntentType.MARK_READ, Map.of("sender", "alice@example.com"));
        CommandResult result = CommandResult.builder()
                .intent(IntentType.MARK_READ).success(true).message("Marked 2 of 2 emails as read").build();
        when(intentResolver.resolve("mark everything from alice as read")).thenReturn(intent);
        when(commandInterpreterService.executeIntent(account, intent)).thenReturn(result);

        // When
        AssistantReply reply = assistantService.handleMessage(account, "mark everything from alice as read");

        // Then
        assertEquals("Marked 2 of 2 emails as read", reply.getMessage());
        assertTrue(reply.isExecuted());
    }

    @Test
    void handleMessage_UnsupportedIntent_ShouldSayCannotDoYet() {
        // Given
        Intent intent = Intent.of("book_flight", Map.of());
        when(intentResolver.resolve(anyString())).thenReturn(intent);
        when(commandInterpreterService.executeIntent(account, intent)).thenThrow(new UnsupportedIntentException("book_flight"));

        // When
        AssistantReply reply = assistantService.handleMessage(account, "book me a flight to Lisbon");

        // Then
        assertEquals(AssistantService.CANNOT_DO_YET, reply.getMessage());
        assertFalse(reply.isExecuted());
    }

    @Test
    void handleMessage_MissingParameters_ShouldAskForThem() {
        // Given
        Intent intent = Intent.of(IntentType.COMPOSE, Map.of("body", "hi"));
        when(intentResolver.resolve(anyString())).thenReturn(intent);
        when(commandInterpreterService.executeIntent(account, intent))
                .thenThrow(new IncompleteIntentException("compose", List.of("to", "subject")));

        // When
        AssistantReply reply = assistantService.handleMessage(account, "send an email saying hi");

        // Then
        assertEquals("I need a bit more information: please tell me the to, subject.", reply.getMessage());
        assertFalse(reply.isExecuted());
    }

    @Test
    void handleMessage_QuotaExceeded_ShouldNotExecute() {
        // Given
        when(intentResolver.resolve(anyString())).thenThrow(new IntentResolver.QuotaException("429", null));

        // When
        AssistantReply reply = assistantService.handleMessage(account, "archive old newsletters");

        // Then
        assertTrue(reply.getMessage().contains("too many requests"));
        verifyNoInteractions(commandInterpreterService);
    }

    @Test
    void handleMessage_BlankText_ShouldNotCallModel() {
        // When
        AssistantReply reply = assistantService.handleMessage(account, "   ");

        // Then
        assertFalse(reply.isExecuted());
        verifyNoInteractions(intentResolver);
    }
}
