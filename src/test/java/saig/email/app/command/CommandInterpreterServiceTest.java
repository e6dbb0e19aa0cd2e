package saig.email.app.command;

import saig.email.app.entity.ActionItem;
import saig.email.app.entity.ActionPriority;
import saig.email.app.entity.ActionSource;
import saig.email.app.entity.Email;
import saig.email.app.entity.Huddle;
import saig.email.app.entity.MailAccount;
import saig.email.app.exception.IncompleteIntentException;
import saig.email.app.exception.PermissionDeniedException;
import saig.email.app.exception.UnsupportedIntentException;
import saig.email.app.repository.EmailFilter;
import saig.email.app.service.ActionItemService;
import saig.email.app.service.EmailActionService;
import saig.email.app.service.HuddleService;
import saig.email.app.service.LocalStoreService;
import saig.email.app.service.TrashLifecycleService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CommandInterpreterServiceTest {

    @Mock
    private LocalStoreService localStoreService;

    @Mock
    private EmailActionService emailActionService;

    @Mock
    private TrashLifecycleService trashLifecycleService;

    @Mock
    private ActionItemService actionItemService;

    @Mock
    private HuddleService huddleService;

    @InjectMocks
    private CommandInterpreterService commandInterpreterService;

    private MailAccount account;

    @BeforeEach
    void setUp() {
        account = new MailAccount();
        account.setId("acc-1");
        account.setEmailAddress("me@example.com");
    }

    private static Email email(String id) {
        Email email = new Email();
        email.setId(id);
        email.setAccountId("acc-1");
        return email;
    }

    @Test
    void markRead_FiveTargetsOneDenied_ShouldApplyToTheOtherFour() {
        // Given
        when(emailActionService.setRead(eq(account), anyString(), eq(true))).thenAnswer(inv -> email(inv.getArgument(1)));
        when(emailActionService.setRead(account, "e3", true)).thenThrow(new PermissionDeniedException("not yours"));

        // When
        CommandResult result = commandInterpreterService.executeIntent(account,
                Intent.of("mark_read", Map.of("emailIds", List.of("e1", "e2", "e3", "e4", "e5"))));

        // Then
        assertFalse(result.isSuccess());
        assertEquals(4, result.successCount());
        assertEquals(1, result.failureCount());
        assertEquals("Marked 4 of 5 emails as read", result.getMessage());
        TargetOutcome failed = result.getOutcomes().get(2);
        assertEquals("e3", failed.getTargetId());
        assertFalse(failed.isSuccess());
        verify(emailActionService, times(5)).setRead(eq(account), anyString(), eq(true));
    }

    @Test
    void moveToTrash_ByFilter_ShouldResolveTargetsFromCurrentMatches() {
        // Given
        when(localStoreService.search(eq("acc-1"), any(EmailFilter.class))).thenReturn(List.of(email("e1"), email("e2")));

        // When
        CommandResult result = commandInterpreterService.executeIntent(account,
                Intent.of("moveToTrash", Map.of("filter", Map.of("sender", "newsletter@shop.example"))));

        // Then
        assertTrue(result.isSuccess());
        assertEquals("Moved 2 of 2 emails to trash", result.getMessage());
        ArgumentCaptor<EmailFilter> filter = ArgumentCaptor.forClass(EmailFilter.class);
        verify(localStoreService).search(eq("acc-1"), filter.capture());
        assertEquals("newsletter@shop.example", filter.getValue().getSender());
        assertFalse(filter.getValue().isInTrash());
        verify(trashLifecycleService).moveToTrash("acc-1", "e1");
        verify(trashLifecycleService).moveToTrash("acc-1", "e2");
    }

    @Test
    void restore_ByFilter_ShouldSearchTheTrash() {
        // Given
        when(localStoreService.search(eq("acc-1"), any(EmailFilter.class))).thenReturn(List.of());

        // When
        CommandResult result = commandInterpreterService.executeIntent(account,
                Intent.of(IntentType.RESTORE, Map.of("query", "invoice")));

        // Then
        assertTrue(result.isSuccess());
        assertEquals("No emails matched", result.getMessage());
        ArgumentCaptor<EmailFilter> filter = ArgumentCaptor.forClass(EmailFilter.class);
        verify(localStoreService).search(eq("acc-1"), filter.capture());
        assertTrue(filter.getValue().isInTrash());
        verifyNoInteractions(trashLifecycleService);
    }

    @Test
    void markRead_WithoutTargetsOrFilter_ShouldRefuseToTouchEverything() {
        // When
        IncompleteIntentException e = assertThrows(IncompleteIntentException.class,
                () -> commandInterpreterService.executeIntent(account, Intent.of("mark_read", Map.of())));

        // Then
        assertEquals(List.of("emailId"), e.getMissingParameters());
        verifyNoInteractions(localStoreService, emailActionService);
    }

    @Test
    void compose_MissingRecipient_ShouldSendNothing() {
        // When
        IncompleteIntentException e = assertThrows(IncompleteIntentException.class,
                () -> commandInterpreterService.executeIntent(account,
                        Intent.of("compose", Map.of("subject", "Lunch", "body", "Noon?"))));

        // Then
        assertEquals(List.of("to"), e.getMissingParameters());
        verifyNoInteractions(emailActionService);
    }

    @Test
    void compose_InvalidAddress_ShouldSendNothing() {
        // When & Then
        assertThrows(IncompleteIntentException.class,
                () -> commandInterpreterService.executeIntent(account,
                        Intent.of("compose", Map.of("to", "bob", "subject", "Lunch", "body", "Noon?"))));
        verifyNoInteractions(emailActionService);
    }

    @Test
    void compose_AddressWithLineBreak_ShouldSendNothing() {
        // When
        IncompleteIntentException e = assertThrows(IncompleteIntentException.class,
                () -> commandInterpreterService.executeIntent(account,
                        Intent.of("compose", Map.of("to", List.of("bob@example.com\r\nBcc: eve@example.com"),
                                "subject", "Lunch", "body", "Noon?"))));

        // Then
        assertEquals(List.of("to"), e.getMissingParameters());
        verifyNoInteractions(emailActionService);
    }

    @Test
    void compose_CommaSeparatedRecipients_ShouldSendToEach() {
        // Given
        Email sent = email("sent-1");
        when(emailActionService.compose(eq(account), anyList(), anyList(), eq("Lunch"), eq("Noon?"))).thenReturn(sent);

        // When
        CommandResult result = commandInterpreterService.executeIntent(account,
                Intent.of("compose", Map.of("to", "bob@example.com, carol@example.com", "subject", "Lunch", "body", "Noon?")));

        // Then
        assertTrue(result.isSuccess());
        assertEquals(List.of(sent), result.getEmails());
        verify(emailActionService).compose(account, List.of("bob@example.com", "carol@example.com"), List.of(), "Lunch", "Noon?");
    }

    @Test
    void reply_MissingBody_ShouldSendNothing() {
        // When
        IncompleteIntentException e = assertThrows(IncompleteIntentException.class,
                () -> commandInterpreterService.executeIntent(account, Intent.of("reply", Map.of("emailId", "e1"))));

        // Then
        assertEquals(List.of("body"), e.getMissingParameters());
        verifyNoInteractions(emailActionService);
    }

    @Test
    void createActionItem_ShouldRecordAssistantSource() {
        // Given
        ActionItem item = new ActionItem();
        item.setId("item-1");
        item.setTitle("Book flights");
        when(actionItemService.create("acc-1", "Book flights", null, Instant.parse("2024-06-01T00:00:00Z"),
                ActionPriority.HIGH, ActionSource.ASSISTANT, null)).thenReturn(item);

        // When
        CommandResult result = commandInterpreterService.executeIntent(account,
                Intent.of("create_action_item", Map.of("title", "Book flights", "dueDate", "2024-06-01", "priority", "high")));

        // Then
        assertEquals("Created action item: Book flights", result.getMessage());
        assertEquals(List.of(item), result.getActionItems());
    }

    @Test
    void createActionItem_UnknownPriority_ShouldBeIncomplete() {
        // When & Then
        assertThrows(IncompleteIntentException.class, () -> commandInterpreterService.executeIntent(account,
                Intent.of("create_action_item", Map.of("title", "Book flights", "priority", "whenever"))));
        verifyNoInteractions(actionItemService);
    }

    @Test
    void createHuddle_ShouldPassMembersThrough() {
        // Given
        Huddle huddle = new Huddle();
        huddle.setId("huddle-1");
        huddle.setName("Launch");
        when(huddleService.create("acc-1", "me@example.com", "Launch", null, List.of("bob@example.com")))
                .thenReturn(huddle);

        // When
        CommandResult result = commandInterpreterService.executeIntent(account,
                Intent.of("create_huddle", Map.of("name", "Launch", "members", List.of("bob@example.com"))));

        // Then
        assertSame(huddle, result.getHuddle());
    }

    @Test
    void unknownIntent_ShouldBeUnsupported() {
        // When & Then
        assertThrows(UnsupportedIntentException.class,
                () -> commandInterpreterService.executeIntent(account, Intent.of("book_flight", Map.of())));
        verifyNoInteractions(localStoreService, emailActionService, trashLifecycleService, actionItemService, huddleService);
    }

    @Test
    void search_ShouldCapLimit() {
        // Given
        when(localStoreService.search(eq("acc-1"), any(EmailFilter.class), eq(100))).thenReturn(List.of(email("e1")));

        // When
        CommandResult result = commandInterpreterService.executeIntent(account,
                Intent.of("search", Map.of("q", "report", "limit", "5000")));

        // Then
        assertEquals("Found 1 emails", result.getMessage());
    }

    @Test
    void markRead_UrgentFilter_ShouldTargetUrgentEmails() {
        // Given
        when(localStoreService.search(eq("acc-1"), any(EmailFilter.class))).thenReturn(List.of(email("e1")));

        // When
        CommandResult result = commandInterpreterService.executeIntent(account,
                Intent.of("mark_read", Map.of("filter", Map.of("urgent", "yes"))));

        // Then
        assertTrue(result.isSuccess());
        ArgumentCaptor<EmailFilter> filter = ArgumentCaptor.forClass(EmailFilter.class);
        verify(localStoreService).search(eq("acc-1"), filter.capture());
        assertEquals(Boolean.TRUE, filter.getValue().getUrgent());
        verify(emailActionService).setRead(account, "e1", true);
    }
}
