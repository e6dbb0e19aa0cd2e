package saig.email.app.service;

import saig.email.app.config.EngineProperties;
import saig.email.app.entity.ActionItem;
import saig.email.app.entity.Email;
import saig.email.app.entity.PurgeTombstone;
import saig.email.app.entity.SyncCursor;
import saig.email.app.exception.InvalidStateException;
import saig.email.app.exception.NotFoundException;
import saig.email.app.exception.PermissionDeniedException;
import saig.email.app.notify.ChangeType;
import saig.email.app.notify.MailboxChangeEvent;
import saig.email.app.notify.NotificationFanout;
import saig.email.app.provider.FetchPage;
import saig.email.app.provider.OutgoingMessage;
import saig.email.app.provider.RemoteMessage;
import saig.email.app.repository.EmailRepository;
import saig.email.app.repository.PurgeTombstoneRepository;
import saig.email.app.repository.SyncCursorRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LocalStoreServiceTest {
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private EmailRepository emailRepository;

    @Mock
    private PurgeTombstoneRepository purgeTombstoneRepository;

    @Mock
    private SyncCursorRepository syncCursorRepository;

    @Mock
    private ActionItemService actionItemService;

    @Mock
    private NotificationFanout notificationFanout;

    private DirectTransactions transactions;
    private LocalStoreService localStoreService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        EngineProperties properties = new EngineProperties();
        transactions = new DirectTransactions();
        ActionExtractionService actionExtractionService = new ActionExtractionService(clock, properties);
        localStoreService = new LocalStoreService(emailRepository, purgeTombstoneRepository, syncCursorRepository,
                actionExtractionService, actionItemService,
                new UrgencyDetectionService(actionExtractionService, properties, clock),
                new EntityLockService(properties), transactions, notificationFanout, clock);

        lenient().when(emailRepository.save(any(Email.class))).thenAnswer(inv -> {
            Email email = inv.getArgument(0);
            if (email.getId() == null) {
                email.setId(UUID.randomUUID().toString());
            }
            return email;
        });
        lenient().when(purgeTombstoneRepository.findByAccountIdAndRemoteIdIn(anyString(), anyCollection())).thenReturn(List.of());
        lenient().when(emailRepository.findByAccountIdAndRemoteIdIn(anyString(), anyCollection())).thenReturn(List.of());
    }

    private static RemoteMessage.RemoteMessageBuilder message(String remoteId) {
        return RemoteMessage.builder()
                .remoteId(remoteId)
                .threadId("t-" + remoteId)
                .sender("alice@example.com")
                .recipients("me@example.com")
                .subject("Subject " + remoteId)
                .body("Body of " + remoteId)
                .receivedAt(NOW.minusSeconds(600))
                .label("INBOX")
                .syncVersion(100);
    }

    private static Email stored(String remoteId) {
        Email email = new Email();
        email.setId("id-" + remoteId);
        email.setAccountId("acc-1");
        email.setRemoteId(remoteId);
        email.setThreadId("t-" + remoteId);
        email.setSender("alice@example.com");
        email.setRecipients("me@example.com");
        email.setSubject("Subject " + remoteId);
        email.setBody("Body of " + remoteId);
        email.setLabels(new HashSet<>(Set.of("INBOX")));
        email.setSyncVersion(100);
        return email;
    }

    @Test
    void applyPage_ThreeNewMessages_ShouldInsertExtractAndAdvanceCursor() {
        // Given
        ActionItem item = new ActionItem();
        item.setId("item-1");
        when(actionItemService.recordExtraction(any(Email.class), anyList())).thenAnswer(inv -> {
            List<ActionCandidate> candidates = inv.getArgument(1);
            return candidates.isEmpty() ? List.of() : List.of(item);
        });
        FetchPage page = FetchPage.builder()
                .records(List.of(
                        message("m1").subject("Contract").body("Please review the attached contract by Friday.").build(),
                        message("m2").build(),
                        message("m3").build()))
                .nextCursor("history:200")
                .build();
        SyncCursor cursor = SyncCursor.initial("acc-1");

        // When
        PageApplyResult result = localStoreService.applyPage("acc-1", page, cursor);

        // Then
        assertEquals(3, result.getCreated());
        assertEquals(3, result.getExtractionPasses());
        assertEquals(1, result.getActionItemsCreated());
        assertEquals("history:200", cursor.getPosition());
        verify(syncCursorRepository).save(argThat(saved -> "history:200".equals(saved.getPosition())));
        assertEquals(1, transactions.executions);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<MailboxChangeEvent>> events = ArgumentCaptor.forClass(List.class);
        verify(notificationFanout).publishAll(events.capture());
        assertEquals(3, events.getValue().stream().filter(e -> e.getType() == ChangeType.EMAIL_CREATED).count());
        assertEquals(1, events.getValue().stream().filter(e -> e.getType() == ChangeType.ACTION_ITEM_CREATED).count());
    }

    @Test
    void applyPage_SamePageTwice_ShouldNotDuplicateOrReExtract() {
        // Given
        Email existing = stored("m1");
        when(emailRepository.findByAccountIdAndRemoteIdIn(eq("acc-1"), anyCollection())).thenReturn(List.of(existing));
        FetchPage page = FetchPage.builder().records(List.of(message("m1").build())).nextCursor("history:200").build();

        // When
        PageApplyResult result = localStoreService.applyPage("acc-1", page, SyncCursor.initial("acc-1"));

        // Then
        assertEquals(0, result.getCreated());
        assertEquals(0, result.getUpdated());
        assertEquals(1, result.getSkipped());
        assertEquals(0, result.getExtractionPasses());
        verify(emailRepository, never()).save(any(Email.class));
        verifyNoInteractions(actionItemService);
    }

    @Test
    void applyPage_PurgedRemoteId_ShouldNotReinsert() {
        // Given
        Email purged = stored("m1");
        when(purgeTombstoneRepository.findByAccountIdAndRemoteIdIn(eq("acc-1"), anyCollection()))
                .thenReturn(List.of(new PurgeTombstone(purged, NOW)));
        FetchPage page = FetchPage.builder().records(List.of(message("m1").build())).nextCursor("history:200").build();

        // When
        PageApplyResult result = localStoreService.applyPage("acc-1", page, SyncCursor.initial("acc-1"));

        // Then
        assertEquals(1, result.getSkipped());
        verify(emailRepository, never()).save(any(Email.class));
    }

    @Test
    void applyPage_MessageAlreadyTrashedRemotely_ShouldInsertIntoTrashWithoutExtraction() {
        // Given
        FetchPage page = FetchPage.builder()
                .records(List.of(message("m1").trashed(true).body("Please send the signed invoice today.").build()))
                .nextCursor("history:200")
                .build();

        // When
        PageApplyResult result = localStoreService.applyPage("acc-1", page, SyncCursor.initial("acc-1"));

        // Then
        assertEquals(1, result.getCreated());
        assertEquals(0, result.getExtractionPasses());
        ArgumentCaptor<Email> saved = ArgumentCaptor.forClass(Email.class);
        verify(emailRepository).save(saved.capture());
        assertEquals(NOW, saved.getValue().getDeletedAt());
        assertNull(saved.getValue().getUrgencyAnalyzedAt());
    }

    @Test
    void applyPage_UrgentMessage_ShouldFlagEmail() {
        // Given
        when(actionItemService.recordExtraction(any(Email.class), anyList())).thenReturn(List.of());
        FetchPage page = FetchPage.builder()
                .records(List.of(
                        message("m1").subject("URGENT: checkout is down").body("Please review the incident report today.").build(),
                        message("m2").subject("Weekly digest").body("Here are this week's top stories.").build()))
                .nextCursor("history:200")
                .build();

        // When
        localStoreService.applyPage("acc-1", page, SyncCursor.initial("acc-1"));

        // Then
        ArgumentCaptor<Email> saved = ArgumentCaptor.forClass(Email.class);
        verify(emailRepository, times(2)).save(saved.capture());
        Email urgent = saved.getAllValues().get(0);
        assertTrue(urgent.isUrgent());
        assertTrue(urgent.getUrgencyScore() >= 40);
        assertTrue(urgent.getUrgencyReason().contains("High-priority keyword: urgent"));
        assertEquals(NOW, urgent.getUrgencyAnalyzedAt());
        Email digest = saved.getAllValues().get(1);
        assertFalse(digest.isUrgent());
        assertEquals(NOW, digest.getUrgencyAnalyzedAt());
    }

    @Test
    void applyPage_WhenStoreFails_ShouldNotAdvanceCursorOrPublish() {
        // Given
        doThrow(new IllegalStateException("disk full")).when(emailRepository).save(any(Email.class));
        FetchPage page = FetchPage.builder().records(List.of(message("m1").build())).nextCursor("history:200").build();
        SyncCursor cursor = SyncCursor.initial("acc-1");

        // When & Then
        assertThrows(IllegalStateException.class, () -> localStoreService.applyPage("acc-1", page, cursor));
        verify(syncCursorRepository, never()).save(any(SyncCursor.class));
        verifyNoInteractions(notificationFanout);
    }

    @Test
    void applyPage_WhenCommitFails_ShouldLeaveCursorAtPreviousPosition() {
        // Given
        transactions.commitFailure = new DataAccessResourceFailureException("connection lost");
        FetchPage page = FetchPage.builder().records(List.of(message("m1").build())).nextCursor("history:200").build();
        SyncCursor cursor = SyncCursor.initial("acc-1");
        cursor.setPosition("history:100");

        // When & Then
        assertThrows(DataAccessResourceFailureException.class, () -> localStoreService.applyPage("acc-1", page, cursor));
        assertEquals("history:100", cursor.getPosition());
        verifyNoInteractions(notificationFanout);
    }

    @Test
    void merge_RemoteFlagChange_ShouldOverwriteLocal() {
        // Given
        Email email = stored("m1");
        email.setRead(true);

        // When
        LocalStoreService.MergeOutcome outcome = LocalStoreService.merge(email, message("m1").read(false).starred(true).build(), NOW);

        // Then
        assertEquals(LocalStoreService.MergeOutcome.FLAGS_CHANGED, outcome);
        assertFalse(email.isRead());
        assertTrue(email.isStarred());
    }

    @Test
    void merge_ContentChange_ShouldReportContentChanged() {
        // Given
        Email email = stored("m1");

        // When
        LocalStoreService.MergeOutcome outcome = LocalStoreService.merge(email, message("m1").body("Edited draft").build(), NOW);

        // Then
        assertEquals(LocalStoreService.MergeOutcome.CONTENT_CHANGED, outcome);
        assertEquals("Edited draft", email.getBody());
    }

    @Test
    void merge_OlderRevision_ShouldBeIgnored() {
        // Given
        Email email = stored("m1");
        email.setSyncVersion(300);

        // When
        LocalStoreService.MergeOutcome outcome = LocalStoreService.merge(email, message("m1").read(true).build(), NOW);

        // Then
        assertEquals(LocalStoreService.MergeOutcome.UNCHANGED, outcome);
        assertFalse(email.isRead());
    }

    @Test
    void merge_RemoteTrash_ShouldSetDeletedAtAndClearPending() {
        // Given
        Email email = stored("m1");
        email.setDeletedAt(NOW.minusSeconds(60));
        email.setTrashSyncPending(true);

        // When
        LocalStoreService.merge(email, message("m1").trashed(true).build(), NOW);

        // Then
        assertEquals(NOW.minusSeconds(60), email.getDeletedAt());
        assertFalse(email.isTrashSyncPending());
    }

    @Test
    void merge_LocalTrashRefusedRemotely_ShouldStayInTrash() {
        // Given
        Email email = stored("m1");
        email.setDeletedAt(NOW.minusSeconds(60));
        email.setTrashSyncPending(true);
        email.setTrashSyncFailedAt(NOW.minusSeconds(50));

        // When
        LocalStoreService.MergeOutcome outcome = LocalStoreService.merge(email, message("m1").read(true).build(), NOW);

        // Then
        assertEquals(LocalStoreService.MergeOutcome.FLAGS_CHANGED, outcome);
        assertEquals(NOW.minusSeconds(60), email.getDeletedAt());
        assertNotNull(email.getTrashSyncFailedAt());
    }

    @Test
    void merge_LocalTrashPendingRemotely_ShouldKeepLocalTrash() {
        // Given
        Email email = stored("m1");
        email.setDeletedAt(NOW.minusSeconds(60));
        email.setTrashSyncPending(true);

        // When
        LocalStoreService.merge(email, message("m1").build(), NOW);

        // Then
        assertTrue(email.isTrashed());
        assertTrue(email.isTrashSyncPending());
    }

    @Test
    void merge_RemoteRestore_ShouldClearDeletedAt() {
        // Given
        Email email = stored("m1");
        email.setDeletedAt(NOW.minusSeconds(60));

        // When
        LocalStoreService.MergeOutcome outcome = LocalStoreService.merge(email, message("m1").build(), NOW);

        // Then
        assertEquals(LocalStoreService.MergeOutcome.FLAGS_CHANGED, outcome);
        assertNull(email.getDeletedAt());
    }

    @Test
    void insertSentCopy_ShouldStoreReadSentEmail() {
        // Given
        when(emailRepository.findByAccountIdAndRemoteId("acc-1", "sent-1")).thenReturn(Optional.empty());
        OutgoingMessage message = OutgoingMessage.builder()
                .from("me@example.com").to(List.of("bob@example.com")).subject("Hi").body("Hello Bob").build();

        // When
        Email email = localStoreService.insertSentCopy("acc-1", "sent-1", message);

        // Then
        assertTrue(email.isRead());
        assertTrue(email.getLabels().contains(LocalStoreService.SENT_LABEL));
        assertEquals("bob@example.com", email.getRecipients());
        verify(notificationFanout).publish(eq("acc-1"), any(MailboxChangeEvent.class));
        verifyNoInteractions(actionItemService);
    }

    @Test
    void insertSentCopy_AlreadySynced_ShouldReturnExistingRow() {
        // Given
        Email existing = stored("sent-1");
        when(emailRepository.findByAccountIdAndRemoteId("acc-1", "sent-1")).thenReturn(Optional.of(existing));
        OutgoingMessage message = OutgoingMessage.builder()
                .from("me@example.com").to(List.of("bob@example.com")).subject("Hi").body("Hello Bob").build();

        // When
        Email email = localStoreService.insertSentCopy("acc-1", "sent-1", message);

        // Then
        assertSame(existing, email);
        verify(emailRepository, never()).save(any(Email.class));
        verifyNoInteractions(notificationFanout);
    }

    @Test
    void requireOwned_ShouldDistinguishPurgedUnknownAndForeign() {
        // Given
        Email foreign = stored("m9");
        foreign.setAccountId("acc-2");
        when(emailRepository.findById("purged")).thenReturn(Optional.empty());
        when(purgeTombstoneRepository.existsById("purged")).thenReturn(true);
        when(emailRepository.findById("unknown")).thenReturn(Optional.empty());
        when(purgeTombstoneRepository.existsById("unknown")).thenReturn(false);
        when(emailRepository.findById("foreign")).thenReturn(Optional.of(foreign));

        // When & Then
        assertThrows(InvalidStateException.class, () -> localStoreService.requireOwned("acc-1", "purged"));
        assertThrows(NotFoundException.class, () -> localStoreService.requireOwned("acc-1", "unknown"));
        assertThrows(PermissionDeniedException.class, () -> localStoreService.requireOwned("acc-1", "foreign"));
    }
}
