package saig.email.app.service;

import saig.email.app.config.EngineProperties;
import saig.email.app.entity.Email;
import saig.email.app.entity.MailAccount;
import saig.email.app.exception.IncompleteIntentException;
import saig.email.app.exception.TransientProviderException;
import saig.email.app.notify.NotificationFanout;
import saig.email.app.provider.FlagChange;
import saig.email.app.provider.OutgoingMessage;
import saig.email.app.provider.RemoteMailboxAdapter;
import saig.email.app.provider.TokenProvider;
import saig.email.app.repository.EmailRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EmailActionServiceTest {

    @Mock
    private EmailRepository emailRepository;

    @Mock
    private LocalStoreService localStoreService;

    @Mock
    private RemoteMailboxAdapter remoteMailboxAdapter;

    @Mock
    private TokenProvider tokenProvider;

    @Mock
    private NotificationFanout notificationFanout;

    private EmailActionService emailActionService;
    private MailAccount account;
    private Email email;

    @BeforeEach
    void setUp() {
        emailActionService = new EmailActionService(emailRepository, localStoreService, remoteMailboxAdapter,
                tokenProvider, new EntityLockService(new EngineProperties()), new DirectTransactions(), notificationFanout);

        account = new MailAccount();
        account.setId("acc-1");
        account.setEmailAddress("me@example.com");

        email = new Email();
        email.setId("email-1");
        email.setAccountId("acc-1");
        email.setRemoteId("m1");
        email.setThreadId("thread-1");
        email.setMessageIdHeader("<abc@mail.example.com>");
        email.setSender("alice@example.com");
        email.setSubject("Quarterly numbers");

        lenient().when(localStoreService.requireOwned("acc-1", "email-1")).thenReturn(email);
        lenient().when(tokenProvider.getValidToken(account)).thenReturn("token");
        lenient().when(emailRepository.save(any(Email.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void setRead_ShouldUpdateRemoteThenLocal() {
        // When
        Email result = emailActionService.setRead(account, "email-1", true);

        // Then
        assertTrue(result.isRead());
        verify(remoteMailboxAdapter).applyFlags(account, "token", "m1", FlagChange.read(true));
        verify(notificationFanout).publish(eq("acc-1"), any());
    }

    @Test
    void setRead_AlreadyRead_ShouldNotCallRemote() {
        // Given
        email.setRead(true);

        // When
        emailActionService.setRead(account, "email-1", true);

        // Then
        verifyNoInteractions(remoteMailboxAdapter);
        verifyNoInteractions(notificationFanout);
    }

    @Test
    void setStarred_WhenRemoteFails_ShouldLeaveLocalUnchanged() {
        // Given
        doThrow(new TransientProviderException("timeout"))
                .when(remoteMailboxAdapter).applyFlags(account, "token", "m1", FlagChange.starred(true));

        // When & Then
        assertThrows(TransientProviderException.class, () -> emailActionService.setStarred(account, "email-1", true));
        assertFalse(email.isStarred());
        verify(emailRepository, never()).save(any(Email.class));
    }

    @Test
    void compose_ShouldSendAndStoreSentCopy() {
        // Given
        Email sent = new Email();
        when(remoteMailboxAdapter.send(eq(account), eq("token"), any(OutgoingMessage.class))).thenReturn("sent-1");
        when(localStoreService.insertSentCopy(eq("acc-1"), eq("sent-1"), any(OutgoingMessage.class))).thenReturn(sent);

        // When
        Email result = emailActionService.compose(account, List.of("bob@example.com"), null, "Lunch", "Noon works.");

        // Then
        assertSame(sent, result);
        ArgumentCaptor<OutgoingMessage> message = ArgumentCaptor.forClass(OutgoingMessage.class);
        verify(remoteMailboxAdapter).send(eq(account), eq("token"), message.capture());
        assertEquals("me@example.com", message.getValue().getFrom());
        assertEquals(List.of(), message.getValue().getCc());
    }

    @Test
    void compose_WithoutRecipient_ShouldSendNothing() {
        // When
        IncompleteIntentException e = assertThrows(IncompleteIntentException.class,
                () -> emailActionService.compose(account, List.of(), null, "Lunch", "Noon works."));

        // Then
        assertEquals(List.of("to"), e.getMissingParameters());
        verifyNoInteractions(remoteMailboxAdapter);
    }

    @Test
    void reply_ShouldThreadAndPrefixSubject() {
        // Given
        when(remoteMailboxAdapter.send(eq(account), eq("token"), any(OutgoingMessage.class))).thenReturn("sent-2");
        when(localStoreService.insertSentCopy(eq("acc-1"), eq("sent-2"), any(OutgoingMessage.class))).thenReturn(new Email());

        // When
        emailActionService.reply(account, "email-1", "Thanks, looks good.");

        // Then
        ArgumentCaptor<OutgoingMessage> message = ArgumentCaptor.forClass(OutgoingMessage.class);
        verify(remoteMailboxAdapter).send(eq(account), eq("token"), message.capture());
        assertEquals("Re: Quarterly numbers", message.getValue().getSubject());
        assertEquals(List.of("alice@example.com"), message.getValue().getTo());
        assertEquals("thread-1", message.getValue().getThreadId());
        assertEquals("<abc@mail.example.com>", message.getValue().getInReplyTo());
    }

    @Test
    void reply_SubjectAlreadyPrefixed_ShouldNotDoublePrefix() {
        // Given
        email.setSubject("RE: Quarterly numbers");
        when(remoteMailboxAdapter.send(eq(account), eq("token"), any(OutgoingMessage.class))).thenReturn("sent-3");
        when(localStoreService.insertSentCopy(eq("acc-1"), eq("sent-3"), any(OutgoingMessage.class))).thenReturn(new Email());

        // When
        emailActionService.reply(account, "email-1", "Agreed.");

        // Then
        ArgumentCaptor<OutgoingMessage> message = ArgumentCaptor.forClass(OutgoingMessage.class);
        verify(remoteMailboxAdapter).send(eq(account), eq("token"), message.capture());
        assertEquals("RE: Quarterly numbers", message.getValue().getSubject());
    }
}
