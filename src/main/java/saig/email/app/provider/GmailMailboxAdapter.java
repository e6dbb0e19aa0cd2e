package saig.email.app.provider;

import com.google.api.client.auth.oauth2.BearerToken;
import com.google.api.client.auth.oauth2.Credential;
import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.googleapis.json.GoogleJsonError;
import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.services.gmail.Gmail;
import com.google.api.services.gmail.model.History;
import com.google.api.services.gmail.model.HistoryLabelAdded;
import com.google.api.services.gmail.model.HistoryLabelRemoved;
import com.google.api.services.gmail.model.HistoryMessageAdded;
import com.google.api.services.gmail.model.ListHistoryResponse;
import com.google.api.services.gmail.model.ListMessagesResponse;
import com.google.api.services.gmail.model.Message;
import com.google.api.services.gmail.model.MessagePart;
import com.google.api.services.gmail.model.MessagePartHeader;
import com.google.api.services.gmail.model.ModifyMessageRequest;
import saig.email.app.entity.MailAccount;
import saig.email.app.exception.AuthenticationException;
import saig.email.app.exception.MailEngineException;
import saig.email.app.exception.PermanentProviderException;
import saig.email.app.exception.TransientProviderException;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Instant;
import java.util.*;

/**
 * Gmail implementation of the remote mailbox.
 * Cursors are {@code list:<historyId>[:<pageToken>]} while the initial listing is in progress and
 * {@code history:<historyId>[:<pageToken>]} once incremental History API sync has taken over.
 */
@Slf4j
@Service
public class GmailMailboxAdapter implements RemoteMailboxAdapter {
    private static final JsonFactory JSON_FACTORY = GsonFactory.getDefaultInstance();
    private static final String APPLICATION_NAME = "SAIG Mail";
    private static final String USER_ID = "me";
    private static final Session MIME_SESSION = Session.getInstance(new Properties());

    static final String LABEL_UNREAD = "UNREAD";
    static final String LABEL_STARRED = "STARRED";
    static final String LABEL_TRASH = "TRASH";

    private final NetHttpTransport httpTransport;

    public GmailMailboxAdapter() throws GeneralSecurityException, IOException {
        this.httpTransport = GoogleNetHttpTransport.newTrustedTransport();
    }

    Gmail getGmailService(String accessToken) {
        Credential credential = new Credential.Builder(BearerToken.authorizationHeaderAccessMethod())
            .setTransport(httpTransport)
            .setJsonFactory(JSON_FACTORY)
            .build();
        credential.setAccessToken(accessToken);

        return new Gmail.Builder(httpTransport, JSON_FACTORY, credential)
            .setApplicationName(APPLICATION_NAME)
            .build();
    }

    @Override
    public FetchPage fetchSince(MailAccount account, String accessToken, String cursor, int pageSize) {
        Gmail service = getGmailService(accessToken);
        GmailCursor position = GmailCursor.parse(cursor);
        try {
            if (position.isHistory()) {
                try {
                    return fetchHistoryPage(service, position, pageSize);
                } catch (GoogleJsonResponseException e) {
                    if (e.getStatusCode() != 404) {
                        throw e;
                    }
                    // History id too old; Gmail only keeps about a week of history.
                    log.warn("History {} expired for account {}, restarting with a full listing",
                            position.getHistoryId(), account.getEmailAddress());
                    return fetchListPage(service, GmailCursor.initial(), pageSize);
                }
            }
            return fetchListPage(service, position, pageSize);
        } catch (GoogleJsonResponseException e) {
            throw classify(e, "fetch for " + account.getEmailAddress());
        } catch (IOException e) {
            throw new TransientProviderException("I/O error fetching changes for " + account.getEmailAddress() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Initial sync: page through the whole mailbox, then switch to history at the id captured before listing.
     */
    private FetchPage fetchListPage(Gmail service, GmailCursor position, int pageSize) throws IOException {
        String historyId = position.getHistoryId();
        if (historyId == null) {
            BigInteger current = service.users().getProfile(USER_ID).execute().getHistoryId();
            historyId = current != null ? current.toString() : "0";
        }

        ListMessagesResponse response = service.users().messages().list(USER_ID)
            .setMaxResults((long) pageSize)
            .setPageToken(position.getPageToken())
            .execute();

        List<RemoteMessage> records = new ArrayList<>();
        if (response.getMessages() != null) {
            for (Message ref : response.getMessages()) {
                Message full = getFullMessage(service, ref.getId());
                if (full != null) {
                    records.add(toRemoteMessage(full));
                }
            }
        }

        String nextPageToken = response.getNextPageToken();
        boolean hasMore = nextPageToken != null && !nextPageToken.isEmpty();
        String next = hasMore
            ? GmailCursor.listing(historyId, nextPageToken).format()
            : GmailCursor.history(historyId, null).format();
        return FetchPage.builder().records(records).nextCursor(next).hasMore(hasMore).build();
    }

    private FetchPage fetchHistoryPage(Gmail service, GmailCursor position, int pageSize) throws IOException {
        ListHistoryResponse response = service.users().history().list(USER_ID)
            .setStartHistoryId(new BigInteger(position.getHistoryId()))
            .setMaxResults((long) pageSize)
            .setPageToken(position.getPageToken())
            .execute();

        // A message can appear in several history entries; fetch it once, in first-seen order.
        Set<String> changedIds = new LinkedHashSet<>();
        if (response.getHistory() != null) {
            for (History history : response.getHistory()) {
                if (history.getMessagesAdded() != null) {
                    for (HistoryMessageAdded added : history.getMessagesAdded()) {
                        changedIds.add(added.getMessage().getId());
                    }
                }
                if (history.getLabelsAdded() != null) {
                    for (HistoryLabelAdded added : history.getLabelsAdded()) {
                        changedIds.add(added.getMessage().getId());
                    }
                }
                if (history.getLabelsRemoved() != null) {
                    for (HistoryLabelRemoved removed : history.getLabelsRemoved()) {
                        changedIds.add(removed.getMessage().getId());
                    }
                }
            }
        }

        List<RemoteMessage> records = new ArrayList<>();
        for (String id : changedIds) {
            Message full = getFullMessage(service, id);
            if (full != null) {
                records.add(toRemoteMessage(full));
            }
        }

        String nextPageToken = response.getNextPageToken();
        boolean hasMore = nextPageToken != null && !nextPageToken.isEmpty();
        String next;
        if (hasMore) {
            next = GmailCursor.history(position.getHistoryId(), nextPageToken).format();
        } else {
            BigInteger latest = response.getHistoryId();
            next = GmailCursor.history(latest != null ? latest.toString() : position.getHistoryId(), null).format();
        }
        return FetchPage.builder().records(records).nextCursor(next).hasMore(hasMore).build();
    }

    /**
     * Returns null when the message was deleted between the listing and the fetch.
     */
    private Message getFullMessage(Gmail service, String messageId) throws IOException {
        try {
            return service.users().messages().get(USER_ID, messageId)
                .setFormat("full")
                .execute();
        } catch (GoogleJsonResponseException e) {
            if (e.getStatusCode() == 404) {
                log.debug("Message {} disappeared before it could be fetched", messageId);
                return null;
            }
            throw e;
        }
    }

    RemoteMessage toRemoteMessage(Message message) {
        String subject = "";
        String from = "";
        String to = "";
        String messageIdHeader = null;

        MessagePart payload = message.getPayload();
        if (payload != null && payload.getHeaders() != null) {
            for (MessagePartHeader header : payload.getHeaders()) {
                String name = header.getName().toLowerCase(Locale.ROOT);
                String value = header.getValue();
                switch (name) {
                    case "subject":
                        subject = value;
                        break;
                    case "from":
                        from = value;
                        break;
                    case "to":
                        to = value;
                        break;
                    case "message-id":
                        messageIdHeader = value;
                        break;
                    default:
                        break;
                }
            }
        }

        String body = "";
        if (payload != null) {
            BodyExtractionResult bodyResult = extractBodyFromParts(payload);
            body = bodyResult.plainTextContent != null && !bodyResult.plainTextContent.isEmpty()
                ? bodyResult.plainTextContent
                : (bodyResult.htmlContent != null ? bodyResult.htmlContent : "");
        }

        Set<String> labels = message.getLabelIds() != null
            ? new HashSet<>(message.getLabelIds())
            : Collections.emptySet();

        return RemoteMessage.builder()
            .remoteId(message.getId())
            .threadId(message.getThreadId())
            .messageIdHeader(messageIdHeader)
            .sender(from)
            .recipients(to)
            .subject(subject)
            .body(body)
            .receivedAt(message.getInternalDate() != null ? Instant.ofEpochMilli(message.getInternalDate()) : null)
            .read(!labels.contains(LABEL_UNREAD))
            .starred(labels.contains(LABEL_STARRED))
            .trashed(labels.contains(LABEL_TRASH))
            .labels(labels)
            .syncVersion(message.getHistoryId() != null ? message.getHistoryId().longValue() : 0L)
            .build();
    }

    private static class BodyExtractionResult {
        String htmlContent = null;
        String plainTextContent = null;
    }

    private BodyExtractionResult extractBodyFromParts(MessagePart part) {
        BodyExtractionResult result = new BodyExtractionResult();

        if (part.getBody() != null && part.getBody().getData() != null) {
            String mimeType = part.getMimeType();
            if ("text/plain".equals(mimeType) || "text/html".equals(mimeType)) {
                String decoded = decodeBody(part.getBody().getData(), mimeType);
                if (decoded != null) {
                    if ("text/html".equals(mimeType)) {
                        result.htmlContent = decoded;
                    } else {
                        result.plainTextContent = decoded;
                    }
                }
            }
        }

        if (part.getParts() != null) {
            for (MessagePart subPart : part.getParts()) {
                BodyExtractionResult subResult = extractBodyFromParts(subPart);
                if (subResult.htmlContent != null && !subResult.htmlContent.isEmpty()) {
                    result.htmlContent = (result.htmlContent != null ? result.htmlContent + "\n" : "") + subResult.htmlContent;
                }
                if (subResult.plainTextContent != null && !subResult.plainTextContent.isEmpty()) {
                    result.plainTextContent = (result.plainTextContent != null ? result.plainTextContent + "\n" : "") + subResult.plainTextContent;
                }
            }
        }
        return result;
    }

    private String decodeBody(String data, String mimeType) {
        try {
            return new String(Base64.getUrlDecoder().decode(data), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            // Some parts arrive unpadded or with the standard alphabet.
            try {
                String padded = data;
                int remainder = padded.length() % 4;
                if (remainder > 0) {
                    padded += "=".repeat(4 - remainder);
                }
                return new String(Base64.getDecoder().decode(padded), StandardCharsets.UTF_8);
            } catch (IllegalArgumentException e2) {
                log.warn("Could not decode body part (mimeType: {}): {}", mimeType, e2.getMessage());
                return null;
            }
        }
    }

    @Override
    public void applyFlags(MailAccount account, String accessToken, String remoteId, FlagChange flags) {
        List<String> add = new ArrayList<>();
        List<String> remove = new ArrayList<>();
        if (flags.getRead() != null) {
            (flags.getRead() ? remove : add).add(LABEL_UNREAD);
        }
        if (flags.getStarred() != null) {
            (flags.getStarred() ? add : remove).add(LABEL_STARRED);
        }
        if (add.isEmpty() && remove.isEmpty()) {
            return;
        }

        ModifyMessageRequest mods = new ModifyMessageRequest()
            .setAddLabelIds(add)
            .setRemoveLabelIds(remove);
        try {
            getGmailService(accessToken).users().messages().modify(USER_ID, remoteId, mods).execute();
        } catch (GoogleJsonResponseException e) {
            throw classify(e, "modify " + remoteId);
        } catch (IOException e) {
            throw new TransientProviderException("I/O error modifying message " + remoteId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void trash(MailAccount account, String accessToken, String remoteId) {
        try {
            getGmailService(accessToken).users().messages().trash(USER_ID, remoteId).execute();
        } catch (GoogleJsonResponseException e) {
            throw classify(e, "trash " + remoteId);
        } catch (IOException e) {
            throw new TransientProviderException("I/O error trashing message " + remoteId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void untrash(MailAccount account, String accessToken, String remoteId) {
        try {
            getGmailService(accessToken).users().messages().untrash(USER_ID, remoteId).execute();
        } catch (GoogleJsonResponseException e) {
            throw classify(e, "untrash " + remoteId);
        } catch (IOException e) {
            throw new TransientProviderException("I/O error restoring message " + remoteId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String send(MailAccount account, String accessToken, OutgoingMessage outgoing) {
        Message message = new Message().setRaw(Base64.getUrlEncoder().encodeToString(toMimeMessage(outgoing)));
        if (outgoing.getThreadId() != null) {
            message.setThreadId(outgoing.getThreadId());
        }
        try {
            Message sent = getGmailService(accessToken).users().messages().send(USER_ID, message).execute();
            return sent.getId();
        } catch (GoogleJsonResponseException e) {
            throw classify(e, "send from " + account.getEmailAddress());
        } catch (IOException e) {
            throw new TransientProviderException("I/O error sending message for " + account.getEmailAddress() + ": " + e.getMessage(), e);
        }
    }

    byte[] toMimeMessage(OutgoingMessage outgoing) {
        try {
            MimeMessage mime = new MimeMessage(MIME_SESSION);
            if (outgoing.getFrom() != null) {
                mime.setFrom(new InternetAddress(outgoing.getFrom(), true));
            }
            mime.setRecipients(jakarta.mail.Message.RecipientType.TO, parseAddresses(outgoing.getTo()));
            if (outgoing.getCc() != null && !outgoing.getCc().isEmpty()) {
                mime.setRecipients(jakarta.mail.Message.RecipientType.CC, parseAddresses(outgoing.getCc()));
            }
            mime.setSubject(outgoing.getSubject() != null ? outgoing.getSubject() : "", "UTF-8");
            if (outgoing.getInReplyTo() != null) {
                String messageId = outgoing.getInReplyTo().replaceAll("[\\r\\n]", "");
                mime.setHeader("In-Reply-To", messageId);
                mime.setHeader("References", messageId);
            }
            mime.setSentDate(new Date());
            mime.setText(outgoing.getBody() != null ? outgoing.getBody() : "", "UTF-8");

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            mime.writeTo(out);
            return out.toByteArray();
        } catch (AddressException e) {
            throw new PermanentProviderException("Invalid recipient address: " + e.getMessage(), e);
        } catch (MessagingException | IOException e) {
            throw new PermanentProviderException("Could not build outgoing message: " + e.getMessage(), e);
        }
    }

    private static InternetAddress[] parseAddresses(List<String> addresses) throws AddressException {
        InternetAddress[] parsed = new InternetAddress[addresses.size()];
        for (int i = 0; i < parsed.length; i++) {
            parsed[i] = new InternetAddress(addresses.get(i), true);
        }
        return parsed;
    }

    private static MailEngineException classify(GoogleJsonResponseException e, String operation) {
        String reason = null;
        GoogleJsonError details = e.getDetails();
        if (details != null && details.getErrors() != null && !details.getErrors().isEmpty()) {
            reason = details.getErrors().get(0).getReason();
        }
        return classify(e.getStatusCode(), reason, operation, e);
    }

    /**
     * Map a Gmail API status (and error reason, when present) onto the engine's error taxonomy.
     */
    static MailEngineException classify(int statusCode, String reason, String operation, Throwable cause) {
        String message = "Gmail " + operation + " failed with " + statusCode + (reason != null ? " (" + reason + ")" : "");
        if (statusCode == 401) {
            return new AuthenticationException(message, cause);
        }
        if (statusCode == 429 || statusCode >= 500) {
            return new TransientProviderException(message, cause);
        }
        if (statusCode == 403 && reason != null
                && (reason.equals("rateLimitExceeded") || reason.equals("userRateLimitExceeded"))) {
            return new TransientProviderException(message, cause);
        }
        return new PermanentProviderException(message, cause);
    }
}
