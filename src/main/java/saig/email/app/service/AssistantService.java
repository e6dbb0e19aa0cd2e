package saig.email.app.service;

import saig.email.app.ai.IntentResolver;
import saig.email.app.command.CommandInterpreterService;
import saig.email.app.command.CommandResult;
import saig.email.app.command.Intent;
import saig.email.app.entity.MailAccount;
import saig.email.app.exception.IncompleteIntentException;
import saig.email.app.exception.MailEngineException;
import saig.email.app.exception.NotFoundException;
import saig.email.app.exception.UnsupportedIntentException;
import saig.email.app.repository.MailAccountRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Conversational front door: free text in, one command executed, a reply out.
 * Every failure becomes a reply; nothing is executed when the request is not understood.
 */
@Slf4j
@Service
public class AssistantService {
    static final String CANNOT_DO_YET = "I can't do that yet.";

    private final IntentResolver intentResolver;
    private final CommandInterpreterService commandInterpreterService;
    private final MailAccountRepository mailAccountRepository;

    public AssistantService(IntentResolver intentResolver,
                            CommandInterpreterService commandInterpreterService,
                            MailAccountRepository mailAccountRepository) {
        this.intentResolver = intentResolver;
        this.commandInterpreterService = commandInterpreterService;
        this.mailAccountRepository = mailAccountRepository;
    }

    public AssistantReply handleMessage(String accountId, String text) {
        MailAccount account = mailAccountRepository.findById(accountId)
                .orElseThrow(() -> new NotFoundException("Account not found: " + accountId));
        return handleMessage(account, text);
    }

    public AssistantReply handleMessage(MailAccount account, String text) {
        if (text == null || text.isBlank()) {
            return new AssistantReply("What would you like me to do?", null);
        }
        Intent intent;
        try {
            intent = intentResolver.resolve(text);
        } catch (IntentResolver.QuotaException e) {
            log.warn("Assistant model quota exceeded for account {}: {}", account.getEmailAddress(), e.getMessage());
            return new AssistantReply("I'm getting too many requests right now. Please try again in a minute.", null);
        } catch (IntentResolver.ResolutionException e) {
            log.warn("Could not resolve request for account {}: {}", account.getEmailAddress(), e.getMessage());
            return new AssistantReply("Sorry, I didn't understand that. Could you rephrase it?", null);
        }

        try {
            CommandResult result = commandInterpreterService.executeIntent(account, intent);
            return new AssistantReply(result.getMessage(), result);
        } catch (UnsupportedIntentException e) {
            log.info("Unsupported intent '{}' requested by account {}", e.getIntentName(), account.getEmailAddress());
            return new AssistantReply(CANNOT_DO_YET, null);
        } catch (IncompleteIntentException e) {
            log.info("Intent {} missing {}", e.getIntentName(), e.getMissingParameters());
            return new AssistantReply("I need a bit more information: please tell me the "
                    + String.join(", ", e.getMissingParameters()) + ".", null);
        } catch (MailEngineException e) {
            log.warn("Intent {} failed for account {}: {}", intent.getName(), account.getEmailAddress(), e.getMessage());
            return new AssistantReply("That didn't work: " + e.getMessage(), null);
        }
    }
}
