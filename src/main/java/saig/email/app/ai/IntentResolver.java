package saig.email.app.ai;

import saig.email.app.command.Intent;

/**
 * Turns a user's free-text request into a structured {@link Intent}.
 * Implementations call a language model; they never touch the mailbox.
 */
public interface IntentResolver {

    /**
     * The model could not be reached or returned something that is not an intent.
     */
    class ResolutionException extends RuntimeException {
        public ResolutionException(String message) {
            super(message);
        }

        public ResolutionException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Provider quota or rate limit exceeded.
     */
    class QuotaException extends ResolutionException {
        public QuotaException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * @param text What the user typed
     * @return the resolved intent; its name may still be one the interpreter does not support
     * @throws ResolutionException if no intent could be produced
     */
    Intent resolve(String text);
}
