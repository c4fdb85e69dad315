package jump.email.sorter.service;

/**
 * Interface for the remote chat-completion providers.
 * Implementations never throw: every failure comes back as a {@link ChatOutcome} error.
 */
public interface ChatCompletionClient {
    /**
     * @return false when no credentials are configured and every call would fail
     */
    boolean isConfigured();

    /**
     * Send a system and a user message and return the assistant's reply.
     * @param systemPrompt instructions that frame the task
     * @param userPrompt the messages to classify
     * @return the reply text, or the failure kind with a short description
     */
    ChatOutcome complete(String systemPrompt, String userPrompt);
}
