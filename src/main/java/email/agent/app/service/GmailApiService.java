package email.agent.app.service;

import com.google.api.services.gmail.model.Message;
import email.agent.app.message.InboundMessage;

import java.util.List;

/**
 * Interface for Gmail API operations.
 * This abstraction allows for easier testing and potential future implementations.
 */
public interface GmailApiService {
    /**
     * Fetch new emails using Gmail History API for efficient incremental fetching.
     * @param accessToken OAuth access token
     * @param userId Gmail user ID (email address)
     * @param lastHistoryId Last processed history ID (null for initial fetch)
     * @return List of new messages in full format
     * @throws Exception if API call fails
     */
    List<Message> fetchNewEmails(String accessToken, String userId, String lastHistoryId) throws Exception;

    /**
     * Get the current historyId for a user's mailbox.
     * @param accessToken OAuth access token
     * @param userId Gmail user ID (email address)
     * @return Current history ID as string, or null if unavailable
     * @throws Exception if API call fails
     */
    String getCurrentHistoryId(String accessToken, String userId) throws Exception;

    /**
     * Convert a full-format Gmail message into the pipeline's message snapshot.
     * @param message Gmail Message object
     * @return Headers, bodies and ids of the message
     */
    InboundMessage toInboundMessage(Message message);

    /**
     * Send a message, threaded onto an existing conversation when a thread id is given.
     * @param accessToken OAuth access token
     * @param userId Gmail user ID (email address)
     * @param message What to send
     * @return Gmail id of the sent message
     * @throws Exception if building or sending fails
     */
    String sendMessage(String accessToken, String userId, OutgoingMessage message) throws Exception;
}
