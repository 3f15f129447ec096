package email.agent.app.service;

/**
 * A batch draft request that was rejected before any job was created.
 */
public class BatchDraftException extends RuntimeException {
    public BatchDraftException(String message) {
        super(message);
    }
}
