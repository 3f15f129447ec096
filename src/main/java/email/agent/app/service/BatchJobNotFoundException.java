package email.agent.app.service;

public class BatchJobNotFoundException extends RuntimeException {
    public BatchJobNotFoundException(String jobId) {
        super("Batch job not found: " + jobId);
    }
}
