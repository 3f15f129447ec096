package email.agent.app.controller;

import lombok.Data;

import java.util.List;

@Data
public class BatchDraftRequest {
    private List<String> emailIds;
}
