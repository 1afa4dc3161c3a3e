package com.amblue.agent.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentRequest {

    @NotBlank(message = "question must not be blank")
    private String question;

    /**
     * Optional: history is keyed by this id. Falls back to "default" when absent,
     * so callers that never send one share a single conversation.
     */
    private String conversationId;

    /**
     * Optional: only used to group run traces. Defaults to "default".
     */
    private String userId;
}
