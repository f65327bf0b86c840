package com.agenthost.client.session;

import com.agenthost.protocol.payload.TemplateCompletePayload;
import com.agenthost.protocol.payload.TemplateConfigPayload;
import com.agenthost.protocol.payload.TemplateProgressPayload;
import lombok.Data;

/**
 * Progress of a templated run, as last reported by the server.
 */
@Data
public class TemplateState {

    private TemplateConfigPayload config;
    private TemplateProgressPayload progress;
    private TemplateCompletePayload completion;

    public boolean isActive() {
        return config != null || progress != null;
    }

    public boolean isCompleted() {
        return completion != null;
    }

    /**
     * The template currently forbids free-text input.
     */
    public boolean chatInputLocked() {
        if (completion != null) {
            return Boolean.FALSE.equals(completion.getContinueAfterCompletion());
        }
        return progress != null && Boolean.FALSE.equals(progress.getEnableChatInput());
    }
}
