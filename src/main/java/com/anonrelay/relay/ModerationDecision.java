package com.anonrelay.relay;

import com.anonrelay.shared.model.MessageStatus;
import com.anonrelay.shared.model.ModAction;

public enum ModerationDecision {
    APPROVE(MessageStatus.APPROVED, ModAction.APPROVE),
    REJECT(MessageStatus.REJECTED, ModAction.REJECT);

    private final MessageStatus target;
    private final ModAction action;

    ModerationDecision(MessageStatus target, ModAction action) {
        this.target = target;
        this.action = action;
    }

    public MessageStatus target() {
        return target;
    }

    public ModAction action() {
        return action;
    }
}
