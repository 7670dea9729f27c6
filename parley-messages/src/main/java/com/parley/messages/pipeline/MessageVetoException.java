package com.parley.messages.pipeline;

import com.parley.messages.model.Message;

/**
 * Thrown (as the failure of the pipeline future) when a check rejects a
 * message. Carries the message as transformed up to the point of rejection.
 */
public class MessageVetoException extends RuntimeException {

    private final Veto veto;
    private final transient Message rejectedMessage;

    public MessageVetoException(Veto veto, Message rejectedMessage) {
        super(veto.errorCode() + ": " + veto.reason());
        this.veto = veto;
        this.rejectedMessage = rejectedMessage;
    }

    public Veto getVeto() {
        return veto;
    }

    public VetoKind getKind() {
        return veto.kind();
    }

    public String getErrorCode() {
        return veto.errorCode();
    }

    public Message getRejectedMessage() {
        return rejectedMessage;
    }
}
