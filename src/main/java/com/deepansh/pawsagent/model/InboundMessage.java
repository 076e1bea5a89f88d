package com.deepansh.pawsagent.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Unit of work handed over by the transport collaborator.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InboundMessage {

    /** Sender address, e.g. "whatsapp:+5491122334455" */
    @NotBlank
    private String identity;

    private String text;

    /**
     * Optional provider message id (Twilio MessageSid). When present it drives
     * duplicate-delivery detection and scopes tool idempotency keys.
     */
    private String inboundMessageId;
}
