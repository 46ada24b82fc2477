package com.coachportal.nudge.application.port.output;

import com.coachportal.nudge.domain.model.MessageRef;
import com.fasterxml.jackson.databind.node.ArrayNode;

/**
 * Outbound chat platform operations. Every call carries the bot token of the
 * workspace the channel belongs to.
 *
 * Implementations throw an unchecked exception on transport failure or when the
 * platform rejects the call.
 */
public interface ChatMessenger {

    /**
     * Post a new message.
     *
     * @param botToken Workspace bot token
     * @param channel  Channel (or DM channel) id
     * @param blocks   Block structure
     * @param text     Plain-text notification fallback
     * @return Identity of the posted message
     */
    MessageRef postMessage(String botToken, String channel, ArrayNode blocks, String text);

    /**
     * Replace the blocks of an existing message in place.
     */
    void updateMessage(String botToken, MessageRef message, ArrayNode blocks, String text);
}
