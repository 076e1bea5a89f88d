package com.deepansh.pawsagent.transcode;

import java.util.List;

/**
 * Output of {@link MessageTranscoder}: the request-ready messages plus one warning per
 * message that was dropped, pruned or left unmerged.
 */
public record TranscodeResult(List<WireMessage> messages, List<String> warnings) {

    /** Providers require a non-empty conversation that ends on the user side. */
    public boolean isSendable() {
        return !messages.isEmpty() && messages.get(messages.size() - 1).isUser();
    }
}
