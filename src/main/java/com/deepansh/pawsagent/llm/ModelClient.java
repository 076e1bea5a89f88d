package com.deepansh.pawsagent.llm;

public interface ModelClient {

    /**
     * One completion round: system prompt, offered tools and the transcoded conversation in,
     * text and/or tool-use blocks out.
     *
     * @throws com.deepansh.pawsagent.exception.TransientExternalException worth retrying later
     * @throws com.deepansh.pawsagent.exception.ModelClientException       request or credentials are wrong
     */
    ModelResponse complete(ModelRequest request);
}
