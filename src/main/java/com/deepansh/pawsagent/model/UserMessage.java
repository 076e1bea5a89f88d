package com.deepansh.pawsagent.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class UserMessage extends SessionMessage {

    private String text;

    @Override
    public boolean startsTurn() {
        return true;
    }
}
