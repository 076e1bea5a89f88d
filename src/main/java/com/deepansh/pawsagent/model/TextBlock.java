package com.deepansh.pawsagent.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class TextBlock extends ContentBlock {

    private String text;

    @Override
    public boolean blank() {
        return text == null || text.isBlank();
    }
}
