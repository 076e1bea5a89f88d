package com.deepansh.pawsagent.session;

import com.deepansh.pawsagent.model.SessionMessage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Persisted conversation state for one identity:
 * {@code {"status":"active","messages":[...],"updatedAt":<epoch-ms>}}
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Session {

    public static final String STATUS_ACTIVE = "active";

    @Builder.Default
    private String status = STATUS_ACTIVE;

    @Builder.Default
    private List<SessionMessage> messages = new ArrayList<>();

    private long updatedAt;

    public static Session fresh() {
        return Session.builder().updatedAt(System.currentTimeMillis()).build();
    }
}
