package com.deepansh.pawsagent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Strongly-typed configuration for the agent loop, session store and tool runner.
 * Bound from application.yml under the "agent" prefix.
 */
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentProperties {

    /** Safety breaker: model rounds allowed per inbound message */
    private int maxRounds = 3;

    private String systemPrompt = "";

    /** Matched case-insensitively as substrings of the user text */
    private List<String> terminationKeywords = new ArrayList<>(
            List.of("FIN", "SALIR", "ADIOS", "CHAU", "TERMINAR"));

    private Replies replies = new Replies();
    private Session session = new Session();
    private Tools tools = new Tools();

    @Data
    public static class Replies {
        private String alreadyProcessed = "Mensaje ya procesado.";
        private String farewell = "👋 Sesión terminada. ¡Hasta luego!";
        private String emptyReply = "Lo siento, no pude generar una respuesta.";
        private String clarification =
                "He procesado tu solicitud, pero necesito más claridad. ¿Puedes reformular tu pregunta?";
        private String error = "Lo siento, ocurrió un error técnico. Por favor intenta de nuevo.";
    }

    @Data
    public static class Session {
        private String keyPrefix = "wh:session:";
        private String seenKeyPrefix = "wh:seen:";
        private Duration ttl = Duration.ofHours(6);
        private Duration seenTtl = Duration.ofHours(1);
        private int maxTurns = 12;
    }

    @Data
    public static class Tools {
        private Duration timeout = Duration.ofSeconds(10);
        private int retries = 2;
        private Duration retryDelay = Duration.ofSeconds(1);
        private Idempotency idempotency = new Idempotency();

        @Data
        public static class Idempotency {
            /** "memory" (per process) or "redis" (shared across replicas) */
            private String store = "memory";
            private int capacity = 100;
            /** Only used by the redis store */
            private Duration ttl = Duration.ofHours(1);
        }
    }
}
