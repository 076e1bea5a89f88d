package com.deepansh.pawsagent;

import com.deepansh.pawsagent.config.AgentProperties;
import com.deepansh.pawsagent.config.ToolProperties;
import com.deepansh.pawsagent.llm.ModelProviderProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
@EnableConfigurationProperties({AgentProperties.class, ToolProperties.class, ModelProviderProperties.class})
public class PawsAgentApplication {
    public static void main(String[] args) {
        SpringApplication.run(PawsAgentApplication.class, args);
    }
}
