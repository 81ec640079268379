package com.openforge.clusterlens;

import com.openforge.clusterlens.config.InvestigationProperties;
import com.openforge.clusterlens.llm.LlmProperties;
import com.openforge.clusterlens.stream.AgentStreamProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        LlmProperties.class,
        InvestigationProperties.class,
        AgentStreamProperties.class
})
public class ClusterLensApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClusterLensApplication.class, args);
    }
}
