package com.safepocket.consensus;

import com.safepocket.consensus.cli.CommandLineOptions;
import com.safepocket.consensus.config.ConsensusProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
@EnableConfigurationProperties(ConsensusProperties.class)
public class ConsensusServiceApplication {

    public static void main(String[] args) {
        if (CommandLineOptions.requested(args)) {
            ConfigurableApplicationContext context = new SpringApplicationBuilder(ConsensusServiceApplication.class)
                    .web(WebApplicationType.NONE)
                    .run(args);
            System.exit(SpringApplication.exit(context));
        }
        SpringApplication.run(ConsensusServiceApplication.class, args);
    }
}
