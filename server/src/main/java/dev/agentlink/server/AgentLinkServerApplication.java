package dev.agentlink.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the server. The front end is chosen by {@code agentlink.server.transport};
 * the {@code websocket} profile starts the embedded servlet container.
 */
@SpringBootApplication
public class AgentLinkServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentLinkServerApplication.class, args);
    }
}
