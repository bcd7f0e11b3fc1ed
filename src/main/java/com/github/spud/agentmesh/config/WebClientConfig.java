package com.github.spud.agentmesh.config;

import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

/**
 * One pooled HTTP client shared by discovery, probing and remote agent calls.
 */
@Configuration
public class WebClientConfig {

  @Bean(destroyMethod = "dispose")
  public ConnectionProvider agentMeshConnectionProvider(AgentMeshProperties properties) {
    AgentMeshProperties.Http http = properties.getHttp();
    return ConnectionProvider.builder("agent-mesh")
      .maxConnections(http.getMaxConnections())
      .maxIdleTime(http.getMaxIdleTime())
      .build();
  }

  @Bean
  public WebClient agentMeshWebClient(WebClient.Builder builder,
    ConnectionProvider agentMeshConnectionProvider, AgentMeshProperties properties) {
    HttpClient httpClient = HttpClient.create(agentMeshConnectionProvider)
      .option(ChannelOption.CONNECT_TIMEOUT_MILLIS,
        (int) properties.getHttp().getConnectTimeout().toMillis());
    return builder
      .clientConnector(new ReactorClientHttpConnector(httpClient))
      .build();
  }
}
