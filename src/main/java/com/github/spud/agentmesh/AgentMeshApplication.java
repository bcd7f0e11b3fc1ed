package com.github.spud.agentmesh;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AgentMeshApplication {

  public static void main(String[] args) {
    SpringApplication.run(AgentMeshApplication.class, args);
  }

}
