package com.github.spud.agentmesh.domain.state;

import java.util.EnumSet;
import org.springframework.context.annotation.Configuration;
import org.springframework.statemachine.config.EnableStateMachineFactory;
import org.springframework.statemachine.config.EnumStateMachineConfigurerAdapter;
import org.springframework.statemachine.config.builders.StateMachineConfigurationConfigurer;
import org.springframework.statemachine.config.builders.StateMachineStateConfigurer;
import org.springframework.statemachine.config.builders.StateMachineTransitionConfigurer;

/**
 * Run state machine
 * <pre>
 *   CREATED --(START)--> IN_PROGRESS
 *   CREATED --(FAIL)--> FAILED
 *   IN_PROGRESS --(COMPLETE)--> COMPLETED
 *   IN_PROGRESS --(FAIL)--> FAILED
 * </pre>
 */
@Configuration
@EnableStateMachineFactory
public class RunStateConfig extends EnumStateMachineConfigurerAdapter<RunState, RunTransition> {

  @Override
  public void configure(StateMachineConfigurationConfigurer<RunState, RunTransition> config)
    throws Exception {
    config
      .withConfiguration()
      .autoStartup(false);
  }

  @Override
  public void configure(StateMachineStateConfigurer<RunState, RunTransition> states)
    throws Exception {
    states
      .withStates()
      .initial(RunState.CREATED)
      .states(EnumSet.allOf(RunState.class))
      .end(RunState.COMPLETED)
      .end(RunState.FAILED);
  }

  @Override
  public void configure(StateMachineTransitionConfigurer<RunState, RunTransition> transitions)
    throws Exception {
    configureTransitions(transitions);
  }

  /**
   * The transition table, also applied to machines built outside the application context.
   */
  public static void configureTransitions(
    StateMachineTransitionConfigurer<RunState, RunTransition> transitions) throws Exception {
    transitions
      .withExternal()
      .source(RunState.CREATED).target(RunState.IN_PROGRESS)
      .event(RunTransition.START)
      .and()

      // failure before the backend produced anything (deadline, refused dispatch)
      .withExternal()
      .source(RunState.CREATED).target(RunState.FAILED)
      .event(RunTransition.FAIL)
      .and()

      .withExternal()
      .source(RunState.IN_PROGRESS).target(RunState.COMPLETED)
      .event(RunTransition.COMPLETE)
      .and()

      .withExternal()
      .source(RunState.IN_PROGRESS).target(RunState.FAILED)
      .event(RunTransition.FAIL);
  }
}
