package com.github.spud.agentmesh.domain.state;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.github.spud.agentmesh.support.RunStateMachines;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.statemachine.StateMachine;

/**
 * Run state machine transitions
 */
class RunStateTransitionTest {

  private final RunStateMachineDriver driver = new RunStateMachineDriver(new RunStateMachines());

  private StateMachine<RunState, RunTransition> stateMachine;

  @BeforeEach
  void setUp() {
    stateMachine = driver.create("run-1").block();
  }

  @Test
  void initialStateShouldBeCreated() {
    assertEquals(RunState.CREATED, driver.getCurrentState(stateMachine));
    assertFalse(RunState.isFinal(driver.getCurrentState(stateMachine)));
  }

  @Test
  void shouldTransitionFromCreatedToInProgress() {
    assertTrue(driver.sendEvent(stateMachine, RunTransition.START).block());
    assertEquals(RunState.IN_PROGRESS, driver.getCurrentState(stateMachine));
  }

  @Test
  void shouldTransitionFromInProgressToCompleted() {
    driver.sendEvent(stateMachine, RunTransition.START).block();
    assertTrue(driver.sendEvent(stateMachine, RunTransition.COMPLETE).block());
    assertEquals(RunState.COMPLETED, driver.getCurrentState(stateMachine));
    assertTrue(RunState.isFinal(driver.getCurrentState(stateMachine)));
  }

  @Test
  void shouldTransitionFromInProgressToFailed() {
    driver.sendEvent(stateMachine, RunTransition.START).block();
    assertTrue(driver.sendEvent(stateMachine, RunTransition.FAIL).block());
    assertEquals(RunState.FAILED, driver.getCurrentState(stateMachine));
  }

  @Test
  void shouldFailBeforeStarting() {
    assertTrue(driver.sendEvent(stateMachine, RunTransition.FAIL).block());
    assertEquals(RunState.FAILED, driver.getCurrentState(stateMachine));
  }

  @Test
  void shouldRejectCompletingBeforeStarting() {
    assertFalse(driver.sendEvent(stateMachine, RunTransition.COMPLETE).block());
    assertEquals(RunState.CREATED, driver.getCurrentState(stateMachine));
  }

  @Test
  void terminalStateShouldRejectFurtherTriggers() {
    driver.sendEvent(stateMachine, RunTransition.START).block();
    driver.sendEvent(stateMachine, RunTransition.COMPLETE).block();

    assertFalse(driver.sendEvent(stateMachine, RunTransition.FAIL).block());
    assertFalse(driver.sendEvent(stateMachine, RunTransition.START).block());
    assertEquals(RunState.COMPLETED, driver.getCurrentState(stateMachine));
  }

  @Test
  void wireNamesShouldRoundTrip() {
    assertEquals("in-progress", RunState.IN_PROGRESS.wireName());
    assertEquals(RunState.IN_PROGRESS, RunState.fromWire("in-progress"));
    assertEquals(RunState.FAILED, RunState.fromWire("FAILED"));
  }
}
