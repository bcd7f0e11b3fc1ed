package com.github.spud.agentmesh.domain.orchestration;

import java.util.List;
import lombok.Value;

/**
 * One orchestrator reply and the calls dispatched from it, in request order.
 */
@Value
public class DelegationRound {

  int depth;

  String reply;

  List<DelegatedCall> calls;
}
