package com.olend.circuit;

/** A breaker phase change, collected under the breaker lock and published after it is released. */
record PhaseTransition(String operationKey, CircuitPhase from, CircuitPhase to, String reason, long at) {}
