package com.example.exam_scheduler.solver;

public enum SolveStatus {
  SATISFIED,
  INFEASIBLE,
  // budget ran out with neither a solution nor a proof
  UNKNOWN
}
