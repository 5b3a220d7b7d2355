package io.intellixity.mapflow.query;

/** Kind of a map-reduce query phase. */
public enum PhaseKind {
  /** Follows links from the input objects; no function reference. */
  LINK,

  /** Runs a function against each input, with locality to the input key. */
  MAP,

  /** Runs a commutative/associative function over the merged outputs of the previous phase. */
  REDUCE
}
