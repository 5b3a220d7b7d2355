package io.intellixity.mapflow.store;

/**
 * Number of replicas that must answer a read.\n
 *
 * {@link #ONE} is the weakest consistency level: the first responding replica wins.\n
 * {@link #QUORUM} and {@link #ALL} are symbolic; backends map them to their own strongest/majority
 * settings.\n
 */
public record ReadQuorum(int replicas) {
  public static final int QUORUM_MARKER = -1;
  public static final int ALL_MARKER = -2;

  public static final ReadQuorum ONE = new ReadQuorum(1);
  public static final ReadQuorum QUORUM = new ReadQuorum(QUORUM_MARKER);
  public static final ReadQuorum ALL = new ReadQuorum(ALL_MARKER);

  public ReadQuorum {
    if (replicas == 0 || replicas < ALL_MARKER) {
      throw new IllegalArgumentException("Invalid read quorum: " + replicas);
    }
  }

  public static ReadQuorum of(int replicas) {
    if (replicas == 1) return ONE;
    return new ReadQuorum(replicas);
  }

  public boolean isOne() {
    return replicas == 1;
  }

  @Override
  public String toString() {
    return switch (replicas) {
      case QUORUM_MARKER -> "quorum";
      case ALL_MARKER -> "all";
      default -> String.valueOf(replicas);
    };
  }
}
