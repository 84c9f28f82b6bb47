package com.zielonka.parity;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSetMultimap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;
import javax.annotation.Nullable;

/**
 * An immutable parity game given by explicit successor sets. Instances are created through {@link
 * #builder()}, which rejects structurally invalid games.
 *
 * @param <S> the state type, which needs proper {@code equals} and {@code hashCode}
 */
public final class ExplicitParityGame<S> implements ParityGame<S> {
  private final ImmutableMap<S, StateData> data;
  private final ImmutableSetMultimap<S, S> successors;
  private final ImmutableMap<S, String> names;

  private record StateData(Player owner, int priority) {}

  private ExplicitParityGame(ImmutableMap<S, StateData> data, ImmutableSetMultimap<S, S> successors,
      ImmutableMap<S, String> names) {
    assert data.keySet().containsAll(successors.keySet());
    assert data.keySet().containsAll(successors.values());
    this.data = data;
    this.successors = successors;
    this.names = names;
  }

  public static <S> Builder<S> builder() {
    return new Builder<>();
  }

  @Override
  public Set<S> states() {
    return data.keySet();
  }

  @Override
  public Stream<S> successors(S state) {
    checkState(state);
    return successors.get(state).stream();
  }

  public Set<S> successorSet(S state) {
    checkState(state);
    return successors.get(state);
  }

  @Override
  public int priority(S state) {
    return stateData(state).priority();
  }

  @Override
  public Player owner(S state) {
    return stateData(state).owner();
  }

  /** The label the state was declared with, if any. */
  public Optional<String> name(S state) {
    checkState(state);
    return Optional.ofNullable(names.get(state));
  }

  public int edgeCount() {
    return successors.size();
  }

  private StateData stateData(S state) {
    StateData stateData = data.get(state);
    if (stateData == null) {
      throw new IllegalArgumentException("Unknown state " + state);
    }
    return stateData;
  }

  private void checkState(S state) {
    if (!data.containsKey(state)) {
      throw new IllegalArgumentException("Unknown state " + state);
    }
  }

  @Override
  public String toString() {
    return "ParityGame[%d states, %d edges]".formatted(data.size(), successors.size());
  }

  public static final class Builder<S> {
    private final Map<S, StateData> data = new LinkedHashMap<>();
    private final ImmutableSetMultimap.Builder<S, S> successors = ImmutableSetMultimap.builder();
    private final Map<S, String> names = new LinkedHashMap<>();

    private Builder() {}

    public Builder<S> addState(S state, Player owner, int priority) {
      return addState(state, owner, priority, null);
    }

    public Builder<S> addState(S state, Player owner, int priority, @Nullable String name) {
      requireNonNull(state);
      requireNonNull(owner);
      if (priority < 0) {
        throw new InvalidGameException("State %s has negative priority %d".formatted(state, priority));
      }
      if (data.putIfAbsent(state, new StateData(owner, priority)) != null) {
        throw new InvalidGameException("State %s declared twice".formatted(state));
      }
      if (name != null) {
        names.put(state, name);
      }
      return this;
    }

    public Builder<S> addEdge(S from, S to) {
      successors.put(requireNonNull(from), requireNonNull(to));
      return this;
    }

    public Builder<S> addEdges(S from, Iterable<? extends S> to) {
      for (S successor : to) {
        addEdge(from, successor);
      }
      return this;
    }

    /**
     * Creates the game.
     *
     * @throws InvalidGameException if an edge touches an undeclared state or some state has no
     *     successor
     */
    public ExplicitParityGame<S> build() {
      ImmutableSetMultimap<S, S> edges = successors.build();
      for (Map.Entry<S, S> edge : edges.entries()) {
        if (!data.containsKey(edge.getKey())) {
          throw new InvalidGameException("Edge %s -> %s starts in an undeclared state"
              .formatted(edge.getKey(), edge.getValue()));
        }
        if (!data.containsKey(edge.getValue())) {
          throw new InvalidGameException("Edge %s -> %s leads to an undeclared state"
              .formatted(edge.getKey(), edge.getValue()));
        }
      }
      for (S state : data.keySet()) {
        if (!edges.containsKey(state)) {
          throw new InvalidGameException("State %s has no successor".formatted(state));
        }
      }
      return new ExplicitParityGame<>(ImmutableMap.copyOf(data), edges, ImmutableMap.copyOf(names));
    }
  }
}
