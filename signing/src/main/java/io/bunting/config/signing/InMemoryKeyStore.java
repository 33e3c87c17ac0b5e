package io.bunting.config.signing;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;

public class InMemoryKeyStore implements KeyStore {

  private final ConcurrentMap<String, List<SigningKey>> keysByApp = new ConcurrentHashMap<>();

  @Override
  public List<SigningKey> keys(String appId) {
    return keysByApp.getOrDefault(appId, List.of());
  }

  @Override
  public List<SigningKey> update(String appId, UnaryOperator<List<SigningKey>> mutation) {
    return keysByApp.compute(
        appId,
        (id, current) ->
            ImmutableList.copyOf(mutation.apply(current == null ? List.of() : current)));
  }
}
